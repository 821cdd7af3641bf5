package com.gridsql.bridge;

import com.gridsql.config.EngineConfig;
import com.gridsql.expression.AggregateExpression;
import com.gridsql.expression.ColumnReference;
import com.gridsql.expression.Expression;
import com.gridsql.expression.ExpressionUtils;
import com.gridsql.expression.Literal;
import com.gridsql.statement.DisplayOption;
import com.gridsql.statement.OrderItem;
import com.gridsql.statement.Projection;
import com.gridsql.statement.SelectStatement;
import com.gridsql.statement.VirtualTableRef;
import com.gridsql.types.StringValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a SELECT can run in the grid's native dialect.
 *
 * <p>A statement is eligible when it reads exactly one grid range, has no JOIN, and
 * uses only clauses the dialect expresses with the same meaning. Everything else is
 * evaluated directly from a raw read, with an identical result shape.
 */
public final class BridgeEligibility {

    private BridgeEligibility() {}

    /**
     * Checks a statement.
     *
     * @param stmt the statement
     * @param config the engine configuration
     * @return the reason the statement is not eligible, or empty when it is
     */
    public static Optional<String> check(SelectStatement stmt, EngineConfig config) {
        if (!config.bridgeEnabled()) {
            return Optional.of("native dialect disabled");
        }
        if (stmt.source() instanceof VirtualTableRef) {
            return Optional.of("virtual table source");
        }
        if (stmt.hasJoins()) {
            return Optional.of("JOIN");
        }
        if (stmt.isDistinct()) {
            return Optional.of("DISTINCT");
        }
        if (stmt.having() != null) {
            return Optional.of("HAVING");
        }

        boolean star = false;
        for (Projection p : stmt.projections()) {
            if (p.isStar()) {
                star = true;
            } else if (ExpressionUtils.containsAggregate(p.expression())
                    && !(p.expression() instanceof AggregateExpression)) {
                return Optional.of("aggregate inside an expression");
            }
        }
        if (star && stmt.projections().size() > 1) {
            return Optional.of("'*' combined with other SELECT items");
        }

        for (OrderItem item : stmt.orderBy()) {
            Expression expr = item.expression();
            if (ExpressionUtils.containsAggregate(expr) && !isSelected(expr, stmt.projections())) {
                return Optional.of("ORDER BY on an aggregate that is not selected");
            }
        }

        for (Expression expr : allExpressions(stmt)) {
            Optional<String> reason = checkExpression(expr);
            if (reason.isPresent()) {
                return reason;
            }
        }
        return Optional.empty();
    }

    private static boolean isSelected(Expression expr, List<Projection> projections) {
        for (Projection p : projections) {
            if (p.expression().equals(expr)) {
                return true;
            }
            if (p.alias() != null && expr instanceof ColumnReference ref && !ref.isQualified()
                    && p.alias().equals(ref.columnName())) {
                return true;
            }
        }
        return false;
    }

    private static List<Expression> allExpressions(SelectStatement stmt) {
        List<Expression> exprs = new ArrayList<>();
        for (Projection p : stmt.projections()) {
            if (!p.isStar()) {
                exprs.add(p.expression());
            }
        }
        if (stmt.where() != null) {
            exprs.add(stmt.where());
        }
        exprs.addAll(stmt.groupBy());
        exprs.addAll(stmt.pivot());
        for (OrderItem item : stmt.orderBy()) {
            exprs.add(item.expression());
        }
        for (DisplayOption option : stmt.labels()) {
            exprs.add(option.target());
        }
        for (DisplayOption option : stmt.formats()) {
            exprs.add(option.target());
        }
        return exprs;
    }

    private static Optional<String> checkExpression(Expression expr) {
        if (expr instanceof AggregateExpression aggregate) {
            if (aggregate.isCountStar()) {
                return Optional.of("COUNT(*)");
            }
            if (aggregate.isDistinct()) {
                return Optional.of("DISTINCT aggregate");
            }
            if (!(aggregate.argument() instanceof ColumnReference)) {
                return Optional.of("expression inside an aggregate");
            }
            return Optional.empty();
        }
        if (expr instanceof Literal literal) {
            if (literal.isNull()) {
                return Optional.of("null literal");
            }
            if (literal.value() instanceof StringValue s && !NativeQuoting.canQuote(s.value())) {
                return Optional.of("literal containing both quote characters");
            }
            return Optional.empty();
        }
        for (Expression child : expr.children()) {
            Optional<String> reason = checkExpression(child);
            if (reason.isPresent()) {
                return reason;
            }
        }
        return Optional.empty();
    }
}
