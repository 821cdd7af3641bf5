package com.gridsql.bridge;

import com.gridsql.expression.AggregateExpression;
import com.gridsql.expression.BinaryExpression;
import com.gridsql.expression.ColumnReference;
import com.gridsql.expression.Expression;
import com.gridsql.expression.FunctionCall;
import com.gridsql.expression.Literal;
import com.gridsql.expression.UnaryExpression;
import com.gridsql.statement.DisplayOption;
import com.gridsql.statement.OrderItem;
import com.gridsql.statement.Projection;
import com.gridsql.statement.SelectStatement;
import com.gridsql.types.BooleanValue;
import com.gridsql.types.CellValue;
import com.gridsql.types.DateValue;
import com.gridsql.types.NumberValue;
import com.gridsql.types.StringValue;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import static com.gridsql.bridge.NativeQuoting.quoteIdentifierIfNeeded;
import static com.gridsql.bridge.NativeQuoting.quoteLiteral;

/**
 * Translates a bridge-eligible SELECT into the grid's native query dialect.
 *
 * <p>Clauses are emitted in the order the dialect requires: select, where, group by,
 * pivot, order by, limit, offset, label, format. Table qualifiers are dropped since
 * only one range is involved. The dialect has no {@code AS}: an alias becomes a label
 * and an ORDER BY on an alias is rewritten to the aliased expression.
 *
 * <p>String operators are rendered over {@code lower(...)} on both sides so that they
 * stay case-insensitive, and {@code TODAY()} becomes a date literal fixed at
 * generation time.
 *
 * <p>Example usage:
 * <pre>
 *   NativeQueryGenerator generator = new NativeQueryGenerator(LocalDate.now());
 *   String query = generator.generate(stmt);
 *   // select A, sum(C) where B = "active" group by A label sum(C) 'Total'
 * </pre>
 *
 * @see BridgeEligibility
 */
public final class NativeQueryGenerator {

    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final LocalDate today;

    public NativeQueryGenerator(LocalDate today) {
        this.today = Objects.requireNonNull(today, "today must not be null");
    }

    /**
     * Generates the native query for a statement.
     *
     * @param stmt an eligible statement
     * @return the query text
     * @throws IllegalArgumentException if the statement uses something the dialect lacks
     */
    public String generate(SelectStatement stmt) {
        Objects.requireNonNull(stmt, "stmt must not be null");
        List<String> clauses = new ArrayList<>();

        List<String> items = new ArrayList<>();
        for (Projection p : stmt.projections()) {
            items.add(p.isStar() ? "*" : render(p.expression()));
        }
        clauses.add("select " + String.join(", ", items));

        if (stmt.where() != null) {
            clauses.add("where " + render(stmt.where()));
        }
        if (!stmt.groupBy().isEmpty()) {
            clauses.add("group by " + renderList(stmt.groupBy()));
        }
        if (!stmt.pivot().isEmpty()) {
            clauses.add("pivot " + renderList(stmt.pivot()));
        }
        if (!stmt.orderBy().isEmpty()) {
            List<String> keys = new ArrayList<>();
            for (OrderItem item : stmt.orderBy()) {
                Expression expr = unalias(item.expression(), stmt.projections());
                keys.add(render(expr) + (item.isDescending() ? " desc" : " asc"));
            }
            clauses.add("order by " + String.join(", ", keys));
        }
        if (stmt.limit() != null) {
            clauses.add("limit " + stmt.limit());
        }
        if (stmt.offset() != null && stmt.offset() > 0) {
            clauses.add("offset " + stmt.offset());
        }

        List<String> labels = labels(stmt);
        if (!labels.isEmpty()) {
            clauses.add("label " + String.join(", ", labels));
        }
        if (!stmt.formats().isEmpty()) {
            List<String> formats = new ArrayList<>();
            for (DisplayOption option : stmt.formats()) {
                formats.add(render(unalias(option.target(), stmt.projections())) + " " + quoteLiteral(option.text()));
            }
            clauses.add("format " + String.join(", ", formats));
        }
        return String.join(" ", clauses);
    }

    /**
     * Explicit LABELs first, then one label per alias not already labelled.
     */
    private List<String> labels(SelectStatement stmt) {
        List<String> labels = new ArrayList<>();
        List<Expression> labelled = new ArrayList<>();
        for (DisplayOption option : stmt.labels()) {
            Expression target = unalias(option.target(), stmt.projections());
            labelled.add(target);
            labels.add(render(target) + " " + quoteLiteral(option.text()));
        }
        for (Projection p : stmt.projections()) {
            if (p.alias() != null && !labelled.contains(p.expression())) {
                labelled.add(p.expression());
                labels.add(render(p.expression()) + " " + quoteLiteral(p.alias()));
            }
        }
        return labels;
    }

    private static Expression unalias(Expression expr, List<Projection> projections) {
        if (expr instanceof ColumnReference ref && !ref.isQualified()) {
            for (Projection p : projections) {
                if (ref.columnName().equals(p.alias())) {
                    return p.expression();
                }
            }
        }
        return expr;
    }

    private String renderList(List<Expression> exprs) {
        List<String> parts = new ArrayList<>(exprs.size());
        for (Expression expr : exprs) {
            parts.add(render(expr));
        }
        return String.join(", ", parts);
    }

    // ==================== Expressions ====================

    /**
     * Renders one expression in the native dialect.
     *
     * @param expr the expression
     * @return the native text
     */
    public String render(Expression expr) {
        if (expr instanceof ColumnReference ref) {
            return quoteIdentifierIfNeeded(ref.columnName());
        } else if (expr instanceof Literal literal) {
            return renderLiteral(literal.value());
        } else if (expr instanceof BinaryExpression binary) {
            return renderBinary(binary);
        } else if (expr instanceof UnaryExpression unary) {
            return renderUnary(unary);
        } else if (expr instanceof FunctionCall call) {
            return renderFunction(call);
        } else if (expr instanceof AggregateExpression aggregate) {
            return aggregate.function().name().toLowerCase(Locale.ROOT) + "(" + render(aggregate.argument()) + ")";
        }
        throw new IllegalArgumentException(
            "Expression cannot be expressed in the native dialect: " + expr.toSQL());
    }

    private static String renderLiteral(CellValue value) {
        if (value instanceof StringValue s) {
            return quoteLiteral(s.value());
        } else if (value instanceof NumberValue n) {
            return n.asText();
        } else if (value instanceof BooleanValue b) {
            return b.value() ? "true" : "false";
        } else if (value instanceof DateValue d) {
            if (d.isDateOnly()) {
                return "date \"" + d.value().toLocalDate() + "\"";
            }
            return "datetime \"" + DATE_TIME.format(d.value()) + "\"";
        }
        throw new IllegalArgumentException("null has no native literal");
    }

    private String renderBinary(BinaryExpression binary) {
        BinaryExpression.Operator op = binary.operator();
        switch (op) {
            case CONTAINS:
            case STARTS_WITH:
            case ENDS_WITH:
            case LIKE:
                return lowered(binary.left()) + " " + op.symbol() + " " + lowered(binary.right());
            case MATCHES:
                return render(binary.left()) + " matches " + render(binary.right());
            case AND:
            case OR:
            case ADD:
            case SUBTRACT:
            case MULTIPLY:
            case DIVIDE:
                return "(" + render(binary.left()) + " " + op.symbol() + " " + render(binary.right()) + ")";
            default:
                return render(binary.left()) + " " + op.symbol() + " " + render(binary.right());
        }
    }

    private String lowered(Expression expr) {
        if (expr instanceof Literal literal && literal.value() instanceof StringValue s) {
            return quoteLiteral(s.value().toLowerCase(Locale.ROOT));
        }
        return "lower(" + render(expr) + ")";
    }

    private String renderUnary(UnaryExpression unary) {
        String operand = render(unary.operand());
        return switch (unary.operator()) {
            case NEGATE -> "(0 - " + operand + ")";
            case NOT -> "not (" + operand + ")";
            case IS_NULL -> operand + " is null";
            case IS_NOT_NULL -> operand + " is not null";
        };
    }

    private String renderFunction(FunctionCall call) {
        switch (call.function()) {
            case TODAY:
                return "date \"" + today + "\"";
            case NOW:
                return "now()";
            default:
                return call.functionName() + "(" + render(call.arguments().get(0)) + ")";
        }
    }
}
