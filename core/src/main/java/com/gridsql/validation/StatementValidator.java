package com.gridsql.validation;

import com.gridsql.exception.ValidationException;
import com.gridsql.exec.SelectExecutor;
import com.gridsql.expression.ColumnReference;
import com.gridsql.expression.Expression;
import com.gridsql.expression.ExpressionUtils;
import com.gridsql.expression.StarExpression;
import com.gridsql.statement.Assignment;
import com.gridsql.statement.DeleteStatement;
import com.gridsql.statement.DisplayOption;
import com.gridsql.statement.InsertStatement;
import com.gridsql.statement.JoinClause;
import com.gridsql.statement.OrderItem;
import com.gridsql.statement.Projection;
import com.gridsql.statement.RowTargetingStatement;
import com.gridsql.statement.SelectStatement;
import com.gridsql.statement.Statement;
import com.gridsql.statement.UpdateStatement;
import com.gridsql.statement.VirtualTableRef;
import com.gridsql.table.Column;
import com.gridsql.table.ColumnLookup;
import com.gridsql.table.TableResolver;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Validates parsed statements before any data is read or written.
 *
 * <p>Only schema knowledge that needs no remote call is used: virtual table headers, and
 * the column letters of declared grid ranges.
 *
 * <p>Validation rules:
 * <ul>
 *   <li><b>Mutations:</b>
 *     <ul>
 *       <li>UPDATE and DELETE must have a WHERE clause ({@code WHERE true} targets every row)</li>
 *       <li>SET columns must exist in the target</li>
 *       <li>VALUES may only hold constant expressions</li>
 *       <li>INSERT into a virtual table must be enabled</li>
 *     </ul>
 *   </li>
 *   <li><b>Targets:</b> virtual tables must be supplied; grid locations and ranges must be valid</li>
 *   <li><b>Columns:</b> every reference must resolve to exactly one column</li>
 *   <li><b>Aggregation:</b>
 *     <ul>
 *       <li>Non-aggregate SELECT items must appear in GROUP BY</li>
 *       <li>{@code *} cannot be combined with aggregation</li>
 *       <li>Aggregates are not allowed in WHERE, GROUP BY or PIVOT</li>
 *     </ul>
 *   </li>
 *   <li><b>LABEL/FORMAT:</b> each target must be an item of the SELECT list</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 *   Statement stmt = StatementParser.parse(sql);
 *   StatementValidator.validate(stmt, resolver);  // Throws ValidationException if invalid
 *   ...
 * </pre>
 *
 * @see ValidationException
 */
public final class StatementValidator {

    private StatementValidator() {}

    /**
     * Validates a statement against the tables it addresses.
     *
     * @param stmt the statement
     * @param resolver the resolver for this call
     * @throws ValidationException if validation fails
     */
    public static void validate(Statement stmt, TableResolver resolver) {
        Objects.requireNonNull(stmt, "Statement cannot be null");
        if (stmt instanceof SelectStatement select) {
            validateSelect(select, resolver);
        } else if (stmt instanceof UpdateStatement update) {
            validateUpdate(update, resolver);
        } else if (stmt instanceof DeleteStatement delete) {
            validateDelete(delete, resolver);
        } else if (stmt instanceof InsertStatement insert) {
            validateInsert(insert, resolver);
        }
    }

    // ==================== Mutations ====================

    private static void validateUpdate(UpdateStatement stmt, TableResolver resolver) {
        requireWhere(stmt.operation(), stmt, "update all rows");
        List<Column> columns = resolver.columnsOf(stmt.source());
        for (Assignment assignment : stmt.assignments()) {
            ColumnLookup.resolve(columns, ColumnReference.of(assignment.column()));
            checkColumns(assignment.value(), columns, Set.of());
            rejectAggregate(assignment.value(), "SET");
        }
        validateTargeting(stmt, columns);
    }

    private static void validateDelete(DeleteStatement stmt, TableResolver resolver) {
        requireWhere(stmt.operation(), stmt, "delete all rows");
        List<Column> columns = resolver.columnsOf(stmt.source());
        validateTargeting(stmt, columns);
    }

    private static void requireWhere(String operation, RowTargetingStatement stmt, String action) {
        if (stmt.where() == null) {
            throw new ValidationException(
                operation + " requires a WHERE clause (use WHERE true to " + action + ")",
                "mutation validation",
                operation + " without WHERE",
                "Add a WHERE clause selecting the rows to change");
        }
    }

    private static void validateTargeting(RowTargetingStatement stmt, List<Column> columns) {
        checkColumns(stmt.where(), columns, Set.of());
        rejectAggregate(stmt.where(), "WHERE");
        for (OrderItem item : stmt.orderBy()) {
            checkColumns(item.expression(), columns, Set.of());
            rejectAggregate(item.expression(), "ORDER BY");
        }
    }

    private static void validateInsert(InsertStatement stmt, TableResolver resolver) {
        for (List<Expression> tuple : stmt.rows()) {
            for (Expression value : tuple) {
                List<ColumnReference> refs = ExpressionUtils.columnReferences(value);
                if (!refs.isEmpty() || ExpressionUtils.containsAggregate(value)) {
                    throw new ValidationException(
                        "Invalid VALUES: '" + value.toSQL() + "' is not a constant",
                        "insert validation",
                        "VALUES " + tuple,
                        "Use literals or constant expressions in VALUES");
                }
            }
        }
        if (stmt.source() instanceof VirtualTableRef virtual) {
            if (!resolver.config().virtualInsertEnabled()) {
                throw new ValidationException(
                    "INSERT is not supported for virtual tables",
                    "insert validation",
                    "INSERT INTO :" + virtual.name(),
                    "Virtual tables are read, update and delete only in this configuration");
            }
            List<Column> columns = resolver.columnsOf(virtual);
            for (String name : stmt.columns()) {
                ColumnLookup.resolve(columns, ColumnReference.of(name));
            }
            return;
        }
        // header labels of a grid range are only known after a read, so names are checked at execution
        resolver.columnsOf(stmt.source());
    }

    // ==================== SELECT ====================

    private static void validateSelect(SelectStatement stmt, TableResolver resolver) {
        List<Column> columns = new ArrayList<>(resolver.columnsOf(stmt.source()));
        for (JoinClause join : stmt.joins()) {
            columns.addAll(resolver.columnsOf(join.table()));
        }
        for (JoinClause join : stmt.joins()) {
            ColumnLookup.resolve(columns, join.firstKey());
            ColumnLookup.resolve(columns, join.secondKey());
        }

        Set<String> aliases = new HashSet<>();
        for (Projection p : stmt.projections()) {
            if (p.alias() != null) {
                aliases.add(p.alias());
            }
            if (p.expression() instanceof StarExpression star) {
                validateStar(star, columns);
            } else {
                checkColumns(p.expression(), columns, Set.of());
            }
        }

        checkColumns(stmt.where(), columns, Set.of());
        rejectAggregate(stmt.where(), "WHERE");
        for (Expression expr : stmt.groupBy()) {
            checkColumns(expr, columns, Set.of());
            rejectAggregate(expr, "GROUP BY");
        }
        for (Expression expr : stmt.pivot()) {
            checkColumns(expr, columns, Set.of());
            rejectAggregate(expr, "PIVOT");
        }
        for (Expression expr : stmt.distinctOn()) {
            checkColumns(expr, columns, aliases);
        }
        checkColumns(stmt.having(), columns, aliases);
        for (OrderItem item : stmt.orderBy()) {
            checkColumns(item.expression(), columns, aliases);
        }

        if (SelectExecutor.isAggregateQuery(stmt)) {
            validateGrouping(stmt, columns);
        }
        validateDisplayOptions(stmt.labels(), "LABEL", stmt.projections());
        validateDisplayOptions(stmt.formats(), "FORMAT", stmt.projections());
    }

    private static void validateStar(StarExpression star, List<Column> columns) {
        if (!star.isQualified()) {
            return;
        }
        for (Column c : columns) {
            if (c.qualifier() != null && c.qualifier().equalsIgnoreCase(star.qualifier())) {
                return;
            }
        }
        throw new ValidationException(
            "Table alias '" + star.qualifier() + "' not found",
            "column resolution",
            star.toSQL(),
            "Use an alias introduced in FROM or JOIN");
    }

    private static void validateGrouping(SelectStatement stmt, List<Column> columns) {
        for (Projection p : stmt.projections()) {
            if (p.isStar()) {
                throw new ValidationException(
                    "'*' cannot be combined with GROUP BY or aggregates",
                    "aggregate validation",
                    "SELECT " + p,
                    "List the grouped columns explicitly");
            }
            Expression expr = p.expression();
            if (ExpressionUtils.containsAggregate(expr) || stmt.groupBy().contains(expr)) {
                continue;
            }
            for (ColumnReference ref : ExpressionUtils.columnReferences(expr)) {
                if (!isGrouped(ref, stmt.groupBy(), columns)) {
                    throw new ValidationException(
                        "Non-aggregate column '" + ref.qualifiedName() + "' must appear in GROUP BY",
                        "aggregate validation",
                        "SELECT " + p + " GROUP BY " + stmt.groupBy(),
                        "Add '" + ref.qualifiedName() + "' to GROUP BY or wrap it in an aggregate function");
                }
            }
        }
    }

    private static boolean isGrouped(ColumnReference ref, List<Expression> groupBy, List<Column> columns) {
        int index = ColumnLookup.resolve(columns, ref);
        for (Expression expr : groupBy) {
            if (expr instanceof ColumnReference grouped && ColumnLookup.resolve(columns, grouped) == index) {
                return true;
            }
        }
        return false;
    }

    private static void validateDisplayOptions(List<DisplayOption> options, String clause,
                                               List<Projection> projections) {
        for (DisplayOption option : options) {
            boolean found = false;
            for (Projection p : projections) {
                if (p.isStar() || SelectExecutor.refersTo(p, option.target())) {
                    found = true;
                    break;
                }
            }
            if (!found) {
                throw new ValidationException(
                    clause + " column '" + option.target().toSQL() + "' not found in the SELECT list",
                    "column resolution",
                    clause + " " + option,
                    "Select the column before labelling or formatting it");
            }
        }
    }

    // ==================== Helpers ====================

    private static void checkColumns(Expression expr, List<Column> columns, Set<String> aliases) {
        if (expr == null) {
            return;
        }
        for (ColumnReference ref : ExpressionUtils.columnReferences(expr)) {
            if (!ref.isQualified() && aliases.contains(ref.columnName())) {
                continue;
            }
            ColumnLookup.resolve(columns, ref);
        }
    }

    private static void rejectAggregate(Expression expr, String clause) {
        if (ExpressionUtils.containsAggregate(expr)) {
            throw new ValidationException(
                "Aggregate functions are not allowed in " + clause,
                "aggregate validation",
                clause + " " + expr.toSQL(),
                clause.equals("WHERE") ? "Use HAVING to filter on aggregate values" : null);
        }
    }
}
