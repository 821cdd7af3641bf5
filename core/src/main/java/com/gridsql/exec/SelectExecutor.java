package com.gridsql.exec;

import com.gridsql.exception.ValidationException;
import com.gridsql.expression.ColumnReference;
import com.gridsql.expression.Expression;
import com.gridsql.expression.ExpressionUtils;
import com.gridsql.expression.StarExpression;
import com.gridsql.result.QueryResult;
import com.gridsql.result.ResultCell;
import com.gridsql.result.ResultColumn;
import com.gridsql.result.ResultRow;
import com.gridsql.statement.DisplayOption;
import com.gridsql.statement.JoinClause;
import com.gridsql.statement.OrderItem;
import com.gridsql.statement.Projection;
import com.gridsql.statement.SelectStatement;
import com.gridsql.table.Column;
import com.gridsql.table.Row;
import com.gridsql.table.Table;
import com.gridsql.table.TableResolver;
import com.gridsql.types.CellValue;
import com.gridsql.types.DataType;
import com.gridsql.types.NullValue;
import com.gridsql.types.TypeInference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Evaluates a SELECT directly over in-memory tables.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>FROM and JOINs, through {@link JoinExecutor}</li>
 *   <li>WHERE, per row</li>
 *   <li>GROUP BY or implicit single group, through {@link AggregationEngine}</li>
 *   <li>projection, with {@code *} expanded to every column</li>
 *   <li>HAVING, with projection aliases visible</li>
 *   <li>DISTINCT, over the projected tuple or the DISTINCT ON expressions</li>
 *   <li>ORDER BY, OFFSET, LIMIT</li>
 *   <li>LABEL and FORMAT, which only change how columns and cells are presented</li>
 * </ol>
 * With PIVOT, each distinct value of the pivot expressions becomes one output column per
 * aggregate in the SELECT list.
 */
public final class SelectExecutor {

    private static final Logger logger = LoggerFactory.getLogger(SelectExecutor.class);

    private final ExpressionEvaluator evaluator;
    private final AggregationEngine aggregation;
    private final JoinExecutor joinExecutor = new JoinExecutor();

    public SelectExecutor(ExpressionEvaluator evaluator) {
        this.evaluator = evaluator;
        this.aggregation = new AggregationEngine(evaluator);
    }

    /**
     * Resolves the statement's tables and evaluates it.
     *
     * @param stmt the statement
     * @param resolver the table resolver
     * @return the result
     */
    public QueryResult execute(SelectStatement stmt, TableResolver resolver) {
        Table table = resolver.resolve(stmt.source());
        for (JoinClause join : stmt.joins()) {
            Table right = resolver.resolve(join.table());
            table = joinExecutor.join(table, right, join);
            logger.debug("{} produced {} row(s)", join, table.rowCount());
        }
        return execute(stmt, table);
    }

    /**
     * Evaluates a statement over an already resolved (and joined) table.
     *
     * @param stmt the statement
     * @param table the source table
     * @return the result
     */
    public QueryResult execute(SelectStatement stmt, Table table) {
        List<RowContext> filtered = new ArrayList<>();
        for (Row row : table.rows()) {
            TableRowContext ctx = new TableRowContext(table, row);
            if (evaluator.test(stmt.where(), ctx)) {
                filtered.add(ctx);
            }
        }
        List<OutputColumn> outputs = expandProjections(stmt, table);
        if (!stmt.pivot().isEmpty()) {
            return executePivot(stmt, filtered, outputs);
        }

        List<? extends RowContext> units = isAggregateQuery(stmt)
            ? aggregation.group(filtered, stmt.groupBy())
            : filtered;

        Map<String, Integer> aliases = aliasIndex(outputs);
        List<Expression> exprs = expressions(outputs);
        List<ProjectedContext> projected = new ArrayList<>(units.size());
        for (RowContext unit : units) {
            List<CellValue> values = new ArrayList<>(exprs.size());
            for (Expression expr : exprs) {
                values.add(evaluator.evaluate(expr, unit));
            }
            ProjectedContext ctx = new ProjectedContext(aliases, exprs, values, unit);
            if (stmt.having() == null || evaluator.test(stmt.having(), ctx)) {
                projected.add(ctx);
            }
        }

        if (stmt.isDistinct()) {
            projected = distinct(projected, stmt.distinctOn());
        }
        projected = RowSorter.sort(projected, stmt.orderBy(), c -> c, evaluator);
        projected = RowSorter.page(projected, stmt.offset(), stmt.limit());

        List<List<CellValue>> rows = new ArrayList<>(projected.size());
        for (ProjectedContext ctx : projected) {
            rows.add(ctx.values());
        }
        return buildResult(stmt, outputs, rows);
    }

    /**
     * Returns whether a SELECT computes groups rather than per-row output.
     *
     * @param stmt the statement
     * @return true with GROUP BY, PIVOT, or an aggregate in SELECT, HAVING or ORDER BY
     */
    public static boolean isAggregateQuery(SelectStatement stmt) {
        if (!stmt.groupBy().isEmpty() || !stmt.pivot().isEmpty()) {
            return true;
        }
        for (Projection p : stmt.projections()) {
            if (ExpressionUtils.containsAggregate(p.expression())) {
                return true;
            }
        }
        if (ExpressionUtils.containsAggregate(stmt.having())) {
            return true;
        }
        for (OrderItem item : stmt.orderBy()) {
            if (ExpressionUtils.containsAggregate(item.expression())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns whether a LABEL or FORMAT target denotes the given projection.
     *
     * @param projection a SELECT item
     * @param target the LABEL or FORMAT expression
     * @return true when they refer to the same output column
     */
    public static boolean refersTo(Projection projection, Expression target) {
        return refersTo(projection.expression(), projection.alias(), target);
    }

    private static boolean refersTo(Expression expr, String alias, Expression target) {
        if (expr.equals(target)) {
            return true;
        }
        if (target instanceof ColumnReference ref) {
            if (!ref.isQualified() && alias != null && alias.equals(ref.columnName())) {
                return true;
            }
            if (expr instanceof ColumnReference col && col.columnName().equalsIgnoreCase(ref.columnName())) {
                return !ref.isQualified() || !col.isQualified()
                    || ref.qualifier().equalsIgnoreCase(col.qualifier());
            }
        }
        return false;
    }

    // ==================== Projection ====================

    private static final class OutputColumn {
        final Expression expr;
        final String id;
        final String label;
        final String alias;

        OutputColumn(Expression expr, String id, String label, String alias) {
            this.expr = expr;
            this.id = id;
            this.label = label;
            this.alias = alias;
        }
    }

    private static List<OutputColumn> expandProjections(SelectStatement stmt, Table table) {
        List<OutputColumn> outputs = new ArrayList<>();
        boolean qualified = table.isJoined();
        for (Projection p : stmt.projections()) {
            if (p.expression() instanceof StarExpression star) {
                for (Column c : table.columns()) {
                    if (star.isQualified() && (c.qualifier() == null || !c.qualifier().equalsIgnoreCase(star.qualifier()))) {
                        continue;
                    }
                    ColumnReference ref = c.qualifier() != null
                        ? ColumnReference.qualified(c.qualifier(), c.name())
                        : ColumnReference.of(c.name());
                    outputs.add(new OutputColumn(ref, c.id(qualified), c.label(), null));
                }
                if (star.isQualified() && outputs.isEmpty()) {
                    throw new ValidationException(
                        "Table alias '" + star.qualifier() + "' not found", "column resolution");
                }
                continue;
            }
            Expression expr = p.expression();
            if (expr instanceof ColumnReference ref) {
                Column c = table.columns().get(table.resolve(ref));
                String id = p.alias() != null ? p.alias() : c.id(qualified);
                String label = p.alias() != null ? p.alias() : c.label();
                outputs.add(new OutputColumn(expr, id, label, p.alias()));
            } else {
                String id = p.alias() != null ? p.alias() : expr.toSQL();
                outputs.add(new OutputColumn(expr, id, id, p.alias()));
            }
        }
        return outputs;
    }

    private static Map<String, Integer> aliasIndex(List<OutputColumn> outputs) {
        Map<String, Integer> aliases = new HashMap<>();
        for (int i = 0; i < outputs.size(); i++) {
            if (outputs.get(i).alias != null) {
                aliases.putIfAbsent(outputs.get(i).alias, i);
            }
        }
        return aliases;
    }

    private static List<Expression> expressions(List<OutputColumn> outputs) {
        List<Expression> exprs = new ArrayList<>(outputs.size());
        for (OutputColumn o : outputs) {
            exprs.add(o.expr);
        }
        return exprs;
    }

    private List<ProjectedContext> distinct(List<ProjectedContext> rows, List<Expression> on) {
        Set<List<Object>> seen = new HashSet<>();
        List<ProjectedContext> kept = new ArrayList<>();
        for (ProjectedContext ctx : rows) {
            List<CellValue> key;
            if (on.isEmpty()) {
                key = ctx.values();
            } else {
                key = new ArrayList<>(on.size());
                for (Expression expr : on) {
                    key.add(evaluator.evaluate(expr, ctx));
                }
            }
            if (seen.add(CellValueComparator.groupingKey(key))) {
                kept.add(ctx);
            }
        }
        return kept;
    }

    // ==================== PIVOT ====================

    private QueryResult executePivot(SelectStatement stmt, List<RowContext> filtered, List<OutputColumn> outputs) {
        List<OutputColumn> groupOutputs = new ArrayList<>();
        List<OutputColumn> aggregateOutputs = new ArrayList<>();
        for (OutputColumn o : outputs) {
            if (ExpressionUtils.containsAggregate(o.expr)) {
                aggregateOutputs.add(o);
            } else {
                groupOutputs.add(o);
            }
        }

        Map<List<Object>, List<CellValue>> firstKeyValues = new LinkedHashMap<>();
        Map<RowContext, List<Object>> rowKeys = new HashMap<>();
        for (RowContext row : filtered) {
            List<CellValue> key = new ArrayList<>(stmt.pivot().size());
            for (Expression expr : stmt.pivot()) {
                key.add(evaluator.evaluate(expr, row));
            }
            List<Object> normalized = CellValueComparator.groupingKey(key);
            firstKeyValues.putIfAbsent(normalized, key);
            rowKeys.put(row, normalized);
        }
        List<List<CellValue>> pivotKeys = new ArrayList<>(firstKeyValues.values());
        pivotKeys.sort((a, b) -> {
            for (int i = 0; i < a.size(); i++) {
                int c = CellValueComparator.compareForSort(a.get(i), b.get(i));
                if (c != 0) {
                    return c;
                }
            }
            return 0;
        });

        List<OutputColumn> columns = new ArrayList<>(groupOutputs);
        for (List<CellValue> key : pivotKeys) {
            String keyText = pivotKeyText(key);
            for (OutputColumn agg : aggregateOutputs) {
                String id = keyText + " " + agg.id;
                columns.add(new OutputColumn(agg.expr, id, keyText + " " + agg.label, null));
            }
        }

        List<Expression> groupExprs = expressions(groupOutputs);
        Map<String, Integer> aliases = aliasIndex(groupOutputs);
        List<ProjectedContext> groups = new ArrayList<>();
        for (GroupContext group : aggregation.group(filtered, stmt.groupBy())) {
            List<CellValue> values = new ArrayList<>();
            for (Expression expr : groupExprs) {
                values.add(evaluator.evaluate(expr, group));
            }
            for (List<CellValue> key : pivotKeys) {
                List<RowContext> cellRows = new ArrayList<>();
                List<Object> normalized = CellValueComparator.groupingKey(key);
                for (RowContext row : group.rows()) {
                    if (normalized.equals(rowKeys.get(row))) {
                        cellRows.add(row);
                    }
                }
                GroupContext cell = group.subset(cellRows);
                for (OutputColumn agg : aggregateOutputs) {
                    values.add(cellRows.isEmpty() ? NullValue.get() : evaluator.evaluate(agg.expr, cell));
                }
            }
            ProjectedContext ctx = new ProjectedContext(aliases, groupExprs, values, group);
            if (stmt.having() == null || evaluator.test(stmt.having(), ctx)) {
                groups.add(ctx);
            }
        }
        groups = RowSorter.sort(groups, stmt.orderBy(), c -> c, evaluator);
        groups = RowSorter.page(groups, stmt.offset(), stmt.limit());

        List<List<CellValue>> rows = new ArrayList<>(groups.size());
        for (ProjectedContext ctx : groups) {
            rows.add(ctx.values());
        }
        logger.debug("PIVOT produced {} value column(s) over {} group(s)", pivotKeys.size(), rows.size());
        return buildPivotResult(stmt, columns, groupOutputs.size(), aggregateOutputs, pivotKeys, rows);
    }

    private static String pivotKeyText(List<CellValue> key) {
        List<String> parts = new ArrayList<>(key.size());
        for (CellValue v : key) {
            parts.add(v.isNull() ? "null" : v.asText());
        }
        return String.join(", ", parts);
    }

    // ==================== Result construction ====================

    private QueryResult buildResult(SelectStatement stmt, List<OutputColumn> outputs, List<List<CellValue>> rows) {
        String[] labels = new String[outputs.size()];
        String[] patterns = new String[outputs.size()];
        for (int i = 0; i < outputs.size(); i++) {
            labels[i] = outputs.get(i).label;
        }
        for (DisplayOption label : stmt.labels()) {
            labels[findOutput(outputs, label.target(), "LABEL")] = label.text();
        }
        for (DisplayOption format : stmt.formats()) {
            patterns[findOutput(outputs, format.target(), "FORMAT")] = format.text();
        }
        return assemble(outputs, labels, patterns, rows);
    }

    private QueryResult buildPivotResult(SelectStatement stmt, List<OutputColumn> columns, int groupWidth,
                                         List<OutputColumn> aggregates, List<List<CellValue>> pivotKeys,
                                         List<List<CellValue>> rows) {
        String[] labels = new String[columns.size()];
        String[] patterns = new String[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            labels[i] = columns.get(i).label;
        }
        List<OutputColumn> groupColumns = columns.subList(0, groupWidth);
        applyPivotOptions(stmt.labels(), "LABEL", groupColumns, aggregates, pivotKeys, labels, true);
        applyPivotOptions(stmt.formats(), "FORMAT", groupColumns, aggregates, pivotKeys, patterns, false);
        return assemble(columns, labels, patterns, rows);
    }

    private static void applyPivotOptions(List<DisplayOption> options, String clause, List<OutputColumn> groupColumns,
                                          List<OutputColumn> aggregates, List<List<CellValue>> pivotKeys,
                                          String[] target, boolean prefixKey) {
        int groupWidth = groupColumns.size();
        for (DisplayOption option : options) {
            int g = indexOf(groupColumns, option.target());
            if (g >= 0) {
                target[g] = option.text();
                continue;
            }
            int a = indexOf(aggregates, option.target());
            if (a < 0) {
                throw notInSelect(clause, option.target());
            }
            for (int k = 0; k < pivotKeys.size(); k++) {
                int index = groupWidth + k * aggregates.size() + a;
                target[index] = prefixKey ? pivotKeyText(pivotKeys.get(k)) + " " + option.text() : option.text();
            }
        }
    }

    private static QueryResult assemble(List<OutputColumn> outputs, String[] labels, String[] patterns,
                                        List<List<CellValue>> rows) {
        List<ResultColumn> columns = new ArrayList<>(outputs.size());
        for (int i = 0; i < outputs.size(); i++) {
            List<CellValue> columnValues = new ArrayList<>(rows.size());
            for (List<CellValue> row : rows) {
                columnValues.add(row.get(i));
            }
            DataType type = TypeInference.inferColumnType(columnValues);
            columns.add(new ResultColumn(outputs.get(i).id, labels[i], type, patterns[i]));
        }
        List<ResultRow> resultRows = new ArrayList<>(rows.size());
        for (List<CellValue> row : rows) {
            List<ResultCell> cells = new ArrayList<>(row.size());
            for (int i = 0; i < row.size(); i++) {
                CellValue value = row.get(i);
                String formatted = patterns[i] != null ? DisplayFormatter.format(value, patterns[i]) : null;
                cells.add(formatted != null ? new ResultCell(value.toJava(), formatted) : ResultCell.of(value.toJava()));
            }
            resultRows.add(new ResultRow(cells));
        }
        return new QueryResult(columns, resultRows);
    }

    private static int findOutput(List<OutputColumn> outputs, Expression target, String clause) {
        int index = indexOf(outputs, target);
        if (index < 0) {
            throw notInSelect(clause, target);
        }
        return index;
    }

    private static int indexOf(List<OutputColumn> outputs, Expression target) {
        for (int i = 0; i < outputs.size(); i++) {
            OutputColumn o = outputs.get(i);
            if (refersTo(o.expr, o.alias, target) || (target instanceof ColumnReference ref
                    && !ref.isQualified() && o.id.equals(ref.columnName()))) {
                return i;
            }
        }
        return -1;
    }

    private static ValidationException notInSelect(String clause, Expression target) {
        return new ValidationException(
            clause + " column '" + target.toSQL() + "' not found in the SELECT list",
            "column resolution",
            clause + " " + target.toSQL(),
            "Select the column before labelling or formatting it");
    }
}
