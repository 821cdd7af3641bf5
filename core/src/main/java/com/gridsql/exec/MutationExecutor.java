package com.gridsql.exec;

import com.gridsql.exception.ValidationException;
import com.gridsql.expression.AggregateExpression;
import com.gridsql.expression.ColumnReference;
import com.gridsql.expression.Expression;
import com.gridsql.grid.AppendRows;
import com.gridsql.grid.DeleteRows;
import com.gridsql.grid.GridWrite;
import com.gridsql.grid.GridWriteResult;
import com.gridsql.grid.RemoteCalls;
import com.gridsql.grid.UpdateCells;
import com.gridsql.result.MutationSummary;
import com.gridsql.statement.Assignment;
import com.gridsql.statement.DeleteStatement;
import com.gridsql.statement.InsertStatement;
import com.gridsql.statement.RowTargetingStatement;
import com.gridsql.statement.TableReference;
import com.gridsql.statement.UpdateStatement;
import com.gridsql.statement.VirtualTableRef;
import com.gridsql.table.Column;
import com.gridsql.table.ColumnLookup;
import com.gridsql.table.GridLocation;
import com.gridsql.table.GridRange;
import com.gridsql.table.GridRangeSource;
import com.gridsql.table.Row;
import com.gridsql.table.Table;
import com.gridsql.table.TableResolver;
import com.gridsql.types.CellValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Executes INSERT, UPDATE and DELETE.
 *
 * <p>Target rows are always chosen by the engine: WHERE filters the loaded rows, then
 * ORDER BY and LIMIT narrow them. Row identity never comes from the grid's native
 * dialect.
 *
 * <p>Virtual tables are mutated on a copy of the caller's array and the whole resulting
 * array is returned. Grid ranges get one read (UPDATE, DELETE) and exactly one write
 * covering every computed row; nothing is written when no row matches.
 */
public final class MutationExecutor {

    private static final Logger logger = LoggerFactory.getLogger(MutationExecutor.class);

    private final ExpressionEvaluator evaluator;

    public MutationExecutor(ExpressionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    // ==================== UPDATE ====================

    /**
     * Executes an UPDATE.
     *
     * @param stmt the statement
     * @param resolver the table resolver
     * @return the summary
     */
    public MutationSummary update(UpdateStatement stmt, TableResolver resolver) {
        Table table = resolver.resolve(stmt.source());
        int[] columnIndexes = assignmentColumns(stmt.assignments(), table);
        List<Row> targets = selectTargets(stmt, table);
        if (targets.isEmpty()) {
            return noMatch(stmt.operation(), table, stmt.source(), resolver);
        }

        List<List<Object>> newValues = new ArrayList<>(targets.size());
        for (Row row : targets) {
            TableRowContext ctx = new TableRowContext(table, row);
            List<Object> values = new ArrayList<>(columnIndexes.length);
            for (Assignment assignment : stmt.assignments()) {
                values.add(evaluator.evaluate(assignment.value(), ctx).toJava());
            }
            newValues.add(values);
        }

        if (stmt.source() instanceof VirtualTableRef virtual) {
            List<List<Object>> data = resolver.virtualTables().copyOf(virtual.name());
            for (int i = 0; i < targets.size(); i++) {
                List<Object> line = data.get(targets.get(i).ordinal() + 1);
                for (int a = 0; a < columnIndexes.length; a++) {
                    while (line.size() <= columnIndexes[a]) {
                        line.add(null);
                    }
                    line.set(columnIndexes[a], newValues.get(i).get(a));
                }
            }
            logger.info("Updated {} row(s) of virtual table :{}", targets.size(), virtual.name());
            return MutationSummary.builder(stmt.operation())
                .affectedRows(targets.size())
                .data(data)
                .build();
        }

        GridRangeSource source = (GridRangeSource) table.source();
        GridRange range = source.location().gridRange();
        List<UpdateCells.CellUpdate> cells = new ArrayList<>();
        List<String> addresses = new ArrayList<>();
        for (int i = 0; i < targets.size(); i++) {
            int sheetRow = source.sheetRowOf(targets.get(i));
            for (int a = 0; a < columnIndexes.length; a++) {
                int column = range.startColumn() + columnIndexes[a];
                cells.add(new UpdateCells.CellUpdate(sheetRow, column, newValues.get(i).get(a)));
                addresses.add(range.cellAddress(column, sheetRow));
            }
        }
        GridWriteResult result = write(resolver, source.location(), new UpdateCells(cells));
        logger.info("Updated {} cell(s) in {} row(s) of {}", cells.size(), targets.size(), source.location());
        return MutationSummary.builder(stmt.operation())
            .affectedRows(targets.size())
            .updatedCells(result.updatedCells() > 0 ? result.updatedCells() : cells.size())
            .affectedRanges(addresses)
            .updateTime(result.updateTime())
            .build();
    }

    private static int[] assignmentColumns(List<Assignment> assignments, Table table) {
        int[] indexes = new int[assignments.size()];
        for (int i = 0; i < assignments.size(); i++) {
            indexes[i] = table.resolve(ColumnReference.of(assignments.get(i).column()));
        }
        return indexes;
    }

    // ==================== DELETE ====================

    /**
     * Executes a DELETE.
     *
     * @param stmt the statement
     * @param resolver the table resolver
     * @return the summary
     */
    public MutationSummary delete(DeleteStatement stmt, TableResolver resolver) {
        Table table = resolver.resolve(stmt.source());
        List<Row> targets = selectTargets(stmt, table);
        if (targets.isEmpty()) {
            return noMatch(stmt.operation(), table, stmt.source(), resolver);
        }

        if (stmt.source() instanceof VirtualTableRef virtual) {
            List<List<Object>> data = resolver.virtualTables().copyOf(virtual.name());
            List<Integer> ordinals = new ArrayList<>();
            for (Row row : targets) {
                ordinals.add(row.ordinal());
            }
            ordinals.sort(Comparator.reverseOrder());
            for (int ordinal : ordinals) {
                data.remove(ordinal + 1);
            }
            logger.info("Deleted {} row(s) from virtual table :{}", targets.size(), virtual.name());
            return MutationSummary.builder(stmt.operation())
                .affectedRows(targets.size())
                .data(data)
                .build();
        }

        GridRangeSource source = (GridRangeSource) table.source();
        List<Integer> sheetRows = new ArrayList<>();
        for (Row row : targets) {
            sheetRows.add(source.sheetRowOf(row));
        }
        DeleteRows deletion = new DeleteRows(sheetRows);
        GridWriteResult result = write(resolver, source.location(), deletion);
        logger.info("Deleted sheet row(s) {} of {}", deletion.rowNumbers(), source.location());
        return MutationSummary.builder(stmt.operation())
            .affectedRows(targets.size())
            .rowNumbers(deletion.rowNumbers())
            .updateTime(result.updateTime())
            .build();
    }

    // ==================== INSERT ====================

    /**
     * Executes an INSERT.
     *
     * @param stmt the statement
     * @param resolver the table resolver
     * @return the summary
     */
    public MutationSummary insert(InsertStatement stmt, TableResolver resolver) {
        if (stmt.source() instanceof VirtualTableRef virtual) {
            if (!resolver.config().virtualInsertEnabled()) {
                throw new ValidationException(
                    "INSERT is not supported for virtual tables",
                    "validation",
                    "INSERT INTO :" + virtual.name(),
                    "Virtual tables are read, update and delete only in this configuration");
            }
            List<Column> columns = resolver.columnsOf(virtual);
            List<List<Object>> rows = buildRows(stmt, columns, columns.size());
            List<List<Object>> data = resolver.virtualTables().copyOf(virtual.name());
            if (data.isEmpty()) {
                data.add(new ArrayList<>());
            }
            data.addAll(rows);
            logger.info("Inserted {} row(s) into virtual table :{}", rows.size(), virtual.name());
            return MutationSummary.builder(stmt.operation())
                .affectedRows(rows.size())
                .data(data)
                .build();
        }

        GridLocation location = resolver.locationOf(stmt.source());
        List<Column> columns = stmt.isPositional() ? resolver.columnsOf(stmt.source())
            : insertColumns(stmt, resolver);
        List<List<Object>> rows = buildRows(stmt, columns, location.gridRange().width());
        GridWriteResult result = write(resolver, location, new AppendRows(rows));
        logger.info("Appended {} row(s) to {} at {}", rows.size(), location, result.updatedRange());
        return MutationSummary.builder(stmt.operation())
            .affectedRows(result.updatedRows() > 0 ? result.updatedRows() : rows.size())
            .updatedCells(result.updatedCells())
            .updatedRange(result.updatedRange())
            .updateTime(result.updateTime())
            .build();
    }

    /**
     * Returns the columns a sparse grid INSERT names: column letters resolve without I/O,
     * header labels need the range to be read.
     */
    private static List<Column> insertColumns(InsertStatement stmt, TableResolver resolver) {
        List<Column> letters = resolver.columnsOf(stmt.source());
        for (String name : stmt.columns()) {
            if (!ColumnLookup.canResolve(letters, ColumnReference.of(name))) {
                return labelledColumns(resolver.resolve(stmt.source()).columns());
            }
        }
        return letters;
    }

    private static List<Column> labelledColumns(List<Column> columns) {
        List<Column> labelled = new ArrayList<>(columns.size());
        for (Column c : columns) {
            labelled.add(new Column(c.label(), c.qualifier(), c.label()));
        }
        return labelled;
    }

    private List<List<Object>> buildRows(InsertStatement stmt, List<Column> columns, int width) {
        int[] targets = null;
        if (!stmt.isPositional()) {
            targets = new int[stmt.columns().size()];
            for (int i = 0; i < targets.length; i++) {
                targets[i] = ColumnLookup.resolve(columns, ColumnReference.of(stmt.columns().get(i)));
            }
        }
        List<List<Object>> rows = new ArrayList<>(stmt.rows().size());
        for (List<Expression> tuple : stmt.rows()) {
            if (tuple.size() > width) {
                throw new ValidationException(
                    "Invalid INSERT: " + tuple.size() + " values for " + width + " column(s)",
                    "validation",
                    "VALUES " + tuple,
                    "Supply at most one value per column of the target");
            }
            List<Object> row = new ArrayList<>(width);
            if (targets == null) {
                for (Expression expr : tuple) {
                    row.add(evaluator.evaluate(expr, ConstantContext.INSTANCE).toJava());
                }
            } else {
                for (int c = 0; c < width; c++) {
                    row.add(null);
                }
                for (int i = 0; i < targets.length; i++) {
                    row.set(targets[i], evaluator.evaluate(tuple.get(i), ConstantContext.INSTANCE).toJava());
                }
            }
            rows.add(row);
        }
        return rows;
    }

    /**
     * Context for VALUES tuples, which may not reference columns.
     */
    private static final class ConstantContext implements RowContext {
        static final ConstantContext INSTANCE = new ConstantContext();

        @Override
        public CellValue column(ColumnReference ref) {
            throw new ValidationException(
                "Column reference '" + ref.qualifiedName() + "' is not allowed in VALUES",
                "validation");
        }

        @Override
        public CellValue aggregate(AggregateExpression aggregate) {
            throw new ValidationException(
                "Aggregate " + aggregate.toSQL() + " is not allowed in VALUES",
                "validation");
        }

        @Override
        public boolean emptyStringIsNull() {
            return false;
        }
    }

    // ==================== Shared ====================

    private List<Row> selectTargets(RowTargetingStatement stmt, Table table) {
        List<Row> matched = new ArrayList<>();
        for (Row row : table.rows()) {
            if (evaluator.test(stmt.where(), new TableRowContext(table, row))) {
                matched.add(row);
            }
        }
        List<Row> sorted = RowSorter.sort(matched, stmt.orderBy(), r -> new TableRowContext(table, r), evaluator);
        List<Row> targets = RowSorter.page(sorted, null, stmt.limit());
        logger.debug("{} of {} row(s) matched, {} targeted", matched.size(), table.rowCount(), targets.size());
        return targets;
    }

    private static MutationSummary noMatch(String operation, Table table, TableReference target,
                                           TableResolver resolver) {
        logger.info("{} matched no rows in {}; nothing written", operation, table.source().describe());
        MutationSummary.Builder builder = MutationSummary.builder(operation)
            .affectedRows(0)
            .message(MutationSummary.NO_MATCH_MESSAGE);
        if (target instanceof VirtualTableRef virtual) {
            builder.data(resolver.virtualTables().copyOf(virtual.name()));
        }
        return builder.build();
    }

    private static GridWriteResult write(TableResolver resolver, GridLocation location, GridWrite write) {
        GridWriteResult result = RemoteCalls.invoke("write", location.toString(),
            () -> resolver.gridSource().write(location, write));
        if (result == null) {
            return new GridWriteResult(write.rowCount(), 0, null, null);
        }
        return result;
    }
}
