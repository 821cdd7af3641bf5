package com.gridsql.table;

import com.gridsql.config.EngineConfig;
import com.gridsql.exception.ValidationException;
import com.gridsql.grid.GridSource;
import com.gridsql.grid.RemoteCalls;
import com.gridsql.statement.RangeRef;
import com.gridsql.statement.TableReference;
import com.gridsql.statement.VirtualTableRef;
import com.gridsql.types.CellValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns FROM, JOIN and mutation targets into {@link Table}s.
 *
 * <p>Virtual tables ({@code :name}) come from the call's {@link VirtualTableSet}: the
 * first row names the columns, the remaining rows are data. Grid ranges are read through
 * the {@link GridSource}; their columns are named by letter from the declared range, so
 * the column list of either kind is known before any remote call (see
 * {@link #columnsOf(TableReference)}).
 *
 * <p>A missing FROM means the caller's default grid range. A bare range in FROM names
 * another range of the same spreadsheet.
 */
public final class TableResolver {

    private static final Logger logger = LoggerFactory.getLogger(TableResolver.class);

    private final EngineConfig config;
    private final GridSource gridSource;
    private final VirtualTableSet virtualTables;
    private final GridLocation defaultLocation;

    /**
     * Creates a resolver for one statement.
     *
     * @param config the engine configuration
     * @param gridSource the grid collaborator (may be null when only virtual tables are used)
     * @param virtualTables the call's virtual tables
     * @param defaultLocation the caller's target range (may be null)
     */
    public TableResolver(EngineConfig config, GridSource gridSource,
                         VirtualTableSet virtualTables, GridLocation defaultLocation) {
        this.config = config;
        this.gridSource = gridSource;
        this.virtualTables = virtualTables != null ? virtualTables : VirtualTableSet.empty();
        this.defaultLocation = defaultLocation;
    }

    public EngineConfig config() {
        return config;
    }

    public VirtualTableSet virtualTables() {
        return virtualTables;
    }

    public GridSource gridSource() {
        return gridSource;
    }

    public boolean isVirtual(TableReference ref) {
        return ref instanceof VirtualTableRef;
    }

    /**
     * Returns the grid location a non-virtual reference points at.
     *
     * @param ref the reference, or null for the default range
     * @return the location
     * @throws ValidationException if no target location was given or no grid source exists
     */
    public GridLocation locationOf(TableReference ref) {
        if (ref instanceof VirtualTableRef) {
            throw new IllegalArgumentException("not a grid reference: " + ref);
        }
        if (defaultLocation == null) {
            throw new ValidationException(
                "Invalid target: no spreadsheet location given",
                "target resolution",
                ref == null ? "statement has no FROM clause" : "FROM " + ref,
                "Pass a target spreadsheet id and range, or read from a :virtual table");
        }
        if (gridSource == null) {
            throw new ValidationException(
                "Invalid target: no grid source configured for " + defaultLocation,
                "target resolution");
        }
        if (ref instanceof RangeRef range) {
            return defaultLocation.withRange(range.range());
        }
        return defaultLocation;
    }

    /**
     * Returns the columns a reference will have, without reading any data.
     *
     * @param ref the reference, or null for the default range
     * @return the columns, qualified with the reference's alias
     */
    public List<Column> columnsOf(TableReference ref) {
        if (ref instanceof VirtualTableRef virtual) {
            List<List<Object>> data = virtualTables.get(virtual.name());
            List<Object> header = data.isEmpty() || data.get(0) == null ? Collections.emptyList() : data.get(0);
            return virtualColumns(header, virtual.effectiveAlias());
        }
        GridLocation location = locationOf(ref);
        return gridColumns(location.gridRange(), ref == null ? null : ref.effectiveAlias(),
            Collections.emptyList());
    }

    /**
     * Loads a table.
     *
     * @param ref the reference, or null for the default range
     * @return the table
     */
    public Table resolve(TableReference ref) {
        if (ref instanceof VirtualTableRef virtual) {
            return loadVirtual(virtual);
        }
        return loadGrid(locationOf(ref), ref == null ? null : ref.effectiveAlias());
    }

    private Table loadVirtual(VirtualTableRef ref) {
        List<List<Object>> data = virtualTables.get(ref.name());
        List<Object> header = data.isEmpty() || data.get(0) == null ? Collections.emptyList() : data.get(0);
        List<Column> columns = virtualColumns(header, ref.effectiveAlias());
        List<Row> rows = new ArrayList<>();
        for (int i = 1; i < data.size(); i++) {
            rows.add(toRow(i - 1, data.get(i), columns.size()));
        }
        logger.debug("Loaded virtual table :{} with {} column(s) and {} row(s)",
            ref.name(), columns.size(), rows.size());
        return new Table(columns, rows, new VirtualTableSource(ref.name()), config.emptyStringIsNull());
    }

    private Table loadGrid(GridLocation location, String alias) {
        List<List<Object>> values = RemoteCalls.invoke("read", location.toString(),
            () -> gridSource.readValues(location));
        if (values == null) {
            values = Collections.emptyList();
        }
        int headerRows = Math.min(config.headerRows(), values.size());
        List<Column> columns = gridColumns(location.gridRange(), alias, values.subList(0, headerRows));
        List<Row> rows = new ArrayList<>();
        for (int i = headerRows; i < values.size(); i++) {
            rows.add(toRow(i - headerRows, values.get(i), columns.size()));
        }
        logger.debug("Read {} data row(s) from {}", rows.size(), location);
        return new Table(columns, rows, new GridRangeSource(location, config.headerRows()), true);
    }

    private static List<Column> virtualColumns(List<Object> header, String alias) {
        List<Column> columns = new ArrayList<>();
        for (int i = 0; i < header.size(); i++) {
            Object cell = header.get(i);
            String name = cell == null || cell.toString().isBlank()
                ? GridRange.columnLetters(i)
                : cell.toString().trim();
            columns.add(new Column(name, alias, name));
        }
        return columns;
    }

    private static List<Column> gridColumns(GridRange range, String alias, List<List<Object>> headerRows) {
        List<Column> columns = new ArrayList<>();
        for (int i = 0; i < range.width(); i++) {
            String letter = range.columnLetterAt(i);
            List<String> parts = new ArrayList<>();
            for (List<Object> header : headerRows) {
                if (header != null && i < header.size() && header.get(i) != null
                        && !header.get(i).toString().isBlank()) {
                    parts.add(header.get(i).toString().trim());
                }
            }
            String label = parts.isEmpty() ? letter : String.join(" ", parts);
            columns.add(new Column(letter, alias, label));
        }
        return columns;
    }

    private static Row toRow(int ordinal, List<Object> cells, int width) {
        List<CellValue> values = new ArrayList<>(width);
        for (int c = 0; c < width; c++) {
            Object cell = cells != null && c < cells.size() ? cells.get(c) : null;
            values.add(CellValue.of(cell));
        }
        return new Row(ordinal, values);
    }
}
