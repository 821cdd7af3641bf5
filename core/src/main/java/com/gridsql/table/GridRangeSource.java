package com.gridsql.table;

import java.util.Objects;

/**
 * A table loaded from a grid range.
 *
 * <p>Knows how to map a row ordinal back to its one-based sheet row: the range's first
 * row, plus the header rows, plus the ordinal.
 */
public final class GridRangeSource implements TableSource {

    private final GridLocation location;
    private final int headerRows;

    public GridRangeSource(GridLocation location, int headerRows) {
        this.location = Objects.requireNonNull(location, "location must not be null");
        this.headerRows = headerRows;
    }

    public GridLocation location() {
        return location;
    }

    public int headerRows() {
        return headerRows;
    }

    /**
     * Returns the sheet row number of a data row.
     *
     * @param row the row
     * @return the one-based sheet row
     */
    public int sheetRowOf(Row row) {
        return location.gridRange().startRow() + headerRows + row.ordinal();
    }

    @Override
    public String describe() {
        return location.toString();
    }
}
