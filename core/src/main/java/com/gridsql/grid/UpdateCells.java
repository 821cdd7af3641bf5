package com.gridsql.grid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Overwrites individual cells, addressed by sheet row and absolute column.
 */
public final class UpdateCells implements GridWrite {

    /**
     * One cell to overwrite.
     */
    public static final class CellUpdate {
        private final int row;
        private final int column;
        private final Object value;

        /**
         * @param row one-based sheet row
         * @param column zero-based absolute column index
         * @param value the new value (String, Number, Boolean or null)
         */
        public CellUpdate(int row, int column, Object value) {
            this.row = row;
            this.column = column;
            this.value = value;
        }

        public int row() {
            return row;
        }

        public int column() {
            return column;
        }

        public Object value() {
            return value;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof CellUpdate)) return false;
            CellUpdate that = (CellUpdate) obj;
            return row == that.row && column == that.column && Objects.equals(value, that.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(row, column, value);
        }

        @Override
        public String toString() {
            return "(" + row + "," + column + ")=" + value;
        }
    }

    private final List<CellUpdate> cells;

    public UpdateCells(List<CellUpdate> cells) {
        this.cells = Collections.unmodifiableList(new ArrayList<>(cells));
    }

    public List<CellUpdate> cells() {
        return cells;
    }

    @Override
    public int rowCount() {
        return (int) cells.stream().mapToInt(CellUpdate::row).distinct().count();
    }

    @Override
    public String toString() {
        return "UpdateCells(" + cells.size() + " cells)";
    }
}
