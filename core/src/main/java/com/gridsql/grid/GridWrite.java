package com.gridsql.grid;

/**
 * A single write against a grid range, computed entirely before it is issued.
 */
public sealed interface GridWrite permits AppendRows, UpdateCells, DeleteRows {

    /**
     * Returns how many sheet rows the write touches.
     *
     * @return the row count
     */
    int rowCount();
}
