package com.gridsql.grid;

/**
 * What the grid reported after a write.
 */
public final class GridWriteResult {

    private final int updatedRows;
    private final int updatedCells;
    private final String updatedRange;
    private final String updateTime;

    /**
     * @param updatedRows rows written or deleted
     * @param updatedCells cells written, 0 for deletions
     * @param updatedRange the A1 range written, or null
     * @param updateTime when the write happened, or null if not reported
     */
    public GridWriteResult(int updatedRows, int updatedCells, String updatedRange, String updateTime) {
        this.updatedRows = updatedRows;
        this.updatedCells = updatedCells;
        this.updatedRange = updatedRange;
        this.updateTime = updateTime;
    }

    public int updatedRows() {
        return updatedRows;
    }

    public int updatedCells() {
        return updatedCells;
    }

    public String updatedRange() {
        return updatedRange;
    }

    public String updateTime() {
        return updateTime;
    }

    @Override
    public String toString() {
        return String.format("GridWriteResult(rows=%d, cells=%d, range=%s)", updatedRows, updatedCells, updatedRange);
    }
}
