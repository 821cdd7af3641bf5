package com.gridsql.grid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Deletes whole sheet rows. Row numbers are one-based and kept in descending order so
 * each deletion leaves the positions of the remaining ones unchanged.
 */
public final class DeleteRows implements GridWrite {

    private final List<Integer> rowNumbers;

    public DeleteRows(List<Integer> rowNumbers) {
        List<Integer> sorted = new ArrayList<>(rowNumbers);
        sorted.sort(Comparator.reverseOrder());
        this.rowNumbers = Collections.unmodifiableList(sorted);
    }

    public List<Integer> rowNumbers() {
        return rowNumbers;
    }

    @Override
    public int rowCount() {
        return rowNumbers.size();
    }

    @Override
    public String toString() {
        return "DeleteRows" + rowNumbers;
    }
}
