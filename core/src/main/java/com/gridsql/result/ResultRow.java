package com.gridsql.result;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One output row.
 */
public final class ResultRow {

    private final List<ResultCell> cells;

    public ResultRow(List<ResultCell> cells) {
        this.cells = Collections.unmodifiableList(new ArrayList<>(cells));
    }

    public List<ResultCell> cells() {
        return cells;
    }

    public Object value(int index) {
        return cells.get(index).value();
    }

    @Override
    public String toString() {
        return cells.toString();
    }
}
