package com.gridsql.grid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Appends rows after the last row of a range. Values are interpreted by the grid as if
 * typed by a user.
 */
public final class AppendRows implements GridWrite {

    private final List<List<Object>> rows;

    public AppendRows(List<List<Object>> rows) {
        List<List<Object>> copy = new ArrayList<>();
        for (List<Object> row : rows) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public List<List<Object>> rows() {
        return rows;
    }

    @Override
    public int rowCount() {
        return rows.size();
    }

    @Override
    public String toString() {
        return "AppendRows(" + rows.size() + ")";
    }
}
