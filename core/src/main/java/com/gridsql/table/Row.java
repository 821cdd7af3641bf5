package com.gridsql.table;

import com.gridsql.types.CellValue;
import com.gridsql.types.NullValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A row of a {@link Table}: its ordinal position plus its cell values.
 *
 * <p>The ordinal is the zero-based index of the row among the table's data rows as
 * loaded, and is what a mutation maps back to the physical source. Rows may be shorter
 * than the column list; missing trailing cells read as Null.
 */
public final class Row {

    private final int ordinal;
    private final List<CellValue> values;

    public Row(int ordinal, List<CellValue> values) {
        this.ordinal = ordinal;
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public int ordinal() {
        return ordinal;
    }

    public List<CellValue> values() {
        return values;
    }

    public CellValue get(int index) {
        if (index < 0 || index >= values.size()) {
            return NullValue.get();
        }
        return values.get(index);
    }

    @Override
    public String toString() {
        return ordinal + ":" + values;
    }
}
