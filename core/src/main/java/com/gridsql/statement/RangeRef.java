package com.gridsql.statement;

import java.util.Objects;

/**
 * Reference to an A1 range of the target spreadsheet, written bare ({@code Sheet1!A:D})
 * or quoted ({@code "My Sheet!A:D"}).
 */
public final class RangeRef implements TableReference {

    private final String range;
    private final String alias;

    public RangeRef(String range, String alias) {
        this.range = Objects.requireNonNull(range, "range must not be null");
        this.alias = alias;
    }

    public String range() {
        return range;
    }

    @Override
    public String alias() {
        return alias;
    }

    @Override
    public String effectiveAlias() {
        return alias;
    }

    @Override
    public String toString() {
        return range + (alias != null ? " AS " + alias : "");
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof RangeRef)) return false;
        RangeRef that = (RangeRef) obj;
        return range.equals(that.range) && Objects.equals(alias, that.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(range, alias);
    }
}
