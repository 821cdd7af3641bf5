package com.gridsql.result;

import java.util.Objects;

/**
 * One output cell: the value {@code v} and, when a FORMAT applies, its formatted text
 * {@code f}.
 */
public final class ResultCell {

    private static final ResultCell EMPTY = new ResultCell(null, null);

    private final Object value;
    private final String formatted;

    public ResultCell(Object value, String formatted) {
        this.value = value;
        this.formatted = formatted;
    }

    public static ResultCell of(Object value) {
        return value == null ? EMPTY : new ResultCell(value, null);
    }

    public Object value() {
        return value;
    }

    public String formatted() {
        return formatted;
    }

    @Override
    public String toString() {
        return formatted != null ? value + "(" + formatted + ")" : String.valueOf(value);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ResultCell)) return false;
        ResultCell that = (ResultCell) obj;
        return Objects.equals(value, that.value) && Objects.equals(formatted, that.formatted);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, formatted);
    }
}
