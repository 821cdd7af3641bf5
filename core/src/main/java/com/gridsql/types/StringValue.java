package com.gridsql.types;

import java.util.Objects;

/**
 * Text cell value.
 */
public final class StringValue implements CellValue {

    private final String value;

    public StringValue(String value) {
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    public String value() {
        return value;
    }

    public boolean isEmpty() {
        return value.isEmpty();
    }

    @Override
    public DataType dataType() {
        return StringType.get();
    }

    @Override
    public Object toJava() {
        return value;
    }

    @Override
    public String asText() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof StringValue)) return false;
        return value.equals(((StringValue) obj).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return '"' + value + '"';
    }
}
