package com.gridsql.types;

/**
 * Data type representing a date with a time of day.
 */
public final class DateTimeType implements DataType {

    private static final DateTimeType INSTANCE = new DateTimeType();

    private DateTimeType() {}

    public static DateTimeType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "datetime";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof DateTimeType;
    }

    @Override
    public int hashCode() {
        return typeName().hashCode();
    }

    @Override
    public String toString() {
        return typeName();
    }
}
