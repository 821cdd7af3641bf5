package com.gridsql.types;

/**
 * The absent cell value.
 */
public final class NullValue implements CellValue {

    private static final NullValue INSTANCE = new NullValue();

    private NullValue() {}

    public static NullValue get() {
        return INSTANCE;
    }

    @Override
    public DataType dataType() {
        return null;
    }

    @Override
    public boolean isNull() {
        return true;
    }

    @Override
    public Object toJava() {
        return null;
    }

    @Override
    public String asText() {
        return "";
    }

    @Override
    public String toString() {
        return "null";
    }
}
