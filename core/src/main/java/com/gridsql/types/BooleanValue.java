package com.gridsql.types;

/**
 * Boolean cell value. Two shared instances.
 */
public final class BooleanValue implements CellValue {

    public static final BooleanValue TRUE = new BooleanValue(true);
    public static final BooleanValue FALSE = new BooleanValue(false);

    private final boolean value;

    private BooleanValue(boolean value) {
        this.value = value;
    }

    public static BooleanValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean value() {
        return value;
    }

    @Override
    public DataType dataType() {
        return BooleanType.get();
    }

    @Override
    public Object toJava() {
        return value;
    }

    @Override
    public String asText() {
        return Boolean.toString(value);
    }

    @Override
    public String toString() {
        return asText();
    }
}
