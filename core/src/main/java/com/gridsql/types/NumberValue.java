package com.gridsql.types;

import java.math.BigDecimal;

/**
 * Numeric cell value. The grid stores every number as a double, so does this class.
 */
public final class NumberValue implements CellValue {

    private final double value;

    public NumberValue(double value) {
        this.value = value;
    }

    public double value() {
        return value;
    }

    /**
     * Returns whether the value has no fractional part and fits in a long.
     *
     * @return true for integral values
     */
    public boolean isIntegral() {
        return !Double.isInfinite(value) && value == Math.rint(value)
            && Math.abs(value) < 9.0E15;
    }

    @Override
    public DataType dataType() {
        return NumberType.get();
    }

    @Override
    public Object toJava() {
        if (isIntegral()) {
            return (long) value;
        }
        return value;
    }

    @Override
    public String asText() {
        if (isIntegral()) {
            return Long.toString((long) value);
        }
        if (!Double.isFinite(value)) {
            return Double.toString(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof NumberValue)) return false;
        return Double.compare(value, ((NumberValue) obj).value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }

    @Override
    public String toString() {
        return asText();
    }
}
