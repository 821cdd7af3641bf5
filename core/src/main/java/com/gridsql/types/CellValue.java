package com.gridsql.types;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Date;

/**
 * A single cell value: a closed tagged variant of String, Number, Boolean, Date and Null.
 *
 * <p>Every comparison, formatting and serialization site switches over the five
 * permitted implementations instead of relying on implicit coercion. Coercions that the
 * evaluator does perform (numeric-like strings, ISO-date-like strings, boolean-like
 * strings) live in {@link TypeCoercion}.
 */
public sealed interface CellValue
    permits StringValue, NumberValue, BooleanValue, DateValue, NullValue {

    /**
     * Returns the data type of this value, or null for {@link NullValue}.
     *
     * @return the data type
     */
    DataType dataType();

    /**
     * Returns whether this is the Null variant.
     *
     * @return true for {@link NullValue}
     */
    default boolean isNull() {
        return false;
    }

    /**
     * Returns the plain Java object written back to a 2-D array or serialized to JSON.
     *
     * <p>Strings stay strings, integral numbers become {@link Long}, other numbers
     * {@link Double}, dates their ISO-8601 text, Null becomes {@code null}.
     *
     * @return the Java value
     */
    Object toJava();

    /**
     * Returns the text form used by string operators and grouping keys.
     *
     * @return the text, empty for Null
     */
    String asText();

    /**
     * Wraps a plain Java object supplied by a caller or read from the grid.
     *
     * @param value the raw value (String, Number, Boolean, date types, or null)
     * @return the cell value
     */
    static CellValue of(Object value) {
        if (value == null) {
            return NullValue.get();
        }
        if (value instanceof CellValue cell) {
            return cell;
        }
        if (value instanceof Number number) {
            return new NumberValue(number.doubleValue());
        }
        if (value instanceof Boolean bool) {
            return BooleanValue.of(bool);
        }
        if (value instanceof LocalDate date) {
            return DateValue.ofDate(date);
        }
        if (value instanceof LocalDateTime dateTime) {
            return DateValue.ofDateTime(dateTime);
        }
        if (value instanceof Date date) {
            return DateValue.ofDateTime(new java.sql.Timestamp(date.getTime()).toLocalDateTime());
        }
        return new StringValue(value.toString());
    }
}
