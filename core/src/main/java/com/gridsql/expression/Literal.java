package com.gridsql.expression;

import com.gridsql.types.BooleanValue;
import com.gridsql.types.CellValue;
import com.gridsql.types.DateValue;
import com.gridsql.types.NullValue;
import com.gridsql.types.NumberValue;
import com.gridsql.types.StringValue;
import java.util.Objects;

/**
 * Expression representing a literal constant value.
 *
 * <p>Examples in a statement:
 * <pre>
 *   WHERE Amount &gt; 100            -- number literal
 *   WHERE Status = "active"        -- string literal
 *   WHERE Paid = true              -- boolean literal
 *   WHERE Due &lt; DATE "2024-01-01" -- date literal
 * </pre>
 */
public final class Literal implements Expression {

    private final CellValue value;

    /**
     * Creates a literal expression.
     *
     * @param value the literal value
     */
    public Literal(CellValue value) {
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    /**
     * Returns the literal value.
     *
     * @return the value
     */
    public CellValue value() {
        return value;
    }

    /**
     * Returns whether this is a null literal.
     *
     * @return true for null
     */
    public boolean isNull() {
        return value.isNull();
    }

    @Override
    public String toSQL() {
        if (value instanceof StringValue string) {
            return quote(string.value());
        }
        if (value instanceof DateValue date) {
            if (date.isDateOnly()) {
                return "date " + quote(date.asText());
            }
            return "datetime " + quote(date.value().toString().replace('T', ' '));
        }
        if (value instanceof NullValue) {
            return "null";
        }
        return value.asText();
    }

    private static String quote(String text) {
        // The native dialect has no escape sequence; pick the quote the text lacks
        if (text.indexOf('"') < 0) {
            return "\"" + text + "\"";
        }
        return "'" + text + "'";
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Literal)) return false;
        return Objects.equals(value, ((Literal) obj).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    // ==================== Factory Methods ====================

    public static Literal of(String value) {
        return new Literal(new StringValue(value));
    }

    public static Literal of(double value) {
        return new Literal(new NumberValue(value));
    }

    public static Literal of(boolean value) {
        return new Literal(BooleanValue.of(value));
    }

    public static Literal nullValue() {
        return new Literal(NullValue.get());
    }
}
