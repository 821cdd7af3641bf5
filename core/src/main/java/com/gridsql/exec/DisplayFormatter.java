package com.gridsql.exec;

import com.gridsql.types.BooleanValue;
import com.gridsql.types.CellValue;
import com.gridsql.types.DateValue;
import com.gridsql.types.NumberValue;
import com.gridsql.types.StringValue;
import com.gridsql.types.TypeCoercion;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.DateTimeException;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Renders FORMAT patterns into the {@code f} text of a cell.
 *
 * <p>Numbers use {@link DecimalFormat} patterns ({@code #,##0.00}), dates
 * {@link DateTimeFormatter} patterns ({@code yyyy-MM-dd}, {@code MMM d, yyyy}), booleans a
 * {@code yes:no} pair. A pattern that does not fit the value leaves the value's plain text.
 */
final class DisplayFormatter {

    private DisplayFormatter() {}

    /**
     * Formats a value.
     *
     * @param value the value
     * @param pattern the FORMAT pattern
     * @return the formatted text, or null for Null
     */
    static String format(CellValue value, String pattern) {
        if (value.isNull()) {
            return null;
        }
        try {
            if (value instanceof NumberValue number) {
                return numberFormat(pattern).format(number.value());
            }
            if (value instanceof DateValue date) {
                return DateTimeFormatter.ofPattern(pattern, Locale.ROOT).format(date.value());
            }
            if (value instanceof BooleanValue bool) {
                int colon = pattern.indexOf(':');
                if (colon >= 0) {
                    return bool.value() ? pattern.substring(0, colon) : pattern.substring(colon + 1);
                }
                return bool.asText();
            }
            StringValue text = (StringValue) value;
            OptionalDouble n = TypeCoercion.asNumber(text);
            if (n.isPresent() && looksNumeric(pattern)) {
                return numberFormat(pattern).format(n.getAsDouble());
            }
            return text.value();
        } catch (IllegalArgumentException | DateTimeException e) {
            return value.asText();
        }
    }

    private static DecimalFormat numberFormat(String pattern) {
        return new DecimalFormat(pattern, DecimalFormatSymbols.getInstance(Locale.ROOT));
    }

    private static boolean looksNumeric(String pattern) {
        return pattern.indexOf('#') >= 0 || pattern.indexOf('0') >= 0;
    }
}
