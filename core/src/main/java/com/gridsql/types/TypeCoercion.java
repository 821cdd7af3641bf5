package com.gridsql.types;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * The coercions the evaluator is allowed to perform between cell value variants.
 *
 * <p>Rules:
 * <ul>
 *   <li>Numbers: a {@link NumberValue}, or a string that is entirely a decimal number</li>
 *   <li>Dates: a {@link DateValue}, or a string in ISO-8601 date / date-time form</li>
 *   <li>Booleans: a {@link BooleanValue}, or the strings "true" / "false" in any case</li>
 * </ul>
 * Anything else does not coerce, and callers treat that as "no match" rather than an error.
 */
public final class TypeCoercion {

    private static final Pattern NUMERIC =
        Pattern.compile("^[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?$");

    private static final Pattern ISO_DATE_LIKE =
        Pattern.compile("^\\d{4}-\\d{2}-\\d{2}([T ]\\d{2}:\\d{2}(:\\d{2}(\\.\\d{1,9})?)?)?$");

    private static final DateTimeFormatter DATE_TIME = new DateTimeFormatterBuilder()
        .appendPattern("yyyy-MM-dd")
        .optionalStart().appendLiteral('T').optionalEnd()
        .optionalStart().appendLiteral(' ').optionalEnd()
        .appendPattern("HH:mm")
        .optionalStart().appendPattern(":ss")
        .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true).optionalEnd()
        .optionalEnd()
        .toFormatter();

    private TypeCoercion() {}

    /**
     * Returns whether the text is a plain decimal number.
     *
     * @param text the text to test
     * @return true if numeric-like
     */
    public static boolean isNumericText(String text) {
        return text != null && NUMERIC.matcher(text.trim()).matches();
    }

    /**
     * Coerces a value to a double.
     *
     * @param value the cell value
     * @return the number, or empty when the value is not numeric
     */
    public static OptionalDouble asNumber(CellValue value) {
        if (value instanceof NumberValue number) {
            return OptionalDouble.of(number.value());
        }
        if (value instanceof StringValue string && isNumericText(string.value())) {
            try {
                return OptionalDouble.of(Double.parseDouble(string.value().trim()));
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.empty();
    }

    /**
     * Coerces a value to a date-time.
     *
     * @param value the cell value
     * @return the instant (local), or empty when the value is not date-like
     */
    public static Optional<LocalDateTime> asDateTime(CellValue value) {
        if (value instanceof DateValue date) {
            return Optional.of(date.value());
        }
        if (value instanceof StringValue string) {
            return parseDateValue(string.value()).map(DateValue::value);
        }
        return Optional.empty();
    }

    /**
     * Coerces a value to a boolean.
     *
     * @param value the cell value
     * @return the boolean, or empty when the value is not boolean-like
     */
    public static Optional<Boolean> asBoolean(CellValue value) {
        if (value instanceof BooleanValue bool) {
            return Optional.of(bool.value());
        }
        if (value instanceof StringValue string) {
            String text = string.value().trim();
            if (text.equalsIgnoreCase("true")) return Optional.of(Boolean.TRUE);
            if (text.equalsIgnoreCase("false")) return Optional.of(Boolean.FALSE);
        }
        return Optional.empty();
    }

    /**
     * Parses ISO-8601 date or date-time text.
     *
     * @param text the text
     * @return the date value, or empty when the text is not ISO-date-like
     */
    public static Optional<DateValue> parseDateValue(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        if (!ISO_DATE_LIKE.matcher(trimmed).matches()) {
            return Optional.empty();
        }
        try {
            if (trimmed.length() == 10) {
                return Optional.of(DateValue.ofDate(LocalDate.parse(trimmed)));
            }
            return Optional.of(DateValue.ofDateTime(LocalDateTime.parse(trimmed, DATE_TIME)));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
