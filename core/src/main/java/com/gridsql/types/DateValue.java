package com.gridsql.types;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Date or date-time cell value, compared by instant.
 *
 * <p>A date-only value is stored as the start of that day.
 */
public final class DateValue implements CellValue {

    private final LocalDateTime value;
    private final boolean dateOnly;

    private DateValue(LocalDateTime value, boolean dateOnly) {
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.dateOnly = dateOnly;
    }

    public static DateValue ofDate(LocalDate date) {
        return new DateValue(date.atStartOfDay(), true);
    }

    public static DateValue ofDateTime(LocalDateTime dateTime) {
        return new DateValue(dateTime, false);
    }

    public LocalDateTime value() {
        return value;
    }

    public boolean isDateOnly() {
        return dateOnly;
    }

    @Override
    public DataType dataType() {
        return dateOnly ? DateType.get() : DateTimeType.get();
    }

    @Override
    public Object toJava() {
        return asText();
    }

    @Override
    public String asText() {
        return dateOnly ? value.toLocalDate().toString() : value.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DateValue)) return false;
        return value.equals(((DateValue) obj).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return asText();
    }
}
