package com.gridsql.exec;

import com.gridsql.types.BooleanValue;
import com.gridsql.types.CellValue;
import com.gridsql.types.DateValue;
import com.gridsql.types.NullValue;
import com.gridsql.types.NumberValue;
import com.gridsql.types.StringValue;
import com.gridsql.types.TypeCoercion;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Typed comparison of cell values.
 *
 * <p>Equality tries, in order: numbers (including numeric-like strings), dates (including
 * ISO-date-like strings), booleans, then exact text. Null equals nothing.
 *
 * <p>Ordering predicates ({@code < <= > >=}) are defined only when both sides are numeric
 * or both are dates; otherwise there is no answer and the predicate is false.
 *
 * <p>{@link #SORT_ORDER} is a total order for ORDER BY, MIN and MAX: Null first, then
 * numbers, dates, booleans and text.
 */
public final class CellValueComparator {

    /** Total order used for sorting. */
    public static final Comparator<CellValue> SORT_ORDER = CellValueComparator::compareForSort;

    private CellValueComparator() {}

    /**
     * Returns whether two values are equal under predicate semantics.
     *
     * @param a the left value
     * @param b the right value
     * @return true when equal; false whenever either side is Null
     */
    public static boolean valuesEqual(CellValue a, CellValue b) {
        if (a.isNull() || b.isNull()) {
            return false;
        }
        OptionalDouble na = TypeCoercion.asNumber(a);
        OptionalDouble nb = TypeCoercion.asNumber(b);
        if (na.isPresent() && nb.isPresent()) {
            return Double.compare(na.getAsDouble(), nb.getAsDouble()) == 0;
        }
        Optional<LocalDateTime> da = TypeCoercion.asDateTime(a);
        Optional<LocalDateTime> db = TypeCoercion.asDateTime(b);
        if (da.isPresent() && db.isPresent()) {
            return da.get().equals(db.get());
        }
        Optional<Boolean> ba = TypeCoercion.asBoolean(a);
        Optional<Boolean> bb = TypeCoercion.asBoolean(b);
        if (ba.isPresent() && bb.isPresent()) {
            return ba.get().equals(bb.get());
        }
        return a.asText().equals(b.asText());
    }

    /**
     * Returns a hashable key under which values that are equal for {@link #valuesEqual}
     * collide. Used by DISTINCT, GROUP BY, PIVOT and distinct aggregates, where Null forms
     * a group of its own.
     *
     * @param value the value
     * @return the key
     */
    public static Object groupingKey(CellValue value) {
        if (value.isNull()) {
            return NullValue.get();
        }
        OptionalDouble n = TypeCoercion.asNumber(value);
        if (n.isPresent()) {
            double d = n.getAsDouble();
            return d == 0.0 ? 0.0 : d;
        }
        Optional<LocalDateTime> date = TypeCoercion.asDateTime(value);
        if (date.isPresent()) {
            return date.get();
        }
        Optional<Boolean> bool = TypeCoercion.asBoolean(value);
        if (bool.isPresent()) {
            return bool.get();
        }
        return value.asText();
    }

    /**
     * Applies {@link #groupingKey(CellValue)} to each value of a tuple.
     *
     * @param values the tuple
     * @return the tuple key
     */
    public static List<Object> groupingKey(List<CellValue> values) {
        List<Object> key = new ArrayList<>(values.size());
        for (CellValue value : values) {
            key.add(groupingKey(value));
        }
        return key;
    }

    /**
     * Compares two values for an ordering predicate.
     *
     * @param a the left value
     * @param b the right value
     * @return the comparison, or empty when the values are not both numeric or both dates
     */
    public static OptionalInt compareForPredicate(CellValue a, CellValue b) {
        if (a.isNull() || b.isNull()) {
            return OptionalInt.empty();
        }
        OptionalDouble na = TypeCoercion.asNumber(a);
        OptionalDouble nb = TypeCoercion.asNumber(b);
        if (na.isPresent() && nb.isPresent()) {
            return OptionalInt.of(Double.compare(na.getAsDouble(), nb.getAsDouble()));
        }
        Optional<LocalDateTime> da = TypeCoercion.asDateTime(a);
        Optional<LocalDateTime> db = TypeCoercion.asDateTime(b);
        if (da.isPresent() && db.isPresent()) {
            return OptionalInt.of(da.get().compareTo(db.get()));
        }
        return OptionalInt.empty();
    }

    /**
     * Total order over all values.
     *
     * @param a the left value
     * @param b the right value
     * @return negative, zero or positive
     */
    public static int compareForSort(CellValue a, CellValue b) {
        int ra = rank(a);
        int rb = rank(b);
        if (ra != rb) {
            return Integer.compare(ra, rb);
        }
        switch (ra) {
            case 0:
                return 0;
            case 1:
                return Double.compare(TypeCoercion.asNumber(a).getAsDouble(), TypeCoercion.asNumber(b).getAsDouble());
            case 2:
                return TypeCoercion.asDateTime(a).get().compareTo(TypeCoercion.asDateTime(b).get());
            case 3:
                return Boolean.compare(TypeCoercion.asBoolean(a).get(), TypeCoercion.asBoolean(b).get());
            default:
                int ci = a.asText().compareToIgnoreCase(b.asText());
                return ci != 0 ? ci : a.asText().compareTo(b.asText());
        }
    }

    private static int rank(CellValue v) {
        if (v instanceof NullValue) {
            return 0;
        }
        if (v instanceof NumberValue) {
            return 1;
        }
        if (v instanceof DateValue) {
            return 2;
        }
        if (v instanceof BooleanValue) {
            return 3;
        }
        StringValue s = (StringValue) v;
        if (TypeCoercion.isNumericText(s.value())) {
            return 1;
        }
        if (TypeCoercion.parseDateValue(s.value()).isPresent()) {
            return 2;
        }
        return 4;
    }
}
