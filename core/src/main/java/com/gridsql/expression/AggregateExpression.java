package com.gridsql.expression;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Expression representing an aggregate function over a group of rows.
 *
 * <p>Examples:
 * <pre>
 *   COUNT(*)              -- row count
 *   COUNT(DISTINCT Region)
 *   SUM(Amount)
 *   AVG(Amount) * 2       -- aggregates may be nested in arithmetic
 * </pre>
 */
public final class AggregateExpression implements Expression {

    /**
     * Aggregate functions.
     */
    public enum Function {
        COUNT, SUM, AVG, MIN, MAX;

        public static Function fromName(String name) {
            for (Function f : values()) {
                if (f.name().equalsIgnoreCase(name)) {
                    return f;
                }
            }
            return null;
        }
    }

    private final Function function;
    private final Expression argument;
    private final boolean distinct;

    /**
     * Creates an aggregate expression.
     *
     * @param function the aggregate function
     * @param argument the expression to aggregate, or null for COUNT(*)
     * @param distinct whether to aggregate only distinct values
     */
    public AggregateExpression(Function function, Expression argument, boolean distinct) {
        this.function = Objects.requireNonNull(function, "function must not be null");
        this.argument = argument;
        this.distinct = distinct;
        if (argument == null && function != Function.COUNT) {
            throw new IllegalArgumentException(function + " requires an argument");
        }
    }

    public AggregateExpression(Function function, Expression argument) {
        this(function, argument, false);
    }

    public Function function() {
        return function;
    }

    /**
     * Returns the aggregated expression.
     *
     * @return the argument, or null for COUNT(*)
     */
    public Expression argument() {
        return argument;
    }

    public boolean isCountStar() {
        return argument == null;
    }

    public boolean isDistinct() {
        return distinct;
    }

    @Override
    public List<Expression> children() {
        return argument == null ? Collections.emptyList() : Collections.singletonList(argument);
    }

    @Override
    public String toSQL() {
        String name = function.name().toLowerCase(Locale.ROOT);
        if (argument == null) {
            return name + "(*)";
        }
        return name + "(" + (distinct ? "distinct " : "") + argument.toSQL() + ")";
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AggregateExpression)) return false;
        AggregateExpression that = (AggregateExpression) obj;
        return function == that.function && distinct == that.distinct &&
               Objects.equals(argument, that.argument);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, argument, distinct);
    }
}
