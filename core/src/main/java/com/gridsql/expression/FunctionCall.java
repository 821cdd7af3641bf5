package com.gridsql.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Expression representing a scalar function call.
 *
 * <p>Supported functions:
 * <pre>
 *   lower(Name)     -- lower-cases text
 *   upper(Name)     -- upper-cases text
 *   today()         -- start of the current day
 *   now()           -- current date-time
 *   year(Due)       -- year of a date
 * </pre>
 *
 * <p>Aggregates are not function calls; see {@link AggregateExpression}.
 */
public final class FunctionCall implements Expression {

    /**
     * Scalar functions with their argument counts.
     */
    public enum Function {
        LOWER(1),
        UPPER(1),
        TODAY(0),
        NOW(0),
        YEAR(1);

        private final int arity;

        Function(int arity) {
            this.arity = arity;
        }

        public int arity() {
            return arity;
        }

        /**
         * Looks up a function by name.
         *
         * @param name the function name, case-insensitive
         * @return the function, or null if unknown
         */
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
    private final List<Expression> arguments;

    /**
     * Creates a function call expression.
     *
     * @param function the function
     * @param arguments the arguments
     */
    public FunctionCall(Function function, List<Expression> arguments) {
        this.function = Objects.requireNonNull(function, "function must not be null");
        this.arguments = new ArrayList<>(Objects.requireNonNull(arguments, "arguments must not be null"));
        if (this.arguments.size() != function.arity()) {
            throw new IllegalArgumentException(String.format("%s expects %d argument(s), got %d",
                function.name().toLowerCase(Locale.ROOT), function.arity(), this.arguments.size()));
        }
    }

    public Function function() {
        return function;
    }

    public String functionName() {
        return function.name().toLowerCase(Locale.ROOT);
    }

    public List<Expression> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    @Override
    public List<Expression> children() {
        return arguments();
    }

    @Override
    public String toSQL() {
        List<String> args = new ArrayList<>();
        for (Expression arg : arguments) {
            args.add(arg.toSQL());
        }
        return functionName() + "(" + String.join(", ", args) + ")";
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunctionCall)) return false;
        FunctionCall that = (FunctionCall) obj;
        return function == that.function && Objects.equals(arguments, that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, arguments);
    }
}
