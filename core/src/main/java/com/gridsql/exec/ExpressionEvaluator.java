package com.gridsql.exec;

import com.gridsql.config.EngineConfig;
import com.gridsql.expression.AggregateExpression;
import com.gridsql.expression.BinaryExpression;
import com.gridsql.expression.ColumnReference;
import com.gridsql.expression.Expression;
import com.gridsql.expression.FunctionCall;
import com.gridsql.expression.Literal;
import com.gridsql.expression.StarExpression;
import com.gridsql.expression.UnaryExpression;
import com.gridsql.types.BooleanValue;
import com.gridsql.types.CellValue;
import com.gridsql.types.DateValue;
import com.gridsql.types.NullValue;
import com.gridsql.types.NumberValue;
import com.gridsql.types.StringValue;
import com.gridsql.types.TypeCoercion;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates expression trees against a {@link RowContext}.
 *
 * <p>Evaluation never fails on data: incompatible types, non-numeric arithmetic,
 * division by zero and malformed patterns produce Null or false, so a WHERE clause
 * simply does not match the row. Predicates use three-valued logic where Null is
 * "unknown"; {@link #test} treats unknown as no match.
 *
 * <p>{@code TODAY()} and {@code NOW()} are fixed when the evaluator is created, so every
 * row of a statement sees the same instant.
 */
public final class ExpressionEvaluator {

    private final LocalDateTime now;
    private final Map<String, Pattern> patternCache = new HashMap<>();

    public ExpressionEvaluator(EngineConfig config) {
        this.now = LocalDateTime.now(config.clock());
    }

    /**
     * Returns the evaluation date used for {@code TODAY()}.
     *
     * @return today's date in the configured zone
     */
    public LocalDate today() {
        return now.toLocalDate();
    }

    /**
     * Evaluates a predicate.
     *
     * @param predicate the predicate (null always matches)
     * @param ctx the row
     * @return true only when the predicate is true
     */
    public boolean test(Expression predicate, RowContext ctx) {
        if (predicate == null) {
            return true;
        }
        Optional<Boolean> result = TypeCoercion.asBoolean(evaluate(predicate, ctx));
        return result.orElse(Boolean.FALSE);
    }

    /**
     * Evaluates an expression.
     *
     * @param expr the expression
     * @param ctx the row
     * @return the value
     */
    public CellValue evaluate(Expression expr, RowContext ctx) {
        if (expr instanceof Literal literal) {
            return literal.value();
        } else if (expr instanceof ColumnReference ref) {
            return ctx.column(ref);
        } else if (expr instanceof AggregateExpression aggregate) {
            return ctx.aggregate(aggregate);
        } else if (expr instanceof BinaryExpression binary) {
            return evaluateBinary(binary, ctx);
        } else if (expr instanceof UnaryExpression unary) {
            return evaluateUnary(unary, ctx);
        } else if (expr instanceof FunctionCall call) {
            return evaluateFunction(call, ctx);
        } else if (expr instanceof StarExpression) {
            throw new IllegalArgumentException("'*' is only valid as a SELECT item");
        }
        throw new UnsupportedOperationException(
            "Unsupported expression type: " + expr.getClass().getSimpleName());
    }

    // ==================== Binary ====================

    private CellValue evaluateBinary(BinaryExpression binary, RowContext ctx) {
        BinaryExpression.Operator op = binary.operator();
        if (op.isLogical()) {
            return evaluateLogical(binary, ctx);
        }
        CellValue left = evaluate(binary.left(), ctx);
        CellValue right = evaluate(binary.right(), ctx);
        if (op.isArithmetic()) {
            return arithmetic(op, left, right);
        }
        if (op.isComparison()) {
            return BooleanValue.of(compare(op, left, right));
        }
        return BooleanValue.of(stringMatch(op, left, right));
    }

    private CellValue evaluateLogical(BinaryExpression binary, RowContext ctx) {
        Optional<Boolean> left = TypeCoercion.asBoolean(evaluate(binary.left(), ctx));
        if (binary.operator() == BinaryExpression.Operator.AND) {
            if (left.isPresent() && !left.get()) {
                return BooleanValue.FALSE;
            }
            Optional<Boolean> right = TypeCoercion.asBoolean(evaluate(binary.right(), ctx));
            if (right.isPresent() && !right.get()) {
                return BooleanValue.FALSE;
            }
            return left.isPresent() && right.isPresent() ? BooleanValue.TRUE : NullValue.get();
        }
        if (left.isPresent() && left.get()) {
            return BooleanValue.TRUE;
        }
        Optional<Boolean> right = TypeCoercion.asBoolean(evaluate(binary.right(), ctx));
        if (right.isPresent() && right.get()) {
            return BooleanValue.TRUE;
        }
        return left.isPresent() && right.isPresent() ? BooleanValue.FALSE : NullValue.get();
    }

    private static CellValue arithmetic(BinaryExpression.Operator op, CellValue left, CellValue right) {
        OptionalDouble a = TypeCoercion.asNumber(left);
        OptionalDouble b = TypeCoercion.asNumber(right);
        if (a.isEmpty() || b.isEmpty()) {
            return NullValue.get();
        }
        double x = a.getAsDouble();
        double y = b.getAsDouble();
        double result;
        switch (op) {
            case ADD -> result = x + y;
            case SUBTRACT -> result = x - y;
            case MULTIPLY -> result = x * y;
            case DIVIDE -> {
                if (y == 0) {
                    return NullValue.get();
                }
                result = x / y;
            }
            default -> throw new IllegalArgumentException("Not an arithmetic operator: " + op);
        }
        return new NumberValue(result);
    }

    private static boolean compare(BinaryExpression.Operator op, CellValue left, CellValue right) {
        switch (op) {
            case EQUAL:
                return CellValueComparator.valuesEqual(left, right);
            case NOT_EQUAL:
                if (left.isNull() && right.isNull()) {
                    return false;
                }
                return left.isNull() || right.isNull() || !CellValueComparator.valuesEqual(left, right);
            default:
                break;
        }
        OptionalInt cmp = CellValueComparator.compareForPredicate(left, right);
        if (cmp.isEmpty()) {
            return false;
        }
        int c = cmp.getAsInt();
        return switch (op) {
            case LESS_THAN -> c < 0;
            case LESS_THAN_OR_EQUAL -> c <= 0;
            case GREATER_THAN -> c > 0;
            case GREATER_THAN_OR_EQUAL -> c >= 0;
            default -> throw new IllegalArgumentException("Not a comparison operator: " + op);
        };
    }

    private boolean stringMatch(BinaryExpression.Operator op, CellValue left, CellValue right) {
        if (left.isNull() || right.isNull()) {
            return false;
        }
        String text = left.asText();
        String pattern = right.asText();
        if (op == BinaryExpression.Operator.MATCHES) {
            Pattern regex = compile("re:" + pattern, pattern, 0);
            return regex != null && regex.matcher(text).matches();
        }
        String lowerText = text.toLowerCase(Locale.ROOT);
        String lowerPattern = pattern.toLowerCase(Locale.ROOT);
        return switch (op) {
            case CONTAINS -> lowerText.contains(lowerPattern);
            case STARTS_WITH -> lowerText.startsWith(lowerPattern);
            case ENDS_WITH -> lowerText.endsWith(lowerPattern);
            case LIKE -> {
                Pattern like = compile("like:" + pattern, likeToRegex(pattern),
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
                yield like != null && like.matcher(text).matches();
            }
            default -> throw new IllegalArgumentException("Not a string operator: " + op);
        };
    }

    private Pattern compile(String key, String regex, int flags) {
        if (patternCache.containsKey(key)) {
            return patternCache.get(key);
        }
        Pattern compiled;
        try {
            compiled = Pattern.compile(regex, flags);
        } catch (PatternSyntaxException e) {
            compiled = null;
        }
        patternCache.put(key, compiled);
        return compiled;
    }

    /**
     * Converts a LIKE pattern to a regular expression: {@code %} is any run of
     * characters, {@code _} exactly one.
     *
     * @param like the LIKE pattern
     * @return the equivalent regex
     */
    static String likeToRegex(String like) {
        StringBuilder sb = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : like.toCharArray()) {
            if (c == '%' || c == '_') {
                if (literal.length() > 0) {
                    sb.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                sb.append(c == '%' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            sb.append(Pattern.quote(literal.toString()));
        }
        return sb.toString();
    }

    // ==================== Unary ====================

    private CellValue evaluateUnary(UnaryExpression unary, RowContext ctx) {
        CellValue value = evaluate(unary.operand(), ctx);
        switch (unary.operator()) {
            case NEGATE: {
                OptionalDouble n = TypeCoercion.asNumber(value);
                return n.isPresent() ? new NumberValue(-n.getAsDouble()) : NullValue.get();
            }
            case NOT: {
                Optional<Boolean> b = TypeCoercion.asBoolean(value);
                return b.isPresent() ? BooleanValue.of(!b.get()) : NullValue.get();
            }
            case IS_NULL:
                return BooleanValue.of(isNullLike(value, ctx));
            case IS_NOT_NULL:
                return BooleanValue.of(!isNullLike(value, ctx));
            default:
                throw new IllegalArgumentException("Unknown unary operator: " + unary.operator());
        }
    }

    private static boolean isNullLike(CellValue value, RowContext ctx) {
        if (value.isNull()) {
            return true;
        }
        return ctx.emptyStringIsNull() && value instanceof StringValue s && s.isEmpty();
    }

    // ==================== Functions ====================

    private CellValue evaluateFunction(FunctionCall call, RowContext ctx) {
        switch (call.function()) {
            case TODAY:
                return DateValue.ofDate(now.toLocalDate());
            case NOW:
                return DateValue.ofDateTime(now);
            default:
                break;
        }
        CellValue arg = evaluate(call.arguments().get(0), ctx);
        if (arg.isNull()) {
            return NullValue.get();
        }
        return switch (call.function()) {
            case LOWER -> new StringValue(arg.asText().toLowerCase(Locale.ROOT));
            case UPPER -> new StringValue(arg.asText().toUpperCase(Locale.ROOT));
            case YEAR -> TypeCoercion.asDateTime(arg)
                .<CellValue>map(d -> new NumberValue(d.getYear()))
                .orElse(NullValue.get());
            default -> throw new IllegalArgumentException("Unknown function: " + call.functionName());
        };
    }
}
