package com.gridsql.bridge;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Utilities for quoting identifiers and literals in the grid's native query dialect.
 *
 * <p>The dialect has no escape sequences: a string literal is delimited by either single
 * or double quotes and simply may not contain its own delimiter. Identifiers are column
 * letters, quoted with back-quotes when they are anything else or read as a keyword.
 *
 * <p>Example usage:
 * <pre>
 *   NativeQuoting.quoteLiteral("O'Reilly");
 *   // Result: "O'Reilly"
 *
 *   NativeQuoting.quoteLiteral("say \"hi\"");
 *   // Result: 'say "hi"'
 *
 *   NativeQuoting.quoteIdentifierIfNeeded("B");
 *   // Result: B
 * </pre>
 *
 * @see NativeQueryGenerator
 */
public final class NativeQuoting {

    private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");

    // Column letters such as AND or BY collide with dialect keywords
    private static final Set<String> KEYWORDS = Set.of(
        "and", "or", "not", "by", "as", "asc", "desc", "is", "null", "true", "false",
        "date", "datetime", "timestamp", "timeofday", "like", "contains", "matches",
        "starts", "ends", "with", "select", "where", "group", "pivot", "order", "limit",
        "offset", "label", "format", "options");

    private NativeQuoting() {}

    /**
     * Returns whether a string can be written as a native literal at all.
     *
     * @param value the string
     * @return false when it contains both quote characters
     */
    public static boolean canQuote(String value) {
        return value.indexOf('"') < 0 || value.indexOf('\'') < 0;
    }

    /**
     * Quotes a string literal, preferring double quotes.
     *
     * @param value the string value
     * @return the quoted literal
     * @throws IllegalArgumentException if the value contains both quote characters
     */
    public static String quoteLiteral(String value) {
        if (value == null) {
            return "null";
        }
        if (value.indexOf('"') < 0) {
            return "\"" + value + "\"";
        }
        if (value.indexOf('\'') < 0) {
            return "'" + value + "'";
        }
        throw new IllegalArgumentException(
            "Literal contains both quote characters and cannot be expressed natively: " + value);
    }

    /**
     * Quotes an identifier with back-quotes unless it is a plain word.
     *
     * @param identifier the column id
     * @return the identifier, quoted if necessary
     * @throws IllegalArgumentException if identifier is null, empty or contains a back-quote
     */
    public static String quoteIdentifierIfNeeded(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        if (PLAIN_IDENTIFIER.matcher(identifier).matches()
                && !KEYWORDS.contains(identifier.toLowerCase(Locale.ROOT))) {
            return identifier;
        }
        if (identifier.indexOf('`') >= 0) {
            throw new IllegalArgumentException("Identifier cannot contain a back-quote: " + identifier);
        }
        return "`" + identifier + "`";
    }
}
