package com.gridsql.parser;

/**
 * Masks the interiors of quoted literals so structural scanning never sees them.
 *
 * <p>The returned string has the same length as the input. Quote characters that open
 * and close a literal are kept; every character between them is replaced by
 * {@link #PLACEHOLDER}. Keyword and {@code :table} detection run over the masked text,
 * while literal values are always read from the original text at the same positions
 * (see {@link Unescaper}).
 *
 * <p>Recognized inside single- and double-quoted literals:
 * <ul>
 *   <li>the escape pairs {@code \t \n \r \\ \" \'}</li>
 *   <li>a doubled quote ({@code ""} inside {@code "..."}, {@code ''} inside {@code '...'})</li>
 * </ul>
 * Back-quoted identifiers are masked as well but have no escapes.
 *
 * <p>Example:
 * <pre>
 *   sanitize("SELECT * WHERE A = \":x\" FROM :data")
 *   // -> "SELECT * WHERE A = \"__\" FROM :data"
 * </pre>
 */
public final class LiteralSanitizer {

    /** Character that replaces literal interiors. */
    public static final char PLACEHOLDER = '_';

    private LiteralSanitizer() {}

    /**
     * Masks the interiors of all quoted literals.
     *
     * <p>An unterminated literal is masked up to the end of the input; the lexer
     * reports it.
     *
     * @param statement the raw statement
     * @return the masked statement, same length as the input
     */
    public static String sanitize(String statement) {
        char[] out = statement.toCharArray();
        int i = 0;
        int n = out.length;
        while (i < n) {
            char c = statement.charAt(i);
            if (c != '"' && c != '\'' && c != '`') {
                i++;
                continue;
            }
            int close = findClosingQuote(statement, i);
            int end = close < 0 ? n : close;
            for (int k = i + 1; k < end; k++) {
                out[k] = PLACEHOLDER;
            }
            i = close < 0 ? n : close + 1;
        }
        return new String(out);
    }

    /**
     * Finds the quote that closes the literal opened at {@code open}.
     *
     * @param statement the raw statement
     * @param open index of the opening quote
     * @return index of the closing quote, or -1 when the literal is unterminated
     */
    public static int findClosingQuote(String statement, int open) {
        char quote = statement.charAt(open);
        int n = statement.length();
        int i = open + 1;
        while (i < n) {
            char c = statement.charAt(i);
            if (quote != '`' && c == '\\' && i + 1 < n && isEscapable(statement.charAt(i + 1))) {
                i += 2;
                continue;
            }
            if (c == quote) {
                if (quote != '`' && i + 1 < n && statement.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i;
            }
            i++;
        }
        return -1;
    }

    static boolean isEscapable(char c) {
        return c == 't' || c == 'n' || c == 'r' || c == '\\' || c == '"' || c == '\'';
    }
}
