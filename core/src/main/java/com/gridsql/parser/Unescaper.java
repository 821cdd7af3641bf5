package com.gridsql.parser;

/**
 * Resolves the escape sequences of a quoted literal body into its real value.
 *
 * <p>{@code \t}, {@code \n}, {@code \r}, {@code \\}, {@code \"} and {@code \'} become the
 * characters they name, and a doubled quote of the enclosing kind becomes one quote. A
 * backslash before any other character is kept as-is.
 */
public final class Unescaper {

    private Unescaper() {}

    /**
     * Unescapes a literal body.
     *
     * @param body the text between the quotes, as written
     * @param quote the enclosing quote character
     * @return the literal value
     */
    public static String unescape(String body, char quote) {
        if (body.indexOf('\\') < 0 && body.indexOf(quote) < 0) {
            return body;
        }
        StringBuilder sb = new StringBuilder(body.length());
        int n = body.length();
        for (int i = 0; i < n; i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < n && LiteralSanitizer.isEscapable(body.charAt(i + 1))) {
                char next = body.charAt(++i);
                switch (next) {
                    case 't' -> sb.append('\t');
                    case 'n' -> sb.append('\n');
                    case 'r' -> sb.append('\r');
                    default -> sb.append(next);
                }
            } else if (c == quote && i + 1 < n && body.charAt(i + 1) == quote) {
                sb.append(quote);
                i++;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
