package com.gridsql.exception;

/**
 * Exception thrown when a statement does not parse.
 *
 * <p>Carries the clause that failed (for example "WHERE" or "VALUES"), the character
 * position in the original statement and the offending token, so callers can point at
 * the exact spot. No part of a statement that fails to parse is ever executed.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       Statement stmt = StatementParser.parse("SELECT A WHERE");
 *   } catch (SQLParseException e) {
 *       System.err.println(e.getUserMessage());
 *       System.err.println("Clause: " + e.getClause());
 *   }
 * </pre>
 *
 * @see com.gridsql.parser.StatementParser
 */
public class SQLParseException extends RuntimeException {

    private final String clause;
    private final int position;
    private final String token;

    /**
     * Creates a parse exception.
     *
     * @param clause the clause being parsed (e.g. "SELECT", "WHERE")
     * @param position the zero-based character position, or -1 if unknown
     * @param token the offending token text (may be empty at end of input)
     * @param detail what was expected
     */
    public SQLParseException(String clause, int position, String token, String detail) {
        super(buildMessage(clause, position, token, detail));
        this.clause = clause;
        this.position = position;
        this.token = token;
    }

    private static String buildMessage(String clause, int position, String token, String detail) {
        StringBuilder sb = new StringBuilder("Invalid syntax");
        if (clause != null && !clause.isEmpty()) {
            sb.append(" in ").append(clause).append(" clause");
        }
        if (position >= 0) {
            sb.append(" at position ").append(position);
        }
        if (token != null && !token.isEmpty()) {
            sb.append(" near '").append(token).append("'");
        }
        sb.append(": ").append(detail);
        return sb.toString();
    }

    /**
     * Returns the clause that failed to parse.
     *
     * @return the clause name
     */
    public String getClause() {
        return clause;
    }

    /**
     * Returns the character position of the error.
     *
     * @return the position, or -1 if unknown
     */
    public int getPosition() {
        return position;
    }

    /**
     * Returns the offending token.
     *
     * @return the token text, empty at end of input
     */
    public String getToken() {
        return token;
    }

    /**
     * Returns a user-friendly error message.
     *
     * @return message with guidance on the supported grammar
     */
    public String getUserMessage() {
        return getMessage() + ". Supported statements: SELECT, INSERT VALUES, UPDATE SET ... WHERE, DELETE WHERE.";
    }
}
