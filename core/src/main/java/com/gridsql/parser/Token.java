package com.gridsql.parser;

import java.util.Locale;

/**
 * A lexical token with its position in the original statement.
 *
 * <p>For {@link TokenType#STRING} and {@link TokenType#QUOTED_IDENTIFIER} the text is the
 * unescaped value; for every other type it is the source text.
 */
public final class Token {

    private final TokenType type;
    private final String text;
    private final int position;

    public Token(TokenType type, String text, int position) {
        this.type = type;
        this.text = text;
        this.position = position;
    }

    public TokenType type() {
        return type;
    }

    public String text() {
        return text;
    }

    public int position() {
        return position;
    }

    /**
     * Returns whether this token is the given keyword (case-insensitive).
     *
     * @param keyword the keyword, upper case
     * @return true for an identifier spelling the keyword
     */
    public boolean isKeyword(String keyword) {
        return type == TokenType.IDENTIFIER && text.toUpperCase(Locale.ROOT).equals(keyword);
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    @Override
    public String toString() {
        return type == TokenType.EOF ? "end of statement" : text;
    }
}
