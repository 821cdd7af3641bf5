package com.gridsql.parser;

import com.gridsql.exception.SQLParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a statement into tokens.
 *
 * <p>Scanning runs over the output of {@link LiteralSanitizer}, so characters inside
 * quotes never produce structural tokens. Literal values are cut from the original
 * statement at the positions found in the masked text and passed through
 * {@link Unescaper}.
 *
 * <p>Bare A1 ranges such as {@code Sheet1!A:D} or {@code A2:C10} are recognized as a
 * single {@link TokenType#RANGE} token so the colon in them is not taken for a
 * {@code :table} reference.
 */
public final class Lexer {

    private static final Pattern RANGE_AT =
        Pattern.compile("([A-Za-z0-9_]+!)?([A-Za-z]+[0-9]*(:[A-Za-z]+[0-9]*)?)");

    private final String original;
    private final String masked;
    private int pos;

    public Lexer(String statement) {
        this.original = statement;
        this.masked = LiteralSanitizer.sanitize(statement);
    }

    /**
     * Tokenizes the statement. The last token is always {@link TokenType#EOF}.
     *
     * @return the tokens
     * @throws SQLParseException on an unterminated literal or an unexpected character
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        int n = masked.length();
        while (pos < n) {
            char c = masked.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '"' || c == '\'' || c == '`') {
                tokens.add(readQuoted(c));
            } else if (Character.isDigit(c) || (c == '.' && pos + 1 < n && Character.isDigit(masked.charAt(pos + 1)))) {
                tokens.add(readNumberOrRange());
            } else if (Character.isLetter(c) || c == '_') {
                tokens.add(readWordOrRange());
            } else if (c == ':') {
                tokens.add(readTableReference());
            } else {
                tokens.add(readSymbol(c));
            }
        }
        tokens.add(new Token(TokenType.EOF, "", n));
        return tokens;
    }

    private Token readQuoted(char quote) {
        int start = pos;
        int close = LiteralSanitizer.findClosingQuote(original, start);
        if (close < 0) {
            throw new SQLParseException("statement", start, String.valueOf(quote),
                "unterminated " + (quote == '`' ? "identifier" : "string literal"));
        }
        pos = close + 1;
        String body = original.substring(start + 1, close);
        if (quote == '`') {
            return new Token(TokenType.QUOTED_IDENTIFIER, body, start);
        }
        return new Token(TokenType.STRING, Unescaper.unescape(body, quote), start);
    }

    private Token readNumberOrRange() {
        Token range = tryRange();
        if (range != null) {
            return range;
        }
        int start = pos;
        int n = masked.length();
        while (pos < n && Character.isDigit(masked.charAt(pos))) pos++;
        if (pos < n && masked.charAt(pos) == '.') {
            pos++;
            while (pos < n && Character.isDigit(masked.charAt(pos))) pos++;
        }
        if (pos < n && (masked.charAt(pos) == 'e' || masked.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < n && (masked.charAt(pos) == '+' || masked.charAt(pos) == '-')) pos++;
            if (pos < n && Character.isDigit(masked.charAt(pos))) {
                while (pos < n && Character.isDigit(masked.charAt(pos))) pos++;
            } else {
                pos = mark;
            }
        }
        return new Token(TokenType.NUMBER, original.substring(start, pos), start);
    }

    private Token readWordOrRange() {
        Token range = tryRange();
        if (range != null) {
            return range;
        }
        int start = pos;
        int n = masked.length();
        while (pos < n && (Character.isLetterOrDigit(masked.charAt(pos)) || masked.charAt(pos) == '_')) {
            pos++;
        }
        return new Token(TokenType.IDENTIFIER, original.substring(start, pos), start);
    }

    /**
     * Reads an A1 range when one starts here and it is either sheet-qualified or
     * contains a colon; a lone {@code A} stays an identifier. Column letters of a
     * sheet-qualified range may be lower case and are upper-cased.
     */
    private Token tryRange() {
        Matcher m = RANGE_AT.matcher(masked);
        m.region(pos, masked.length());
        if (!m.lookingAt()) {
            return null;
        }
        if (m.group(1) == null && (m.group(3) == null || !m.group(2).equals(m.group(2).toUpperCase()))) {
            return null;
        }
        int end = m.end();
        if (end < masked.length()) {
            char next = masked.charAt(end);
            if (Character.isLetterOrDigit(next) || next == '_' || next == ':' || next == '!') {
                return null;
            }
        }
        int start = pos;
        pos = end;
        String sheet = m.group(1) == null ? "" : m.group(1);
        return new Token(TokenType.RANGE, sheet + m.group(2).toUpperCase(), start);
    }

    private Token readTableReference() {
        int start = pos;
        pos++;
        int n = masked.length();
        if (pos >= n || !(Character.isLetter(masked.charAt(pos)) || masked.charAt(pos) == '_')) {
            throw new SQLParseException("statement", start, ":", "expected a table name after ':'");
        }
        while (pos < n && (Character.isLetterOrDigit(masked.charAt(pos)) || masked.charAt(pos) == '_')) {
            pos++;
        }
        return new Token(TokenType.TABLE_REF, original.substring(start + 1, pos), start);
    }

    private Token readSymbol(char c) {
        int start = pos;
        char next = pos + 1 < masked.length() ? masked.charAt(pos + 1) : '\0';
        TokenType type;
        int length = 1;
        switch (c) {
            case ',' -> type = TokenType.COMMA;
            case '.' -> type = TokenType.DOT;
            case '(' -> type = TokenType.LPAREN;
            case ')' -> type = TokenType.RPAREN;
            case '*' -> type = TokenType.STAR;
            case '+' -> type = TokenType.PLUS;
            case '-' -> type = TokenType.MINUS;
            case '/' -> type = TokenType.SLASH;
            case ';' -> type = TokenType.SEMICOLON;
            case '=' -> {
                type = TokenType.EQ;
                if (next == '=') length = 2;
            }
            case '!' -> {
                if (next != '=') {
                    throw new SQLParseException("statement", start, "!",
                        "expected '!=' or a range such as Sheet1!A:D");
                }
                type = TokenType.NEQ;
                length = 2;
            }
            case '<' -> {
                if (next == '=') {
                    type = TokenType.LTE;
                    length = 2;
                } else if (next == '>') {
                    type = TokenType.NEQ;
                    length = 2;
                } else {
                    type = TokenType.LT;
                }
            }
            case '>' -> {
                if (next == '=') {
                    type = TokenType.GTE;
                    length = 2;
                } else {
                    type = TokenType.GT;
                }
            }
            default -> throw new SQLParseException("statement", start, String.valueOf(c),
                "unexpected character");
        }
        pos += length;
        return new Token(type, original.substring(start, pos), start);
    }
}
