package com.gridsql.parser;

/**
 * Lexical token kinds. Keywords are plain identifiers matched case-insensitively by the
 * parser.
 */
public enum TokenType {
    IDENTIFIER,
    QUOTED_IDENTIFIER,
    STRING,
    NUMBER,
    TABLE_REF,
    RANGE,
    COMMA,
    DOT,
    LPAREN,
    RPAREN,
    STAR,
    PLUS,
    MINUS,
    SLASH,
    EQ,
    NEQ,
    LT,
    LTE,
    GT,
    GTE,
    SEMICOLON,
    EOF
}
