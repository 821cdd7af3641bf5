package com.gridsql.parser;

import com.gridsql.exception.SQLParseException;
import com.gridsql.test.TestBase;
import com.gridsql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

@DisplayName("Lexer")
@Tag("parser")
@Tag("tier1")
@TestCategories.Unit
public class LexerTest extends TestBase {

    private static List<TokenType> types(String statement) {
        return new Lexer(statement).tokenize().stream().map(Token::type).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Tokenizes a simple SELECT")
    void testSimpleSelect() {
        List<TokenType> types = types("SELECT A, SUM(B) FROM :data WHERE C >= 10");

        assertThat(types).containsExactly(
            TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.COMMA, TokenType.IDENTIFIER,
            TokenType.LPAREN, TokenType.IDENTIFIER, TokenType.RPAREN, TokenType.IDENTIFIER,
            TokenType.TABLE_REF, TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.GTE,
            TokenType.NUMBER, TokenType.EOF);
    }

    @Test
    @DisplayName("Recognizes A1 ranges as one token")
    void testRanges() {
        List<Token> tokens = new Lexer("SELECT A FROM Sheet1!A:D").tokenize();

        Token range = tokens.get(3);
        assertThat(range.type()).isEqualTo(TokenType.RANGE);
        assertThat(range.text()).isEqualTo("Sheet1!A:D");
        assertThat(new Lexer("FROM A2:C10").tokenize().get(1).type()).isEqualTo(TokenType.RANGE);
    }

    @Test
    @DisplayName("Sheet-qualified ranges accept lower-case columns and upper-case them")
    void testLowerCaseSheetRange() {
        Token range = new Lexer("FROM Sheet1!a:d").tokenize().get(1);

        assertThat(range.type()).isEqualTo(TokenType.RANGE);
        assertThat(range.text()).isEqualTo("Sheet1!A:D");
        assertThat(new Lexer("FROM data!b2:c10").tokenize().get(1).text()).isEqualTo("data!B2:C10");
        assertThat(types("FROM :t")).containsExactly(TokenType.IDENTIFIER, TokenType.TABLE_REF, TokenType.EOF);
    }

    @Test
    @DisplayName("A stray '!' names both readings it could have had")
    void testStrayBang() {
        SQLParseException error = catchThrowableOfType(
            () -> new Lexer("SELECT A ! B").tokenize(), SQLParseException.class);

        assertThat(error).isNotNull();
        assertThat(error.getMessage()).contains("'!='").contains("range");
    }

    @Test
    @DisplayName("A lone column letter stays an identifier")
    void testLoneLetter() {
        assertThat(new Lexer("B2").tokenize().get(0).type()).isEqualTo(TokenType.IDENTIFIER);
    }

    @Test
    @DisplayName("String values are unescaped")
    void testStringValue() {
        Token token = new Lexer("\"line\\none\"").tokenize().get(0);

        assertThat(token.type()).isEqualTo(TokenType.STRING);
        assertThat(token.text()).isEqualTo("line\none");
        assertThat(token.position()).isZero();
    }

    @Test
    @DisplayName("A colon inside a literal is not a table reference")
    void testColonInLiteral() {
        assertThat(types("A = ':x'")).doesNotContain(TokenType.TABLE_REF);
    }

    @Test
    @DisplayName("Both spellings of not-equal produce NEQ")
    void testNotEqual() {
        assertThat(types("A != 1")).contains(TokenType.NEQ);
        assertThat(types("A <> 1")).contains(TokenType.NEQ);
    }

    @Test
    @DisplayName("Unterminated literals are rejected")
    void testUnterminated() {
        SQLParseException e = catchThrowableOfType(
            () -> new Lexer("SELECT A WHERE B = 'open").tokenize(), SQLParseException.class);

        assertThat(e).hasMessageContaining("unterminated string literal");
        assertThat(e.getPosition()).isEqualTo(19);
    }

    @Test
    @DisplayName("Unexpected characters are rejected")
    void testUnexpectedCharacter() {
        assertThatThrownBy(() -> new Lexer("SELECT A # B").tokenize())
            .isInstanceOf(SQLParseException.class)
            .hasMessageContaining("unexpected character");
    }
}
