package com.gridsql.parser;

import com.gridsql.test.TestBase;
import com.gridsql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Unescaper")
@Tag("parser")
@Tag("tier1")
@TestCategories.Unit
public class UnescaperTest extends TestBase {

    @Test
    @DisplayName("Control escapes become control characters")
    void testControlEscapes() {
        assertThat(Unescaper.unescape("a\\tb\\nc\\rd", '"')).isEqualTo("a\tb\nc\rd");
    }

    @Test
    @DisplayName("Escaped quotes and backslashes become themselves")
    void testQuoteEscapes() {
        assertThat(Unescaper.unescape("O\\\"Brien", '"')).isEqualTo("O\"Brien");
        assertThat(Unescaper.unescape("it\\'s", '"')).isEqualTo("it's");
        assertThat(Unescaper.unescape("a\\\\b", '\'')).isEqualTo("a\\b");
    }

    @Test
    @DisplayName("A doubled quote of the enclosing kind becomes one quote")
    void testDoubledQuote() {
        assertThat(Unescaper.unescape("it''s", '\'')).isEqualTo("it's");
        assertThat(Unescaper.unescape("say \"\"hi\"\"", '"')).isEqualTo("say \"hi\"");
    }

    @Test
    @DisplayName("A backslash before other characters is kept")
    void testUnknownEscapeKept() {
        assertThat(Unescaper.unescape("C:\\path", '"')).isEqualTo("C:\\path");
    }

    @Test
    @DisplayName("Plain text is returned unchanged")
    void testPlain() {
        String body = "nothing to do";
        assertThat(Unescaper.unescape(body, '"')).isSameAs(body);
    }
}
