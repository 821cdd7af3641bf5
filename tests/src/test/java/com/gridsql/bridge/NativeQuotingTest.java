package com.gridsql.bridge;

import com.gridsql.test.TestBase;
import com.gridsql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("NativeQuoting")
@Tag("bridge")
@Tag("tier1")
@TestCategories.Unit
public class NativeQuotingTest extends TestBase {

    @Test
    @DisplayName("Literals prefer double quotes and fall back to single quotes")
    void testQuoteLiteral() {
        assertThat(NativeQuoting.quoteLiteral("O'Reilly")).isEqualTo("\"O'Reilly\"");
        assertThat(NativeQuoting.quoteLiteral("say \"hi\"")).isEqualTo("'say \"hi\"'");
        assertThat(NativeQuoting.canQuote("it's \"x\"")).isFalse();
        assertThatThrownBy(() -> NativeQuoting.quoteLiteral("it's \"x\""))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Column letters that read as keywords are back-quoted")
    void testQuoteIdentifier() {
        assertThat(NativeQuoting.quoteIdentifierIfNeeded("B")).isEqualTo("B");
        assertThat(NativeQuoting.quoteIdentifierIfNeeded("AB")).isEqualTo("AB");
        assertThat(NativeQuoting.quoteIdentifierIfNeeded("BY")).isEqualTo("`BY`");
        assertThat(NativeQuoting.quoteIdentifierIfNeeded("AND")).isEqualTo("`AND`");
        assertThat(NativeQuoting.quoteIdentifierIfNeeded("My Column")).isEqualTo("`My Column`");
    }
}
