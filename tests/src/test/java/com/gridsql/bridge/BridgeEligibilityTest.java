package com.gridsql.bridge;

import com.gridsql.config.EngineConfig;
import com.gridsql.parser.StatementParser;
import com.gridsql.statement.SelectStatement;
import com.gridsql.test.TestBase;
import com.gridsql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BridgeEligibility")
@Tag("bridge")
@Tag("tier1")
@TestCategories.Unit
public class BridgeEligibilityTest extends TestBase {

    private static Optional<String> check(String sql, EngineConfig config) {
        return BridgeEligibility.check((SelectStatement) StatementParser.parse(sql), config);
    }

    @Test
    @DisplayName("Single-range statements within the dialect are eligible")
    void testEligible() {
        assertThat(check("SELECT A, SUM(C) WHERE B > 1 GROUP BY A ORDER BY A DESC LIMIT 3", fixedConfig())).isEmpty();
        assertThat(check("SELECT *", fixedConfig())).isEmpty();
        assertThat(check("SELECT A, MAX(C) AS top GROUP BY A ORDER BY top", fixedConfig())).isEmpty();
        assertThat(check("SELECT A WHERE B contains 'x' LABEL A 'Name' FORMAT A '0'", fixedConfig())).isEmpty();
    }

    @Test
    @DisplayName("Disabled configuration keeps everything local")
    void testDisabled() {
        EngineConfig config = fixedConfig().toBuilder().bridgeEnabled(false).build();

        assertThat(check("SELECT A", config)).contains("native dialect disabled");
    }

    @ParameterizedTest(name = "{0}")
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
        "SELECT * FROM :t | virtual table source",
        "SELECT x.A FROM Sheet1!A:C x JOIN Sheet2!A:B y ON x.A = y.A | JOIN",
        "SELECT DISTINCT A | DISTINCT",
        "SELECT A, SUM(C) GROUP BY A HAVING SUM(C) > 1 | HAVING",
        "SELECT SUM(C) * 2 | aggregate inside an expression",
        "SELECT *, A | '*' combined with other SELECT items",
        "SELECT A GROUP BY A ORDER BY SUM(C) | ORDER BY on an aggregate that is not selected",
        "SELECT COUNT(*) | COUNT(*)",
        "SELECT COUNT(DISTINCT A) | DISTINCT aggregate",
        "SELECT SUM(B * 2) | expression inside an aggregate",
        "SELECT A WHERE B = null | null literal"
    })
    @DisplayName("Statements outside the dialect name the reason")
    void testIneligible(String sql, String reason) {
        assertThat(check(sql, fixedConfig())).contains(reason);
    }

    @Test
    @DisplayName("A literal holding both quote characters cannot be sent")
    void testUnquotableLiteral() {
        assertThat(check("SELECT A WHERE B = 'it''s \"x\"'", fixedConfig()))
            .contains("literal containing both quote characters");
    }
}
