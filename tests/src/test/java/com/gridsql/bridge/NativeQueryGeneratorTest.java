package com.gridsql.bridge;

import com.gridsql.parser.StatementParser;
import com.gridsql.statement.SelectStatement;
import com.gridsql.test.TestBase;
import com.gridsql.test.TestCategories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for translation into the native query dialect.
 */
@DisplayName("NativeQueryGenerator")
@Tag("bridge")
@Tag("tier1")
@TestCategories.Unit
public class NativeQueryGeneratorTest extends TestBase {

    private NativeQueryGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new NativeQueryGenerator(LocalDate.of(2024, 3, 15));
    }

    private String generate(String sql) {
        String query = generator.generate((SelectStatement) StatementParser.parse(sql));
        logData(sql, query);
        return query;
    }

    @Nested
    @DisplayName("Clauses")
    class Clauses {

        @Test
        @DisplayName("Select, where and group by")
        void testBasicClauses() {
            assertThat(generate("SELECT A, SUM(C) WHERE B = 'active' GROUP BY A"))
                .isEqualTo("select A, sum(C) where B = \"active\" group by A");
        }

        @Test
        @DisplayName("Clauses come out in dialect order whatever the input order")
        void testClauseOrder() {
            assertThat(generate("SELECT A LIMIT 10 ORDER BY B WHERE C > 2 OFFSET 20"))
                .isEqualTo("select A where C > 2 order by B asc limit 10 offset 20");
        }

        @Test
        @DisplayName("A zero OFFSET is omitted")
        void testZeroOffset() {
            assertThat(generate("SELECT * OFFSET 0")).isEqualTo("select *");
        }

        @Test
        @DisplayName("Aliases become labels and ORDER BY an alias uses the expression")
        void testAliases() {
            assertThat(generate("SELECT A, SUM(C) AS total GROUP BY A ORDER BY total DESC LIMIT 5"))
                .isEqualTo("select A, sum(C) group by A order by sum(C) desc limit 5 label sum(C) \"total\"");
        }

        @Test
        @DisplayName("Explicit labels come before alias labels, formats last")
        void testLabelAndFormat() {
            assertThat(generate("SELECT A, B AS amount, C LABEL C 'Cost' FORMAT amount '#,##0.00'"))
                .isEqualTo("select A, B, C label C \"Cost\", B \"amount\" format B \"#,##0.00\"");
        }

        @Test
        @DisplayName("PIVOT is passed through")
        void testPivot() {
            assertThat(generate("SELECT A, SUM(C) GROUP BY A PIVOT B"))
                .isEqualTo("select A, sum(C) group by A pivot B");
        }
    }

    @Nested
    @DisplayName("Expressions")
    class Expressions {

        @Test
        @DisplayName("String operators compare lower-cased text")
        void testStringOperators() {
            assertThat(generate("SELECT A WHERE B contains 'ABC' AND C starts with 'X'"))
                .isEqualTo("select A where (lower(B) contains \"abc\" and lower(C) starts with \"x\")");
            assertThat(generate("SELECT A WHERE B like 'Al%'"))
                .isEqualTo("select A where lower(B) like \"al%\"");
        }

        @Test
        @DisplayName("matches keeps its case")
        void testMatches() {
            assertThat(generate("SELECT A WHERE B matches 'Al.*'"))
                .isEqualTo("select A where B matches \"Al.*\"");
        }

        @Test
        @DisplayName("Date literals and TODAY() become native date literals")
        void testDates() {
            assertThat(generate("SELECT A WHERE D > date '2024-01-31' AND D <= TODAY()"))
                .isEqualTo("select A where (D > date \"2024-01-31\" and D <= date \"2024-03-15\")");
        }

        @Test
        @DisplayName("Arithmetic, negation and NOT are parenthesized")
        void testArithmetic() {
            assertThat(generate("SELECT -B, B * 2 + 1 WHERE NOT (B = 1)"))
                .isEqualTo("select (0 - B), ((B * 2) + 1) where not (B = 1)");
        }

        @Test
        @DisplayName("Literals with double quotes use single quotes")
        void testQuoting() {
            assertThat(generate("SELECT A WHERE B = 'say \"hi\"' OR B = \"it's\""))
                .isEqualTo("select A where (B = 'say \"hi\"' or B = \"it's\")");
        }

        @Test
        @DisplayName("Scalar functions and null tests")
        void testFunctions() {
            assertThat(generate("SELECT UPPER(A), YEAR(D) WHERE B IS NOT NULL"))
                .isEqualTo("select upper(A), year(D) where B is not null");
        }
    }
}
