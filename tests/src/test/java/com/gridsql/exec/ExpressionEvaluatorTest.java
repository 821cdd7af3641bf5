package com.gridsql.exec;

import com.gridsql.config.EngineConfig;
import com.gridsql.expression.Expression;
import com.gridsql.parser.StatementParser;
import com.gridsql.statement.SelectStatement;
import com.gridsql.statement.VirtualTableRef;
import com.gridsql.table.Table;
import com.gridsql.table.TableResolver;
import com.gridsql.table.VirtualTableSet;
import com.gridsql.test.TestBase;
import com.gridsql.test.TestCategories;
import com.gridsql.types.BooleanValue;
import com.gridsql.types.CellValue;
import com.gridsql.types.DateValue;
import com.gridsql.types.NullValue;
import com.gridsql.types.NumberValue;
import com.gridsql.types.StringValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for expression evaluation against one row.
 */
@DisplayName("ExpressionEvaluator")
@Tag("exec")
@Tag("tier1")
@TestCategories.Unit
public class ExpressionEvaluatorTest extends TestBase {

    private ExpressionEvaluator evaluator;
    private TableRowContext row;

    @BeforeEach
    void setUp() {
        evaluator = new ExpressionEvaluator(fixedConfig());
        row = rowOf(fixedConfig());
    }

    private TableRowContext rowOf(EngineConfig config) {
        VirtualTableSet tables = new VirtualTableSet(Map.of("t", table(
            row("Name", "Amount", "Joined", "Flag", "Note", "Code", "Extra"),
            row("Alice", 100, "2024-01-15", true, "", "42", null))));
        Table table = new TableResolver(config, null, tables, null).resolve(new VirtualTableRef("t", null));
        return new TableRowContext(table, table.rows().get(0));
    }

    private static Expression expr(String text) {
        return ((SelectStatement) StatementParser.parse("SELECT " + text)).projections().get(0).expression();
    }

    private CellValue eval(String text) {
        return evaluator.evaluate(expr(text), row);
    }

    private boolean test(String text) {
        return evaluator.test(expr(text), row);
    }

    @Nested
    @DisplayName("Arithmetic")
    class Arithmetic {

        @Test
        @DisplayName("Computes with numbers")
        void testNumbers() {
            assertThat(eval("Amount * 2 + 1")).isEqualTo(new NumberValue(201));
            assertThat(eval("Amount / 8")).isEqualTo(new NumberValue(12.5));
            assertThat(eval("-Amount")).isEqualTo(new NumberValue(-100));
        }

        @Test
        @DisplayName("Numeric-like strings take part in arithmetic")
        void testNumericStrings() {
            assertThat(eval("Code + 1")).isEqualTo(new NumberValue(43));
        }

        @Test
        @DisplayName("Division by zero and non-numeric operands give Null")
        void testNullResults() {
            assertThat(eval("Amount / 0")).isEqualTo(NullValue.get());
            assertThat(eval("Name + 1")).isEqualTo(NullValue.get());
            assertThat(eval("Extra * 3")).isEqualTo(NullValue.get());
        }
    }

    @Nested
    @DisplayName("Comparison")
    class Comparison {

        @Test
        @DisplayName("Compares numbers, numeric strings and dates")
        void testTypedComparison() {
            assertThat(test("Amount > 50")).isTrue();
            assertThat(test("Code = 42")).isTrue();
            assertThat(test("Code > 40")).isTrue();
            assertThat(test("Joined = date \"2024-01-15\"")).isTrue();
            assertThat(test("Joined < TODAY()")).isTrue();
            assertThat(test("Flag = true")).isTrue();
        }

        @Test
        @DisplayName("Ordering across incompatible types is no match")
        void testIncompatibleOrdering() {
            assertThat(test("Name > 5")).isFalse();
            assertThat(test("Name < 5")).isFalse();
        }

        @Test
        @DisplayName("Null equals nothing and differs from any value")
        void testNullComparison() {
            assertThat(test("Extra = 1")).isFalse();
            assertThat(test("Extra != 1")).isTrue();
            assertThat(test("Extra != Extra")).isFalse();
            assertThat(test("Extra > 1")).isFalse();
        }

        @Test
        @DisplayName("Unknown operands follow three-valued logic")
        void testThreeValuedLogic() {
            assertThat(test("Name AND true")).isFalse();
            assertThat(test("Name OR Amount = 100")).isTrue();
            assertThat(eval("Name AND true")).isEqualTo(NullValue.get());
            assertThat(eval("Name AND false")).isEqualTo(BooleanValue.FALSE);
        }
    }

    @Nested
    @DisplayName("String operators")
    class StringOperators {

        @Test
        @DisplayName("contains, starts with, ends with and like ignore case")
        void testCaseInsensitive() {
            assertThat(test("Name contains 'LI'")).isTrue();
            assertThat(test("Name starts with 'al'")).isTrue();
            assertThat(test("Name ends with 'CE'")).isTrue();
            assertThat(test("Name like 'a_i%'")).isTrue();
            assertThat(test("Name like 'b%'")).isFalse();
        }

        @Test
        @DisplayName("matches is a case-sensitive full match")
        void testMatches() {
            assertThat(test("Name matches 'Al.*'")).isTrue();
            assertThat(test("Name matches 'al.*'")).isFalse();
            assertThat(test("Name matches 'Al'")).isFalse();
        }

        @Test
        @DisplayName("A malformed pattern matches nothing")
        void testMalformedPattern() {
            assertThat(test("Name matches '('")).isFalse();
        }

        @Test
        @DisplayName("LIKE escapes regex metacharacters")
        void testLikeRegex() {
            assertThat(ExpressionEvaluator.likeToRegex("a.b%")).isEqualTo("\\Qa.b\\E.*");
        }
    }

    @Nested
    @DisplayName("Null tests and functions")
    class NullsAndFunctions {

        @Test
        @DisplayName("IS NULL matches empty strings in virtual tables by default")
        void testEmptyStringIsNull() {
            assertThat(test("Note IS NULL")).isTrue();
            assertThat(test("Extra IS NULL")).isTrue();
            assertThat(test("Name IS NOT NULL")).isTrue();
        }

        @Test
        @DisplayName("Empty strings are values when configured so")
        void testEmptyStringNotNull() {
            TableRowContext strict = rowOf(fixedConfig().toBuilder().emptyStringIsNull(false).build());

            assertThat(evaluator.test(expr("Note IS NULL"), strict)).isFalse();
            assertThat(evaluator.test(expr("Extra IS NULL"), strict)).isTrue();
        }

        @Test
        @DisplayName("TODAY and NOW come from the configured clock")
        void testClock() {
            assertThat(eval("TODAY()")).isEqualTo(DateValue.ofDate(LocalDate.of(2024, 3, 15)));
            assertThat(evaluator.today()).isEqualTo(LocalDate.of(2024, 3, 15));
            assertThat(eval("NOW()").toJava()).isEqualTo("2024-03-15T10:30");
        }

        @Test
        @DisplayName("Scalar functions")
        void testScalarFunctions() {
            assertThat(eval("LOWER(Name)")).isEqualTo(new StringValue("alice"));
            assertThat(eval("upper(Name)")).isEqualTo(new StringValue("ALICE"));
            assertThat(eval("YEAR(Joined)")).isEqualTo(new NumberValue(2024));
            assertThat(eval("YEAR(Name)")).isEqualTo(NullValue.get());
            assertThat(eval("LOWER(Extra)")).isEqualTo(NullValue.get());
        }
    }
}
