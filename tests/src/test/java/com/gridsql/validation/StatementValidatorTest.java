package com.gridsql.validation;

import com.gridsql.exception.ValidationException;
import com.gridsql.parser.StatementParser;
import com.gridsql.table.GridLocation;
import com.gridsql.table.TableResolver;
import com.gridsql.table.VirtualTableSet;
import com.gridsql.test.InMemoryGridSource;
import com.gridsql.test.TestBase;
import com.gridsql.test.TestCategories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Tests for StatementValidator. Validation must decide everything without touching the grid.
 */
@DisplayName("StatementValidator")
@Tag("validation")
@Tag("tier1")
@TestCategories.Unit
public class StatementValidatorTest extends TestBase {

    private InMemoryGridSource grid;

    @BeforeEach
    void setUp() {
        grid = new InMemoryGridSource();
    }

    private void validate(String sql, GridLocation target) {
        logStep(sql);
        TableResolver resolver = new TableResolver(fixedConfig(), grid,
            new VirtualTableSet(Map.of("t", table(row("Name", "Amount", "Status")))), target);
        StatementValidator.validate(StatementParser.parse(sql), resolver);
    }

    private void validate(String sql) {
        validate(sql, location("Sheet1!A:D"));
    }

    @Nested
    @DisplayName("Grid ranges")
    class GridRanges {

        @Test
        @DisplayName("Column letters inside the range are accepted without any read")
        void testLettersInRange() {
            assertThatCode(() -> validate("SELECT A, SUM(D) WHERE B > 1 GROUP BY A ORDER BY A"))
                .doesNotThrowAnyException();
            assertThat(grid.callCount()).isZero();
        }

        @Test
        @DisplayName("Letters outside the range are rejected")
        void testLetterOutsideRange() {
            assertThatThrownBy(() -> validate("SELECT E"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Column 'E' not found");
            assertThat(grid.callCount()).isZero();
        }

        @Test
        @DisplayName("A grid statement needs a target location")
        void testMissingTarget() {
            assertThatThrownBy(() -> validate("SELECT A", null))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Invalid target: no spreadsheet location given");
        }

        @Test
        @DisplayName("A range in FROM replaces the default range")
        void testRangeInFrom() {
            assertThatCode(() -> validate("SELECT F FROM Sheet2!E:F")).doesNotThrowAnyException();
            assertThatThrownBy(() -> validate("SELECT A FROM Sheet2!E:F"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Column 'A' not found");
        }
    }

    @Nested
    @DisplayName("Mutations")
    class Mutations {

        @Test
        @DisplayName("VALUES must be constants")
        void testValuesConstant() {
            ValidationException e = catchThrowableOfType(
                () -> validate("INSERT INTO :t VALUES ('a', Amount, 'b')"), ValidationException.class);

            assertThat(e.getMessage()).isEqualTo("Invalid VALUES: 'Amount' is not a constant");
            assertThat(e.getPhase()).isEqualTo("insert validation");
        }

        @Test
        @DisplayName("Constant expressions are allowed in VALUES")
        void testConstantExpression() {
            assertThatCode(() -> validate("INSERT INTO :t VALUES ('a', 1 + 2, UPPER('b'))"))
                .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Aggregates are rejected in mutation ORDER BY")
        void testAggregateInMutationOrder() {
            assertThatThrownBy(() -> validate("DELETE FROM :t WHERE true ORDER BY SUM(Amount) LIMIT 1"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Aggregate functions are not allowed in ORDER BY");
        }

        @Test
        @DisplayName("Sparse INSERT into a virtual table checks the named columns")
        void testSparseInsertColumns() {
            assertThatThrownBy(() -> validate("INSERT INTO :t (Name, Color) VALUES ('a', 'red')"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Column 'Color' not found");
        }

        @Test
        @DisplayName("The WHERE suggestion explains how to target every row")
        void testWhereSuggestion() {
            ValidationException e = catchThrowableOfType(
                () -> validate("UPDATE :t SET Status = 'x'"), ValidationException.class);

            assertThat(e.getSuggestion()).isEqualTo("Add a WHERE clause selecting the rows to change");
        }
    }

    @Nested
    @DisplayName("SELECT")
    class Select {

        @Test
        @DisplayName("HAVING, ORDER BY and DISTINCT ON may use aliases")
        void testAliasesVisible() {
            assertThatCode(() -> validate(
                "SELECT Status, COUNT(*) AS n FROM :t GROUP BY Status HAVING n > 1 ORDER BY n DESC"))
                .doesNotThrowAnyException();
            assertThatCode(() -> validate("SELECT DISTINCT ON (s) Status AS s, Name FROM :t"))
                .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("WHERE cannot see aliases")
        void testAliasNotInWhere() {
            assertThatThrownBy(() -> validate("SELECT Amount AS a FROM :t WHERE a > 1"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Column 'a' not found");
        }

        @Test
        @DisplayName("Aggregates are rejected in GROUP BY")
        void testAggregateInGroupBy() {
            assertThatThrownBy(() -> validate("SELECT COUNT(*) FROM :t GROUP BY SUM(Amount)"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Aggregate functions are not allowed in GROUP BY");
        }

        @Test
        @DisplayName("FORMAT must target a SELECT item, star covers every column")
        void testFormatTarget() {
            assertThatThrownBy(() -> validate("SELECT Name FROM :t FORMAT Amount '0.0'"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("FORMAT column 'Amount' not found in the SELECT list");
            assertThatCode(() -> validate("SELECT * FROM :t FORMAT Amount '0.0'"))
                .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Unknown virtual tables are reported by name")
        void testUnknownVirtualTable() {
            assertThatThrownBy(() -> validate("SELECT * FROM :missing"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Virtual table ':missing' not found");
        }
    }
}
