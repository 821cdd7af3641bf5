package com.gridsql.exec;

import com.gridsql.exception.ValidationException;
import com.gridsql.result.QueryResult;
import com.gridsql.result.ResultColumn;
import com.gridsql.result.SelectResult;
import com.gridsql.runtime.QueryEngine;
import com.gridsql.test.TestBase;
import com.gridsql.test.TestCategories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for GROUP BY, aggregates, HAVING and PIVOT.
 */
@DisplayName("Aggregation")
@Tag("exec")
@Tag("tier1")
@TestCategories.Unit
public class AggregationTest extends TestBase {

    private QueryEngine engine;
    private List<List<Object>> sales;

    @BeforeEach
    void setUp() {
        engine = new QueryEngine(null, fixedConfig());
        sales = table(
            row("Region", "Amount", "Rep"),
            row("North", 100, "Ann"),
            row("South", 200, "Ben"),
            row("North", 150, "Ann"),
            row("East", "n/a", "Cy"),
            row("East", "", "Cy"));
    }

    private QueryResult query(String sql) {
        logStep(sql);
        QueryResult result = ((SelectResult) engine.execute(sql, Map.of("sales", sales))).data();
        logData("result", result.values());
        return result;
    }

    private static List<String> ids(QueryResult result) {
        return result.columns().stream().map(ResultColumn::id).collect(Collectors.toList());
    }

    private QueryResult queryCodes(String sql) {
        logStep(sql);
        List<List<Object>> codes = table(
            row("Code", "Qty"),
            row(1, 5),
            row("1", 7),
            row(2, 1),
            row("2.0", 4));
        QueryResult result = ((SelectResult) engine.execute(sql, Map.of("codes", codes))).data();
        logData("result", result.values());
        return result;
    }

    @Nested
    @DisplayName("GROUP BY")
    class GroupBy {

        @Test
        @DisplayName("Groups keep first-appearance order and SUM skips non-numeric values")
        void testSumPerGroup() {
            QueryResult result = query("SELECT Region, SUM(Amount) FROM :sales GROUP BY Region");

            assertThat(ids(result)).containsExactly("Region", "sum(Amount)");
            assertThat(result.values()).containsExactly(
                Arrays.asList("North", 250L),
                Arrays.asList("South", 200L),
                Arrays.asList("East", null));
        }

        @Test
        @DisplayName("COUNT(*) counts rows while COUNT skips empty values")
        void testCounts() {
            QueryResult result = query(
                "SELECT Region, COUNT(*) AS all_rows, COUNT(Amount) AS filled FROM :sales GROUP BY Region");

            assertThat(result.columnValues("all_rows")).containsExactly(2L, 1L, 2L);
            assertThat(result.columnValues("filled")).containsExactly(2L, 1L, 1L);
        }

        @Test
        @DisplayName("AVG, MIN and MAX over the numeric rows")
        void testAvgMinMax() {
            QueryResult result = query(
                "SELECT AVG(Amount) AS mean, MIN(Amount) AS low, MAX(Amount) AS high FROM :sales WHERE Region != 'East'");

            assertThat(result.values()).containsExactly(Arrays.asList(150L, 100L, 200L));
        }

        @Test
        @DisplayName("COUNT(DISTINCT x) counts distinct values")
        void testCountDistinct() {
            QueryResult result = query("SELECT COUNT(DISTINCT Rep) FROM :sales");

            assertThat(ids(result)).containsExactly("count(distinct Rep)");
            assertThat(result.values()).containsExactly(List.of(3L));
        }

        @Test
        @DisplayName("A number and numeric text of the same value share a group")
        void testMixedNumericKeys() {
            QueryResult grouped = queryCodes("SELECT Code, SUM(Qty) AS total FROM :codes GROUP BY Code");
            QueryResult distinct = queryCodes("SELECT COUNT(DISTINCT Code) FROM :codes");

            assertThat(grouped.values()).containsExactly(
                Arrays.asList(1L, 12L),
                Arrays.asList(2L, 5L));
            assertThat(distinct.values()).containsExactly(List.of(2L));
        }

        @Test
        @DisplayName("Expressions combine aggregates")
        void testAggregateArithmetic() {
            QueryResult result = query(
                "SELECT Region, SUM(Amount) / COUNT(*) AS mean FROM :sales WHERE Region = 'North' GROUP BY Region");

            assertThat(result.values()).containsExactly(Arrays.asList("North", 125L));
        }
    }

    @Nested
    @DisplayName("HAVING and ORDER BY on groups")
    class Having {

        @Test
        @DisplayName("HAVING sees SELECT aliases")
        void testHavingAlias() {
            QueryResult result = query(
                "SELECT Region, SUM(Amount) AS total FROM :sales GROUP BY Region HAVING total > 200");

            assertThat(result.columnValues("Region")).containsExactly("North");
        }

        @Test
        @DisplayName("HAVING may use an aggregate directly")
        void testHavingAggregate() {
            QueryResult result = query(
                "SELECT Region FROM :sales GROUP BY Region HAVING SUM(Amount) >= 200");

            assertThat(result.columnValues("Region")).containsExactly("North", "South");
        }

        @Test
        @DisplayName("ORDER BY an alias puts Null groups last when descending")
        void testOrderByAlias() {
            QueryResult result = query(
                "SELECT Region, SUM(Amount) AS total FROM :sales GROUP BY Region ORDER BY total DESC");

            assertThat(result.columnValues("Region")).containsExactly("North", "South", "East");
        }
    }

    @Nested
    @DisplayName("PIVOT")
    class Pivot {

        @Test
        @DisplayName("Each pivot value becomes a column per aggregate")
        void testPivotWithGroups() {
            QueryResult result = query(
                "SELECT Rep, SUM(Amount) FROM :sales WHERE Region != 'East' GROUP BY Rep PIVOT Region");

            assertThat(ids(result)).containsExactly("Rep", "North sum(Amount)", "South sum(Amount)");
            assertThat(result.values()).containsExactly(
                Arrays.asList("Ann", 250L, null),
                Arrays.asList("Ben", null, 200L));
        }

        @Test
        @DisplayName("PIVOT without GROUP BY yields a single row")
        void testPivotSingleRow() {
            QueryResult result = query(
                "SELECT SUM(Amount) FROM :sales WHERE Region != 'East' PIVOT Region LABEL SUM(Amount) 'Total'");

            assertThat(result.values()).containsExactly(Arrays.asList(250L, 200L));
            assertThat(result.columns()).extracting(ResultColumn::label)
                .containsExactly("North Total", "South Total");
        }

        @Test
        @DisplayName("Pivot values equal across number and text become one column")
        void testPivotMixedNumericKeys() {
            QueryResult result = queryCodes("SELECT SUM(Qty) FROM :codes PIVOT Code");

            assertThat(ids(result)).containsExactly("1 sum(Qty)", "2 sum(Qty)");
            assertThat(result.values()).containsExactly(Arrays.asList(12L, 5L));
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Non-aggregated columns must be grouped")
        void testUngroupedColumn() {
            assertThatThrownBy(() -> query("SELECT Region, Rep, SUM(Amount) FROM :sales GROUP BY Region"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Non-aggregate column 'Rep' must appear in GROUP BY");
        }

        @Test
        @DisplayName("'*' cannot be grouped")
        void testStarWithGroupBy() {
            assertThatThrownBy(() -> query("SELECT * FROM :sales GROUP BY Region"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("'*' cannot be combined with GROUP BY or aggregates");
        }

        @Test
        @DisplayName("Aggregates are rejected in WHERE")
        void testAggregateInWhere() {
            assertThatThrownBy(() -> query("SELECT Region FROM :sales WHERE SUM(Amount) > 1"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Aggregate functions are not allowed in WHERE");
        }
    }
}
