package com.gridsql.bridge;

import com.gridsql.result.QueryResult;
import com.gridsql.result.ResultColumn;
import com.gridsql.result.SelectResult;
import com.gridsql.runtime.QueryEngine;
import com.gridsql.test.InMemoryGridSource;
import com.gridsql.test.TestBase;
import com.gridsql.test.TestCategories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Bridged and evaluated runs of the same statement must be indistinguishable.
 */
@DisplayName("NativeQueryBridge")
@Tag("bridge")
@Tag("integration")
@TestCategories.Integration
public class NativeQueryBridgeTest extends TestBase {

    private static final String TOTALS_RESPONSE = "google.visualization.Query.setResponse({\"status\":\"ok\","
        + "\"table\":{\"cols\":[{\"id\":\"A\",\"label\":\"Region\",\"type\":\"string\"},"
        + "{\"id\":\"\",\"label\":\"total\",\"type\":\"number\"}],"
        + "\"rows\":[{\"c\":[{\"v\":\"North\"},{\"v\":150.0}]},{\"c\":[{\"v\":\"South\"},{\"v\":200.0}]}]}});";

    private static final String UNLABELLED_RESPONSE = "{\"status\":\"ok\","
        + "\"table\":{\"cols\":[{\"id\":\"A\",\"label\":\"Region\",\"type\":\"string\"},"
        + "{\"id\":\"\",\"label\":\"sum Amount\",\"type\":\"number\"}],"
        + "\"rows\":[{\"c\":[{\"v\":\"North\"},{\"v\":150}]}]}}";

    private InMemoryGridSource grid;

    @BeforeEach
    void setUp() {
        grid = new InMemoryGridSource()
            .withValues("Sheet1!A:B", table(
                row("Region", "Amount"),
                row("North", 100),
                row("South", 200),
                row("North", 50)));
    }

    private QueryResult run(String sql, boolean bridge) {
        QueryEngine engine = new QueryEngine(grid, fixedConfig().toBuilder().bridgeEnabled(bridge).build());
        QueryResult result = ((SelectResult) engine.execute(sql, location("Sheet1!A:B"))).data();
        logData(bridge ? "bridged" : "evaluated", result);
        return result;
    }

    @Test
    @DisplayName("The native query is sent instead of reading the range")
    void testBridgedRoute() {
        grid.withQueryResponse(TOTALS_RESPONSE);

        run("SELECT A, SUM(B) AS total GROUP BY A", true);

        assertThat(grid.reads()).isEmpty();
        assertThat(grid.queries()).containsExactly("select A, sum(B) group by A label sum(B) \"total\"");
    }

    @Test
    @DisplayName("Bridged and evaluated results have the same shape and values")
    void testSameShape() {
        grid.withQueryResponse(TOTALS_RESPONSE);
        String sql = "SELECT A, SUM(B) AS total GROUP BY A";

        QueryResult bridged = run(sql, true);
        QueryResult evaluated = run(sql, false);

        assertThat(bridged.columns()).extracting(ResultColumn::id).containsExactly("A", "total");
        assertThat(bridged.columns()).extracting(ResultColumn::id)
            .isEqualTo(evaluated.columns().stream().map(ResultColumn::id).collect(Collectors.toList()));
        assertThat(bridged.columns()).extracting(ResultColumn::label).containsExactly("Region", "total");
        assertThat(evaluated.columns()).extracting(ResultColumn::label).containsExactly("Region", "total");
        assertThat(bridged.values()).isEqualTo(evaluated.values());
        assertThat(evaluated.values()).containsExactly(List.of("North", 150L), List.of("South", 200L));
    }

    @Test
    @DisplayName("Computed columns without a label take the expression text")
    void testUnlabelledComputedColumn() {
        grid.withQueryResponse(UNLABELLED_RESPONSE);

        QueryResult result = run("SELECT A, SUM(B) GROUP BY A", true);

        assertThat(result.columns()).extracting(ResultColumn::id).containsExactly("A", "sum(B)");
        assertThat(result.columns()).extracting(ResultColumn::label).containsExactly("Region", "sum(B)");
    }

    @Test
    @DisplayName("Ineligible statements fall back to a raw read")
    void testFallback() {
        QueryResult result = run("SELECT COUNT(*) AS n", true);

        assertThat(grid.queries()).isEmpty();
        assertThat(grid.reads()).hasSize(1);
        assertThat(result.values()).containsExactly(List.of(3L));
    }
}
