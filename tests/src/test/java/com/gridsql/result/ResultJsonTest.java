package com.gridsql.result;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gridsql.test.TestBase;
import com.gridsql.test.TestCategories;
import com.gridsql.types.NumberType;
import com.gridsql.types.StringType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ResultJson")
@Tag("result")
@Tag("tier1")
@TestCategories.Unit
public class ResultJsonTest extends TestBase {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    @DisplayName("SELECT results serialize to cols and rows")
    void testSelectShape() throws Exception {
        QueryResult data = new QueryResult(
            List.of(
                new ResultColumn("A", "Name", StringType.get()),
                new ResultColumn("total", "Total", NumberType.get(), "#,##0.00")),
            List.of(
                new ResultRow(List.of(ResultCell.of("Alice"), new ResultCell(1234.5, "1,234.50"))),
                new ResultRow(Arrays.asList(ResultCell.of("Bob"), ResultCell.of(null)))));

        JsonNode json = MAPPER.readTree(ResultJson.toJsonString(new SelectResult(data)));
        logData("json", json);

        assertThat(json.path("operation").asText()).isEqualTo("SELECT");
        assertThat(json.has("metadata")).isFalse();
        JsonNode cols = json.path("data").path("cols");
        assertThat(cols).hasSize(2);
        assertThat(cols.get(0).path("id").asText()).isEqualTo("A");
        assertThat(cols.get(0).path("label").asText()).isEqualTo("Name");
        assertThat(cols.get(0).path("type").asText()).isEqualTo("string");
        assertThat(cols.get(0).has("pattern")).isFalse();
        assertThat(cols.get(1).path("pattern").asText()).isEqualTo("#,##0.00");

        JsonNode rows = json.path("data").path("rows");
        assertThat(rows.get(0).path("c").get(1).path("v").asDouble()).isEqualTo(1234.5);
        assertThat(rows.get(0).path("c").get(1).path("f").asText()).isEqualTo("1,234.50");
        assertThat(rows.get(0).path("c").get(0).has("f")).isFalse();
        assertThat(rows.get(1).path("c").get(1).path("v").isNull()).isTrue();
    }

    @Test
    @DisplayName("Metadata is included when present")
    void testMetadata() throws Exception {
        JsonNode metadata = MAPPER.readTree("{\"sheets\":[]}");
        QueryResult data = new QueryResult(List.of(), List.of());

        JsonNode json = ResultJson.toJson(new SelectResult(data, metadata));

        assertThat(json.path("metadata")).isEqualTo(metadata);
    }

    @Test
    @DisplayName("Virtual-table mutations carry the whole table")
    void testVirtualMutation() {
        MutationSummary summary = MutationSummary.builder("UPDATE")
            .affectedRows(1)
            .data(table(row("Name", "Status"), row("Alice", "done")))
            .build();

        JsonNode json = ResultJson.toJson(summary);

        assertThat(json.path("operation").asText()).isEqualTo("UPDATE");
        assertThat(json.path("updatedRows").asInt()).isEqualTo(1);
        assertThat(json.path("data").get(1).get(1).asText()).isEqualTo("done");
        assertThat(json.has("rowNumbers")).isFalse();
    }

    @Test
    @DisplayName("Grid deletes report deletedRows and row numbers")
    void testGridDelete() {
        MutationSummary summary = MutationSummary.builder("DELETE")
            .affectedRows(2)
            .rowNumbers(List.of(7, 3))
            .updateTime("2024-03-15T10:30:00Z")
            .build();

        JsonNode json = ResultJson.toJson(summary);

        assertThat(json.path("deletedRows").asInt()).isEqualTo(2);
        assertThat(json.has("updatedRows")).isFalse();
        assertThat(json.path("rowNumbers").get(0).asInt()).isEqualTo(7);
        assertThat(json.path("rowNumbers").get(1).asInt()).isEqualTo(3);
        assertThat(json.path("updateTime").asText()).isEqualTo("2024-03-15T10:30:00Z");
        assertThat(json.has("data")).isFalse();
    }

    @Test
    @DisplayName("A mutation matching nothing carries its message")
    void testNoMatchMessage() {
        MutationSummary summary = MutationSummary.builder("UPDATE")
            .affectedRows(0)
            .message(MutationSummary.NO_MATCH_MESSAGE)
            .build();

        JsonNode json = ResultJson.toJson(summary);

        assertThat(json.path("updatedRows").asInt()).isZero();
        assertThat(json.path("message").asText()).isEqualTo("No rows matched WHERE clause");
    }
}
