package com.gridsql.bridge;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.gridsql.exception.RemoteAccessException;
import com.gridsql.result.QueryResult;
import com.gridsql.result.ResultColumn;
import com.gridsql.test.TestBase;
import com.gridsql.test.TestCategories;
import com.gridsql.types.DateType;
import com.gridsql.types.NumberType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for reading native query responses.
 */
@DisplayName("NativeResponseParser")
@Tag("bridge")
@Tag("tier1")
@TestCategories.Unit
public class NativeResponseParserTest extends TestBase {

    private static final String LOCATION = "sheet Sheet1!A:C";

    private static final String WRAPPED = "/*O_o*/\n"
        + "google.visualization.Query.setResponse({\"version\":\"0.6\",\"status\":\"ok\",\"table\":{"
        + "\"cols\":[{\"id\":\"A\",\"label\":\"Name\",\"type\":\"string\"},"
        + "{\"id\":\"B\",\"label\":\"\",\"type\":\"number\",\"pattern\":\"0.00\"},"
        + "{\"id\":\"C\",\"label\":\"Joined\",\"type\":\"date\"}],"
        + "\"rows\":[{\"c\":[{\"v\":\"Alice\"},{\"v\":100.0,\"f\":\"100.00\"},{\"v\":\"Date(2024,0,15)\",\"f\":\"1/15/2024\"}]},"
        + "{\"c\":[{\"v\":\"Bob\"},{\"v\":2.5,\"f\":\"2.50\"},null]}]}});";

    private NativeResponseParser parser;

    @BeforeEach
    void setUp() {
        parser = new NativeResponseParser();
    }

    @Test
    @DisplayName("Unwraps the response and normalizes values")
    void testWrappedResponse() {
        QueryResult result = parser.parse(WRAPPED, LOCATION);

        assertThat(result.columns()).extracting(ResultColumn::id).containsExactly("A", "B", "C");
        assertThat(result.columns()).extracting(ResultColumn::label).containsExactly("Name", "B", "Joined");
        assertThat(result.columns().get(1).type()).isEqualTo(NumberType.get());
        assertThat(result.columns().get(2).type()).isEqualTo(DateType.get());
        assertThat(result.values()).containsExactly(
            Arrays.asList("Alice", 100L, "2024-01-15"),
            Arrays.asList("Bob", 2.5, null));
    }

    @Test
    @DisplayName("Formatted text is kept only for columns with a pattern")
    void testFormattedText() {
        QueryResult result = parser.parse(WRAPPED, LOCATION);

        assertThat(result.columns().get(1).pattern()).isEqualTo("0.00");
        assertThat(result.rows().get(0).cells().get(1).formatted()).isEqualTo("100.00");
        assertThat(result.rows().get(0).cells().get(2).formatted()).isNull();
    }

    @Test
    @DisplayName("An error status becomes a remote access error with the detailed message")
    void testErrorStatus() {
        String body = "{\"status\":\"error\",\"errors\":[{\"reason\":\"invalid_query\","
            + "\"message\":\"INVALID_QUERY\",\"detailed_message\":\"Invalid query: NO_COLUMN: Z\"}]}";

        assertThatThrownBy(() -> parser.parse(body, LOCATION))
            .isInstanceOf(RemoteAccessException.class)
            .hasMessage("Query failed for sheet Sheet1!A:C: Native query failed: Invalid query: NO_COLUMN: Z");
    }

    @Test
    @DisplayName("Bodies without a table are malformed")
    void testMissingTable() {
        assertThatThrownBy(() -> parser.parse("{\"status\":\"ok\"}", LOCATION))
            .isInstanceOf(RemoteAccessException.class)
            .hasMessageContaining("Malformed native response: no table");
        assertThatThrownBy(() -> parser.parse("  ", LOCATION))
            .isInstanceOf(RemoteAccessException.class)
            .hasMessageContaining("empty body");
        assertThatThrownBy(() -> parser.parse("setResponse({not json", LOCATION))
            .isInstanceOf(RemoteAccessException.class)
            .hasMessageContaining("Malformed native response");
    }

    @Test
    @DisplayName("Date-time and time-of-day values become ISO text")
    void testTemporalValues() {
        JsonNodeFactory json = JsonNodeFactory.instance;

        assertThat(NativeResponseParser.convert(json.textNode("Date(2024,2,15,10,30,5)")))
            .isEqualTo("2024-03-15T10:30:05");
        assertThat(NativeResponseParser.convert(json.arrayNode().add(9).add(5).add(0).add(0)))
            .isEqualTo("09:05");
        assertThat(NativeResponseParser.convert(json.numberNode(3.0))).isEqualTo(3L);
        assertThat(NativeResponseParser.convert(json.booleanNode(true))).isEqualTo(true);
        assertThat(NativeResponseParser.convert(json.nullNode())).isNull();
    }
}
