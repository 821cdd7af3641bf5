package com.gridsql.sheets;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gridsql.exception.RemoteAccessException;
import com.gridsql.grid.AppendRows;
import com.gridsql.grid.DeleteRows;
import com.gridsql.grid.GridWriteResult;
import com.gridsql.grid.UpdateCells;
import com.gridsql.test.TestBase;
import com.gridsql.test.TestCategories;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Tests for {@link SheetsGridSource} against a local HTTP server.
 */
@DisplayName("SheetsGridSource")
@Tag("sheets")
@Tag("tier2")
@TestCategories.Integration
public class SheetsGridSourceTest extends TestBase {

    private HttpServer server;
    private final Map<String, Integer> statuses = new ConcurrentHashMap<>();
    private final Map<String, String> responses = new ConcurrentHashMap<>();
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();
    private SheetsGridSource source;

    /** What the server saw. */
    private static final class RecordedRequest {
        final String method;
        final String path;
        final String rawQuery;
        final String authorization;
        final String body;

        RecordedRequest(HttpExchange exchange, String body) {
            this.method = exchange.getRequestMethod();
            this.path = exchange.getRequestURI().getPath();
            this.rawQuery = exchange.getRequestURI().getRawQuery();
            this.authorization = exchange.getRequestHeaders().getFirst("Authorization");
            this.body = body;
        }

        Map<String, String> params() {
            Map<String, String> params = new LinkedHashMap<>();
            if (rawQuery == null) {
                return params;
            }
            for (String pair : rawQuery.split("&")) {
                int eq = pair.indexOf('=');
                params.put(pair.substring(0, eq),
                    URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
            }
            return params;
        }
    }

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
        String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
        HttpClient client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
        source = new SheetsGridSource(client, () -> "test-token", SheetsClientConfig.forBaseUrl(baseUrl),
            new ObjectMapper(), Clock.fixed(FIXED_INSTANT, ZoneOffset.UTC));
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        RecordedRequest request = new RecordedRequest(exchange, body);
        requests.add(request);
        String key = request.method + " " + request.path;
        String response = responses.getOrDefault(key, "{}");
        int status = statuses.getOrDefault(key, 200);
        byte[] bytes = response.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private void respond(String method, String path, int status, String body) {
        responses.put(method + " " + path, body);
        statuses.put(method + " " + path, status);
    }

    private static String valuesPath(String suffix) {
        return "/v4/spreadsheets/" + SPREADSHEET_ID + suffix;
    }

    @Nested
    @DisplayName("Reads")
    class Reads {

        @Test
        @DisplayName("Values are read unformatted and converted to Java values")
        void testReadValues() {
            respond("GET", valuesPath("/values/Sheet1!A:C"), 200,
                "{\"range\":\"Sheet1!A1:C3\",\"values\":[[\"Name\",\"Amount\",\"Paid\"],"
                    + "[\"Alice\",100,true],[\"Bob\",12.5,\"\"]]}");

            List<List<Object>> values = source.readValues(location("Sheet1!A:C"));

            assertThat(values).hasSize(3);
            assertThat(values.get(1)).containsExactly("Alice", 100L, true);
            assertThat(values.get(2)).isEqualTo(Arrays.asList("Bob", 12.5, null));

            RecordedRequest request = requests.get(0);
            assertThat(request.method).isEqualTo("GET");
            assertThat(request.authorization).isEqualTo("Bearer test-token");
            assertThat(request.params())
                .containsEntry("valueRenderOption", "UNFORMATTED_VALUE")
                .containsEntry("dateTimeRenderOption", "FORMATTED_STRING");
        }

        @Test
        @DisplayName("A range with no values reads as empty")
        void testEmptyRange() {
            respond("GET", valuesPath("/values/Sheet1!A:C"), 200, "{\"range\":\"Sheet1!A1:C1000\"}");

            assertThat(source.readValues(location("Sheet1!A:C"))).isEmpty();
        }

        @Test
        @DisplayName("Native queries go to the visualization endpoint and return the raw body")
        void testQuery() {
            String wrapped = "/*O_o*/\ngoogle.visualization.Query.setResponse({\"status\":\"ok\"});";
            respond("GET", "/spreadsheets/d/" + SPREADSHEET_ID + "/gviz/tq", 200, wrapped);

            String body = source.query(location("Sheet1!A:C"), "select A, sum(B) group by A", 1);

            assertThat(body).isEqualTo(wrapped);
            assertThat(requests.get(0).params())
                .containsEntry("tqx", "out:json")
                .containsEntry("range", "Sheet1!A:C")
                .containsEntry("headers", "1")
                .containsEntry("tq", "select A, sum(B) group by A");
        }

        @Test
        @DisplayName("Metadata requests include grid data")
        void testMetadata() {
            respond("GET", valuesPath(""), 200, "{\"sheets\":[{\"data\":[]}]}");

            JsonNode metadata = source.readMetadata(location("Sheet1!A:C"));

            assertThat(metadata.path("sheets").isArray()).isTrue();
            assertThat(requests.get(0).params())
                .containsEntry("ranges", "Sheet1!A:C")
                .containsEntry("includeGridData", "true");
        }
    }

    @Nested
    @DisplayName("Writes")
    class Writes {

        @Test
        @DisplayName("Appends send rows as typed and blank out nulls")
        void testAppend() throws Exception {
            respond("POST", valuesPath("/values/Sheet1!A:C:append"), 200,
                "{\"updates\":{\"updatedRange\":\"Sheet1!A4:C4\",\"updatedRows\":1,\"updatedCells\":3}}");

            GridWriteResult result = source.write(location("Sheet1!A:C"),
                new AppendRows(List.of(Arrays.asList("Dan", 5, null))));

            assertThat(result.updatedRows()).isEqualTo(1);
            assertThat(result.updatedCells()).isEqualTo(3);
            assertThat(result.updatedRange()).isEqualTo("Sheet1!A4:C4");
            assertThat(result.updateTime()).isEqualTo("2024-03-15T10:30:00Z");

            RecordedRequest request = requests.get(0);
            assertThat(request.params())
                .containsEntry("valueInputOption", "USER_ENTERED")
                .containsEntry("insertDataOption", "INSERT_ROWS");
            JsonNode body = new ObjectMapper().readTree(request.body);
            assertThat(body.path("values").get(0).toString()).isEqualTo("[\"Dan\",5,\"\"]");
        }

        @Test
        @DisplayName("Cell updates are sent in one batch with A1 addresses")
        void testUpdateCells() throws Exception {
            respond("POST", valuesPath("/values:batchUpdate"), 200,
                "{\"totalUpdatedRows\":2,\"totalUpdatedCells\":2}");

            GridWriteResult result = source.write(location("Sheet1!A:C"), new UpdateCells(List.of(
                new UpdateCells.CellUpdate(2, 2, "done"),
                new UpdateCells.CellUpdate(4, 2, null))));

            assertThat(result.updatedRows()).isEqualTo(2);
            assertThat(result.updatedCells()).isEqualTo(2);
            assertThat(requests).hasSize(1);

            JsonNode body = new ObjectMapper().readTree(requests.get(0).body);
            assertThat(body.path("valueInputOption").asText()).isEqualTo("USER_ENTERED");
            assertThat(body.path("data").get(0).path("range").asText()).isEqualTo("Sheet1!C2");
            assertThat(body.path("data").get(0).path("values").toString()).isEqualTo("[[\"done\"]]");
            assertThat(body.path("data").get(1).path("range").asText()).isEqualTo("Sheet1!C4");
            assertThat(body.path("data").get(1).path("values").toString()).isEqualTo("[[\"\"]]");
        }

        @Test
        @DisplayName("Row deletion looks up the sheet id and deletes bottom-up")
        void testDeleteRows() throws Exception {
            respond("GET", valuesPath(""), 200,
                "{\"sheets\":[{\"properties\":{\"title\":\"Other\",\"sheetId\":0}},"
                    + "{\"properties\":{\"title\":\"Sheet1\",\"sheetId\":42}}]}");
            respond("POST", valuesPath(":batchUpdate"), 200, "{\"replies\":[{},{}]}");

            GridWriteResult result = source.write(location("Sheet1!A:C"), new DeleteRows(List.of(3, 7)));

            assertThat(result.updatedRows()).isEqualTo(2);
            assertThat(requests).hasSize(2);
            assertThat(requests.get(0).method).isEqualTo("GET");

            JsonNode deletes = new ObjectMapper().readTree(requests.get(1).body).path("requests");
            assertThat(deletes).hasSize(2);
            JsonNode first = deletes.get(0).path("deleteDimension").path("range");
            assertThat(first.path("sheetId").asInt()).isEqualTo(42);
            assertThat(first.path("dimension").asText()).isEqualTo("ROWS");
            assertThat(first.path("startIndex").asInt()).isEqualTo(6);
            assertThat(first.path("endIndex").asInt()).isEqualTo(7);
            assertThat(deletes.get(1).path("deleteDimension").path("range").path("startIndex").asInt())
                .isEqualTo(2);
        }

        @Test
        @DisplayName("Deleting from a sheet that does not exist fails before any write")
        void testDeleteUnknownSheet() {
            respond("GET", valuesPath(""), 200, "{\"sheets\":[{\"properties\":{\"title\":\"Other\",\"sheetId\":0}}]}");

            RemoteAccessException e = catchThrowableOfType(
                () -> source.write(location("Sheet1!A:C"), new DeleteRows(List.of(2))),
                RemoteAccessException.class);

            assertThat(e.getStatusCode()).isEqualTo(404);
            assertThat(e.getMessage()).contains("Sheet \"Sheet1\" not found");
            assertThat(requests).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("HTTP errors carry the status code and the body")
        void testHttpError() {
            respond("GET", valuesPath("/values/Sheet1!A:C"), 403, "{\"error\":\"denied\"}");

            RemoteAccessException e = catchThrowableOfType(
                () -> source.readValues(location("Sheet1!A:C")), RemoteAccessException.class);

            assertThat(e.getOperation()).isEqualTo("read");
            assertThat(e.getStatusCode()).isEqualTo(403);
            assertThat(e.getMessage())
                .isEqualTo("Read failed for " + SPREADSHEET_ID + "/Sheet1!A:C: HTTP 403: {\"error\":\"denied\"}");
            assertThat(requests).hasSize(1);
        }

        @Test
        @DisplayName("Unparseable JSON is reported as a remote failure")
        void testMalformedJson() {
            respond("GET", valuesPath("/values/Sheet1!A:C"), 200, "<html>");

            RemoteAccessException e = catchThrowableOfType(
                () -> source.readValues(location("Sheet1!A:C")), RemoteAccessException.class);

            assertThat(e.getMessage()).contains("Malformed response");
            assertThat(e.getStatusCode()).isEqualTo(-1);
        }
    }
}
