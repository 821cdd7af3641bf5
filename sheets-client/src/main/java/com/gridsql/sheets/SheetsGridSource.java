package com.gridsql.sheets;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gridsql.exception.RemoteAccessException;
import com.gridsql.grid.AppendRows;
import com.gridsql.grid.DeleteRows;
import com.gridsql.grid.GridSource;
import com.gridsql.grid.GridWrite;
import com.gridsql.grid.GridWriteResult;
import com.gridsql.grid.UpdateCells;
import com.gridsql.table.GridLocation;
import com.gridsql.table.GridRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * {@link GridSource} over the spreadsheet REST API and the visualization query endpoint.
 *
 * <p>Endpoints used:
 * <ul>
 *   <li>read: {@code GET values/{range}} with unformatted values</li>
 *   <li>query: {@code GET /gviz/tq?tqx=out:json}, returned unparsed</li>
 *   <li>append: {@code POST values/{range}:append}, values entered as if typed</li>
 *   <li>cell update: {@code POST values:batchUpdate}, all cells in one request</li>
 *   <li>row deletion: {@code POST :batchUpdate} with one deleteDimension request per row,
 *       highest row first</li>
 *   <li>metadata: {@code GET ?includeGridData=true}</li>
 * </ul>
 *
 * <p>Responses with status 400 or above become {@link RemoteAccessException}s carrying
 * the status code. Requests are never retried. The class holds no mutable state and may
 * be shared between threads.
 */
public class SheetsGridSource implements GridSource {

    private static final Logger logger = LoggerFactory.getLogger(SheetsGridSource.class);

    private static final String METADATA_FIELDS =
        "sheets(data(rowData(values(formattedValue,userEnteredValue,effectiveFormat))))";
    private static final int MAX_ERROR_BODY = 500;

    private final HttpClient client;
    private final SheetsClientConfig config;
    private final AccessTokenProvider tokens;
    private final ObjectMapper mapper;
    private final Clock clock;

    public SheetsGridSource(AccessTokenProvider tokens) {
        this(tokens, SheetsClientConfig.fromSystemProperties());
    }

    public SheetsGridSource(AccessTokenProvider tokens, SheetsClientConfig config) {
        this(HttpClient.newBuilder()
                .connectTimeout(config.timeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(),
            tokens, config, new ObjectMapper(), Clock.systemUTC());
    }

    SheetsGridSource(HttpClient client, AccessTokenProvider tokens, SheetsClientConfig config,
                     ObjectMapper mapper, Clock clock) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.tokens = Objects.requireNonNull(tokens, "tokens must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ==================== Reads ====================

    @Override
    public List<List<Object>> readValues(GridLocation location) {
        String url = config.valuesBaseUrl() + "/" + location.spreadsheetId() + "/values/"
            + encode(location.range()) + "?valueRenderOption=UNFORMATTED_VALUE&dateTimeRenderOption=FORMATTED_STRING";
        JsonNode root = readJson("read", location, send("read", location, get(url)));
        List<List<Object>> rows = new ArrayList<>();
        for (JsonNode row : root.path("values")) {
            List<Object> cells = new ArrayList<>();
            for (JsonNode cell : row) {
                cells.add(toJava(cell));
            }
            rows.add(cells);
        }
        logger.debug("Read {} row(s) from {}", rows.size(), location);
        return rows;
    }

    @Override
    public String query(GridLocation location, String nativeQuery, int headerRows) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("tqx", "out:json");
        params.put("range", location.range());
        params.put("headers", Integer.toString(headerRows));
        params.put("tq", nativeQuery);
        String url = config.queryBaseUrl() + "/" + location.spreadsheetId() + "/gviz/tq?" + encodeQuery(params);
        return send("query", location, get(url));
    }

    @Override
    public JsonNode readMetadata(GridLocation location) {
        String url = config.valuesBaseUrl() + "/" + location.spreadsheetId()
            + "?ranges=" + encode(location.range()) + "&includeGridData=true&fields=" + encode(METADATA_FIELDS);
        return readJson("metadata", location, send("metadata", location, get(url)));
    }

    // ==================== Writes ====================

    @Override
    public GridWriteResult write(GridLocation location, GridWrite write) {
        if (write instanceof AppendRows append) {
            return append(location, append);
        } else if (write instanceof UpdateCells update) {
            return updateCells(location, update);
        } else if (write instanceof DeleteRows delete) {
            return deleteRows(location, delete);
        }
        throw new IllegalArgumentException("Unsupported write: " + write);
    }

    private GridWriteResult append(GridLocation location, AppendRows append) {
        String url = config.valuesBaseUrl() + "/" + location.spreadsheetId() + "/values/"
            + encode(location.range()) + ":append?valueInputOption=USER_ENTERED&insertDataOption=INSERT_ROWS";
        ObjectNode body = mapper.createObjectNode();
        JsonNode values = mapper.valueToTree(blankNulls(append.rows()));
        body.set("values", values);
        JsonNode root = readJson("write", location, send("write", location, post(url, body)));
        JsonNode updates = root.path("updates");
        return new GridWriteResult(
            updates.path("updatedRows").asInt(append.rowCount()),
            updates.path("updatedCells").asInt(0),
            updates.path("updatedRange").asText(null),
            now());
    }

    private GridWriteResult updateCells(GridLocation location, UpdateCells update) {
        GridRange range = location.gridRange();
        ArrayNode data = mapper.createArrayNode();
        for (UpdateCells.CellUpdate cell : update.cells()) {
            ObjectNode entry = data.addObject();
            entry.put("range", range.cellAddress(cell.column(), cell.row()));
            ArrayNode values = entry.putArray("values").addArray();
            JsonNode value = mapper.valueToTree(cell.value() == null ? "" : cell.value());
            values.add(value);
        }
        ObjectNode body = mapper.createObjectNode();
        body.put("valueInputOption", "USER_ENTERED");
        body.set("data", data);
        String url = config.valuesBaseUrl() + "/" + location.spreadsheetId() + "/values:batchUpdate";
        JsonNode root = readJson("write", location, send("write", location, post(url, body)));
        return new GridWriteResult(
            root.path("totalUpdatedRows").asInt(update.rowCount()),
            root.path("totalUpdatedCells").asInt(update.cells().size()),
            null,
            now());
    }

    private GridWriteResult deleteRows(GridLocation location, DeleteRows delete) {
        int sheetId = sheetIdOf(location);
        ArrayNode requests = mapper.createArrayNode();
        for (int row : delete.rowNumbers()) {
            ObjectNode range = requests.addObject().putObject("deleteDimension").putObject("range");
            range.put("sheetId", sheetId);
            range.put("dimension", "ROWS");
            range.put("startIndex", row - 1);
            range.put("endIndex", row);
        }
        ObjectNode body = mapper.createObjectNode();
        body.set("requests", requests);
        String url = config.valuesBaseUrl() + "/" + location.spreadsheetId() + ":batchUpdate";
        send("write", location, post(url, body));
        return new GridWriteResult(delete.rowCount(), 0, null, now());
    }

    /**
     * Looks up the numeric id of the range's sheet; the first sheet when the range names none.
     */
    private int sheetIdOf(GridLocation location) {
        String url = config.valuesBaseUrl() + "/" + location.spreadsheetId()
            + "?fields=" + encode("sheets(properties(title,sheetId))");
        JsonNode sheets = readJson("write", location, send("write", location, get(url))).path("sheets");
        String name = location.gridRange().sheetName();
        for (JsonNode sheet : sheets) {
            JsonNode properties = sheet.path("properties");
            if (name == null || name.equals(properties.path("title").asText())) {
                return properties.path("sheetId").asInt();
            }
        }
        throw new RemoteAccessException("write", location.toString(),
            "Sheet \"" + (name == null ? "" : name) + "\" not found", 404, null);
    }

    // ==================== HTTP ====================

    private HttpRequest.Builder request(String url) {
        return HttpRequest.newBuilder(URI.create(url))
            .timeout(config.timeout())
            .header("Authorization", "Bearer " + tokens.accessToken())
            .header("Accept", "application/json");
    }

    private HttpRequest get(String url) {
        return request(url).GET().build();
    }

    private HttpRequest post(String url, JsonNode body) {
        String json;
        try {
            json = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize request body", e);
        }
        return request(url)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
            .build();
    }

    private String send(String operation, GridLocation location, HttpRequest request) {
        logger.debug("{} {} ({})", request.method(), request.uri().getPath(), operation);
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RemoteAccessException(operation, location.toString(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteAccessException(operation, location.toString(), "interrupted", -1, e);
        }
        if (response.statusCode() >= 400) {
            String body = response.body() == null ? "" : response.body();
            if (body.length() > MAX_ERROR_BODY) {
                body = body.substring(0, MAX_ERROR_BODY) + "...";
            }
            logger.warn("{} on {} returned HTTP {}", operation, location, response.statusCode());
            throw new RemoteAccessException(operation, location.toString(),
                "HTTP " + response.statusCode() + ": " + body, response.statusCode(), null);
        }
        return response.body();
    }

    private JsonNode readJson(String operation, GridLocation location, String body) {
        try {
            return mapper.readTree(body == null || body.isBlank() ? "{}" : body);
        } catch (JsonProcessingException e) {
            throw new RemoteAccessException(operation, location.toString(),
                "Malformed response: " + e.getOriginalMessage(), -1, e);
        }
    }

    // ==================== Helpers ====================

    private static Object toJava(JsonNode cell) {
        if (cell == null || cell.isNull()) {
            return null;
        }
        if (cell.isBoolean()) {
            return cell.booleanValue();
        }
        if (cell.isIntegralNumber()) {
            return cell.longValue();
        }
        if (cell.isNumber()) {
            return cell.doubleValue();
        }
        String text = cell.asText();
        return text.isEmpty() ? null : text;
    }

    private static List<List<Object>> blankNulls(List<List<Object>> rows) {
        List<List<Object>> out = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            List<Object> line = new ArrayList<>(row.size());
            for (Object value : row) {
                line.add(value == null ? "" : value);
            }
            out.add(line);
        }
        return out;
    }

    private String now() {
        return Instant.now(clock).toString();
    }

    static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String encodeQuery(Map<String, String> params) {
        return params.entrySet().stream()
            .map(e -> e.getKey() + "=" + encode(e.getValue()))
            .collect(Collectors.joining("&"));
    }
}
