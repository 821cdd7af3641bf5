package com.gridsql.bridge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gridsql.exception.RemoteAccessException;
import com.gridsql.result.QueryResult;
import com.gridsql.result.ResultCell;
import com.gridsql.result.ResultColumn;
import com.gridsql.result.ResultRow;
import com.gridsql.types.DataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reshapes a native query response into a {@link QueryResult}.
 *
 * <p>The response body is JSON, optionally preceded by an anti-hijacking comment and
 * wrapped in a {@code google.visualization.Query.setResponse(...)} call. Values are
 * normalized to what direct evaluation produces:
 * <ul>
 *   <li>{@code Date(y,m,d[,h,mi,s])} values (months counted from 0) become ISO-8601 text</li>
 *   <li>integral numbers become {@link Long}, other numbers {@link Double}</li>
 *   <li>the formatted text {@code f} is kept only for columns with a FORMAT pattern</li>
 * </ul>
 */
public final class NativeResponseParser {

    private static final Logger logger = LoggerFactory.getLogger(NativeResponseParser.class);

    private static final String WRAPPER = "setResponse(";
    private static final Pattern DATE_VALUE = Pattern.compile(
        "Date\\((\\d+),(\\d+),(\\d+)(?:,(\\d+),(\\d+),(\\d+)(?:,(\\d+))?)?\\)");

    private final ObjectMapper mapper;

    public NativeResponseParser() {
        this(new ObjectMapper());
    }

    public NativeResponseParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Parses a response body.
     *
     * @param body the raw body
     * @param location the queried range, for error messages
     * @return the result
     * @throws RemoteAccessException if the body is malformed or reports an error
     */
    public QueryResult parse(String body, String location) {
        JsonNode root = readJson(unwrap(body, location), location);
        String status = root.path("status").asText("ok");
        if ("error".equals(status)) {
            throw new RemoteAccessException("query", location, "Native query failed: " + messages(root.path("errors")));
        }
        if ("warning".equals(status)) {
            logger.warn("Native query on {} returned warnings: {}", location, messages(root.path("warnings")));
        }
        JsonNode table = root.path("table");
        if (!table.isObject()) {
            throw new RemoteAccessException("query", location, "Malformed native response: no table");
        }

        List<ResultColumn> columns = new ArrayList<>();
        for (JsonNode col : table.path("cols")) {
            String id = col.path("id").asText();
            String label = col.hasNonNull("label") && !col.get("label").asText().isEmpty()
                ? col.get("label").asText() : id;
            String pattern = col.hasNonNull("pattern") && !col.get("pattern").asText().isEmpty()
                ? col.get("pattern").asText() : null;
            columns.add(new ResultColumn(id, label, DataType.fromName(col.path("type").asText()), pattern));
        }

        List<ResultRow> rows = new ArrayList<>();
        for (JsonNode row : table.path("rows")) {
            List<ResultCell> cells = new ArrayList<>(columns.size());
            JsonNode c = row.path("c");
            for (int i = 0; i < columns.size(); i++) {
                JsonNode cell = c.path(i);
                Object value = cell.isObject() ? convert(cell.get("v")) : null;
                String formatted = columns.get(i).pattern() != null && cell.hasNonNull("f")
                    ? cell.get("f").asText() : null;
                cells.add(formatted != null ? new ResultCell(value, formatted) : ResultCell.of(value));
            }
            rows.add(new ResultRow(cells));
        }
        logger.debug("Native response from {}: {} column(s), {} row(s)", location, columns.size(), rows.size());
        return new QueryResult(columns, rows);
    }

    private static String unwrap(String body, String location) {
        if (body == null || body.isBlank()) {
            throw new RemoteAccessException("query", location, "Malformed native response: empty body");
        }
        int start = body.indexOf(WRAPPER);
        if (start < 0) {
            int brace = body.indexOf('{');
            return brace < 0 ? body : body.substring(brace);
        }
        int end = body.lastIndexOf(')');
        if (end < start) {
            throw new RemoteAccessException("query", location, "Malformed native response: unterminated wrapper");
        }
        return body.substring(start + WRAPPER.length(), end);
    }

    private JsonNode readJson(String json, String location) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RemoteAccessException("query", location, "Malformed native response: " + e.getOriginalMessage(), -1, e);
        }
    }

    private static String messages(JsonNode entries) {
        List<String> messages = new ArrayList<>();
        for (JsonNode entry : entries) {
            String text = entry.hasNonNull("detailed_message") ? entry.get("detailed_message").asText()
                : entry.path("message").asText(entry.path("reason").asText());
            messages.add(text);
        }
        return messages.isEmpty() ? "unknown error" : String.join("; ", messages);
    }

    /**
     * Converts one native cell value to the Java value direct evaluation would produce.
     *
     * @param v the JSON value (may be null)
     * @return the value
     */
    static Object convert(JsonNode v) {
        if (v == null || v.isNull()) {
            return null;
        }
        if (v.isBoolean()) {
            return v.booleanValue();
        }
        if (v.isNumber()) {
            double d = v.doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 9.007199254740992E15) {
                return (long) d;
            }
            return d;
        }
        if (v.isArray()) {
            // time of day: [h, m, s, ms]
            LocalTime time = LocalTime.of(v.path(0).asInt(), v.path(1).asInt(), v.path(2).asInt());
            return time.toString();
        }
        String text = v.asText();
        Matcher m = DATE_VALUE.matcher(text);
        if (m.matches()) {
            int year = Integer.parseInt(m.group(1));
            int month = Integer.parseInt(m.group(2)) + 1;
            int day = Integer.parseInt(m.group(3));
            if (m.group(4) == null) {
                return LocalDate.of(year, month, day).toString();
            }
            return LocalDateTime.of(year, month, day, Integer.parseInt(m.group(4)),
                Integer.parseInt(m.group(5)), Integer.parseInt(m.group(6))).toString();
        }
        return text;
    }
}
