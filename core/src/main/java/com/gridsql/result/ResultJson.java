package com.gridsql.result;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Serializes results to their JSON shapes.
 *
 * <p>SELECT:
 * <pre>
 *   {"operation":"SELECT",
 *    "data":{"cols":[{"id":"A","label":"Name","type":"string"}],
 *            "rows":[{"c":[{"v":"Alice"}]}]},
 *    "metadata":{...}}
 * </pre>
 * Mutations:
 * <pre>
 *   {"operation":"UPDATE","updatedRows":2,"data":[[...],...]}
 *   {"operation":"DELETE","deletedRows":1,"rowNumbers":[7],"updateTime":"..."}
 * </pre>
 */
public final class ResultJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ResultJson() {}

    /**
     * Converts a result to a JSON tree.
     *
     * @param result the result
     * @return the JSON object
     */
    public static ObjectNode toJson(ExecutionResult result) {
        if (result instanceof SelectResult select) {
            return selectToJson(select);
        }
        return mutationToJson((MutationSummary) result);
    }

    /**
     * Converts a result to JSON text.
     *
     * @param result the result
     * @return the JSON string
     */
    public static String toJsonString(ExecutionResult result) {
        try {
            return MAPPER.writeValueAsString(toJson(result));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize result: " + e.getMessage(), e);
        }
    }

    /**
     * Converts the tabular part alone, {@code {cols, rows}}.
     *
     * @param data the table
     * @return the JSON object
     */
    public static ObjectNode dataToJson(QueryResult data) {
        ObjectNode node = MAPPER.createObjectNode();
        ArrayNode cols = node.putArray("cols");
        for (ResultColumn column : data.columns()) {
            ObjectNode col = cols.addObject();
            col.put("id", column.id());
            col.put("label", column.label());
            col.put("type", column.type().typeName());
            if (column.pattern() != null) {
                col.put("pattern", column.pattern());
            }
        }
        ArrayNode rows = node.putArray("rows");
        for (ResultRow row : data.rows()) {
            ArrayNode cells = rows.addObject().putArray("c");
            for (ResultCell cell : row.cells()) {
                ObjectNode c = cells.addObject();
                c.set("v", MAPPER.valueToTree(cell.value()));
                if (cell.formatted() != null) {
                    c.put("f", cell.formatted());
                }
            }
        }
        return node;
    }

    private static ObjectNode selectToJson(SelectResult select) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("operation", select.operation());
        node.set("data", dataToJson(select.data()));
        if (select.metadata() != null) {
            node.set("metadata", select.metadata());
        }
        return node;
    }

    private static ObjectNode mutationToJson(MutationSummary summary) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("operation", summary.operation());
        node.put(summary.countField(), summary.affectedRows());
        if (summary.updatedCells() != null) {
            node.put("updatedCells", summary.updatedCells());
        }
        if (summary.affectedRanges() != null) {
            ArrayNode ranges = node.putArray("affectedRanges");
            summary.affectedRanges().forEach(ranges::add);
        }
        if (summary.rowNumbers() != null) {
            ArrayNode rows = node.putArray("rowNumbers");
            summary.rowNumbers().forEach(rows::add);
        }
        if (summary.updatedRange() != null) {
            node.put("updatedRange", summary.updatedRange());
        }
        if (summary.updateTime() != null) {
            node.put("updateTime", summary.updateTime());
        }
        if (summary.message() != null) {
            node.put("message", summary.message());
        }
        if (summary.data() != null) {
            node.set("data", toArray(summary.data()));
        }
        return node;
    }

    private static ArrayNode toArray(List<List<Object>> data) {
        ArrayNode array = MAPPER.createArrayNode();
        for (List<Object> row : data) {
            array.add(MAPPER.<ArrayNode>valueToTree(row));
        }
        return array;
    }
}
