package com.gridsql.result;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * Result of a SELECT: the data plus, when requested for a grid range, cell metadata.
 */
public final class SelectResult implements ExecutionResult {

    private final QueryResult data;
    private final JsonNode metadata;

    public SelectResult(QueryResult data, JsonNode metadata) {
        this.data = Objects.requireNonNull(data, "data must not be null");
        this.metadata = metadata;
    }

    public SelectResult(QueryResult data) {
        this(data, null);
    }

    @Override
    public String operation() {
        return "SELECT";
    }

    public QueryResult data() {
        return data;
    }

    /**
     * Returns cell metadata of the source range.
     *
     * @return the metadata, or null when not requested or not applicable
     */
    public JsonNode metadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "SelectResult(" + data + (metadata != null ? ", with metadata" : "") + ")";
    }
}
