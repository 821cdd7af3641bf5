package com.gridsql.test;

import com.fasterxml.jackson.databind.JsonNode;
import com.gridsql.grid.AppendRows;
import com.gridsql.grid.DeleteRows;
import com.gridsql.grid.GridSource;
import com.gridsql.grid.GridWrite;
import com.gridsql.grid.GridWriteResult;
import com.gridsql.grid.UpdateCells;
import com.gridsql.table.GridLocation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory {@link GridSource} for tests.
 *
 * <p>Serves canned values per range and canned native-query responses, and records every
 * call so tests can assert what reached the grid. A failure can be armed per operation
 * ("read", "query", "write", "metadata").
 */
public class InMemoryGridSource implements GridSource {

    private final Map<String, List<List<Object>>> values = new HashMap<>();
    private final Map<String, RuntimeException> failures = new HashMap<>();
    private final List<GridLocation> reads = new ArrayList<>();
    private final List<String> queries = new ArrayList<>();
    private final List<GridWrite> writes = new ArrayList<>();
    private String queryResponse;
    private JsonNode metadata;
    private String updateTime = "2024-03-15T10:30:00Z";

    public InMemoryGridSource withValues(String range, List<List<Object>> rows) {
        values.put(range, rows);
        return this;
    }

    public InMemoryGridSource withQueryResponse(String body) {
        this.queryResponse = body;
        return this;
    }

    public InMemoryGridSource withMetadata(JsonNode document) {
        this.metadata = document;
        return this;
    }

    public InMemoryGridSource failing(String operation, RuntimeException error) {
        failures.put(operation, error);
        return this;
    }

    public InMemoryGridSource withUpdateTime(String time) {
        this.updateTime = time;
        return this;
    }

    @Override
    public List<List<Object>> readValues(GridLocation location) {
        reads.add(location);
        failIfArmed("read");
        List<List<Object>> rows = values.get(location.range());
        return rows == null ? new ArrayList<>() : rows;
    }

    @Override
    public String query(GridLocation location, String nativeQuery, int headerRows) {
        queries.add(nativeQuery);
        failIfArmed("query");
        if (queryResponse == null) {
            throw new IllegalStateException("no canned query response for " + location);
        }
        return queryResponse;
    }

    @Override
    public GridWriteResult write(GridLocation location, GridWrite write) {
        writes.add(write);
        failIfArmed("write");
        if (write instanceof AppendRows append) {
            int cells = append.rows().stream().mapToInt(List::size).sum();
            String range = location.gridRange().sheetPrefix() + "A100:C" + (99 + append.rowCount());
            return new GridWriteResult(append.rowCount(), cells, range, updateTime);
        }
        if (write instanceof UpdateCells update) {
            return new GridWriteResult(update.rowCount(), update.cells().size(), null, updateTime);
        }
        return new GridWriteResult(((DeleteRows) write).rowCount(), 0, null, updateTime);
    }

    @Override
    public JsonNode readMetadata(GridLocation location) {
        failIfArmed("metadata");
        return metadata;
    }

    private void failIfArmed(String operation) {
        RuntimeException error = failures.get(operation);
        if (error != null) {
            throw error;
        }
    }

    public List<GridLocation> reads() {
        return reads;
    }

    public List<String> queries() {
        return queries;
    }

    public List<GridWrite> writes() {
        return writes;
    }

    public int callCount() {
        return reads.size() + queries.size() + writes.size();
    }
}
