package com.gridsql.grid;

import com.fasterxml.jackson.databind.JsonNode;
import com.gridsql.exception.RemoteAccessException;
import com.gridsql.table.GridLocation;
import java.util.List;

/**
 * The external collaborator giving authenticated access to grid ranges.
 *
 * <p>The engine calls it at most once to read and once to write per statement and never
 * retries. Implementations report failures as {@link RemoteAccessException}; anything
 * else they throw is wrapped by the engine with the operation and location.
 *
 * <p>Implementations must be safe for concurrent use if the engine is shared between
 * threads.
 */
public interface GridSource {

    /**
     * Reads the cell values of a range, header rows included.
     *
     * <p>Values are Strings, Numbers, Booleans or null. Rows may be shorter than the
     * range is wide, and trailing empty rows may be omitted.
     *
     * @param location the range to read
     * @return the rows
     */
    List<List<Object>> readValues(GridLocation location);

    /**
     * Runs a query in the grid's native dialect against a range.
     *
     * @param location the range to query
     * @param nativeQuery the query text
     * @param headerRows how many leading rows are headers
     * @return the raw response body
     */
    String query(GridLocation location, String nativeQuery, int headerRows);

    /**
     * Applies one write to the spreadsheet holding the range.
     *
     * @param location the range the write targets
     * @param write the write
     * @return what the grid reported
     */
    GridWriteResult write(GridLocation location, GridWrite write);

    /**
     * Reads cell metadata (formatted value, entered value or formula, effective format)
     * for a range.
     *
     * @param location the range
     * @return the metadata document
     */
    default JsonNode readMetadata(GridLocation location) {
        throw new RemoteAccessException("metadata", location.toString(),
            "this grid source does not provide cell metadata");
    }
}
