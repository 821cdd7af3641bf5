package com.gridsql.table;

import com.gridsql.exception.ValidationException;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Where a grid range lives: a spreadsheet id and an A1 range within it.
 *
 * <p>The id may be given as a full spreadsheet URL; the id segment after
 * {@code /spreadsheets/d/} is extracted. Both parts are validated on construction so a
 * malformed location fails before any remote call.
 */
public final class GridLocation {

    private static final Pattern URL_ID = Pattern.compile("/spreadsheets/d/([a-zA-Z0-9_-]+)");
    private static final Pattern BARE_ID = Pattern.compile("^[a-zA-Z0-9_-]{20,60}$");

    private final String spreadsheetId;
    private final String range;
    private final GridRange gridRange;

    private GridLocation(String spreadsheetId, String range) {
        this.spreadsheetId = spreadsheetId;
        this.range = range;
        this.gridRange = GridRange.parse(range);
    }

    /**
     * Creates a location from a spreadsheet id or URL and a range.
     *
     * @param idOrUrl the spreadsheet id, or a URL containing it
     * @param range the A1 range
     * @return the location
     * @throws ValidationException if either part is invalid
     */
    public static GridLocation of(String idOrUrl, String range) {
        return new GridLocation(extractSpreadsheetId(idOrUrl), Objects.requireNonNull(range, "range").trim());
    }

    /**
     * Extracts and validates a spreadsheet id.
     *
     * @param idOrUrl a bare id or a spreadsheet URL
     * @return the id
     * @throws ValidationException if no valid id is found
     */
    public static String extractSpreadsheetId(String idOrUrl) {
        if (idOrUrl == null || idOrUrl.isBlank()) {
            throw new ValidationException("Invalid spreadsheet id: none given", "target resolution");
        }
        String candidate = idOrUrl.trim();
        Matcher m = URL_ID.matcher(candidate);
        if (m.find()) {
            candidate = m.group(1);
        }
        if (!BARE_ID.matcher(candidate).matches()) {
            throw new ValidationException(
                "Invalid spreadsheet id: '" + idOrUrl + "'",
                "target resolution",
                idOrUrl,
                "Pass the id from the spreadsheet URL (20 to 60 letters, digits, '-' or '_')");
        }
        return candidate;
    }

    /**
     * Returns a location for another range of the same spreadsheet.
     *
     * @param otherRange the range
     * @return the new location
     */
    public GridLocation withRange(String otherRange) {
        return new GridLocation(spreadsheetId, otherRange.trim());
    }

    public String spreadsheetId() {
        return spreadsheetId;
    }

    public String range() {
        return range;
    }

    public GridRange gridRange() {
        return gridRange;
    }

    @Override
    public String toString() {
        return spreadsheetId + "/" + range;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof GridLocation)) return false;
        GridLocation that = (GridLocation) obj;
        return spreadsheetId.equals(that.spreadsheetId) && range.equals(that.range);
    }

    @Override
    public int hashCode() {
        return Objects.hash(spreadsheetId, range);
    }
}
