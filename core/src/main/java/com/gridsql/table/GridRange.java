package com.gridsql.table;

import com.gridsql.exception.ValidationException;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A parsed A1 range: optional sheet name, start and end column, optional rows.
 *
 * <p>Accepted forms: {@code A:D}, {@code A2:D}, {@code A2:D50}, {@code C5},
 * {@code Sheet1!A:D}, {@code My Sheet!B2:C}. Columns are zero-based indexes here and
 * rows one-based sheet rows, as the grid numbers them.
 */
public final class GridRange {

    /** Shape every range must have before it is sent anywhere. */
    public static final Pattern RANGE_PATTERN =
        Pattern.compile("^([A-Za-z0-9_\\s]+!)?[A-Z]+[0-9]*(:[A-Z]+[0-9]*)?$");

    private static final Pattern CELL = Pattern.compile("([A-Z]+)([0-9]*)");

    private final String sheetName;
    private final int startColumn;
    private final int startRow;
    private final int endColumn;
    private final Integer endRow;

    private GridRange(String sheetName, int startColumn, int startRow, int endColumn, Integer endRow) {
        this.sheetName = sheetName;
        this.startColumn = startColumn;
        this.startRow = startRow;
        this.endColumn = endColumn;
        this.endRow = endRow;
    }

    /**
     * Parses an A1 range.
     *
     * @param range the range text
     * @return the range
     * @throws ValidationException if the range is malformed
     */
    public static GridRange parse(String range) {
        if (range == null || !RANGE_PATTERN.matcher(range.trim()).matches()) {
            throw new ValidationException(
                "Invalid range: '" + range + "'",
                "target resolution",
                "range " + range,
                "Use A1 notation such as Sheet1!A:D or A2:C10");
        }
        String text = range.trim();
        String sheet = null;
        int bang = text.indexOf('!');
        if (bang >= 0) {
            sheet = text.substring(0, bang).trim();
            text = text.substring(bang + 1);
        }
        String[] parts = text.split(":");
        Matcher start = CELL.matcher(parts[0]);
        Matcher end = CELL.matcher(parts.length > 1 ? parts[1] : parts[0]);
        if (!start.matches() || !end.matches()) {
            throw new ValidationException("Invalid range: '" + range + "'", "target resolution");
        }
        int startCol = columnIndex(start.group(1));
        int endCol = columnIndex(end.group(1));
        int startRow = start.group(2).isEmpty() ? 1 : Integer.parseInt(start.group(2));
        Integer endRow = end.group(2).isEmpty() ? null : Integer.valueOf(end.group(2));
        if (parts.length == 1 && !start.group(2).isEmpty()) {
            endRow = startRow;
        }
        if (endCol < startCol || (endRow != null && endRow < startRow)) {
            throw new ValidationException(
                "Invalid range: '" + range + "' ends before it starts", "target resolution");
        }
        return new GridRange(sheet, startCol, startRow, endCol, endRow);
    }

    /**
     * Returns the sheet name.
     *
     * @return the sheet name, or null when the range applies to the first sheet
     */
    public String sheetName() {
        return sheetName;
    }

    public int startColumn() {
        return startColumn;
    }

    public int endColumn() {
        return endColumn;
    }

    public int startRow() {
        return startRow;
    }

    /**
     * Returns the last row of the range.
     *
     * @return the end row, or null when the range is open-ended downwards
     */
    public Integer endRow() {
        return endRow;
    }

    public int width() {
        return endColumn - startColumn + 1;
    }

    /**
     * Returns the letter of the column at a zero-based offset within this range.
     *
     * @param offset the offset from the first column
     * @return the column letters
     */
    public String columnLetterAt(int offset) {
        return columnLetters(startColumn + offset);
    }

    /**
     * Returns the A1 address of one cell on this range's sheet.
     *
     * @param columnIndex absolute zero-based column index
     * @param row one-based sheet row
     * @return the address, for example {@code Sheet1!C5} or {@code 'My Sheet'!C5}
     */
    public String cellAddress(int columnIndex, int row) {
        return sheetPrefix() + columnLetters(columnIndex) + row;
    }

    /**
     * Returns the sheet prefix for A1 addresses, quoted when the name is not a plain word.
     *
     * @return the prefix including '!', or empty for the first sheet
     */
    public String sheetPrefix() {
        if (sheetName == null) {
            return "";
        }
        if (sheetName.matches("[A-Za-z0-9_]+")) {
            return sheetName + "!";
        }
        return "'" + sheetName.replace("'", "''") + "'!";
    }

    // ==================== Column letters ====================

    /**
     * Converts column letters to a zero-based index: A=0, Z=25, AA=26.
     *
     * @param letters upper-case column letters
     * @return the index
     */
    public static int columnIndex(String letters) {
        int index = 0;
        for (int i = 0; i < letters.length(); i++) {
            index = index * 26 + (letters.charAt(i) - 'A' + 1);
        }
        return index - 1;
    }

    /**
     * Converts a zero-based column index to letters: 0=A, 25=Z, 26=AA.
     *
     * @param index the index
     * @return the letters
     */
    public static String columnLetters(int index) {
        StringBuilder sb = new StringBuilder();
        int n = index + 1;
        while (n > 0) {
            int rem = (n - 1) % 26;
            sb.insert(0, (char) ('A' + rem));
            n = (n - 1) / 26;
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        String end = columnLetters(endColumn) + (endRow != null ? endRow : "");
        return sheetPrefix() + columnLetters(startColumn) + startRow + ":" + end;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof GridRange)) return false;
        GridRange that = (GridRange) obj;
        return startColumn == that.startColumn && startRow == that.startRow &&
               endColumn == that.endColumn && Objects.equals(endRow, that.endRow) &&
               Objects.equals(sheetName, that.sheetName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sheetName, startColumn, startRow, endColumn, endRow);
    }
}
