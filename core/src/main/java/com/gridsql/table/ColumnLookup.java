package com.gridsql.table;

import com.gridsql.exception.ValidationException;
import com.gridsql.expression.ColumnReference;
import java.util.ArrayList;
import java.util.List;

/**
 * Resolves a {@link ColumnReference} to a position in a column list.
 *
 * <p>Rules:
 * <ul>
 *   <li>A qualified reference only considers columns of that alias</li>
 *   <li>An exact name match wins; otherwise a unique case-insensitive match is used</li>
 *   <li>An unqualified name present in more than one joined table is ambiguous</li>
 * </ul>
 */
public final class ColumnLookup {

    private ColumnLookup() {}

    /**
     * Finds the index of the referenced column.
     *
     * @param columns the columns to search
     * @param ref the reference
     * @return the zero-based index
     * @throws ValidationException if the column is missing or ambiguous
     */
    public static int resolve(List<Column> columns, ColumnReference ref) {
        List<Integer> candidates = find(columns, ref, true);
        if (candidates.isEmpty()) {
            candidates = find(columns, ref, false);
        }
        if (candidates.size() == 1) {
            return candidates.get(0);
        }
        if (candidates.isEmpty()) {
            throw new ValidationException(
                "Column '" + ref.qualifiedName() + "' not found",
                "column resolution",
                "available columns: " + describe(columns),
                ref.isQualified() ? null : "Check the header names of the source table");
        }
        throw new ValidationException(
            "Column '" + ref.qualifiedName() + "' is ambiguous",
            "column resolution",
            "matches " + describeMatches(columns, candidates),
            "Qualify the column with its table alias, for example alias." + ref.columnName());
    }

    /**
     * Returns whether the reference resolves to exactly one column.
     *
     * @param columns the columns to search
     * @param ref the reference
     * @return true when resolvable
     */
    public static boolean canResolve(List<Column> columns, ColumnReference ref) {
        List<Integer> candidates = find(columns, ref, true);
        if (candidates.isEmpty()) {
            candidates = find(columns, ref, false);
        }
        return candidates.size() == 1;
    }

    private static List<Integer> find(List<Column> columns, ColumnReference ref, boolean exact) {
        List<Integer> matches = new ArrayList<>();
        for (int i = 0; i < columns.size(); i++) {
            Column c = columns.get(i);
            if (ref.isQualified() && (c.qualifier() == null || !c.qualifier().equalsIgnoreCase(ref.qualifier()))) {
                continue;
            }
            boolean same = exact ? c.name().equals(ref.columnName()) : c.name().equalsIgnoreCase(ref.columnName());
            if (same) {
                matches.add(i);
            }
        }
        return matches;
    }

    private static String describe(List<Column> columns) {
        List<String> names = new ArrayList<>();
        for (Column c : columns) {
            names.add(c.id(true));
        }
        return names.toString();
    }

    private static String describeMatches(List<Column> columns, List<Integer> indexes) {
        List<String> names = new ArrayList<>();
        for (int i : indexes) {
            names.add(columns.get(i).id(true));
        }
        return names.toString();
    }
}
