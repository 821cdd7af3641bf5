package com.gridsql.table;

import com.gridsql.exception.ValidationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The virtual tables supplied with one call, by name.
 *
 * <p>Each table is a 2-D array whose first row is the header. The caller's arrays are
 * never modified; mutations work on {@link #copyOf(String) copies}.
 */
public final class VirtualTableSet {

    private final Map<String, List<List<Object>>> tables;

    public VirtualTableSet(Map<String, List<List<Object>>> tables) {
        this.tables = tables == null ? Collections.emptyMap() : new LinkedHashMap<>(tables);
    }

    public static VirtualTableSet empty() {
        return new VirtualTableSet(null);
    }

    public boolean contains(String name) {
        return tables.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(tables.keySet());
    }

    public boolean isEmpty() {
        return tables.isEmpty();
    }

    /**
     * Returns the named table's 2-D array.
     *
     * @param name the table name, without the colon
     * @return the array, header first
     * @throws ValidationException if no table of that name was supplied
     */
    public List<List<Object>> get(String name) {
        List<List<Object>> table = tables.get(name);
        if (table == null) {
            throw notFound(name, tables.keySet());
        }
        return table;
    }

    /**
     * Returns a mutable deep copy of the named table's array.
     *
     * @param name the table name
     * @return a copy whose rows may be modified freely
     */
    public List<List<Object>> copyOf(String name) {
        List<List<Object>> copy = new ArrayList<>();
        for (List<Object> row : get(name)) {
            copy.add(row == null ? new ArrayList<>() : new ArrayList<>(row));
        }
        return copy;
    }

    /**
     * Builds the error for a missing virtual table.
     *
     * @param name the missing name
     * @param available the supplied names
     * @return the exception
     */
    public static ValidationException notFound(String name, Set<String> available) {
        return new ValidationException(
            "Virtual table ':" + name + "' not found",
            "target resolution",
            "supplied tables: " + available,
            "Pass the table in the virtual table map under the key '" + name + "'");
    }
}
