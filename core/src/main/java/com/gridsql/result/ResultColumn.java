package com.gridsql.result;

import com.gridsql.types.DataType;
import java.util.Objects;

/**
 * One output column: id, display label, reported type and optional display pattern.
 */
public final class ResultColumn {

    private final String id;
    private final String label;
    private final DataType type;
    private final String pattern;

    public ResultColumn(String id, String label, DataType type, String pattern) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.label = label != null ? label : id;
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.pattern = pattern;
    }

    public ResultColumn(String id, String label, DataType type) {
        this(id, label, type, null);
    }

    public String id() {
        return id;
    }

    public String label() {
        return label;
    }

    public DataType type() {
        return type;
    }

    /**
     * Returns the FORMAT pattern applied to this column.
     *
     * @return the pattern, or null
     */
    public String pattern() {
        return pattern;
    }

    @Override
    public String toString() {
        return id + ":" + type.typeName();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ResultColumn)) return false;
        ResultColumn that = (ResultColumn) obj;
        return id.equals(that.id) && label.equals(that.label) && type.equals(that.type) &&
               Objects.equals(pattern, that.pattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, label, type, pattern);
    }
}
