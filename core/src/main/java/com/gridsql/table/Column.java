package com.gridsql.table;

import java.util.Objects;

/**
 * A column of a {@link Table}.
 *
 * <p>For grid ranges the name is the column letter and the label comes from the header
 * row; for virtual tables name and label are both the header text. The qualifier is the
 * owning table's alias, used for {@code alias.column} references.
 */
public final class Column {

    private final String name;
    private final String qualifier;
    private final String label;

    public Column(String name, String qualifier, String label) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.qualifier = qualifier;
        this.label = label != null ? label : name;
    }

    public String name() {
        return name;
    }

    public String qualifier() {
        return qualifier;
    }

    public String label() {
        return label;
    }

    /**
     * Returns the id used in results: {@code alias.name} when qualified output is
     * requested, otherwise the bare name.
     *
     * @param qualified whether to include the qualifier
     * @return the id
     */
    public String id(boolean qualified) {
        return qualified && qualifier != null ? qualifier + "." + name : name;
    }

    public Column withQualifier(String newQualifier) {
        return new Column(name, newQualifier, label);
    }

    public Column withLabel(String newLabel) {
        return new Column(name, qualifier, newLabel);
    }

    @Override
    public String toString() {
        return id(true);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Column)) return false;
        Column that = (Column) obj;
        return name.equals(that.name) && Objects.equals(qualifier, that.qualifier) &&
               label.equals(that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, qualifier, label);
    }
}
