package com.gridsql.statement;

import java.util.Objects;

/**
 * Reference to a caller-supplied virtual table, written {@code :name [AS alias]}.
 */
public final class VirtualTableRef implements TableReference {

    private final String name;
    private final String alias;

    public VirtualTableRef(String name, String alias) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.alias = alias;
    }

    public String name() {
        return name;
    }

    @Override
    public String alias() {
        return alias;
    }

    @Override
    public String effectiveAlias() {
        return alias != null ? alias : name;
    }

    @Override
    public String toString() {
        return ":" + name + (alias != null ? " AS " + alias : "");
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof VirtualTableRef)) return false;
        VirtualTableRef that = (VirtualTableRef) obj;
        return name.equals(that.name) && Objects.equals(alias, that.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, alias);
    }
}
