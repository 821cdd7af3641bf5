package com.gridsql.table;

import java.util.Objects;

/**
 * A table loaded from a caller-supplied virtual table.
 */
public final class VirtualTableSource implements TableSource {

    private final String name;

    public VirtualTableSource(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public String name() {
        return name;
    }

    @Override
    public String describe() {
        return ":" + name;
    }
}
