package com.gridsql.statement;

/**
 * A FROM, JOIN or mutation target: a virtual table ({@code :name}) or a grid range.
 */
public sealed interface TableReference permits VirtualTableRef, RangeRef {

    /**
     * Returns the explicit alias from {@code AS}, or null.
     *
     * @return the alias
     */
    String alias();

    /**
     * Returns the name used to qualify this table's columns: the alias, falling back to
     * the virtual-table name.
     *
     * @return the effective alias, or null for an unaliased range
     */
    String effectiveAlias();
}
