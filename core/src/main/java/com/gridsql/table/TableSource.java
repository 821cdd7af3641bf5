package com.gridsql.table;

/**
 * Where a {@link Table} came from.
 */
public sealed interface TableSource permits VirtualTableSource, GridRangeSource, JoinedSource {

    /**
     * Returns a short description for logs and error messages.
     *
     * @return the description
     */
    String describe();
}
