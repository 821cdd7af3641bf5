package com.gridsql.statement;

/**
 * A parsed statement: exactly one of SELECT, INSERT, UPDATE or DELETE.
 *
 * <p>Statements are immutable and live for a single execution.
 */
public sealed interface Statement
    permits SelectStatement, InsertStatement, UpdateStatement, DeleteStatement {

    /**
     * Returns the operation name reported in results ("SELECT", "INSERT", ...).
     *
     * @return the operation name
     */
    String operation();

    /**
     * Returns the table the statement reads or writes.
     *
     * @return the explicit source, or null for the caller's default grid range
     */
    TableReference source();
}
