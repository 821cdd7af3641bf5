package com.gridsql.result;

/**
 * What one statement returns: a {@link SelectResult} or a {@link MutationSummary}.
 */
public sealed interface ExecutionResult permits SelectResult, MutationSummary {

    /**
     * Returns the operation name, "SELECT", "INSERT", "UPDATE" or "DELETE".
     *
     * @return the operation
     */
    String operation();
}
