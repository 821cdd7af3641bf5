package com.gridsql.exception;

/**
 * Exception thrown when a statement parses but cannot be executed as written.
 *
 * <p>All validation runs before any remote I/O. Typical causes:
 * <ul>
 *   <li>UPDATE or DELETE without a WHERE clause</li>
 *   <li>A {@code :name} reference to a virtual table that was not supplied</li>
 *   <li>A column that does not exist, or an unqualified column that is ambiguous after a JOIN</li>
 *   <li>A missing or malformed target location</li>
 * </ul>
 *
 * <p>The message wording of these categories is stable: callers match on "where",
 * "not found" and "invalid".
 */
public class ValidationException extends RuntimeException {

    private final String phase;
    private final String context;
    private final String suggestion;

    /**
     * Creates a validation exception.
     *
     * @param message the error message
     * @param phase the validation phase (e.g. "target resolution", "column resolution")
     * @param context what was being validated
     * @param suggestion how to fix it (may be null)
     */
    public ValidationException(String message, String phase, String context, String suggestion) {
        super(message);
        this.phase = phase;
        this.context = context;
        this.suggestion = suggestion;
    }

    /**
     * Creates a validation exception without context.
     *
     * @param message the error message
     * @param phase the validation phase
     */
    public ValidationException(String message, String phase) {
        this(message, phase, null, null);
    }

    public String getPhase() {
        return phase;
    }

    public String getContext() {
        return context;
    }

    public String getSuggestion() {
        return suggestion;
    }

    /**
     * Returns the message followed by the suggestion, if any.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        if (suggestion == null || suggestion.isEmpty()) {
            return getMessage();
        }
        return getMessage() + ". " + suggestion;
    }
}
