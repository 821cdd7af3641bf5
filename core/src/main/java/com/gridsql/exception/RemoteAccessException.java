package com.gridsql.exception;

/**
 * Exception thrown when the grid collaborator fails to read, query or write a range.
 *
 * <p>Wraps the collaborator's failure (permission denied, range not found, malformed
 * location, transport error) with the operation and location that failed. The engine
 * never retries and never swallows these.
 */
public class RemoteAccessException extends RuntimeException {

    private final String operation;
    private final String location;
    private final int statusCode;

    /**
     * Creates a remote access exception.
     *
     * @param operation the operation that failed ("read", "query", "write", "metadata")
     * @param location the range or URL involved
     * @param message the error message
     * @param statusCode the remote status code, or -1 if none
     * @param cause the underlying cause (may be null)
     */
    public RemoteAccessException(String operation, String location, String message,
                                 int statusCode, Throwable cause) {
        super(String.format("%s failed for %s: %s", capitalize(operation), location, message), cause);
        this.operation = operation;
        this.location = location;
        this.statusCode = statusCode;
    }

    public RemoteAccessException(String operation, String location, String message) {
        this(operation, location, message, -1, null);
    }

    public RemoteAccessException(String operation, String location, Throwable cause) {
        this(operation, location, String.valueOf(cause.getMessage()), -1, cause);
    }

    public String getOperation() {
        return operation;
    }

    public String getLocation() {
        return location;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Returns a user-friendly error message with guidance for common status codes.
     *
     * @return the message
     */
    public String getUserMessage() {
        return switch (statusCode) {
            case 401, 403 -> getMessage() + ". Check that the credentials grant access to the spreadsheet.";
            case 404 -> getMessage() + ". Spreadsheet or sheet not found; check the id and the sheet name.";
            case 400 -> getMessage() + ". The range or query was rejected as invalid.";
            default -> getMessage();
        };
    }

    private static String capitalize(String s) {
        if (s == null || s.isEmpty()) {
            return "Remote operation";
        }
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
