package com.gridsql.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Structured per-statement logging.
 *
 * <p>{@link #start(String)} places a short correlation id in the SLF4J MDC under
 * {@value #MDC_KEY} so every log line written while the statement runs carries it;
 * {@link #end()} removes it and must be called from a {@code finally} block.
 *
 * <p>Example usage:
 * <pre>
 *   String id = StatementLogger.newStatementId();
 *   StatementLogger.start(id);
 *   try {
 *       ...
 *       StatementLogger.logCompletion("SELECT", "evaluated", rows, elapsedMs);
 *   } finally {
 *       StatementLogger.end();
 *   }
 * </pre>
 */
public final class StatementLogger {

    private static final Logger logger = LoggerFactory.getLogger(StatementLogger.class);

    /** MDC key holding the statement id */
    public static final String MDC_KEY = "statementId";

    private StatementLogger() {}

    /**
     * Generates a short statement id such as {@code s_1a2b3c4d}.
     *
     * @return the id
     */
    public static String newStatementId() {
        return "s_" + UUID.randomUUID().toString().substring(0, 8);
    }

    public static void start(String statementId) {
        MDC.put(MDC_KEY, statementId);
    }

    /**
     * Returns the id of the statement running on this thread.
     *
     * @return the id, or null outside a statement
     */
    public static String currentStatementId() {
        return MDC.get(MDC_KEY);
    }

    public static void logParse(String operation, long elapsedMs) {
        logger.debug("Parsed {} in {}ms", operation, elapsedMs);
    }

    public static void logRoute(String route, String reason) {
        logger.debug("Routing: {} ({})", route, reason);
    }

    public static void logRemoteCall(String operation, String location) {
        logger.debug("Remote {} on {}", operation, location);
    }

    public static void logCompletion(String operation, String route, int rows, long elapsedMs) {
        logger.info("{} completed via {}: {} row(s) in {}ms", operation, route, rows, elapsedMs);
    }

    public static void logFailure(Throwable error) {
        logger.warn("Statement failed: {}", error.getMessage());
    }

    public static void end() {
        MDC.remove(MDC_KEY);
    }
}
