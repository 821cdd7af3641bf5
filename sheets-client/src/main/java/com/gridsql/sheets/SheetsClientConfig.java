package com.gridsql.sheets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Endpoints and timeouts for {@link SheetsGridSource}.
 *
 * <p>The request timeout can be overridden with the {@code gridsql.sheets.timeoutMs}
 * system property (default 30000). Base URLs are only changed by tests.
 */
public final class SheetsClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(SheetsClientConfig.class);

    /** System property for the request timeout in milliseconds */
    public static final String PROP_TIMEOUT_MS = "gridsql.sheets.timeoutMs";

    public static final String DEFAULT_VALUES_BASE_URL = "https://sheets.googleapis.com/v4/spreadsheets";
    public static final String DEFAULT_QUERY_BASE_URL = "https://docs.google.com/spreadsheets/d";
    public static final long DEFAULT_TIMEOUT_MS = 30_000L;

    private final String valuesBaseUrl;
    private final String queryBaseUrl;
    private final Duration timeout;

    public SheetsClientConfig(String valuesBaseUrl, String queryBaseUrl, Duration timeout) {
        this.valuesBaseUrl = stripSlash(Objects.requireNonNull(valuesBaseUrl, "valuesBaseUrl must not be null"));
        this.queryBaseUrl = stripSlash(Objects.requireNonNull(queryBaseUrl, "queryBaseUrl must not be null"));
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    /**
     * Returns the production endpoints with the configured timeout.
     *
     * @return the configuration
     */
    public static SheetsClientConfig fromSystemProperties() {
        return new SheetsClientConfig(DEFAULT_VALUES_BASE_URL, DEFAULT_QUERY_BASE_URL,
            Duration.ofMillis(getConfiguredTimeoutMs()));
    }

    /**
     * Returns a configuration pointing every endpoint at one base URL.
     *
     * @param baseUrl for example {@code http://localhost:8080}
     * @return the configuration
     */
    public static SheetsClientConfig forBaseUrl(String baseUrl) {
        String base = stripSlash(baseUrl);
        return new SheetsClientConfig(base + "/v4/spreadsheets", base + "/spreadsheets/d",
            Duration.ofMillis(DEFAULT_TIMEOUT_MS));
    }

    /** Base of the values, batch update and metadata endpoints */
    public String valuesBaseUrl() {
        return valuesBaseUrl;
    }

    /** Base of the visualization query endpoint */
    public String queryBaseUrl() {
        return queryBaseUrl;
    }

    public Duration timeout() {
        return timeout;
    }

    public SheetsClientConfig withTimeout(Duration newTimeout) {
        return new SheetsClientConfig(valuesBaseUrl, queryBaseUrl, newTimeout);
    }

    private static long getConfiguredTimeoutMs() {
        String value = System.getProperty(PROP_TIMEOUT_MS);
        if (value != null) {
            try {
                long ms = Long.parseLong(value.trim());
                if (ms > 0) {
                    return ms;
                }
                logger.warn("Ignoring {}={}: must be positive", PROP_TIMEOUT_MS, value);
            } catch (NumberFormatException e) {
                logger.warn("Ignoring {}={}: not a number", PROP_TIMEOUT_MS, value);
            }
        }
        return DEFAULT_TIMEOUT_MS;
    }

    private static String stripSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @Override
    public String toString() {
        return String.format("SheetsClientConfig(values=%s, query=%s, timeout=%s)",
            valuesBaseUrl, queryBaseUrl, timeout);
    }
}
