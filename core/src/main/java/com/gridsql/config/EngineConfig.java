package com.gridsql.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Immutable engine settings.
 *
 * <p>Defaults can be overridden with system properties:
 * <ul>
 *   <li>{@code gridsql.bridge.enabled} (default true): translate eligible grid SELECTs
 *       to the native dialect</li>
 *   <li>{@code gridsql.grid.headerRows} (default 1): leading rows of a grid range that
 *       hold labels and never match a WHERE</li>
 *   <li>{@code gridsql.virtual.insertEnabled} (default true): allow INSERT into virtual
 *       tables</li>
 *   <li>{@code gridsql.virtual.emptyStringIsNull} (default true): {@code IS NULL}
 *       matches empty strings in virtual tables</li>
 *   <li>{@code gridsql.timezone} (default system zone): zone of {@code TODAY()} and
 *       {@code NOW()}</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 *   EngineConfig config = EngineConfig.builder()
 *       .bridgeEnabled(false)
 *       .clock(Clock.fixed(instant, ZoneOffset.UTC))
 *       .build();
 * </pre>
 */
public final class EngineConfig {

    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    /** System property for the native-dialect bridge switch */
    public static final String PROP_BRIDGE_ENABLED = "gridsql.bridge.enabled";

    /** System property for the number of header rows in grid ranges */
    public static final String PROP_HEADER_ROWS = "gridsql.grid.headerRows";

    /** System property for INSERT into virtual tables */
    public static final String PROP_VIRTUAL_INSERT = "gridsql.virtual.insertEnabled";

    /** System property for empty-string-is-null in virtual tables */
    public static final String PROP_EMPTY_STRING_IS_NULL = "gridsql.virtual.emptyStringIsNull";

    /** System property for the evaluation time zone */
    public static final String PROP_TIMEZONE = "gridsql.timezone";

    /** Default number of header rows */
    public static final int DEFAULT_HEADER_ROWS = 1;

    private final boolean bridgeEnabled;
    private final int headerRows;
    private final boolean virtualInsertEnabled;
    private final boolean emptyStringIsNull;
    private final Clock clock;

    private EngineConfig(Builder b) {
        this.bridgeEnabled = b.bridgeEnabled;
        this.headerRows = b.headerRows;
        this.virtualInsertEnabled = b.virtualInsertEnabled;
        this.emptyStringIsNull = b.emptyStringIsNull;
        this.clock = b.clock;
    }

    /**
     * Returns the built-in defaults, ignoring system properties.
     *
     * @return the default configuration
     */
    public static EngineConfig defaults() {
        return builder().build();
    }

    /**
     * Returns the defaults overridden by any {@code gridsql.*} system properties.
     *
     * @return the configuration
     */
    public static EngineConfig fromSystemProperties() {
        Builder b = builder()
            .bridgeEnabled(getConfiguredBoolean(PROP_BRIDGE_ENABLED, true))
            .headerRows(getConfiguredHeaderRows())
            .virtualInsertEnabled(getConfiguredBoolean(PROP_VIRTUAL_INSERT, true))
            .emptyStringIsNull(getConfiguredBoolean(PROP_EMPTY_STRING_IS_NULL, true));
        ZoneId zone = getConfiguredZone();
        if (zone != null) {
            b.clock(Clock.system(zone));
        }
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean bridgeEnabled() {
        return bridgeEnabled;
    }

    public int headerRows() {
        return headerRows;
    }

    public boolean virtualInsertEnabled() {
        return virtualInsertEnabled;
    }

    public boolean emptyStringIsNull() {
        return emptyStringIsNull;
    }

    public Clock clock() {
        return clock;
    }

    public Builder toBuilder() {
        return builder()
            .bridgeEnabled(bridgeEnabled)
            .headerRows(headerRows)
            .virtualInsertEnabled(virtualInsertEnabled)
            .emptyStringIsNull(emptyStringIsNull)
            .clock(clock);
    }

    @Override
    public String toString() {
        return String.format(
            "EngineConfig(bridge=%s, headerRows=%d, virtualInsert=%s, emptyStringIsNull=%s, zone=%s)",
            bridgeEnabled, headerRows, virtualInsertEnabled, emptyStringIsNull, clock.getZone());
    }

    // ========== Configuration Helpers ==========

    private static boolean getConfiguredBoolean(String property, boolean defaultValue) {
        String value = System.getProperty(property);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        String trimmed = value.trim();
        if (trimmed.equalsIgnoreCase("true")) {
            return true;
        }
        if (trimmed.equalsIgnoreCase("false")) {
            return false;
        }
        logger.warn("Ignoring {}={}: expected true or false", property, value);
        return defaultValue;
    }

    private static int getConfiguredHeaderRows() {
        String value = System.getProperty(PROP_HEADER_ROWS);
        if (value != null) {
            try {
                int rows = Integer.parseInt(value.trim());
                if (rows >= 0) {
                    return rows;
                }
                logger.warn("Ignoring {}={}: must not be negative", PROP_HEADER_ROWS, value);
            } catch (NumberFormatException e) {
                logger.warn("Ignoring {}={}: not an integer", PROP_HEADER_ROWS, value);
            }
        }
        return DEFAULT_HEADER_ROWS;
    }

    private static ZoneId getConfiguredZone() {
        String value = System.getProperty(PROP_TIMEZONE);
        if (value != null && !value.isBlank()) {
            try {
                return ZoneId.of(value.trim());
            } catch (DateTimeException e) {
                logger.warn("Ignoring {}={}: {}", PROP_TIMEZONE, value, e.getMessage());
            }
        }
        return null;
    }

    /**
     * Builder for {@link EngineConfig}.
     */
    public static final class Builder {
        private boolean bridgeEnabled = true;
        private int headerRows = DEFAULT_HEADER_ROWS;
        private boolean virtualInsertEnabled = true;
        private boolean emptyStringIsNull = true;
        private Clock clock = Clock.systemDefaultZone();

        private Builder() {}

        public Builder bridgeEnabled(boolean value) {
            this.bridgeEnabled = value;
            return this;
        }

        public Builder headerRows(int value) {
            if (value < 0) {
                throw new IllegalArgumentException("headerRows must not be negative: " + value);
            }
            this.headerRows = value;
            return this;
        }

        public Builder virtualInsertEnabled(boolean value) {
            this.virtualInsertEnabled = value;
            return this;
        }

        public Builder emptyStringIsNull(boolean value) {
            this.emptyStringIsNull = value;
            return this;
        }

        public Builder clock(Clock value) {
            this.clock = Objects.requireNonNull(value, "clock must not be null");
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
