package com.gridsql.test;

import com.gridsql.config.EngineConfig;
import com.gridsql.table.GridLocation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Base class for gridsql tests: per-test logging plus shared fixtures.
 */
public abstract class TestBase {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    /** A syntactically valid spreadsheet id */
    protected static final String SPREADSHEET_ID = "1AbCdEfGhIjKlMnOpQrStUvWxYz0123456789";

    /** 2024-03-15T10:30:00Z */
    protected static final Instant FIXED_INSTANT = Instant.parse("2024-03-15T10:30:00Z");

    private String testName;

    @BeforeEach
    void setUpTestBase(TestInfo info) {
        testName = info.getDisplayName();
        logger.debug("=== {} ===", testName);
    }

    @AfterEach
    void tearDownTestBase() {
        logger.debug("--- done: {} ---", testName);
    }

    protected String getTestName() {
        return testName;
    }

    protected void logStep(String step) {
        logger.debug("[{}] {}", testName, step);
    }

    protected void logData(String label, Object data) {
        logger.debug("[{}] {}: {}", testName, label, data);
    }

    /**
     * Returns a configuration with the clock fixed at {@link #FIXED_INSTANT} in UTC.
     *
     * @return the configuration
     */
    protected static EngineConfig fixedConfig() {
        return EngineConfig.builder()
            .clock(Clock.fixed(FIXED_INSTANT, ZoneOffset.UTC))
            .build();
    }

    protected static GridLocation location(String range) {
        return GridLocation.of(SPREADSHEET_ID, range);
    }

    /**
     * Builds a mutable 2-D array.
     *
     * @param rows the rows, header first for virtual tables
     * @return the table
     */
    protected static List<List<Object>> table(List<?>... rows) {
        List<List<Object>> table = new ArrayList<>();
        for (List<?> row : rows) {
            table.add(new ArrayList<>(row));
        }
        return table;
    }

    protected static List<Object> row(Object... values) {
        return new ArrayList<>(Arrays.asList(values));
    }
}
