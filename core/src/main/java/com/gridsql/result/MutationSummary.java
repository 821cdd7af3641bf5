package com.gridsql.result;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of an INSERT, UPDATE or DELETE.
 *
 * <p>Against a virtual table the summary carries the full post-mutation table in
 * {@link #data()}, header included. Against a grid range it carries what the grid
 * reported: cells and ranges written, or the sheet rows deleted.
 */
public final class MutationSummary implements ExecutionResult {

    /** Message reported when a WHERE clause selects nothing. */
    public static final String NO_MATCH_MESSAGE = "No rows matched WHERE clause";

    private final String operation;
    private final int affectedRows;
    private final List<List<Object>> data;
    private final Integer updatedCells;
    private final List<String> affectedRanges;
    private final List<Integer> rowNumbers;
    private final String updatedRange;
    private final String updateTime;
    private final String message;

    private MutationSummary(Builder b) {
        this.operation = Objects.requireNonNull(b.operation, "operation must not be null");
        this.affectedRows = b.affectedRows;
        this.data = b.data;
        this.updatedCells = b.updatedCells;
        this.affectedRanges = b.affectedRanges == null ? null
            : Collections.unmodifiableList(new ArrayList<>(b.affectedRanges));
        this.rowNumbers = b.rowNumbers == null ? null
            : Collections.unmodifiableList(new ArrayList<>(b.rowNumbers));
        this.updatedRange = b.updatedRange;
        this.updateTime = b.updateTime;
        this.message = b.message;
    }

    public static Builder builder(String operation) {
        return new Builder(operation);
    }

    @Override
    public String operation() {
        return operation;
    }

    /**
     * Returns the rows inserted, updated or deleted.
     *
     * @return the count
     */
    public int affectedRows() {
        return affectedRows;
    }

    /**
     * Returns the name of the count field: {@code deletedRows} for DELETE,
     * {@code updatedRows} otherwise.
     *
     * @return the field name
     */
    public String countField() {
        return "DELETE".equals(operation) ? "deletedRows" : "updatedRows";
    }

    /**
     * Returns the full resulting virtual table.
     *
     * @return the table with its header row, or null for grid targets
     */
    public List<List<Object>> data() {
        return data;
    }

    public Integer updatedCells() {
        return updatedCells;
    }

    public List<String> affectedRanges() {
        return affectedRanges;
    }

    /**
     * Returns the deleted sheet rows, highest first.
     *
     * @return the rows, or null unless this is a grid DELETE
     */
    public List<Integer> rowNumbers() {
        return rowNumbers;
    }

    public String updatedRange() {
        return updatedRange;
    }

    public String updateTime() {
        return updateTime;
    }

    public String message() {
        return message;
    }

    @Override
    public String toString() {
        return String.format("MutationSummary(%s, %s=%d%s)", operation, countField(), affectedRows,
            message != null ? ", " + message : "");
    }

    /**
     * Builder for {@link MutationSummary}.
     */
    public static final class Builder {
        private final String operation;
        private int affectedRows;
        private List<List<Object>> data;
        private Integer updatedCells;
        private List<String> affectedRanges;
        private List<Integer> rowNumbers;
        private String updatedRange;
        private String updateTime;
        private String message;

        private Builder(String operation) {
            this.operation = operation;
        }

        public Builder affectedRows(int value) {
            this.affectedRows = value;
            return this;
        }

        public Builder data(List<List<Object>> value) {
            this.data = value;
            return this;
        }

        public Builder updatedCells(Integer value) {
            this.updatedCells = value;
            return this;
        }

        public Builder affectedRanges(List<String> value) {
            this.affectedRanges = value;
            return this;
        }

        public Builder rowNumbers(List<Integer> value) {
            this.rowNumbers = value;
            return this;
        }

        public Builder updatedRange(String value) {
            this.updatedRange = value;
            return this;
        }

        public Builder updateTime(String value) {
            this.updateTime = value;
            return this;
        }

        public Builder message(String value) {
            this.message = value;
            return this;
        }

        public MutationSummary build() {
            return new MutationSummary(this);
        }
    }
}
