package com.gridsql.statement;

import com.gridsql.expression.Expression;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A parsed SELECT.
 *
 * <p>Clauses are applied in a fixed order regardless of how they were written:
 * <pre>
 *   FROM/JOIN -&gt; WHERE -&gt; GROUP BY/PIVOT -&gt; projection -&gt; HAVING
 *     -&gt; DISTINCT -&gt; ORDER BY -&gt; OFFSET -&gt; LIMIT -&gt; LABEL/FORMAT
 * </pre>
 */
public final class SelectStatement implements Statement {

    private final List<Projection> projections;
    private final boolean distinct;
    private final List<Expression> distinctOn;
    private final TableReference from;
    private final List<JoinClause> joins;
    private final Expression where;
    private final List<Expression> groupBy;
    private final List<Expression> pivot;
    private final Expression having;
    private final List<OrderItem> orderBy;
    private final Integer limit;
    private final Integer offset;
    private final List<DisplayOption> labels;
    private final List<DisplayOption> formats;

    private SelectStatement(Builder b) {
        this.projections = Collections.unmodifiableList(new ArrayList<>(b.projections));
        this.distinct = b.distinct;
        this.distinctOn = Collections.unmodifiableList(new ArrayList<>(b.distinctOn));
        this.from = b.from;
        this.joins = Collections.unmodifiableList(new ArrayList<>(b.joins));
        this.where = b.where;
        this.groupBy = Collections.unmodifiableList(new ArrayList<>(b.groupBy));
        this.pivot = Collections.unmodifiableList(new ArrayList<>(b.pivot));
        this.having = b.having;
        this.orderBy = Collections.unmodifiableList(new ArrayList<>(b.orderBy));
        this.limit = b.limit;
        this.offset = b.offset;
        this.labels = Collections.unmodifiableList(new ArrayList<>(b.labels));
        this.formats = Collections.unmodifiableList(new ArrayList<>(b.formats));
        if (projections.isEmpty()) {
            throw new IllegalArgumentException("projections must not be empty");
        }
    }

    @Override
    public String operation() {
        return "SELECT";
    }

    @Override
    public TableReference source() {
        return from;
    }

    public List<Projection> projections() {
        return projections;
    }

    public boolean isDistinct() {
        return distinct;
    }

    /**
     * Returns the explicit de-duplication expressions of {@code DISTINCT ON (...)}.
     *
     * @return the expressions, empty when the whole projected tuple is compared
     */
    public List<Expression> distinctOn() {
        return distinctOn;
    }

    public List<JoinClause> joins() {
        return joins;
    }

    public Expression where() {
        return where;
    }

    public List<Expression> groupBy() {
        return groupBy;
    }

    public List<Expression> pivot() {
        return pivot;
    }

    public Expression having() {
        return having;
    }

    public List<OrderItem> orderBy() {
        return orderBy;
    }

    public Integer limit() {
        return limit;
    }

    public Integer offset() {
        return offset;
    }

    public List<DisplayOption> labels() {
        return labels;
    }

    public List<DisplayOption> formats() {
        return formats;
    }

    public boolean hasJoins() {
        return !joins.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("SELECT ");
        if (distinct) sb.append("DISTINCT ");
        sb.append(projections);
        if (from != null) sb.append(" FROM ").append(from);
        for (JoinClause join : joins) sb.append(' ').append(join);
        if (where != null) sb.append(" WHERE ").append(where.toSQL());
        if (!groupBy.isEmpty()) sb.append(" GROUP BY ").append(groupBy);
        if (!pivot.isEmpty()) sb.append(" PIVOT ").append(pivot);
        if (having != null) sb.append(" HAVING ").append(having.toSQL());
        if (!orderBy.isEmpty()) sb.append(" ORDER BY ").append(orderBy);
        if (limit != null) sb.append(" LIMIT ").append(limit);
        if (offset != null) sb.append(" OFFSET ").append(offset);
        return sb.toString();
    }

    /**
     * Builder used by the parser.
     */
    public static final class Builder {
        private final List<Projection> projections = new ArrayList<>();
        private boolean distinct;
        private final List<Expression> distinctOn = new ArrayList<>();
        private TableReference from;
        private final List<JoinClause> joins = new ArrayList<>();
        private Expression where;
        private final List<Expression> groupBy = new ArrayList<>();
        private final List<Expression> pivot = new ArrayList<>();
        private Expression having;
        private final List<OrderItem> orderBy = new ArrayList<>();
        private Integer limit;
        private Integer offset;
        private final List<DisplayOption> labels = new ArrayList<>();
        private final List<DisplayOption> formats = new ArrayList<>();

        private Builder() {}

        public Builder projection(Projection projection) {
            projections.add(Objects.requireNonNull(projection));
            return this;
        }

        public Builder distinct(boolean value) {
            this.distinct = value;
            return this;
        }

        public Builder distinctOn(List<Expression> expressions) {
            distinctOn.addAll(expressions);
            return this;
        }

        public Builder from(TableReference table) {
            this.from = table;
            return this;
        }

        public Builder join(JoinClause join) {
            joins.add(Objects.requireNonNull(join));
            return this;
        }

        public Builder where(Expression condition) {
            this.where = condition;
            return this;
        }

        public Builder groupBy(List<Expression> expressions) {
            groupBy.addAll(expressions);
            return this;
        }

        public Builder pivot(List<Expression> expressions) {
            pivot.addAll(expressions);
            return this;
        }

        public Builder having(Expression condition) {
            this.having = condition;
            return this;
        }

        public Builder orderBy(List<OrderItem> items) {
            orderBy.addAll(items);
            return this;
        }

        public Builder limit(Integer value) {
            this.limit = value;
            return this;
        }

        public Builder offset(Integer value) {
            this.offset = value;
            return this;
        }

        public Builder labels(List<DisplayOption> options) {
            labels.addAll(options);
            return this;
        }

        public Builder formats(List<DisplayOption> options) {
            formats.addAll(options);
            return this;
        }

        public SelectStatement build() {
            return new SelectStatement(this);
        }
    }
}
