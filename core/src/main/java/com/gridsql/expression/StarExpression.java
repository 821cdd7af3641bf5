package com.gridsql.expression;

import java.util.Objects;

/**
 * Expression representing a star ({@code *}) in the projection list.
 *
 * <p>This can be unqualified ({@code *}) or qualified ({@code alias.*}). It is expanded to
 * concrete columns when the projection is evaluated.
 */
public final class StarExpression implements Expression {

    private final String qualifier;

    /**
     * Creates an unqualified star expression.
     */
    public StarExpression() {
        this.qualifier = null;
    }

    /**
     * Creates a qualified star expression.
     *
     * @param qualifier the table alias
     */
    public StarExpression(String qualifier) {
        this.qualifier = qualifier;
    }

    public String qualifier() {
        return qualifier;
    }

    public boolean isQualified() {
        return qualifier != null;
    }

    @Override
    public String toSQL() {
        return qualifier != null ? qualifier + ".*" : "*";
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof StarExpression)) return false;
        return Objects.equals(qualifier, ((StarExpression) obj).qualifier);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(qualifier);
    }
}
