package com.gridsql.expression;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Expression representing a reference to a column.
 *
 * <p>Column references can be:
 * <ul>
 *   <li>Letter-coded, for grid ranges: {@code A}, {@code E}</li>
 *   <li>Header-derived, for virtual tables: {@code Amount}, {@code `Due Date`}</li>
 *   <li>Qualified by a table alias: {@code o.CustomerId}</li>
 * </ul>
 *
 * <p>Unqualified references that match columns of more than one joined table are
 * rejected during validation.
 */
public final class ColumnReference implements Expression {

    private static final Pattern SIMPLE_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String columnName;
    private final String qualifier;

    /**
     * Creates a column reference.
     *
     * @param columnName the column name
     * @param qualifier the table alias (may be null)
     */
    public ColumnReference(String columnName, String qualifier) {
        this.columnName = Objects.requireNonNull(columnName, "columnName must not be null");
        this.qualifier = qualifier;
    }

    /**
     * Creates an unqualified column reference.
     *
     * @param columnName the column name
     */
    public ColumnReference(String columnName) {
        this(columnName, null);
    }

    public String columnName() {
        return columnName;
    }

    /**
     * Returns the qualifier (table alias).
     *
     * @return the qualifier, or null if not qualified
     */
    public String qualifier() {
        return qualifier;
    }

    public boolean isQualified() {
        return qualifier != null;
    }

    /**
     * Returns the qualified name, {@code alias.column} or just {@code column}.
     *
     * @return the qualified name
     */
    public String qualifiedName() {
        if (qualifier != null) {
            return qualifier + "." + columnName;
        }
        return columnName;
    }

    @Override
    public String toSQL() {
        if (qualifier != null) {
            return quoteIfNeeded(qualifier) + "." + quoteIfNeeded(columnName);
        }
        return quoteIfNeeded(columnName);
    }

    /**
     * Quotes an identifier with back-quotes unless it is a plain identifier.
     *
     * @param identifier the identifier
     * @return the identifier, back-quoted if needed
     */
    public static String quoteIfNeeded(String identifier) {
        if (SIMPLE_IDENTIFIER.matcher(identifier).matches()) {
            return identifier;
        }
        return "`" + identifier + "`";
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ColumnReference)) return false;
        ColumnReference that = (ColumnReference) obj;
        return Objects.equals(columnName, that.columnName) &&
               Objects.equals(qualifier, that.qualifier);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columnName, qualifier);
    }

    // ==================== Factory Methods ====================

    public static ColumnReference of(String columnName) {
        return new ColumnReference(columnName);
    }

    public static ColumnReference qualified(String qualifier, String columnName) {
        return new ColumnReference(columnName, qualifier);
    }
}
