package com.gridsql.statement;

import com.gridsql.expression.Expression;
import com.gridsql.expression.StarExpression;
import java.util.Objects;

/**
 * One item of a SELECT list: an expression with an optional {@code AS} alias.
 */
public final class Projection {

    private final Expression expression;
    private final String alias;

    public Projection(Expression expression, String alias) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.alias = alias;
    }

    public Projection(Expression expression) {
        this(expression, null);
    }

    public Expression expression() {
        return expression;
    }

    public String alias() {
        return alias;
    }

    public boolean isStar() {
        return expression instanceof StarExpression;
    }

    @Override
    public String toString() {
        return alias != null ? expression.toSQL() + " AS " + alias : expression.toSQL();
    }
}
