package com.gridsql.statement;

import com.gridsql.expression.Expression;
import java.util.Objects;

/**
 * A LABEL or FORMAT entry: the output column it applies to and its text.
 */
public final class DisplayOption {

    private final Expression target;
    private final String text;

    public DisplayOption(Expression target, String text) {
        this.target = Objects.requireNonNull(target, "target must not be null");
        this.text = Objects.requireNonNull(text, "text must not be null");
    }

    public Expression target() {
        return target;
    }

    public String text() {
        return text;
    }

    @Override
    public String toString() {
        return target.toSQL() + " '" + text + "'";
    }
}
