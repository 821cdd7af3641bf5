package com.gridsql.expression;

import java.util.ArrayList;
import java.util.List;

/**
 * Tree walks over expressions.
 */
public final class ExpressionUtils {

    private ExpressionUtils() {}

    /**
     * Returns whether the expression contains an aggregate anywhere in its tree.
     *
     * @param expr the expression (may be null)
     * @return true if an aggregate is present
     */
    public static boolean containsAggregate(Expression expr) {
        if (expr == null) {
            return false;
        }
        if (expr instanceof AggregateExpression) {
            return true;
        }
        for (Expression child : expr.children()) {
            if (containsAggregate(child)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Collects the column references of an expression, in tree order.
     *
     * @param expr the expression (may be null)
     * @return the references
     */
    public static List<ColumnReference> columnReferences(Expression expr) {
        List<ColumnReference> refs = new ArrayList<>();
        collect(expr, refs, true);
        return refs;
    }

    /**
     * Collects the column references that are not inside an aggregate.
     *
     * @param expr the expression (may be null)
     * @return the references outside aggregates
     */
    public static List<ColumnReference> columnReferencesOutsideAggregates(Expression expr) {
        List<ColumnReference> refs = new ArrayList<>();
        collect(expr, refs, false);
        return refs;
    }

    private static void collect(Expression expr, List<ColumnReference> refs, boolean intoAggregates) {
        if (expr == null) {
            return;
        }
        if (expr instanceof ColumnReference ref) {
            refs.add(ref);
            return;
        }
        if (expr instanceof AggregateExpression && !intoAggregates) {
            return;
        }
        for (Expression child : expr.children()) {
            collect(child, refs, intoAggregates);
        }
    }
}
