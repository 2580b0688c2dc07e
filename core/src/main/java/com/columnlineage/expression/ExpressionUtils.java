package com.columnlineage.expression;

import java.util.ArrayList;
import java.util.List;

/**
 * Utility methods for inspecting expression trees.
 *
 * <p>None of the walks below descend into subquery plans: a subquery is a
 * separate scope and is handled by whoever owns the subquery expression.
 */
public final class ExpressionUtils {

    private ExpressionUtils() {}

    /**
     * Collects every column reference in the expression tree, in pre-order.
     *
     * @param expr the expression to inspect
     * @return the references found (may contain the same column twice)
     */
    public static List<AttributeReference> references(Expression expr) {
        List<AttributeReference> result = new ArrayList<>();
        collect(expr, AttributeReference.class, result);
        return result;
    }

    /**
     * Returns true if the expression reads at least one column, either
     * directly or through a subquery.
     *
     * <p>An expression that reads nothing is built from literals only; a
     * grouping-set branch uses such an expression (usually NULL) to blank out
     * a column the branch does not group by.
     *
     * @param expr the expression to inspect
     * @return true if the expression depends on some column
     */
    public static boolean readsAnyColumn(Expression expr) {
        if (expr instanceof AttributeReference || expr instanceof SubqueryExpression) {
            return true;
        }
        if (expr instanceof AggregateExpression && ((AggregateExpression) expr).isCountStar()) {
            return true;
        }
        for (Expression child : expr.children()) {
            if (readsAnyColumn(child)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Collects the subquery expressions embedded in the expression tree, in
     * pre-order.
     *
     * @param expr the expression to inspect
     * @return the subquery expressions found
     */
    public static List<SubqueryExpression> subqueries(Expression expr) {
        List<SubqueryExpression> result = new ArrayList<>();
        collect(expr, SubqueryExpression.class, result);
        return result;
    }

    /**
     * Collects unresolved column markers in the expression tree.
     *
     * @param expr the expression to inspect
     * @return the unresolved columns found
     */
    public static List<UnresolvedColumn> unresolvedColumns(Expression expr) {
        List<UnresolvedColumn> result = new ArrayList<>();
        collect(expr, UnresolvedColumn.class, result);
        return result;
    }

    private static <T extends Expression> void collect(Expression expr, Class<T> type, List<T> out) {
        if (type.isInstance(expr)) {
            out.add(type.cast(expr));
        }
        for (Expression child : expr.children()) {
            collect(child, type, out);
        }
    }
}
