package com.columnlineage.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing an aggregate function call.
 *
 * <p>Examples:
 * <pre>
 *   count(*)                 -- countStar, no argument
 *   count(DISTINCT order_id) -- distinct
 *   sum(goods_count * shop_price)
 *   collect_set(b)
 * </pre>
 *
 * <p>{@code count(*)} is kept distinct from {@code count(col)}: it counts rows
 * rather than values of any column, so its lineage is the per-table row-count
 * marker instead of a real column.
 */
public final class AggregateExpression implements Expression {

    private final String function;
    private final List<Expression> arguments;
    private final boolean distinct;
    private final boolean countStar;

    /**
     * Creates an aggregate expression.
     *
     * @param function the aggregate function name (sum, avg, count, ...)
     * @param arguments the function arguments
     * @param distinct whether DISTINCT is applied to the arguments
     * @param countStar whether this is {@code count(*)}
     */
    public AggregateExpression(String function, List<Expression> arguments,
                               boolean distinct, boolean countStar) {
        this.function = Objects.requireNonNull(function, "function must not be null");
        this.arguments = new ArrayList<>(Objects.requireNonNull(arguments, "arguments must not be null"));
        this.distinct = distinct;
        this.countStar = countStar;
        if (countStar && !this.arguments.isEmpty()) {
            throw new IllegalArgumentException("count(*) takes no arguments");
        }
        if (countStar && !"count".equalsIgnoreCase(function)) {
            throw new IllegalArgumentException("countStar is only valid for count, got: " + function);
        }
    }

    /**
     * Creates a non-distinct aggregate call.
     *
     * @param function the aggregate function name
     * @param arguments the arguments
     * @return the aggregate expression
     */
    public static AggregateExpression of(String function, Expression... arguments) {
        return new AggregateExpression(function, List.of(arguments), false, false);
    }

    /**
     * Creates a DISTINCT aggregate call.
     *
     * @param function the aggregate function name
     * @param arguments the arguments
     * @return the aggregate expression
     */
    public static AggregateExpression distinct(String function, Expression... arguments) {
        return new AggregateExpression(function, List.of(arguments), true, false);
    }

    /**
     * Creates {@code count(*)}.
     *
     * @return the aggregate expression
     */
    public static AggregateExpression countStar() {
        return new AggregateExpression("count", Collections.emptyList(), false, true);
    }

    public String function() {
        return function;
    }

    public List<Expression> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    public boolean isDistinct() {
        return distinct;
    }

    public boolean isCountStar() {
        return countStar;
    }

    @Override
    public List<Expression> children() {
        return arguments();
    }

    @Override
    public String toString() {
        if (countStar) {
            return "count(*)";
        }
        StringBuilder sb = new StringBuilder(function).append('(');
        if (distinct) {
            sb.append("DISTINCT ");
        }
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(arguments.get(i));
        }
        return sb.append(')').toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AggregateExpression)) return false;
        AggregateExpression that = (AggregateExpression) obj;
        return distinct == that.distinct &&
               countStar == that.countStar &&
               function.equalsIgnoreCase(that.function) &&
               arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function.toLowerCase(), arguments, distinct, countStar);
    }
}
