package com.columnlineage.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a window function applied over a window spec.
 *
 * <p>Examples:
 * <pre>
 *   ROW_NUMBER() OVER (PARTITION BY a ORDER BY b ASC)
 *   LAG(amount, 1) OVER (PARTITION BY customer_id ORDER BY date)
 *   SUM(amount) OVER (PARTITION BY region)
 * </pre>
 *
 * <p>The window function's result depends on its own arguments and on every
 * partition and ordering key: {@code row_number() OVER (PARTITION BY a ORDER BY b)}
 * derives from both {@code a} and {@code b}.
 */
public final class WindowExpression implements Expression {

    private final Expression function;
    private final List<Expression> partitionBy;
    private final List<SortOrder> orderBy;

    /**
     * Creates a window expression.
     *
     * @param function the window function (a {@link FunctionCall} such as
     *                 row_number(), or an {@link AggregateExpression})
     * @param partitionBy the PARTITION BY expressions (may be empty)
     * @param orderBy the ORDER BY keys (may be empty)
     */
    public WindowExpression(Expression function, List<Expression> partitionBy, List<SortOrder> orderBy) {
        this.function = Objects.requireNonNull(function, "function must not be null");
        this.partitionBy = new ArrayList<>(Objects.requireNonNull(partitionBy, "partitionBy must not be null"));
        this.orderBy = new ArrayList<>(Objects.requireNonNull(orderBy, "orderBy must not be null"));
    }

    public Expression function() {
        return function;
    }

    public List<Expression> partitionBy() {
        return Collections.unmodifiableList(partitionBy);
    }

    public List<SortOrder> orderBy() {
        return Collections.unmodifiableList(orderBy);
    }

    @Override
    public List<Expression> children() {
        List<Expression> children = new ArrayList<>(1 + partitionBy.size() + orderBy.size());
        children.add(function);
        children.addAll(partitionBy);
        children.addAll(orderBy);
        return Collections.unmodifiableList(children);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(function).append(" OVER (");
        if (!partitionBy.isEmpty()) {
            sb.append("PARTITION BY ").append(partitionBy);
        }
        if (!orderBy.isEmpty()) {
            if (!partitionBy.isEmpty()) {
                sb.append(' ');
            }
            sb.append("ORDER BY ").append(orderBy);
        }
        return sb.append(')').toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof WindowExpression)) return false;
        WindowExpression that = (WindowExpression) obj;
        return function.equals(that.function) &&
               partitionBy.equals(that.partitionBy) &&
               orderBy.equals(that.orderBy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, partitionBy, orderBy);
    }
}
