package com.columnlineage.expression;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A sort key: an expression plus its direction and null ordering.
 *
 * <p>Used by {@link com.columnlineage.logical.Sort} and by the ORDER BY part of
 * a {@link WindowExpression}.
 */
public final class SortOrder implements Expression {

    private final Expression expression;
    private final SortDirection direction;
    private final NullOrdering nullOrdering;

    public SortOrder(Expression expression, SortDirection direction, NullOrdering nullOrdering) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.direction = Objects.requireNonNull(direction, "direction must not be null");
        this.nullOrdering = Objects.requireNonNull(nullOrdering, "nullOrdering must not be null");
    }

    public SortOrder(Expression expression, SortDirection direction) {
        this(expression, direction,
             direction == SortDirection.ASCENDING ? NullOrdering.NULLS_FIRST : NullOrdering.NULLS_LAST);
    }

    public static SortOrder asc(Expression expression) {
        return new SortOrder(expression, SortDirection.ASCENDING);
    }

    public static SortOrder desc(Expression expression) {
        return new SortOrder(expression, SortDirection.DESCENDING);
    }

    public Expression expression() {
        return expression;
    }

    public SortDirection direction() {
        return direction;
    }

    public NullOrdering nullOrdering() {
        return nullOrdering;
    }

    @Override
    public List<Expression> children() {
        return Collections.singletonList(expression);
    }

    @Override
    public String toString() {
        return String.format("%s %s %s", expression, direction, nullOrdering);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SortOrder)) return false;
        SortOrder that = (SortOrder) obj;
        return expression.equals(that.expression) &&
               direction == that.direction &&
               nullOrdering == that.nullOrdering;
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, direction, nullOrdering);
    }

    /**
     * Sort direction.
     */
    public enum SortDirection {
        ASCENDING,
        DESCENDING
    }

    /**
     * Null ordering.
     */
    public enum NullOrdering {
        NULLS_FIRST,
        NULLS_LAST
    }
}
