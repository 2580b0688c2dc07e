package com.columnlineage.logical;

import com.columnlineage.expression.AttributeReference;
import com.columnlineage.expression.Expression;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Two-input join. Output is the left columns then the right columns; semi and
 * anti joins output only the left columns but still read the right side.
 */
public final class Join extends LogicalPlan {

    private final JoinType joinType;
    private final Expression condition;

    /**
     * @param condition the ON condition, null for none; CROSS joins take none
     */
    public Join(LogicalPlan left, LogicalPlan right, JoinType joinType, Expression condition) {
        super(Arrays.asList(
            Objects.requireNonNull(left, "left must not be null"),
            Objects.requireNonNull(right, "right must not be null")));
        this.joinType = Objects.requireNonNull(joinType, "joinType must not be null");
        this.condition = condition;

        if (joinType == JoinType.CROSS && condition != null) {
            throw new IllegalArgumentException("condition must be null for CROSS join");
        }
    }

    public LogicalPlan left() {
        return children.get(0);
    }

    public LogicalPlan right() {
        return children.get(1);
    }

    public JoinType joinType() {
        return joinType;
    }

    /**
     * Returns the join condition.
     *
     * @return the condition, or null if there is none
     */
    public Expression condition() {
        return condition;
    }

    @Override
    public List<AttributeReference> output() {
        if (joinType.keepsOnlyLeft()) {
            return left().output();
        }
        List<AttributeReference> output = new ArrayList<>(left().output());
        output.addAll(right().output());
        return Collections.unmodifiableList(output);
    }

    @Override
    public List<Expression> expressions() {
        return condition == null ? Collections.emptyList() : Collections.singletonList(condition);
    }

    @Override
    public String toString() {
        return String.format("Join(type=%s, condition=%s)", joinType, condition);
    }

    /**
     * Join types.
     */
    public enum JoinType {
        INNER,
        LEFT,
        RIGHT,
        FULL,
        CROSS,
        LEFT_SEMI,
        LEFT_ANTI;

        /**
         * Returns true for joins whose output is the left side only.
         *
         * @return true for LEFT_SEMI and LEFT_ANTI
         */
        public boolean keepsOnlyLeft() {
            return this == LEFT_SEMI || this == LEFT_ANTI;
        }
    }
}
