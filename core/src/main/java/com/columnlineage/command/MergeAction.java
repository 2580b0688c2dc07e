package com.columnlineage.command;

import com.columnlineage.expression.Expression;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A {@code WHEN [NOT] MATCHED [AND condition] THEN ...} clause of a MERGE.
 *
 * <p>An action either lists its assignments or is a star action
 * ({@code UPDATE SET *}, {@code INSERT *}) that writes every target column
 * from the source column at the same position.
 */
public abstract class MergeAction {

    private final Expression condition;
    private final List<Assignment> assignments;
    private final boolean star;

    protected MergeAction(Expression condition, List<Assignment> assignments, boolean star) {
        this.condition = condition;
        this.assignments = Collections.unmodifiableList(
            new ArrayList<>(Objects.requireNonNull(assignments, "assignments must not be null")));
        this.star = star;
        if (star && !this.assignments.isEmpty()) {
            throw new IllegalArgumentException("A star action takes no explicit assignments");
        }
    }

    /**
     * Returns the extra clause condition.
     *
     * @return the condition, or null if the clause has none
     */
    public Expression condition() {
        return condition;
    }

    public List<Assignment> assignments() {
        return assignments;
    }

    public boolean isStar() {
        return star;
    }

    /**
     * Returns true if the action writes target rows.
     *
     * @return false for DELETE
     */
    public boolean writesColumns() {
        return star || !assignments.isEmpty();
    }

    @Override
    public String toString() {
        String body = star ? "*" : assignments.toString();
        return getClass().getSimpleName() + (condition != null ? "[" + condition + "]" : "") + " " + body;
    }
}
