package com.columnlineage.logical;

import com.columnlineage.expression.AttributeReference;
import com.columnlineage.expression.Expression;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node that emits every input row once per projection.
 *
 * <p>This is how grouping sets are executed: each projection is one grouping
 * set branch, with the columns that branch does not group by replaced by NULL.
 * Position {@code i} of every projection feeds output column {@code i}.
 *
 * @see GroupingSets
 */
public final class Expand extends LogicalPlan {

    private final List<List<Expression>> projections;
    private final List<AttributeReference> output;

    /**
     * Creates an expand node.
     *
     * @param child the child node
     * @param projections the branch projections
     * @param output the output columns
     * @throws IllegalArgumentException if a projection does not match the output arity
     */
    public Expand(LogicalPlan child, List<List<Expression>> projections, List<AttributeReference> output) {
        super(Objects.requireNonNull(child, "child must not be null"));
        Objects.requireNonNull(projections, "projections must not be null");
        this.output = copyOf(output, "output");
        if (projections.isEmpty()) {
            throw new IllegalArgumentException("Expand requires at least one projection");
        }
        List<List<Expression>> copy = new ArrayList<>(projections.size());
        for (List<Expression> projection : projections) {
            if (projection.size() != this.output.size()) {
                throw new IllegalArgumentException(String.format(
                    "Expand projection has %d expressions, output has %d columns",
                    projection.size(), this.output.size()));
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(projection)));
        }
        this.projections = Collections.unmodifiableList(copy);
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    public List<List<Expression>> projections() {
        return projections;
    }

    @Override
    public List<AttributeReference> output() {
        return output;
    }

    @Override
    public List<Expression> expressions() {
        List<Expression> all = new ArrayList<>();
        projections.forEach(all::addAll);
        return Collections.unmodifiableList(all);
    }

    @Override
    public String toString() {
        return String.format("Expand(branches=%d, output=%s)", projections.size(), output);
    }
}
