package com.columnlineage.logical;

import com.columnlineage.expression.AttributeReference;
import com.columnlineage.expression.Expression;
import com.columnlineage.expression.NamedExpression;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing a projection (SELECT list).
 *
 * <p>Each entry is either a column passed through or an {@link
 * com.columnlineage.expression.Alias} naming a computed value.
 *
 * <p>Examples:
 * <pre>
 *   SELECT key, value AS v FROM t
 *   SELECT hash(col1) AS col2, 'const' AS col3 FROM t
 * </pre>
 */
public final class Project extends LogicalPlan {

    private final List<NamedExpression> projections;

    /**
     * Creates a projection node.
     *
     * @param child the child node
     * @param projections the projected expressions
     */
    public Project(LogicalPlan child, List<NamedExpression> projections) {
        super(Objects.requireNonNull(child, "child must not be null"));
        this.projections = new ArrayList<>(Objects.requireNonNull(projections, "projections must not be null"));
    }

    /**
     * Returns the child node.
     *
     * @return the child
     */
    public LogicalPlan child() {
        return children.get(0);
    }

    /**
     * Returns the projected expressions.
     *
     * @return an unmodifiable list of projections
     */
    public List<NamedExpression> projections() {
        return Collections.unmodifiableList(projections);
    }

    @Override
    public List<AttributeReference> output() {
        List<AttributeReference> output = new ArrayList<>(projections.size());
        for (NamedExpression projection : projections) {
            output.add(projection.toAttribute());
        }
        return Collections.unmodifiableList(output);
    }

    @Override
    public List<Expression> expressions() {
        return Collections.unmodifiableList(new ArrayList<>(projections));
    }

    @Override
    public String toString() {
        return String.format("Project(%s)", projections);
    }
}
