package com.columnlineage.logical;

import com.columnlineage.expression.AttributeReference;
import com.columnlineage.expression.Expression;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class for all nodes of a resolved logical plan.
 *
 * <p>This represents a node in the logical query plan tree. Each node can have
 * zero or more children and produces an ordered list of output columns, each
 * an {@link AttributeReference} bound to a {@link com.columnlineage.expression.ColumnId}.
 *
 * <p>Plans are built by the host after name resolution and optimization; this
 * library only reads them. Every node is immutable.
 */
public abstract class LogicalPlan {

    /** Child nodes in the plan tree */
    protected final List<LogicalPlan> children;

    /**
     * Creates a logical plan node with no children.
     */
    protected LogicalPlan() {
        this.children = Collections.emptyList();
    }

    /**
     * Creates a logical plan node with a single child.
     *
     * @param child the child node
     */
    protected LogicalPlan(LogicalPlan child) {
        this.children = Collections.singletonList(child);
    }

    /**
     * Creates a logical plan node with multiple children.
     *
     * @param children the child nodes
     */
    protected LogicalPlan(List<LogicalPlan> children) {
        this.children = new ArrayList<>(children);
    }

    /**
     * Returns the ordered output columns of this node.
     *
     * @return an unmodifiable list of attributes
     */
    public abstract List<AttributeReference> output();

    /**
     * Returns the expressions this node evaluates itself, not counting those
     * of its children.
     *
     * @return an unmodifiable list of expressions (empty by default)
     */
    public List<Expression> expressions() {
        return Collections.emptyList();
    }

    /**
     * Returns the child nodes of this plan.
     *
     * @return an unmodifiable list of children
     */
    public List<LogicalPlan> children() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Returns the operator name, used in diagnostics.
     *
     * @return the node name
     */
    public String nodeName() {
        return getClass().getSimpleName();
    }

    /**
     * Returns a human-readable string representation of this plan node.
     *
     * @return a string representation
     */
    @Override
    public abstract String toString();

    static List<AttributeReference> copyOf(List<AttributeReference> attributes, String what) {
        if (attributes == null) {
            throw new NullPointerException(what + " must not be null");
        }
        List<AttributeReference> copy = new ArrayList<>(attributes.size());
        for (AttributeReference attribute : attributes) {
            if (attribute == null) {
                throw new NullPointerException(what + " must not contain null");
            }
            copy.add(attribute);
        }
        return Collections.unmodifiableList(copy);
    }
}
