package com.columnlineage.logical;

import com.columnlineage.expression.AttributeReference;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base class for UNION, INTERSECT and EXCEPT.
 *
 * <p>Children are aligned by position, never by name: column {@code i} of the
 * result combines column {@code i} of every child. The output reuses the
 * first child's names but mints a fresh id per position, since one id repeated
 * in the first child may hold different columns in the other children.
 */
public abstract class SetOperation extends LogicalPlan {

    private final boolean all;
    private final List<AttributeReference> output;

    protected SetOperation(List<LogicalPlan> children, boolean all) {
        super(Objects.requireNonNull(children, "children must not be null"));
        this.all = all;
        if (children.size() < 2) {
            throw new IllegalArgumentException(nodeName() + " requires at least two children");
        }
        int arity = children.get(0).output().size();
        for (int i = 1; i < children.size(); i++) {
            LogicalPlan child = Objects.requireNonNull(children.get(i), "children must not contain null");
            int childArity = child.output().size();
            if (childArity != arity) {
                throw new IllegalArgumentException(
                    String.format("%s requires same number of columns: first child has %d, child %d has %d",
                                  nodeName(), arity, i, childArity));
            }
        }
        List<AttributeReference> attributes = new ArrayList<>(arity);
        for (AttributeReference attribute : children.get(0).output()) {
            attributes.add(AttributeReference.newColumn(attribute.name()));
        }
        this.output = Collections.unmodifiableList(attributes);
    }

    /**
     * Returns whether duplicates are kept (UNION ALL, INTERSECT ALL, EXCEPT ALL).
     *
     * @return true for the ALL variant
     */
    public boolean all() {
        return all;
    }

    @Override
    public List<AttributeReference> output() {
        return output;
    }

    @Override
    public String toString() {
        return String.format("%s(all=%s, children=%d)", nodeName(), all, children.size());
    }
}
