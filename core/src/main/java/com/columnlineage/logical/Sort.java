package com.columnlineage.logical;

import com.columnlineage.expression.AttributeReference;
import com.columnlineage.expression.Expression;
import com.columnlineage.expression.SortOrder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing a sort operation (ORDER BY clause).
 *
 * <p>Examples:
 * <pre>
 *   ORDER BY name ASC
 *   ORDER BY age DESC, name ASC
 * </pre>
 */
public final class Sort extends LogicalPlan {

    private final List<SortOrder> sortOrders;

    /**
     * Creates a sort node.
     *
     * @param child the child node
     * @param sortOrders the sort specifications
     */
    public Sort(LogicalPlan child, List<SortOrder> sortOrders) {
        super(Objects.requireNonNull(child, "child must not be null"));
        this.sortOrders = new ArrayList<>(Objects.requireNonNull(sortOrders, "sortOrders must not be null"));
        if (this.sortOrders.isEmpty()) {
            throw new IllegalArgumentException("At least one sort order is required");
        }
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    public List<SortOrder> sortOrders() {
        return Collections.unmodifiableList(sortOrders);
    }

    @Override
    public List<AttributeReference> output() {
        return child().output();
    }

    @Override
    public List<Expression> expressions() {
        return Collections.unmodifiableList(new ArrayList<>(sortOrders));
    }

    @Override
    public String toString() {
        return String.format("Sort(%s)", sortOrders);
    }
}
