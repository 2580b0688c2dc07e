package com.columnlineage.logical;

import com.columnlineage.expression.AttributeReference;
import com.columnlineage.expression.Expression;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Leaf node with inline rows, such as {@code VALUES (1, 'a'), (2, 'b')}.
 *
 * <p>No column of a local relation has an upstream source.
 */
public final class LocalRelation extends LogicalPlan {

    private final List<AttributeReference> output;
    private final List<List<Expression>> rows;

    /**
     * Creates a local relation.
     *
     * @param output the columns
     * @param rows the rows, each with one value per column
     * @throws IllegalArgumentException if a row has the wrong number of values
     */
    public LocalRelation(List<AttributeReference> output, List<List<Expression>> rows) {
        super();
        this.output = copyOf(output, "output");
        Objects.requireNonNull(rows, "rows must not be null");
        List<List<Expression>> copy = new ArrayList<>(rows.size());
        for (List<Expression> row : rows) {
            if (row.size() != this.output.size()) {
                throw new IllegalArgumentException(String.format(
                    "Row has %d values, relation has %d columns", row.size(), this.output.size()));
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    /**
     * Creates a local relation with no rows.
     *
     * @param output the columns
     */
    public LocalRelation(List<AttributeReference> output) {
        this(output, Collections.emptyList());
    }

    public List<List<Expression>> rows() {
        return rows;
    }

    @Override
    public List<AttributeReference> output() {
        return output;
    }

    @Override
    public List<Expression> expressions() {
        List<Expression> all = new ArrayList<>();
        rows.forEach(all::addAll);
        return Collections.unmodifiableList(all);
    }

    @Override
    public String toString() {
        return String.format("LocalRelation(%s, rows=%d)", output, rows.size());
    }
}
