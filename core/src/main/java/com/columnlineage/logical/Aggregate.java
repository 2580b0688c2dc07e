package com.columnlineage.logical;

import com.columnlineage.expression.AttributeReference;
import com.columnlineage.expression.Expression;
import com.columnlineage.expression.NamedExpression;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing an aggregation (GROUP BY).
 *
 * <p>The grouping expressions decide how rows are grouped; the aggregate list
 * decides what is produced and may mix grouping columns with aggregate calls.
 *
 * <p>Examples:
 * <pre>
 *   SELECT count(*) AS n FROM t
 *   SELECT key, sum(value) AS total FROM t GROUP BY key
 *   SELECT count(*) + sum(key) AS x FROM t
 * </pre>
 *
 * <p>A {@code ROLLUP}, {@code CUBE} or {@code GROUPING SETS} aggregation is an
 * aggregate over an {@link Expand}; see {@link GroupingSets}.
 */
public final class Aggregate extends LogicalPlan {

    private final List<Expression> groupingExpressions;
    private final List<NamedExpression> aggregateExpressions;

    /**
     * Creates an aggregate node.
     *
     * @param child the child node
     * @param groupingExpressions the GROUP BY expressions (empty for a global aggregate)
     * @param aggregateExpressions the produced columns
     */
    public Aggregate(LogicalPlan child,
                     List<Expression> groupingExpressions,
                     List<NamedExpression> aggregateExpressions) {
        super(Objects.requireNonNull(child, "child must not be null"));
        this.groupingExpressions = new ArrayList<>(
            Objects.requireNonNull(groupingExpressions, "groupingExpressions must not be null"));
        this.aggregateExpressions = new ArrayList<>(
            Objects.requireNonNull(aggregateExpressions, "aggregateExpressions must not be null"));
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    public List<Expression> groupingExpressions() {
        return Collections.unmodifiableList(groupingExpressions);
    }

    public List<NamedExpression> aggregateExpressions() {
        return Collections.unmodifiableList(aggregateExpressions);
    }

    @Override
    public List<AttributeReference> output() {
        List<AttributeReference> output = new ArrayList<>(aggregateExpressions.size());
        for (NamedExpression expression : aggregateExpressions) {
            output.add(expression.toAttribute());
        }
        return Collections.unmodifiableList(output);
    }

    @Override
    public List<Expression> expressions() {
        List<Expression> all = new ArrayList<>(groupingExpressions);
        all.addAll(aggregateExpressions);
        return Collections.unmodifiableList(all);
    }

    @Override
    public String toString() {
        return String.format("Aggregate(groupBy=%s, aggregates=%s)", groupingExpressions, aggregateExpressions);
    }
}
