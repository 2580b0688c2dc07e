package com.columnlineage.logical;

import com.columnlineage.expression.AttributeReference;
import java.util.List;
import java.util.Objects;

/**
 * A relation with an alias name: a derived table, a CTE reference, or a view
 * boundary after inlining.
 *
 * <p>Examples:
 * <pre>
 *   SELECT * FROM (SELECT a, b FROM t) AS sub
 *   WITH cte AS (SELECT a FROM t) SELECT a FROM cte
 * </pre>
 *
 * <p>The alias only qualifies names; the output is the child's.
 */
public final class AliasedRelation extends LogicalPlan {

    private final String alias;

    /**
     * Creates an aliased relation.
     *
     * @param child the underlying relation
     * @param alias the alias name
     */
    public AliasedRelation(LogicalPlan child, String alias) {
        super(Objects.requireNonNull(child, "child must not be null"));
        this.alias = Objects.requireNonNull(alias, "alias must not be null");
        if (alias.isEmpty()) {
            throw new IllegalArgumentException("alias must not be empty");
        }
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    public String alias() {
        return alias;
    }

    @Override
    public List<AttributeReference> output() {
        return child().output();
    }

    @Override
    public String toString() {
        return String.format("AliasedRelation[%s]", alias);
    }
}
