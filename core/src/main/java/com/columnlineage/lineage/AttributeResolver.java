package com.columnlineage.lineage;

import com.columnlineage.catalog.QualifiedName;
import com.columnlineage.exception.UnresolvedPlanException;
import com.columnlineage.expression.AggregateExpression;
import com.columnlineage.expression.AttributeReference;
import com.columnlineage.expression.ColumnId;
import com.columnlineage.expression.ExistsSubquery;
import com.columnlineage.expression.Expression;
import com.columnlineage.expression.ExpressionUtils;
import com.columnlineage.expression.InSubquery;
import com.columnlineage.expression.Literal;
import com.columnlineage.expression.ScalarSubquery;
import com.columnlineage.expression.SubqueryExpression;
import com.columnlineage.expression.UnresolvedColumn;
import com.columnlineage.logical.LogicalPlan;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the expressions of one plan node against its input scope.
 *
 * <p>The scope is the lineage of the node's children: every column the node
 * may read, keyed by {@link ColumnId}. The resolver computes, for any
 * expression, the union of the sources of the columns it reads:
 * <ul>
 *   <li>a column reference yields the sources recorded for its id</li>
 *   <li>a literal yields nothing</li>
 *   <li>{@code count(*)} yields the row-count marker of every input table</li>
 *   <li>a scalar subquery yields the sources of its single output column, and
 *       the tables it reads are collected in encounter order</li>
 *   <li>EXISTS yields nothing and IN yields its tested values only</li>
 *   <li>anything else yields the union of its children</li>
 * </ul>
 *
 * <p>A resolver is used for one node and then discarded.
 */
final class AttributeResolver {

    private static final Logger logger = LoggerFactory.getLogger(AttributeResolver.class);

    private final ColumnLineage scope;
    private final List<QualifiedName> inputTables;
    private final LineagePropagator propagator;
    private final Set<QualifiedName> subqueryTables = new LinkedHashSet<>();

    /**
     * Creates a resolver.
     *
     * @param scope the lineage of the columns in scope
     * @param inputTables the tables read beneath the node, used by {@code count(*)}
     * @param propagator the propagator used for embedded subqueries
     */
    AttributeResolver(ColumnLineage scope, List<QualifiedName> inputTables, LineagePropagator propagator) {
        this.scope = Objects.requireNonNull(scope, "scope must not be null");
        this.inputTables = Objects.requireNonNull(inputTables, "inputTables must not be null");
        this.propagator = Objects.requireNonNull(propagator, "propagator must not be null");
    }

    /**
     * Returns the identity of a node's output column.
     *
     * @param node the plan node
     * @param position the output position
     * @return the column id
     */
    static ColumnId identityOf(LogicalPlan node, int position) {
        return node.output().get(position).id();
    }

    /**
     * Verifies that a plan, its subquery plans included, is fully resolved.
     *
     * @param plan the plan to check
     * @throws UnresolvedPlanException at the first unresolved reference
     */
    static void checkResolved(LogicalPlan plan) {
        for (Expression expression : plan.expressions()) {
            List<UnresolvedColumn> unresolved = ExpressionUtils.unresolvedColumns(expression);
            if (!unresolved.isEmpty()) {
                throw new UnresolvedPlanException(unresolved.get(0), plan);
            }
            for (SubqueryExpression subquery : ExpressionUtils.subqueries(expression)) {
                checkResolved(subquery.subquery());
            }
        }
        for (LogicalPlan child : plan.children()) {
            checkResolved(child);
        }
    }

    /**
     * Computes the base columns an expression derives from.
     *
     * @param expression the expression
     * @return the sources, empty for a constant
     */
    Set<SourceColumnRef> sourcesOf(Expression expression) {
        Set<SourceColumnRef> result = new LinkedHashSet<>();
        collectSources(expression, result);
        return result;
    }

    /**
     * Walks the subqueries of a predicate for their errors only; their
     * columns and tables are dropped.
     *
     * @param expression a filter or join condition
     */
    void checkPredicate(Expression expression) {
        for (SubqueryExpression subquery : ExpressionUtils.subqueries(expression)) {
            PlanLineage discarded = propagator.propagate(subquery.subquery());
            logger.debug("Dropping {} table(s) read by predicate subquery {}", discarded.tables().size(), subquery);
        }
    }

    /**
     * Returns the tables read by scalar subqueries resolved so far, in
     * encounter order.
     *
     * @return the subquery tables
     */
    List<QualifiedName> subqueryTables() {
        return Collections.unmodifiableList(new ArrayList<>(subqueryTables));
    }

    private void collectSources(Expression expression, Set<SourceColumnRef> out) {
        if (expression instanceof AttributeReference) {
            out.addAll(lookup((AttributeReference) expression));
        } else if (expression instanceof Literal) {
            return;
        } else if (expression instanceof AggregateExpression && ((AggregateExpression) expression).isCountStar()) {
            for (QualifiedName table : inputTables) {
                out.add(SourceColumnRef.countOf(table));
            }
        } else if (expression instanceof ScalarSubquery) {
            PlanLineage subquery = propagator.propagate(((ScalarSubquery) expression).subquery());
            subqueryTables.addAll(subquery.tables());
            out.addAll(subquery.sourcesAt(0));
        } else if (expression instanceof ExistsSubquery) {
            propagator.propagate(((ExistsSubquery) expression).subquery());
        } else if (expression instanceof InSubquery) {
            InSubquery in = (InSubquery) expression;
            propagator.propagate(in.subquery());
            for (Expression value : in.values()) {
                collectSources(value, out);
            }
        } else {
            for (Expression child : expression.children()) {
                collectSources(child, out);
            }
        }
    }

    private Set<SourceColumnRef> lookup(AttributeReference reference) {
        Set<SourceColumnRef> sources = scope.get(reference.id());
        if (sources == null) {
            // outer reference of a correlated subquery
            logger.debug("Column {} is not in scope, treating it as unattributed", reference);
            return Collections.emptySet();
        }
        return sources;
    }
}
