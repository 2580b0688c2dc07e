package com.columnlineage.test;

import com.columnlineage.catalog.QualifiedName;
import com.columnlineage.config.LineageConfig;
import com.columnlineage.expression.AggregateExpression;
import com.columnlineage.expression.Alias;
import com.columnlineage.expression.AttributeReference;
import com.columnlineage.expression.BinaryExpression;
import com.columnlineage.expression.Expression;
import com.columnlineage.expression.FunctionCall;
import com.columnlineage.expression.Literal;
import com.columnlineage.expression.NamedExpression;
import com.columnlineage.logical.Aggregate;
import com.columnlineage.logical.Filter;
import com.columnlineage.logical.Join;
import com.columnlineage.logical.LogicalPlan;
import com.columnlineage.logical.Project;
import com.columnlineage.logical.TableScan;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Small DSL for building resolved plans in tests, the way a resolver would.
 *
 * <pre>
 *   TableScan t = scan("test_db0.test_table0", "key", "value");
 *   LogicalPlan plan = project(t, col(t, "key"), as(fn("hash", col(t, "value")), "h"));
 * </pre>
 */
public final class PlanBuilder {

    private PlanBuilder() {}

    public static QualifiedName name(String identifier) {
        return QualifiedName.parse(identifier, LineageConfig.DEFAULT_CATALOG_NAME, LineageConfig.DEFAULT_DATABASE_NAME);
    }

    public static TableScan scan(String identifier, String... columns) {
        return TableScan.of(name(identifier), columns);
    }

    /**
     * Returns the output column of a plan with the given name.
     *
     * @throws IllegalArgumentException if the plan has no such column
     */
    public static AttributeReference col(LogicalPlan plan, String name) {
        for (AttributeReference attribute : plan.output()) {
            if (attribute.name().equalsIgnoreCase(name)) {
                return attribute;
            }
        }
        throw new IllegalArgumentException(plan + " has no column " + name);
    }

    public static List<AttributeReference> cols(String... names) {
        List<AttributeReference> attributes = new ArrayList<>();
        for (String name : names) {
            attributes.add(AttributeReference.newColumn(name));
        }
        return attributes;
    }

    public static Alias as(Expression expression, String name) {
        return new Alias(expression, name);
    }

    public static Literal lit(Object value) {
        return Literal.of(value);
    }

    public static FunctionCall fn(String name, Expression... args) {
        return FunctionCall.of(name, args);
    }

    public static AggregateExpression agg(String name, Expression... args) {
        return AggregateExpression.of(name, args);
    }

    public static BinaryExpression eq(Expression left, Expression right) {
        return BinaryExpression.equal(left, right);
    }

    public static Project project(LogicalPlan child, NamedExpression... projections) {
        return new Project(child, Arrays.asList(projections));
    }

    /**
     * Projects every output column of the child, as {@code SELECT *} resolves.
     */
    public static Project selectAll(LogicalPlan child) {
        return new Project(child, new ArrayList<NamedExpression>(child.output()));
    }

    public static Filter filter(LogicalPlan child, Expression condition) {
        return new Filter(child, condition);
    }

    public static Aggregate aggregate(LogicalPlan child, List<Expression> grouping, NamedExpression... aggregates) {
        return new Aggregate(child, grouping, Arrays.asList(aggregates));
    }

    public static Join join(LogicalPlan left, LogicalPlan right, Join.JoinType type, Expression condition) {
        return new Join(left, right, type, condition);
    }
}
