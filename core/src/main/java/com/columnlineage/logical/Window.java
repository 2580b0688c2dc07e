package com.columnlineage.logical;

import com.columnlineage.expression.AttributeReference;
import com.columnlineage.expression.Expression;
import com.columnlineage.expression.NamedExpression;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node computing window functions.
 *
 * <p>Each entry of the window list names a
 * {@link com.columnlineage.expression.WindowExpression}:
 * <pre>
 *   SELECT a, b, row_number() OVER (PARTITION BY a ORDER BY b) AS rank FROM t
 * </pre>
 *
 * <p>The output is the child's columns followed by one column per window entry.
 */
public final class Window extends LogicalPlan {

    private final List<NamedExpression> windowExpressions;

    public Window(LogicalPlan child, List<NamedExpression> windowExpressions) {
        super(Objects.requireNonNull(child, "child must not be null"));
        this.windowExpressions = new ArrayList<>(
            Objects.requireNonNull(windowExpressions, "windowExpressions must not be null"));
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    public List<NamedExpression> windowExpressions() {
        return Collections.unmodifiableList(windowExpressions);
    }

    @Override
    public List<AttributeReference> output() {
        List<AttributeReference> output = new ArrayList<>(child().output());
        for (NamedExpression expression : windowExpressions) {
            output.add(expression.toAttribute());
        }
        return Collections.unmodifiableList(output);
    }

    @Override
    public List<Expression> expressions() {
        return Collections.unmodifiableList(new ArrayList<>(windowExpressions));
    }

    @Override
    public String toString() {
        return String.format("Window(%s)", windowExpressions);
    }
}
