package com.columnlineage.expression;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a type cast.
 *
 * <p>Example: {@code CAST(unix_timestamp() AS BIGINT)}. A cast is lineage
 * transparent: it derives from exactly what its operand derives from.
 */
public final class CastExpression implements Expression {

    private final Expression expression;
    private final String targetType;

    /**
     * Creates a cast expression.
     *
     * @param expression the expression to cast
     * @param targetType the target type name, as written in SQL
     */
    public CastExpression(Expression expression, String targetType) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.targetType = Objects.requireNonNull(targetType, "targetType must not be null");
    }

    public Expression expression() {
        return expression;
    }

    public String targetType() {
        return targetType;
    }

    @Override
    public List<Expression> children() {
        return Collections.singletonList(expression);
    }

    @Override
    public String toString() {
        return "CAST(" + expression + " AS " + targetType + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CastExpression)) return false;
        CastExpression that = (CastExpression) obj;
        return expression.equals(that.expression) && targetType.equalsIgnoreCase(that.targetType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, targetType.toLowerCase());
    }
}
