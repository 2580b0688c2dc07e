package com.columnlineage.expression;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Arithmetic, comparison, boolean or concatenation operator over two operands.
 * Its value derives from both operands.
 *
 * <p>Examples:
 * <pre>
 *   goods_count * shop_price     -- arithmetic
 *   count(value) + sum(key)      -- combination of two aggregate calls
 *   t1.col1 = t2.col1            -- join condition
 * </pre>
 */
public final class BinaryExpression implements Expression {

    public enum Operator {
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        MODULO("%"),

        EQUAL("="),
        NOT_EQUAL("!="),
        LESS_THAN("<"),
        LESS_THAN_OR_EQUAL("<="),
        GREATER_THAN(">"),
        GREATER_THAN_OR_EQUAL(">="),

        AND("AND"),
        OR("OR"),

        CONCAT("||");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    private final Expression left;
    private final Operator operator;
    private final Expression right;

    public BinaryExpression(Expression left, Operator operator, Expression right) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    public Expression left() {
        return left;
    }

    public Operator operator() {
        return operator;
    }

    public Expression right() {
        return right;
    }

    @Override
    public List<Expression> children() {
        return Arrays.asList(left, right);
    }

    public static BinaryExpression add(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.ADD, right);
    }

    public static BinaryExpression multiply(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.MULTIPLY, right);
    }

    public static BinaryExpression equal(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.EQUAL, right);
    }

    public static BinaryExpression and(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.AND, right);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.symbol() + " " + right + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BinaryExpression)) return false;
        BinaryExpression that = (BinaryExpression) obj;
        return operator == that.operator && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, right);
    }
}
