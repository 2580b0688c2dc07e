package com.columnlineage.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@code CASE WHEN c1 THEN r1 [WHEN c2 THEN r2 ...] [ELSE r] END}.
 *
 * <p>The result derives from every column referenced by any condition or any
 * branch: {@code CASE WHEN cat_id = 1 THEN 'car' ELSE 'other' END} derives
 * from {@code cat_id} although both branches are constants.
 */
public final class CaseWhenExpression implements Expression {

    private final List<Expression> conditions;
    private final List<Expression> thenBranches;
    private final Expression elseBranch;

    /**
     * @param conditions the WHEN conditions, at least one
     * @param thenBranches one result per condition
     * @param elseBranch the ELSE result, or null for none
     */
    public CaseWhenExpression(List<Expression> conditions, List<Expression> thenBranches, Expression elseBranch) {
        this.conditions = List.copyOf(Objects.requireNonNull(conditions, "conditions must not be null"));
        this.thenBranches = List.copyOf(Objects.requireNonNull(thenBranches, "thenBranches must not be null"));
        this.elseBranch = elseBranch;
        if (this.conditions.isEmpty()) {
            throw new IllegalArgumentException("CASE WHEN requires at least one condition");
        }
        if (this.conditions.size() != this.thenBranches.size()) {
            throw new IllegalArgumentException(String.format(
                "CASE WHEN has %d conditions but %d results", this.conditions.size(), this.thenBranches.size()));
        }
    }

    public List<Expression> conditions() {
        return conditions;
    }

    public List<Expression> thenBranches() {
        return thenBranches;
    }

    public Expression elseBranch() {
        return elseBranch;
    }

    /**
     * Returns each condition followed by its result, then the ELSE result.
     */
    @Override
    public List<Expression> children() {
        List<Expression> children = new ArrayList<>();
        for (int i = 0; i < conditions.size(); i++) {
            children.add(conditions.get(i));
            children.add(thenBranches.get(i));
        }
        if (elseBranch != null) {
            children.add(elseBranch);
        }
        return children;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("CASE");
        for (int i = 0; i < conditions.size(); i++) {
            sb.append(" WHEN ").append(conditions.get(i))
              .append(" THEN ").append(thenBranches.get(i));
        }
        if (elseBranch != null) {
            sb.append(" ELSE ").append(elseBranch);
        }
        return sb.append(" END").toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CaseWhenExpression)) return false;
        CaseWhenExpression that = (CaseWhenExpression) obj;
        return conditions.equals(that.conditions) &&
               thenBranches.equals(that.thenBranches) &&
               Objects.equals(elseBranch, that.elseBranch);
    }

    @Override
    public int hashCode() {
        return Objects.hash(conditions, thenBranches, elseBranch);
    }
}
