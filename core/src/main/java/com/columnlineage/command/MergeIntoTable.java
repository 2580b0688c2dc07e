package com.columnlineage.command;

import com.columnlineage.catalog.QualifiedName;
import com.columnlineage.expression.AttributeReference;
import com.columnlineage.expression.Expression;
import com.columnlineage.logical.LogicalPlan;
import com.columnlineage.logical.TableScan;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code MERGE INTO target USING source ON condition WHEN ...}.
 *
 * <p>Example:
 * <pre>
 *   MERGE INTO target t USING (SELECT * FROM source) s ON t.id = s.id
 *   WHEN MATCHED THEN UPDATE SET t.name = s.name, t.price = s.price
 *   WHEN NOT MATCHED THEN INSERT (id, name, price) VALUES (s.id, s.name, s.price)
 * </pre>
 *
 * <p>Matched clauses may update or delete; not-matched clauses may only
 * insert. Assignment keys must be columns of the target.
 */
public final class MergeIntoTable extends Command {

    private final Expression mergeCondition;
    private final List<MergeAction> matchedActions;
    private final List<MergeAction> notMatchedActions;

    public MergeIntoTable(TableScan target,
                          LogicalPlan source,
                          Expression mergeCondition,
                          List<MergeAction> matchedActions,
                          List<MergeAction> notMatchedActions) {
        super(Arrays.asList(
            Objects.requireNonNull(target, "target must not be null"),
            Objects.requireNonNull(source, "source must not be null")));
        this.mergeCondition = Objects.requireNonNull(mergeCondition, "mergeCondition must not be null");
        this.matchedActions = new ArrayList<>(Objects.requireNonNull(matchedActions, "matchedActions must not be null"));
        this.notMatchedActions = new ArrayList<>(
            Objects.requireNonNull(notMatchedActions, "notMatchedActions must not be null"));

        for (MergeAction action : this.matchedActions) {
            if (action instanceof InsertAction) {
                throw new IllegalArgumentException("INSERT is not allowed in a WHEN MATCHED clause");
            }
            validateAssignments(target, action);
        }
        for (MergeAction action : this.notMatchedActions) {
            if (!(action instanceof InsertAction)) {
                throw new IllegalArgumentException(
                    "Only INSERT is allowed in a WHEN NOT MATCHED clause, got " + action.getClass().getSimpleName());
            }
            validateAssignments(target, action);
        }
    }

    private static void validateAssignments(TableScan target, MergeAction action) {
        for (Assignment assignment : action.assignments()) {
            if (!target.output().contains(assignment.key())) {
                throw new IllegalArgumentException(
                    "Assignment to " + assignment.key() + " which is not a column of " + target.table());
            }
        }
    }

    /**
     * Returns the table scan of the merge target.
     *
     * @return the target relation
     */
    public TableScan targetTable() {
        return (TableScan) children.get(0);
    }

    public LogicalPlan source() {
        return children.get(1);
    }

    @Override
    public QualifiedName target() {
        return targetTable().table();
    }

    public Expression mergeCondition() {
        return mergeCondition;
    }

    public List<MergeAction> matchedActions() {
        return Collections.unmodifiableList(matchedActions);
    }

    public List<MergeAction> notMatchedActions() {
        return Collections.unmodifiableList(notMatchedActions);
    }

    /**
     * Returns every clause, matched ones first, in statement order.
     *
     * @return the actions
     */
    public List<MergeAction> actions() {
        List<MergeAction> all = new ArrayList<>(matchedActions);
        all.addAll(notMatchedActions);
        return all;
    }

    @Override
    public Optional<LogicalPlan> query() {
        return Optional.of(source());
    }

    @Override
    public List<Expression> expressions() {
        List<Expression> all = new ArrayList<>();
        all.add(mergeCondition);
        for (MergeAction action : actions()) {
            if (action.condition() != null) {
                all.add(action.condition());
            }
            for (Assignment assignment : action.assignments()) {
                all.add(assignment.key());
                all.add(assignment.value());
            }
        }
        return Collections.unmodifiableList(all);
    }

    @Override
    public String toString() {
        return String.format("MergeIntoTable(%s, matched=%s, notMatched=%s)",
            target(), matchedActions, notMatchedActions);
    }
}
