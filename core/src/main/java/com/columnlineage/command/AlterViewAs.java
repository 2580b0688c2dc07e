package com.columnlineage.command;

import com.columnlineage.catalog.QualifiedName;
import com.columnlineage.logical.LogicalPlan;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code ALTER VIEW target AS SELECT ...}.
 */
public final class AlterViewAs extends Command {

    private final QualifiedName target;

    public AlterViewAs(QualifiedName target, LogicalPlan query) {
        super(Objects.requireNonNull(query, "query must not be null"));
        this.target = Objects.requireNonNull(target, "target must not be null");
    }

    @Override
    public QualifiedName target() {
        return target;
    }

    @Override
    public Optional<LogicalPlan> query() {
        return Optional.of(children.get(0));
    }

    @Override
    public String toString() {
        return String.format("AlterViewAs(%s)", target);
    }
}
