package com.columnlineage.command;

import com.columnlineage.catalog.QualifiedName;
import com.columnlineage.logical.LogicalPlan;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code CREATE TABLE target (a int, b string)} with column definitions only.
 *
 * <p>No rows are written, so the statement has no lineage.
 */
public final class CreateTable extends Command {

    private final QualifiedName target;
    private final List<String> columns;

    public CreateTable(QualifiedName target, List<String> columns) {
        super();
        this.target = Objects.requireNonNull(target, "target must not be null");
        this.columns = new ArrayList<>(Objects.requireNonNull(columns, "columns must not be null"));
    }

    @Override
    public QualifiedName target() {
        return target;
    }

    public List<String> columns() {
        return Collections.unmodifiableList(columns);
    }

    @Override
    public Optional<LogicalPlan> query() {
        return Optional.empty();
    }

    @Override
    public String toString() {
        return String.format("CreateTable(%s, %s)", target, columns);
    }
}
