package com.columnlineage.command;

import com.columnlineage.catalog.QualifiedName;
import com.columnlineage.logical.LogicalPlan;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code CREATE TABLE target AS SELECT ...}, including the data source and
 * Hive flavours and {@code REPLACE TABLE ... AS SELECT}.
 *
 * <p>The new table's columns are the query's output columns.
 */
public final class CreateTableAsSelect extends Command {

    private final QualifiedName target;

    public CreateTableAsSelect(QualifiedName target, LogicalPlan query) {
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
        return String.format("CreateTableAsSelect(%s)", target);
    }
}
