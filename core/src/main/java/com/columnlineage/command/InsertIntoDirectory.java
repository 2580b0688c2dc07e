package com.columnlineage.command;

import com.columnlineage.catalog.QualifiedName;
import com.columnlineage.logical.LogicalPlan;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code INSERT OVERWRITE [LOCAL] DIRECTORY 'path' SELECT ...}.
 *
 * <p>The destination has no catalog entry; it is named by its path.
 */
public final class InsertIntoDirectory extends Command {

    private final QualifiedName target;
    private final boolean local;

    public InsertIntoDirectory(String path, boolean local, LogicalPlan query) {
        super(Objects.requireNonNull(query, "query must not be null"));
        this.target = QualifiedName.path(path);
        this.local = local;
    }

    public InsertIntoDirectory(String path, LogicalPlan query) {
        this(path, false, query);
    }

    @Override
    public QualifiedName target() {
        return target;
    }

    public String path() {
        return target.pathValue().orElseThrow(IllegalStateException::new);
    }

    public boolean local() {
        return local;
    }

    @Override
    public Optional<LogicalPlan> query() {
        return Optional.of(children.get(0));
    }

    @Override
    public String toString() {
        return String.format("InsertIntoDirectory(%s, local=%s)", target, local);
    }
}
