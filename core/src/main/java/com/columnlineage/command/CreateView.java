package com.columnlineage.command;

import com.columnlineage.catalog.QualifiedName;
import com.columnlineage.logical.LogicalPlan;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code CREATE [OR REPLACE] VIEW target [(c1, c2, ...)] AS SELECT ...}.
 *
 * <p>When a column list is given it renames the query's output columns by
 * position.
 */
public final class CreateView extends Command {

    private final QualifiedName target;
    private final List<String> userColumns;
    private final boolean replace;

    /**
     * Creates a view definition.
     *
     * @param target the view name
     * @param userColumns the column list, empty to keep the query's names
     * @param replace true for CREATE OR REPLACE
     * @param query the view's query
     * @throws IllegalArgumentException if a column list is given whose size
     *         differs from the query's output
     */
    public CreateView(QualifiedName target, List<String> userColumns, boolean replace, LogicalPlan query) {
        super(Objects.requireNonNull(query, "query must not be null"));
        this.target = Objects.requireNonNull(target, "target must not be null");
        this.userColumns = new ArrayList<>(Objects.requireNonNull(userColumns, "userColumns must not be null"));
        this.replace = replace;
        if (!this.userColumns.isEmpty() && this.userColumns.size() != query.output().size()) {
            throw new IllegalArgumentException(String.format(
                "View %s names %d columns but its query produces %d",
                target, this.userColumns.size(), query.output().size()));
        }
    }

    public CreateView(QualifiedName target, LogicalPlan query) {
        this(target, Collections.emptyList(), false, query);
    }

    @Override
    public QualifiedName target() {
        return target;
    }

    public List<String> userColumns() {
        return Collections.unmodifiableList(userColumns);
    }

    public boolean replace() {
        return replace;
    }

    @Override
    public Optional<LogicalPlan> query() {
        return Optional.of(children.get(0));
    }

    @Override
    public String toString() {
        return String.format("CreateView(%s%s, replace=%s)",
            target, userColumns.isEmpty() ? "" : " " + userColumns, replace);
    }
}
