package com.columnlineage.command;

import com.columnlineage.catalog.QualifiedName;
import com.columnlineage.logical.LogicalPlan;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code INSERT INTO} / {@code INSERT OVERWRITE TABLE} with an optional
 * partition clause.
 *
 * <p>The destination columns are the table's full schema in order, partition
 * columns included. The query supplies one column for every destination
 * column that is not a static partition column, in schema order:
 * <pre>
 *   -- t(a, b, p): the query supplies a and b, p is fixed
 *   INSERT OVERWRITE TABLE t PARTITION (p = 'x') SELECT a, b FROM u
 * </pre>
 */
public final class InsertIntoTable extends Command {

    private final QualifiedName target;
    private final List<String> destinationColumns;
    private final PartitionSpec partitionSpec;
    private final boolean overwrite;

    /**
     * Creates an insert.
     *
     * @param target the destination table
     * @param destinationColumns the destination schema, in order
     * @param partitionSpec the partition clause
     * @param overwrite true for INSERT OVERWRITE
     * @param query the query supplying the rows
     * @throws IllegalArgumentException if the partition clause names an unknown
     *         column or the query does not supply one column per non-static
     *         destination column
     */
    public InsertIntoTable(QualifiedName target,
                           List<String> destinationColumns,
                           PartitionSpec partitionSpec,
                           boolean overwrite,
                           LogicalPlan query) {
        super(Objects.requireNonNull(query, "query must not be null"));
        this.target = Objects.requireNonNull(target, "target must not be null");
        this.destinationColumns = new ArrayList<>(
            Objects.requireNonNull(destinationColumns, "destinationColumns must not be null"));
        this.partitionSpec = Objects.requireNonNull(partitionSpec, "partitionSpec must not be null");
        this.overwrite = overwrite;

        for (String column : partitionSpec.columns()) {
            if (this.destinationColumns.stream().noneMatch(column::equalsIgnoreCase)) {
                throw new IllegalArgumentException(
                    "Partition column " + column + " is not a column of " + target);
            }
        }
        int supplied = query.output().size();
        int expected = nonStaticColumns().size();
        if (supplied != expected) {
            throw new IllegalArgumentException(String.format(
                "%s requires %d columns from the query, got %d", target, expected, supplied));
        }
    }

    /**
     * Creates an insert without a partition clause.
     */
    public InsertIntoTable(QualifiedName target, List<String> destinationColumns,
                           boolean overwrite, LogicalPlan query) {
        this(target, destinationColumns, PartitionSpec.empty(), overwrite, query);
    }

    @Override
    public QualifiedName target() {
        return target;
    }

    public List<String> destinationColumns() {
        return Collections.unmodifiableList(destinationColumns);
    }

    public PartitionSpec partitionSpec() {
        return partitionSpec;
    }

    public boolean overwrite() {
        return overwrite;
    }

    /**
     * Returns the destination columns the query supplies, in schema order.
     *
     * @return every destination column except the static partition columns
     */
    public List<String> nonStaticColumns() {
        List<String> columns = new ArrayList<>();
        for (String column : destinationColumns) {
            if (!partitionSpec.isStatic(column)) {
                columns.add(column);
            }
        }
        return columns;
    }

    @Override
    public Optional<LogicalPlan> query() {
        return Optional.of(children.get(0));
    }

    @Override
    public String toString() {
        return String.format("InsertIntoTable(%s, %s%s, overwrite=%s)",
            target, destinationColumns, partitionSpec.isEmpty() ? "" : " " + partitionSpec, overwrite);
    }
}
