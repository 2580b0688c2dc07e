package com.columnlineage.logical;

import com.columnlineage.catalog.QualifiedName;
import com.columnlineage.expression.AttributeReference;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Leaf node reading a catalog relation.
 *
 * <p>The relation is a base table unless the catalog holds a defining plan for
 * its name, in which case it is a permanent view and lineage is taken from the
 * view's query instead.
 *
 * <p>Examples:
 * <pre>
 *   SELECT key, value FROM test_db0.test_table0
 *   SELECT * FROM v2_catalog.db.tb
 * </pre>
 */
public final class TableScan extends LogicalPlan {

    private final QualifiedName table;
    private final List<AttributeReference> output;

    /**
     * Creates a table scan.
     *
     * @param table the canonical table name
     * @param output the columns read, in table schema order
     */
    public TableScan(QualifiedName table, List<AttributeReference> output) {
        super();
        this.table = Objects.requireNonNull(table, "table must not be null");
        if (table.isPath()) {
            throw new IllegalArgumentException("A table scan needs a table name, got path " + table);
        }
        this.output = copyOf(output, "output");
    }

    /**
     * Creates a scan that mints a fresh column for each name.
     *
     * @param table the canonical table name
     * @param columns the column names
     * @return the table scan
     */
    public static TableScan of(QualifiedName table, String... columns) {
        List<AttributeReference> output = new ArrayList<>(columns.length);
        for (String column : columns) {
            output.add(AttributeReference.newColumn(column));
        }
        return new TableScan(table, output);
    }

    /**
     * Returns the table name.
     *
     * @return the canonical name
     */
    public QualifiedName table() {
        return table;
    }

    @Override
    public List<AttributeReference> output() {
        return output;
    }

    @Override
    public String toString() {
        return String.format("TableScan(%s, %s)", table, output);
    }
}
