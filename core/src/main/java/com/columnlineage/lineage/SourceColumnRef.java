package com.columnlineage.lineage;

import com.columnlineage.catalog.QualifiedName;
import java.util.Locale;
import java.util.Objects;

/**
 * A base column a value was derived from, rendered as {@code table.column}.
 *
 * <p>The column {@value #COUNT_SENTINEL} stands for the rows of the table
 * rather than any of its columns; it is what {@code count(*)} derives from.
 *
 * <p>Column names are stored lower-cased, like the table name, so {@code t.A}
 * and {@code t.a} are the same source.
 */
public final class SourceColumnRef implements Comparable<SourceColumnRef> {

    public static final String COUNT_SENTINEL = "__count__";

    private final QualifiedName table;
    private final String column;

    public SourceColumnRef(QualifiedName table, String column) {
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.column = Objects.requireNonNull(column, "column must not be null").toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the row-count marker of a table.
     *
     * @param table the table counted
     * @return {@code table.__count__}
     */
    public static SourceColumnRef countOf(QualifiedName table) {
        return new SourceColumnRef(table, COUNT_SENTINEL);
    }

    public QualifiedName table() {
        return table;
    }

    public String column() {
        return column;
    }

    public boolean isCountSentinel() {
        return COUNT_SENTINEL.equals(column);
    }

    @Override
    public int compareTo(SourceColumnRef other) {
        return toString().compareTo(other.toString());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SourceColumnRef)) return false;
        SourceColumnRef that = (SourceColumnRef) obj;
        return table.equals(that.table) && column.equals(that.column);
    }

    @Override
    public int hashCode() {
        return Objects.hash(table, column);
    }

    @Override
    public String toString() {
        return table.column(column);
    }
}
