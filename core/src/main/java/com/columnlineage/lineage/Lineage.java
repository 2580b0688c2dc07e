package com.columnlineage.lineage;

import com.columnlineage.catalog.QualifiedName;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * The lineage of one statement: the tables it reads, the tables it writes, and
 * for each written (or selected) column the base columns it derives from.
 *
 * <p>Columns are a list, not a map: they keep the statement's column order and
 * may repeat a name.
 *
 * <pre>
 *   Lineage(sources=[test_db0.test_table0], targets=[default.t1],
 *           columns=[default.t1.a -> {test_db0.test_table0.key}])
 * </pre>
 */
public final class Lineage {

    private static final Lineage EMPTY = new Lineage(
        Collections.emptyList(), Collections.emptyList(), Collections.emptyList());

    private final List<QualifiedName> sources;
    private final List<QualifiedName> targets;
    private final List<ColumnLineageEntry> columns;

    public Lineage(List<QualifiedName> sources, List<QualifiedName> targets, List<ColumnLineageEntry> columns) {
        this.sources = distinct(Objects.requireNonNull(sources, "sources must not be null"));
        this.targets = distinct(Objects.requireNonNull(targets, "targets must not be null"));
        this.columns = Collections.unmodifiableList(
            new ArrayList<>(Objects.requireNonNull(columns, "columns must not be null")));
    }

    /**
     * Returns the lineage of a statement that moves no data.
     *
     * @return a lineage with no sources, targets or columns
     */
    public static Lineage empty() {
        return EMPTY;
    }

    public List<QualifiedName> sources() {
        return sources;
    }

    public List<QualifiedName> targets() {
        return targets;
    }

    public List<ColumnLineageEntry> columns() {
        return columns;
    }

    public List<String> columnNames() {
        return columns.stream().map(ColumnLineageEntry::name).collect(Collectors.toList());
    }

    public boolean isEmpty() {
        return sources.isEmpty() && targets.isEmpty() && columns.isEmpty();
    }

    private static List<QualifiedName> distinct(List<QualifiedName> names) {
        return Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(names)));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Lineage)) return false;
        Lineage that = (Lineage) obj;
        return sources.equals(that.sources) &&
               targets.equals(that.targets) &&
               columns.equals(that.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sources, targets, columns);
    }

    @Override
    public String toString() {
        return "Lineage(sources=" + sources + ", targets=" + targets + ", columns=" + columns + ")";
    }

    /**
     * One output column and the base columns it derives from.
     */
    public static final class ColumnLineageEntry {

        private final String name;
        private final Set<SourceColumnRef> sources;

        public ColumnLineageEntry(String name, Set<SourceColumnRef> sources) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            this.sources = Collections.unmodifiableSet(
                new LinkedHashSet<>(Objects.requireNonNull(sources, "sources must not be null")));
        }

        public String name() {
            return name;
        }

        public Set<SourceColumnRef> sources() {
            return sources;
        }

        /**
         * Returns the sources rendered as {@code table.column}, sorted.
         *
         * @return the sorted source names
         */
        public Set<String> sourceNames() {
            Set<String> names = new TreeSet<>();
            for (SourceColumnRef source : sources) {
                names.add(source.toString());
            }
            return Collections.unmodifiableSet(names);
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof ColumnLineageEntry)) return false;
            ColumnLineageEntry that = (ColumnLineageEntry) obj;
            return name.equals(that.name) && sources.equals(that.sources);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, sources);
        }

        @Override
        public String toString() {
            return name + " -> {" + String.join(", ", sourceNames()) + "}";
        }
    }
}
