package com.columnlineage.lineage;

import com.columnlineage.catalog.QualifiedName;
import com.columnlineage.expression.AttributeReference;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Lineage of one plan node: its output columns, the sources of each, and the
 * tables read beneath it in first-seen order.
 */
public final class PlanLineage {

    private final List<AttributeReference> output;
    private final ColumnLineage columns;
    private final List<QualifiedName> tables;
    private final List<Set<SourceColumnRef>> positions;

    /**
     * Creates a plan lineage.
     *
     * @param output the node's output columns
     * @param columns sources of at least every output column
     * @param tables the tables read, de-duplicated in first-seen order
     * @throws IllegalArgumentException if an output column has no entry
     */
    public PlanLineage(List<AttributeReference> output, ColumnLineage columns, List<QualifiedName> tables) {
        this(output, null, columns, tables);
    }

    /**
     * Creates a plan lineage whose per-position sources are given explicitly,
     * for nodes that may repeat an id at positions with different sources.
     *
     * @param output the node's output columns
     * @param positions sources per output position, or null to read them from {@code columns}
     * @param columns sources of at least every output column
     * @param tables the tables read, de-duplicated in first-seen order
     */
    public PlanLineage(List<AttributeReference> output, List<Set<SourceColumnRef>> positions,
                       ColumnLineage columns, List<QualifiedName> tables) {
        this.output = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(output, "output must not be null")));
        this.columns = Objects.requireNonNull(columns, "columns must not be null");
        this.tables = Collections.unmodifiableList(new ArrayList<>(
            new LinkedHashSet<>(Objects.requireNonNull(tables, "tables must not be null"))));
        for (AttributeReference attribute : this.output) {
            if (!columns.contains(attribute.id())) {
                throw new IllegalArgumentException("No lineage for output column " + attribute);
            }
        }
        if (positions == null) {
            this.positions = null;
        } else if (positions.size() != this.output.size()) {
            throw new IllegalArgumentException(String.format(
                "%d output columns but %d positional source sets", this.output.size(), positions.size()));
        } else {
            List<Set<SourceColumnRef>> copy = new ArrayList<>(positions.size());
            for (Set<SourceColumnRef> sources : positions) {
                copy.add(Collections.unmodifiableSet(new LinkedHashSet<>(sources)));
            }
            this.positions = Collections.unmodifiableList(copy);
        }
    }

    public List<AttributeReference> output() {
        return output;
    }

    public ColumnLineage columns() {
        return columns;
    }

    public List<QualifiedName> tables() {
        return tables;
    }

    /**
     * Returns the sources of the output column at a position.
     *
     * @param position the output position
     * @return the sources
     */
    public Set<SourceColumnRef> sourcesAt(int position) {
        if (positions != null) {
            return positions.get(position);
        }
        return columns.get(output.get(position).id());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("PlanLineage(tables=").append(tables).append(", columns=[");
        for (int i = 0; i < output.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(output.get(i)).append(" -> ").append(sourcesAt(i));
        }
        return sb.append("])").toString();
    }
}
