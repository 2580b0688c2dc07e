package com.columnlineage.lineage;

import com.columnlineage.expression.ColumnId;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable mapping from column identity to the base columns the column was
 * derived from. An empty set means the column derives from constants only.
 */
public final class ColumnLineage {

    private static final ColumnLineage EMPTY = new ColumnLineage(Collections.emptyMap());

    private final Map<ColumnId, Set<SourceColumnRef>> sources;

    private ColumnLineage(Map<ColumnId, Set<SourceColumnRef>> sources) {
        this.sources = sources;
    }

    public static ColumnLineage empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the sources recorded for a column.
     *
     * @param id the column identity
     * @return the sources, or null if the column is not in this mapping
     */
    public Set<SourceColumnRef> get(ColumnId id) {
        return sources.get(id);
    }

    public boolean contains(ColumnId id) {
        return sources.containsKey(id);
    }

    public Set<ColumnId> ids() {
        return Collections.unmodifiableSet(sources.keySet());
    }

    public int size() {
        return sources.size();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ColumnLineage)) return false;
        return sources.equals(((ColumnLineage) obj).sources);
    }

    @Override
    public int hashCode() {
        return sources.hashCode();
    }

    @Override
    public String toString() {
        return sources.toString();
    }

    /**
     * Builder for {@link ColumnLineage}. Putting an id twice unions the sets.
     */
    public static final class Builder {

        private final Map<ColumnId, Set<SourceColumnRef>> sources = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(ColumnId id, Set<SourceColumnRef> refs) {
            Objects.requireNonNull(id, "id must not be null");
            Objects.requireNonNull(refs, "refs must not be null");
            sources.computeIfAbsent(id, k -> new LinkedHashSet<>()).addAll(refs);
            return this;
        }

        public Builder putAll(ColumnLineage other) {
            other.sources.forEach(this::put);
            return this;
        }

        public ColumnLineage build() {
            Map<ColumnId, Set<SourceColumnRef>> copy = new LinkedHashMap<>();
            sources.forEach((id, refs) -> copy.put(id, Collections.unmodifiableSet(new LinkedHashSet<>(refs))));
            return new ColumnLineage(Collections.unmodifiableMap(copy));
        }
    }
}
