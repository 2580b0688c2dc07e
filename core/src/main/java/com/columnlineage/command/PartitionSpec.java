package com.columnlineage.command;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The PARTITION clause of an INSERT.
 *
 * <p>Each partition column is either static, with a value fixed in the
 * statement, or dynamic, taking its value from the query:
 * <pre>
 *   INSERT INTO t PARTITION (col2 = 'bb', col3) SELECT col1, col3 FROM u
 *
 *   PartitionSpec spec = PartitionSpec.builder()
 *       .staticValue("col2", "bb")
 *       .dynamic("col3")
 *       .build();
 * </pre>
 *
 * <p>Column names compare case-insensitively.
 */
public final class PartitionSpec {

    private static final PartitionSpec EMPTY = new PartitionSpec(Collections.emptyMap());

    private final Map<String, Optional<String>> values;

    private PartitionSpec(Map<String, Optional<String>> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Returns a spec with no partition clause.
     *
     * @return the empty spec
     */
    public static PartitionSpec empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the partition columns in clause order.
     *
     * @return the lower-cased column names
     */
    public List<String> columns() {
        return Collections.unmodifiableList(new ArrayList<>(values.keySet()));
    }

    /**
     * Returns true if the column has a value fixed by the statement.
     *
     * @param column the column name
     * @return true for a static partition column
     */
    public boolean isStatic(String column) {
        Optional<String> value = values.get(normalize(column));
        return value != null && value.isPresent();
    }

    /**
     * Returns the static value of a partition column.
     *
     * @param column the column name
     * @return the value, or empty for a dynamic or unknown column
     */
    public Optional<String> staticValue(String column) {
        Optional<String> value = values.get(normalize(column));
        return value != null ? value : Optional.empty();
    }

    public boolean contains(String column) {
        return values.containsKey(normalize(column));
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    private static String normalize(String column) {
        return Objects.requireNonNull(column, "column must not be null").toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PartitionSpec)) return false;
        return values.equals(((PartitionSpec) obj).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("PARTITION(");
        boolean first = true;
        for (Map.Entry<String, Optional<String>> entry : values.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            first = false;
            sb.append(entry.getKey());
            entry.getValue().ifPresent(v -> sb.append("='").append(v).append("'"));
        }
        return sb.append(")").toString();
    }

    /**
     * Builder for {@link PartitionSpec}.
     */
    public static final class Builder {

        private final Map<String, Optional<String>> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder staticValue(String column, String value) {
            return put(column, Optional.of(Objects.requireNonNull(value, "value must not be null")));
        }

        public Builder dynamic(String column) {
            return put(column, Optional.empty());
        }

        public PartitionSpec build() {
            return new PartitionSpec(values);
        }

        private Builder put(String column, Optional<String> value) {
            String key = normalize(column);
            if (values.containsKey(key)) {
                throw new IllegalArgumentException("Duplicate partition column: " + column);
            }
            values.put(key, value);
            return this;
        }
    }
}
