package com.columnlineage.logical;

import com.columnlineage.expression.AttributeReference;
import com.columnlineage.expression.Expression;
import com.columnlineage.expression.Literal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Represents grouping sets for multi-dimensional aggregation.
 *
 * <p><b>ROLLUP</b> generates hierarchical grouping sets:
 * <pre>
 * ROLLUP(a, b, c) generates:
 * - (a, b, c)
 * - (a, b)
 * - (a)
 * - ()
 * </pre>
 *
 * <p><b>CUBE</b> generates all possible combinations:
 * <pre>
 * CUBE(a, b) generates:
 * - (a, b)
 * - (a)
 * - (b)
 * - ()
 * </pre>
 *
 * <p><b>GROUPING SETS</b> allows explicit specification:
 * <pre>
 * GROUP BY a, b, c, d GROUPING SETS ((a, b, c), (a, b, d))
 * </pre>
 *
 * <p>A resolved plan does not keep this specification; it keeps the
 * {@link Expand} it is executed as, with an {@link Aggregate} on top.
 * {@link #expand(LogicalPlan)} builds that Expand the way the resolver does:
 * <pre>
 * GroupingSets.Expansion expansion = GroupingSets.rollup(List.of(a, b)).expand(scan);
 * new Aggregate(expansion.plan(), groupingKeys, aggregates);
 * </pre>
 */
public final class GroupingSets {

    /**
     * Maximum recommended dimensions for CUBE operations.
     * 2^10 = 1,024 grouping sets.
     */
    public static final int MAX_CUBE_DIMENSIONS = 10;

    /** Name of the grouping id column added by the expansion. */
    public static final String GROUPING_ID_NAME = "spark_grouping_id";

    private final GroupingType type;
    private final List<AttributeReference> columns;
    private final List<List<AttributeReference>> sets;

    private GroupingSets(GroupingType type,
                         List<AttributeReference> columns,
                         List<List<AttributeReference>> sets) {
        this.type = type;
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        List<List<AttributeReference>> copy = new ArrayList<>(sets.size());
        for (List<AttributeReference> set : sets) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(set)));
        }
        this.sets = Collections.unmodifiableList(copy);
    }

    /**
     * Creates a ROLLUP grouping over the specified columns.
     *
     * @param columns the grouping columns in hierarchical order
     * @return a ROLLUP grouping sets instance
     * @throws IllegalArgumentException if columns is empty
     */
    public static GroupingSets rollup(List<AttributeReference> columns) {
        requireColumns(columns, GroupingType.ROLLUP);
        List<List<AttributeReference>> sets = new ArrayList<>();
        for (int size = columns.size(); size >= 0; size--) {
            sets.add(columns.subList(0, size));
        }
        return new GroupingSets(GroupingType.ROLLUP, columns, sets);
    }

    /**
     * Creates a CUBE grouping over the specified columns.
     *
     * <p><b>Warning:</b> CUBE generates 2^N grouping sets, so it is limited
     * to {@link #MAX_CUBE_DIMENSIONS} dimensions.
     *
     * @param columns the grouping columns
     * @return a CUBE grouping sets instance
     * @throws IllegalArgumentException if columns is empty or exceeds max dimensions
     */
    public static GroupingSets cube(List<AttributeReference> columns) {
        requireColumns(columns, GroupingType.CUBE);
        if (columns.size() > MAX_CUBE_DIMENSIONS) {
            throw new IllegalArgumentException(
                String.format("CUBE with %d dimensions exceeds maximum of %d " +
                              "(would generate %d grouping sets)",
                              columns.size(), MAX_CUBE_DIMENSIONS,
                              1 << columns.size()));
        }
        int n = columns.size();
        List<List<AttributeReference>> sets = new ArrayList<>();
        // Masks count down so the full set comes first and () last
        for (int mask = (1 << n) - 1; mask >= 0; mask--) {
            List<AttributeReference> set = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                if ((mask & (1 << (n - 1 - i))) != 0) {
                    set.add(columns.get(i));
                }
            }
            sets.add(set);
        }
        return new GroupingSets(GroupingType.CUBE, columns, sets);
    }

    /**
     * Creates GROUPING SETS whose grouping columns are those named by the sets,
     * in first-seen order.
     *
     * @param sets the explicit grouping sets
     * @return a GROUPING SETS instance
     * @throws IllegalArgumentException if sets is empty
     */
    public static GroupingSets groupingSets(List<List<AttributeReference>> sets) {
        Objects.requireNonNull(sets, "sets must not be null");
        Set<AttributeReference> columns = new LinkedHashSet<>();
        for (List<AttributeReference> set : sets) {
            columns.addAll(Objects.requireNonNull(set, "GROUPING SETS must not contain null sets"));
        }
        return groupingSets(new ArrayList<>(columns), sets);
    }

    /**
     * Creates GROUPING SETS over an explicit GROUP BY column list.
     *
     * @param columns the GROUP BY columns
     * @param sets the explicit grouping sets, each a subset of columns
     * @return a GROUPING SETS instance
     * @throws IllegalArgumentException if sets is empty or a set names a column not grouped by
     */
    public static GroupingSets groupingSets(List<AttributeReference> columns,
                                            List<List<AttributeReference>> sets) {
        Objects.requireNonNull(columns, "columns must not be null");
        Objects.requireNonNull(sets, "sets must not be null");
        if (sets.isEmpty()) {
            throw new IllegalArgumentException("GROUPING SETS requires at least one set");
        }
        for (int i = 0; i < sets.size(); i++) {
            List<AttributeReference> set = sets.get(i);
            if (set == null) {
                throw new IllegalArgumentException("GROUPING SETS must not contain null sets");
            }
            for (AttributeReference column : set) {
                if (column == null) {
                    throw new IllegalArgumentException(
                        String.format("GROUPING SETS set %d contains null expressions", i));
                }
                if (!columns.contains(column)) {
                    throw new IllegalArgumentException(
                        String.format("GROUPING SETS set %d uses %s, which is not a grouping column", i, column));
                }
            }
        }
        return new GroupingSets(GroupingType.GROUPING_SETS, columns, sets);
    }

    public GroupingType type() {
        return type;
    }

    public List<AttributeReference> columns() {
        return columns;
    }

    /**
     * Returns the grouping sets this specification expands to, in branch order.
     *
     * @return an unmodifiable list of grouping sets
     */
    public List<List<AttributeReference>> sets() {
        return sets;
    }

    /**
     * Builds the {@link Expand} that executes these grouping sets.
     *
     * <p>The expand output is the child's columns, then one fresh copy of each
     * grouping column, then the grouping id. In every branch the child's
     * columns pass through, a grouping column outside the branch's set is
     * NULL, and the grouping id is a literal bit mask with a 1 for each
     * grouping column left out (first column in the highest bit).
     *
     * @param child the aggregate input
     * @return the expansion
     */
    public Expansion expand(LogicalPlan child) {
        Objects.requireNonNull(child, "child must not be null");
        List<AttributeReference> childOutput = child.output();

        List<AttributeReference> groupingAttributes = new ArrayList<>(columns.size());
        for (AttributeReference column : columns) {
            groupingAttributes.add(AttributeReference.newColumn(column.name()));
        }
        AttributeReference groupingId = AttributeReference.newColumn(GROUPING_ID_NAME);

        List<AttributeReference> output = new ArrayList<>(childOutput);
        output.addAll(groupingAttributes);
        output.add(groupingId);

        List<List<Expression>> projections = new ArrayList<>(sets.size());
        int n = columns.size();
        for (List<AttributeReference> set : sets) {
            List<Expression> projection = new ArrayList<Expression>(childOutput);
            long mask = 0L;
            for (int i = 0; i < n; i++) {
                AttributeReference column = columns.get(i);
                if (set.contains(column)) {
                    projection.add(column);
                } else {
                    projection.add(Literal.NULL);
                    mask |= 1L << (n - 1 - i);
                }
            }
            projection.add(Literal.of(mask));
            projections.add(projection);
        }
        return new Expansion(new Expand(child, projections, output), columns, groupingAttributes, groupingId);
    }

    private static void requireColumns(List<AttributeReference> columns, GroupingType type) {
        Objects.requireNonNull(columns, "columns must not be null");
        if (columns.isEmpty()) {
            throw new IllegalArgumentException(type + " requires at least one column");
        }
        if (columns.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException(type + " columns must not contain null values");
        }
    }

    @Override
    public String toString() {
        return String.format("GroupingSets[type=%s, sets=%d]", type, sets.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GroupingSets that = (GroupingSets) o;
        return type == that.type &&
               Objects.equals(columns, that.columns) &&
               Objects.equals(sets, that.sets);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, columns, sets);
    }

    /**
     * Kind of grouping specification.
     */
    public enum GroupingType {
        ROLLUP,
        CUBE,
        GROUPING_SETS
    }

    /**
     * An {@link Expand} built from grouping sets, with handles on the columns
     * an aggregate above it groups by.
     */
    public static final class Expansion {

        private final Expand plan;
        private final List<AttributeReference> columns;
        private final List<AttributeReference> groupingAttributes;
        private final AttributeReference groupingId;

        private Expansion(Expand plan,
                          List<AttributeReference> columns,
                          List<AttributeReference> groupingAttributes,
                          AttributeReference groupingId) {
            this.plan = plan;
            this.columns = columns;
            this.groupingAttributes = Collections.unmodifiableList(groupingAttributes);
            this.groupingId = groupingId;
        }

        public Expand plan() {
            return plan;
        }

        /**
         * Returns the expanded copies of the grouping columns, in grouping order.
         *
         * @return the grouping attributes
         */
        public List<AttributeReference> groupingAttributes() {
            return groupingAttributes;
        }

        /**
         * Returns the expanded copy of one grouping column.
         *
         * @param column a grouping column of the child
         * @return its copy in the expand output
         * @throws IllegalArgumentException if column is not a grouping column
         */
        public AttributeReference groupingAttribute(AttributeReference column) {
            int index = columns.indexOf(column);
            if (index < 0) {
                throw new IllegalArgumentException(column + " is not a grouping column");
            }
            return groupingAttributes.get(index);
        }

        public AttributeReference groupingId() {
            return groupingId;
        }
    }
}
