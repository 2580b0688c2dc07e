package com.columnlineage.expression;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Opaque identity of a column value produced somewhere in a plan.
 *
 * <p>Two references denote the same column if and only if their ids are equal,
 * regardless of the display name each reference carries. Ids are minted from a
 * process-wide counter, so plans built independently (on any thread) never
 * share an id by accident.
 *
 * <p>Example:
 * <pre>
 *   ColumnId key = ColumnId.newId();
 *   AttributeReference a = new AttributeReference(key, "key");
 *   AttributeReference b = a.withName("k");   // same id, new display name
 * </pre>
 */
public final class ColumnId implements Comparable<ColumnId> {

    private static final AtomicLong NEXT_ID = new AtomicLong();

    private final long id;

    private ColumnId(long id) {
        this.id = id;
    }

    /**
     * Mints a fresh, never-before-used column id.
     *
     * @return the new id
     */
    public static ColumnId newId() {
        return new ColumnId(NEXT_ID.getAndIncrement());
    }

    /**
     * Returns the numeric value of this id.
     *
     * @return the id value
     */
    public long value() {
        return id;
    }

    @Override
    public int compareTo(ColumnId other) {
        return Long.compare(id, other.id);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ColumnId)) return false;
        return id == ((ColumnId) obj).id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "#" + id;
    }
}
