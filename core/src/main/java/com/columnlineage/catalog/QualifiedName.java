package com.columnlineage.catalog;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Canonical name of a table, view, or output directory.
 *
 * <p>Table names are {@code [catalog.]database.table}; the catalog part is
 * only present for a non-default catalog. Comparison is case-insensitive, so
 * every part is stored lower-cased. A directory sink has no catalog entry and
 * is named by its path, rendered between backticks:
 * <pre>
 *   QualifiedName.of("test_db0", "test_table0")       // test_db0.test_table0
 *   QualifiedName.of("v2_catalog", "db", "tb")        // v2_catalog.db.tb
 *   QualifiedName.path("/tmp/out")                    // `/tmp/out`
 * </pre>
 */
public final class QualifiedName {

    private final String catalog;   // null for the default catalog
    private final String database;  // null for a path
    private final String table;     // null for a path
    private final String path;      // null for a table

    private QualifiedName(String catalog, String database, String table, String path) {
        this.catalog = catalog;
        this.database = database;
        this.table = table;
        this.path = path;
    }

    /**
     * Creates a name in the default catalog.
     *
     * @param database the database
     * @param table the table
     * @return the qualified name
     */
    public static QualifiedName of(String database, String table) {
        return of(null, database, table);
    }

    /**
     * Creates a name in the given catalog.
     *
     * @param catalog the catalog, or null for the default catalog
     * @param database the database
     * @param table the table
     * @return the qualified name
     */
    public static QualifiedName of(String catalog, String database, String table) {
        requireNonBlank(database, "database");
        requireNonBlank(table, "table");
        return new QualifiedName(
            catalog == null || catalog.isEmpty() ? null : catalog.toLowerCase(Locale.ROOT),
            database.toLowerCase(Locale.ROOT),
            table.toLowerCase(Locale.ROOT),
            null);
    }

    /**
     * Creates the name of a directory sink.
     *
     * @param path the output path, kept verbatim
     * @return the qualified name
     */
    public static QualifiedName path(String path) {
        requireNonBlank(path, "path");
        return new QualifiedName(null, null, null, path);
    }

    /**
     * Parses a dotted identifier.
     *
     * <p>A one-part identifier gets the default database; a three-or-more-part
     * identifier names its catalog first and its table last, with everything in
     * between as the (possibly multi-level) database. The default catalog is
     * dropped. A backtick-quoted identifier is a path.
     *
     * @param identifier the identifier
     * @param defaultCatalog the catalog left out of rendered names
     * @param defaultDatabase the database for one-part identifiers
     * @return the qualified name
     */
    public static QualifiedName parse(String identifier, String defaultCatalog, String defaultDatabase) {
        requireNonBlank(identifier, "identifier");
        String trimmed = identifier.trim();
        if (trimmed.length() > 2 && trimmed.startsWith("`") && trimmed.endsWith("`")) {
            return path(trimmed.substring(1, trimmed.length() - 1));
        }
        String[] parts = trimmed.split("\\.");
        for (String part : parts) {
            if (part.trim().isEmpty()) {
                throw new IllegalArgumentException("Invalid identifier: " + identifier);
            }
        }
        switch (parts.length) {
            case 1:
                return of(defaultDatabase, parts[0]);
            case 2:
                return of(parts[0], parts[1]);
            default:
                String catalogPart = parts[0];
                String database = String.join(".", Arrays.copyOfRange(parts, 1, parts.length - 1));
                boolean isDefault = defaultCatalog != null && catalogPart.equalsIgnoreCase(defaultCatalog);
                return of(isDefault ? null : catalogPart, database, parts[parts.length - 1]);
        }
    }

    public Optional<String> catalog() {
        return Optional.ofNullable(catalog);
    }

    /**
     * Returns the database.
     *
     * @return the database
     * @throws IllegalStateException if this is a path
     */
    public String database() {
        if (isPath()) {
            throw new IllegalStateException("A path has no database: " + this);
        }
        return database;
    }

    /**
     * Returns the table.
     *
     * @return the table
     * @throws IllegalStateException if this is a path
     */
    public String table() {
        if (isPath()) {
            throw new IllegalStateException("A path has no table: " + this);
        }
        return table;
    }

    public boolean isPath() {
        return path != null;
    }

    /**
     * Returns the path of a directory sink.
     *
     * @return the path, or empty for a table
     */
    public Optional<String> pathValue() {
        return Optional.ofNullable(path);
    }

    /**
     * Renders a column of this table as {@code name.column}.
     *
     * @param column the column name
     * @return the rendered column
     */
    public String column(String column) {
        return this + "." + column;
    }

    @Override
    public String toString() {
        if (path != null) {
            return "`" + path + "`";
        }
        return catalog != null ? catalog + "." + database + "." + table : database + "." + table;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof QualifiedName)) return false;
        QualifiedName that = (QualifiedName) obj;
        return Objects.equals(catalog, that.catalog) &&
               Objects.equals(database, that.database) &&
               Objects.equals(table, that.table) &&
               Objects.equals(path, that.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(catalog, database, table, path);
    }

    private static void requireNonBlank(String value, String what) {
        Objects.requireNonNull(value, what + " must not be null");
        if (value.trim().isEmpty()) {
            throw new IllegalArgumentException(what + " must not be empty");
        }
    }
}
