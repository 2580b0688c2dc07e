package com.columnlineage.config;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings that shape how lineage is extracted and how names are rendered.
 *
 * <p>Instances are immutable. They are built from a key/value map (as a host
 * would pass its session configuration) or from JVM system properties:
 * <pre>
 *   LineageConfig config = LineageConfig.fromMap(Map.of(
 *       LineageConfig.SKIP_PERMANENT_VIEWS, "true"));
 *
 *   // -Dcolumnlineage.default.database=warehouse
 *   LineageConfig fromJvm = LineageConfig.fromSystemProperties();
 * </pre>
 */
public final class LineageConfig {

    private static final Logger logger = LoggerFactory.getLogger(LineageConfig.class);

    /** Treat permanent views as base tables instead of inlining their definitions. */
    public static final String SKIP_PERMANENT_VIEWS = "columnlineage.skip.parsing.permanent.view.enabled";

    /** Catalog whose name is left out when rendering qualified names. */
    public static final String DEFAULT_CATALOG = "columnlineage.default.catalog";

    /** Database filled in for identifiers that do not name one. */
    public static final String DEFAULT_DATABASE = "columnlineage.default.database";

    public static final boolean DEFAULT_SKIP_PERMANENT_VIEWS = false;
    public static final String DEFAULT_CATALOG_NAME = "spark_catalog";
    public static final String DEFAULT_DATABASE_NAME = "default";

    private static final LineageConfig DEFAULTS = new LineageConfig(
        DEFAULT_SKIP_PERMANENT_VIEWS, DEFAULT_CATALOG_NAME, DEFAULT_DATABASE_NAME);

    private final boolean skipPermanentViews;
    private final String defaultCatalog;
    private final String defaultDatabase;

    private LineageConfig(boolean skipPermanentViews, String defaultCatalog, String defaultDatabase) {
        this.skipPermanentViews = skipPermanentViews;
        this.defaultCatalog = Objects.requireNonNull(defaultCatalog, "defaultCatalog must not be null")
            .toLowerCase(Locale.ROOT);
        this.defaultDatabase = Objects.requireNonNull(defaultDatabase, "defaultDatabase must not be null")
            .toLowerCase(Locale.ROOT);
        if (this.defaultDatabase.isEmpty()) {
            throw new IllegalArgumentException("default database must not be empty");
        }
    }

    /**
     * Returns the default configuration.
     *
     * @return the defaults
     */
    public static LineageConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Builds a configuration from key/value settings. Unknown keys are ignored;
     * missing keys take their defaults.
     *
     * @param settings the settings
     * @return the configuration
     */
    public static LineageConfig fromMap(Map<String, String> settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        return new LineageConfig(
            parseBoolean(settings, SKIP_PERMANENT_VIEWS, DEFAULT_SKIP_PERMANENT_VIEWS),
            settings.getOrDefault(DEFAULT_CATALOG, DEFAULT_CATALOG_NAME),
            settings.getOrDefault(DEFAULT_DATABASE, DEFAULT_DATABASE_NAME));
    }

    /**
     * Builds a configuration from JVM system properties.
     *
     * @return the configuration
     */
    public static LineageConfig fromSystemProperties() {
        Map<String, String> settings = new HashMap<>();
        for (String key : new String[] {SKIP_PERMANENT_VIEWS, DEFAULT_CATALOG, DEFAULT_DATABASE}) {
            String value = System.getProperty(key);
            if (value != null) {
                settings.put(key, value);
            }
        }
        return fromMap(settings);
    }

    public boolean skipPermanentViews() {
        return skipPermanentViews;
    }

    public String defaultCatalog() {
        return defaultCatalog;
    }

    public String defaultDatabase() {
        return defaultDatabase;
    }

    /**
     * Returns the effective settings as a key/value map.
     *
     * @return an unmodifiable map of every setting
     */
    public Map<String, String> toMap() {
        Map<String, String> map = new HashMap<>();
        map.put(SKIP_PERMANENT_VIEWS, Boolean.toString(skipPermanentViews));
        map.put(DEFAULT_CATALOG, defaultCatalog);
        map.put(DEFAULT_DATABASE, defaultDatabase);
        return Collections.unmodifiableMap(map);
    }

    private static boolean parseBoolean(Map<String, String> settings, String key, boolean defaultValue) {
        String value = settings.get(key);
        if (value == null) {
            return defaultValue;
        }
        String trimmed = value.trim();
        if ("true".equalsIgnoreCase(trimmed)) {
            return true;
        }
        if ("false".equalsIgnoreCase(trimmed)) {
            return false;
        }
        logger.warn("Ignoring invalid boolean '{}' for {}, using {}", value, key, defaultValue);
        return defaultValue;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof LineageConfig)) return false;
        LineageConfig that = (LineageConfig) obj;
        return skipPermanentViews == that.skipPermanentViews &&
               defaultCatalog.equals(that.defaultCatalog) &&
               defaultDatabase.equals(that.defaultDatabase);
    }

    @Override
    public int hashCode() {
        return Objects.hash(skipPermanentViews, defaultCatalog, defaultDatabase);
    }

    @Override
    public String toString() {
        return "LineageConfig" + toMap();
    }
}
