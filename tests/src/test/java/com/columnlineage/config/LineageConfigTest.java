package com.columnlineage.config;

import com.columnlineage.test.TestBase;
import com.columnlineage.test.TestCategories;
import java.util.Collections;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LineageConfig Tests")
@Tag("config")
@TestCategories.Unit
public class LineageConfigTest extends TestBase {

    @AfterEach
    void clearProperties() {
        System.clearProperty(LineageConfig.SKIP_PERMANENT_VIEWS);
        System.clearProperty(LineageConfig.DEFAULT_DATABASE);
    }

    @Test
    @DisplayName("Defaults")
    void testDefaults() {
        LineageConfig config = LineageConfig.defaults();

        assertThat(config.skipPermanentViews()).isFalse();
        assertThat(config.defaultCatalog()).isEqualTo("spark_catalog");
        assertThat(config.defaultDatabase()).isEqualTo("default");
        assertThat(LineageConfig.fromMap(Collections.emptyMap())).isEqualTo(config);
    }

    @Test
    @DisplayName("Settings are read from a map")
    void testFromMap() {
        LineageConfig config = LineageConfig.fromMap(Map.of(
            LineageConfig.SKIP_PERMANENT_VIEWS, " TRUE ",
            LineageConfig.DEFAULT_DATABASE, "Warehouse",
            "unrelated.key", "ignored"));

        assertThat(config.skipPermanentViews()).isTrue();
        assertThat(config.defaultDatabase()).isEqualTo("warehouse");
        assertThat(config.toMap()).containsEntry(LineageConfig.SKIP_PERMANENT_VIEWS, "true");
    }

    @Test
    @DisplayName("Malformed boolean falls back to the default")
    void testMalformedBoolean() {
        LineageConfig config = LineageConfig.fromMap(Map.of(LineageConfig.SKIP_PERMANENT_VIEWS, "yes please"));

        assertThat(config.skipPermanentViews()).isFalse();
    }

    @Test
    @DisplayName("Empty default database is rejected")
    void testEmptyDatabase() {
        assertThatThrownBy(() -> LineageConfig.fromMap(Map.of(LineageConfig.DEFAULT_DATABASE, "")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Settings are read from system properties")
    void testFromSystemProperties() {
        System.setProperty(LineageConfig.SKIP_PERMANENT_VIEWS, "true");
        System.setProperty(LineageConfig.DEFAULT_DATABASE, "sys_db");

        LineageConfig config = LineageConfig.fromSystemProperties();

        assertThat(config.skipPermanentViews()).isTrue();
        assertThat(config.defaultDatabase()).isEqualTo("sys_db");
        assertThat(config.defaultCatalog()).isEqualTo("spark_catalog");
    }
}
