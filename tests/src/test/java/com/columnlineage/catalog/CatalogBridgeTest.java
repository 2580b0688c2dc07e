package com.columnlineage.catalog;

import com.columnlineage.config.LineageConfig;
import com.columnlineage.logical.LogicalPlan;
import com.columnlineage.test.TestBase;
import com.columnlineage.test.TestCategories;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static com.columnlineage.test.PlanBuilder.scan;
import static com.columnlineage.test.PlanBuilder.selectAll;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Catalog and Cache Registry Tests")
@Tag("catalog")
@TestCategories.Unit
public class CatalogBridgeTest extends TestBase {

    @Nested
    @DisplayName("InMemoryCatalog")
    class Catalogs {

        @Test
        @DisplayName("Registered view resolves to its defining plan, anything else is a base table")
        void testRegisterView() {
            LogicalPlan definition = selectAll(scan("test_db0.test_table0", "key", "value"));

            QualifiedName view = catalog.registerView("V1", definition);

            assertThat(view).isEqualTo(QualifiedName.of("default", "v1"));
            assertThat(catalog.resolveDefiningPlan(QualifiedName.of("default", "v1"))).containsSame(definition);
            assertThat(catalog.resolveDefiningPlan(QualifiedName.of("test_db0", "test_table0"))).isEmpty();
        }

        @Test
        @DisplayName("Dropped view becomes unknown")
        void testDropView() {
            catalog.registerView("db.v", selectAll(scan("db.t", "a")));

            assertThat(catalog.dropView("DB.V")).isTrue();
            assertThat(catalog.dropView("db.v")).isFalse();
            assertThat(catalog.resolveDefiningPlan(QualifiedName.of("db", "v"))).isEmpty();
        }

        @Test
        @DisplayName("Canonical names use the configured defaults")
        void testConfiguredDefaults() {
            InMemoryCatalog custom = new InMemoryCatalog(LineageConfig.fromMap(Map.of(
                LineageConfig.DEFAULT_DATABASE, "warehouse",
                LineageConfig.DEFAULT_CATALOG, "hive")));

            assertThat(custom.canonicalName("t").toString()).isEqualTo("warehouse.t");
            assertThat(custom.canonicalName("hive.db.t").toString()).isEqualTo("db.t");
            assertThat(custom.canonicalName("spark_catalog.db.t").toString()).isEqualTo("spark_catalog.db.t");
        }
    }

    @Nested
    @DisplayName("CacheKey and InMemoryCacheRegistry")
    class Caches {

        @Test
        @DisplayName("Named keys compare case-insensitively")
        void testNamedKeys() {
            assertThat(CacheKey.named("C1")).isEqualTo(CacheKey.named("c1"));
            assertThat(CacheKey.named("c1")).isNotEqualTo(CacheKey.named("c2"));
        }

        @Test
        @DisplayName("Instance keys compare by identity")
        void testInstanceKeys() {
            LogicalPlan first = selectAll(scan("db.t", "a"));
            LogicalPlan second = selectAll(scan("db.t", "a"));

            assertThat(CacheKey.instance(first)).isEqualTo(CacheKey.instance(first));
            assertThat(CacheKey.instance(first)).isNotEqualTo(CacheKey.instance(second));
        }

        @Test
        @DisplayName("Registry looks up by name and by instance")
        void testLookup() {
            LogicalPlan named = selectAll(scan("db.t", "a"));
            LogicalPlan cached = selectAll(scan("db.u", "b"));

            cacheRegistry.cacheNamed("c1", named);
            CacheKey instanceKey = cacheRegistry.cacheInstance(cached);

            assertThat(cacheRegistry.lookup(CacheKey.named("C1"))).containsSame(named);
            assertThat(cacheRegistry.lookup(instanceKey)).containsSame(cached);
            assertThat(cacheRegistry.lookup(CacheKey.named("missing"))).isEmpty();

            assertThat(cacheRegistry.uncache(instanceKey)).isTrue();
            assertThat(cacheRegistry.lookup(instanceKey)).isEmpty();
        }

        @Test
        @DisplayName("Empty registry knows no cache")
        void testEmptyRegistry() {
            assertThat(CacheRegistry.empty().lookup(CacheKey.named("c1"))).isEmpty();
        }
    }
}
