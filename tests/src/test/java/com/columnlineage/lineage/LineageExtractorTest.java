package com.columnlineage.lineage;

import com.columnlineage.catalog.Catalog;
import com.columnlineage.catalog.CacheRegistry;
import com.columnlineage.catalog.QualifiedName;
import com.columnlineage.command.CreateTableAsSelect;
import com.columnlineage.exception.LineageException;
import com.columnlineage.exception.UnresolvedPlanException;
import com.columnlineage.exception.UnsupportedOperatorException;
import com.columnlineage.expression.AttributeReference;
import com.columnlineage.expression.InSubquery;
import com.columnlineage.expression.UnresolvedColumn;
import com.columnlineage.logical.Join;
import com.columnlineage.logical.LogicalPlan;
import com.columnlineage.logical.TableScan;
import com.columnlineage.test.TestBase;
import com.columnlineage.test.TestCategories;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static com.columnlineage.test.PlanBuilder.as;
import static com.columnlineage.test.PlanBuilder.col;
import static com.columnlineage.test.PlanBuilder.eq;
import static com.columnlineage.test.PlanBuilder.filter;
import static com.columnlineage.test.PlanBuilder.fn;
import static com.columnlineage.test.PlanBuilder.join;
import static com.columnlineage.test.PlanBuilder.name;
import static com.columnlineage.test.PlanBuilder.project;
import static com.columnlineage.test.PlanBuilder.scan;
import static com.columnlineage.test.PlanBuilder.selectAll;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Extraction entry point: validation, fallbacks and error reporting.
 */
@DisplayName("Lineage Extractor Tests")
@Tag("lineage")
@Tag("tier1")
@TestCategories.Unit
public class LineageExtractorTest extends TestBase {

    @Nested
    @DisplayName("Unresolved plans")
    class Unresolved {

        @Test
        @DisplayName("An unresolved column fails the extraction")
        void testUnresolvedColumn() {
            TableScan t = scan("db.t", "a");
            LogicalPlan plan = project(t, as(fn("upper", new UnresolvedColumn("missing", "t")), "x"));

            LineageResult result = extractor().extractLineage(plan);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.lineage()).isEmpty();
            assertThat(result.error().get()).isInstanceOf(UnresolvedPlanException.class);
            UnresolvedPlanException error = (UnresolvedPlanException) result.error().get();
            assertThat(error.getColumn().columnName()).isEqualTo("missing");
            assertThat(error.getFailedPlan()).isSameAs(plan);
            assertThat(error.getMessage()).contains("(plan type: Project)");
        }

        @Test
        @DisplayName("An unresolved column inside a subquery is found too")
        void testUnresolvedInsideSubquery() {
            TableScan t = scan("db.t", "a");
            TableScan u = scan("db.u", "a");
            LogicalPlan broken = project(u, as(new UnresolvedColumn("ghost"), "g"));
            LogicalPlan plan = selectAll(filter(t, new InSubquery(col(t, "a"), broken, false)));

            LineageResult result = extractor().extractLineage(plan);

            assertThat(result.error().get()).isInstanceOf(UnresolvedPlanException.class);
            assertThat(result.error().get().getFailedPlan()).isSameAs(broken);
        }

        @Test
        @DisplayName("getOrThrow rethrows the failure")
        void testGetOrThrow() {
            LogicalPlan plan = project(scan("db.t", "a"), as(new UnresolvedColumn("x"), "x"));

            LineageResult result = extractor().extractLineage(plan);

            assertThatThrownBy(result::getOrThrow)
                .isInstanceOf(UnresolvedPlanException.class)
                .hasMessageContaining("Unresolved column reference");
        }
    }

    @Nested
    @DisplayName("Operators without a rule")
    class Unsupported {

        @Test
        @DisplayName("Same-width operator passes its child through with a warning")
        void testPositionalFallback() {
            TableScan t = scan("db.t", "a", "b");
            Sample sample = new Sample(project(t, col(t, "a"), col(t, "b")), false);

            LineageResult result = extractor().extractLineage(project(sample, col(sample, "b")));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.warnings()).hasSize(1);
            UnsupportedOperatorException warning = result.warnings().get(0);
            assertThat(warning.getFailedPlan()).isSameAs(sample);
            assertThat(warning.getMessage()).contains("Sample");
            assertThat(sourcesAt(result.getOrThrow(), 0)).containsExactly("db.t.b");
        }

        @Test
        @DisplayName("Different-width operator derives from nothing but keeps its tables")
        void testFallbackWidthMismatch() {
            TableScan t = scan("db.t", "a", "b");
            Sample sample = new Sample(t, true);

            LineageResult result = extractor().extractLineage(sample);

            Lineage lineage = result.getOrThrow();
            assertThat(result.warnings()).hasSize(1);
            assertThat(tableNames(lineage.sources())).containsExactly("db.t");
            assertThat(lineage.columnNames()).containsExactly("a", "b", "weight");
            assertThat(sourcesAt(lineage, 0)).isEmpty();
            assertThat(sourcesAt(lineage, 2)).isEmpty();
        }

        @Test
        @DisplayName("Warnings do not leak between extractions")
        void testWarningsPerExtraction() {
            LineageExtractor extractor = extractor();
            extractor.extractLineage(new Sample(scan("db.t", "a"), false));

            LineageResult clean = extractor.extractLineage(scan("db.t", "a"));

            assertThat(clean.warnings()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Error handling")
    class Errors {

        @Test
        @DisplayName("Host failures are wrapped with the root plan")
        void testUnexpectedErrorIsWrapped() {
            Catalog failing = new Catalog() {
                @Override
                public Optional<LogicalPlan> resolveDefiningPlan(QualifiedName name) {
                    throw new IllegalStateException("metastore unavailable");
                }

                @Override
                public QualifiedName canonicalName(String identifier) {
                    return name(identifier);
                }
            };
            LogicalPlan plan = new CreateTableAsSelect(name("db.dst"), selectAll(scan("db.t", "a")));

            LineageResult result = new LineageExtractor(failing, CacheRegistry.empty()).extractLineage(plan);

            assertThat(result.isSuccess()).isFalse();
            LineageException error = result.error().get();
            assertThat(error.getMessage())
                .startsWith("Unexpected error during lineage extraction: metastore unavailable");
            assertThat(error.getCause()).isInstanceOf(IllegalStateException.class);
            assertThat(error.getFailedPlan()).isSameAs(plan);
            assertThat(error.getUserMessage()).startsWith("Failed to extract column lineage");
            assertThat(error.getTechnicalMessage()).contains("Cause: metastore unavailable");
        }

        @Test
        @DisplayName("The extractor can be reused across statements")
        void testReuse() {
            LineageExtractor extractor = extractor();
            TableScan t = scan("db.t", "a");
            TableScan u = scan("db.u", "a");

            Lineage first = extractor.extractLineage(selectAll(t)).getOrThrow();
            Lineage second = extractor.extractLineage(
                project(join(t, u, Join.JoinType.INNER, eq(col(t, "a"), col(u, "a"))), col(u, "a")))
                .getOrThrow();

            assertThat(tableNames(first.sources())).containsExactly("db.t");
            assertThat(tableNames(second.sources())).containsExactly("db.t", "db.u");
            assertThat(sourcesAt(second, 0)).containsExactly("db.u.a");
        }
    }

    /**
     * {@code TABLESAMPLE}, optionally with a weight column appended.
     */
    private static final class Sample extends LogicalPlan {

        private final List<AttributeReference> output;

        Sample(LogicalPlan child, boolean withWeight) {
            super(child);
            List<AttributeReference> attributes = new ArrayList<>(child.output());
            if (withWeight) {
                attributes.add(AttributeReference.newColumn("weight"));
            }
            this.output = Collections.unmodifiableList(attributes);
        }

        @Override
        public List<AttributeReference> output() {
            return output;
        }

        @Override
        public String toString() {
            return "Sample(output=" + output + ")";
        }
    }
}
