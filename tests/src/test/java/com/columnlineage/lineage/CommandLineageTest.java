package com.columnlineage.lineage;

import com.columnlineage.catalog.QualifiedName;
import com.columnlineage.command.AlterViewAs;
import com.columnlineage.command.Assignment;
import com.columnlineage.command.Command;
import com.columnlineage.command.CreateTable;
import com.columnlineage.command.CreateTableAsSelect;
import com.columnlineage.command.CreateView;
import com.columnlineage.command.DeleteAction;
import com.columnlineage.command.InsertAction;
import com.columnlineage.command.InsertIntoDirectory;
import com.columnlineage.command.InsertIntoTable;
import com.columnlineage.command.MergeAction;
import com.columnlineage.command.MergeIntoTable;
import com.columnlineage.command.PartitionSpec;
import com.columnlineage.command.UpdateAction;
import com.columnlineage.expression.BinaryExpression;
import com.columnlineage.expression.CastExpression;
import com.columnlineage.expression.ScalarSubquery;
import com.columnlineage.logical.Join;
import com.columnlineage.logical.LogicalPlan;
import com.columnlineage.logical.Project;
import com.columnlineage.logical.TableScan;
import com.columnlineage.test.TestBase;
import com.columnlineage.test.TestCategories;
import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static com.columnlineage.test.PlanBuilder.as;
import static com.columnlineage.test.PlanBuilder.col;
import static com.columnlineage.test.PlanBuilder.eq;
import static com.columnlineage.test.PlanBuilder.fn;
import static com.columnlineage.test.PlanBuilder.join;
import static com.columnlineage.test.PlanBuilder.name;
import static com.columnlineage.test.PlanBuilder.project;
import static com.columnlineage.test.PlanBuilder.scan;
import static com.columnlineage.test.PlanBuilder.selectAll;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Lineage of commands bound onto their destination.
 */
@DisplayName("Command Lineage Tests")
@Tag("lineage")
@Tag("tier1")
@TestCategories.Unit
public class CommandLineageTest extends TestBase {

    private static final String T0 = "test_db0.test_table0";

    private static Project keyValueQuery(TableScan t) {
        return project(t, as(col(t, "key"), "a"), as(col(t, "value"), "b"));
    }

    @Nested
    @DisplayName("CREATE and ALTER")
    class Create {

        @Test
        @DisplayName("CTAS names destination columns after the query")
        void testCreateTableAsSelect() {
            // Given: CREATE TABLE t1 AS SELECT key AS a, value AS b FROM test_db0.test_table0
            LogicalPlan plan = new CreateTableAsSelect(name("t1"), keyValueQuery(scan(T0, "key", "value")));

            // When
            Lineage lineage = lineageOf(plan);

            // Then
            assertThat(tableNames(lineage.sources())).containsExactly(T0);
            assertThat(tableNames(lineage.targets())).containsExactly("default.t1");
            assertThat(lineage.columnNames()).containsExactly("default.t1.a", "default.t1.b");
            assertThat(sourcesAt(lineage, 0)).containsExactly("test_db0.test_table0.key");
            assertThat(sourcesAt(lineage, 1)).containsExactly("test_db0.test_table0.value");
        }

        @Test
        @DisplayName("CREATE VIEW with a column list uses the listed names")
        void testCreateViewWithColumnList() {
            TableScan t = scan(T0, "key", "value");
            LogicalPlan plan = new CreateView(name("db.v"), Arrays.asList("x", "y"), true, keyValueQuery(t));

            Lineage lineage = lineageOf(plan);

            assertThat(lineage.columnNames()).containsExactly("db.v.x", "db.v.y");
            assertThat(sourcesAt(lineage, 1)).containsExactly("test_db0.test_table0.value");
        }

        @Test
        @DisplayName("ALTER VIEW AS rebinds the view")
        void testAlterViewAs() {
            TableScan t = scan(T0, "key", "value");
            LogicalPlan plan = new AlterViewAs(name("db.v"), project(t, as(fn("md5", col(t, "value")), "digest")));

            Lineage lineage = lineageOf(plan);

            assertThat(tableNames(lineage.targets())).containsExactly("db.v");
            assertThat(lineage.columnNames()).containsExactly("db.v.digest");
            assertThat(sourcesAt(lineage, 0)).containsExactly("test_db0.test_table0.value");
        }

        @Test
        @DisplayName("CREATE TABLE without a query has no lineage")
        void testCreateTable() {
            Lineage lineage = lineageOf(new CreateTable(name("db.t"), Arrays.asList("a", "b")));

            assertThat(lineage.isEmpty()).isTrue();
            assertThat(lineage).isEqualTo(Lineage.empty());
        }
    }

    @Nested
    @DisplayName("INSERT")
    class Insert {

        @Test
        @DisplayName("INSERT binds query columns to the table schema by position")
        void testInsertByPosition() {
            // INSERT INTO t1 SELECT value, key FROM t0: names on the query side do not matter
            TableScan t = scan(T0, "key", "value");
            LogicalPlan plan = new InsertIntoTable(name("t1"), Arrays.asList("a", "b"), false,
                project(t, col(t, "value"), col(t, "key")));

            Lineage lineage = lineageOf(plan);

            assertThat(lineage.columnNames()).containsExactly("default.t1.a", "default.t1.b");
            assertThat(sourcesAt(lineage, 0)).containsExactly("test_db0.test_table0.value");
            assertThat(sourcesAt(lineage, 1)).containsExactly("test_db0.test_table0.key");
        }

        @Test
        @DisplayName("Static partition columns derive from nothing")
        void testStaticPartition() {
            // INSERT INTO test_table_part0 PARTITION (pid = 'grouping_pid') SELECT key, value FROM t0
            TableScan t = scan(T0, "key", "value");
            PartitionSpec partition = PartitionSpec.builder().staticValue("pid", "grouping_pid").build();
            LogicalPlan plan = new InsertIntoTable(name("test_db0.test_table_part0"),
                Arrays.asList("key", "value", "pid"), partition, false, selectAll(t));

            Lineage lineage = lineageOf(plan);

            assertThat(lineage.columnNames()).containsExactly(
                "test_db0.test_table_part0.key", "test_db0.test_table_part0.value", "test_db0.test_table_part0.pid");
            assertThat(sourcesAt(lineage, 0)).containsExactly("test_db0.test_table0.key");
            assertThat(sourcesAt(lineage, 1)).containsExactly("test_db0.test_table0.value");
            assertThat(sourcesAt(lineage, 2)).isEmpty();
        }

        @Test
        @DisplayName("Mixed static and dynamic partitions skip only the static one")
        void testMixedPartitions() {
            // INSERT OVERWRITE t PARTITION (p1 = 'x', p2) SELECT a, b AS p2 FROM s
            TableScan s = scan("db.s", "a", "b");
            PartitionSpec partition = PartitionSpec.builder().staticValue("p1", "x").dynamic("p2").build();
            LogicalPlan plan = new InsertIntoTable(name("db.t"), Arrays.asList("c", "p1", "p2"), partition, true,
                project(s, col(s, "a"), as(col(s, "b"), "p2")));

            Lineage lineage = lineageOf(plan);

            assertThat(sourcesAt(lineage, 0)).containsExactly("db.s.a");
            assertThat(sourcesAt(lineage, 1)).isEmpty();
            assertThat(sourcesAt(lineage, 2)).containsExactly("db.s.b");
        }

        @Test
        @DisplayName("Directory inserts target the quoted path")
        void testInsertIntoDirectory() {
            TableScan t = scan(T0, "key", "value");
            LogicalPlan plan = new InsertIntoDirectory("/tmp/out", true, selectAll(t));

            Lineage lineage = lineageOf(plan);

            assertThat(tableNames(lineage.targets())).containsExactly("`/tmp/out`");
            assertThat(lineage.columnNames()).containsExactly("`/tmp/out`.key", "`/tmp/out`.value");
            assertThat(sourcesAt(lineage, 0)).containsExactly("test_db0.test_table0.key");
        }

        @Test
        @DisplayName("Scalar subquery tables precede the main query tables")
        void testInsertWithScalarSubquery() {
            TableScan t = scan("db.t", "a");
            TableScan u = scan("db.u", "m");
            LogicalPlan query = project(t, col(t, "a"), as(new ScalarSubquery(project(u, col(u, "m"))), "m"));
            LogicalPlan plan = new InsertIntoTable(name("db.dst"), Arrays.asList("a", "m"), false, query);

            Lineage lineage = lineageOf(plan);

            assertThat(tableNames(lineage.sources())).containsExactly("db.u", "db.t");
            assertThat(sourcesAt(lineage, 1)).containsExactly("db.u.m");
        }
    }

    @Nested
    @DisplayName("MERGE")
    class Merge {

        private final TableScan target = scan("v2_catalog.db.target_t", "id", "name", "price");

        @Test
        @DisplayName("Update and insert clauses union per target column")
        void testMergeAssignments() {
            // Given
            //   MERGE INTO v2_catalog.db.target_t AS target
            //   USING v2_catalog.db.source_t AS source ON target.id = source.id
            //   WHEN MATCHED THEN UPDATE SET target.name = source.name, target.price = source.price
            //   WHEN NOT MATCHED THEN INSERT (id, name, price) VALUES (cast(source.id AS int), source.name, source.price)
            TableScan source = scan("v2_catalog.db.source_t", "id", "name", "price");
            MergeAction update = new UpdateAction(null, Arrays.asList(
                new Assignment(col(target, "name"), col(source, "name")),
                new Assignment(col(target, "price"), col(source, "price"))));
            MergeAction insert = new InsertAction(null, Arrays.asList(
                new Assignment(col(target, "id"), new CastExpression(col(source, "id"), "int")),
                new Assignment(col(target, "name"), col(source, "name")),
                new Assignment(col(target, "price"), col(source, "price"))));
            MergeIntoTable merge = new MergeIntoTable(target, source, eq(col(target, "id"), col(source, "id")),
                Collections.singletonList(update), Collections.singletonList(insert));

            // When
            Lineage lineage = lineageOf(merge);

            // Then
            assertThat(tableNames(lineage.sources())).containsExactly("v2_catalog.db.source_t");
            assertThat(tableNames(lineage.targets())).containsExactly("v2_catalog.db.target_t");
            assertThat(lineage.columnNames()).containsExactly(
                "v2_catalog.db.target_t.id", "v2_catalog.db.target_t.name", "v2_catalog.db.target_t.price");
            assertThat(sourcesAt(lineage, 0)).containsExactly("v2_catalog.db.source_t.id");
            assertThat(sourcesAt(lineage, 1)).containsExactly("v2_catalog.db.source_t.name");
            assertThat(sourcesAt(lineage, 2)).containsExactly("v2_catalog.db.source_t.price");
        }

        @Test
        @DisplayName("Star clauses write target columns by position")
        void testMergeStar() {
            TableScan source = scan("v2_catalog.db.source_t", "sid", "sname", "sprice");
            MergeIntoTable merge = new MergeIntoTable(target, source, eq(col(target, "id"), col(source, "sid")),
                Arrays.asList(new DeleteAction(eq(col(source, "sprice"), col(target, "price"))), UpdateAction.star(null)),
                Collections.<MergeAction>singletonList(InsertAction.star(null)));

            Lineage lineage = lineageOf(merge);

            assertThat(sourcesAt(lineage, 0)).containsExactly("v2_catalog.db.source_t.sid");
            assertThat(sourcesAt(lineage, 1)).containsExactly("v2_catalog.db.source_t.sname");
            assertThat(sourcesAt(lineage, 2)).containsExactly("v2_catalog.db.source_t.sprice");
        }

        @Test
        @DisplayName("A joined source lists every source table, never the target")
        void testMergeJoinedSource() {
            TableScan source = scan("v2_catalog.db.source_t", "id", "name", "price");
            TableScan pivot = scan("v2_catalog.db.pivot_t", "id", "price");
            Join joined = join(source, pivot, Join.JoinType.INNER, eq(col(source, "id"), col(pivot, "id")));
            MergeAction update = new UpdateAction(null, Collections.singletonList(
                new Assignment(col(target, "price"), fn("coalesce", col(pivot, "price"), col(source, "price")))));
            MergeIntoTable merge = new MergeIntoTable(target, joined, eq(col(target, "id"), col(source, "id")),
                Collections.singletonList(update), Collections.<MergeAction>emptyList());

            Lineage lineage = lineageOf(merge);

            assertThat(tableNames(lineage.sources()))
                .containsExactly("v2_catalog.db.source_t", "v2_catalog.db.pivot_t");
            assertThat(sourcesAt(lineage, 0)).isEmpty();
            assertThat(sourcesAt(lineage, 1)).isEmpty();
            assertThat(sourcesAt(lineage, 2))
                .containsExactly("v2_catalog.db.pivot_t.price", "v2_catalog.db.source_t.price");
        }

        @Test
        @DisplayName("A value read from the target itself derives from nothing")
        void testMergeSelfReference() {
            // UPDATE SET price = target.price + source.price
            TableScan source = scan("v2_catalog.db.source_t", "id", "price");
            MergeAction update = new UpdateAction(null, Collections.singletonList(new Assignment(col(target, "price"),
                BinaryExpression.add(col(target, "price"), col(source, "price")))));
            MergeIntoTable merge = new MergeIntoTable(target, source, eq(col(target, "id"), col(source, "id")),
                Collections.singletonList(update), Collections.<MergeAction>emptyList());

            Lineage lineage = lineageOf(merge);

            assertThat(sourcesAt(lineage, 2)).containsExactly("v2_catalog.db.source_t.price");
        }

        @Test
        @DisplayName("A star clause over a source of another width fails")
        void testMergeStarArityMismatch() {
            TableScan source = scan("v2_catalog.db.source_t", "id", "name");
            MergeIntoTable merge = new MergeIntoTable(target, source, eq(col(target, "id"), col(source, "id")),
                Collections.<MergeAction>emptyList(), Collections.<MergeAction>singletonList(InsertAction.star(null)));

            LineageResult result = extractor().extractLineage(merge);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.error().get().getMessage()).contains("writes 3 columns from a source of 2 columns");
        }
    }

    @Test
    @DisplayName("A command without a binding rule fails")
    void testUnknownCommand() {
        LineageResult result = extractor().extractLineage(new TruncateTable(name("db.t")));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.error().get().getMessage()).contains("No lineage rule for command TruncateTable");
    }

    /** A command this library has no rule for. */
    private static final class TruncateTable extends Command {

        private final QualifiedName target;

        TruncateTable(QualifiedName target) {
            this.target = target;
        }

        @Override
        public QualifiedName target() {
            return target;
        }

        @Override
        public Optional<LogicalPlan> query() {
            return Optional.empty();
        }

        @Override
        public String toString() {
            return "TruncateTable(" + target + ")";
        }
    }
}
