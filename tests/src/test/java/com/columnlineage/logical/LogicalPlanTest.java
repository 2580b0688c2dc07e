package com.columnlineage.logical;

import com.columnlineage.expression.AttributeReference;
import com.columnlineage.expression.Expression;
import com.columnlineage.expression.NamedExpression;
import com.columnlineage.expression.SortOrder;
import com.columnlineage.expression.WindowExpression;
import com.columnlineage.test.TestBase;
import com.columnlineage.test.TestCategories;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static com.columnlineage.test.PlanBuilder.agg;
import static com.columnlineage.test.PlanBuilder.as;
import static com.columnlineage.test.PlanBuilder.col;
import static com.columnlineage.test.PlanBuilder.cols;
import static com.columnlineage.test.PlanBuilder.eq;
import static com.columnlineage.test.PlanBuilder.fn;
import static com.columnlineage.test.PlanBuilder.lit;
import static com.columnlineage.test.PlanBuilder.project;
import static com.columnlineage.test.PlanBuilder.scan;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the output columns and structural checks of plan nodes.
 */
@DisplayName("Logical Plan Tests")
@Tag("logical")
@TestCategories.Unit
public class LogicalPlanTest extends TestBase {

    @Nested
    @DisplayName("Output columns")
    class OutputColumns {

        @Test
        @DisplayName("Aliasing a column keeps its id, aliasing a computation mints one")
        void testProjectIdentity() {
            TableScan t = scan("db.t", "a", "b");
            AttributeReference a = col(t, "a");

            Project p = project(t, as(a, "renamed"), as(fn("upper", a), "computed"));

            assertThat(p.output().get(0).id()).isEqualTo(a.id());
            assertThat(p.output().get(0).name()).isEqualTo("renamed");
            assertThat(p.output().get(1).id()).isNotEqualTo(a.id());
        }

        @Test
        @DisplayName("Identical computations never share an id")
        void testNoCommonSubexpressionMerging() {
            TableScan t = scan("db.t", "a");
            Project p = project(t, as(fn("hash", col(t, "a")), "h1"), as(fn("hash", col(t, "a")), "h2"));

            assertThat(p.output().get(0).id()).isNotEqualTo(p.output().get(1).id());
        }

        @Test
        @DisplayName("Semi and anti joins output the left side only")
        void testSemiJoinOutput() {
            TableScan left = scan("db.l", "a", "b");
            TableScan right = scan("db.r", "a", "c");
            Expression on = eq(col(left, "a"), col(right, "a"));

            assertThat(new Join(left, right, Join.JoinType.INNER, on).output()).hasSize(4);
            assertThat(new Join(left, right, Join.JoinType.LEFT_SEMI, on).output()).isEqualTo(left.output());
            assertThat(new Join(left, right, Join.JoinType.LEFT_ANTI, on).output()).isEqualTo(left.output());
        }

        @Test
        @DisplayName("Window appends its columns to the child's")
        void testWindowOutput() {
            TableScan t = scan("db.t", "a", "b");
            WindowExpression rank = new WindowExpression(
                fn("row_number"),
                Collections.singletonList(col(t, "a")),
                Collections.singletonList(SortOrder.asc(col(t, "b"))));

            Window w = new Window(t, Collections.<NamedExpression>singletonList(as(rank, "rank")));

            assertThat(w.output()).extracting(AttributeReference::name).containsExactly("a", "b", "rank");
        }

        @Test
        @DisplayName("Set operations take the first child's names with fresh ids")
        void testSetOperationOutput() {
            TableScan t1 = scan("db.t1", "a", "b");
            TableScan t2 = scan("db.t2", "c", "d");
            Union union = new Union(t1, t2);

            assertThat(union.output()).extracting(AttributeReference::name).containsExactly("a", "b");
            assertThat(union.output()).doesNotContainAnyElementsOf(t1.output());
            assertThat(union.output()).isSameAs(union.output());
            assertThat(new Except(t1, t2, false).output()).extracting(AttributeReference::name)
                .containsExactly("a", "b");
        }

        @Test
        @DisplayName("Passthrough nodes keep the child's columns")
        void testPassthroughOutput() {
            TableScan t = scan("db.t", "a");

            assertThat(new Limit(t, 10).output()).isEqualTo(t.output());
            assertThat(new Distinct(t).output()).isEqualTo(t.output());
            assertThat(new AliasedRelation(t, "x").output()).isEqualTo(t.output());
            assertThat(new Sort(t, Collections.singletonList(SortOrder.desc(col(t, "a")))).output())
                .isEqualTo(t.output());
            assertThat(new SingleRowRelation().output()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Structural checks")
    class StructuralChecks {

        @Test
        @DisplayName("Union rejects children of different arity")
        void testUnionArity() {
            TableScan t1 = scan("db.t1", "a", "b");
            TableScan t2 = scan("db.t2", "a");

            assertThatThrownBy(() -> new Union(t1, t2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Union requires same number of columns");
        }

        @Test
        @DisplayName("CROSS join takes no condition")
        void testCrossJoinCondition() {
            TableScan t1 = scan("db.t1", "a");
            TableScan t2 = scan("db.t2", "a");

            assertThatThrownBy(() -> new Join(t1, t2, Join.JoinType.CROSS, eq(col(t1, "a"), col(t2, "a"))))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Expand projections must match the output arity")
        void testExpandArity() {
            TableScan t = scan("db.t", "a");
            List<List<Expression>> projections = Collections.singletonList(Arrays.asList(col(t, "a"), lit(1)));

            assertThatThrownBy(() -> new Expand(t, projections, t.output()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Expand projection has 2 expressions");
        }

        @Test
        @DisplayName("Local relation rows must match the columns")
        void testLocalRelationRows() {
            List<AttributeReference> output = cols("a", "b");

            assertThatThrownBy(() -> new LocalRelation(output,
                    Collections.singletonList(Collections.<Expression>singletonList(lit(1)))))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Null arguments are rejected")
        void testNulls() {
            assertThatThrownBy(() -> new Filter(null, lit(true)))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("child must not be null");
            assertThatThrownBy(() -> new Aggregate(scan("db.t", "a"), null, Collections.singletonList(as(agg("max", lit(1)), "m"))))
                .isInstanceOf(NullPointerException.class);
        }
    }
}
