package com.columnlineage.lineage;

import com.columnlineage.catalog.CacheRegistry;
import com.columnlineage.catalog.Catalog;
import com.columnlineage.catalog.QualifiedName;
import com.columnlineage.config.LineageConfig;
import com.columnlineage.exception.LineageException;
import com.columnlineage.exception.UnsupportedOperatorException;
import com.columnlineage.expression.AttributeReference;
import com.columnlineage.expression.Expression;
import com.columnlineage.expression.ExpressionUtils;
import com.columnlineage.expression.NamedExpression;
import com.columnlineage.expression.SortOrder;
import com.columnlineage.logical.Aggregate;
import com.columnlineage.logical.AliasedRelation;
import com.columnlineage.logical.Distinct;
import com.columnlineage.logical.Expand;
import com.columnlineage.logical.Filter;
import com.columnlineage.logical.InMemoryRelation;
import com.columnlineage.logical.Join;
import com.columnlineage.logical.Limit;
import com.columnlineage.logical.LocalRelation;
import com.columnlineage.logical.LogicalPlan;
import com.columnlineage.logical.Project;
import com.columnlineage.logical.SetOperation;
import com.columnlineage.logical.SingleRowRelation;
import com.columnlineage.logical.Sort;
import com.columnlineage.logical.TableScan;
import com.columnlineage.logical.Window;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the column lineage of a query plan, bottom-up.
 *
 * <p>Each node's lineage is computed from its children's: which base columns
 * every output column derives from, and which tables were read. Views and
 * cached relations are inlined through the {@link Catalog} and
 * {@link CacheRegistry}, so their lineage reaches down to base tables.
 *
 * <p>Operators without a dedicated rule fall back to a positional passthrough
 * of their first child. Each fallback is recorded in {@link #warnings()}.
 *
 * <p>A propagator is used for one extraction and is not thread-safe.
 */
public final class LineagePropagator {

    private static final Logger logger = LoggerFactory.getLogger(LineagePropagator.class);

    private final Catalog catalog;
    private final CacheRegistry cacheRegistry;
    private final LineageConfig config;
    private final ExpansionStack expansionStack = new ExpansionStack();
    private final List<UnsupportedOperatorException> warnings = new ArrayList<>();

    public LineagePropagator(Catalog catalog, CacheRegistry cacheRegistry, LineageConfig config) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.cacheRegistry = Objects.requireNonNull(cacheRegistry, "cacheRegistry must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Computes the lineage of a plan node.
     *
     * @param plan the node
     * @return its lineage
     * @throws LineageException if a view or cache definition is cyclic or malformed
     */
    public PlanLineage propagate(LogicalPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");

        PlanLineage lineage;
        if (plan instanceof TableScan) {
            lineage = visitTableScan((TableScan) plan);
        } else if (plan instanceof InMemoryRelation) {
            lineage = visitInMemoryRelation((InMemoryRelation) plan);
        } else if (plan instanceof LocalRelation || plan instanceof SingleRowRelation) {
            lineage = constant(plan.output(), Collections.emptyList());
        } else if (plan instanceof Project) {
            lineage = visitProject((Project) plan);
        } else if (plan instanceof Filter) {
            lineage = visitFilter((Filter) plan);
        } else if (plan instanceof Aggregate) {
            lineage = visitAggregate((Aggregate) plan);
        } else if (plan instanceof Expand) {
            lineage = visitExpand((Expand) plan);
        } else if (plan instanceof Join) {
            lineage = visitJoin((Join) plan);
        } else if (plan instanceof SetOperation) {
            lineage = visitSetOperation((SetOperation) plan);
        } else if (plan instanceof Window) {
            lineage = visitWindow((Window) plan);
        } else if (plan instanceof Sort) {
            lineage = visitSort((Sort) plan);
        } else if (plan instanceof Limit || plan instanceof Distinct || plan instanceof AliasedRelation) {
            lineage = propagate(plan.children().get(0));
        } else {
            lineage = visitUnsupported(plan);
        }

        logger.debug("{} -> {}", plan.nodeName(), lineage);
        return lineage;
    }

    /**
     * Returns the fallbacks applied so far.
     *
     * @return the warnings, in the order they occurred
     */
    public List<UnsupportedOperatorException> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    private PlanLineage visitTableScan(TableScan scan) {
        QualifiedName table = scan.table();
        if (!config.skipPermanentViews()) {
            Optional<LogicalPlan> definition = catalog.resolveDefiningPlan(table);
            if (definition.isPresent()) {
                logger.debug("Inlining view {}", table);
                return inline(scan, definition.get(), table, "view " + table);
            }
        }

        ColumnLineage.Builder columns = ColumnLineage.builder();
        for (AttributeReference attribute : scan.output()) {
            columns.put(attribute.id(), Collections.singleton(new SourceColumnRef(table, attribute.name())));
        }
        return new PlanLineage(scan.output(), columns.build(), Collections.singletonList(table));
    }

    private PlanLineage visitInMemoryRelation(InMemoryRelation relation) {
        Optional<LogicalPlan> definition = cacheRegistry.lookup(relation.key());
        if (!definition.isPresent()) {
            logger.debug("No cached plan registered for {}, columns are unattributed", relation.key());
            return constant(relation.output(), Collections.emptyList());
        }
        logger.debug("Inlining cached relation {}", relation.key());
        return inline(relation, definition.get(), relation.key(), relation.key().toString());
    }

    /**
     * Replaces a leaf with the lineage of the plan that defines it, renaming
     * the defining plan's output columns to the leaf's.
     */
    private PlanLineage inline(LogicalPlan leaf, LogicalPlan definition, Object key, String label) {
        PlanLineage defined;
        expansionStack.push(key, label, leaf);
        try {
            defined = propagate(definition);
        } finally {
            expansionStack.pop();
        }

        List<AttributeReference> leafOutput = leaf.output();
        List<AttributeReference> definedOutput = defined.output();
        ColumnLineage.Builder columns = ColumnLineage.builder();
        if (leafOutput.size() == definedOutput.size()) {
            for (int i = 0; i < leafOutput.size(); i++) {
                columns.put(leafOutput.get(i).id(), defined.sourcesAt(i));
            }
        } else {
            // the leaf reads a subset of the definition's columns
            for (AttributeReference attribute : leafOutput) {
                int position = indexOfName(definedOutput, attribute.name());
                if (position < 0) {
                    throw new LineageException(String.format(
                        "%s has no column %s to inline", label, attribute.name()), leaf);
                }
                columns.put(attribute.id(), defined.sourcesAt(position));
            }
        }
        return new PlanLineage(leafOutput, columns.build(), defined.tables());
    }

    private PlanLineage visitProject(Project project) {
        PlanLineage child = propagate(project.child());
        AttributeResolver resolver = new AttributeResolver(child.columns(), child.tables(), this);
        ColumnLineage columns = resolveNamed(resolver, project.projections(), ColumnLineage.builder());
        return new PlanLineage(project.output(), columns, concat(resolver.subqueryTables(), child.tables()));
    }

    private PlanLineage visitFilter(Filter filter) {
        PlanLineage child = propagate(filter.child());
        new AttributeResolver(child.columns(), child.tables(), this).checkPredicate(filter.condition());
        return child;
    }

    private PlanLineage visitAggregate(Aggregate aggregate) {
        PlanLineage child = propagate(aggregate.child());
        AttributeResolver resolver = new AttributeResolver(child.columns(), child.tables(), this);
        for (Expression grouping : aggregate.groupingExpressions()) {
            resolver.checkPredicate(grouping);
        }
        ColumnLineage columns = resolveNamed(resolver, aggregate.aggregateExpressions(), ColumnLineage.builder());
        return new PlanLineage(aggregate.output(), columns, concat(resolver.subqueryTables(), child.tables()));
    }

    /**
     * An output position of an expand is attributable only if every branch
     * reads some column there; a branch that fills in a constant means the
     * value cannot be traced to one source.
     */
    private PlanLineage visitExpand(Expand expand) {
        PlanLineage child = propagate(expand.child());
        AttributeResolver resolver = new AttributeResolver(child.columns(), child.tables(), this);
        List<AttributeReference> output = expand.output();
        ColumnLineage.Builder columns = ColumnLineage.builder();
        for (int i = 0; i < output.size(); i++) {
            Set<SourceColumnRef> sources = new LinkedHashSet<>();
            boolean attributable = true;
            for (List<Expression> projection : expand.projections()) {
                Expression expression = projection.get(i);
                if (!ExpressionUtils.readsAnyColumn(expression)) {
                    attributable = false;
                    break;
                }
                sources.addAll(resolver.sourcesOf(expression));
            }
            columns.put(output.get(i).id(), attributable ? sources : Collections.emptySet());
        }
        return new PlanLineage(output, columns.build(), concat(resolver.subqueryTables(), child.tables()));
    }

    private PlanLineage visitJoin(Join join) {
        PlanLineage left = propagate(join.left());
        PlanLineage right = propagate(join.right());

        ColumnLineage.Builder scope = ColumnLineage.builder()
            .putAll(left.columns())
            .putAll(right.columns());
        if (join.condition() != null) {
            List<QualifiedName> tables = concat(left.tables(), right.tables());
            new AttributeResolver(scope.build(), tables, this).checkPredicate(join.condition());
        }

        if (join.joinType().keepsOnlyLeft()) {
            // the right side only filters, as a rewritten IN or EXISTS predicate
            return new PlanLineage(join.output(), left.columns(), left.tables());
        }
        return new PlanLineage(join.output(), scope.build(), concat(left.tables(), right.tables()));
    }

    private PlanLineage visitSetOperation(SetOperation setOperation) {
        List<PlanLineage> children = new ArrayList<>();
        List<QualifiedName> tables = new ArrayList<>();
        for (LogicalPlan child : setOperation.children()) {
            PlanLineage lineage = propagate(child);
            children.add(lineage);
            tables.addAll(lineage.tables());
        }

        ColumnLineage.Builder columns = ColumnLineage.builder();
        List<Set<SourceColumnRef>> positions = new ArrayList<>();
        int arity = setOperation.output().size();
        for (int i = 0; i < arity; i++) {
            Set<SourceColumnRef> sources = new LinkedHashSet<>();
            for (PlanLineage child : children) {
                sources.addAll(child.sourcesAt(i));
            }
            positions.add(sources);
            columns.put(AttributeResolver.identityOf(setOperation, i), sources);
        }
        return new PlanLineage(setOperation.output(), positions, columns.build(), tables);
    }

    private PlanLineage visitWindow(Window window) {
        PlanLineage child = propagate(window.child());
        AttributeResolver resolver = new AttributeResolver(child.columns(), child.tables(), this);
        ColumnLineage columns = resolveNamed(
            resolver, window.windowExpressions(), ColumnLineage.builder().putAll(child.columns()));
        return new PlanLineage(window.output(), columns, concat(resolver.subqueryTables(), child.tables()));
    }

    private PlanLineage visitSort(Sort sort) {
        PlanLineage child = propagate(sort.child());
        AttributeResolver resolver = new AttributeResolver(child.columns(), child.tables(), this);
        for (SortOrder order : sort.sortOrders()) {
            resolver.checkPredicate(order);
        }
        return child;
    }

    private PlanLineage visitUnsupported(LogicalPlan plan) {
        UnsupportedOperatorException warning = new UnsupportedOperatorException(plan);
        warnings.add(warning);
        logger.warn("{}", warning.getMessage());

        List<PlanLineage> children = new ArrayList<>();
        List<QualifiedName> tables = new ArrayList<>();
        for (LogicalPlan child : plan.children()) {
            PlanLineage lineage = propagate(child);
            children.add(lineage);
            tables.addAll(lineage.tables());
        }

        List<AttributeReference> output = plan.output();
        if (children.isEmpty() || children.get(0).output().size() != output.size()) {
            return constant(output, tables);
        }
        PlanLineage first = children.get(0);
        ColumnLineage.Builder columns = ColumnLineage.builder();
        List<Set<SourceColumnRef>> positions = new ArrayList<>();
        for (int i = 0; i < output.size(); i++) {
            positions.add(first.sourcesAt(i));
            columns.put(AttributeResolver.identityOf(plan, i), first.sourcesAt(i));
        }
        return new PlanLineage(output, positions, columns.build(), tables);
    }

    private static ColumnLineage resolveNamed(AttributeResolver resolver,
                                              List<NamedExpression> expressions,
                                              ColumnLineage.Builder columns) {
        for (NamedExpression expression : expressions) {
            columns.put(expression.id(), resolver.sourcesOf(expression));
        }
        return columns.build();
    }

    private static PlanLineage constant(List<AttributeReference> output, List<QualifiedName> tables) {
        ColumnLineage.Builder columns = ColumnLineage.builder();
        for (AttributeReference attribute : output) {
            columns.put(attribute.id(), Collections.emptySet());
        }
        return new PlanLineage(output, columns.build(), tables);
    }

    private static List<QualifiedName> concat(List<QualifiedName> first, List<QualifiedName> second) {
        Set<QualifiedName> tables = new LinkedHashSet<>(first);
        tables.addAll(second);
        return new ArrayList<>(tables);
    }

    private static int indexOfName(List<AttributeReference> attributes, String name) {
        String wanted = name.toLowerCase(Locale.ROOT);
        for (int i = 0; i < attributes.size(); i++) {
            if (attributes.get(i).name().toLowerCase(Locale.ROOT).equals(wanted)) {
                return i;
            }
        }
        return -1;
    }
}
