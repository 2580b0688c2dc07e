package com.columnlineage.lineage;

import com.columnlineage.catalog.QualifiedName;
import com.columnlineage.command.AlterViewAs;
import com.columnlineage.command.Assignment;
import com.columnlineage.command.Command;
import com.columnlineage.command.CreateTable;
import com.columnlineage.command.CreateTableAsSelect;
import com.columnlineage.command.CreateView;
import com.columnlineage.command.InsertIntoDirectory;
import com.columnlineage.command.InsertIntoTable;
import com.columnlineage.command.MergeAction;
import com.columnlineage.command.MergeIntoTable;
import com.columnlineage.exception.LineageException;
import com.columnlineage.expression.AttributeReference;
import com.columnlineage.lineage.Lineage.ColumnLineageEntry;
import com.columnlineage.logical.LogicalPlan;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds the lineage of a command's query onto the command's destination.
 *
 * <p>Destination columns are named {@code target.column} and listed in the
 * destination's column order. The query's columns are matched to them by
 * position:
 * <ul>
 *   <li>CTAS, CREATE VIEW, ALTER VIEW AS and directory inserts write the
 *       query's columns under the query's names (or the view's column list)</li>
 *   <li>INSERT writes the table schema; static partition columns derive from
 *       nothing and the other columns take the query's columns in order</li>
 *   <li>MERGE unions, per target column, the values every clause assigns to
 *       it; the merge target itself is not a source</li>
 *   <li>CREATE TABLE without a query has no lineage</li>
 * </ul>
 */
public final class TargetBinder {

    private static final Logger logger = LoggerFactory.getLogger(TargetBinder.class);

    private final LineagePropagator propagator;

    public TargetBinder(LineagePropagator propagator) {
        this.propagator = Objects.requireNonNull(propagator, "propagator must not be null");
    }

    /**
     * Computes the lineage of a command.
     *
     * @param command the command at the root of the plan
     * @return its lineage
     * @throws LineageException if the command is not supported
     */
    public Lineage bind(Command command) {
        Objects.requireNonNull(command, "command must not be null");

        if (command instanceof CreateTable) {
            logger.debug("{} writes no rows, lineage is empty", command);
            return Lineage.empty();
        } else if (command instanceof CreateView) {
            CreateView view = (CreateView) command;
            List<String> names = view.userColumns().isEmpty() ? null : view.userColumns();
            return bindQuery(view, names);
        } else if (command instanceof CreateTableAsSelect
                   || command instanceof AlterViewAs
                   || command instanceof InsertIntoDirectory) {
            return bindQuery(command, null);
        } else if (command instanceof InsertIntoTable) {
            return bindInsert((InsertIntoTable) command);
        } else if (command instanceof MergeIntoTable) {
            return bindMerge((MergeIntoTable) command);
        } else {
            throw new LineageException("No lineage rule for command " + command.nodeName(), command);
        }
    }

    private Lineage bindQuery(Command command, List<String> names) {
        LogicalPlan query = command.query().orElseThrow(
            () -> new LineageException("Command has no query", command));
        PlanLineage lineage = propagator.propagate(query);
        QualifiedName target = command.target();

        List<ColumnLineageEntry> columns = new ArrayList<>();
        List<AttributeReference> output = lineage.output();
        for (int i = 0; i < output.size(); i++) {
            String name = names != null ? names.get(i) : output.get(i).name();
            columns.add(new ColumnLineageEntry(target.column(name), lineage.sourcesAt(i)));
        }
        return new Lineage(lineage.tables(), Collections.singletonList(target), columns);
    }

    private Lineage bindInsert(InsertIntoTable insert) {
        PlanLineage lineage = propagator.propagate(insert.query().get());
        QualifiedName target = insert.target();

        List<ColumnLineageEntry> columns = new ArrayList<>();
        int position = 0;
        for (String column : insert.destinationColumns()) {
            Set<SourceColumnRef> sources;
            if (insert.partitionSpec().isStatic(column)) {
                sources = Collections.emptySet();
            } else {
                sources = lineage.sourcesAt(position++);
            }
            columns.add(new ColumnLineageEntry(target.column(column), sources));
        }
        return new Lineage(lineage.tables(), Collections.singletonList(target), columns);
    }

    private Lineage bindMerge(MergeIntoTable merge) {
        PlanLineage source = propagator.propagate(merge.source());
        QualifiedName target = merge.target();
        List<AttributeReference> targetColumns = merge.targetTable().output();
        AttributeResolver resolver = new AttributeResolver(source.columns(), source.tables(), propagator);

        Map<AttributeReference, Set<SourceColumnRef>> assigned = new LinkedHashMap<>();
        for (AttributeReference column : targetColumns) {
            assigned.put(column, new LinkedHashSet<>());
        }
        for (MergeAction action : merge.actions()) {
            if (!action.writesColumns()) {
                continue;
            }
            if (action.isStar()) {
                if (source.output().size() != targetColumns.size()) {
                    throw new LineageException(String.format(
                        "%s writes %d columns from a source of %d columns",
                        action, targetColumns.size(), source.output().size()), merge);
                }
                for (int i = 0; i < targetColumns.size(); i++) {
                    assigned.get(targetColumns.get(i)).addAll(source.sourcesAt(i));
                }
            } else {
                for (Assignment assignment : action.assignments()) {
                    assigned.get(assignment.key()).addAll(resolver.sourcesOf(assignment.value()));
                }
            }
        }

        List<ColumnLineageEntry> columns = new ArrayList<>();
        for (Map.Entry<AttributeReference, Set<SourceColumnRef>> entry : assigned.entrySet()) {
            columns.add(new ColumnLineageEntry(target.column(entry.getKey().name()), entry.getValue()));
        }

        Set<QualifiedName> sources = new LinkedHashSet<>(resolver.subqueryTables());
        sources.addAll(source.tables());
        sources.remove(target);
        return new Lineage(new ArrayList<>(sources), Collections.singletonList(target), columns);
    }
}
