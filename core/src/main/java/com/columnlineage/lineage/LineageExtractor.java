package com.columnlineage.lineage;

import com.columnlineage.catalog.CacheRegistry;
import com.columnlineage.catalog.Catalog;
import com.columnlineage.catalog.QualifiedName;
import com.columnlineage.command.Command;
import com.columnlineage.config.LineageConfig;
import com.columnlineage.exception.LineageException;
import com.columnlineage.lineage.Lineage.ColumnLineageEntry;
import com.columnlineage.logical.LogicalPlan;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts the column lineage of a resolved statement plan.
 *
 * <p>Example usage:
 * <pre>
 *   LineageExtractor extractor = new LineageExtractor(catalog, cacheRegistry, LineageConfig.defaults());
 *   LineageResult result = extractor.extractLineage(plan);
 *   result.lineage().ifPresent(lineage -> publish(LineageJson.toJson(lineage)));
 * </pre>
 *
 * <p>A command at the root is bound onto its destination; any other plan is a
 * query whose columns keep their unqualified output names and which has no
 * targets. Extraction errors are returned in the result, never thrown.
 *
 * <p>The extractor keeps no state between calls and may be shared between
 * threads.
 */
public class LineageExtractor {

    private static final Logger logger = LoggerFactory.getLogger(LineageExtractor.class);

    private final Catalog catalog;
    private final CacheRegistry cacheRegistry;
    private final LineageConfig config;

    public LineageExtractor(Catalog catalog, CacheRegistry cacheRegistry, LineageConfig config) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.cacheRegistry = Objects.requireNonNull(cacheRegistry, "cacheRegistry must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public LineageExtractor(Catalog catalog, CacheRegistry cacheRegistry) {
        this(catalog, cacheRegistry, LineageConfig.defaults());
    }

    /**
     * Extracts the lineage of a plan.
     *
     * @param plan the resolved, optimized plan of one statement
     * @return the lineage, or the error that prevented it
     */
    public LineageResult extractLineage(LogicalPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");

        LineagePropagator propagator = new LineagePropagator(catalog, cacheRegistry, config);
        try {
            AttributeResolver.checkResolved(plan);

            Lineage lineage;
            if (plan instanceof Command) {
                lineage = new TargetBinder(propagator).bind((Command) plan);
            } else {
                lineage = selectLineage(propagator.propagate(plan));
            }
            logger.debug("Extracted {}", lineage);
            return LineageResult.success(lineage, propagator.warnings());

        } catch (LineageException e) {
            logger.debug("Lineage extraction failed: {}", e.getMessage());
            return LineageResult.failure(e);

        } catch (RuntimeException e) {
            // Malformed plans surface as unchecked exceptions from deep inside the traversal
            return LineageResult.failure(
                new LineageException("Unexpected error during lineage extraction: " + e.getMessage(), e, plan));
        }
    }

    private static Lineage selectLineage(PlanLineage lineage) {
        List<ColumnLineageEntry> columns = new ArrayList<>();
        for (int i = 0; i < lineage.output().size(); i++) {
            columns.add(new ColumnLineageEntry(lineage.output().get(i).name(), lineage.sourcesAt(i)));
        }
        return new Lineage(lineage.tables(), Collections.<QualifiedName>emptyList(), columns);
    }
}
