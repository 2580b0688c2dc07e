package com.columnlineage.catalog;

import com.columnlineage.config.LineageConfig;
import com.columnlineage.logical.LogicalPlan;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link Catalog} backed by a map of view definitions.
 *
 * <p>Any name without a registered definition is a base table. Hosts without a
 * catalog service of their own register their views here:
 * <pre>
 *   InMemoryCatalog catalog = new InMemoryCatalog(LineageConfig.defaults());
 *   catalog.registerView("t2", definingPlan);   // default.t2
 * </pre>
 */
public class InMemoryCatalog implements Catalog {

    private final LineageConfig config;
    private final Map<QualifiedName, LogicalPlan> views = new ConcurrentHashMap<>();

    public InMemoryCatalog(LineageConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public InMemoryCatalog() {
        this(LineageConfig.defaults());
    }

    /**
     * Registers (or replaces) a view definition.
     *
     * @param identifier the view identifier
     * @param definingPlan the resolved plan of the view's query
     * @return the canonical name the view was registered under
     */
    public QualifiedName registerView(String identifier, LogicalPlan definingPlan) {
        QualifiedName name = canonicalName(identifier);
        views.put(name, Objects.requireNonNull(definingPlan, "definingPlan must not be null"));
        return name;
    }

    /**
     * Removes a view definition.
     *
     * @param identifier the view identifier
     * @return true if a view was removed
     */
    public boolean dropView(String identifier) {
        return views.remove(canonicalName(identifier)) != null;
    }

    @Override
    public Optional<LogicalPlan> resolveDefiningPlan(QualifiedName name) {
        Objects.requireNonNull(name, "name must not be null");
        return Optional.ofNullable(views.get(name));
    }

    @Override
    public QualifiedName canonicalName(String identifier) {
        return QualifiedName.parse(identifier, config.defaultCatalog(), config.defaultDatabase());
    }
}
