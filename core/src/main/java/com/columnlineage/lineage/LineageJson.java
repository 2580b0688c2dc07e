package com.columnlineage.lineage;

import com.columnlineage.catalog.QualifiedName;
import com.columnlineage.config.LineageConfig;
import com.columnlineage.lineage.Lineage.ColumnLineageEntry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * JSON form of a {@link Lineage}, as published by lineage listeners:
 * <pre>
 * {
 *   "inputTables": ["test_db0.test_table0"],
 *   "outputTables": ["default.t1"],
 *   "columnLineage": [
 *     {"column": "default.t1.a", "originalColumns": ["test_db0.test_table0.key"]}
 *   ]
 * }
 * </pre>
 *
 * <p>Original columns are written sorted so the output is stable.
 */
public final class LineageJson {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private LineageJson() {}

    /**
     * Renders a lineage as JSON.
     *
     * @param lineage the lineage
     * @return the JSON text
     */
    public static String toJson(Lineage lineage) {
        Objects.requireNonNull(lineage, "lineage must not be null");
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode inputs = root.putArray("inputTables");
        lineage.sources().forEach(table -> inputs.add(table.toString()));
        ArrayNode outputs = root.putArray("outputTables");
        lineage.targets().forEach(table -> outputs.add(table.toString()));
        ArrayNode columns = root.putArray("columnLineage");
        for (ColumnLineageEntry entry : lineage.columns()) {
            ObjectNode column = columns.addObject();
            column.put("column", entry.name());
            ArrayNode originals = column.putArray("originalColumns");
            entry.sourceNames().forEach(originals::add);
        }
        try {
            return objectMapper.writeValueAsString(root);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to render lineage as JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Reads a lineage from JSON.
     *
     * @param json the JSON text
     * @return the lineage
     * @throws IllegalArgumentException if the text is not a valid lineage document
     */
    public static Lineage fromJson(String json) {
        if (json == null || json.trim().isEmpty()) {
            throw new IllegalArgumentException("Lineage JSON cannot be null or empty");
        }
        try {
            JsonNode root = objectMapper.readTree(json);
            List<QualifiedName> sources = parseTables(requireArray(root, "inputTables"));
            List<QualifiedName> targets = parseTables(requireArray(root, "outputTables"));
            List<ColumnLineageEntry> columns = new ArrayList<>();
            for (JsonNode column : requireArray(root, "columnLineage")) {
                JsonNode name = column.get("column");
                if (name == null || !name.isTextual()) {
                    throw new IllegalArgumentException("Column entry without a name: " + column);
                }
                Set<SourceColumnRef> originals = new LinkedHashSet<>();
                for (JsonNode original : requireArray(column, "originalColumns")) {
                    originals.add(parseColumn(original.asText()));
                }
                columns.add(new ColumnLineageEntry(name.asText(), originals));
            }
            return new Lineage(sources, targets, columns);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to parse lineage JSON: " + e.getMessage(), e);
        }
    }

    private static JsonNode requireArray(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isArray()) {
            throw new IllegalArgumentException("Missing array field '" + field + "'");
        }
        return value;
    }

    private static List<QualifiedName> parseTables(JsonNode tables) {
        List<QualifiedName> names = new ArrayList<>();
        for (JsonNode table : tables) {
            names.add(parseTable(table.asText()));
        }
        return names;
    }

    // Rendered names never carry the default catalog, so a leading part is always a real catalog
    private static QualifiedName parseTable(String name) {
        return QualifiedName.parse(name, null, LineageConfig.DEFAULT_DATABASE_NAME);
    }

    private static SourceColumnRef parseColumn(String text) {
        int split = text.lastIndexOf('.');
        if (split <= 0 || split == text.length() - 1) {
            throw new IllegalArgumentException("Invalid column reference: " + text);
        }
        return new SourceColumnRef(parseTable(text.substring(0, split)), text.substring(split + 1));
    }
}
