package com.entity.profiling.index;

import com.entity.profiling.core.InputSanitizer;
import com.entity.profiling.core.JsonSupport;
import com.entity.profiling.core.ReferenceDataException;
import com.entity.profiling.core.model.CanonicalEntity;
import com.entity.profiling.rules.NormalizationEngine;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the canonical entity registry and the curated alias table from JSON.
 *
 * <p>Entities:</p>
 * <pre>
 * {"entities": [{"id": "E1", "name": "Test Nation of ABC", "aliases": ["ABC Nation"], "states": ["AZ"]}]}
 * </pre>
 *
 * <p>Alias table:</p>
 * <pre>
 * [{"entity_id": "E1", "aliases": ["TEST NATION OF ABC"]}]
 * </pre>
 *
 * <p>Both are reference data: a missing or unreadable file aborts the run with
 * {@link ReferenceDataException}.</p>
 */
public class ReferenceDataLoader {
    private static final Logger log = LoggerFactory.getLogger(ReferenceDataLoader.class);

    private final ObjectMapper mapper;

    public ReferenceDataLoader() {
        this(JsonSupport.mapper());
    }

    public ReferenceDataLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Builds the index from an entity registry and an optional alias table.
     *
     * @param aliasTablePath alias table file, or null when only registry aliases are used
     */
    public CanonicalEntityIndex loadIndex(Path entitiesPath, Path aliasTablePath, NormalizationEngine normalizer) {
        List<CanonicalEntity> entities = loadEntities(entitiesPath);
        if (aliasTablePath != null) {
            entities = mergeAliases(entities, loadAliasTable(aliasTablePath));
        }
        try {
            return new CanonicalEntityIndex(entities, normalizer);
        } catch (IllegalArgumentException e) {
            throw new ReferenceDataException("Invalid entity registry " + entitiesPath + ": " + e.getMessage(), e);
        }
    }

    public List<CanonicalEntity> loadEntities(Path path) {
        JsonNode root = readTree(path, "entity registry");
        JsonNode array = root.isArray() ? root : root.path("entities");
        if (!array.isArray()) {
            throw new ReferenceDataException("Entity registry " + path + " has no 'entities' array");
        }

        List<CanonicalEntity> entities = new ArrayList<>();
        int position = 0;
        for (JsonNode node : array) {
            position++;
            String id = node.path("id").asText(null);
            String name = node.path("name").asText(null);
            if (id == null || name == null || name.isBlank()) {
                throw new ReferenceDataException(
                        "Entity registry " + path + " entry " + position + " lacks id or name");
            }
            try {
                InputSanitizer.validateEntityId(id);
                entities.add(new CanonicalEntity(id, name, strings(node.path("aliases")), strings(node.path("states"))));
            } catch (IllegalArgumentException e) {
                throw new ReferenceDataException(
                        "Entity registry " + path + " entry " + position + ": " + e.getMessage(), e);
            }
        }
        log.info("reference.entities.loaded path={} count={}", path, entities.size());
        return entities;
    }

    /**
     * Reads the alias table as entity id to aliases, in file order.
     */
    public Map<String, List<String>> loadAliasTable(Path path) {
        JsonNode root = readTree(path, "alias table");
        if (!root.isArray()) {
            throw new ReferenceDataException("Alias table " + path + " must be a JSON array");
        }
        Map<String, List<String>> table = new LinkedHashMap<>();
        for (JsonNode node : root) {
            String entityId = node.path("entity_id").asText(null);
            if (entityId == null) {
                throw new ReferenceDataException("Alias table " + path + " has an entry without entity_id");
            }
            table.computeIfAbsent(entityId, k -> new ArrayList<>()).addAll(strings(node.path("aliases")));
        }
        log.info("reference.aliases.loaded path={} entities={}", path, table.size());
        return table;
    }

    private List<CanonicalEntity> mergeAliases(List<CanonicalEntity> entities, Map<String, List<String>> aliasTable) {
        Map<String, List<String>> remaining = new LinkedHashMap<>(aliasTable);
        List<CanonicalEntity> merged = new ArrayList<>(entities.size());
        for (CanonicalEntity entity : entities) {
            merged.add(entity.withAdditionalAliases(remaining.remove(entity.id())));
        }
        for (String unknown : remaining.keySet()) {
            log.warn("reference.aliases.unknownEntity entityId={}", unknown);
        }
        return merged;
    }

    private JsonNode readTree(Path path, String what) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ReferenceDataException("Missing " + what + ": " + path);
        }
        try {
            JsonNode root = mapper.readTree(path.toFile());
            if (root == null || root.isMissingNode()) {
                throw new ReferenceDataException("Empty " + what + ": " + path);
            }
            return root;
        } catch (IOException e) {
            throw new ReferenceDataException("Unreadable " + what + " " + path + ": " + e.getMessage(), e);
        }
    }

    private static List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode item : node) {
                String text = item.asText("");
                if (!text.isBlank()) {
                    values.add(text.trim());
                }
            }
        }
        return values;
    }
}
