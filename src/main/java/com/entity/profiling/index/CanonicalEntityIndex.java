package com.entity.profiling.index;

import com.entity.profiling.core.model.CanonicalEntity;
import com.entity.profiling.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable in-memory table of canonical entities with their normalized names.
 * Built once per run and shared read-only by every matcher and aggregator thread.
 *
 * <p>The exact-match alias table maps a normalized name (display name or alias) to
 * exactly one entity. A normalized name claimed by two different entities is a
 * collision: it is dropped from the exact tier, since an exact hit must be unambiguous.
 * Colliding names still take part in fuzzy scoring.</p>
 */
public final class CanonicalEntityIndex {
    private static final Logger log = LoggerFactory.getLogger(CanonicalEntityIndex.class);

    private final NormalizationEngine normalizer;
    private final TreeMap<String, CanonicalEntity> entities;
    private final Map<String, List<String>> normalizedNames;
    private final Map<String, String> aliasTable;
    private final Set<String> collisions;

    public CanonicalEntityIndex(Collection<CanonicalEntity> entities, NormalizationEngine normalizer) {
        this.normalizer = normalizer;
        TreeMap<String, CanonicalEntity> byId = new TreeMap<>();
        for (CanonicalEntity entity : entities) {
            if (byId.putIfAbsent(entity.id(), entity) != null) {
                throw new IllegalArgumentException("Duplicate entity id: " + entity.id());
            }
        }
        this.entities = byId;

        Map<String, List<String>> names = new HashMap<>();
        Map<String, String> table = new HashMap<>();
        Set<String> collided = new TreeSet<>();
        for (CanonicalEntity entity : byId.values()) {
            LinkedHashSet<String> own = new LinkedHashSet<>();
            addNormalized(own, entity.displayName());
            for (String alias : entity.aliases()) {
                addNormalized(own, alias);
            }
            names.put(entity.id(), List.copyOf(own));

            for (String name : own) {
                if (collided.contains(name)) {
                    continue;
                }
                String existing = table.putIfAbsent(name, entity.id());
                if (existing != null && !existing.equals(entity.id())) {
                    table.remove(name);
                    collided.add(name);
                    log.warn("alias.collision alias='{}' entities=[{}, {}]", name, existing, entity.id());
                }
            }
        }
        this.normalizedNames = Collections.unmodifiableMap(names);
        this.aliasTable = Collections.unmodifiableMap(table);
        this.collisions = Collections.unmodifiableSet(collided);

        log.info("index.built entities={} aliases={} collisions={}",
                byId.size(), table.size(), collided.size());
    }

    private void addNormalized(Set<String> target, String raw) {
        String normalized = normalizer.normalize(raw);
        if (!normalized.isEmpty()) {
            target.add(normalized);
        }
    }

    public NormalizationEngine normalizer() {
        return normalizer;
    }

    public Optional<CanonicalEntity> get(String entityId) {
        return Optional.ofNullable(entities.get(entityId));
    }

    public boolean contains(String entityId) {
        return entities.containsKey(entityId);
    }

    /**
     * Returns all entities in ascending id order.
     */
    public List<CanonicalEntity> entities() {
        return new ArrayList<>(entities.values());
    }

    public int size() {
        return entities.size();
    }

    /**
     * Exact alias-tier lookup of an already normalized name.
     */
    public Optional<String> lookupAlias(String normalizedName) {
        return Optional.ofNullable(aliasTable.get(normalizedName));
    }

    /**
     * Returns the normalized display name and aliases of an entity, display name first.
     */
    public List<String> normalizedNames(String entityId) {
        return normalizedNames.getOrDefault(entityId, List.of());
    }

    /**
     * Normalized names removed from the exact tier because several entities claim them.
     */
    public Set<String> aliasCollisions() {
        return collisions;
    }
}
