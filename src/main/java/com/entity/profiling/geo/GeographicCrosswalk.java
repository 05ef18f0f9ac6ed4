package com.entity.profiling.geo;

import com.entity.profiling.core.model.CrosswalkEntry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable entity-to-county lookup. Every entity present satisfies the weight invariant:
 * either a single fallback entry of weight 1.0, or area-weighted entries summing to 1.0
 * within the configured tolerance. Built once and read by every aggregation thread.
 */
public final class GeographicCrosswalk {

    private final Map<String, List<CrosswalkEntry>> byEntity;

    private GeographicCrosswalk(Map<String, List<CrosswalkEntry>> byEntity) {
        this.byEntity = byEntity;
    }

    public static GeographicCrosswalk of(Collection<CrosswalkEntry> entries) {
        return of(entries, CrosswalkOptions.DEFAULT_WEIGHT_TOLERANCE);
    }

    /**
     * @throws IllegalArgumentException if any entity violates the weight invariant
     */
    public static GeographicCrosswalk of(Collection<CrosswalkEntry> entries, double tolerance) {
        Map<String, List<CrosswalkEntry>> grouped = new TreeMap<>();
        for (CrosswalkEntry entry : entries) {
            grouped.computeIfAbsent(entry.entityId(), k -> new ArrayList<>()).add(entry);
        }
        Map<String, List<CrosswalkEntry>> frozen = new TreeMap<>();
        for (Map.Entry<String, List<CrosswalkEntry>> e : grouped.entrySet()) {
            validate(e.getKey(), e.getValue(), tolerance);
            frozen.put(e.getKey(), List.copyOf(e.getValue()));
        }
        return new GeographicCrosswalk(Collections.unmodifiableMap(frozen));
    }

    public static GeographicCrosswalk empty() {
        return new GeographicCrosswalk(Map.of());
    }

    private static void validate(String entityId, List<CrosswalkEntry> entries, double tolerance) {
        boolean anyFallback = entries.stream().anyMatch(CrosswalkEntry::isFallback);
        if (anyFallback) {
            if (entries.size() != 1 || entries.get(0).overlapWeight() != 1.0) {
                throw new IllegalArgumentException(
                        "Entity " + entityId + " must have exactly one fallback entry of weight 1.0");
            }
            return;
        }
        double sum = entries.stream().mapToDouble(CrosswalkEntry::overlapWeight).sum();
        if (Math.abs(sum - 1.0) >= tolerance) {
            throw new IllegalArgumentException(
                    "Weights of entity " + entityId + " sum to " + sum + ", expected 1.0");
        }
        long distinct = entries.stream().map(CrosswalkEntry::countyUnitId).distinct().count();
        if (distinct != entries.size()) {
            throw new IllegalArgumentException("Entity " + entityId + " lists a county more than once");
        }
    }

    /**
     * Returns the entity's entries, or an empty list when the entity has no geography at all.
     */
    public List<CrosswalkEntry> entriesFor(String entityId) {
        return byEntity.getOrDefault(entityId, List.of());
    }

    public boolean contains(String entityId) {
        return byEntity.containsKey(entityId);
    }

    public boolean isFallback(String entityId) {
        List<CrosswalkEntry> entries = entriesFor(entityId);
        return entries.size() == 1 && entries.get(0).isFallback();
    }

    public Set<String> entityIds() {
        return byEntity.keySet();
    }

    /**
     * All entries, grouped by entity id in ascending order.
     */
    public List<CrosswalkEntry> entries() {
        List<CrosswalkEntry> all = new ArrayList<>();
        byEntity.values().forEach(all::addAll);
        return all;
    }

    public int entityCount() {
        return byEntity.size();
    }

    public int linkCount() {
        return byEntity.values().stream().mapToInt(List::size).sum();
    }

    public long fallbackCount() {
        return byEntity.keySet().stream().filter(this::isFallback).count();
    }
}
