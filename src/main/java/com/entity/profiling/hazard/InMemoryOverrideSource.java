package com.entity.profiling.hazard;

import com.entity.profiling.core.model.HazardOverride;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Override source backed by a fixed list of overrides. A repeated (entity, hazard) pair
 * keeps its first override.
 */
public class InMemoryOverrideSource implements OverrideSource {
    private static final Logger log = LoggerFactory.getLogger(InMemoryOverrideSource.class);

    private final Map<Key, HazardOverride> overrides = new HashMap<>();

    public InMemoryOverrideSource(Collection<HazardOverride> overrides) {
        for (HazardOverride override : overrides) {
            Key key = new Key(override.entityId(), override.hazardType());
            if (this.overrides.putIfAbsent(key, override) != null) {
                log.warn("override.duplicate entityId={} hazard={} keeping=first",
                        override.entityId(), override.hazardType());
            }
        }
    }

    @Override
    public Optional<HazardOverride> overrideFor(String entityId, String hazardCode) {
        return Optional.ofNullable(overrides.get(new Key(entityId, hazardCode)));
    }

    public int size() {
        return overrides.size();
    }

    private record Key(String entityId, String hazardCode) {}
}
