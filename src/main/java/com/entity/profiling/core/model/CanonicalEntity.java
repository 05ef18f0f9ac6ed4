package com.entity.profiling.core.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * One of the fixed set of real-world entities that external records are attributed to.
 * Created once when the index is built and immutable thereafter.
 *
 * @param id                stable, opaque identifier
 * @param displayName       canonical display name
 * @param aliases           known alternate spellings and historical names, in curation order
 * @param geographicUnitIds two-letter state codes the entity touches; the first is the primary state
 */
public record CanonicalEntity(
        String id,
        String displayName,
        List<String> aliases,
        List<String> geographicUnitIds
) {
    public CanonicalEntity {
        Objects.requireNonNull(id, "id is required");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        Objects.requireNonNull(displayName, "displayName is required");
        aliases = aliases != null ? List.copyOf(aliases) : List.of();
        geographicUnitIds = geographicUnitIds != null
                ? geographicUnitIds.stream().map(s -> s.trim().toUpperCase(Locale.ROOT)).toList()
                : List.of();
    }

    /**
     * Returns the primary administrative state, if any geographic unit is known.
     */
    public Optional<String> primaryState() {
        return geographicUnitIds.isEmpty() ? Optional.empty() : Optional.of(geographicUnitIds.get(0));
    }

    /**
     * Returns true if the entity is known to touch the given state code.
     */
    public boolean touchesState(String stateCode) {
        return stateCode != null && geographicUnitIds.contains(stateCode.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Returns a copy of this entity with additional aliases appended (duplicates skipped).
     */
    public CanonicalEntity withAdditionalAliases(List<String> extra) {
        if (extra == null || extra.isEmpty()) {
            return this;
        }
        LinkedHashSet<String> merged = new LinkedHashSet<>(aliases);
        merged.addAll(extra);
        return new CanonicalEntity(id, displayName, List.copyOf(merged), geographicUnitIds);
    }
}
