package com.entity.profiling.index;

import com.entity.profiling.core.model.CanonicalEntity;
import com.entity.profiling.rules.DefaultNormalizationRules;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CanonicalEntityIndexTest {

    private static CanonicalEntityIndex index(CanonicalEntity... entities) {
        return new CanonicalEntityIndex(List.of(entities), DefaultNormalizationRules.createDefaultEngine());
    }

    @Test
    @DisplayName("Display name and aliases resolve through the alias table")
    void exactLookup() {
        CanonicalEntityIndex index = index(
                new CanonicalEntity("E1", "Test Nation of ABC", List.of("ABC Nation"), List.of("AZ")));

        assertEquals(Optional.of("E1"), index.lookupAlias("test nation of abc"));
        assertEquals(Optional.of("E1"), index.lookupAlias("abc nation"));
        assertEquals(Optional.empty(), index.lookupAlias("unknown"));
        assertEquals(List.of("test nation of abc", "abc nation"), index.normalizedNames("E1"));
    }

    @Test
    @DisplayName("A name claimed by two entities is removed from the exact tier")
    void collisionsAreDropped() {
        CanonicalEntityIndex index = index(
                new CanonicalEntity("E1", "Alpha Tribe", List.of("Shared Name"), List.of()),
                new CanonicalEntity("E2", "Beta Tribe", List.of("SHARED NAME, Inc."), List.of()));

        assertTrue(index.lookupAlias("shared name").isEmpty());
        assertEquals(Set.of("shared name"), index.aliasCollisions());
        assertTrue(index.normalizedNames("E1").contains("shared name"));
        assertTrue(index.normalizedNames("E2").contains("shared name"));
        assertEquals(Optional.of("E2"), index.lookupAlias("beta tribe"));
    }

    @Test
    @DisplayName("A name repeated on the same entity is not a collision")
    void repeatedOwnAliasIsNotACollision() {
        CanonicalEntityIndex index = index(
                new CanonicalEntity("E1", "Alpha Tribe", List.of("ALPHA TRIBE", "Alpha Tribe, Inc."), List.of()));

        assertEquals(Optional.of("E1"), index.lookupAlias("alpha tribe"));
        assertTrue(index.aliasCollisions().isEmpty());
        assertEquals(List.of("alpha tribe"), index.normalizedNames("E1"));
    }

    @Test
    void entitiesAreOrderedById() {
        CanonicalEntityIndex index = index(
                new CanonicalEntity("E2", "Beta", List.of(), List.of()),
                new CanonicalEntity("E1", "Alpha", List.of(), List.of()));

        assertEquals(List.of("E1", "E2"), index.entities().stream().map(CanonicalEntity::id).toList());
        assertEquals(2, index.size());
        assertTrue(index.contains("E2"));
        assertTrue(index.get("E3").isEmpty());
    }

    @Test
    void duplicateIdsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> index(
                new CanonicalEntity("E1", "Alpha", List.of(), List.of()),
                new CanonicalEntity("E1", "Beta", List.of(), List.of())));
    }
}
