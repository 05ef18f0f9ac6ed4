package com.entity.profiling.matching;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RecipientStatesTest {

    @Test
    void extractsTrailingStateQualifier() {
        assertEquals("AZ", RecipientStates.extractFromName("HOPI TRIBE, AZ"));
        assertEquals("NM", RecipientStates.extractFromName("Sample Pueblo ,NM  "));
    }

    @Test
    void ignoresCorporateSuffixesAndUnknownCodes() {
        assertNull(RecipientStates.extractFromName("Acme, Co"));
        assertNull(RecipientStates.extractFromName("Acme, ZZ"));
        assertNull(RecipientStates.extractFromName("Hopi Tribe"));
        assertNull(RecipientStates.extractFromName(null));
    }

    @Test
    void declaredStateWinsOverName() {
        assertEquals("NM", RecipientStates.resolve(" nm ", "HOPI TRIBE, AZ"));
    }

    @Test
    void invalidDeclaredStateFallsBackToName() {
        assertEquals("AZ", RecipientStates.resolve("XX", "HOPI TRIBE, AZ"));
        assertNull(RecipientStates.resolve(null, "Hopi Tribe"));
    }
}
