package com.entity.profiling.rules;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in normalization rules for award recipient names.
 * Recipient names arrive in every casing and with corporate or legal boilerplate
 * ("HOPI TRIBE, AZ", "Navajo Nation Government", "Acme Housing Authority, Inc.");
 * these rules reduce them to the core name the alias table is keyed on.
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with all default rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        List<NormalizationRule> rules = new ArrayList<>();
        rules.addAll(getQualifierRules());
        rules.addAll(getCorporateRules());
        rules.addAll(getLegalRules());
        rules.addAll(getCommonRules());
        return new NormalizationEngine(rules);
    }

    /**
     * Trailing location qualifiers added by the publishing system.
     */
    public static List<NormalizationRule> getQualifierRules() {
        return List.of(
                // "HOPI TRIBE, AZ" -> "HOPI TRIBE"
                NormalizationRule.builder()
                        .name("qualifier-state")
                        .pattern(",\\s*[A-Z]{2}\\s*$")
                        .priority(5)
                        .build(),

                // "Hopi Tribe (Arizona)" -> "Hopi Tribe"
                NormalizationRule.builder()
                        .name("qualifier-parenthetical")
                        .pattern("\\s*\\([^)]*\\)\\s*$")
                        .priority(5)
                        .build()
        );
    }

    /**
     * Corporate suffixes.
     */
    public static List<NormalizationRule> getCorporateRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("corporate-inc")
                        .pattern(",?\\s*\\b(Inc\\.?|Incorporated)$")
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("corporate-llc")
                        .pattern(",?\\s*\\b(LLC|L\\.L\\.C\\.)$")
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("corporate-corp")
                        .pattern(",?\\s*\\b(Corp\\.?|Corporation)$")
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("corporate-co")
                        .pattern(",?\\s*\\b(Co\\.|Company)$")
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("corporate-ltd")
                        .pattern(",?\\s*\\b(Ltd\\.?|Limited)$")
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("corporate-plc")
                        .pattern(",?\\s*\\b(PLC|P\\.L\\.C\\.)$")
                        .priority(10)
                        .build()
        );
    }

    /**
     * Legal and governmental boilerplate.
     */
    public static List<NormalizationRule> getLegalRules() {
        return List.of(
                // "Navajo Nation Government", "Hopi Tribal Government"
                NormalizationRule.builder()
                        .name("legal-government")
                        .pattern(",?\\s+(Tribal\\s+)?Government$")
                        .priority(15)
                        .build(),

                NormalizationRule.builder()
                        .name("legal-the")
                        .pattern("^The\\s+")
                        .priority(20)
                        .build()
        );
    }

    /**
     * Common rules.
     */
    public static List<NormalizationRule> getCommonRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("common-ampersand")
                        .pattern("\\s*&\\s*")
                        .replacement(" and ")
                        .priority(50)
                        .build(),

                // Remove special characters (but keep spaces and alphanumeric)
                NormalizationRule.builder()
                        .name("common-special-chars")
                        .pattern("[^a-zA-Z0-9\\s]")
                        .replacement(" ")
                        .priority(100)
                        .build(),

                NormalizationRule.builder()
                        .name("common-collapse-spaces")
                        .pattern("\\s+")
                        .replacement(" ")
                        .priority(200)
                        .build()
        );
    }
}
