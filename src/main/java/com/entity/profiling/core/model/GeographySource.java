package com.entity.profiling.core.model;

/**
 * Origin of an entity's geographic mapping.
 */
public enum GeographySource {
    AREA_WEIGHTED,
    FALLBACK,
    NONE
}
