package com.entity.profiling.core.model;

/**
 * How a crosswalk entry was derived.
 */
public enum CrosswalkMethod {
    /**
     * Intersection area in an equal-area projection divided by total entity area.
     */
    AREA_WEIGHTED,

    /**
     * Synthetic single entry on the entity's primary state, used when no boundary geometry exists.
     */
    FALLBACK
}
