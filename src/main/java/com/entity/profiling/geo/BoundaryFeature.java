package com.entity.profiling.geo;

import org.locationtech.jts.geom.Geometry;

import java.util.Objects;

/**
 * A boundary polygon in geographic coordinates (longitude, latitude degrees).
 *
 * @param unitId    entity id for entity boundaries, county FIPS for county boundaries
 * @param stateFips two-digit state FIPS used to pick the projection region, may be null
 * @param geometry  polygon or multipolygon
 */
public record BoundaryFeature(String unitId, String stateFips, Geometry geometry) {

    public BoundaryFeature {
        Objects.requireNonNull(unitId, "unitId is required");
        Objects.requireNonNull(geometry, "geometry is required");
    }
}
