package com.entity.profiling.geo;

/**
 * Albers equal-area conic parameter sets, one per region with its own native distortion.
 * Entities and counties are only intersected within the same region.
 */
public enum ProjectionRegion {
    /**
     * Conterminous United States, NAD83 / Conus Albers.
     */
    CONUS("EPSG:5070", 29.5, 45.5, 23.0, -96.0),

    /**
     * Alaska, NAD83 / Alaska Albers.
     */
    ALASKA("EPSG:3338", 55.0, 65.0, 50.0, -154.0),

    /**
     * Hawaii, Hawaii Albers Equal Area Conic.
     */
    HAWAII("ESRI:102007", 8.0, 18.0, 3.0, -157.0);

    private static final String ALASKA_FIPS = "02";
    private static final String HAWAII_FIPS = "15";

    private final String crsCode;
    private final double standardParallel1;
    private final double standardParallel2;
    private final double latitudeOfOrigin;
    private final double centralMeridian;

    ProjectionRegion(String crsCode, double standardParallel1, double standardParallel2,
                     double latitudeOfOrigin, double centralMeridian) {
        this.crsCode = crsCode;
        this.standardParallel1 = standardParallel1;
        this.standardParallel2 = standardParallel2;
        this.latitudeOfOrigin = latitudeOfOrigin;
        this.centralMeridian = centralMeridian;
    }

    public String crsCode() {
        return crsCode;
    }

    public double standardParallel1() {
        return standardParallel1;
    }

    public double standardParallel2() {
        return standardParallel2;
    }

    public double latitudeOfOrigin() {
        return latitudeOfOrigin;
    }

    public double centralMeridian() {
        return centralMeridian;
    }

    /**
     * Chooses the region from a two-digit state FIPS code; anything not Alaska or Hawaii is CONUS.
     */
    public static ProjectionRegion forStateFips(String stateFips) {
        if (ALASKA_FIPS.equals(stateFips)) {
            return ALASKA;
        }
        if (HAWAII_FIPS.equals(stateFips)) {
            return HAWAII;
        }
        return CONUS;
    }
}
