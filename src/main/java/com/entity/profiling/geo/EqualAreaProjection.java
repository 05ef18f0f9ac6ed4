package com.entity.profiling.geo;

import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.CoordinateSequenceFilter;
import org.locationtech.jts.geom.Geometry;

/**
 * Albers equal-area conic projection on the GRS80 ellipsoid (Snyder, "Map Projections:
 * A Working Manual", eq. 14-1 to 14-6). Input coordinates are (longitude, latitude)
 * in degrees; output is metres, so {@link Geometry#getArea()} of a projected geometry
 * is in square metres.
 */
public final class EqualAreaProjection {

    static final double SEMI_MAJOR_AXIS = 6_378_137.0;
    static final double ECCENTRICITY_SQUARED = 0.00669438002290;

    private static final double E = Math.sqrt(ECCENTRICITY_SQUARED);

    private final ProjectionRegion region;
    private final double lambda0;
    private final double n;
    private final double c;
    private final double rho0;

    public EqualAreaProjection(ProjectionRegion region) {
        this.region = region;
        double phi1 = Math.toRadians(region.standardParallel1());
        double phi2 = Math.toRadians(region.standardParallel2());
        double phi0 = Math.toRadians(region.latitudeOfOrigin());
        this.lambda0 = Math.toRadians(region.centralMeridian());

        double m1 = m(phi1);
        double m2 = m(phi2);
        double q1 = q(phi1);
        double q2 = q(phi2);
        this.n = (m1 * m1 - m2 * m2) / (q2 - q1);
        this.c = m1 * m1 + n * q1;
        this.rho0 = rho(q(phi0));
    }

    public ProjectionRegion region() {
        return region;
    }

    /**
     * Projects a single point, returning {x, y} in metres.
     */
    public double[] project(double longitude, double latitude) {
        double phi = Math.toRadians(latitude);
        double lambda = Math.toRadians(longitude);
        double rho = rho(q(phi));
        double theta = n * (lambda - lambda0);
        return new double[]{rho * Math.sin(theta), rho0 - rho * Math.cos(theta)};
    }

    /**
     * Returns a projected copy of the geometry; the input is left untouched.
     */
    public Geometry project(Geometry geographic) {
        Geometry copy = geographic.copy();
        copy.apply(new CoordinateSequenceFilter() {
            @Override
            public void filter(CoordinateSequence seq, int i) {
                double[] xy = project(seq.getX(i), seq.getY(i));
                seq.setOrdinate(i, CoordinateSequence.X, xy[0]);
                seq.setOrdinate(i, CoordinateSequence.Y, xy[1]);
            }

            @Override
            public boolean isDone() {
                return false;
            }

            @Override
            public boolean isGeometryChanged() {
                return true;
            }
        });
        copy.geometryChanged();
        return copy;
    }

    private double rho(double q) {
        return SEMI_MAJOR_AXIS * Math.sqrt(c - n * q) / n;
    }

    private static double m(double phi) {
        double sin = Math.sin(phi);
        return Math.cos(phi) / Math.sqrt(1.0 - ECCENTRICITY_SQUARED * sin * sin);
    }

    private static double q(double phi) {
        double sin = Math.sin(phi);
        double esin = E * sin;
        return (1.0 - ECCENTRICITY_SQUARED)
                * (sin / (1.0 - ECCENTRICITY_SQUARED * sin * sin)
                - (1.0 / (2.0 * E)) * Math.log((1.0 - esin) / (1.0 + esin)));
    }
}
