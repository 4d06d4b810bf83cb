package com.stationpath.router.common;

import org.apache.commons.math3.util.FastMath;

/**
 * Great-circle distances between points given in degrees of latitude and longitude.
 */
public abstract class SphericalDistanceLibrary {

    /** Mean radius of the Earth as used by the station heuristic, https://en.wikipedia.org/wiki/Earth_radius */
    public static final double RADIUS_OF_EARTH_IN_M = 6_371_000;

    /** Haversine distance in meters on a sphere of the default Earth radius. */
    public static double haversine (double lat1, double lon1, double lat2, double lon2) {
        return haversine(lat1, lon1, lat2, lon2, RADIUS_OF_EARTH_IN_M);
    }

    /**
     * Haversine distance in meters on a sphere of the given radius.
     * See: http://www.movable-type.co.uk/scripts/latlong.html
     */
    public static double haversine (double lat1, double lon1, double lat2, double lon2, double radiusMeters) {
        double phi1 = FastMath.toRadians(lat1);
        double phi2 = FastMath.toRadians(lat2);
        double dPhi = FastMath.toRadians(lat2 - lat1);
        double dLambda = FastMath.toRadians(lon2 - lon1);
        double sinHalfDPhi = FastMath.sin(dPhi / 2);
        double sinHalfDLambda = FastMath.sin(dLambda / 2);
        double a = sinHalfDPhi * sinHalfDPhi + FastMath.cos(phi1) * FastMath.cos(phi2) * sinHalfDLambda * sinHalfDLambda;
        // Rounding can push a slightly above 1 for antipodal points.
        a = FastMath.min(1, a);
        double c = 2 * FastMath.atan2(FastMath.sqrt(a), FastMath.sqrt(1 - a));
        return radiusMeters * c;
    }

}
