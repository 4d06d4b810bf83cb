package com.stationpath.router.common;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class SphericalDistanceLibraryTest {

    /** One degree of arc on the mean Earth radius. */
    private static final double METERS_PER_DEGREE = SphericalDistanceLibrary.RADIUS_OF_EARTH_IN_M * Math.PI / 180;

    @Test
    public void testKnownDistances () {
        assertEquals(0, SphericalDistanceLibrary.haversine(40.75, -73.99, 40.75, -73.99), 1e-9);
        assertEquals(METERS_PER_DEGREE, SphericalDistanceLibrary.haversine(0, 0, 0, 1), 1e-6);
        assertEquals(METERS_PER_DEGREE, SphericalDistanceLibrary.haversine(10, 20, 11, 20), 1e-6);
        // Half the circumference, where rounding could otherwise take the arcsine argument out of range.
        assertEquals(Math.PI * SphericalDistanceLibrary.RADIUS_OF_EARTH_IN_M,
                SphericalDistanceLibrary.haversine(0, 0, 0, 180), 1e-3);
    }

    @Test
    public void testSymmetryAndRadius () {
        double there = SphericalDistanceLibrary.haversine(40.7527, -73.9772, 40.6892, -74.0445);
        double back = SphericalDistanceLibrary.haversine(40.6892, -74.0445, 40.7527, -73.9772);
        assertEquals(there, back, 1e-9);
        // Roughly 9.2 km between Grand Central and the Statue of Liberty.
        assertEquals(9200, there, 200);
        double halfRadius = SphericalDistanceLibrary.haversine(40.7527, -73.9772, 40.6892, -74.0445,
                SphericalDistanceLibrary.RADIUS_OF_EARTH_IN_M / 2);
        assertEquals(there / 2, halfRadius, 1e-6);
    }

}
