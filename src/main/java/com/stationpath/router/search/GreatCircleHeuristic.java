package com.stationpath.router.search;

import com.google.common.base.Preconditions;
import com.stationpath.router.common.SphericalDistanceLibrary;
import com.stationpath.router.transit.Station;
import com.stationpath.router.transit.StationGraph;

/**
 * Estimates travel time as the straight-line (great circle) distance between two stations divided by a speed that
 * no vehicle is expected to beat between adjacent stops. Since no track is shorter than the great circle, this
 * underestimates the time of any real path as long as the assumed speed is not exceeded.
 *
 * Stations without coordinates give an estimate of zero, which keeps the search correct but undirected.
 */
public class GreatCircleHeuristic implements SearchHeuristic {

    public static final double DEFAULT_SPEED_METERS_PER_SECOND = 10;

    public final double earthRadiusMeters;

    public final double speedMetersPerSecond;

    public GreatCircleHeuristic () {
        this(SphericalDistanceLibrary.RADIUS_OF_EARTH_IN_M, DEFAULT_SPEED_METERS_PER_SECOND);
    }

    public GreatCircleHeuristic (double earthRadiusMeters, double speedMetersPerSecond) {
        Preconditions.checkArgument(earthRadiusMeters > 0, "Earth radius must be positive: %s", earthRadiusMeters);
        Preconditions.checkArgument(speedMetersPerSecond > 0, "Speed must be positive: %s", speedMetersPerSecond);
        this.earthRadiusMeters = earthRadiusMeters;
        this.speedMetersPerSecond = speedMetersPerSecond;
    }

    @Override
    public double estimate (StationGraph graph, int fromStation, int toStation) {
        if (fromStation < 0 || toStation < 0 ||
                fromStation >= graph.getStationCount() || toStation >= graph.getStationCount()) {
            return 0;
        }
        Station from = graph.getStation(fromStation);
        Station to = graph.getStation(toStation);
        if (!from.hasCoordinates() || !to.hasCoordinates()) return 0;
        double meters = SphericalDistanceLibrary.haversine(from.lat, from.lon, to.lat, to.lon, earthRadiusMeters);
        return meters / speedMetersPerSecond;
    }

    @Override
    public String toString () {
        return String.format("GreatCircleHeuristic{radius=%.0fm, speed=%.1fm/s}", earthRadiusMeters, speedMetersPerSecond);
    }

}
