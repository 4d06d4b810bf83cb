package com.stationpath.router.search;

import java.util.List;

/**
 * A minimum travel time route: the stations passed through from origin to destination inclusive, the total
 * time, and the edges traversed between consecutive stations.
 */
public class RouteResult {

    public final List<String> stationIds;

    public final double totalSeconds;

    /** One fewer than the number of stations. Empty when origin and destination are the same station. */
    public final List<RouteLeg> legs;

    public RouteResult (List<String> stationIds, double totalSeconds, List<RouteLeg> legs) {
        this.stationIds = List.copyOf(stationIds);
        this.totalSeconds = totalSeconds;
        this.legs = List.copyOf(legs);
    }

    public String getOrigin () {
        return stationIds.get(0);
    }

    public String getDestination () {
        return stationIds.get(stationIds.size() - 1);
    }

    /** Number of edges traversed, which is the number of stops made after leaving the origin. */
    public int getLegCount () {
        return legs.size();
    }

    @Override
    public String toString () {
        return String.format("RouteResult{%s, %.0f sec}", String.join(" > ", stationIds), totalSeconds);
    }

}
