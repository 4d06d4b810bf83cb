package com.stationpath.router.search;

import com.stationpath.router.transit.StationGraph;

/**
 * A lower bound on the travel time in seconds between two stations of a graph, used to direct an A* search.
 * To guarantee optimal routes an implementation must never overestimate the true remaining time, must never be
 * negative, and should not decrease by more than an edge's weight when stepping across that edge.
 * Implementations are pure functions of the graph and must be safe to call from concurrent searches.
 */
@FunctionalInterface
public interface SearchHeuristic {

    /** Reduces A* to a plain uniform-cost (Dijkstra) search. */
    SearchHeuristic ZERO = (graph, fromStation, toStation) -> 0;

    double estimate (StationGraph graph, int fromStation, int toStation);

    /** Estimate by station id. Ids that are not in the graph give an estimate of zero. */
    default double estimate (StationGraph graph, String fromStationId, String toStationId) {
        int from = graph.getIndexForStationId(fromStationId);
        int to = graph.getIndexForStationId(toStationId);
        if (from < 0 || to < 0) return 0;
        return estimate(graph, from, to);
    }

}
