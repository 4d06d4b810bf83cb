package com.stationpath.router.search;

import com.google.common.base.Preconditions;
import com.stationpath.router.transit.StationGraph;
import com.stationpath.router.transit.TransitEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.function.LongSupplier;

/**
 * Finds minimum travel time routes between stations of a {@link StationGraph} with an A* search directed by a
 * pluggable {@link SearchHeuristic}.
 *
 * The router itself holds no search state: every call to findPath works on its own throw-away {@link Search}, so
 * one router and one graph can serve concurrent searches. The graph is only read.
 *
 * The route found is optimal as long as the heuristic is admissible and consistent. When the heuristic returns
 * zero (for instance because stations lack coordinates) the search simply becomes a uniform-cost search.
 */
public class AStarRouter {

    private static final Logger LOG = LoggerFactory.getLogger(AStarRouter.class);

    private final SearchHeuristic heuristic;

    private final LongSupplier nanoTime;

    public AStarRouter (SearchHeuristic heuristic) {
        this(heuristic, System::nanoTime);
    }

    /** The time source is only replaced in tests of the time limit. */
    AStarRouter (SearchHeuristic heuristic, LongSupplier nanoTime) {
        this.heuristic = Preconditions.checkNotNull(heuristic);
        this.nanoTime = nanoTime;
    }

    public SearchHeuristic getHeuristic () {
        return heuristic;
    }

    public SearchOutcome findPath (StationGraph graph, String originId, String destinationId) {
        return findPath(graph, originId, destinationId, null);
    }

    /**
     * @param timeLimit if non-null, the search gives up with {@link SearchOutcome.Error#TIMED_OUT} once this much
     *                  time has passed. The limit is checked each time a station comes off the frontier.
     */
    public SearchOutcome findPath (StationGraph graph, String originId, String destinationId, Duration timeLimit) {
        Preconditions.checkNotNull(graph);
        Preconditions.checkArgument(timeLimit == null || !timeLimit.isNegative(), "Negative time limit.");
        int origin = graph.getIndexForStationId(originId);
        int destination = graph.getIndexForStationId(destinationId);
        if (origin < 0 || destination < 0) {
            String missing = origin < 0 ? originId : destinationId;
            return SearchOutcome.failure(originId, destinationId, SearchOutcome.Error.NODE_NOT_FOUND,
                    "Station " + missing + " is not in the network.", 0);
        }
        return new Search(graph, origin, destination, timeLimit).run();
    }

    /** An entry on the frontier. A station may have several entries, only the one with the lowest cost matters. */
    static class FrontierEntry {
        final int station;
        final double costSeconds;
        final double estimatedTotalSeconds;
        /** Insertion order, used to break ties deterministically: the entry inserted first comes out first. */
        final long sequence;

        FrontierEntry (int station, double costSeconds, double estimatedTotalSeconds, long sequence) {
            this.station = station;
            this.costSeconds = costSeconds;
            this.estimatedTotalSeconds = estimatedTotalSeconds;
            this.sequence = sequence;
        }
    }

    static final Comparator<FrontierEntry> FRONTIER_ORDER =
            Comparator.<FrontierEntry>comparingDouble(e -> e.estimatedTotalSeconds).thenComparingLong(e -> e.sequence);

    /** The state of a single search from one origin to one destination. */
    private class Search {

        final StationGraph graph;
        final int origin;
        final int destination;
        final long deadlineNanos;
        final long startNanos;

        /** Best known cost from the origin to each station, infinite for stations not yet discovered. */
        final double[] bestCost;

        /** The edge by which each station was reached at its best known cost. */
        final TransitEdge[] backEdge;

        final BitSet finalized;

        final PriorityQueue<FrontierEntry> frontier = new PriorityQueue<>(FRONTIER_ORDER);

        long nextSequence = 0;

        int stationsExpanded = 0;

        Search (StationGraph graph, int origin, int destination, Duration timeLimit) {
            this.graph = graph;
            this.origin = origin;
            this.destination = destination;
            this.startNanos = nanoTime.getAsLong();
            this.deadlineNanos = timeLimit == null ? Long.MAX_VALUE : startNanos + timeLimit.toNanos();
            int n = graph.getStationCount();
            bestCost = new double[n];
            Arrays.fill(bestCost, Double.POSITIVE_INFINITY);
            backEdge = new TransitEdge[n];
            finalized = new BitSet(n);
        }

        SearchOutcome run () {
            bestCost[origin] = 0;
            push(origin, 0);
            while (!frontier.isEmpty()) {
                if (nanoTime.getAsLong() > deadlineNanos) {
                    LOG.debug("Search from {} timed out after finalizing {} stations.", originId(), stationsExpanded);
                    return failure(SearchOutcome.Error.TIMED_OUT, "The search exceeded its time limit.");
                }
                FrontierEntry entry = frontier.poll();
                int station = entry.station;
                if (station == destination) {
                    return success();
                }
                // Stale entries remain on the frontier after a station is reached again more cheaply.
                if (finalized.get(station)) continue;
                finalized.set(station);
                stationsExpanded++;
                for (TransitEdge edge : graph.getOutgoingEdges(station)) {
                    double cost = bestCost[station] + edge.weightSeconds;
                    if (cost < bestCost[edge.toIndex]) {
                        bestCost[edge.toIndex] = cost;
                        backEdge[edge.toIndex] = edge;
                        push(edge.toIndex, cost);
                    }
                }
            }
            return failure(SearchOutcome.Error.NO_PATH_FOUND,
                    String.format("No path from %s to %s.", originId(), destinationId()));
        }

        private void push (int station, double cost) {
            double estimate = cost + heuristic.estimate(graph, station, destination);
            frontier.add(new FrontierEntry(station, cost, estimate, nextSequence++));
        }

        private SearchOutcome success () {
            List<String> stationIds = new ArrayList<>();
            List<RouteLeg> legs = new ArrayList<>();
            stationIds.add(destinationId());
            for (int station = destination; station != origin; ) {
                TransitEdge edge = backEdge[station];
                legs.add(new RouteLeg(edge));
                stationIds.add(edge.fromStationId);
                station = edge.fromIndex;
            }
            Collections.reverse(stationIds);
            Collections.reverse(legs);
            logDone("found a route");
            RouteResult route = new RouteResult(stationIds, bestCost[destination], legs);
            return SearchOutcome.success(originId(), destinationId(), route, stationsExpanded);
        }

        private SearchOutcome failure (SearchOutcome.Error error, String message) {
            logDone(error.toString());
            return SearchOutcome.failure(originId(), destinationId(), error, message, stationsExpanded);
        }

        private void logDone (String result) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("Search {} -> {} {} after finalizing {} stations and {} frontier insertions in {} msec.",
                        originId(), destinationId(), result, stationsExpanded, nextSequence,
                        (nanoTime.getAsLong() - startNanos) / 1_000_000);
            }
        }

        private String originId () {
            return graph.getStation(origin).id;
        }

        private String destinationId () {
            return graph.getStation(destination).id;
        }
    }

}
