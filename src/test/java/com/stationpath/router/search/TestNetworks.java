package com.stationpath.router.search;

import com.stationpath.gtfs.model.Stop;
import com.stationpath.gtfs.model.Transfer;
import com.stationpath.gtfs.model.TravelSegment;
import com.stationpath.router.common.SphericalDistanceLibrary;
import com.stationpath.router.transit.StationGraph;
import com.stationpath.router.transit.StationGraphBuilder;
import com.stationpath.router.transit.TransitEdge;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Random;

/**
 * Builds station graphs for router tests, and finds reference travel times with a plain Dijkstra search that shares
 * no code with the router.
 */
public abstract class TestNetworks {

    /** A graph of stations without coordinates, from "FROM TO SECONDS" travel strings, e.g. "A B 100". */
    public static StationGraph network (List<String> stationIds, String... travel) {
        List<Stop> stops = new ArrayList<>();
        for (String id : stationIds) stops.add(new Stop(id, "Station " + id, null, null));
        List<TravelSegment> segments = new ArrayList<>();
        for (String edge : travel) {
            String[] parts = edge.split(" ");
            segments.add(new TravelSegment(parts[0], parts[1], Integer.parseInt(parts[2]), "R"));
        }
        return new StationGraphBuilder().build(stops, segments, List.of());
    }

    /**
     * Random stations scattered over roughly 20 km, connected by travel and transfer edges that are never faster than
     * the straight line distance at 10 m/s, so the great circle heuristic is admissible on them.
     */
    public static StationGraph randomNetwork (long seed, int stationCount, int edgeCount) {
        Random random = new Random(seed);
        List<Stop> stops = new ArrayList<>();
        for (int s = 0; s < stationCount; s++) {
            double lat = 40.6 + random.nextDouble() * 0.2;
            double lon = -74.1 + random.nextDouble() * 0.2;
            stops.add(new Stop("S" + s, "Station " + s, lat, lon));
        }
        List<TravelSegment> segments = new ArrayList<>();
        List<Transfer> transfers = new ArrayList<>();
        for (int e = 0; e < edgeCount; e++) {
            Stop from = stops.get(random.nextInt(stationCount));
            Stop to = stops.get(random.nextInt(stationCount));
            if (from == to) continue;
            double meters = SphericalDistanceLibrary.haversine(from.stop_lat, from.stop_lon, to.stop_lat, to.stop_lon);
            int seconds = (int) Math.ceil(meters / 10) + 1 + random.nextInt(120);
            if (random.nextInt(5) == 0) {
                transfers.add(new Transfer(from.stop_id, to.stop_id, seconds));
            } else {
                segments.add(new TravelSegment(from.stop_id, to.stop_id, seconds, "R" + random.nextInt(10)));
            }
        }
        return new StationGraphBuilder().build(stops, segments, transfers);
    }

    /** Travel time from the origin to every station by uniform-cost search, infinite where unreachable. */
    public static double[] referenceTravelTimes (StationGraph graph, int origin) {
        double[] best = new double[graph.getStationCount()];
        Arrays.fill(best, Double.POSITIVE_INFINITY);
        best[origin] = 0;
        PriorityQueue<double[]> queue = new PriorityQueue<>((a, b) -> Double.compare(a[0], b[0]));
        queue.add(new double[] {0, origin});
        while (!queue.isEmpty()) {
            double[] item = queue.poll();
            int station = (int) item[1];
            if (item[0] > best[station]) continue;
            for (TransitEdge edge : graph.getOutgoingEdges(station)) {
                double cost = item[0] + edge.weightSeconds;
                if (cost < best[edge.toIndex]) {
                    best[edge.toIndex] = cost;
                    queue.add(new double[] {cost, edge.toIndex});
                }
            }
        }
        return best;
    }

}
