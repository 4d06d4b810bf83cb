package com.stationpath.router.search;

import com.stationpath.gtfs.model.Stop;
import com.stationpath.gtfs.model.Transfer;
import com.stationpath.gtfs.model.TravelSegment;
import com.stationpath.router.transit.StationGraph;
import com.stationpath.router.transit.StationGraphBuilder;
import com.stationpath.router.transit.TransitEdge;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

import static com.stationpath.router.search.TestNetworks.network;
import static com.stationpath.router.search.TestNetworks.randomNetwork;
import static com.stationpath.router.search.TestNetworks.referenceTravelTimes;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Small hand-made networks check exact routes, and random networks check that A* with the great circle heuristic
 * finds the same travel times as a plain Dijkstra search.
 */
public class AStarRouterTest {

    private final AStarRouter router = new AStarRouter(new GreatCircleHeuristic());

    @Test
    public void testRouteThroughIntermediateStation () {
        StationGraph graph = network(List.of("A", "B", "C"), "A B 100", "B C 200");
        SearchOutcome outcome = router.findPath(graph, "A", "C");
        assertTrue(outcome.isSuccess());
        RouteResult route = outcome.getRoute();
        assertEquals(List.of("A", "B", "C"), route.stationIds);
        assertEquals(300, route.totalSeconds);
        assertEquals(2, route.getLegCount());
        assertEquals("B", route.legs.get(0).toStationId);
        assertEquals(200, route.legs.get(1).weightSeconds);
        assertNull(outcome.error);
    }

    @Test
    public void testTransferReplacingTravelEdgeIsUsed () {
        List<Stop> stops = List.of(new Stop("A", "A", null, null), new Stop("B", "B", null, null),
                new Stop("C", "C", null, null));
        StationGraph graph = new StationGraphBuilder().build(stops,
                List.of(new TravelSegment("A", "B", 100, "R1"), new TravelSegment("B", "C", 200, "R1")),
                List.of(new Transfer("A", "B", 50)));
        RouteResult route = router.findPath(graph, "A", "C").getRoute();
        assertEquals(List.of("A", "B", "C"), route.stationIds);
        assertEquals(250, route.totalSeconds);
        assertEquals(TransitEdge.Kind.TRANSFER, route.legs.get(0).kind);
        assertNull(route.legs.get(0).routeId);
        assertEquals(TransitEdge.Kind.TRAVEL, route.legs.get(1).kind);
    }

    @Test
    public void testNoPathFound () {
        StationGraph graph = network(List.of("A", "B"));
        SearchOutcome outcome = router.findPath(graph, "A", "B");
        assertFalse(outcome.isSuccess());
        assertEquals(SearchOutcome.Error.NO_PATH_FOUND, outcome.error);
        assertNull(outcome.route);
        assertEquals(1, outcome.stationsExpanded);
        assertThrows(IllegalStateException.class, outcome::getRoute);

        // Edges only lead away from the destination.
        StationGraph oneWay = network(List.of("A", "B", "C"), "A B 10", "B C 10");
        assertEquals(SearchOutcome.Error.NO_PATH_FOUND, router.findPath(oneWay, "C", "A").error);
    }

    @Test
    public void testUnknownStation () {
        StationGraph graph = network(List.of("A", "B"), "A B 10");
        SearchOutcome unknownOrigin = router.findPath(graph, "X", "A");
        assertEquals(SearchOutcome.Error.NODE_NOT_FOUND, unknownOrigin.error);
        assertTrue(unknownOrigin.message.contains("X"));
        assertEquals(0, unknownOrigin.stationsExpanded);
        SearchOutcome unknownDestination = router.findPath(graph, "A", "Y");
        assertEquals(SearchOutcome.Error.NODE_NOT_FOUND, unknownDestination.error);
        assertTrue(unknownDestination.message.contains("Y"));
        assertEquals(SearchOutcome.Error.NODE_NOT_FOUND, router.findPath(graph, null, "A").error);
    }

    @Test
    public void testOriginIsDestination () {
        StationGraph graph = network(List.of("A", "B"), "A B 10", "B A 10");
        RouteResult route = router.findPath(graph, "A", "A").getRoute();
        assertEquals(List.of("A"), route.stationIds);
        assertEquals(0, route.totalSeconds);
        assertTrue(route.legs.isEmpty());
    }

    /** Of two routes taking the same time, the one whose first edge was inserted first is returned every time. */
    @Test
    public void testEqualCostTiesAreDeterministic () {
        StationGraph graph = network(List.of("A", "B", "C", "D"), "A B 10", "A C 10", "B D 10", "C D 10");
        for (int i = 0; i < 10; i++) {
            RouteResult route = router.findPath(graph, "A", "D").getRoute();
            assertEquals(List.of("A", "B", "D"), route.stationIds);
            assertEquals(20, route.totalSeconds);
        }
        StationGraph reversed = network(List.of("A", "B", "C", "D"), "A C 10", "A B 10", "B D 10", "C D 10");
        assertEquals(List.of("A", "C", "D"), router.findPath(reversed, "A", "D").getRoute().stationIds);
    }

    @Test
    public void testFasterRouteWithMoreStops () {
        StationGraph graph = network(List.of("A", "B", "C", "D"), "A D 500", "A B 100", "B C 100", "C D 100");
        RouteResult route = router.findPath(graph, "A", "D").getRoute();
        assertEquals(List.of("A", "B", "C", "D"), route.stationIds);
        assertEquals(300, route.totalSeconds);
    }

    @Test
    public void testTimeLimit () {
        List<String> ids = new ArrayList<>();
        List<String> travel = new ArrayList<>();
        for (int s = 0; s < 10; s++) {
            ids.add("S" + s);
            if (s > 0) travel.add(String.format("S%d S%d 60", s - 1, s));
        }
        StationGraph graph = network(ids, travel.toArray(new String[0]));
        // Every reading of this clock is one millisecond later than the last.
        AtomicLong clock = new AtomicLong();
        AStarRouter slowRouter = new AStarRouter(SearchHeuristic.ZERO, () -> clock.addAndGet(1_000_000));
        SearchOutcome outcome = slowRouter.findPath(graph, "S0", "S9", Duration.ofMillis(2));
        assertEquals(SearchOutcome.Error.TIMED_OUT, outcome.error);
        assertEquals(2, outcome.stationsExpanded);

        SearchOutcome unlimited = slowRouter.findPath(graph, "S0", "S9", null);
        assertEquals(540, unlimited.getRoute().totalSeconds);
        assertThrows(IllegalArgumentException.class,
                () -> router.findPath(graph, "S0", "S9", Duration.ofSeconds(-1)));
    }

    @ParameterizedTest(name = "network {0}")
    @ValueSource(longs = {0, 1, 2, 3, 4})
    public void testOptimalOnRandomNetworks (long seed) {
        Random random = new Random(seed + 100);
        StationGraph graph = randomNetwork(seed, 150, 600);
        for (int q = 0; q < 40; q++) {
            int origin = random.nextInt(graph.getStationCount());
            int destination = random.nextInt(graph.getStationCount());
            String originId = graph.getStation(origin).id;
            String destinationId = graph.getStation(destination).id;
            double expected = referenceTravelTimes(graph, origin)[destination];
            SearchOutcome outcome = router.findPath(graph, originId, destinationId);
            if (Double.isInfinite(expected)) {
                assertEquals(SearchOutcome.Error.NO_PATH_FOUND, outcome.error);
            } else {
                assertEquals(expected, outcome.getRoute().totalSeconds, 1e-9);
                assertValidRoute(graph, outcome.getRoute(), originId, destinationId);
            }
        }
    }

    /** The estimate never exceeds the true remaining travel time on networks respecting the assumed speed. */
    @Test
    public void testHeuristicIsAdmissible () {
        GreatCircleHeuristic heuristic = new GreatCircleHeuristic();
        StationGraph graph = randomNetwork(11, 80, 400);
        for (int origin = 0; origin < graph.getStationCount(); origin += 7) {
            double[] travelTimes = referenceTravelTimes(graph, origin);
            for (int destination = 0; destination < graph.getStationCount(); destination++) {
                if (Double.isInfinite(travelTimes[destination])) continue;
                double estimate = heuristic.estimate(graph, origin, destination);
                assertTrue(estimate >= 0);
                assertTrue(estimate <= travelTimes[destination],
                        String.format("Estimate %f exceeds travel time %f", estimate, travelTimes[destination]));
            }
        }
    }

    /** Without coordinates the great circle heuristic is zero everywhere, and the search is uniform-cost. */
    @Test
    public void testDegeneratesToUniformCostSearch () {
        StationGraph graph = network(List.of("A", "B", "C", "D", "E"),
                "A B 30", "A C 10", "C B 10", "B D 40", "C E 100", "E D 1");
        AStarRouter uniformCost = new AStarRouter(SearchHeuristic.ZERO);
        SearchOutcome withHeuristic = router.findPath(graph, "A", "D");
        SearchOutcome withoutHeuristic = uniformCost.findPath(graph, "A", "D");
        assertEquals(withoutHeuristic.getRoute().stationIds, withHeuristic.getRoute().stationIds);
        assertEquals(List.of("A", "C", "B", "D"), withHeuristic.getRoute().stationIds);
        assertEquals(60, withHeuristic.getRoute().totalSeconds);
        assertEquals(withoutHeuristic.stationsExpanded, withHeuristic.stationsExpanded);
    }

    /** With a zero heuristic every pair of stations gets the same travel time as Dijkstra, or no path at all. */
    @ParameterizedTest(name = "network {0}")
    @ValueSource(longs = {0, 1, 2})
    public void testZeroHeuristicMatchesDijkstraForAllPairs (long seed) {
        AStarRouter uniformCost = new AStarRouter(SearchHeuristic.ZERO);
        StationGraph graph = randomNetwork(seed, 50, 200);
        for (int origin = 0; origin < graph.getStationCount(); origin++) {
            double[] travelTimes = referenceTravelTimes(graph, origin);
            String originId = graph.getStation(origin).id;
            for (int destination = 0; destination < graph.getStationCount(); destination++) {
                String destinationId = graph.getStation(destination).id;
                SearchOutcome outcome = uniformCost.findPath(graph, originId, destinationId);
                if (Double.isInfinite(travelTimes[destination])) {
                    assertEquals(SearchOutcome.Error.NO_PATH_FOUND, outcome.error);
                } else {
                    assertEquals(travelTimes[destination], outcome.getRoute().totalSeconds, 1e-9);
                    assertEquals(outcome.getRoute().totalSeconds,
                            router.findPath(graph, originId, destinationId).getRoute().totalSeconds, 1e-9);
                    assertValidRoute(graph, outcome.getRoute(), originId, destinationId);
                }
            }
        }
    }

    private static void assertValidRoute (StationGraph graph, RouteResult route, String originId, String destinationId) {
        assertEquals(originId, route.getOrigin());
        assertEquals(destinationId, route.getDestination());
        assertEquals(route.stationIds.size() - 1, route.legs.size());
        double total = 0;
        for (int i = 0; i < route.legs.size(); i++) {
            RouteLeg leg = route.legs.get(i);
            assertEquals(route.stationIds.get(i), leg.fromStationId);
            assertEquals(route.stationIds.get(i + 1), leg.toStationId);
            assertEquals(graph.getEdge(leg.fromStationId, leg.toStationId).weightSeconds, leg.weightSeconds);
            total += leg.weightSeconds;
        }
        assertEquals(total, route.totalSeconds, 1e-9);
    }

}
