package com.stationpath.router;

import com.google.common.base.Preconditions;
import com.stationpath.gtfs.loader.ScheduleStore;
import com.stationpath.router.search.AStarRouter;
import com.stationpath.router.search.GreatCircleHeuristic;
import com.stationpath.router.search.SearchHeuristic;
import com.stationpath.router.search.SearchOutcome;
import com.stationpath.router.transit.StationGraph;
import com.stationpath.router.transit.StationGraphBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.time.Duration;

/**
 * A route planning session: builds a station graph from the schedule store, then answers route queries on it.
 *
 * Every call to {@link #loadGraph()} reads a fresh snapshot of the schedule and returns a new graph. The planner
 * does not keep the graph; callers hold on to it for as long as the snapshot should be used. Since the graph is
 * immutable, concurrent calls to {@link #planRoute(StationGraph, String, String)} on the same graph are safe.
 */
public class TransitPlanner {

    private static final Logger LOG = LoggerFactory.getLogger(TransitPlanner.class);

    /** Settings for a planning session. */
    public interface Config {
        String databaseFile ();
        int defaultTransferSeconds ();
        double earthRadiusMeters ();
        double assumedSpeedMetersPerSecond ();
        /** Zero means searches are not limited in time. */
        int searchTimeoutSeconds ();
    }

    private final ScheduleStore scheduleStore;

    private final int defaultTransferSeconds;

    private final AStarRouter router;

    private final Duration searchTimeLimit;

    public TransitPlanner (ScheduleStore scheduleStore, int defaultTransferSeconds, SearchHeuristic heuristic,
                           Duration searchTimeLimit) {
        this.scheduleStore = Preconditions.checkNotNull(scheduleStore);
        Preconditions.checkArgument(defaultTransferSeconds >= 0);
        this.defaultTransferSeconds = defaultTransferSeconds;
        this.router = new AStarRouter(heuristic);
        this.searchTimeLimit = searchTimeLimit;
    }

    /** A session with the default transfer time and the great circle heuristic at default speed. */
    public TransitPlanner (ScheduleStore scheduleStore) {
        this(scheduleStore, StationGraphBuilder.DEFAULT_TRANSFER_SECONDS, new GreatCircleHeuristic(), null);
    }

    public static TransitPlanner fromConfig (Config config) {
        ScheduleStore store = ScheduleStore.forDatabaseFile(new File(config.databaseFile()));
        SearchHeuristic heuristic =
                new GreatCircleHeuristic(config.earthRadiusMeters(), config.assumedSpeedMetersPerSecond());
        Duration timeLimit = config.searchTimeoutSeconds() > 0 ? Duration.ofSeconds(config.searchTimeoutSeconds()) : null;
        return new TransitPlanner(store, config.defaultTransferSeconds(), heuristic, timeLimit);
    }

    /**
     * Read the stops, travel segments and transfers from the schedule store and build a graph from them.
     * @throws com.stationpath.gtfs.ScheduleStoreException if the store cannot be read or has no stops.
     */
    public StationGraph loadGraph () {
        long startTime = System.currentTimeMillis();
        StationGraph graph = new StationGraphBuilder(defaultTransferSeconds).build(scheduleStore.readSnapshot());
        LOG.info("Loaded {} in {} msec.", graph, System.currentTimeMillis() - startTime);
        return graph;
    }

    /** Find the minimum travel time route between two stations, or the reason there is none. */
    public SearchOutcome planRoute (StationGraph graph, String originId, String destinationId) {
        SearchOutcome outcome = router.findPath(graph, originId, destinationId, searchTimeLimit);
        if (outcome.isSuccess()) {
            LOG.info("Route from {} to {}: {} stops, {} sec.", originId, destinationId,
                    outcome.route.getLegCount(), outcome.route.totalSeconds);
        } else {
            LOG.info("No route from {} to {}: {}", originId, destinationId, outcome.message);
        }
        return outcome;
    }

    public AStarRouter getRouter () {
        return router;
    }

}
