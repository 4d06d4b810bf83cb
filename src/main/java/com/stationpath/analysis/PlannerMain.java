package com.stationpath.analysis;

import com.stationpath.gtfs.FeedImporter;
import com.stationpath.router.TransitPlanner;
import com.stationpath.router.common.JsonUtilities;
import com.stationpath.router.search.RouteLeg;
import com.stationpath.router.search.RouteResult;
import com.stationpath.router.search.SearchOutcome;
import com.stationpath.router.transit.StationGraph;
import com.stationpath.router.transit.TransitEdge;
import com.stationpath.router.util.ExceptionUtils;
import gnu.trove.map.TObjectIntMap;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

/**
 * This is the main entry point for the command line planner. Configuration is read from planner.properties in the
 * working directory, or from the file named with --config.
 *
 * <pre>
 *   plan ORIGIN_STOP_ID DESTINATION_STOP_ID [--json]
 *   import FEED.zip
 * </pre>
 */
public abstract class PlannerMain {

    private static final Logger LOG = LoggerFactory.getLogger(PlannerMain.class);

    /** Exit status when the search completed without finding a route. */
    static final int NO_ROUTE_STATUS = 2;

    public static void main (String... args) {
        int status;
        try {
            PlannerCommandLine commandLine = new PlannerCommandLine(args);
            if (commandLine.help()) {
                PlannerCommandLine.printHelp(System.out);
                status = 0;
            } else {
                status = run(PlannerConfig.fromFile(commandLine.configFile()), System.out, commandLine);
            }
        } catch (ParseException e) {
            System.err.println(e.getMessage());
            PlannerCommandLine.printHelp(System.err);
            status = 1;
        } catch (Throwable throwable) {
            LOG.error("Planner failed: {}\n{}", ExceptionUtils.shortCauseString(throwable),
                    ExceptionUtils.stackTraceString(throwable));
            status = 1;
        }
        System.exit(status);
    }

    /** Carry out one command, writing its results to the given stream. Returns the exit status. */
    static int run (TransitPlanner.Config config, PrintStream out, PlannerCommandLine commandLine) {
        List<String> arguments = commandLine.arguments();
        String command = arguments.isEmpty() ? "" : arguments.get(0);
        if ("plan".equals(command) && arguments.size() == 3) {
            return plan(config, out, arguments.get(1), arguments.get(2), commandLine.json());
        } else if ("import".equals(command) && arguments.size() == 2) {
            return importFeed(config, out, new File(arguments.get(1)));
        }
        out.println("Unexpected argument(s): " + arguments);
        PlannerCommandLine.printHelp(out);
        return 1;
    }

    private static int plan (TransitPlanner.Config config, PrintStream out, String originId, String destinationId,
                             boolean json) {
        TransitPlanner planner = TransitPlanner.fromConfig(config);
        StationGraph graph = planner.loadGraph();
        SearchOutcome outcome = planner.planRoute(graph, originId, destinationId);
        if (json) {
            out.println(JsonUtilities.objectToJsonString(outcome));
        } else {
            printOutcome(graph, outcome, out);
        }
        return outcome.isSuccess() ? 0 : NO_ROUTE_STATUS;
    }

    private static int importFeed (TransitPlanner.Config config, PrintStream out, File feedFile) {
        TObjectIntMap<String> rowsForTable = new FeedImporter(new File(config.databaseFile())).importFeed(feedFile);
        for (String table : rowsForTable.keySet()) {
            out.printf("%-15s %d rows%n", table, rowsForTable.get(table));
        }
        return 0;
    }

    static void printOutcome (StationGraph graph, SearchOutcome outcome, PrintStream out) {
        if (!outcome.isSuccess()) {
            out.printf("No route from %s to %s: %s%n", outcome.origin, outcome.destination, outcome.message);
            return;
        }
        RouteResult route = outcome.getRoute();
        out.printf("Origin:      %s (%s)%n", nameOf(graph, route.getOrigin()), route.getOrigin());
        out.printf("Destination: %s (%s)%n", nameOf(graph, route.getDestination()), route.getDestination());
        out.printf(Locale.ROOT, "Total time:  %.1f minutes%n", route.totalSeconds / 60);
        out.printf("Stops:       %d%n", route.getLegCount());
        int legNumber = 1;
        for (RouteLeg leg : route.legs) {
            String mode = leg.kind == TransitEdge.Kind.TRANSFER ? "transfer" : "route " + leg.routeId;
            out.printf("  %d. %s -> %s (%s, %ds)%n", legNumber++, nameOf(graph, leg.fromStationId),
                    nameOf(graph, leg.toStationId), mode, leg.weightSeconds);
        }
    }

    private static String nameOf (StationGraph graph, String stationId) {
        return graph.getStation(stationId).displayName();
    }

}
