package com.stationpath.router.transit;

import org.slf4j.Logger;

/**
 * Tallies of what happened to the schedule records fed into a {@link StationGraphBuilder}.
 * Records that cannot become part of the graph are skipped without failing the build, and counted here so the
 * skips stay visible.
 */
public class BuildStatistics {

    int stations;
    int travelEdges;
    int transferEdges;

    /** Stops without an id. */
    int malformedStops;
    /** Stops whose id was already taken by an earlier stop. */
    int duplicateStops;

    /** Travel segments lacking an endpoint, or whose duration is missing, unparsable or negative. */
    int malformedTravelSegments;
    /** Travel segments referring to a stop that is not a station of the graph. */
    int danglingTravelSegments;
    /** Travel segments sharing an ordered pair with another travel segment. Only the fastest one is kept. */
    int duplicateTravelSegments;

    int malformedTransfers;
    int selfLoopTransfers;
    int danglingTransfers;
    /** Transfers whose stored minimum time was missing or not positive, replaced by the default. */
    int defaultedTransfers;
    /** Travel edges discarded because a transfer was later inserted for the same ordered pair. */
    int travelEdgesReplacedByTransfers;

    public int getStations () { return stations; }
    public int getTravelEdges () { return travelEdges; }
    public int getTransferEdges () { return transferEdges; }
    public int getMalformedStops () { return malformedStops; }
    public int getDuplicateStops () { return duplicateStops; }
    public int getMalformedTravelSegments () { return malformedTravelSegments; }
    public int getDanglingTravelSegments () { return danglingTravelSegments; }
    public int getDuplicateTravelSegments () { return duplicateTravelSegments; }
    public int getMalformedTransfers () { return malformedTransfers; }
    public int getSelfLoopTransfers () { return selfLoopTransfers; }
    public int getDanglingTransfers () { return danglingTransfers; }
    public int getDefaultedTransfers () { return defaultedTransfers; }
    public int getTravelEdgesReplacedByTransfers () { return travelEdgesReplacedByTransfers; }

    /** Total number of records skipped because required fields were missing or unusable. */
    public int getMalformedRecords () {
        return malformedStops + duplicateStops + malformedTravelSegments + malformedTransfers;
    }

    void log (Logger log) {
        log.info("Station graph built: {} stations, {} travel edges, {} transfer edges.",
                stations, travelEdges, transferEdges);
        if (getMalformedRecords() > 0) {
            log.warn("Skipped malformed records: {} stops without id, {} duplicate stops, {} travel segments, {} transfers.",
                    malformedStops, duplicateStops, malformedTravelSegments, malformedTransfers);
        }
        if (danglingTravelSegments + danglingTransfers > 0) {
            log.warn("Skipped {} travel segments and {} transfers referring to unknown stops.",
                    danglingTravelSegments, danglingTransfers);
        }
        log.info("{} self-loop transfers skipped, {} transfers given the default time, " +
                "{} travel edges replaced by transfers.",
                selfLoopTransfers, defaultedTransfers, travelEdgesReplacedByTransfers);
    }

    @Override
    public String toString () {
        return String.format("BuildStatistics{stations=%d, travelEdges=%d, transferEdges=%d, malformed=%d, " +
                        "danglingTravel=%d, danglingTransfers=%d, selfLoops=%d, defaulted=%d, replacedTravel=%d}",
                stations, travelEdges, transferEdges, getMalformedRecords(), danglingTravelSegments,
                danglingTransfers, selfLoopTransfers, defaultedTransfers, travelEdgesReplacedByTransfers);
    }

}
