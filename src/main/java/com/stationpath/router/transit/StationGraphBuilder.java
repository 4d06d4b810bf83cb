package com.stationpath.router.transit;

import com.google.common.base.Preconditions;
import com.stationpath.gtfs.loader.ScheduleSnapshot;
import com.stationpath.gtfs.model.Stop;
import com.stationpath.gtfs.model.Transfer;
import com.stationpath.gtfs.model.TravelSegment;
import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TObjectIntHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives a {@link StationGraph} from schedule records.
 *
 * All stops become stations. Then every travel segment whose endpoints are stations becomes a TRAVEL edge, and
 * after that every transfer between two distinct stations becomes a TRANSFER edge. Each ordered pair of stations
 * holds at most one edge. When a transfer is inserted for a pair that already holds a travel edge, the transfer
 * replaces it and the travel edge is lost, see {@link #putTransferEdge(TransitEdge)}.
 *
 * Records that cannot be turned into stations or edges are skipped and counted in {@link BuildStatistics}.
 * This is a throw-away object: create a new builder for each graph.
 */
public class StationGraphBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(StationGraphBuilder.class);

    /** Transfer time used when the schedule gives none, or gives zero or a negative number. */
    public static final int DEFAULT_TRANSFER_SECONDS = 180;

    private final int defaultTransferSeconds;

    private final List<Station> stations = new ArrayList<>();

    private final TObjectIntMap<String> indexForStationId = new TObjectIntHashMap<>(64, 0.5f, -1);

    /** Insertion ordered, so the graph's edge lists come out in a reproducible order. */
    private final Map<StationPair, TransitEdge> edges = new LinkedHashMap<>();

    private final BuildStatistics statistics = new BuildStatistics();

    private boolean built = false;

    public StationGraphBuilder () {
        this(DEFAULT_TRANSFER_SECONDS);
    }

    public StationGraphBuilder (int defaultTransferSeconds) {
        Preconditions.checkArgument(defaultTransferSeconds >= 0,
                "Default transfer time must not be negative: %s", defaultTransferSeconds);
        this.defaultTransferSeconds = defaultTransferSeconds;
    }

    public StationGraph build (ScheduleSnapshot snapshot) {
        return build(snapshot.stops, snapshot.travelSegments, snapshot.transfers);
    }

    public StationGraph build (List<Stop> stops, List<TravelSegment> travelSegments, List<Transfer> transfers) {
        Preconditions.checkState(!built, "A StationGraphBuilder can only build one graph.");
        built = true;
        LOG.info("Building station graph from {} stops, {} travel segments and {} transfers...",
                stops.size(), travelSegments.size(), transfers.size());
        stops.forEach(this::addStation);
        // Travel edges must all go in before any transfer edge, since transfers overwrite them.
        travelSegments.forEach(this::addTravelSegment);
        transfers.forEach(this::addTransfer);

        for (TransitEdge edge : edges.values()) {
            if (edge.kind == TransitEdge.Kind.TRAVEL) statistics.travelEdges++;
            else statistics.transferEdges++;
        }
        statistics.stations = stations.size();
        statistics.log(LOG);
        return new StationGraph(stations, new ArrayList<>(edges.values()), statistics);
    }

    private void addStation (Stop stop) {
        if (isBlank(stop.stop_id)) {
            statistics.malformedStops++;
            LOG.debug("Skipping stop without id: {}", stop);
            return;
        }
        if (indexForStationId.containsKey(stop.stop_id)) {
            statistics.duplicateStops++;
            LOG.debug("Skipping stop with duplicate id: {}", stop);
            return;
        }
        indexForStationId.put(stop.stop_id, stations.size());
        stations.add(new Station(stop.stop_id, stop.stop_name, stop.stop_lat, stop.stop_lon));
    }

    private void addTravelSegment (TravelSegment segment) {
        if (isBlank(segment.from_stop_id) || isBlank(segment.to_stop_id) ||
                segment.weight == null || segment.weight < 0) {
            statistics.malformedTravelSegments++;
            LOG.debug("Skipping malformed travel segment: {}", segment);
            return;
        }
        int fromIndex = indexForStationId.get(segment.from_stop_id);
        int toIndex = indexForStationId.get(segment.to_stop_id);
        if (fromIndex < 0 || toIndex < 0) {
            statistics.danglingTravelSegments++;
            return;
        }
        putTravelEdge(new TransitEdge(fromIndex, toIndex, segment.from_stop_id, segment.to_stop_id,
                segment.weight, TransitEdge.Kind.TRAVEL, segment.route_id));
    }

    private void addTransfer (Transfer transfer) {
        if (isBlank(transfer.from_stop_id) || isBlank(transfer.to_stop_id)) {
            statistics.malformedTransfers++;
            LOG.debug("Skipping malformed transfer: {}", transfer);
            return;
        }
        if (transfer.from_stop_id.equals(transfer.to_stop_id)) {
            statistics.selfLoopTransfers++;
            return;
        }
        int fromIndex = indexForStationId.get(transfer.from_stop_id);
        int toIndex = indexForStationId.get(transfer.to_stop_id);
        if (fromIndex < 0 || toIndex < 0) {
            statistics.danglingTransfers++;
            return;
        }
        putTransferEdge(new TransitEdge(fromIndex, toIndex, transfer.from_stop_id, transfer.to_stop_id,
                transferSeconds(transfer), TransitEdge.Kind.TRANSFER, null));
    }

    /** The stored minimum transfer time if it is a positive number, otherwise the default. */
    int transferSeconds (Transfer transfer) {
        if (transfer.min_transfer_time != null && transfer.min_transfer_time > 0) {
            return transfer.min_transfer_time;
        }
        statistics.defaultedTransfers++;
        return defaultTransferSeconds;
    }

    /**
     * Travel segments normally arrive already aggregated to one per ordered pair. If the same pair appears again,
     * only the fastest segment is kept, which keeps the edge weight at the minimum scheduled duration.
     */
    private void putTravelEdge (TransitEdge edge) {
        StationPair pair = new StationPair(edge.fromStationId, edge.toStationId);
        TransitEdge existing = edges.get(pair);
        if (existing != null) {
            statistics.duplicateTravelSegments++;
            if (existing.weightSeconds <= edge.weightSeconds) return;
        }
        edges.put(pair, edge);
    }

    /**
     * Insert a transfer edge, replacing whatever edge already connects the same ordered pair of stations.
     *
     * When the replaced edge is a travel edge its in-vehicle time and route are discarded, even if the travel edge
     * was faster than the transfer. Whether travel should take precedence instead is an open question; route
     * results depend on this order, so do not change it without settling that.
     *
     * @return the edge that was replaced, or null if the pair had no edge yet.
     */
    TransitEdge putTransferEdge (TransitEdge edge) {
        TransitEdge replaced = edges.put(new StationPair(edge.fromStationId, edge.toStationId), edge);
        if (replaced != null && replaced.kind == TransitEdge.Kind.TRAVEL) {
            statistics.travelEdgesReplacedByTransfers++;
            LOG.debug("Transfer {} replaces travel edge {}", edge, replaced);
        }
        return replaced;
    }

    private static boolean isBlank (String s) {
        return s == null || s.isBlank();
    }

}
