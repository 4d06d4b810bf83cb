package com.stationpath.router.transit;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TObjectIntHashMap;

import java.util.ArrayList;
import java.util.List;

/**
 * A directed graph of stations with at most one edge per ordered pair of stations.
 *
 * Stations are numbered densely in the order they were added, and routing code works on these integer indexes.
 * Outgoing edges of each station are kept in the order the edges were first inserted, so searches expand
 * neighbors in a reproducible order.
 *
 * Instances are only produced by {@link StationGraphBuilder} and are never modified afterward, so a single graph
 * can be shared by any number of concurrent searches without locking.
 */
public class StationGraph {

    private final ImmutableList<Station> stations;

    private final TObjectIntMap<String> indexForStationId;

    private final ImmutableList<ImmutableList<TransitEdge>> outgoingEdges;

    private final ImmutableMap<StationPair, TransitEdge> edgeForPair;

    private final BuildStatistics buildStatistics;

    StationGraph (List<Station> stations, List<TransitEdge> edges, BuildStatistics buildStatistics) {
        this.stations = ImmutableList.copyOf(stations);
        this.indexForStationId = new TObjectIntHashMap<>(stations.size() * 2, 0.5f, -1);
        for (int s = 0; s < stations.size(); s++) {
            indexForStationId.put(stations.get(s).id, s);
        }
        List<ImmutableList.Builder<TransitEdge>> edgeListBuilders = new ArrayList<>(stations.size());
        for (int s = 0; s < stations.size(); s++) {
            edgeListBuilders.add(ImmutableList.builder());
        }
        ImmutableMap.Builder<StationPair, TransitEdge> pairMapBuilder = ImmutableMap.builder();
        for (TransitEdge edge : edges) {
            edgeListBuilders.get(edge.fromIndex).add(edge);
            pairMapBuilder.put(new StationPair(edge.fromStationId, edge.toStationId), edge);
        }
        ImmutableList.Builder<ImmutableList<TransitEdge>> outgoing = ImmutableList.builder();
        for (ImmutableList.Builder<TransitEdge> builder : edgeListBuilders) {
            outgoing.add(builder.build());
        }
        this.outgoingEdges = outgoing.build();
        // buildOrThrow rejects duplicate keys, which enforces the one-edge-per-pair invariant.
        this.edgeForPair = pairMapBuilder.buildOrThrow();
        this.buildStatistics = buildStatistics;
    }

    public int getStationCount () {
        return stations.size();
    }

    public int getEdgeCount () {
        return edgeForPair.size();
    }

    /** @return the index of the station with the given id, or -1 if there is no such station. */
    public int getIndexForStationId (String stationId) {
        if (stationId == null) return -1;
        return indexForStationId.get(stationId);
    }

    public boolean containsStation (String stationId) {
        return getIndexForStationId(stationId) >= 0;
    }

    public Station getStation (int stationIndex) {
        return stations.get(stationIndex);
    }

    /** @return the station with the given id, or null if there is no such station. */
    public Station getStation (String stationId) {
        int index = getIndexForStationId(stationId);
        return index < 0 ? null : stations.get(index);
    }

    public List<Station> getStations () {
        return stations;
    }

    public List<TransitEdge> getOutgoingEdges (int stationIndex) {
        return outgoingEdges.get(stationIndex);
    }

    /** @return the edge from one station to another, or null if they are not directly connected. */
    public TransitEdge getEdge (String fromStationId, String toStationId) {
        return edgeForPair.get(new StationPair(fromStationId, toStationId));
    }

    /** All edges, in insertion order. */
    public Iterable<TransitEdge> getEdges () {
        return edgeForPair.values();
    }

    /** Counts of records used and skipped while this graph was built. */
    public BuildStatistics getBuildStatistics () {
        return buildStatistics;
    }

    @Override
    public String toString () {
        return String.format("StationGraph with %d stations and %d edges", getStationCount(), getEdgeCount());
    }

}
