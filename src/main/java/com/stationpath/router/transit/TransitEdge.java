package com.stationpath.router.transit;

import com.google.common.base.Preconditions;

/**
 * A directed, weighted connection between two stations of the graph.
 * Stations are referenced both by id and by their index within the graph that holds this edge.
 */
public class TransitEdge {

    public enum Kind {
        /** In-vehicle movement between stations that are consecutive on at least one trip. */
        TRAVEL,
        /** Out-of-vehicle change between nearby stations. */
        TRANSFER
    }

    public final int fromIndex;
    public final int toIndex;
    public final String fromStationId;
    public final String toStationId;
    public final int weightSeconds;
    public final Kind kind;

    /** The route serving a travel edge, always null for transfers. */
    public final String routeId;

    TransitEdge (int fromIndex, int toIndex, String fromStationId, String toStationId,
                 int weightSeconds, Kind kind, String routeId) {
        Preconditions.checkArgument(weightSeconds >= 0, "Edge weight must not be negative: %s", weightSeconds);
        Preconditions.checkArgument(kind == Kind.TRAVEL || routeId == null, "Transfer edges carry no route.");
        this.fromIndex = fromIndex;
        this.toIndex = toIndex;
        this.fromStationId = fromStationId;
        this.toStationId = toStationId;
        this.weightSeconds = weightSeconds;
        this.kind = Preconditions.checkNotNull(kind);
        this.routeId = routeId;
    }

    public boolean isTransfer () {
        return kind == Kind.TRANSFER;
    }

    @Override
    public String toString () {
        if (kind == Kind.TRAVEL) {
            return String.format("%s -> %s (route %s, %ds)", fromStationId, toStationId, routeId, weightSeconds);
        }
        return String.format("%s -> %s (transfer, %ds)", fromStationId, toStationId, weightSeconds);
    }

}
