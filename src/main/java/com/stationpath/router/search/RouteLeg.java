package com.stationpath.router.search;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.stationpath.router.transit.TransitEdge;

/** One traversed edge of a route, for display. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RouteLeg {

    public final String fromStationId;
    public final String toStationId;
    public final TransitEdge.Kind kind;
    public final int weightSeconds;
    public final String routeId;

    public RouteLeg (TransitEdge edge) {
        this.fromStationId = edge.fromStationId;
        this.toStationId = edge.toStationId;
        this.kind = edge.kind;
        this.weightSeconds = edge.weightSeconds;
        this.routeId = edge.routeId;
    }

    @Override
    public String toString () {
        return String.format("%s -> %s %s %ds", fromStationId, toStationId,
                kind == TransitEdge.Kind.TRAVEL ? "route " + routeId : "transfer", weightSeconds);
    }

}
