package com.stationpath.router.search;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

/**
 * The result of one route search: either a route, or the reason there is none.
 * Failing searches are ordinary outcomes rather than exceptions, and never carry a partial route.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchOutcome {

    public enum Error {
        /** The origin or destination is not a station of the graph. No search was attempted. */
        NODE_NOT_FOUND,
        /** Every station reachable from the origin was explored without reaching the destination. */
        NO_PATH_FOUND,
        /** The search ran past its time limit before reaching the destination. */
        TIMED_OUT
    }

    public final String origin;

    public final String destination;

    /** Null when the search failed. */
    @JsonProperty("route")
    public final RouteResult route;

    /** Null when the search succeeded. */
    public final Error error;

    public final String message;

    /** How many stations were finalized (settled) during the search. */
    public final int stationsExpanded;

    private SearchOutcome (String origin, String destination, RouteResult route, Error error, String message,
                           int stationsExpanded) {
        this.origin = origin;
        this.destination = destination;
        this.route = route;
        this.error = error;
        this.message = message;
        this.stationsExpanded = stationsExpanded;
    }

    public static SearchOutcome success (String origin, String destination, RouteResult route, int stationsExpanded) {
        Preconditions.checkNotNull(route);
        return new SearchOutcome(origin, destination, route, null, null, stationsExpanded);
    }

    public static SearchOutcome failure (String origin, String destination, Error error, String message,
                                         int stationsExpanded) {
        Preconditions.checkNotNull(error);
        return new SearchOutcome(origin, destination, null, error, message, stationsExpanded);
    }

    @JsonIgnore
    public boolean isSuccess () {
        return route != null;
    }

    /**
     * @return the route found
     * @throws IllegalStateException if the search failed, so that a failure cannot be mistaken for an empty route.
     */
    @JsonIgnore
    public RouteResult getRoute () {
        if (route == null) {
            throw new IllegalStateException(String.format("No route from %s to %s: %s", origin, destination, message));
        }
        return route;
    }

    @Override
    public String toString () {
        if (isSuccess()) return route.toString();
        return String.format("SearchOutcome{%s, %s}", error, message);
    }

}
