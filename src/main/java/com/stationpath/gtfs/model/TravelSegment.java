package com.stationpath.gtfs.model;

/**
 * Minimum scheduled in-vehicle duration between two stops that follow one another on at least one trip.
 * The weight is null when the stored duration was missing or could not be parsed.
 */
public class TravelSegment {

    public String from_stop_id;
    public String to_stop_id;
    public Integer weight;
    public String route_id;

    public TravelSegment () { }

    public TravelSegment (String from_stop_id, String to_stop_id, Integer weight, String route_id) {
        this.from_stop_id = from_stop_id;
        this.to_stop_id = to_stop_id;
        this.weight = weight;
        this.route_id = route_id;
    }

    @Override
    public String toString () {
        return String.format("TravelSegment %s -> %s, %s sec on route %s", from_stop_id, to_stop_id, weight, route_id);
    }

}
