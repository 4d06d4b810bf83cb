package com.stationpath.gtfs.model;

/**
 * One row of the stops table. Coordinates are null when the store holds no value for them.
 */
public class Stop {

    public String stop_id;
    public String stop_name;
    public Double stop_lat;
    public Double stop_lon;

    public Stop () { }

    public Stop (String stop_id, String stop_name, Double stop_lat, Double stop_lon) {
        this.stop_id = stop_id;
        this.stop_name = stop_name;
        this.stop_lat = stop_lat;
        this.stop_lon = stop_lon;
    }

    @Override
    public String toString () {
        return String.format("Stop %s (%s) at %s, %s", stop_id, stop_name, stop_lat, stop_lon);
    }

}
