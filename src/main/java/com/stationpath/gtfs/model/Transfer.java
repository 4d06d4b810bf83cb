package com.stationpath.gtfs.model;

/**
 * One row of the transfers table. A null or non-positive min_transfer_time means the default transfer time applies.
 */
public class Transfer {

    public String from_stop_id;
    public String to_stop_id;
    public Integer min_transfer_time;

    public Transfer () { }

    public Transfer (String from_stop_id, String to_stop_id, Integer min_transfer_time) {
        this.from_stop_id = from_stop_id;
        this.to_stop_id = to_stop_id;
        this.min_transfer_time = min_transfer_time;
    }

    @Override
    public String toString () {
        return String.format("Transfer %s -> %s, min %s sec", from_stop_id, to_stop_id, min_transfer_time);
    }

}
