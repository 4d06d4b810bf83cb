package com.stationpath.gtfs.loader;

import com.stationpath.gtfs.model.Stop;
import com.stationpath.gtfs.model.Transfer;
import com.stationpath.gtfs.model.TravelSegment;

import java.util.List;

/** The three record sets a station graph is built from, as read from the schedule store at one point in time. */
public class ScheduleSnapshot {

    public final List<Stop> stops;
    public final List<TravelSegment> travelSegments;
    public final List<Transfer> transfers;

    public ScheduleSnapshot (List<Stop> stops, List<TravelSegment> travelSegments, List<Transfer> transfers) {
        this.stops = List.copyOf(stops);
        this.travelSegments = List.copyOf(travelSegments);
        this.transfers = List.copyOf(transfers);
    }

}
