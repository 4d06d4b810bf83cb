package com.stationpath.gtfs;

/**
 * Thrown when the schedule store cannot be reached, lacks a required table or holds no stops.
 * A planning session cannot continue without its schedule, so callers are expected to report this and stop.
 */
public class ScheduleStoreException extends RuntimeException {

    public ScheduleStoreException (String message) {
        super(message);
    }

    public ScheduleStoreException (String message, Throwable cause) {
        super(message, cause);
    }

}
