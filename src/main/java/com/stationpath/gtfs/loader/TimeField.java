package com.stationpath.gtfs.loader;

/**
 * A GTFS time in the format HH:MM:SS, converted to a number of seconds after midnight of the service day.
 * Hours may exceed 23 for trips that run past midnight, so "25:30:00" is 91800. Single digit hours are accepted.
 */
public abstract class TimeField {

    /** Service days are at most two calendar days long. Larger hours are garbage and could overflow. */
    private static final int MAX_HOURS = 47;

    /** @return seconds after midnight, or null if the string is empty or not a valid time. */
    public static Integer getSeconds (String hhmmss) {
        if (hhmmss == null) return null;
        String[] fields = hhmmss.trim().split(":");
        if (fields.length != 3) return null;
        try {
            int h = Integer.parseInt(fields[0]);
            int m = Integer.parseInt(fields[1]);
            int s = Integer.parseInt(fields[2]);
            if (h < 0 || h > MAX_HOURS || m < 0 || m > 59 || s < 0 || s > 59) return null;
            return ((h * 60) + m) * 60 + s;
        } catch (NumberFormatException e) {
            return null;
        }
    }

}
