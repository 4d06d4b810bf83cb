package com.stationpath.gtfs.loader;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

/**
 * A GTFS date in the numeric format YYYYMMDD, stored in the schedule database in ISO format YYYY-MM-DD.
 */
public abstract class DateField {

    /** Strict resolution rejects dates such as February 30th instead of moving them to the end of the month. */
    private static final DateTimeFormatter gtfsDateFormat =
            DateTimeFormatter.ofPattern("uuuuMMdd").withResolverStyle(ResolverStyle.STRICT);

    /** True for columns treated as dates, e.g. date, start_date and end_date. */
    public static boolean isDateColumn (String columnName) {
        return columnName.toLowerCase().contains("date");
    }

    /** @return the date in ISO format, or null if the string is not a valid YYYYMMDD date. */
    public static String normalize (String yyyymmdd) {
        if (yyyymmdd == null || yyyymmdd.isBlank()) return null;
        try {
            return LocalDate.parse(yyyymmdd.trim(), gtfsDateFormat).toString();
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

}
