package com.stationpath.gtfs.loader;

import com.stationpath.gtfs.model.Stop;
import com.stationpath.gtfs.model.Transfer;
import com.stationpath.gtfs.model.TravelSegment;
import gnu.trove.map.TObjectIntMap;

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Copies the columns of one result row into a model object.
 *
 * Numeric columns that are NULL or hold text that does not parse as a number are populated as null rather than
 * throwing. A single bad row should not abort reading the whole table; the graph builder decides what to do with
 * incomplete records and counts them.
 */
public interface EntityPopulator<T> {

    public T populate (ResultSet results, TObjectIntMap<String> columnForName) throws SQLException;

    public static final EntityPopulator<Stop> STOP = (result, columnForName) -> {
        Stop stop = new Stop();
        stop.stop_id   = getStringIfPresent (result, "stop_id", columnForName);
        stop.stop_name = getStringIfPresent (result, "stop_name", columnForName);
        stop.stop_lat  = getDoubleIfPresent (result, "stop_lat", columnForName);
        stop.stop_lon  = getDoubleIfPresent (result, "stop_lon", columnForName);
        return stop;
    };

    public static final EntityPopulator<TravelSegment> TRAVEL_SEGMENT = (result, columnForName) -> {
        TravelSegment segment = new TravelSegment();
        segment.from_stop_id = getStringIfPresent (result, "from_stop_id", columnForName);
        segment.to_stop_id   = getStringIfPresent (result, "to_stop_id", columnForName);
        segment.weight       = getIntegerIfPresent(result, "weight", columnForName);
        segment.route_id     = getStringIfPresent (result, "route_id", columnForName);
        return segment;
    };

    public static final EntityPopulator<Transfer> TRANSFER = (result, columnForName) -> {
        Transfer transfer = new Transfer();
        transfer.from_stop_id      = getStringIfPresent (result, "from_stop_id", columnForName);
        transfer.to_stop_id        = getStringIfPresent (result, "to_stop_id", columnForName);
        transfer.min_transfer_time = getIntegerIfPresent(result, "min_transfer_time", columnForName);
        return transfer;
    };

    // The columnForName map is passed in because resultSet.getX(columnName) throws an exception when the column is
    // not present. Column indexes are one-based, so zero (the map's no-entry value) means the column is absent.

    public static String getStringIfPresent (ResultSet resultSet, String columnName,
                                             TObjectIntMap<String> columnForName) throws SQLException {
        int columnIndex = columnForName.get(columnName);
        if (columnIndex == 0) return null;
        else return resultSet.getString(columnIndex);
    }

    public static Double getDoubleIfPresent (ResultSet resultSet, String columnName,
                                             TObjectIntMap<String> columnForName) throws SQLException {
        String value = getStringIfPresent(resultSet, columnName, columnForName);
        if (value == null || value.isBlank()) return null;
        try {
            double d = Double.parseDouble(value.trim());
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * SQLite is dynamically typed, so a duration column may come back as "120", "120.0" or garbage.
     * Whole numbers stored as reals are accepted, anything else becomes null.
     */
    public static Integer getIntegerIfPresent (ResultSet resultSet, String columnName,
                                               TObjectIntMap<String> columnForName) throws SQLException {
        Double value = getDoubleIfPresent(resultSet, columnName, columnForName);
        if (value == null) return null;
        if (value != Math.rint(value) || Math.abs(value) > Integer.MAX_VALUE) return null;
        return value.intValue();
    }

}
