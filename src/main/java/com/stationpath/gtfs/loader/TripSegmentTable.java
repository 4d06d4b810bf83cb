package com.stationpath.gtfs.loader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashSet;
import java.util.Set;

/**
 * Derives the trip_segments table from stop_times and trips: one row for every pair of consecutive stops on a trip,
 * with the scheduled time between departing the first and arriving at the second.
 *
 * Consecutive stop times are paired with the LEAD window function partitioned by trip and ordered by stop sequence,
 * which requires SQLite 3.25 or later. The last stop of each trip has no successor and produces no row.
 */
public abstract class TripSegmentTable {

    private static final Logger LOG = LoggerFactory.getLogger(TripSegmentTable.class);

    static final String CREATE_SQL =
            "CREATE TABLE " + ScheduleStore.TRIP_SEGMENTS_TABLE + " AS " +
            "WITH ordered_stops AS (" +
            "  SELECT trip_id, stop_id AS from_stop_id, departure_time_sec AS start_time_sec, stop_sequence," +
            "    LEAD(stop_id) OVER (PARTITION BY trip_id ORDER BY stop_sequence) AS to_stop_id," +
            "    LEAD(arrival_time_sec) OVER (PARTITION BY trip_id ORDER BY stop_sequence) AS end_time_sec" +
            "  FROM stop_times" +
            ") " +
            "SELECT os.trip_id, os.from_stop_id, os.to_stop_id, os.start_time_sec, os.end_time_sec," +
            "  (os.end_time_sec - os.start_time_sec) AS duration_sec," +
            "  t.route_id, %s AS service_id, %s AS direction_id " +
            "FROM ordered_stops os JOIN trips t ON os.trip_id = t.trip_id " +
            "WHERE os.to_stop_id IS NOT NULL";

    /**
     * Replace any existing trip_segments table with one derived from the current stop_times and trips tables.
     * @return the number of segments created.
     */
    public static int create (Connection connection) throws SQLException {
        Set<String> tripColumns = columnNames(connection, "trips");
        // service_id and direction_id are carried along for analysis only, and direction_id is optional in GTFS.
        String sql = String.format(CREATE_SQL,
                tripColumns.contains("service_id") ? "t.service_id" : "NULL",
                tripColumns.contains("direction_id") ? "t.direction_id" : "NULL");
        try (Statement statement = connection.createStatement()) {
            LOG.info("Deriving {} from stop_times...", ScheduleStore.TRIP_SEGMENTS_TABLE);
            statement.executeUpdate("DROP TABLE IF EXISTS " + ScheduleStore.TRIP_SEGMENTS_TABLE);
            statement.executeUpdate(sql);
            try (ResultSet count = statement.executeQuery("SELECT COUNT(*) FROM " + ScheduleStore.TRIP_SEGMENTS_TABLE)) {
                int segments = count.next() ? count.getInt(1) : 0;
                LOG.info("Created {} trip segments.", segments);
                return segments;
            }
        }
    }

    private static Set<String> columnNames (Connection connection, String table) throws SQLException {
        Set<String> names = new HashSet<>();
        try (ResultSet columns = connection.getMetaData().getColumns(null, null, table, null)) {
            while (columns.next()) {
                names.add(columns.getString("COLUMN_NAME").toLowerCase());
            }
        }
        return names;
    }

}
