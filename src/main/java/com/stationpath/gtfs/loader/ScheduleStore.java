package com.stationpath.gtfs.loader;

import com.stationpath.gtfs.ScheduleStoreException;
import com.stationpath.gtfs.model.Stop;
import com.stationpath.gtfs.model.Transfer;
import com.stationpath.gtfs.model.TravelSegment;
import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TObjectIntHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read-only access to the normalized schedule tables in a relational database (SQLite in practice).
 * Each read pulls a complete record set into memory; nothing is held open between calls.
 */
public class ScheduleStore {

    private static final Logger LOG = LoggerFactory.getLogger(ScheduleStore.class);

    public static final String STOPS_TABLE = "stops";
    public static final String TRIP_SEGMENTS_TABLE = "trip_segments";
    public static final String TRANSFERS_TABLE = "transfers";

    static final String STOPS_QUERY = "SELECT * FROM " + STOPS_TABLE;

    /**
     * Minimum scheduled duration for every ordered stop pair served by any trip. When several routes serve a pair,
     * the route label is whichever row the aggregation happens to keep.
     */
    static final String TRAVEL_SEGMENTS_QUERY =
            "SELECT from_stop_id, to_stop_id, MIN(duration_sec) AS weight, route_id " +
            "FROM " + TRIP_SEGMENTS_TABLE + " GROUP BY from_stop_id, to_stop_id";

    static final String TRANSFERS_QUERY = "SELECT * FROM " + TRANSFERS_TABLE;

    private final String jdbcUrl;

    public ScheduleStore (String jdbcUrl) {
        this.jdbcUrl = jdbcUrl;
    }

    /**
     * Open a store on an existing SQLite database file. The file must exist: the SQLite driver would otherwise
     * silently create an empty database.
     */
    public static ScheduleStore forDatabaseFile (File databaseFile) {
        if (!databaseFile.isFile()) {
            throw new ScheduleStoreException("Schedule database not found: " + databaseFile.getAbsolutePath());
        }
        return new ScheduleStore("jdbc:sqlite:" + databaseFile.getAbsolutePath());
    }

    public String getJdbcUrl () {
        return jdbcUrl;
    }

    /** All three record sets read over a single connection, so they describe the same point in time. */
    public ScheduleSnapshot readSnapshot () {
        try (Connection connection = openConnection()) {
            List<Stop> stops = fetchStops(connection);
            List<TravelSegment> travelSegments = fetchTravelSegments(connection);
            List<Transfer> transfers = fetchTransfers(connection);
            LOG.info("Read {} stops, {} travel segments and {} transfers from {}",
                    stops.size(), travelSegments.size(), transfers.size(), jdbcUrl);
            return new ScheduleSnapshot(stops, travelSegments, transfers);
        } catch (SQLException e) {
            throw new ScheduleStoreException("Could not read schedule from " + jdbcUrl, e);
        }
    }

    public List<Stop> fetchStops () {
        try (Connection connection = openConnection()) {
            return fetchStops(connection);
        } catch (SQLException e) {
            throw new ScheduleStoreException("Could not read stops from " + jdbcUrl, e);
        }
    }

    public List<TravelSegment> fetchTravelSegments () {
        try (Connection connection = openConnection()) {
            return fetchTravelSegments(connection);
        } catch (SQLException e) {
            throw new ScheduleStoreException("Could not read travel segments from " + jdbcUrl, e);
        }
    }

    public List<Transfer> fetchTransfers () {
        try (Connection connection = openConnection()) {
            return fetchTransfers(connection);
        } catch (SQLException e) {
            throw new ScheduleStoreException("Could not read transfers from " + jdbcUrl, e);
        }
    }

    private List<Stop> fetchStops (Connection connection) throws SQLException {
        requireTable(connection, STOPS_TABLE);
        List<Stop> stops = fetchAll(connection, STOPS_QUERY, EntityPopulator.STOP);
        if (stops.isEmpty()) {
            throw new ScheduleStoreException("The stops table in " + jdbcUrl + " is empty.");
        }
        return stops;
    }

    private List<TravelSegment> fetchTravelSegments (Connection connection) throws SQLException {
        requireTable(connection, TRIP_SEGMENTS_TABLE);
        return fetchAll(connection, TRAVEL_SEGMENTS_QUERY, EntityPopulator.TRAVEL_SEGMENT);
    }

    // The transfers table is optional in GTFS, so a feed without one simply yields no transfer edges.
    private List<Transfer> fetchTransfers (Connection connection) throws SQLException {
        if (!tableExists(connection, TRANSFERS_TABLE)) {
            LOG.warn("No {} table in {}, the network will have no transfer edges.", TRANSFERS_TABLE, jdbcUrl);
            return Collections.emptyList();
        }
        return fetchAll(connection, TRANSFERS_QUERY, EntityPopulator.TRANSFER);
    }

    private <T> List<T> fetchAll (Connection connection, String sql, EntityPopulator<T> populator)
            throws SQLException {
        List<T> entities = new ArrayList<>();
        try (PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet results = statement.executeQuery()) {
            TObjectIntMap<String> columnForName = columnForName(results.getMetaData());
            while (results.next()) {
                entities.add(populator.populate(results, columnForName));
            }
        }
        LOG.debug("{} rows from query: {}", entities.size(), sql);
        return entities;
    }

    /** Map lower case column labels to one-based column indexes, zero meaning "no such column". */
    private static TObjectIntMap<String> columnForName (ResultSetMetaData metaData) throws SQLException {
        TObjectIntMap<String> columnForName = new TObjectIntHashMap<>(metaData.getColumnCount() * 2, 0.5f, 0);
        for (int c = 1; c <= metaData.getColumnCount(); c++) {
            columnForName.put(metaData.getColumnLabel(c).toLowerCase(), c);
        }
        return columnForName;
    }

    private void requireTable (Connection connection, String tableName) throws SQLException {
        if (!tableExists(connection, tableName)) {
            throw new ScheduleStoreException("Required table " + tableName + " is missing from " + jdbcUrl);
        }
    }

    private static boolean tableExists (Connection connection, String tableName) throws SQLException {
        try (ResultSet tables = connection.getMetaData().getTables(null, null, tableName, null)) {
            return tables.next();
        }
    }

    private Connection openConnection () {
        try {
            return DriverManager.getConnection(jdbcUrl);
        } catch (SQLException e) {
            throw new ScheduleStoreException("Could not connect to schedule store " + jdbcUrl, e);
        }
    }

}
