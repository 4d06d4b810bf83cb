package com.stationpath.gtfs;

import com.csvreader.CsvReader;
import com.google.common.collect.ImmutableSet;
import com.stationpath.gtfs.loader.DateField;
import com.stationpath.gtfs.loader.ScheduleStore;
import com.stationpath.gtfs.loader.TimeField;
import com.stationpath.gtfs.loader.TripSegmentTable;
import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TObjectIntHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Loads the tables of a zipped GTFS feed into an SQLite schedule database and derives the trip segments that
 * route planning is based on.
 *
 * Every table is replaced wholesale. Values are stored as text except for well known numeric columns, and empty
 * values become NULL. Date columns are rewritten from YYYYMMDD to YYYY-MM-DD, and the HH:MM:SS times of stop_times
 * are additionally stored as seconds after midnight in arrival_time_sec and departure_time_sec.
 */
public class FeedImporter {

    private static final Logger LOG = LoggerFactory.getLogger(FeedImporter.class);

    /** Tables copied as they are, in load order. stop_times is handled separately. */
    public static final List<String> STATIC_TABLES =
            List.of("stops", "routes", "trips", "calendar", "calendar_dates", "transfers");

    public static final String STOP_TIMES = "stop_times";

    private static final Set<String> REAL_COLUMNS = ImmutableSet.of("stop_lat", "stop_lon", "shape_dist_traveled");

    private static final Set<String> INTEGER_COLUMNS = ImmutableSet.of(
            "location_type", "wheelchair_boarding", "route_type", "direction_id", "wheelchair_accessible",
            "bikes_allowed", "stop_sequence", "pickup_type", "drop_off_type", "timepoint", "transfer_type",
            "min_transfer_time", "exception_type", "monday", "tuesday", "wednesday", "thursday", "friday",
            "saturday", "sunday", "arrival_time_sec", "departure_time_sec");

    /** Columns with more than this share of empty values are reported after loading. */
    private static final double MISSING_VALUE_REPORT_THRESHOLD = 0.1;

    private static final int BATCH_SIZE = 10_000;

    /** Returned by loadTable for an empty file, for which no table is created. */
    private static final int SKIPPED = -1;

    private final File databaseFile;

    public FeedImporter (File databaseFile) {
        this.databaseFile = databaseFile;
    }

    /**
     * Load the feed into the database, then derive trip_segments. All tables of any previous import are dropped
     * first, so tables whose files are missing or empty in this feed do not survive from an older one.
     * @return the number of rows loaded into each table, including trip_segments. Empty files are left out.
     */
    public TObjectIntMap<String> importFeed (File feedFile) {
        LOG.info("Importing GTFS feed {} into {}", feedFile, databaseFile);
        TObjectIntMap<String> rowsForTable = new TObjectIntHashMap<>();
        try (ZipFile zip = new ZipFile(feedFile);
             Connection connection = DriverManager.getConnection("jdbc:sqlite:" + databaseFile.getAbsolutePath())) {
            connection.setAutoCommit(false);
            try {
                dropPreviousTables(connection);
                for (String table : STATIC_TABLES) {
                    ZipEntry entry = findEntry(zip, table + ".txt");
                    if (entry != null) {
                        int rows = loadTable(zip, entry, table, connection);
                        if (rows != SKIPPED) rowsForTable.put(table, rows);
                    }
                }
                ZipEntry stopTimesEntry = findEntry(zip, STOP_TIMES + ".txt");
                if (stopTimesEntry != null) {
                    int rows = loadTable(zip, stopTimesEntry, STOP_TIMES, connection);
                    if (rows != SKIPPED) {
                        rowsForTable.put(STOP_TIMES, rows);
                        createStopTimesIndexes(connection);
                    }
                }
                if (rowsForTable.containsKey(STOP_TIMES) && rowsForTable.containsKey("trips")) {
                    rowsForTable.put("trip_segments", TripSegmentTable.create(connection));
                } else {
                    LOG.warn("Feed has no stop_times or trips, no trip segments were derived.");
                }
                connection.commit();
            } catch (SQLException | IOException | RuntimeException e) {
                connection.rollback();
                throw e;
            }
        } catch (IOException e) {
            throw new ScheduleStoreException("Could not read GTFS feed " + feedFile, e);
        } catch (SQLException e) {
            throw new ScheduleStoreException("Could not write schedule database " + databaseFile, e);
        }
        LOG.info("Import complete: {}", rowsForTable);
        return rowsForTable;
    }

    /** Tables should be at the root of the zip, but feeds nested in a single subdirectory are also accepted. */
    private static ZipEntry findEntry (ZipFile zip, String fileName) {
        ZipEntry entry = zip.getEntry(fileName);
        if (entry != null) return entry;
        for (Enumeration<? extends ZipEntry> entries = zip.entries(); entries.hasMoreElements(); ) {
            ZipEntry candidate = entries.nextElement();
            if (candidate.getName().endsWith("/" + fileName)) {
                LOG.warn("Table {} was found in a subdirectory of the feed: {}", fileName, candidate.getName());
                return candidate;
            }
        }
        return null;
    }

    private int loadTable (ZipFile zip, ZipEntry entry, String table, Connection connection)
            throws IOException, SQLException {
        CsvReader reader = new CsvReader(zip.getInputStream(entry), ',', StandardCharsets.UTF_8);
        try {
            if (!reader.readHeaders() || reader.getHeaderCount() == 0) {
                LOG.warn("Skipping {}: file is empty.", entry.getName());
                return SKIPPED;
            }
            List<String> headers = new ArrayList<>();
            for (String header : reader.getHeaders()) {
                headers.add(sanitizeColumnName(header));
            }
            boolean stopTimes = STOP_TIMES.equals(table);
            List<String> columns = new ArrayList<>(headers);
            int arrivalColumn = headers.indexOf("arrival_time");
            int departureColumn = headers.indexOf("departure_time");
            if (stopTimes) {
                columns.add("arrival_time_sec");
                columns.add("departure_time_sec");
            }
            createTable(connection, table, columns);

            String insertSql = String.format("INSERT INTO %s VALUES (%s)", table,
                    String.join(", ", Collections.nCopies(columns.size(), "?")));
            int[] missingCounts = new int[headers.size()];
            int rows = 0;
            try (PreparedStatement insert = connection.prepareStatement(insertSql)) {
                while (reader.readRecord()) {
                    for (int c = 0; c < headers.size(); c++) {
                        String value = c < reader.getColumnCount() ? reader.get(c) : null;
                        if (value != null && DateField.isDateColumn(headers.get(c))) {
                            value = DateField.normalize(value);
                        }
                        if (value == null || value.isBlank()) {
                            missingCounts[c]++;
                            insert.setNull(c + 1, Types.NULL);
                        } else {
                            insert.setString(c + 1, value);
                        }
                    }
                    if (stopTimes) {
                        setSeconds(insert, headers.size() + 1, arrivalColumn < 0 ? null : reader.get(arrivalColumn));
                        setSeconds(insert, headers.size() + 2, departureColumn < 0 ? null : reader.get(departureColumn));
                    }
                    insert.addBatch();
                    rows += 1;
                    if (rows % BATCH_SIZE == 0) {
                        insert.executeBatch();
                        LOG.debug("Loaded {} rows into {}", rows, table);
                    }
                }
                insert.executeBatch();
            }
            LOG.info("Loaded {} rows into {}.", rows, table);
            reportMissingValues(table, headers, missingCounts, rows);
            return rows;
        } finally {
            reader.close();
        }
    }

    private static void setSeconds (PreparedStatement insert, int oneBasedIndex, String hhmmss) throws SQLException {
        Integer seconds = TimeField.getSeconds(hhmmss);
        if (seconds == null) insert.setNull(oneBasedIndex, Types.INTEGER);
        else insert.setInt(oneBasedIndex, seconds);
    }

    private static void dropPreviousTables (Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            for (String table : STATIC_TABLES) {
                statement.executeUpdate("DROP TABLE IF EXISTS " + table);
            }
            statement.executeUpdate("DROP TABLE IF EXISTS " + STOP_TIMES);
            statement.executeUpdate("DROP TABLE IF EXISTS " + ScheduleStore.TRIP_SEGMENTS_TABLE);
        }
    }

    private static void createTable (Connection connection, String table, List<String> columns) throws SQLException {
        String declarations = columns.stream()
                .map(column -> column + " " + sqlType(column))
                .collect(Collectors.joining(", "));
        try (Statement statement = connection.createStatement()) {
            statement.executeUpdate("DROP TABLE IF EXISTS " + table);
            statement.executeUpdate(String.format("CREATE TABLE %s (%s)", table, declarations));
        }
    }

    private static void createStopTimesIndexes (Connection connection) throws SQLException {
        LOG.info("Creating stop_times indexes...");
        try (Statement statement = connection.createStatement()) {
            statement.executeUpdate("CREATE INDEX IF NOT EXISTS idx_trip_seq ON stop_times (trip_id, stop_sequence)");
            statement.executeUpdate("CREATE INDEX IF NOT EXISTS idx_stop_id ON stop_times (stop_id)");
        }
    }

    static String sqlType (String column) {
        if (REAL_COLUMNS.contains(column)) return "REAL";
        if (INTEGER_COLUMNS.contains(column)) return "INTEGER";
        return "TEXT";
    }

    /**
     * Column names are interpolated into SQL, so anything but letters, digits and underscores is replaced.
     * Also strips the byte order mark some feeds put at the start of the header line.
     */
    static String sanitizeColumnName (String header) {
        String name = header.replace("\uFEFF", "").trim().toLowerCase();
        String safe = name.replaceAll("[^a-z0-9_]", "_");
        if (safe.isEmpty() || Character.isDigit(safe.charAt(0))) safe = "_" + safe;
        if (!safe.equals(name)) {
            LOG.warn("Column header '{}' is not safe in SQL, renamed to {}", header, safe);
        }
        return safe;
    }

    private static void reportMissingValues (String table, List<String> headers, int[] missingCounts, int rows) {
        if (rows == 0) return;
        for (int c = 0; c < headers.size(); c++) {
            double missingShare = missingCounts[c] / (double) rows;
            if (missingShare > MISSING_VALUE_REPORT_THRESHOLD) {
                LOG.info("Column {}.{} is missing {}% of its values.", table, headers.get(c),
                        String.format("%.2f", missingShare * 100));
            }
        }
    }

}
