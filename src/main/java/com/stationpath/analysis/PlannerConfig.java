package com.stationpath.analysis;

import com.stationpath.router.TransitPlanner;

import java.util.Properties;

/**
 * Loads and validates the configuration of a planning session. See planner.properties at the root of the repo for
 * an example containing every key.
 */
public class PlannerConfig extends ConfigBase implements TransitPlanner.Config {

    public static final String PLANNER_CONFIG_FILE = "planner.properties";

    private final String databaseFile;
    private final int defaultTransferSeconds;
    private final double earthRadiusMeters;
    private final double assumedSpeedMetersPerSecond;
    private final int searchTimeoutSeconds;

    public static PlannerConfig fromDefaultFile () {
        return fromFile(PLANNER_CONFIG_FILE);
    }

    public static PlannerConfig fromFile (String filename) {
        return fromProperties(propsFromFile(filename));
    }

    /** Read and validate all options, shutting down the JVM if any of them are missing or invalid. */
    public static PlannerConfig fromProperties (Properties properties) {
        PlannerConfig config = new PlannerConfig(properties);
        config.exitIfErrors();
        return config;
    }

    /** Reads all options and records problems, leaving it to the caller to check them. */
    PlannerConfig (Properties properties) {
        super(properties);
        databaseFile = strProp("database-file");
        defaultTransferSeconds = intProp("default-transfer-seconds");
        earthRadiusMeters = doubleProp("earth-radius-meters");
        assumedSpeedMetersPerSecond = doubleProp("assumed-speed-meters-per-second");
        searchTimeoutSeconds = intProp("search-timeout-seconds");
        if (defaultTransferSeconds < 0) invalidProp("default-transfer-seconds", "must not be negative");
        if (earthRadiusMeters <= 0) invalidProp("earth-radius-meters", "must be positive");
        if (assumedSpeedMetersPerSecond <= 0) invalidProp("assumed-speed-meters-per-second", "must be positive");
        if (searchTimeoutSeconds < 0) invalidProp("search-timeout-seconds", "must not be negative");
    }

    // INTERFACE IMPLEMENTATIONS
    // Methods implementing the Config interface of the planning session.

    @Override public String databaseFile () { return databaseFile; }
    @Override public int defaultTransferSeconds () { return defaultTransferSeconds; }
    @Override public double earthRadiusMeters () { return earthRadiusMeters; }
    @Override public double assumedSpeedMetersPerSecond () { return assumedSpeedMetersPerSecond; }
    @Override public int searchTimeoutSeconds () { return searchTimeoutSeconds; }

}
