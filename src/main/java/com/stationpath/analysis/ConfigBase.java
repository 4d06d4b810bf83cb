package com.stationpath.analysis;

import com.google.common.primitives.Doubles;
import com.google.common.primitives.Ints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Base class for configuration read from a properties file. Every option is required: the example file shipped
 * with the project lists them all, and there are no hidden defaults.
 *
 * Any option can be overridden by an environment variable or a system property whose name carries the
 * "stationpath" prefix, in upper or lower case, with dots, dashes or underscores as separators. For example
 * STATIONPATH_SEARCH_TIMEOUT_SECONDS=5 or -Dstationpath.search.timeout.seconds=5 both set search-timeout-seconds.
 * System properties win over environment variables, which win over the file.
 *
 * The *Prop methods never throw. Problems are logged and collected, so that a single run reports all of them.
 */
public abstract class ConfigBase {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigBase.class);

    public static final String PROPERTY_PREFIX = "stationpath-";

    private final Properties properties;

    /** Keys that were missing or held unusable values, sorted for reporting. */
    protected final Set<String> keysWithErrors = new TreeSet<>();

    protected ConfigBase (Properties properties) {
        this.properties = properties;
        applyOverrides(System.getenv(), "environment variable");
        applyOverrides(System.getProperties(), "system property");
    }

    protected static Properties propsFromFile (String filename) {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(Paths.get(filename), StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException e) {
            throw new RuntimeException("Could not load configuration properties from " + filename, e);
        }
        return properties;
    }

    protected String strProp (String key) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            LOG.error("Missing configuration option {}", key);
            keysWithErrors.add(key);
            return null;
        }
        return value.trim();
    }

    protected int intProp (String key) {
        Integer value = parsedProp(key, Ints::tryParse, "an integer");
        return value == null ? 0 : value;
    }

    /** Infinities and NaN are rejected along with unparseable text. */
    protected double doubleProp (String key) {
        Double value = parsedProp(key, text -> {
            Double parsed = Doubles.tryParse(text);
            return parsed != null && Double.isFinite(parsed) ? parsed : null;
        }, "a finite number");
        return value == null ? 0 : value;
    }

    /** The parser returns null for text it cannot interpret. */
    private <T> T parsedProp (String key, Function<String, T> parser, String expected) {
        String text = strProp(key);
        if (text == null) return null;
        T value = parser.apply(text);
        if (value == null) {
            invalidProp(key, String.format("'%s' is not %s", text, expected));
        }
        return value;
    }

    /** Record an option that was present but is unusable. */
    protected void invalidProp (String key, String reason) {
        LOG.error("Configuration option {} is invalid: {}", key, reason);
        keysWithErrors.add(key);
    }

    /** Call once all options have been read. Shuts down the JVM if any of them were missing or invalid. */
    protected void exitIfErrors () {
        if (!keysWithErrors.isEmpty()) {
            LOG.error("Please provide valid values for these configuration options: {}",
                    String.join(", ", keysWithErrors));
            System.exit(1);
        }
    }

    private void applyOverrides (Map<?, ?> source, String sourceDescription) {
        source.forEach((name, value) -> {
            // Properties are an Object-Object map. Normalize names to lower case with dash separators.
            String normalized = ((String) name).toLowerCase().replaceAll("[._-]", "-");
            if (!normalized.startsWith(PROPERTY_PREFIX)) return;
            String key = normalized.substring(PROPERTY_PREFIX.length());
            LOG.info("{} config key {} with '{}' from {}.",
                    properties.containsKey(key) ? "Overriding" : "Setting", key, value, sourceDescription);
            properties.setProperty(key, (String) value);
        });
    }

}
