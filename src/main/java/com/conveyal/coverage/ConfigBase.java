package com.conveyal.coverage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileReader;
import java.io.Reader;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Shared functionality for loading properties containing configuration information and exposing them through the
 * Config interfaces of Components. Any interpretation or conditional logic belongs in the Components themselves.
 *
 * An example config file is shipped in the repo, so it's easy to see an exhaustive list of all parameters. All
 * configuration parameters are therefore required, to avoid any confusion due to merging layers of defaults.
 */
public class ConfigBase {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigBase.class);

    public static final String PROPERTY_PREFIX = "coverage-";

    // All access to these should be through the *Prop methods.
    private final Properties properties;

    protected final Set<String> keysWithErrors = new TreeSet<>();

    /**
     * Prepare to load config from the given properties, overriding from environment variables and system properties.
     * In the latter two sources, the keys may be in upper or lower case and use dashes, underscores, or dots as
     * separators, and must be prefixed with "coverage", e.g. COVERAGE_FETCH_THREADS=8 or -Dcoverage.fetch.threads=8.
     * Precedence of configuration sources is: system properties > environment variables > config file.
     */
    protected ConfigBase (Properties properties) {
        this(properties, System.getenv(), System.getProperties());
    }

    protected ConfigBase (Properties properties, Map<?, ?> environment, Map<?, ?> systemProperties) {
        this.properties = new Properties();
        this.properties.putAll(properties);
        setPropertiesFromMap(environment, "environment variable");
        setPropertiesFromMap(systemProperties, "system properties");
    }

    /** Static convenience method to uniformly load files into properties and catch errors. */
    protected static Properties propsFromFile (String filename) {
        try (Reader propsReader = new FileReader(filename)) {
            Properties properties = new Properties();
            properties.load(propsReader);
            return properties;
        } catch (Exception e) {
            throw new RuntimeException("Could not load configuration properties from " + filename, e);
        }
    }

    // Always use the following *Prop methods to read properties. They record missing keys and parse errors, allowing
    // config loading to continue and reporting as many problems as possible at once.

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
        String val = strProp(key);
        if (val != null) {
            try {
                return Integer.parseInt(val);
            } catch (NumberFormatException nfe) {
                LOG.error("Value of configuration option '{}' could not be parsed as an integer: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return 0;
    }

    protected long longProp (String key) {
        String val = strProp(key);
        if (val != null) {
            try {
                return Long.parseLong(val.replace("_", ""));
            } catch (NumberFormatException nfe) {
                LOG.error("Value of configuration option '{}' could not be parsed as an integer: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return 0;
    }

    /** An integer option that must be at least one. */
    protected int positiveIntProp (String key) {
        int value = intProp(key);
        if (value < 1 && !keysWithErrors.contains(key)) {
            LOG.error("Value of configuration option '{}' must be positive: {}", key, value);
            keysWithErrors.add(key);
        }
        return value;
    }

    /** Call this after reading all properties to enforce the presence of all configuration options. */
    protected void exitIfErrors () {
        if (!keysWithErrors.isEmpty()) {
            LOG.error("You must provide valid values for these configuration properties: {}",
                    String.join(", ", keysWithErrors));
            System.exit(1);
        }
    }

    /** Like exitIfErrors, but for configuration built in code, where the caller should handle the failure. */
    protected void throwIfErrors () {
        if (!keysWithErrors.isEmpty()) {
            throw new IllegalArgumentException(
                    "Missing or invalid configuration properties: " + String.join(", ", keysWithErrors));
        }
    }

    /**
     * Overwrite configuration options supplied in the config file with environment variables and system properties.
     * Case and separators are normalized to conform to both properties and environment variable conventions.
     */
    private void setPropertiesFromMap (Map<?, ?> map, String sourceDescription) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            // Normalize to String type, all lower case, all dash separators.
            String key = String.valueOf(entry.getKey()).toLowerCase(Locale.ROOT).replaceAll("[\\._-]", "-");
            String value = String.valueOf(entry.getValue());
            if (key.startsWith(PROPERTY_PREFIX)) {
                key = key.substring(PROPERTY_PREFIX.length());
                if (properties.getProperty(key) != null) {
                    LOG.info("Overwriting existing config key {} to '{}' from {}.", key, value, sourceDescription);
                } else {
                    LOG.info("Setting configuration key {} to '{}' from {}.", key, value, sourceDescription);
                }
                properties.setProperty(key, value);
            }
        }
    }

}
