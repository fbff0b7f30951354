package edu.yu.idxcheck.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Process-wide harness configuration. Defaults are read from the
 * {@value #RESOURCE_NAME} classpath resource the first time the singleton is
 * touched; tests replace them wholesale via {@link #setConfiguration(Properties)}.
 */
public enum HarnessConfiguration {

    INSTANCE;

    public static final String RESOURCE_NAME = "idxcheck.properties";

    public static final String THREAD_NUM = "idxcheck.threadNum";
    public static final String EXEC_NUM = "idxcheck.execNum";
    public static final String RANDOM_SEED = "idxcheck.randomSeed";
    public static final String SETTLE_MILLIS = "idxcheck.settleMillis";
    public static final String EPOCH_INTERVAL_MICROS = "idxcheck.epochIntervalMicros";
    public static final String REPEAT_NUM = "idxcheck.repeatNum";

    private static final Logger logger = LogManager.getLogger(HarnessConfiguration.class);

    private volatile Properties properties;

    HarnessConfiguration() {
        this.properties = loadDefaults();
    }

    /**
     * Build the built-in defaults, then overlay whatever the classpath resource
     * supplies.
     *
     * @return the default properties
     */
    private static Properties loadDefaults() {
        Properties defaults = new Properties();
        defaults.setProperty(THREAD_NUM, "8");
        defaults.setProperty(EXEC_NUM, "1000");
        defaults.setProperty(RANDOM_SEED, "20");
        defaults.setProperty(SETTLE_MILLIS, "100");
        defaults.setProperty(EPOCH_INTERVAL_MICROS, "1000");
        defaults.setProperty(REPEAT_NUM, "5");

        try (InputStream in = HarnessConfiguration.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            // runs from the enum constructor, before the static logger exists
            if (in != null) {
                defaults.load(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Couldn't read " + RESOURCE_NAME, e);
        }

        return defaults;
    }

    /**
     * Replace the active configuration. Keys missing from {@code props} fall back
     * to the defaults.
     *
     * @param props
     */
    public void setConfiguration(Properties props) {
        if (props == null) {
            throw new IllegalArgumentException("Properties can't be null");
        }

        Properties merged = loadDefaults();
        merged.putAll(props);
        this.properties = merged;

        logger.info("Harness configuration updated: {}", merged);
    }

    /**
     * Restore the defaults read from the classpath.
     */
    public void reset() {
        this.properties = loadDefaults();
    }

    public int threadNum() {
        return positiveInt(THREAD_NUM);
    }

    public int execNum() {
        return positiveInt(EXEC_NUM);
    }

    public long randomSeed() {
        return nonNegativeLong(RANDOM_SEED);
    }

    public long settleMillis() {
        return nonNegativeLong(SETTLE_MILLIS);
    }

    /**
     * @return the reference index's epoch ticker period, 0 to disable it
     */
    public long epochIntervalMicros() {
        return nonNegativeLong(EPOCH_INTERVAL_MICROS);
    }

    public int repeatNum() {
        return positiveInt(REPEAT_NUM);
    }

    private int positiveInt(String key) {
        long value = parse(key);
        if (value <= 0 || value > Integer.MAX_VALUE) {
            throw new IllegalStateException("Config value for " + key + " must be a positive int");
        }
        return (int) value;
    }

    private long nonNegativeLong(String key) {
        long value = parse(key);
        if (value < 0) {
            throw new IllegalStateException("Config value for " + key + " must be >= 0");
        }
        return value;
    }

    private long parse(String key) {
        String raw = this.properties.getProperty(key);
        if (raw == null) {
            throw new IllegalStateException("Config is missing " + key);
        }

        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Config value for " + key + " isn't a number: " + raw, e);
        }
    }
}
