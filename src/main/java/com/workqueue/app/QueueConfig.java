package com.workqueue.app;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Settings of the host process.
 *
 * <p>Values come from the classpath resource {@code workqueue.properties}; a
 * system property with the same key ({@code -Dworkqueue.workers=4}) wins over the
 * file. Missing keys fall back to the defaults below.</p>
 */
public class QueueConfig {
    private static final Logger logger = Logger.getLogger(QueueConfig.class.getName());

    static final String RESOURCE = "/workqueue.properties";

    public static final String DB_URL = "workqueue.db.url";
    public static final String DB_USER = "workqueue.db.user";
    public static final String DB_PASSWORD = "workqueue.db.password";
    public static final String DB_POOL_SIZE = "workqueue.db.pool-size";
    public static final String WORKERS = "workqueue.workers";
    public static final String DISPATCH_PERIOD_MS = "workqueue.dispatch.period-ms";
    public static final String HOLD_DELAY_MS = "workqueue.dispatch.hold-delay-ms";
    public static final String CRON_PERIOD_MS = "workqueue.cron.period-ms";
    public static final String SHUTDOWN_TIMEOUT_S = "workqueue.shutdown.timeout-s";
    public static final String DEFAULT_CHANNEL_CAPACITY = "workqueue.default-channel.capacity";
    public static final String ZONE = "workqueue.zone";

    private final Properties properties;

    QueueConfig(Properties properties) {
        this.properties = properties;
    }

    /**
     * Load the classpath file, then apply system property overrides.
     */
    public static QueueConfig load() {
        Properties properties = new Properties();
        try (InputStream in = QueueConfig.class.getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            } else {
                logger.info(RESOURCE + " not found, using defaults");
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + RESOURCE, e);
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("workqueue.")) {
                properties.setProperty(key, System.getProperty(key));
            }
        }
        return new QueueConfig(properties);
    }

    public String getDbUrl() {
        return properties.getProperty(DB_URL, "jdbc:h2:./workqueue;AUTO_SERVER=TRUE");
    }

    public String getDbUser() {
        return properties.getProperty(DB_USER, "sa");
    }

    public String getDbPassword() {
        return properties.getProperty(DB_PASSWORD, "");
    }

    public int getDbPoolSize() {
        return getInt(DB_POOL_SIZE, 10);
    }

    public int getWorkers() {
        return getInt(WORKERS, 8);
    }

    public Duration getDispatchPeriod() {
        return Duration.ofMillis(getInt(DISPATCH_PERIOD_MS, 10));
    }

    public Duration getHoldDelay() {
        return Duration.ofMillis(getInt(HOLD_DELAY_MS, 500));
    }

    public Duration getCronPeriod() {
        return Duration.ofMillis(getInt(CRON_PERIOD_MS, 30_000));
    }

    public Duration getShutdownTimeout() {
        return Duration.ofSeconds(getInt(SHUTDOWN_TIMEOUT_S, 60));
    }

    public int getDefaultChannelCapacity() {
        return getInt(DEFAULT_CHANNEL_CAPACITY, 1);
    }

    public ZoneId getZone() {
        String zone = properties.getProperty(ZONE);
        return zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone.trim());
    }

    private int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    @Override
    public String toString() {
        return "QueueConfig{db=" + getDbUrl() + ", workers=" + getWorkers() + ", dispatchPeriod="
                + getDispatchPeriod().toMillis() + "ms, holdDelay=" + getHoldDelay().toMillis()
                + "ms, cronPeriod=" + getCronPeriod().toMillis() + "ms, zone=" + getZone() + "}";
    }
}
