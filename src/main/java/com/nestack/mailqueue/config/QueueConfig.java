package com.nestack.mailqueue.config;

import java.io.IOException;
import java.util.Map;

/**
 * Email queue configuration.
 *
 * <p>This class provides type safe access to the queue configuration, usually {@code cfg/queue.json5}.
 * <p>Defaults match the outbound SMTP relay limits: 100 recipients per hour, 1,000 per day.
 */
public class QueueConfig extends ConfigFoundation {

    /**
     * Constructs a new QueueConfig instance with all defaults.
     */
    public QueueConfig() {
        super();
    }

    /**
     * Constructs a new QueueConfig instance with configuration map.
     *
     * @param map Configuration map.
     */
    public QueueConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new QueueConfig instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public QueueConfig(String path) throws IOException {
        super(path);
    }

    /**
     * Gets sends allowed within a trailing hour.
     *
     * @return Hourly limit.
     */
    public int getHourlyLimit() {
        return Math.toIntExact(getLongProperty("hourlyLimit", 100L));
    }

    /**
     * Gets sends allowed within a trailing day.
     *
     * @return Daily limit.
     */
    public int getDailyLimit() {
        return Math.toIntExact(getLongProperty("dailyLimit", 1000L));
    }

    /**
     * Gets total attempts after which a failing email is dropped.
     *
     * @return Max attempts.
     */
    public int getMaxAttempts() {
        return Math.toIntExact(getLongProperty("maxAttempts", 3L));
    }

    /**
     * Gets retry base delay.
     * <p>Scaled by attempt count when no explicit delay is given.
     *
     * @return Delay in milliseconds.
     */
    public long getRetryDelayMs() {
        return getLongProperty("retryDelayMs", 5000L);
    }

    /**
     * Gets pause between consecutive sends while draining the queue.
     *
     * @return Pause in milliseconds.
     */
    public long getSendIntervalMs() {
        return getLongProperty("sendIntervalMs", 100L);
    }

    /**
     * Gets queue cron configuration.
     *
     * @return BasicConfig instance.
     */
    public BasicConfig getCron() {
        return new BasicConfig(getMapProperty("cron"));
    }

    /**
     * Is queue cron enabled.
     *
     * @return Boolean.
     */
    public boolean isCronEnabled() {
        return getCron().getBooleanProperty("enabled", false);
    }

    /**
     * Gets queue cron initial delay.
     *
     * @return Time in seconds.
     */
    public int getCronInitialDelaySeconds() {
        return Math.toIntExact(getCron().getLongProperty("initialDelaySeconds", 10L));
    }

    /**
     * Gets queue cron interval.
     *
     * @return Time in seconds.
     */
    public int getCronIntervalSeconds() {
        return Math.toIntExact(getCron().getLongProperty("intervalSeconds", 30L));
    }

    /**
     * Gets maximum emails attempted per cron tick.
     *
     * @return Batch size.
     */
    public int getCronMaxPerTick() {
        return Math.toIntExact(getCron().getLongProperty("maxPerTick", 10L));
    }
}
