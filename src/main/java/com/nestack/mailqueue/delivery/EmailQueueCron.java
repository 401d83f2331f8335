package com.nestack.mailqueue.delivery;

import com.nestack.mailqueue.config.QueueConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Email queue cron job.
 * <p>Periodically drains a bounded batch of emails through an {@link EmailQueueProcessor}.
 * <p>Rate limited ticks simply find nothing to send; the next tick tries again.
 */
public class EmailQueueCron {
    private static final Logger log = LogManager.getLogger(EmailQueueCron.class);

    private final EmailQueueProcessor processor;
    private final EmailSender sender;
    private final int initialDelaySeconds;
    private final int periodSeconds;
    private final int maxPerTick;
    private final boolean enabled;
    private final Clock clock;

    private volatile ScheduledExecutorService scheduler;

    // Timing info.
    private volatile Instant lastExecution;
    private volatile Instant nextExecution;

    /**
     * Constructs an EmailQueueCron from configuration.
     * <p>When {@code cron.enabled} is false {@link #start()} does nothing.
     *
     * @param processor Queue processor.
     * @param sender    Transport.
     * @param config    Queue configuration.
     */
    public EmailQueueCron(EmailQueueProcessor processor, EmailSender sender, QueueConfig config) {
        this(processor, sender, config.getCronInitialDelaySeconds(), config.getCronIntervalSeconds(),
                config.getCronMaxPerTick(), config.isCronEnabled(), Clock.systemUTC());
    }

    /**
     * Constructs an EmailQueueCron.
     *
     * @param processor           Queue processor.
     * @param sender              Transport.
     * @param initialDelaySeconds Delay before the first tick.
     * @param periodSeconds       Interval between ticks.
     * @param maxPerTick          Maximum emails attempted per tick.
     * @param clock               Time source for timing info.
     */
    public EmailQueueCron(EmailQueueProcessor processor, EmailSender sender,
                          int initialDelaySeconds, int periodSeconds, int maxPerTick, Clock clock) {
        this(processor, sender, initialDelaySeconds, periodSeconds, maxPerTick, true, clock);
    }

    private EmailQueueCron(EmailQueueProcessor processor, EmailSender sender,
                           int initialDelaySeconds, int periodSeconds, int maxPerTick, boolean enabled, Clock clock) {
        if (initialDelaySeconds < 0) {
            throw new IllegalArgumentException("initialDelaySeconds must be >= 0, got: " + initialDelaySeconds);
        }
        if (periodSeconds <= 0) {
            throw new IllegalArgumentException("periodSeconds must be > 0, got: " + periodSeconds);
        }
        if (maxPerTick <= 0) {
            throw new IllegalArgumentException("maxPerTick must be > 0, got: " + maxPerTick);
        }
        this.processor = Objects.requireNonNull(processor, "processor");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.initialDelaySeconds = initialDelaySeconds;
        this.periodSeconds = periodSeconds;
        this.maxPerTick = maxPerTick;
        this.enabled = enabled;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Starts the cron job.
     * <p>Calling start on a running or disabled job has no effect.
     */
    public synchronized void start() {
        if (!enabled) {
            log.info("EmailQueueCron disabled by configuration");
            return;
        }
        if (scheduler != null) {
            return; // Already running.
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "EmailQueueCron");
            thread.setDaemon(true);
            return thread;
        });

        nextExecution = clock.instant().plusSeconds(initialDelaySeconds);
        scheduler.scheduleAtFixedRate(this::tick, initialDelaySeconds, periodSeconds, TimeUnit.SECONDS);
        log.info("EmailQueueCron scheduled: initialDelaySeconds={}, periodSeconds={}, maxPerTick={}",
                initialDelaySeconds, periodSeconds, maxPerTick);
    }

    /**
     * Stops the cron job, waiting briefly for a running tick to finish.
     */
    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            scheduler = null;
            nextExecution = null;
            log.info("EmailQueueCron stopped");
        }
    }

    /**
     * Runs a single tick.
     * <p>Errors are logged so the schedule survives them.
     */
    void tick() {
        try {
            lastExecution = clock.instant();
            nextExecution = lastExecution.plusSeconds(periodSeconds);
            processor.processBatch(sender, maxPerTick);
        } catch (Exception e) {
            log.error("EmailQueueCron task error: {}", e.getMessage(), e);
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isRunning() {
        return scheduler != null;
    }

    public Instant getLastExecution() {
        return lastExecution;
    }

    public Instant getNextExecution() {
        return nextExecution;
    }
}
