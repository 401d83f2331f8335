package com.nestack.mailqueue.metrics;

import com.nestack.mailqueue.queue.EmailQueue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Email queue Micrometer metrics.
 *
 * <p>Provides counters for sends, retries, drops and rate limited dequeues, plus gauges over a bound queue.
 * <p>Every call is a no-op when no registry is registered and never throws into the caller.
 */
public final class EmailQueueMetrics {
    private static final Logger log = LogManager.getLogger(EmailQueueMetrics.class);

    public static final String SENT = "email.queue.sent";
    public static final String RETRIED = "email.queue.retried";
    public static final String DROPPED = "email.queue.dropped";
    public static final String RATE_LIMITED = "email.queue.rate_limited";
    public static final String PENDING = "email.queue.pending";
    public static final String SENT_LAST_HOUR = "email.queue.sent.last_hour";

    /**
     * Private constructor for utility class.
     */
    private EmailQueueMetrics() {
    }

    /**
     * Increment the sent counter.
     * <p>Called once per transport success.
     */
    public static void incrementSent() {
        increment(SENT, "Number of emails delivered by the transport");
    }

    /**
     * Increment the retried counter.
     * <p>Called when a failed email is scheduled for another attempt.
     */
    public static void incrementRetried() {
        increment(RETRIED, "Number of failed emails scheduled for retry");
    }

    /**
     * Increment the dropped counter.
     * <p>Called when a failed email exhausted its attempts.
     */
    public static void incrementDropped() {
        increment(DROPPED, "Number of emails dropped after exhausting attempts");
    }

    /**
     * Increment the rate limited counter.
     * <p>Called when a dequeue is refused by the send history ledger.
     */
    public static void incrementRateLimited() {
        increment(RATE_LIMITED, "Number of dequeue calls refused by rate limits");
    }

    /**
     * Register gauges reporting the state of a queue.
     * <p>Gauges hold a weak reference; the caller keeps the queue alive.
     *
     * @param queue Email queue.
     */
    public static void bindQueue(EmailQueue queue) {
        for (MeterRegistry registry : MetricsRegistry.getRegistries()) {
            try {
                Gauge.builder(PENDING, queue, EmailQueue::size)
                        .description("Number of emails waiting for delivery")
                        .register(registry);
                Gauge.builder(SENT_LAST_HOUR, queue, q -> q.getRateLimitStatus().sentLastHour())
                        .description("Number of emails sent within the trailing hour")
                        .register(registry);
            } catch (Exception e) {
                log.warn("Failed to bind email queue gauges: {}", e.getMessage());
            }
        }
        log.info("Email queue metrics bound to {} registries", MetricsRegistry.getRegistries().size());
    }

    private static void increment(String name, String description) {
        for (MeterRegistry registry : MetricsRegistry.getRegistries()) {
            try {
                Counter.builder(name)
                        .description(description)
                        .register(registry)
                        .increment();
            } catch (Exception e) {
                log.warn("Failed to increment {} counter: {}", name, e.getMessage());
            }
        }
    }
}
