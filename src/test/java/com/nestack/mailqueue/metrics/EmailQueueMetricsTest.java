package com.nestack.mailqueue.metrics;

import com.nestack.mailqueue.queue.EmailQueue;
import com.nestack.mailqueue.queue.EmailRequest;
import com.nestack.mailqueue.queue.QueuedEmail;
import com.nestack.mailqueue.queue.RetryScheduler;
import com.nestack.mailqueue.queue.SendHistory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EmailQueueMetrics.
 */
class EmailQueueMetricsTest {

    private PrometheusMeterRegistry testRegistry;

    @BeforeEach
    void setUp() {
        testRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        MetricsRegistry.register(testRegistry, null);
    }

    @AfterEach
    void tearDown() {
        MetricsRegistry.register(null, null);
        testRegistry.close();
    }

    @Test
    void testIncrementSent() {
        // Act
        EmailQueueMetrics.incrementSent();
        EmailQueueMetrics.incrementSent();
        EmailQueueMetrics.incrementSent();

        // Assert
        Counter counter = testRegistry.find(EmailQueueMetrics.SENT).counter();
        assertNotNull(counter, "Sent counter should be registered");
        assertEquals(3.0, counter.count(), 0.001, "Counter should have incremented 3 times");
    }

    @Test
    void testIncrementRetriedAndDropped() {
        // Act
        EmailQueueMetrics.incrementRetried();
        EmailQueueMetrics.incrementRetried();
        EmailQueueMetrics.incrementDropped();

        // Assert
        assertEquals(2.0, testRegistry.find(EmailQueueMetrics.RETRIED).counter().count(), 0.001);
        assertEquals(1.0, testRegistry.find(EmailQueueMetrics.DROPPED).counter().count(), 0.001);
    }

    @Test
    void testNoRegistryIsNoOp() {
        MetricsRegistry.register(null, null);

        assertDoesNotThrow(EmailQueueMetrics::incrementSent);
        assertDoesNotThrow(EmailQueueMetrics::incrementRateLimited);
        assertNull(testRegistry.find(EmailQueueMetrics.SENT).counter(), "Nothing should reach an unregistered registry");
    }

    @Test
    void testQueueOperationsReportCounters() {
        EmailQueue queue = new EmailQueue(new SendHistory(1, 10), new RetryScheduler(), 2, Clock.systemUTC());
        queue.enqueue(EmailRequest.builder()
                .recipient("test@example.com")
                .subject("Test")
                .textBody("Test")
                .build());

        // Retry then drop.
        QueuedEmail email = queue.dequeue();
        assertTrue(queue.requeueForRetry(email, 0));
        email = queue.dequeue();
        assertFalse(queue.requeueForRetry(email, 0));

        // Exhaust the hourly limit then try again.
        queue.recordSent("test@example.com");
        assertNull(queue.dequeue());

        assertEquals(1.0, testRegistry.find(EmailQueueMetrics.RETRIED).counter().count(), 0.001);
        assertEquals(1.0, testRegistry.find(EmailQueueMetrics.DROPPED).counter().count(), 0.001);
        assertEquals(1.0, testRegistry.find(EmailQueueMetrics.SENT).counter().count(), 0.001);
        assertEquals(1.0, testRegistry.find(EmailQueueMetrics.RATE_LIMITED).counter().count(), 0.001);
    }

    @Test
    void testBindQueueGauges() {
        EmailQueue queue = new EmailQueue(new SendHistory(100, 1000), new RetryScheduler(), 3, Clock.systemUTC());
        EmailQueueMetrics.bindQueue(queue);

        queue.enqueue(EmailRequest.builder().recipient("a@example.com").subject("A").textBody("A").build());
        queue.enqueue(EmailRequest.builder().recipient("b@example.com").subject("B").textBody("B").build());
        queue.recordSent("c@example.com");

        Gauge pending = testRegistry.find(EmailQueueMetrics.PENDING).gauge();
        assertNotNull(pending, "Pending gauge should be registered");
        assertEquals(2.0, pending.value(), 0.001);

        Gauge sentLastHour = testRegistry.find(EmailQueueMetrics.SENT_LAST_HOUR).gauge();
        assertNotNull(sentLastHour, "Sent last hour gauge should be registered");
        assertEquals(1.0, sentLastHour.value(), 0.001);
    }
}
