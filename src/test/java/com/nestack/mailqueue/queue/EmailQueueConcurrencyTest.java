package com.nestack.mailqueue.queue;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrent access tests for EmailQueue.
 */
class EmailQueueConcurrencyTest {

    private static final int THREADS = 8;
    private static final int PER_THREAD = 250;

    @Test
    void testConcurrentEnqueueAndDequeueNeverDuplicates() throws Exception {
        EmailQueue queue = new EmailQueue(new SendHistory(100_000, 100_000), new RetryScheduler(), 3, Clock.systemUTC());
        ExecutorService executor = Executors.newFixedThreadPool(THREADS * 2);
        CountDownLatch start = new CountDownLatch(1);
        Set<String> seen = ConcurrentHashMap.newKeySet();
        AtomicInteger duplicates = new AtomicInteger();
        AtomicInteger producersDone = new AtomicInteger();

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < THREADS; t++) {
                final int thread = t;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < PER_THREAD; i++) {
                        Priority priority = Priority.values()[i % 3];
                        queue.enqueue(EmailRequest.builder()
                                .recipient("user" + thread + "-" + i + "@example.com")
                                .subject("Test")
                                .textBody("Test")
                                .priority(priority)
                                .build());
                    }
                    producersDone.incrementAndGet();
                    return null;
                }));
                futures.add(executor.submit(() -> {
                    start.await();
                    while (producersDone.get() < THREADS || queue.size() > 0) {
                        QueuedEmail email = queue.dequeue();
                        if (email == null) {
                            Thread.onSpinWait();
                            continue;
                        }
                        if (!seen.add(email.getId())) {
                            duplicates.incrementAndGet();
                        }
                        queue.recordSent(email.getRecipient());
                    }
                    return null;
                }));
            }

            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(0, duplicates.get(), "No email may be dequeued twice");
        assertEquals(THREADS * PER_THREAD, seen.size(), "Every email must be dequeued once");
        assertEquals(0, queue.size());
        assertEquals(THREADS * PER_THREAD, queue.getRateLimitStatus().sentLastHour());
    }

    @Test
    void testConcurrentDequeueRespectsHourlyLimit() throws Exception {
        EmailQueue queue = new EmailQueue(new SendHistory(50, 1000), new RetryScheduler(), 3, Clock.systemUTC());
        for (int i = 0; i < 200; i++) {
            queue.enqueue(EmailRequest.builder()
                    .recipient("user" + i + "@example.com")
                    .subject("Test")
                    .textBody("Test")
                    .build());
        }

        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        AtomicInteger sent = new AtomicInteger();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < THREADS; t++) {
                futures.add(executor.submit(() -> {
                    QueuedEmail email;
                    while ((email = queue.dequeue()) != null) {
                        queue.recordSent(email.getRecipient());
                        sent.incrementAndGet();
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        // Dequeue and record are separate calls so concurrent workers may overshoot by at most one each.
        assertTrue(sent.get() >= 50, "Sent " + sent.get());
        assertTrue(sent.get() <= 50 + THREADS, "Sent " + sent.get());
        assertFalse(queue.canSendNow());
        assertEquals(200 - sent.get(), queue.size());
    }
}
