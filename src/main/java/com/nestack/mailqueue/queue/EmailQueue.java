package com.nestack.mailqueue.queue;

import com.nestack.mailqueue.config.QueueConfig;
import com.nestack.mailqueue.metrics.EmailQueueMetrics;
import org.apache.commons.lang3.RandomStringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory priority retry queue for outbound email.
 *
 * <p>Emails are held ordered by priority, then enqueue time, then creation sequence.
 * <br>Order is maintained on insertion so a retried email returns to its original slot among peers.
 * <p>{@link #dequeue()} is gated by the {@link SendHistory} ledger and releases the first due email in order.
 * <br>Scheduled emails are skipped over, never removed, until their time passes.
 *
 * <p>All mutations hold the write lock; stats and snapshots hold the read lock.
 * <br>Scan and removal in {@link #dequeue()} is one critical section so concurrent consumers never receive the same email.
 *
 * <p>This queue is not durable. Contents are lost on restart.
 */
public class EmailQueue {
    private static final Logger log = LogManager.getLogger(EmailQueue.class);

    private static final String ID_CHARS = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int ID_TOKEN_LENGTH = 9;

    private static final Comparator<QueuedEmail> ORDER = Comparator
            .comparing(QueuedEmail::getPriority)
            .thenComparing(QueuedEmail::getEnqueuedAt)
            .thenComparingLong(QueuedEmail::getSequence);

    private final List<QueuedEmail> queue = new ArrayList<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong sequence = new AtomicLong();

    private final SendHistory history;
    private final RetryScheduler retryScheduler;
    private final int maxAttempts;
    private final Clock clock;

    /**
     * Constructs a new EmailQueue from configuration using the system clock.
     *
     * @param config Queue configuration.
     */
    public EmailQueue(QueueConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * Constructs a new EmailQueue from configuration.
     *
     * @param config Queue configuration.
     * @param clock  Time source shared with the ledger.
     */
    public EmailQueue(QueueConfig config, Clock clock) {
        this(new SendHistory(config.getHourlyLimit(), config.getDailyLimit(), clock),
                new RetryScheduler(config.getRetryDelayMs()),
                config.getMaxAttempts(),
                clock);
    }

    /**
     * Constructs a new EmailQueue.
     *
     * @param history        Send history ledger gating dequeue.
     * @param retryScheduler Default backoff policy.
     * @param maxAttempts    Attempts after which an email is dropped.
     * @param clock          Time source.
     */
    public EmailQueue(SendHistory history, RetryScheduler retryScheduler, int maxAttempts, Clock clock) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0, got: " + maxAttempts);
        }
        this.history = Objects.requireNonNull(history, "history");
        this.retryScheduler = Objects.requireNonNull(retryScheduler, "retryScheduler");
        this.maxAttempts = maxAttempts;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Adds an email to the queue.
     *
     * @param request Email request.
     * @return Queue entry id.
     * @throws InvalidEmailException Malformed request.
     */
    public String enqueue(EmailRequest request) {
        QueuedEmail email = createEmail(request);

        lock.writeLock().lock();
        try {
            insertOrdered(email);
        } finally {
            lock.writeLock().unlock();
        }

        log.debug("Email enqueued: id={}, recipient={}, priority={}, scheduledFor={}",
                email.getId(), email.getRecipient(), email.getPriority().label(), email.getScheduledFor());
        return email.getId();
    }

    /**
     * Builds a queue entry without adding it to the queue.
     * <p>Used by callers that attempt an immediate send and only queue on rate limiting.
     *
     * @param request Email request.
     * @return QueuedEmail with a fresh id and zero attempts.
     * @throws InvalidEmailException Malformed request.
     */
    public QueuedEmail createEmail(EmailRequest request) {
        if (request == null) {
            throw new InvalidEmailException("Email request is required");
        }
        request.validate();

        Instant now = clock.instant();
        return new QueuedEmail(generateId(now), request, now, sequence.getAndIncrement());
    }

    /**
     * Removes and returns the next email that is due and within rate budget.
     * <p>When the ledger blocks sending the queue is not inspected.
     *
     * @return QueuedEmail or null if rate limited or nothing is due.
     */
    public QueuedEmail dequeue() {
        if (!history.canSendNow()) {
            log.trace("Dequeue blocked by rate limit");
            EmailQueueMetrics.incrementRateLimited();
            return null;
        }

        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            Iterator<QueuedEmail> it = queue.iterator();
            while (it.hasNext()) {
                QueuedEmail email = it.next();
                if (email.isDue(now)) {
                    it.remove();
                    log.debug("Email dequeued: id={}, priority={}, attempts={}",
                            email.getId(), email.getPriority().label(), email.getAttempts());
                    return email;
                }
            }
            return null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Re-queues a failed email using the default backoff.
     *
     * @param email Email previously returned by {@link #dequeue()}.
     * @return True if re-queued, false if dropped after exhausting attempts.
     */
    public boolean requeueForRetry(QueuedEmail email) {
        return requeue(email, null);
    }

    /**
     * Re-queues a failed email.
     * <p>The attempt counter is bumped first; once it reaches the max attempts the email is dropped.
     * <br>Otherwise it returns to its original position among same priority peers, held back by the delay.
     *
     * @param email   Email previously returned by {@link #dequeue()}.
     * @param delayMs Delay before retry in milliseconds.
     * @return True if re-queued, false if dropped after exhausting attempts.
     */
    public boolean requeueForRetry(QueuedEmail email, long delayMs) {
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must be >= 0, got: " + delayMs);
        }
        return requeue(email, delayMs);
    }

    private boolean requeue(QueuedEmail email, Long delayMs) {
        Objects.requireNonNull(email, "email");

        lock.writeLock().lock();
        try {
            if (containsId(email.getId())) {
                throw new IllegalStateException("Email is still queued: " + email.getId());
            }

            int attempts = email.incrementAttempts();
            if (attempts >= maxAttempts) {
                log.warn("Email dropped after {} attempts: id={}, recipient={}",
                        attempts, email.getId(), email.getRecipient());
                EmailQueueMetrics.incrementDropped();
                return false;
            }

            long delay = delayMs != null ? delayMs : retryScheduler.getRetryDelayMs(attempts);
            email.setScheduledFor(clock.instant().plusMillis(delay));
            insertOrdered(email);

            log.info("Email scheduled for retry: id={}, attempts={}, delayMs={}, scheduledFor={}",
                    email.getId(), attempts, delay, email.getScheduledFor());
            EmailQueueMetrics.incrementRetried();
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Gets queue statistics.
     *
     * @return QueueStats instance.
     */
    public QueueStats getQueueStats() {
        lock.readLock().lock();
        try {
            Map<Priority, Long> byPriority = new EnumMap<>(Priority.class);
            for (Priority priority : Priority.values()) {
                byPriority.put(priority, 0L);
            }

            Instant oldest = null;
            for (QueuedEmail email : queue) {
                byPriority.merge(email.getPriority(), 1L, Long::sum);
                if (oldest == null || email.getEnqueuedAt().isBefore(oldest)) {
                    oldest = email.getEnqueuedAt();
                }
            }

            return new QueueStats(queue.size(), Collections.unmodifiableMap(byPriority), oldest);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Take a snapshot copy of queued emails in delivery order.
     * <p>Neither the list nor its elements are linked to the live queue.
     *
     * @return Immutable list of email copies.
     */
    public List<QueuedEmail> getQueuedEmails() {
        lock.readLock().lock();
        try {
            List<QueuedEmail> snapshot = new ArrayList<>(queue.size());
            for (QueuedEmail email : queue) {
                snapshot.add(email.copy());
            }
            return Collections.unmodifiableList(snapshot);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Gets the number of queued emails.
     *
     * @return Queue size.
     */
    public int size() {
        lock.readLock().lock();
        try {
            return queue.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Drops every queued email, including those waiting on a retry.
     */
    public void clearQueue() {
        lock.writeLock().lock();
        try {
            int dropped = queue.size();
            queue.clear();
            log.info("Email queue cleared: dropped={}", dropped);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Records a successful send against the rate limits.
     *
     * @param recipient Recipient address.
     */
    public void recordSent(String recipient) {
        history.recordSent(recipient);
        EmailQueueMetrics.incrementSent();
    }

    public boolean canSendNow() {
        return history.canSendNow();
    }

    public RateLimitStatus getRateLimitStatus() {
        return history.getRateLimitStatus();
    }

    public void clearHistory() {
        history.clearHistory();
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Inserts after every entry that orders before or equal to the email.
     * <p>Caller must hold the write lock.
     */
    private void insertOrdered(QueuedEmail email) {
        int low = 0;
        int high = queue.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (ORDER.compare(queue.get(mid), email) <= 0) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        queue.add(low, email);
    }

    private boolean containsId(String id) {
        for (QueuedEmail queued : queue) {
            if (queued.getId().equals(id)) {
                return true;
            }
        }
        return false;
    }

    private String generateId(Instant now) {
        return "email-" + now.toEpochMilli() + "-" + RandomStringUtils.random(ID_TOKEN_LENGTH, ID_CHARS);
    }
}
