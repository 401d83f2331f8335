package com.nestack.mailqueue.delivery;

import com.nestack.mailqueue.queue.EmailQueue;
import com.nestack.mailqueue.queue.QueuedEmail;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * EmailQueueProcessor drains the email queue through a transport.
 * <p>This class is responsible for:
 * <ul>
 *   <li>Dequeuing emails while they are due and within rate budget</li>
 *   <li>Handing each email to the {@link EmailSender}</li>
 *   <li>Recording successful sends against the rate limits</li>
 *   <li>Re-queueing refused or failed emails for retry with backoff</li>
 *   <li>Pausing between sends to avoid flooding the transport</li>
 * </ul>
 */
public class EmailQueueProcessor {
    private static final Logger log = LogManager.getLogger(EmailQueueProcessor.class);

    private final EmailQueue queue;
    private final long sendIntervalMs;

    /**
     * Constructs an EmailQueueProcessor.
     *
     * @param queue          Queue to drain.
     * @param sendIntervalMs Pause after each send in milliseconds, 0 for none.
     */
    public EmailQueueProcessor(EmailQueue queue, long sendIntervalMs) {
        if (sendIntervalMs < 0) {
            throw new IllegalArgumentException("sendIntervalMs must be >= 0, got: " + sendIntervalMs);
        }
        this.queue = Objects.requireNonNull(queue, "queue");
        this.sendIntervalMs = sendIntervalMs;
    }

    /**
     * Processes emails until the queue has nothing due or the rate limit is hit.
     *
     * @param sender Transport.
     * @return Number of emails attempted.
     */
    public int process(EmailSender sender) {
        return processBatch(sender, Integer.MAX_VALUE);
    }

    /**
     * Processes up to {@code maxEmails} emails.
     *
     * @param sender    Transport.
     * @param maxEmails Maximum emails to attempt.
     * @return Number of emails attempted.
     */
    public int processBatch(EmailSender sender, int maxEmails) {
        Objects.requireNonNull(sender, "sender");

        int processed = 0;
        while (processed < maxEmails) {
            QueuedEmail email = queue.dequeue();
            if (email == null) {
                break;
            }

            deliver(sender, email);
            processed++;

            if (!pause()) {
                log.warn("Queue processing interrupted after {} emails", processed);
                break;
            }
        }

        if (processed > 0) {
            log.info("Queue processing finished: processed={}, remaining={}", processed, queue.size());
        } else {
            log.trace("Queue processing found nothing to send");
        }
        return processed;
    }

    /**
     * Attempts delivery of a single email and books the outcome.
     *
     * @param sender Transport.
     * @param email  Email to deliver.
     */
    void deliver(EmailSender sender, QueuedEmail email) {
        boolean success;
        try {
            success = sender.send(email);
        } catch (Exception e) {
            log.error("Failed to send email id={} to {}: {}", email.getId(), email.getRecipient(), e.getMessage());
            success = false;
        }

        if (success) {
            queue.recordSent(email.getRecipient());
            log.info("Email sent: id={}, recipient={}, attempts={}",
                    email.getId(), email.getRecipient(), email.getAttempts());
        } else {
            boolean requeued = queue.requeueForRetry(email);
            log.debug("Email send failed: id={}, requeued={}", email.getId(), requeued);
        }
    }

    /**
     * Sleeps for the send interval.
     *
     * @return False if interrupted.
     */
    private boolean pause() {
        if (sendIntervalMs == 0) {
            return true;
        }
        try {
            Thread.sleep(sendIntervalMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
