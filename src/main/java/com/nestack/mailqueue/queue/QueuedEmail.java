package com.nestack.mailqueue.queue;

import java.time.Instant;
import java.util.Map;

/**
 * An email awaiting delivery.
 *
 * <p>Content and metadata are fixed at enqueue time.
 * <br>Only the retry path changes {@code attempts} and {@code scheduledFor}.
 */
public class QueuedEmail {

    /**
     * Queue entry id, {@code email-<epoch millis>-<base36 token>}.
     */
    private final String id;

    private final String recipient;
    private final String subject;
    private final String htmlBody;
    private final String textBody;
    private final Priority priority;

    /**
     * Correlation data passed through to the sender untouched.
     */
    private final Map<String, String> metadata;

    /**
     * Creation time, kept across retries for FIFO ordering.
     */
    private final Instant enqueuedAt;

    /**
     * Tie breaker for emails enqueued within the same clock tick.
     */
    private final long sequence;

    /**
     * Failed delivery attempts so far.
     */
    private int attempts;

    /**
     * Earliest delivery time, null when due now.
     */
    private Instant scheduledFor;

    /**
     * Constructs a new QueuedEmail instance.
     *
     * @param id         Queue entry id.
     * @param request    Email request.
     * @param enqueuedAt Creation time.
     * @param sequence   Creation sequence number.
     */
    QueuedEmail(String id, EmailRequest request, Instant enqueuedAt, long sequence) {
        this.id = id;
        this.recipient = request.getRecipient();
        this.subject = request.getSubject();
        this.htmlBody = request.getHtmlBody();
        this.textBody = request.getTextBody();
        this.priority = request.getPriority();
        this.metadata = request.getMetadata();
        this.scheduledFor = request.getScheduledFor();
        this.enqueuedAt = enqueuedAt;
        this.sequence = sequence;
        this.attempts = 0;
    }

    /**
     * Copy constructor for snapshots.
     *
     * @param source Email to copy.
     */
    private QueuedEmail(QueuedEmail source) {
        this.id = source.id;
        this.recipient = source.recipient;
        this.subject = source.subject;
        this.htmlBody = source.htmlBody;
        this.textBody = source.textBody;
        this.priority = source.priority;
        this.metadata = source.metadata;
        this.enqueuedAt = source.enqueuedAt;
        this.sequence = source.sequence;
        this.attempts = source.attempts;
        this.scheduledFor = source.scheduledFor;
    }

    public String getId() {
        return id;
    }

    public String getRecipient() {
        return recipient;
    }

    public String getSubject() {
        return subject;
    }

    public String getHtmlBody() {
        return htmlBody;
    }

    public String getTextBody() {
        return textBody;
    }

    public Priority getPriority() {
        return priority;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public Instant getEnqueuedAt() {
        return enqueuedAt;
    }

    long getSequence() {
        return sequence;
    }

    public int getAttempts() {
        return attempts;
    }

    public Instant getScheduledFor() {
        return scheduledFor;
    }

    /**
     * Checks if the email may be delivered at the given time.
     *
     * @param now Current time.
     * @return True if not scheduled or schedule has passed.
     */
    public boolean isDue(Instant now) {
        return scheduledFor == null || !scheduledFor.isAfter(now);
    }

    /**
     * Bumps the attempt counter.
     *
     * @return New attempt count.
     */
    int incrementAttempts() {
        return ++attempts;
    }

    void setScheduledFor(Instant scheduledFor) {
        this.scheduledFor = scheduledFor;
    }

    /**
     * Creates a detached copy.
     *
     * @return QueuedEmail.
     */
    QueuedEmail copy() {
        return new QueuedEmail(this);
    }

    @Override
    public String toString() {
        return "QueuedEmail{" +
                "id='" + id + '\'' +
                ", recipient='" + recipient + '\'' +
                ", priority=" + priority +
                ", attempts=" + attempts +
                ", scheduledFor=" + scheduledFor +
                ", enqueuedAt=" + enqueuedAt +
                '}';
    }
}
