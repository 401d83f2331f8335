package com.nestack.mailqueue.delivery;

import com.nestack.mailqueue.queue.EmailQueue;
import com.nestack.mailqueue.queue.EmailRequest;
import com.nestack.mailqueue.queue.QueuedEmail;
import com.nestack.mailqueue.queue.RateLimitStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Sends an email straight away when the rate limits allow it, otherwise queues it.
 *
 * <p>Critical emails may bypass the limits with {@code skipRateLimit}; their sends are still recorded.
 * <p>Transport failures are reported back to the caller, not queued.
 */
public class EmailDispatcher {
    private static final Logger log = LogManager.getLogger(EmailDispatcher.class);

    private final EmailQueue queue;
    private final EmailSender sender;

    /**
     * Constructs an EmailDispatcher.
     *
     * @param queue  Queue used when rate limited.
     * @param sender Transport.
     */
    public EmailDispatcher(EmailQueue queue, EmailSender sender) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.sender = Objects.requireNonNull(sender, "sender");
    }

    /**
     * Sends or queues an email honoring rate limits.
     *
     * @param request Email request.
     * @return SendResult instance.
     */
    public SendResult send(EmailRequest request) {
        return send(request, false);
    }

    /**
     * Sends or queues an email.
     *
     * @param request       Email request.
     * @param skipRateLimit Send even if the limits are exhausted.
     * @return SendResult instance.
     * @throws com.nestack.mailqueue.queue.InvalidEmailException Malformed request.
     */
    public SendResult send(EmailRequest request, boolean skipRateLimit) {
        if (!skipRateLimit && !queue.canSendNow()) {
            String id = queue.enqueue(request);
            RateLimitStatus status = queue.getRateLimitStatus();
            log.warn("Rate limit reached. Sent: {}/{} per hour, {}/{} per day. Queued email id={} to {}",
                    status.sentLastHour(), status.hourlyLimit(),
                    status.sentLastDay(), status.dailyLimit(), id, request.getRecipient());
            return SendResult.queued(id);
        }

        QueuedEmail email = queue.createEmail(request);

        try {
            if (sender.send(email)) {
                queue.recordSent(email.getRecipient());
                log.info("Email sent: id={}, recipient={}", email.getId(), email.getRecipient());
                return SendResult.sent(email.getId());
            }
            log.warn("Email refused by transport: id={}, recipient={}", email.getId(), email.getRecipient());
            return SendResult.failed(email.getId(), "Transport refused email");
        } catch (Exception e) {
            log.error("Failed to send email id={} to {}: {}", email.getId(), email.getRecipient(), e.getMessage());
            return SendResult.failed(email.getId(), e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }
}
