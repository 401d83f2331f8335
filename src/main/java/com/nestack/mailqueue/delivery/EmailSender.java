package com.nestack.mailqueue.delivery;

import com.nestack.mailqueue.queue.QueuedEmail;

/**
 * Transport performing the actual send, e.g. an SMTP relay or a provider API.
 */
@FunctionalInterface
public interface EmailSender {

    /**
     * Sends an email.
     *
     * @param email Email to send.
     * @return True if the transport accepted the email, false if it refused it.
     * @throws Exception Transport failure, treated like a refusal.
     */
    boolean send(QueuedEmail email) throws Exception;
}
