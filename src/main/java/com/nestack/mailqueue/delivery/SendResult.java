package com.nestack.mailqueue.delivery;

/**
 * Outcome of a dispatch.
 *
 * @param status  Outcome.
 * @param emailId Queue entry id of the email.
 * @param error   Failure or queueing reason, null when sent.
 */
public record SendResult(Status status, String emailId, String error) {

    /**
     * Dispatch outcome.
     */
    public enum Status {
        /** Accepted by the transport. */
        SENT,
        /** Held back by rate limits and queued for later delivery. */
        QUEUED,
        /** Refused or failed by the transport. */
        FAILED
    }

    public static SendResult sent(String emailId) {
        return new SendResult(Status.SENT, emailId, null);
    }

    public static SendResult queued(String emailId) {
        return new SendResult(Status.QUEUED, emailId, "Rate limit reached, email queued");
    }

    public static SendResult failed(String emailId, String error) {
        return new SendResult(Status.FAILED, emailId, error);
    }

    public boolean isSuccess() {
        return status == Status.SENT;
    }

    public boolean isQueued() {
        return status == Status.QUEUED;
    }
}
