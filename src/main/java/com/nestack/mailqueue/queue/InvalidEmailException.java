package com.nestack.mailqueue.queue;

/**
 * Thrown when an email handed to the queue is malformed.
 *
 * <p>This is a caller error, distinct from the normal empty or rate limited states
 * which are reported by null results.
 */
public class InvalidEmailException extends IllegalArgumentException {

    /**
     * Constructs a new InvalidEmailException instance.
     *
     * @param message Reason.
     */
    public InvalidEmailException(String message) {
        super(message);
    }
}
