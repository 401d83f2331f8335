package com.nestack.mailqueue.queue;

import java.time.Instant;

/**
 * Point in time view of the sliding window rate limits.
 *
 * @param sentLastHour    Sends within the trailing hour.
 * @param sentLastDay     Sends within the trailing 24 hours.
 * @param hourlyLimit     Configured hourly limit.
 * @param dailyLimit      Configured daily limit.
 * @param canSend         True if both windows have room for one more send.
 * @param nextAvailableAt When the binding window next admits a send, null if {@code canSend}.
 */
public record RateLimitStatus(
        int sentLastHour,
        int sentLastDay,
        int hourlyLimit,
        int dailyLimit,
        boolean canSend,
        Instant nextAvailableAt
) {
}
