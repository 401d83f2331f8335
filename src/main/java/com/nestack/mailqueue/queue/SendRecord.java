package com.nestack.mailqueue.queue;

import java.time.Instant;

/**
 * A completed send: recipient {@code recipient} was delivered to at {@code timestamp}.
 *
 * <p>Only the timestamp feeds the rate computation; the recipient is kept for diagnostics.
 *
 * @param timestamp Send completion time.
 * @param recipient Recipient address.
 */
public record SendRecord(Instant timestamp, String recipient) {
}
