package com.nestack.mailqueue.queue;

import java.time.Instant;
import java.util.Map;

/**
 * Queue statistics.
 *
 * @param pending    Emails currently held.
 * @param byPriority Count per priority, every priority present.
 * @param oldestItem Earliest enqueue time held, null when empty.
 */
public record QueueStats(long pending, Map<Priority, Long> byPriority, Instant oldestItem) {
}
