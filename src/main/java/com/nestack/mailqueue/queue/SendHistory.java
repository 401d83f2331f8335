package com.nestack.mailqueue.queue;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.Objects;

/**
 * Send history ledger.
 *
 * <p>Append only, time ordered record of successful sends used to enforce sliding window limits.
 * <p>Windows are computed relative to "now" on every call, not bucketed by calendar hour or day.
 * <p>Records older than the daily window can no longer affect a verdict and are pruned on access.
 *
 * <p>Thread-safe; every access holds the instance monitor.
 */
public class SendHistory {
    private static final Logger log = LogManager.getLogger(SendHistory.class);

    public static final Duration HOUR = Duration.ofHours(1);
    public static final Duration DAY = Duration.ofHours(24);

    private final ArrayDeque<SendRecord> records = new ArrayDeque<>();
    private final int hourlyLimit;
    private final int dailyLimit;
    private final Clock clock;

    /**
     * Constructs a new SendHistory using the system clock.
     *
     * @param hourlyLimit Sends allowed per trailing hour.
     * @param dailyLimit  Sends allowed per trailing day.
     */
    public SendHistory(int hourlyLimit, int dailyLimit) {
        this(hourlyLimit, dailyLimit, Clock.systemUTC());
    }

    /**
     * Constructs a new SendHistory.
     *
     * @param hourlyLimit Sends allowed per trailing hour.
     * @param dailyLimit  Sends allowed per trailing day.
     * @param clock       Time source.
     */
    public SendHistory(int hourlyLimit, int dailyLimit, Clock clock) {
        if (hourlyLimit <= 0) {
            throw new IllegalArgumentException("hourlyLimit must be > 0, got: " + hourlyLimit);
        }
        if (dailyLimit <= 0) {
            throw new IllegalArgumentException("dailyLimit must be > 0, got: " + dailyLimit);
        }
        this.hourlyLimit = hourlyLimit;
        this.dailyLimit = dailyLimit;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Records a completed send at the current time.
     * <p>If the clock stepped back behind the newest record, the send is stamped with that record's time
     * so records stay in time order.
     *
     * @param recipient Recipient address.
     */
    public synchronized void recordSent(String recipient) {
        Instant now = clock.instant();
        prune(now);
        SendRecord newest = records.peekLast();
        Instant timestamp = newest != null && newest.timestamp().isAfter(now) ? newest.timestamp() : now;
        records.addLast(new SendRecord(timestamp, recipient));
        log.debug("Send recorded: recipient={}, sentLastDay={}", recipient, records.size());
    }

    /**
     * Checks whether one more send fits in both windows.
     * <p>Counts in place without building a status object.
     *
     * @return True if sending is allowed now.
     */
    public synchronized boolean canSendNow() {
        Instant now = clock.instant();
        prune(now);
        if (records.size() >= dailyLimit) {
            return false;
        }
        return countSince(now.minus(HOUR)) < hourlyLimit;
    }

    /**
     * Gets the current rate limit status.
     *
     * @return RateLimitStatus instance.
     */
    public synchronized RateLimitStatus getRateLimitStatus() {
        Instant now = clock.instant();
        prune(now);

        Instant hourCutoff = now.minus(HOUR);
        int sentLastHour = countSince(hourCutoff);
        int sentLastDay = records.size();

        boolean hourlyBlocked = sentLastHour >= hourlyLimit;
        boolean dailyBlocked = sentLastDay >= dailyLimit;
        boolean canSend = !hourlyBlocked && !dailyBlocked;

        Instant nextAvailableAt = null;
        if (hourlyBlocked) {
            nextAvailableAt = releaseTime(hourCutoff, sentLastHour - hourlyLimit, HOUR);
        }
        if (dailyBlocked) {
            Instant dailyRelease = releaseTime(now.minus(DAY), sentLastDay - dailyLimit, DAY);
            if (nextAvailableAt == null || dailyRelease.isAfter(nextAvailableAt)) {
                nextAvailableAt = dailyRelease;
            }
        }

        return new RateLimitStatus(sentLastHour, sentLastDay, hourlyLimit, dailyLimit, canSend, nextAvailableAt);
    }

    /**
     * Drops all records.
     */
    public synchronized void clearHistory() {
        int dropped = records.size();
        records.clear();
        log.info("Send history cleared: dropped={}", dropped);
    }

    public int getHourlyLimit() {
        return hourlyLimit;
    }

    public int getDailyLimit() {
        return dailyLimit;
    }

    /**
     * Counts records newer than the cutoff, walking back from the newest.
     */
    private int countSince(Instant cutoff) {
        int count = 0;
        Iterator<SendRecord> it = records.descendingIterator();
        while (it.hasNext() && it.next().timestamp().isAfter(cutoff)) {
            count++;
        }
        return count;
    }

    /**
     * Finds when the window frees a slot.
     * <p>With {@code excess} records beyond the limit, the window admits a send once the
     * {@code excess + 1} oldest in-window records have aged out, so the release time is the
     * timestamp of the record at in-window index {@code excess} plus the window length.
     */
    private Instant releaseTime(Instant cutoff, int excess, Duration window) {
        int index = 0;
        for (SendRecord sendRecord : records) {
            if (!sendRecord.timestamp().isAfter(cutoff)) {
                continue;
            }
            if (index == excess) {
                return sendRecord.timestamp().plus(window);
            }
            index++;
        }
        // Unreachable while the window is over its limit.
        return cutoff.plus(window);
    }

    /**
     * Removes records that have left the daily window.
     */
    private void prune(Instant now) {
        Instant dayCutoff = now.minus(DAY);
        int pruned = 0;
        while (!records.isEmpty() && !records.peekFirst().timestamp().isAfter(dayCutoff)) {
            records.pollFirst();
            pruned++;
        }
        if (pruned > 0) {
            log.trace("Pruned {} send records older than {}", pruned, dayCutoff);
        }
    }
}
