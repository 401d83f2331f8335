package com.nestack.mailqueue.queue;

import java.util.Locale;

/**
 * Email delivery priority.
 *
 * <p>Declaration order is the delivery order: {@code HIGH} before {@code NORMAL} before {@code LOW}.
 */
public enum Priority {
    HIGH,
    NORMAL,
    LOW;

    /**
     * Parses a priority name, case insensitive.
     *
     * @param value Priority name, e.g. "high".
     * @return Priority.
     * @throws InvalidEmailException Unrecognized or missing value.
     */
    public static Priority fromString(String value) {
        if (value == null) {
            throw new InvalidEmailException("Priority is required");
        }
        try {
            return Priority.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidEmailException("Unrecognized priority: " + value);
        }
    }

    /**
     * Gets the lower case name used in log lines.
     *
     * @return Lower case name.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
