package com.nestack.mailqueue.queue;

import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Description of an email to be queued.
 *
 * <p>Content is opaque to the queue; it is carried through to the sender unchanged.
 * <p>Use {@link #builder()} to create instances.
 */
public final class EmailRequest {

    private final String recipient;
    private final String subject;
    private final String htmlBody;
    private final String textBody;
    private final Priority priority;
    private final Instant scheduledFor;
    private final Map<String, String> metadata;

    private EmailRequest(Builder builder) {
        this.recipient = builder.recipient;
        this.subject = builder.subject;
        this.htmlBody = builder.htmlBody;
        this.textBody = builder.textBody;
        this.priority = builder.priority;
        this.scheduledFor = builder.scheduledFor;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    }

    /**
     * Creates a new builder.
     *
     * @return Builder with {@link Priority#NORMAL} preset.
     */
    public static Builder builder() {
        return new Builder();
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

    public Instant getScheduledFor() {
        return scheduledFor;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    /**
     * Checks the request is well formed.
     *
     * @throws InvalidEmailException Missing recipient, subject, priority or body.
     */
    public void validate() {
        if (StringUtils.isBlank(recipient)) {
            throw new InvalidEmailException("Recipient is required");
        }
        if (subject == null) {
            throw new InvalidEmailException("Subject is required for " + recipient);
        }
        if (priority == null) {
            throw new InvalidEmailException("Priority is required for " + recipient);
        }
        if (htmlBody == null && textBody == null) {
            throw new InvalidEmailException("Email to " + recipient + " has neither text nor html body");
        }
    }

    /**
     * EmailRequest builder.
     */
    public static final class Builder {
        private String recipient;
        private String subject;
        private String htmlBody;
        private String textBody;
        private Priority priority = Priority.NORMAL;
        private Instant scheduledFor;
        private final Map<String, String> metadata = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder recipient(String recipient) {
            this.recipient = recipient;
            return this;
        }

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder htmlBody(String htmlBody) {
            this.htmlBody = htmlBody;
            return this;
        }

        public Builder textBody(String textBody) {
            this.textBody = textBody;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        /**
         * Sets priority by name.
         *
         * @param priority Priority name.
         * @return Self.
         * @throws InvalidEmailException Unrecognized name.
         */
        public Builder priority(String priority) {
            this.priority = Priority.fromString(priority);
            return this;
        }

        /**
         * Holds the email back until the given instant.
         *
         * @param scheduledFor Earliest delivery time, or null for now.
         * @return Self.
         */
        public Builder scheduledFor(Instant scheduledFor) {
            this.scheduledFor = scheduledFor;
            return this;
        }

        public Builder metadata(String key, String value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public EmailRequest build() {
            return new EmailRequest(this);
        }
    }
}
