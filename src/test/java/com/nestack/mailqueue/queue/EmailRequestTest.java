package com.nestack.mailqueue.queue;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for EmailRequest validation and Priority parsing.
 */
class EmailRequestTest {

    @Test
    void testPriorityDefaultsToNormal() {
        EmailRequest request = EmailRequest.builder()
                .recipient("test@example.com")
                .subject("Test")
                .textBody("Test")
                .build();

        assertEquals(Priority.NORMAL, request.getPriority());
        assertDoesNotThrow(request::validate);
    }

    @Test
    void testPriorityFromString() {
        assertEquals(Priority.HIGH, Priority.fromString("high"));
        assertEquals(Priority.NORMAL, Priority.fromString(" Normal "));
        assertEquals(Priority.LOW, Priority.fromString("LOW"));
    }

    @Test
    void testUnrecognizedPriorityIsRejected() {
        assertThrows(InvalidEmailException.class, () -> Priority.fromString("urgent"));
        assertThrows(InvalidEmailException.class, () -> Priority.fromString(null));
        assertThrows(InvalidEmailException.class, () -> EmailRequest.builder().priority("critical"));
    }

    @Test
    void testPriorityOrder() {
        assertTrue(Priority.HIGH.compareTo(Priority.NORMAL) < 0);
        assertTrue(Priority.NORMAL.compareTo(Priority.LOW) < 0);
        assertEquals("high", Priority.HIGH.label());
    }

    @Test
    void testMissingRecipient() {
        EmailRequest request = EmailRequest.builder().subject("Test").textBody("Test").build();
        assertThrows(InvalidEmailException.class, request::validate);

        EmailRequest blank = EmailRequest.builder().recipient("  ").subject("Test").textBody("Test").build();
        assertThrows(InvalidEmailException.class, blank::validate);
    }

    @Test
    void testMissingSubject() {
        EmailRequest request = EmailRequest.builder().recipient("test@example.com").textBody("Test").build();
        assertThrows(InvalidEmailException.class, request::validate);
    }

    @Test
    void testMissingBody() {
        EmailRequest request = EmailRequest.builder().recipient("test@example.com").subject("Test").build();
        assertThrows(InvalidEmailException.class, request::validate);
    }

    @Test
    void testHtmlOnlyIsAccepted() {
        EmailRequest request = EmailRequest.builder()
                .recipient("test@example.com")
                .subject("Test")
                .htmlBody("<p>Test</p>")
                .build();
        assertDoesNotThrow(request::validate);
    }

    @Test
    void testNullPriorityIsRejected() {
        EmailRequest request = EmailRequest.builder()
                .recipient("test@example.com")
                .subject("Test")
                .textBody("Test")
                .priority((Priority) null)
                .build();
        assertThrows(InvalidEmailException.class, request::validate);
    }

    @Test
    void testMetadataIsCopied() {
        Map<String, String> metadata = new HashMap<>();
        metadata.put("personId", "person-123");

        EmailRequest request = EmailRequest.builder()
                .recipient("test@example.com")
                .subject("Test")
                .textBody("Test")
                .metadata(metadata)
                .build();
        metadata.put("applicationId", "app-456");

        assertEquals(Map.of("personId", "person-123"), request.getMetadata());
        assertThrows(UnsupportedOperationException.class, () -> request.getMetadata().put("x", "y"));
    }
}
