package com.invoiceguard.backend.services.forensics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class DetectorOutcomeTest {

    @Test
    void capture_wrapsValue() {
        DetectorOutcome<String> outcome = DetectorOutcome.capture(FailureReason.UNEXPECTED, () -> "ok");

        assertTrue(outcome.isSuccess());
        assertEquals("ok", outcome.orElseGet((reason, message) -> "fallback"));
    }

    @Test
    void capture_turnsRuntimeExceptionIntoFailure() {
        DetectorOutcome<String> outcome = DetectorOutcome.capture(FailureReason.PROCESSING_FAILED, () -> {
            throw new IllegalStateException("boom");
        });

        assertFalse(outcome.isSuccess());
        assertEquals(FailureReason.PROCESSING_FAILED, outcome.failureReason());
        assertEquals("fallback:PROCESSING_FAILED:boom",
                outcome.orElseGet((reason, message) -> "fallback:" + reason + ":" + message));
    }

    @Test
    void capture_turnsStackOverflowIntoFailure() {
        DetectorOutcome<String> outcome = DetectorOutcome.capture(FailureReason.PROCESSING_FAILED, () -> {
            throw new StackOverflowError("deep");
        });

        assertFalse(outcome.isSuccess());
        assertEquals(FailureReason.PROCESSING_FAILED, outcome.failureReason());
        assertEquals("deep", outcome.message());
    }

    @Test
    void capture_treatsNullAsFailure() {
        DetectorOutcome<String> outcome = DetectorOutcome.capture(FailureReason.UNEXPECTED, () -> null);

        assertFalse(outcome.isSuccess());
        assertEquals("Detector returned no result", outcome.message());
    }

    @Test
    void describe_fallsBackToClassName() {
        assertEquals("NullPointerException", DetectorOutcome.describe(new NullPointerException()));
    }

    @Test
    void rejectsAmbiguousState() {
        assertThrows(IllegalArgumentException.class,
                () -> new DetectorOutcome<>("value", FailureReason.UNEXPECTED, "both"));
        assertThrows(IllegalArgumentException.class,
                () -> new DetectorOutcome<>(null, null, "neither"));
    }
}
