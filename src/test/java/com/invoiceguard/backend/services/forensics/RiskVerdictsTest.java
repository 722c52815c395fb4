package com.invoiceguard.backend.services.forensics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class RiskVerdictsTest {

    @Test
    void forScore_bucketsOnSharedThresholds() {
        assertEquals("LOW ELA RISK", RiskVerdicts.forScore(0.0, "ELA"));
        assertEquals("LOW ELA RISK", RiskVerdicts.forScore(39.99, "ELA"));
        assertEquals("MEDIUM OCR RISK", RiskVerdicts.forScore(40.0, "OCR"));
        assertEquals("MEDIUM OCR RISK", RiskVerdicts.forScore(64.99, "OCR"));
        assertEquals("HIGH METADATA RISK", RiskVerdicts.forScore(65.0, "METADATA"));
        assertEquals("HIGH METADATA RISK", RiskVerdicts.forScore(100.0, "METADATA"));
    }

    @Test
    void finalVerdict_usesLiteralLabels() {
        assertEquals("LOW RISK - Appears Authentic", RiskVerdicts.finalVerdict(12.5));
        assertEquals("MEDIUM RISK - Requires Review", RiskVerdicts.finalVerdict(59.0));
        assertEquals("HIGH RISK - Likely Tampered", RiskVerdicts.finalVerdict(65.0));
    }

    @Test
    void levelIsMonotonicInScore() {
        RiskLevel previous = RiskLevel.LOW;
        for (int i = 0; i <= 10000; i++) {
            RiskLevel current = RiskLevel.of(i / 100.0);
            assertTrue(current.compareTo(previous) >= 0, "level dropped at " + (i / 100.0));
            previous = current;
        }
    }

    @Test
    void clampAndRound() {
        assertEquals(0.0, RiskVerdicts.clampScore(-3.0));
        assertEquals(100.0, RiskVerdicts.clampScore(140.0));
        assertEquals(0.0, RiskVerdicts.clampScore(Double.NaN));
        assertEquals(59.0, RiskVerdicts.round2(0.4 * 80 + 0.3 * 50 + 0.3 * 40));
        assertEquals(12.35, RiskVerdicts.round2(12.3456));
    }
}
