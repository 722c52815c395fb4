package com.invoiceguard.backend.services.forensics;

/**
 * Verdict strings derived from a 0-100 score through the shared {40, 65} thresholds.
 */
public final class RiskVerdicts {

    public static final String FINAL_HIGH = "HIGH RISK - Likely Tampered";
    public static final String FINAL_MEDIUM = "MEDIUM RISK - Requires Review";
    public static final String FINAL_LOW = "LOW RISK - Appears Authentic";

    private RiskVerdicts() {
    }

    /**
     * "HIGH ELA RISK", "MEDIUM OCR RISK", ...
     */
    public static String forScore(double score, String label) {
        return RiskLevel.of(score).name() + " " + label + " RISK";
    }

    public static String finalVerdict(double score) {
        switch (RiskLevel.of(score)) {
            case HIGH:
                return FINAL_HIGH;
            case MEDIUM:
                return FINAL_MEDIUM;
            default:
                return FINAL_LOW;
        }
    }

    public static double clampScore(double score) {
        if (Double.isNaN(score)) return 0.0;
        return Math.max(0.0, Math.min(100.0, score));
    }

    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
