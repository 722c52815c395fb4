package com.invoiceguard.backend.services.forensics;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    public static final double MEDIUM_THRESHOLD = 40.0;
    public static final double HIGH_THRESHOLD = 65.0;

    public static RiskLevel of(double score) {
        if (score >= HIGH_THRESHOLD) return HIGH;
        if (score >= MEDIUM_THRESHOLD) return MEDIUM;
        return LOW;
    }
}
