package com.invoiceguard.backend.services.forensics.metadata;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.invoiceguard.backend.services.forensics.DetectorResult;
import com.invoiceguard.backend.services.forensics.FailureReason;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MetadataResult(
        double score,
        String verdict,
        List<String> flags,
        Map<String, String> metadata,
        String error
) implements DetectorResult {

    public static final double FALLBACK_SCORE = 50.0;

    public static final String NO_EXIF_VERDICT = "SUSPICIOUS - No EXIF metadata found";
    public static final String FAILED_VERDICT = "INCONCLUSIVE - Metadata inspection failed";

    public MetadataResult {
        flags = flags == null ? List.of() : List.copyOf(flags);
        metadata = metadata == null ? Map.of() : metadata;
    }

    public static MetadataResult noMetadata() {
        return new MetadataResult(FALLBACK_SCORE, NO_EXIF_VERDICT,
                List.of("No EXIF metadata present (often stripped by editors or screenshots)."),
                Map.of(), null);
    }

    /**
     * Rendered PDF pages never carry EXIF, so inspection is skipped for them.
     */
    public static MetadataResult pdfInput() {
        return new MetadataResult(FALLBACK_SCORE, NO_EXIF_VERDICT,
                List.of("PDF input has no EXIF metadata; metadata checks are limited."),
                Map.of(), null);
    }

    public static MetadataResult failed(FailureReason reason, String message) {
        return new MetadataResult(FALLBACK_SCORE, FAILED_VERDICT,
                List.of("Could not extract EXIF metadata."),
                Map.of(), message);
    }
}
