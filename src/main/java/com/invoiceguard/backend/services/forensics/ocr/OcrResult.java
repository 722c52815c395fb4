package com.invoiceguard.backend.services.forensics.ocr;

import java.util.List;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.invoiceguard.backend.services.forensics.DetectorResult;
import com.invoiceguard.backend.services.forensics.FailureReason;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OcrResult(
        double score,
        String verdict,
        List<String> flags,
        String extractedText,
        List<ParsedAmount> amounts,
        String error
) implements DetectorResult {

    public static final double FALLBACK_SCORE = 40.0;

    public static final String NOT_INSTALLED_VERDICT = "INCONCLUSIVE - Tesseract not installed";
    public static final String DISABLED_VERDICT = "INCONCLUSIVE - OCR disabled";
    public static final String EXTRACTION_FAILED_VERDICT = "INCONCLUSIVE - OCR extraction failed";
    public static final String FAILED_VERDICT = "INCONCLUSIVE - OCR failed";

    public OcrResult {
        flags = flags == null ? List.of() : List.copyOf(flags);
        extractedText = extractedText == null ? "" : extractedText;
        amounts = amounts == null ? List.of() : List.copyOf(amounts);
    }

    /**
     * Maps a validator-level failure to its inconclusive payload.
     */
    public static OcrResult inconclusive(FailureReason reason, String message) {
        if (reason == FailureReason.ENGINE_DISABLED) {
            return fallback(DISABLED_VERDICT,
                    "OCR is disabled by configuration (invoiceguard.ocr.enabled=false).", message);
        }
        if (reason == FailureReason.ENGINE_UNAVAILABLE) {
            return fallback(NOT_INSTALLED_VERDICT,
                    "Tesseract OCR is not available; install it to enable OCR checks.", message);
        }
        return fallback(EXTRACTION_FAILED_VERDICT,
                "OCR extraction failed; poor scan quality can trigger this.", message);
    }

    /**
     * Substituted by the aggregator when the validator blew up past its own boundary.
     */
    public static OcrResult failed(FailureReason reason, String message) {
        return fallback(FAILED_VERDICT, "OCR validation failed unexpectedly.", message);
    }

    private static OcrResult fallback(String verdict, String flag, String message) {
        return new OcrResult(FALLBACK_SCORE, verdict, List.of(flag), "", List.of(),
                message == null || message.isBlank() ? "OCR unavailable" : message);
    }
}
