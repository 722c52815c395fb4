package com.invoiceguard.backend.services.forensics.ela;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.invoiceguard.backend.services.forensics.DetectorResult;
import com.invoiceguard.backend.services.forensics.FailureReason;

/**
 * ELA payload. {@code visualizationPath} and {@code metrics} are null on the inconclusive branches.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ElaResult(
        double score,
        String verdict,
        String visualizationPath,
        ElaMetrics metrics,
        String error
) implements DetectorResult {

    public static final double FALLBACK_SCORE = 50.0;

    public static final String NO_ARTIFACTS_VERDICT = "SUSPICIOUS - No compression artifacts detected";
    public static final String PROCESSING_FAILED_VERDICT = "INCONCLUSIVE - ELA processing failed";
    public static final String FAILED_VERDICT = "INCONCLUSIVE - ELA failed";

    /**
     * Returned by the analyzer itself when the recompression or measurement step fails.
     */
    public static ElaResult processingFailed(FailureReason reason, String message) {
        return new ElaResult(FALLBACK_SCORE, PROCESSING_FAILED_VERDICT, null, null, message);
    }

    /**
     * Substituted by the aggregator when the analyzer blew up past its own boundary.
     */
    public static ElaResult failed(FailureReason reason, String message) {
        return new ElaResult(FALLBACK_SCORE, FAILED_VERDICT, null, null, message);
    }
}
