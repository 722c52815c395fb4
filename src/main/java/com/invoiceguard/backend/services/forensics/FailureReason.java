package com.invoiceguard.backend.services.forensics;

/**
 * Why a detector could not complete its normal computation.
 */
public enum FailureReason {
    ENGINE_UNAVAILABLE,
    ENGINE_DISABLED,
    READ_FAILED,
    EXTRACTION_FAILED,
    PROCESSING_FAILED,
    UNEXPECTED
}
