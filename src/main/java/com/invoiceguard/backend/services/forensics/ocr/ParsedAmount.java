package com.invoiceguard.backend.services.forensics.ocr;

/**
 * A currency-like token as it appeared in the OCR text, with its numeric value.
 */
public record ParsedAmount(
        String raw,
        double value
) {
}
