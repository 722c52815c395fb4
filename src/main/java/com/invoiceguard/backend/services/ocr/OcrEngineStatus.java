package com.invoiceguard.backend.services.ocr;

/**
 * Reachability of the OCR engine. {@code disabled} marks an engine switched off by configuration,
 * as opposed to one that was probed and not found.
 */
public record OcrEngineStatus(
        boolean available,
        boolean disabled,
        String version,
        String error
) {
    public static OcrEngineStatus available(String version) {
        return new OcrEngineStatus(true, false, version, null);
    }

    public static OcrEngineStatus unavailable(String error) {
        return new OcrEngineStatus(false, false, null,
                error == null || error.isBlank() ? "Tesseract not found" : error);
    }

    public static OcrEngineStatus disabled(String reason) {
        return new OcrEngineStatus(false, true, null, reason);
    }
}
