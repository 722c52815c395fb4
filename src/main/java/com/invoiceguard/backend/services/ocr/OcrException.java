package com.invoiceguard.backend.services.ocr;

/**
 * Raised by an {@link OcrService} when text extraction fails for a given image.
 */
public class OcrException extends RuntimeException {

    public OcrException(String message, Throwable cause) {
        super(message, cause);
    }
}
