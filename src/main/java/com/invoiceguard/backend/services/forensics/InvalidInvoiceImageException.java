package com.invoiceguard.backend.services.forensics;

/**
 * Thrown when an upload cannot be turned into an analyzable image. Rejected before any detector runs.
 */
public class InvalidInvoiceImageException extends IllegalArgumentException {

    public InvalidInvoiceImageException(String message) {
        super(message);
    }

    public InvalidInvoiceImageException(String message, Throwable cause) {
        super(message, cause);
    }
}
