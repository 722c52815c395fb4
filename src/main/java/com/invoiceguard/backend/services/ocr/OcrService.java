package com.invoiceguard.backend.services.ocr;

import java.awt.image.BufferedImage;

public interface OcrService {

    /**
     * Extracts text from an image using OCR.
     *
     * @throws OcrException when the engine fails on this image
     */
    String extractText(BufferedImage image);

    /**
     * Reports whether the engine can be reached at all. Callers check this before
     * attempting extraction so a missing installation degrades to an inconclusive result.
     */
    OcrEngineStatus status();
}
