package com.invoiceguard.backend.services.ocr;

import java.awt.image.BufferedImage;

public class DisabledOcrService implements OcrService {

    private static final String DISABLED_MESSAGE = "OCR is disabled. Enable it with invoiceguard.ocr.enabled=true";

    @Override
    public String extractText(BufferedImage image) {
        throw new IllegalStateException(DISABLED_MESSAGE);
    }

    @Override
    public OcrEngineStatus status() {
        return OcrEngineStatus.disabled(DISABLED_MESSAGE);
    }
}
