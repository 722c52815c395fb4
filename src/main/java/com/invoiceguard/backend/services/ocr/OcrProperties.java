package com.invoiceguard.backend.services.ocr;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "invoiceguard.ocr")
public class OcrProperties {

    /**
     * Uses the Tesseract engine; whether it is actually installed is probed at first use.
     * When false every OCR check is reported as "INCONCLUSIVE - OCR disabled".
     */
    private boolean enabled = true;

    /**
     * Tesseract language(s), e.g. "eng" or "eng+por".
     */
    private String language = "eng";

    /**
     * Optional path that contains the "tessdata" directory.
     * If empty, Tess4J/Tesseract will rely on OS installation and environment.
     */
    private String tessdataPath = "";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    public String getTessdataPath() {
        return tessdataPath;
    }

    public void setTessdataPath(String tessdataPath) {
        this.tessdataPath = tessdataPath;
    }
}
