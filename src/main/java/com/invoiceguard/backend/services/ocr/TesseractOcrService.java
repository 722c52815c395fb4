package com.invoiceguard.backend.services.ocr;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;

import lombok.extern.slf4j.Slf4j;
import net.sourceforge.tess4j.ITessAPI.TessPageSegMode;
import net.sourceforge.tess4j.TessAPI;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;

@Slf4j
public class TesseractOcrService implements OcrService {

    private final OcrProperties ocrProperties;

    /**
     * Tess4J's {@link Tesseract} is not thread-safe. Keep one instance per thread.
     */
    private final ThreadLocal<Tesseract> threadLocalTesseract;

    private volatile OcrEngineStatus cachedStatus;

    public TesseractOcrService(OcrProperties ocrProperties) {
        this.ocrProperties = ocrProperties;
        this.threadLocalTesseract = ThreadLocal.withInitial(this::createTesseract);
    }

    @Override
    public String extractText(BufferedImage image) {
        if (image == null) return "";

        try {
            String text = threadLocalTesseract.get().doOCR(image);
            return text == null ? "" : text;
        } catch (TesseractException e) {
            throw new OcrException("Failed to run OCR (Tesseract)", e);
        } catch (LinkageError e) {
            throw new OcrException("Tesseract native library could not be used", e);
        }
    }

    @Override
    public OcrEngineStatus status() {
        OcrEngineStatus status = cachedStatus;
        if (status == null) {
            status = probe();
            cachedStatus = status;
        }
        return status;
    }

    private OcrEngineStatus probe() {
        String datapath = ocrProperties.getTessdataPath();
        if (datapath != null && !datapath.isBlank() && !Files.isDirectory(Path.of(datapath))) {
            log.warn("[OCR] tessdata path not found: '{}'", datapath);
            return OcrEngineStatus.unavailable("tessdata directory not found: " + datapath);
        }

        try {
            String version = TessAPI.INSTANCE.TessVersion();
            log.info("[OCR] Tesseract available: version={}", version);
            return OcrEngineStatus.available(version);
        } catch (LinkageError | RuntimeException e) {
            // JNA reports a missing native library as UnsatisfiedLinkError.
            log.warn("[OCR] Tesseract unavailable: {}", e.toString());
            return OcrEngineStatus.unavailable(e.getMessage());
        }
    }

    private Tesseract createTesseract() {
        Tesseract tesseract = new Tesseract();

        String datapath = ocrProperties.getTessdataPath();
        if (datapath != null && !datapath.isBlank()) {
            tesseract.setDatapath(datapath);
        }

        String language = ocrProperties.getLanguage();
        if (language != null && !language.isBlank()) {
            tesseract.setLanguage(language);
        }

        tesseract.setPageSegMode(TessPageSegMode.PSM_AUTO);
        return tesseract;
    }
}
