package com.invoiceguard.backend.services.forensics;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Locale;
import java.util.Set;

import javax.imageio.ImageIO;

import org.springframework.stereotype.Service;

import com.invoiceguard.backend.services.forensics.metadata.CaptureMetadata;
import com.invoiceguard.backend.services.forensics.metadata.CaptureMetadataExtractor;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns an uploaded JPG/PNG/PDF into an {@link InvoiceImage}. Anything that cannot be decoded is
 * rejected here, before a detector runs.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvoiceImageLoader {

    public static final Set<String> ALLOWED_EXTENSIONS = Set.of(".jpg", ".jpeg", ".png", ".pdf");

    private final PdfPageRenderer pdfPageRenderer;
    private final CaptureMetadataExtractor metadataExtractor;

    public InvoiceImage load(String filename, byte[] bytes) {
        String extension = extensionOf(filename);
        if (!ALLOWED_EXTENSIONS.contains(extension)) {
            throw new InvalidInvoiceImageException("Invalid file type. Allowed: jpg, jpeg, png, pdf.");
        }
        if (bytes == null || bytes.length == 0) {
            throw new InvalidInvoiceImageException("Empty file (0 bytes)");
        }

        if (".pdf".equals(extension)) {
            return InvoiceImage.fromPdf(pdfPageRenderer.renderFirstPage(bytes));
        }

        BufferedImage raster;
        try {
            raster = ImageIO.read(new ByteArrayInputStream(bytes));
        } catch (IOException e) {
            throw new InvalidInvoiceImageException("Failed to read invoice image: " + e.getMessage(), e);
        }
        if (raster == null) {
            throw new InvalidInvoiceImageException("Failed to read invoice image: unsupported or corrupt data");
        }

        CaptureMetadata metadata = metadataExtractor.extract(bytes);
        log.info("[InvoiceAnalysis] Loaded image: ext={} bytes={} size={}x{} metadata={}",
                extension, bytes.length, raster.getWidth(), raster.getHeight(), metadata.isPresent());
        return InvoiceImage.of(raster, metadata);
    }

    static String extensionOf(String filename) {
        if (filename == null) return "";
        String name = filename.trim();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) return "";
        return name.substring(dot).toLowerCase(Locale.ROOT);
    }
}
