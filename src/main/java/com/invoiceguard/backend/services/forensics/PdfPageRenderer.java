package com.invoiceguard.backend.services.forensics;

import java.awt.image.BufferedImage;
import java.io.IOException;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Service;

import com.invoiceguard.backend.config.ForensicsProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Service
@RequiredArgsConstructor
@Slf4j
public class PdfPageRenderer {

    private final ForensicsProperties properties;

    /**
     * Renders the first page as an in-memory RGB image at {@code invoiceguard.forensics.pdf.render-dpi}.
     */
    public BufferedImage renderFirstPage(byte[] pdfBytes) {
        if (pdfBytes == null || pdfBytes.length == 0) {
            throw new InvalidInvoiceImageException("Empty PDF (0 bytes)");
        }

        int dpi = Math.max(72, properties.getPdf().getRenderDpi());
        long startMs = System.currentTimeMillis();

        try (PDDocument document = PDDocument.load(pdfBytes)) {
            if (document.getNumberOfPages() == 0) {
                throw new InvalidInvoiceImageException("PDF conversion returned no pages.");
            }
            BufferedImage image = new PDFRenderer(document).renderImageWithDPI(0, dpi, ImageType.RGB);
            log.info("[PDF] Rendered first page: pages={} dpi={} size={}x{} elapsedMs={}",
                    document.getNumberOfPages(), dpi, image.getWidth(), image.getHeight(),
                    System.currentTimeMillis() - startMs);
            return image;
        } catch (IOException e) {
            throw new InvalidInvoiceImageException("Failed to convert PDF to image: " + e.getMessage(), e);
        }
    }
}
