package com.invoiceguard.backend.services.forensics;

import java.awt.image.BufferedImage;
import java.util.Objects;

import com.invoiceguard.backend.services.forensics.metadata.CaptureMetadata;

/**
 * One decoded page handed to the analysis pipeline, with whatever capture metadata
 * was read from the same bytes.
 */
public record InvoiceImage(
        BufferedImage raster,
        CaptureMetadata metadata,
        boolean pdfOrigin
) {
    public InvoiceImage {
        Objects.requireNonNull(raster, "raster");
        if (metadata == null) {
            metadata = CaptureMetadata.none();
        }
    }

    public static InvoiceImage of(BufferedImage raster, CaptureMetadata metadata) {
        return new InvoiceImage(raster, metadata, false);
    }

    public static InvoiceImage fromPdf(BufferedImage raster) {
        return new InvoiceImage(raster, CaptureMetadata.none(), true);
    }

    public int width() {
        return raster.getWidth();
    }

    public int height() {
        return raster.getHeight();
    }
}
