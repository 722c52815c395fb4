package com.invoiceguard.backend.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Settings for the forensic analysis pipeline, bound from the "invoiceguard.forensics" prefix.
 *
 * Example:
 * invoiceguard.forensics.ela.jpeg-quality=90
 * invoiceguard.forensics.ela.results-directory=static/results
 * invoiceguard.forensics.image.max-width-px=2000
 * invoiceguard.forensics.ocr.tolerance-ratio=0.15
 */
@Data
@ConfigurationProperties(prefix = "invoiceguard.forensics")
public class ForensicsProperties {

    private Ela ela = new Ela();
    private Image image = new Image();
    private Ocr ocr = new Ocr();
    private Metadata metadata = new Metadata();
    private Pdf pdf = new Pdf();
    private Executor executor = new Executor();

    @Data
    public static class Ela {

        /**
         * JPEG quality (1-100) used for the recompression round-trip.
         */
        private int jpegQuality = 90;

        /**
         * Directory where ELA visualizations are written.
         */
        private String resultsDirectory = "static/results";

        /**
         * Public prefix joined with the visualization filename.
         * Blank returns the raw filesystem path instead.
         */
        private String publicResultsPrefix = "/static/results";
    }

    @Data
    public static class Image {

        /**
         * Images wider than this are downscaled before any detector runs. 0 disables.
         */
        private int maxWidthPx = 2000;
    }

    @Data
    public static class Ocr {

        /**
         * Maximum relative deviation between the largest amount and the sum of the others.
         */
        private double toleranceRatio = 0.15;
    }

    @Data
    public static class Metadata {

        /**
         * Case-insensitive substrings of the Software tag that indicate an editor.
         */
        private List<String> editingMarkers = new ArrayList<>(
                List.of("photoshop", "gimp", "paint.net", "paint shop", "adobe"));
    }

    @Data
    public static class Pdf {

        /**
         * Render DPI for the first PDF page.
         */
        private int renderDpi = 200;
    }

    @Data
    public static class Executor {

        /**
         * Runs the three detectors concurrently when true.
         */
        private boolean parallel = true;

        private int poolSize = 3;

        private int queueCapacity = 100;
    }

    public String getDescription() {
        return String.format(
                "ForensicsProperties{jpegQuality=%d, maxWidthPx=%d, tolerance=%.2f, pdfDpi=%d, parallel=%s}",
                ela.getJpegQuality(),
                image.getMaxWidthPx(),
                ocr.getToleranceRatio(),
                pdf.getRenderDpi(),
                executor.isParallel());
    }
}
