package com.invoiceguard.backend.services.forensics;

import com.invoiceguard.backend.config.ForensicsProperties;

/**
 * Per-call knobs. Defaults come from {@link ForensicsProperties}; callers may override any of them.
 */
public record AnalysisOptions(
        int jpegQuality,
        int maxImageWidthPx,
        double toleranceRatio
) {
    public static final int DEFAULT_JPEG_QUALITY = 90;
    public static final int DEFAULT_MAX_WIDTH_PX = 2000;
    public static final double DEFAULT_TOLERANCE_RATIO = 0.15;

    public AnalysisOptions {
        if (jpegQuality < 1 || jpegQuality > 100) {
            throw new IllegalArgumentException("jpegQuality must be between 1 and 100: " + jpegQuality);
        }
        if (maxImageWidthPx < 0) {
            throw new IllegalArgumentException("maxImageWidthPx must be >= 0: " + maxImageWidthPx);
        }
        if (Double.isNaN(toleranceRatio) || toleranceRatio < 0) {
            throw new IllegalArgumentException("toleranceRatio must be >= 0: " + toleranceRatio);
        }
    }

    public static AnalysisOptions defaults() {
        return new AnalysisOptions(DEFAULT_JPEG_QUALITY, DEFAULT_MAX_WIDTH_PX, DEFAULT_TOLERANCE_RATIO);
    }

    public static AnalysisOptions from(ForensicsProperties properties) {
        return new AnalysisOptions(
                properties.getEla().getJpegQuality(),
                properties.getImage().getMaxWidthPx(),
                properties.getOcr().getToleranceRatio());
    }

    public AnalysisOptions withOverrides(Integer jpegQualityOverride, Integer maxWidthOverride, Double toleranceOverride) {
        return new AnalysisOptions(
                jpegQualityOverride != null ? jpegQualityOverride : jpegQuality,
                maxWidthOverride != null ? maxWidthOverride : maxImageWidthPx,
                toleranceOverride != null ? toleranceOverride : toleranceRatio);
    }
}
