package com.invoiceguard.backend.services.forensics.ela;

import java.awt.image.BufferedImage;
import java.io.IOException;

import org.springframework.stereotype.Component;

import com.invoiceguard.backend.services.forensics.DetectorOutcome;
import com.invoiceguard.backend.services.forensics.FailureReason;
import com.invoiceguard.backend.services.forensics.RasterImages;
import com.invoiceguard.backend.services.forensics.RiskVerdicts;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Error Level Analysis: re-encodes the page as JPEG and measures how much each pixel moved.
 * Regions pasted in after the last save recompress differently from their surroundings and
 * show up bright in the scaled difference image.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ElaAnalyzer {

    public static final String LABEL = "ELA";

    private final JpegRecompressor jpegRecompressor;
    private final ElaVisualizationStore visualizationStore;

    /**
     * Never throws: any failure becomes {@link ElaResult#processingFailed}.
     */
    public ElaResult analyze(BufferedImage image, int jpegQuality) {
        long startMs = System.currentTimeMillis();
        ElaResult result = run(image, jpegQuality).orElseGet((reason, message) -> {
            log.warn("[ELA] Inconclusive: reason={} error={}", reason, message);
            return ElaResult.processingFailed(reason, message);
        });
        log.info("[ELA] Completed: score={} verdict='{}' elapsedMs={}",
                result.score(), result.verdict(), System.currentTimeMillis() - startMs);
        return result;
    }

    DetectorOutcome<ElaResult> run(BufferedImage image, int jpegQuality) {
        try {
            ElaObservation observation = observe(image, jpegQuality);
            String visualizationPath = visualizationStore.save(observation.visualization());
            return DetectorOutcome.success(new ElaResult(
                    RiskVerdicts.round2(observation.score()),
                    observation.verdict(),
                    visualizationPath,
                    observation.metrics(),
                    null));
        } catch (IOException e) {
            return DetectorOutcome.failure(FailureReason.READ_FAILED, DetectorOutcome.describe(e));
        } catch (RuntimeException e) {
            return DetectorOutcome.failure(FailureReason.PROCESSING_FAILED, DetectorOutcome.describe(e));
        }
    }

    ElaObservation observe(BufferedImage image, int jpegQuality) throws IOException {
        BufferedImage original = RasterImages.toRgb(image);
        BufferedImage recompressed = jpegRecompressor.recompress(original, jpegQuality);

        int width = original.getWidth();
        int height = original.getHeight();
        if (recompressed.getWidth() != width || recompressed.getHeight() != height) {
            throw new IllegalStateException("Recompressed image size differs: "
                    + recompressed.getWidth() + "x" + recompressed.getHeight() + " vs " + width + "x" + height);
        }

        int[] difference = new int[width * height];
        int maxDifference = absoluteDifference(original, recompressed, difference);

        BufferedImage visualization = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        if (maxDifference > 0) {
            scaleInPlace(difference, 255.0 / maxDifference);
        }
        visualization.setRGB(0, 0, width, height, difference, 0, width);

        ElaMetrics metrics = measure(difference, maxDifference, jpegQuality);
        double score = scoreFrom(metrics);
        String verdict = maxDifference == 0
                ? ElaResult.NO_ARTIFACTS_VERDICT
                : RiskVerdicts.forScore(score, LABEL);

        log.debug("[ELA] Observed: size={}x{} quality={} maxDiff={} mean={} variance={}",
                width, height, jpegQuality, maxDifference, metrics.brightnessMean(), metrics.brightnessVariance());
        return new ElaObservation(visualization, metrics, score, verdict);
    }

    /**
     * Fills {@code out} with the per-channel absolute difference and returns the largest channel value.
     */
    static int absoluteDifference(BufferedImage original, BufferedImage recompressed, int[] out) {
        int width = original.getWidth();
        int height = original.getHeight();
        int[] a = new int[width];
        int[] b = new int[width];
        int max = 0;
        for (int y = 0; y < height; y++) {
            original.getRGB(0, y, width, 1, a, 0, width);
            recompressed.getRGB(0, y, width, 1, b, 0, width);
            for (int x = 0; x < width; x++) {
                int dr = Math.abs(((a[x] >> 16) & 0xFF) - ((b[x] >> 16) & 0xFF));
                int dg = Math.abs(((a[x] >> 8) & 0xFF) - ((b[x] >> 8) & 0xFF));
                int db = Math.abs((a[x] & 0xFF) - (b[x] & 0xFF));
                out[y * width + x] = (dr << 16) | (dg << 8) | db;
                max = Math.max(max, Math.max(dr, Math.max(dg, db)));
            }
        }
        return max;
    }

    static void scaleInPlace(int[] pixels, double scale) {
        for (int i = 0; i < pixels.length; i++) {
            int p = pixels[i];
            int r = scaleChannel((p >> 16) & 0xFF, scale);
            int g = scaleChannel((p >> 8) & 0xFF, scale);
            int b = scaleChannel(p & 0xFF, scale);
            pixels[i] = (r << 16) | (g << 8) | b;
        }
    }

    private static int scaleChannel(int value, double scale) {
        return (int) Math.min(255.0, value * scale);
    }

    static ElaMetrics measure(int[] pixels, int maxDifference, int jpegQuality) {
        if (pixels.length == 0) {
            return new ElaMetrics(0.0, 0.0, maxDifference, jpegQuality);
        }
        double sum = 0.0;
        double sumSquares = 0.0;
        for (int p : pixels) {
            int l = RasterImages.luminance(p);
            sum += l;
            sumSquares += (double) l * l;
        }
        double mean = sum / pixels.length;
        double variance = Math.max(0.0, sumSquares / pixels.length - mean * mean);
        return new ElaMetrics(mean, variance, maxDifference, jpegQuality);
    }

    /**
     * Brightness and spatial non-uniformity each contribute up to 50 points.
     */
    static double scoreFrom(ElaMetrics metrics) {
        if (metrics.maxPixelDifference() == 0) {
            return ElaResult.FALLBACK_SCORE;
        }
        double brightness = (metrics.brightnessMean() / 255.0) * 50.0;
        double spread = (metrics.brightnessVariance() / 1000.0) * 50.0;
        return Math.min(100.0, brightness + spread);
    }

    record ElaObservation(
            BufferedImage visualization,
            ElaMetrics metrics,
            double score,
            String verdict
    ) {
    }
}
