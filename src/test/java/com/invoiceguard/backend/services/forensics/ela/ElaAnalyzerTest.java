package com.invoiceguard.backend.services.forensics.ela;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ElaAnalyzerTest {

    @TempDir
    Path tempDir;

    @Test
    void identicalRecompression_isSuspiciousWithFixedScore() throws IOException {
        JpegRecompressor recompressor = mock(JpegRecompressor.class);
        when(recompressor.recompress(any(BufferedImage.class), anyInt())).thenAnswer(inv -> inv.getArgument(0));
        ElaAnalyzer analyzer = new ElaAnalyzer(recompressor, rawPathStore());

        ElaResult result = analyzer.analyze(solid(64, 64, 0x0A0A0A), 90);

        assertEquals(50.0, result.score());
        assertTrue(result.verdict().toLowerCase(Locale.ROOT).contains("no compression artifacts"));
        assertNull(result.error());
        assertNotNull(result.visualizationPath());
        assertTrue(Files.exists(Path.of(result.visualizationPath())));
        assertEquals(0, result.metrics().maxPixelDifference());
        assertEquals(90, result.metrics().jpegQuality());
    }

    @Test
    void realRecompression_producesBoundedScoreAndMetrics() {
        ElaAnalyzer analyzer = new ElaAnalyzer(new JpegRecompressor(), rawPathStore());

        ElaResult result = analyzer.analyze(noise(96, 64, 42L), 90);

        assertNull(result.error());
        assertTrue(result.score() >= 0.0 && result.score() <= 100.0, "score=" + result.score());
        assertTrue(result.metrics().maxPixelDifference() > 0);
        assertTrue(result.verdict().endsWith("ELA RISK"), result.verdict());
        assertTrue(Files.exists(Path.of(result.visualizationPath())));
    }

    @Test
    void recompressionFailure_returnsInconclusivePayload() throws IOException {
        JpegRecompressor recompressor = mock(JpegRecompressor.class);
        when(recompressor.recompress(any(BufferedImage.class), anyInt())).thenThrow(new IOException("disk full"));
        ElaAnalyzer analyzer = new ElaAnalyzer(recompressor, rawPathStore());

        ElaResult result = analyzer.analyze(solid(16, 16, 0xFFFFFF), 90);

        assertEquals(50.0, result.score());
        assertEquals("INCONCLUSIVE - ELA processing failed", result.verdict());
        assertNull(result.visualizationPath());
        assertEquals("disk full", result.error());
    }

    @Test
    void nullImage_returnsInconclusivePayload() {
        ElaAnalyzer analyzer = new ElaAnalyzer(new JpegRecompressor(), rawPathStore());

        ElaResult result = analyzer.analyze(null, 90);

        assertEquals(ElaResult.PROCESSING_FAILED_VERDICT, result.verdict());
        assertNotNull(result.error());
    }

    @Test
    void publicPrefix_isJoinedWithFilename() {
        ElaVisualizationStore store = new ElaVisualizationStore(tempDir, "/static/results/", Clock.systemUTC());
        ElaAnalyzer analyzer = new ElaAnalyzer(new JpegRecompressor(), store);

        ElaResult result = analyzer.analyze(noise(32, 32, 7L), 90);

        assertTrue(result.visualizationPath().startsWith("/static/results/ela_"), result.visualizationPath());
        assertTrue(result.visualizationPath().endsWith(".png"));
        String filename = result.visualizationPath().substring("/static/results/".length());
        assertTrue(Files.exists(tempDir.resolve(filename)));
    }

    @Test
    void scoreFormula_weightsMeanAndVarianceEqually() {
        assertEquals(50.0, ElaAnalyzer.scoreFrom(new ElaMetrics(0.0, 0.0, 0, 90)));
        assertEquals(25.0 + 25.0, ElaAnalyzer.scoreFrom(new ElaMetrics(127.5, 500.0, 10, 90)), 1e-9);
        assertEquals(100.0, ElaAnalyzer.scoreFrom(new ElaMetrics(255.0, 5000.0, 255, 90)));
    }

    @Test
    void scaling_mapsBrightestChannelTo255() {
        int[] pixels = {(2 << 16) | (1 << 8), 4};
        ElaAnalyzer.scaleInPlace(pixels, 255.0 / 4);

        assertEquals(127, (pixels[0] >> 16) & 0xFF);
        assertEquals(63, (pixels[0] >> 8) & 0xFF);
        assertEquals(255, pixels[1] & 0xFF);
    }

    @Test
    void measure_usesPopulationVarianceOfLuminance() {
        int[] pixels = {0x000000, 0xFFFFFF};
        ElaMetrics metrics = ElaAnalyzer.measure(pixels, 255, 90);

        assertEquals(127.5, metrics.brightnessMean(), 1e-9);
        assertEquals(127.5 * 127.5, metrics.brightnessVariance(), 1e-6);
    }

    private ElaVisualizationStore rawPathStore() {
        return new ElaVisualizationStore(tempDir, null, Clock.systemUTC());
    }

    private static BufferedImage solid(int width, int height, int rgb) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.setRGB(x, y, rgb);
            }
        }
        return image;
    }

    private static BufferedImage noise(int width, int height, long seed) {
        Random random = new Random(seed);
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.setRGB(x, y, random.nextInt(0x1000000));
            }
        }
        return image;
    }
}
