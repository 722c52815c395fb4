package com.invoiceguard.backend.services.forensics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.image.BufferedImage;

import org.junit.jupiter.api.Test;

class ImageDownscalerTest {

    private final ImageDownscaler downscaler = new ImageDownscaler();

    @Test
    void leavesNarrowImagesUntouched() {
        BufferedImage image = new BufferedImage(800, 600, BufferedImage.TYPE_INT_RGB);

        assertSame(image, downscaler.shrinkToMaxWidth(image, 2000));
    }

    @Test
    void zeroMaxWidthDisablesDownscaling() {
        BufferedImage image = new BufferedImage(3000, 100, BufferedImage.TYPE_INT_RGB);

        assertSame(image, downscaler.shrinkToMaxWidth(image, 0));
    }

    @Test
    void shrinksWideImagesPreservingAspectRatio() {
        BufferedImage image = new BufferedImage(5000, 3001, BufferedImage.TYPE_INT_RGB);

        BufferedImage result = downscaler.shrinkToMaxWidth(image, 2000);

        assertEquals(2000, result.getWidth());
        double expectedHeight = 3001 * (2000 / 5000.0);
        assertTrue(Math.abs(result.getHeight() - expectedHeight) <= 1.0,
                "height " + result.getHeight() + " vs " + expectedHeight);
    }

    @Test
    void neverProducesZeroHeight() {
        BufferedImage image = new BufferedImage(4000, 1, BufferedImage.TYPE_INT_RGB);

        BufferedImage result = downscaler.shrinkToMaxWidth(image, 100);

        assertEquals(100, result.getWidth());
        assertEquals(1, result.getHeight());
    }

    @Test
    void keepsUniformColour() {
        BufferedImage image = new BufferedImage(400, 200, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < 200; y++) {
            for (int x = 0; x < 400; x++) {
                image.setRGB(x, y, 0xC81E32);
            }
        }

        BufferedImage result = downscaler.shrinkToMaxWidth(image, 100);

        assertEquals(100, result.getWidth());
        assertEquals(50, result.getHeight());
        assertEquals(0xC81E32, result.getRGB(50, 25) & 0xFFFFFF);
    }
}
