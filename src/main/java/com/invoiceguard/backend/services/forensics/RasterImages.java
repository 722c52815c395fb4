package com.invoiceguard.backend.services.forensics;

import java.awt.image.BufferedImage;

/**
 * Pixel helpers shared by the detectors. All of them return fresh buffers; inputs are never mutated.
 */
public final class RasterImages {

    private RasterImages() {
    }

    /**
     * Copies {@code source} into a 3-channel RGB buffer. Alpha is dropped, not composited.
     */
    public static BufferedImage toRgb(BufferedImage source) {
        if (source == null) {
            throw new IllegalArgumentException("Image is null");
        }
        int width = source.getWidth();
        int height = source.getHeight();
        BufferedImage rgb = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            source.getRGB(0, y, width, 1, row, 0, width);
            for (int x = 0; x < width; x++) {
                row[x] &= 0xFFFFFF;
            }
            rgb.setRGB(0, y, width, 1, row, 0, width);
        }
        return rgb;
    }

    /**
     * ITU-R 601-2 luma in fixed point, rounded: L = R*299/1000 + G*587/1000 + B*114/1000.
     */
    public static int luminance(int rgb) {
        int r = (rgb >> 16) & 0xFF;
        int g = (rgb >> 8) & 0xFF;
        int b = rgb & 0xFF;
        return (r * 19595 + g * 38470 + b * 7471 + 0x8000) >> 16;
    }
}
