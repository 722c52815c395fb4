package com.invoiceguard.backend.services.forensics;

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;

import org.opencv.core.CvType;
import org.opencv.core.Mat;

import lombok.extern.slf4j.Slf4j;
import nu.pattern.OpenCV;

/**
 * Bridges {@link BufferedImage} and OpenCV {@link Mat}. The native library is loaded once, on first use.
 */
@Slf4j
public final class OpenCvImages {

    private static volatile boolean loaded;

    private OpenCvImages() {
    }

    public static void ensureLoaded() {
        if (loaded) return;
        synchronized (OpenCvImages.class) {
            if (!loaded) {
                OpenCV.loadLocally();
                loaded = true;
                log.info("[Forensics] OpenCV native library loaded");
            }
        }
    }

    /**
     * 3-channel BGR copy of {@code image}. Alpha is dropped.
     */
    public static Mat toBgrMat(BufferedImage image) {
        ensureLoaded();
        int width = image.getWidth();
        int height = image.getHeight();

        BufferedImage bgr = new BufferedImage(width, height, BufferedImage.TYPE_3BYTE_BGR);
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            image.getRGB(0, y, width, 1, row, 0, width);
            bgr.setRGB(0, y, width, 1, row, 0, width);
        }

        byte[] data = ((DataBufferByte) bgr.getRaster().getDataBuffer()).getData();
        Mat mat = new Mat(height, width, CvType.CV_8UC3);
        mat.put(0, 0, data);
        return mat;
    }

    /**
     * Copies an 8-bit single-channel or BGR {@link Mat} into a new image of the matching type.
     */
    public static BufferedImage toBufferedImage(Mat mat) {
        int channels = mat.channels();
        int type;
        if (channels == 1) {
            type = BufferedImage.TYPE_BYTE_GRAY;
        } else if (channels == 3) {
            type = BufferedImage.TYPE_3BYTE_BGR;
        } else {
            throw new IllegalArgumentException("Unsupported channel count: " + channels);
        }

        BufferedImage image = new BufferedImage(mat.cols(), mat.rows(), type);
        byte[] target = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
        mat.get(0, 0, target);
        return image;
    }
}
