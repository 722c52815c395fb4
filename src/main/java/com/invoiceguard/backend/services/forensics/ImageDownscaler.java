package com.invoiceguard.backend.services.forensics;

import java.awt.image.BufferedImage;

import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * Shrinks very wide scans before analysis, keeping the aspect ratio.
 * Uses area interpolation, which averages source pixels and avoids moire on text.
 */
@Component
@Slf4j
public class ImageDownscaler {

    public BufferedImage shrinkToMaxWidth(BufferedImage image, int maxWidthPx) {
        if (image == null || maxWidthPx <= 0) return image;

        int width = image.getWidth();
        int height = image.getHeight();
        if (width <= maxWidthPx) return image;

        double ratio = maxWidthPx / (double) width;
        int targetHeight = Math.max(1, (int) (height * ratio));

        Mat source = OpenCvImages.toBgrMat(image);
        Mat resized = new Mat();
        try {
            Imgproc.resize(source, resized, new Size(maxWidthPx, targetHeight), 0, 0, Imgproc.INTER_AREA);
            log.debug("[Forensics] Downscaled image {}x{} -> {}x{}", width, height, maxWidthPx, targetHeight);
            return OpenCvImages.toBufferedImage(resized);
        } finally {
            source.release();
            resized.release();
        }
    }
}
