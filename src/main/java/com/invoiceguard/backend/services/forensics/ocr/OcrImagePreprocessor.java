package com.invoiceguard.backend.services.forensics.ocr;

import java.awt.image.BufferedImage;

import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import org.springframework.stereotype.Component;

import com.invoiceguard.backend.services.forensics.OpenCvImages;

/**
 * Grayscale, Otsu global threshold, then a 3x3 median blur to drop speckle.
 * Printed and scanned invoices OCR noticeably better after this.
 */
@Component
public class OcrImagePreprocessor {

    static final int MEDIAN_KERNEL = 3;

    public BufferedImage preprocess(BufferedImage image) {
        Mat bgr = OpenCvImages.toBgrMat(image);
        Mat gray = new Mat();
        Mat binary = new Mat();
        Mat denoised = new Mat();
        try {
            Imgproc.cvtColor(bgr, gray, Imgproc.COLOR_BGR2GRAY);
            Imgproc.threshold(gray, binary, 0, 255, Imgproc.THRESH_BINARY + Imgproc.THRESH_OTSU);
            Imgproc.medianBlur(binary, denoised, MEDIAN_KERNEL);
            return OpenCvImages.toBufferedImage(denoised);
        } finally {
            bgr.release();
            gray.release();
            binary.release();
            denoised.release();
        }
    }
}
