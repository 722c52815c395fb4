package com.invoiceguard.backend.services.forensics.ela;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;

import org.springframework.stereotype.Component;

import com.invoiceguard.backend.services.forensics.RasterImages;

import lombok.extern.slf4j.Slf4j;

/**
 * Re-encodes an RGB buffer as JPEG at a given quality and decodes it back.
 * The encoded copy lives in a temp file that is deleted on every exit path.
 */
@Component
@Slf4j
public class JpegRecompressor {

    public BufferedImage recompress(BufferedImage rgb, int jpegQuality) throws IOException {
        Path tempFile = Files.createTempFile("ela_", ".jpg");
        try {
            writeJpeg(rgb, tempFile, jpegQuality);
            BufferedImage decoded = ImageIO.read(tempFile.toFile());
            if (decoded == null) {
                throw new IOException("Recompressed JPEG could not be decoded");
            }
            return RasterImages.toRgb(decoded);
        } finally {
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException e) {
                log.warn("[ELA] Failed to delete temp file {}: {}", tempFile, e.getMessage());
            }
        }
    }

    private void writeJpeg(BufferedImage rgb, Path destination, int jpegQuality) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IOException("No JPEG encoder available");
        }

        ImageWriter writer = writers.next();
        try (ImageOutputStream output = ImageIO.createImageOutputStream(destination.toFile())) {
            if (output == null) {
                throw new IOException("Could not open output stream for " + destination);
            }
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(Math.max(1, Math.min(100, jpegQuality)) / 100f);

            writer.setOutput(output);
            writer.write(null, new IIOImage(rgb, null, null), param);
        } finally {
            writer.dispose();
        }
    }
}
