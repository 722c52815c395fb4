package com.invoiceguard.backend.services.forensics.ela;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;

class JpegRecompressorTest {

    @Test
    void roundTripKeepsSizeAndLeavesNoTempFile() throws IOException {
        Path tmp = Path.of(System.getProperty("java.io.tmpdir"));
        long before = countElaTempFiles(tmp);

        BufferedImage source = new BufferedImage(40, 30, BufferedImage.TYPE_INT_RGB);
        source.setRGB(5, 5, 0xFF0000);

        BufferedImage result = new JpegRecompressor().recompress(source, 90);

        assertEquals(40, result.getWidth());
        assertEquals(30, result.getHeight());
        assertEquals(BufferedImage.TYPE_INT_RGB, result.getType());
        assertEquals(before, countElaTempFiles(tmp));
    }

    private static long countElaTempFiles(Path directory) throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(p -> {
                String name = p.getFileName().toString();
                return name.startsWith("ela_") && name.endsWith(".jpg");
            }).count();
        }
    }
}
