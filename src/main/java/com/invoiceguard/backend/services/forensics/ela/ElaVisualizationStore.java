package com.invoiceguard.backend.services.forensics.ela;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

import javax.imageio.ImageIO;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.invoiceguard.backend.config.ForensicsProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * Writes ELA visualizations as PNG under a timestamp + random filename so concurrent
 * calls never collide.
 */
@Component
@Slf4j
public class ElaVisualizationStore {

    private static final DateTimeFormatter FILENAME_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSSSSS").withZone(ZoneOffset.UTC);

    private final Path resultsDirectory;
    private final String publicResultsPrefix;
    private final Clock clock;

    @Autowired
    public ElaVisualizationStore(ForensicsProperties properties) {
        this(Path.of(properties.getEla().getResultsDirectory()), properties.getEla().getPublicResultsPrefix(),
                Clock.systemUTC());
    }

    public ElaVisualizationStore(Path resultsDirectory, String publicResultsPrefix, Clock clock) {
        this.resultsDirectory = resultsDirectory;
        this.publicResultsPrefix = publicResultsPrefix;
        this.clock = clock;
    }

    /**
     * Persists {@code visualization} and returns either the public path or the raw file path.
     */
    public String save(BufferedImage visualization) throws IOException {
        try {
            Files.createDirectories(resultsDirectory);
        } catch (IOException e) {
            throw new IOException("Failed to create directory: " + resultsDirectory, e);
        }

        String filename = "ela_" + FILENAME_TIMESTAMP.format(clock.instant()) + "_"
                + UUID.randomUUID().toString().substring(0, 8) + ".png";
        Path destination = resultsDirectory.resolve(filename);

        if (!ImageIO.write(visualization, "png", destination.toFile())) {
            throw new IOException("Failed to save ELA visualization: " + destination);
        }
        log.debug("[ELA] Visualization saved: {}", destination);

        if (publicResultsPrefix != null && !publicResultsPrefix.isBlank()) {
            return stripTrailingSlash(publicResultsPrefix.trim()) + "/" + filename;
        }
        return destination.toString();
    }

    private static String stripTrailingSlash(String value) {
        String result = value;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
