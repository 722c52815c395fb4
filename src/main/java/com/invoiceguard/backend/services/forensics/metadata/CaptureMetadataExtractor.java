package com.invoiceguard.backend.services.forensics.metadata;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.Tag;
import com.drew.metadata.exif.ExifDirectoryBase;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads EXIF capture fields from encoded image bytes. Known tags are exposed under their
 * EXIF names (Make, Model, Software, DateTime, ...); anything else under the library's tag name.
 */
@Component
@Slf4j
public class CaptureMetadataExtractor {

    static final int TAG_PROCESSING_SOFTWARE = 0x000B;

    private static final Map<Integer, String> CANONICAL_NAMES = Map.of(
            ExifDirectoryBase.TAG_MAKE, "Make",
            ExifDirectoryBase.TAG_MODEL, "Model",
            ExifDirectoryBase.TAG_SOFTWARE, "Software",
            TAG_PROCESSING_SOFTWARE, "ProcessingSoftware",
            ExifDirectoryBase.TAG_DATETIME, "DateTime",
            ExifDirectoryBase.TAG_DATETIME_ORIGINAL, "DateTimeOriginal",
            ExifDirectoryBase.TAG_DATETIME_DIGITIZED, "DateTimeDigitized",
            ExifDirectoryBase.TAG_ORIENTATION, "Orientation",
            ExifDirectoryBase.TAG_ARTIST, "Artist",
            ExifDirectoryBase.TAG_COPYRIGHT, "Copyright");

    public CaptureMetadata extract(byte[] imageBytes) {
        if (imageBytes == null || imageBytes.length == 0) {
            return CaptureMetadata.none();
        }

        Map<String, Object> fields = new LinkedHashMap<>();
        try {
            Metadata metadata = ImageMetadataReader.readMetadata(
                    new ByteArrayInputStream(imageBytes), imageBytes.length);
            for (ExifIFD0Directory directory : metadata.getDirectoriesOfType(ExifIFD0Directory.class)) {
                collect(directory, fields);
            }
            for (ExifSubIFDDirectory directory : metadata.getDirectoriesOfType(ExifSubIFDDirectory.class)) {
                collect(directory, fields);
            }
        } catch (ImageProcessingException | IOException e) {
            log.debug("[Metadata] No readable metadata: {}", e.getMessage());
            return CaptureMetadata.none();
        } catch (RuntimeException e) {
            // malformed EXIF segments surface as unchecked exceptions from the reader
            log.warn("[Metadata] Metadata reader failed: {}", e.toString());
            return CaptureMetadata.none();
        }

        log.debug("[Metadata] Extracted {} EXIF fields", fields.size());
        return CaptureMetadata.of(fields);
    }

    private static void collect(Directory directory, Map<String, Object> fields) {
        for (Tag tag : directory.getTags()) {
            int tagType = tag.getTagType();
            String name = CANONICAL_NAMES.getOrDefault(tagType, compactName(tag.getTagName()));
            if (fields.containsKey(name)) continue;

            Object value = directory.getObject(tagType);
            if (value instanceof byte[]) {
                fields.put(name, value);
            } else {
                String text = directory.getString(tagType);
                fields.put(name, text != null ? text : tag.getDescription());
            }
        }
    }

    private static String compactName(String tagName) {
        if (tagName == null) return "";
        return tagName.replaceAll("[^A-Za-z0-9]", "");
    }
}
