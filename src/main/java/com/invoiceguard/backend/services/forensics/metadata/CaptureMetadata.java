package com.invoiceguard.backend.services.forensics.metadata;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Capture metadata read alongside an image: either a set of named fields, or none at all.
 * Values are display strings: newlines removed and cut to {@value #MAX_VALUE_CHARS} characters.
 */
public final class CaptureMetadata {

    public static final int MAX_VALUE_CHARS = 100;

    private static final CaptureMetadata NONE = new CaptureMetadata(Map.of());

    private final Map<String, String> fields;

    private CaptureMetadata(Map<String, String> fields) {
        this.fields = fields;
    }

    public static CaptureMetadata none() {
        return NONE;
    }

    public static CaptureMetadata of(Map<String, ?> rawFields) {
        if (rawFields == null || rawFields.isEmpty()) {
            return NONE;
        }
        Map<String, String> sanitized = new LinkedHashMap<>();
        rawFields.forEach((name, value) -> {
            if (name != null && !name.isBlank()) {
                sanitized.put(name, displayValue(value));
            }
        });
        return sanitized.isEmpty() ? NONE : new CaptureMetadata(Collections.unmodifiableMap(sanitized));
    }

    public boolean isPresent() {
        return !fields.isEmpty();
    }

    /**
     * Value of {@code name}, treating blank values as absent.
     */
    public Optional<String> field(String name) {
        String value = fields.get(name);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    public Map<String, String> fields() {
        return fields;
    }

    static String displayValue(Object raw) {
        String text;
        if (raw == null) {
            text = "";
        } else if (raw instanceof byte[] bytes) {
            text = new String(bytes, StandardCharsets.UTF_8);
        } else {
            try {
                text = String.valueOf(raw);
            } catch (RuntimeException e) {
                text = raw.getClass().getSimpleName();
            }
        }

        text = text.replace("\r\n", " ").replace('\n', ' ').replace('\r', ' ').trim();
        if (text.length() <= MAX_VALUE_CHARS) {
            return text;
        }
        return text.substring(0, MAX_VALUE_CHARS - 1) + "…";
    }

    @Override
    public String toString() {
        return isPresent() ? "CaptureMetadata" + fields.keySet() : "CaptureMetadata[none]";
    }
}
