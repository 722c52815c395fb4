package com.invoiceguard.backend.services.forensics.metadata;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.invoiceguard.backend.config.ForensicsProperties;
import com.invoiceguard.backend.services.forensics.DetectorOutcome;
import com.invoiceguard.backend.services.forensics.FailureReason;
import com.invoiceguard.backend.services.forensics.RiskVerdicts;

import lombok.extern.slf4j.Slf4j;

/**
 * Additive EXIF heuristics. Each check contributes a fixed number of points and a flag.
 */
@Component
@Slf4j
public class MetadataInspector {

    public static final String LABEL = "METADATA";

    static final double EDITING_SOFTWARE_POINTS = 30.0;
    static final double TIMESTAMP_MISMATCH_POINTS = 20.0;
    static final double MISSING_FIELDS_POINTS = 15.0;

    private static final List<String> CRITICAL_FIELDS = List.of("Make", "Model", "DateTime");

    private final List<String> editingMarkers;

    public MetadataInspector(ForensicsProperties properties) {
        List<String> markers = new ArrayList<>();
        for (String marker : properties.getMetadata().getEditingMarkers()) {
            if (marker != null && !marker.isBlank()) {
                markers.add(marker.trim().toLowerCase(Locale.ROOT));
            }
        }
        this.editingMarkers = List.copyOf(markers);
    }

    /**
     * Never throws: a failure inside the checks yields {@link MetadataResult#failed}.
     */
    public MetadataResult inspect(CaptureMetadata metadata) {
        MetadataResult result = DetectorOutcome.capture(FailureReason.PROCESSING_FAILED, () -> score(metadata))
                .orElseGet((reason, message) -> {
                    log.warn("[Metadata] Inconclusive: reason={} error={}", reason, message);
                    return MetadataResult.failed(reason, message);
                });
        log.info("[Metadata] Completed: score={} verdict='{}' flags={}",
                result.score(), result.verdict(), result.flags().size());
        return result;
    }

    private MetadataResult score(CaptureMetadata metadata) {
        if (metadata == null || !metadata.isPresent()) {
            return MetadataResult.noMetadata();
        }

        List<String> flags = new ArrayList<>();
        double score = 0.0;

        Optional<String> editingSoftware = detectEditingSoftware(metadata);
        if (editingSoftware.isPresent()) {
            score += EDITING_SOFTWARE_POINTS;
            flags.add("Edited with: " + editingSoftware.get());
        }

        Optional<String> dateTime = metadata.field("DateTime");
        Optional<String> dateTimeOriginal = metadata.field("DateTimeOriginal");
        if (dateTime.isPresent() && dateTimeOriginal.isPresent() && !dateTime.get().equals(dateTimeOriginal.get())) {
            score += TIMESTAMP_MISMATCH_POINTS;
            flags.add("DateTime differs from DateTimeOriginal (possible re-save or edit).");
        }

        List<String> missing = new ArrayList<>();
        for (String field : CRITICAL_FIELDS) {
            if (metadata.field(field).isEmpty()) {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            score += MISSING_FIELDS_POINTS;
            flags.add("Missing critical EXIF fields: " + String.join(", ", missing));
        }

        double finalScore = Math.min(100.0, score);
        return new MetadataResult(finalScore, RiskVerdicts.forScore(finalScore, LABEL), flags,
                metadata.fields(), null);
    }

    Optional<String> detectEditingSoftware(CaptureMetadata metadata) {
        String software = metadata.field("Software")
                .or(() -> metadata.field("ProcessingSoftware"))
                .orElse("");
        if (software.isEmpty()) {
            return Optional.empty();
        }

        String searchable = software.toLowerCase(Locale.ROOT);
        for (String marker : editingMarkers) {
            if (searchable.contains(marker)) {
                return Optional.of(software);
            }
        }
        return Optional.empty();
    }
}
