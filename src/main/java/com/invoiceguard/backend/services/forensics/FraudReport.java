package com.invoiceguard.backend.services.forensics;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.invoiceguard.backend.services.forensics.ela.ElaResult;
import com.invoiceguard.backend.services.forensics.metadata.MetadataResult;
import com.invoiceguard.backend.services.forensics.ocr.OcrResult;

/**
 * Final three-part assessment of one invoice page.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FraudReport(
        double finalScore,
        String verdict,
        ElaResult ela,
        MetadataResult metadata,
        OcrResult ocr
) {
}
