package com.invoiceguard.backend.services.forensics.ela;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ElaMetrics(
        double brightnessMean,
        double brightnessVariance,
        int maxPixelDifference,
        int jpegQuality
) {
}
