package com.invoiceguard.backend.services.forensics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.invoiceguard.backend.config.ForensicsProperties;

class AnalysisOptionsTest {

    @Test
    void from_readsPropertyDefaults() {
        assertEquals(AnalysisOptions.defaults(), AnalysisOptions.from(new ForensicsProperties()));
    }

    @Test
    void withOverrides_replacesOnlyGivenValues() {
        AnalysisOptions options = AnalysisOptions.defaults().withOverrides(70, null, 0.05);

        assertEquals(new AnalysisOptions(70, 2000, 0.05), options);
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertThrows(IllegalArgumentException.class, () -> new AnalysisOptions(0, 2000, 0.15));
        assertThrows(IllegalArgumentException.class, () -> new AnalysisOptions(101, 2000, 0.15));
        assertThrows(IllegalArgumentException.class, () -> new AnalysisOptions(90, -1, 0.15));
        assertThrows(IllegalArgumentException.class, () -> new AnalysisOptions(90, 2000, -0.1));
        assertThrows(IllegalArgumentException.class, () -> new AnalysisOptions(90, 2000, Double.NaN));
    }
}
