package com.invoiceguard.backend.services.ocr;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import lombok.extern.slf4j.Slf4j;

@Configuration
@EnableConfigurationProperties(OcrProperties.class)
@Slf4j
public class OcrConfiguration {

    @Bean
    @ConditionalOnProperty(prefix = "invoiceguard.ocr", name = "enabled", havingValue = "true", matchIfMissing = true)
    public OcrService tesseractOcrService(OcrProperties ocrProperties) {
        log.info("[OCR] Enabled: language='{}' tessdataPath='{}'",
                safe(ocrProperties.getLanguage()),
                safe(ocrProperties.getTessdataPath()));
        return new TesseractOcrService(ocrProperties);
    }

    @Bean
    @ConditionalOnMissingBean(OcrService.class)
    public OcrService disabledOcrService() {
        log.info("[OCR] Disabled (invoiceguard.ocr.enabled=false)");
        return new DisabledOcrService();
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }
}
