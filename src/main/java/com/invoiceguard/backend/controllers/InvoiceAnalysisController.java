package com.invoiceguard.backend.controllers;

import java.io.IOException;
import java.util.Map;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.invoiceguard.backend.config.ForensicsProperties;
import com.invoiceguard.backend.services.forensics.AnalysisOptions;
import com.invoiceguard.backend.services.forensics.FraudReport;
import com.invoiceguard.backend.services.forensics.InvoiceFraudScorer;
import com.invoiceguard.backend.services.forensics.InvoiceImage;
import com.invoiceguard.backend.services.forensics.InvoiceImageLoader;

import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class InvoiceAnalysisController {

    private final InvoiceImageLoader invoiceImageLoader;
    private final InvoiceFraudScorer invoiceFraudScorer;
    private final ForensicsProperties forensicsProperties;

    @Operation(summary = "Score an invoice (JPG/PNG/PDF first page) for tampering risk")
    @PostMapping(value = "/analyze", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> analyze(
            @RequestParam(value = "file", required = false) MultipartFile file,
            @RequestParam(value = "jpegQuality", required = false) Integer jpegQuality,
            @RequestParam(value = "maxWidth", required = false) Integer maxWidth,
            @RequestParam(value = "tolerance", required = false) Double tolerance
    ) throws IOException {
        if (file == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Missing file field 'file'."));
        }

        String filename = file.getOriginalFilename() != null ? file.getOriginalFilename() : "";
        AnalysisOptions options = AnalysisOptions.from(forensicsProperties)
                .withOverrides(jpegQuality, maxWidth, tolerance);

        InvoiceImage invoiceImage = invoiceImageLoader.load(filename, file.getBytes());
        FraudReport report = invoiceFraudScorer.analyze(invoiceImage, options);

        log.info("[InvoiceAnalysis] '{}' -> finalScore={} verdict='{}'", filename, report.finalScore(), report.verdict());
        return ResponseEntity.ok(report);
    }
}
