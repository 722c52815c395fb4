package com.invoiceguard.backend.services.forensics;

import java.awt.image.BufferedImage;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.BiFunction;
import java.util.function.Supplier;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.invoiceguard.backend.config.ForensicsProperties;
import com.invoiceguard.backend.services.forensics.ela.ElaAnalyzer;
import com.invoiceguard.backend.services.forensics.ela.ElaResult;
import com.invoiceguard.backend.services.forensics.metadata.MetadataInspector;
import com.invoiceguard.backend.services.forensics.metadata.MetadataResult;
import com.invoiceguard.backend.services.forensics.ocr.OcrArithmeticValidator;
import com.invoiceguard.backend.services.forensics.ocr.OcrResult;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs ELA, metadata inspection and OCR arithmetic on one page and combines them:
 * final = 0.4 * ELA + 0.3 * metadata + 0.3 * OCR.
 * A detector that fails is replaced by its fallback payload; the report always has all three parts.
 */
@Service
@Slf4j
public class InvoiceFraudScorer {

    static final double WEIGHT_ELA = 0.4;
    static final double WEIGHT_METADATA = 0.3;
    static final double WEIGHT_OCR = 0.3;

    private final ElaAnalyzer elaAnalyzer;
    private final MetadataInspector metadataInspector;
    private final OcrArithmeticValidator ocrValidator;
    private final ImageDownscaler imageDownscaler;
    private final ForensicsProperties properties;
    private final Executor executor;

    public InvoiceFraudScorer(ElaAnalyzer elaAnalyzer,
                              MetadataInspector metadataInspector,
                              OcrArithmeticValidator ocrValidator,
                              ImageDownscaler imageDownscaler,
                              ForensicsProperties properties,
                              @Qualifier("forensicsTaskExecutor") Executor executor) {
        this.elaAnalyzer = elaAnalyzer;
        this.metadataInspector = metadataInspector;
        this.ocrValidator = ocrValidator;
        this.imageDownscaler = imageDownscaler;
        this.properties = properties;
        this.executor = executor;
    }

    public FraudReport analyze(InvoiceImage invoiceImage) {
        return analyze(invoiceImage, AnalysisOptions.from(properties));
    }

    public FraudReport analyze(InvoiceImage invoiceImage, AnalysisOptions options) {
        if (invoiceImage == null) {
            throw new InvalidInvoiceImageException("No image to analyze");
        }
        AnalysisOptions effective = options != null ? options : AnalysisOptions.from(properties);
        long startMs = System.currentTimeMillis();

        BufferedImage analysisImage = downscaled(invoiceImage.raster(), effective.maxImageWidthPx());
        log.info("[Forensics] Analyzing: size={}x{} analysisSize={}x{} pdf={} quality={} tolerance={}",
                invoiceImage.width(), invoiceImage.height(),
                analysisImage.getWidth(), analysisImage.getHeight(),
                invoiceImage.pdfOrigin(), effective.jpegQuality(), effective.toleranceRatio());

        CompletableFuture<ElaResult> ela = submit(
                () -> guarded("ELA", () -> elaAnalyzer.analyze(analysisImage, effective.jpegQuality()), ElaResult::failed));
        CompletableFuture<MetadataResult> metadata = submit(() -> invoiceImage.pdfOrigin()
                ? MetadataResult.pdfInput()
                : guarded("Metadata", () -> metadataInspector.inspect(invoiceImage.metadata()), MetadataResult::failed));
        CompletableFuture<OcrResult> ocr = submit(
                () -> guarded("OCR", () -> ocrValidator.validate(analysisImage, effective.toleranceRatio()), OcrResult::failed));

        FraudReport report = combine(
                settle("ELA", ela, ElaResult::failed),
                settle("Metadata", metadata, MetadataResult::failed),
                settle("OCR", ocr, OcrResult::failed));
        log.info("[Forensics] Completed: finalScore={} verdict='{}' ela={} metadata={} ocr={} elapsedMs={}",
                report.finalScore(), report.verdict(),
                report.ela().score(), report.metadata().score(), report.ocr().score(),
                System.currentTimeMillis() - startMs);
        return report;
    }

    static FraudReport combine(ElaResult ela, MetadataResult metadata, OcrResult ocr) {
        double weighted = scoreOrFallback(ela, ElaResult.FALLBACK_SCORE) * WEIGHT_ELA
                + scoreOrFallback(metadata, MetadataResult.FALLBACK_SCORE) * WEIGHT_METADATA
                + scoreOrFallback(ocr, OcrResult.FALLBACK_SCORE) * WEIGHT_OCR;
        double clamped = RiskVerdicts.clampScore(weighted);
        return new FraudReport(
                RiskVerdicts.round2(clamped),
                RiskVerdicts.finalVerdict(clamped),
                ela != null ? ela : ElaResult.failed(FailureReason.UNEXPECTED, "ELA produced no result"),
                metadata != null ? metadata : MetadataResult.failed(FailureReason.UNEXPECTED, "Metadata produced no result"),
                ocr != null ? ocr : OcrResult.failed(FailureReason.UNEXPECTED, "OCR produced no result"));
    }

    static double scoreOrFallback(DetectorResult result, double fallback) {
        if (result == null || !Double.isFinite(result.score())) {
            return fallback;
        }
        return result.score();
    }

    private <T extends DetectorResult> T guarded(String detector, Supplier<T> action,
                                                 BiFunction<FailureReason, String, T> fallback) {
        return DetectorOutcome.capture(FailureReason.UNEXPECTED, action)
                .orElseGet((reason, message) -> {
                    log.warn("[Forensics] {} detector failed, using fallback: {}", detector, message);
                    return fallback.apply(reason, message);
                });
    }

    private BufferedImage downscaled(BufferedImage raster, int maxWidthPx) {
        try {
            return imageDownscaler.shrinkToMaxWidth(raster, maxWidthPx);
        } catch (RuntimeException | LinkageError e) {
            log.warn("[Forensics] Downscaling failed, analyzing at original size: {}", DetectorOutcome.describe(e));
            return raster;
        }
    }

    /**
     * Waits for a detector; a future that completed exceptionally yields the detector's fallback instead.
     */
    private <T extends DetectorResult> T settle(String detector, CompletableFuture<T> future,
                                                BiFunction<FailureReason, String, T> fallback) {
        return future.exceptionally(error -> {
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error;
            log.error("[Forensics] {} detector crashed, using fallback", detector, cause);
            return fallback.apply(FailureReason.UNEXPECTED, DetectorOutcome.describe(cause));
        }).join();
    }

    private <T> CompletableFuture<T> submit(Supplier<T> task) {
        try {
            return CompletableFuture.supplyAsync(task, executor);
        } catch (RejectedExecutionException e) {
            log.warn("[Forensics] Executor saturated, running detector inline");
            try {
                return CompletableFuture.completedFuture(task.get());
            } catch (RuntimeException | Error inline) {
                return CompletableFuture.failedFuture(inline);
            }
        }
    }
}
