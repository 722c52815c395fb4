package com.invoiceguard.backend.services.forensics.ocr;

import java.awt.image.BufferedImage;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.invoiceguard.backend.services.forensics.DetectorOutcome;
import com.invoiceguard.backend.services.forensics.FailureReason;
import com.invoiceguard.backend.services.forensics.RiskVerdicts;
import com.invoiceguard.backend.services.ocr.OcrEngineStatus;
import com.invoiceguard.backend.services.ocr.OcrService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * OCRs the page, pulls out monetary amounts and checks that they reconcile:
 * the largest amount is taken as the total and the rest as line items.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OcrArithmeticValidator {

    public static final String LABEL = "OCR";
    public static final int MAX_TEXT_CHARS = 500;

    static final double TOO_FEW_AMOUNTS_POINTS = 40.0;
    static final double DUPLICATE_AMOUNTS_POINTS = 20.0;
    static final double SUM_MISMATCH_POINTS = 35.0;

    private final OcrService ocrService;
    private final OcrImagePreprocessor preprocessor;
    private final AmountParser amountParser;

    /**
     * Never throws: a disabled or missing engine, or a failed extraction, yields {@link OcrResult#inconclusive}.
     */
    public OcrResult validate(BufferedImage image, double toleranceRatio) {
        long startMs = System.currentTimeMillis();
        OcrResult result = run(image, toleranceRatio).orElseGet((reason, message) -> {
            log.warn("[OCR] Inconclusive: reason={} error={}", reason, message);
            return OcrResult.inconclusive(reason, message);
        });
        log.info("[OCR] Completed: score={} verdict='{}' amounts={} elapsedMs={}",
                result.score(), result.verdict(), result.amounts().size(), System.currentTimeMillis() - startMs);
        return result;
    }

    DetectorOutcome<OcrResult> run(BufferedImage image, double toleranceRatio) {
        OcrEngineStatus status = ocrService.status();
        if (status == null) {
            return DetectorOutcome.failure(FailureReason.ENGINE_UNAVAILABLE, "Tesseract not found");
        }
        if (status.disabled()) {
            return DetectorOutcome.failure(FailureReason.ENGINE_DISABLED, status.error());
        }
        if (!status.available()) {
            return DetectorOutcome.failure(FailureReason.ENGINE_UNAVAILABLE, status.error());
        }

        DetectorOutcome<String> extraction = DetectorOutcome.capture(FailureReason.EXTRACTION_FAILED,
                () -> ocrService.extractText(preprocessor.preprocess(image)));
        if (!extraction.isSuccess()) {
            return DetectorOutcome.failure(extraction.failureReason(), extraction.message());
        }

        String text = extraction.value();
        List<ParsedAmount> amounts = amountParser.parse(text);
        List<Double> values = amounts.stream().map(ParsedAmount::value).collect(Collectors.toList());
        AmountFindings findings = scoreAmounts(values, toleranceRatio);

        double score = Math.min(100.0, findings.score());
        return DetectorOutcome.success(new OcrResult(
                score,
                RiskVerdicts.forScore(score, LABEL),
                findings.flags(),
                displayText(text),
                amounts,
                null));
    }

    static String displayText(String text) {
        if (text == null) return "";
        String cleaned = text.replace("\u0000", "");
        return cleaned.length() <= MAX_TEXT_CHARS ? cleaned : cleaned.substring(0, MAX_TEXT_CHARS);
    }

    static AmountFindings scoreAmounts(List<Double> values, double toleranceRatio) {
        List<String> flags = new ArrayList<>();
        double score = 0.0;

        if (values.size() < 2) {
            score += TOO_FEW_AMOUNTS_POINTS;
            flags.add("Too few amounts detected by OCR (< 2).");
        }

        List<BigDecimal> duplicates = duplicateAmounts(values);
        if (!duplicates.isEmpty()) {
            score += DUPLICATE_AMOUNTS_POINTS;
            String listed = duplicates.stream()
                    .map(value -> String.format(Locale.ROOT, "%.2f", value))
                    .collect(Collectors.joining(", "));
            flags.add("Duplicate amounts detected: " + listed);
        }

        if (sumMismatch(values, toleranceRatio)) {
            score += SUM_MISMATCH_POINTS;
            flags.add("Line items do not sum to the total within the allowed tolerance.");
        }

        return new AmountFindings(score, flags);
    }

    static List<BigDecimal> duplicateAmounts(List<Double> values) {
        Map<BigDecimal, Integer> counts = new HashMap<>();
        for (Double value : values) {
            BigDecimal rounded = BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_EVEN);
            counts.merge(rounded, 1, Integer::sum);
        }
        return counts.entrySet().stream()
                .filter(entry -> entry.getValue() > 1)
                .map(Map.Entry::getKey)
                .sorted()
                .collect(Collectors.toList());
    }

    /**
     * Needs at least three amounts. The largest is the claimed total; the mismatch ratio is
     * |sum(others) - total| / total. A non-positive total cannot be checked.
     */
    static boolean sumMismatch(List<Double> values, double toleranceRatio) {
        if (values.size() < 3) return false;

        List<Double> sorted = new ArrayList<>(values);
        sorted.sort(Double::compare);
        double total = sorted.get(sorted.size() - 1);
        if (total <= 0) return false;

        double lineItems = 0.0;
        for (int i = 0; i < sorted.size() - 1; i++) {
            lineItems += sorted.get(i);
        }
        return Math.abs(lineItems - total) / total > toleranceRatio;
    }

    record AmountFindings(double score, List<String> flags) {
    }
}
