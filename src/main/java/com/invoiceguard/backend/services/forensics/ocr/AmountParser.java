package com.invoiceguard.backend.services.forensics.ocr;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

/**
 * Finds currency-like tokens in OCR text: an optional currency symbol, digit groups with optional
 * ',' or '.' thousands markers, and a two-digit decimal tail.
 */
@Component
public class AmountParser {

    static final Pattern AMOUNT_PATTERN = Pattern.compile(
            "(?<![\\d.,])[$€£]?\\s?(?:\\d{1,3}(?:[.,]\\d{3})+|\\d+)[.,]\\d{2}(?![\\d])");

    private static final Pattern CURRENCY_AND_SPACES = Pattern.compile("[$€£\\s]");

    public List<ParsedAmount> parse(String text) {
        if (text == null || text.isBlank()) return List.of();

        List<ParsedAmount> amounts = new ArrayList<>();
        Matcher matcher = AMOUNT_PATTERN.matcher(text);
        while (matcher.find()) {
            String raw = matcher.group().trim();
            normalize(raw).ifPresent(value -> amounts.add(new ParsedAmount(raw, value)));
        }
        return amounts;
    }

    /**
     * "1,234.56" -> 1234.56 (',' is a thousands separator when both appear),
     * "12,50" -> 12.50 (a lone ',' is the decimal separator). Unparseable tokens yield empty.
     */
    public static Optional<Double> normalize(String raw) {
        if (raw == null) return Optional.empty();

        String cleaned = CURRENCY_AND_SPACES.matcher(raw).replaceAll("");
        boolean hasComma = cleaned.indexOf(',') >= 0;
        boolean hasDot = cleaned.indexOf('.') >= 0;
        if (hasComma && hasDot) {
            cleaned = cleaned.replace(",", "");
        } else if (hasComma) {
            cleaned = cleaned.replace(',', '.');
        }

        if (cleaned.isEmpty()) return Optional.empty();
        try {
            double value = Double.parseDouble(cleaned);
            return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
