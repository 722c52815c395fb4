package com.invoiceguard.backend.services.forensics.ocr;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

class AmountParserTest {

    private final AmountParser parser = new AmountParser();

    @Test
    void parse_findsAmountsWithSymbolsAndSeparators() {
        String text = "Widget  $1,234.56\nService fee 12,50\nShipping € 7.00\nTotal 1.254,06";

        List<ParsedAmount> amounts = parser.parse(text);

        assertEquals(List.of("$1,234.56", "12,50", "€ 7.00", "1.254,06"),
                amounts.stream().map(ParsedAmount::raw).collect(Collectors.toList()));
        assertEquals(1234.56, amounts.get(0).value(), 1e-9);
        assertEquals(12.50, amounts.get(1).value(), 1e-9);
        assertEquals(7.00, amounts.get(2).value(), 1e-9);
    }

    @Test
    void parse_ignoresIntegersDatesAndLongDecimals() {
        List<ParsedAmount> amounts = parser.parse("Invoice 2024 qty 3 rate 0.125 ref 12.3");

        assertTrue(amounts.isEmpty(), amounts.toString());
    }

    @Test
    void parse_emptyOrNullText_returnsEmpty() {
        assertTrue(parser.parse(null).isEmpty());
        assertTrue(parser.parse("   ").isEmpty());
    }

    @Test
    void normalize_treatsCommaAsThousandsWhenDotPresent() {
        assertEquals(Optional.of(1234.56), AmountParser.normalize("$1,234.56"));
    }

    @Test
    void normalize_treatsLoneCommaAsDecimal() {
        assertEquals(Optional.of(12.5), AmountParser.normalize("12,50"));
    }

    @Test
    void normalize_unparseable_returnsEmpty() {
        assertEquals(Optional.empty(), AmountParser.normalize("$"));
        assertEquals(Optional.empty(), AmountParser.normalize("1.2.3"));
        assertEquals(Optional.empty(), AmountParser.normalize(null));
    }
}
