package ca.jonathanfritz.dealwatch.matching;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * The currencies that can be recognized next to a price. Detection is case-insensitive and checks the currencies in
 * declaration order, so a span that mentions both euros and dollars is reported as euros.
 */
public enum Currency {
    EURO("€", "€", "eur", "евро"),
    DOLLAR("$", "$", "usd", "dollar", "доллар"),
    UNKNOWN("");

    private final String symbol;
    private final List<String> tokens;

    Currency(String symbol, String... tokens) {
        this.symbol = symbol;
        this.tokens = List.of(tokens);
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Scans the matched price text for a currency token.
     *
     * @param matchedText the full text span matched by a price pattern, including any currency sign or word
     * @return the first currency whose tokens occur in the span, or {@link #UNKNOWN}
     */
    public static Currency detect(String matchedText) {
        if (matchedText == null || matchedText.isEmpty()) {
            return UNKNOWN;
        }
        final String lowercased = matchedText.toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(currency -> currency.tokens.stream().anyMatch(lowercased::contains))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
