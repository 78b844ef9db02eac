package ca.jonathanfritz.dealwatch.matching;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Parses the numeric part of a price whose thousands and decimal separators depend on the author's locale.
 * <p>
 * The later of the last '.' and the last ',' is treated as the decimal separator, but only when it is followed by
 * one or two digits. Every other separator and whitespace character is discarded. This reads "1,234.56",
 * "1.234,56", "1234,56" and "1 234.56" the same way, and reads "1,234" as one thousand two hundred thirty-four.
 */
public final class PriceParser {

    // with UNICODE_CHARACTER_CLASS, \s also covers non-breaking and thin spaces
    private static final Pattern SEPARATORS = Pattern.compile("[.,\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern SURROUNDING_WHITESPACE = Pattern.compile("^\\s+|\\s+$", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern DIGITS = Pattern.compile("\\p{Nd}+(?:\\.\\p{Nd}+)?");

    private PriceParser() {}

    /**
     * @param raw the text captured by a price pattern
     * @return the parsed value, or empty if the text does not reduce to a number
     */
    public static OptionalDouble parse(String raw) {
        if (raw == null) {
            return OptionalDouble.empty();
        }
        final String trimmed = SURROUNDING_WHITESPACE.matcher(raw).replaceAll("");

        final String cleaned = findDecimalSeparator(trimmed)
                .map(pos -> stripSeparators(trimmed.substring(0, pos)) + "." + trimmed.substring(pos + 1))
                .orElseGet(() -> stripSeparators(trimmed));

        if (!DIGITS.matcher(cleaned).matches()) {
            return OptionalDouble.empty();
        }
        final double value;
        try {
            value = new BigDecimal(toAsciiDigits(cleaned)).doubleValue();
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
        return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    // BigDecimal reads one char at a time and rejects digits outside the basic multilingual plane
    private static String toAsciiDigits(String s) {
        final StringBuilder sb = new StringBuilder(s.length());
        s.codePoints().forEach(cp -> {
            final int digit = Character.digit(cp, 10);
            sb.append(digit >= 0 ? (char) ('0' + digit) : (char) cp);
        });
        return sb.toString();
    }

    private static Optional<Integer> findDecimalSeparator(String s) {
        final int candidate = Math.max(s.lastIndexOf('.'), s.lastIndexOf(','));
        // a leading separator has no integer part in front of it
        if (candidate <= 0) {
            return Optional.empty();
        }
        final String fraction = s.substring(candidate + 1);
        final long fractionLength = fraction.codePoints().count();
        if (fractionLength < 1 || fractionLength > 2 || !fraction.codePoints().allMatch(Character::isDigit)) {
            return Optional.empty();
        }
        return Optional.of(candidate);
    }

    private static String stripSeparators(String s) {
        return SEPARATORS.matcher(s).replaceAll("");
    }
}
