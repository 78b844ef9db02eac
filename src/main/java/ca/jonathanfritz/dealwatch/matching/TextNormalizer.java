package ca.jonathanfritz.dealwatch.matching;

import java.util.Locale;
import java.util.Map;

/**
 * Rewrites message text and keywords into a canonical form before they are compared.
 * Cyrillic characters that are visually indistinguishable from Latin ones are replaced with their Latin
 * counterparts, so that a listing spelled "iРhоnе" with Cyrillic letters still matches the keyword "iphone".
 */
public class TextNormalizer {

    private static final Map<Character, Character> CYRILLIC_TO_LATIN = Map.ofEntries(
            // uppercase
            Map.entry('А', 'A'), Map.entry('В', 'B'), Map.entry('Е', 'E'), Map.entry('К', 'K'),
            Map.entry('М', 'M'), Map.entry('Н', 'H'), Map.entry('О', 'O'), Map.entry('Р', 'P'),
            Map.entry('С', 'C'), Map.entry('Т', 'T'), Map.entry('Х', 'X'), Map.entry('У', 'Y'),
            Map.entry('І', 'I'),
            // lowercase
            Map.entry('а', 'a'), Map.entry('е', 'e'), Map.entry('о', 'o'), Map.entry('р', 'p'),
            Map.entry('с', 'c'), Map.entry('у', 'y'), Map.entry('х', 'x'), Map.entry('і', 'i'));

    private final boolean caseSensitive;

    /**
     * Creates a TextNormalizer that case-folds according to the default {@link MatchingSettings}.
     */
    public TextNormalizer() {
        this(MatchingSettings.defaults());
    }

    public TextNormalizer(MatchingSettings settings) {
        this.caseSensitive = settings.isCaseSensitive();
    }

    /**
     * Replaces every look-alike character with its Latin counterpart. All other characters pass through unchanged.
     *
     * @param text the text to normalize, may be null
     * @return the normalized text, or an empty string if the input was null
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        final StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            sb.append(CYRILLIC_TO_LATIN.getOrDefault(c, c));
        }
        return sb.toString();
    }

    /**
     * Normalizes the text and then lowercases it, unless matching is case-sensitive.
     * Both the message text and every keyword must go through this method before they are compared.
     */
    public String canonicalize(String text) {
        final String normalized = normalize(text);
        return caseSensitive ? normalized : normalized.toLowerCase(Locale.ROOT);
    }
}
