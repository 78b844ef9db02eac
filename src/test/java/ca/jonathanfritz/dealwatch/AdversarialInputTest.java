package ca.jonathanfritz.dealwatch;

import ca.jonathanfritz.dealwatch.config.AppConfig;
import ca.jonathanfritz.dealwatch.matching.Currency;
import ca.jonathanfritz.dealwatch.matching.KeywordMatcher;
import ca.jonathanfritz.dealwatch.matching.MatchResult;
import ca.jonathanfritz.dealwatch.matching.MatchingModule;
import ca.jonathanfritz.dealwatch.matching.MatchingSettings;
import ca.jonathanfritz.dealwatch.matching.PriceExtractor;
import ca.jonathanfritz.dealwatch.matching.PriceNumberFormat;
import ca.jonathanfritz.dealwatch.matching.PricePattern;
import ca.jonathanfritz.dealwatch.matching.Product;
import ca.jonathanfritz.dealwatch.matching.ProductMatcher;
import ca.jonathanfritz.dealwatch.matching.TextNormalizer;
import com.google.inject.Guice;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Adversarial input tests to verify that hostile or malformed messages and catalogs
 * are handled without crashes.
 */
class AdversarialInputTest {

    @TempDir
    Path tempDir;

    private ProductMatcher bundledMatcher() {
        return Guice.createInjector(new MatchingModule(AppConfig.defaults(), tempDir)).getInstance(ProductMatcher.class);
    }

    // ==================== Message Tests ====================

    @Test
    @Timeout(10)
    void veryLongMessage() {
        // Setup: a message of several hundred thousand characters
        String message = "blah ".repeat(100_000) + "iphone 15 for 500€";

        // Execute
        List<MatchResult> results = bundledMatcher().match(message);

        // Verify
        assertEquals(1, results.size());
        assertEquals(500.0, results.get(0).price());
    }

    @Test
    @Timeout(10)
    void longDigitRunDoesNotHang() {
        // Setup
        String message = "ps5 " + "1".repeat(50_000) + " € and $" + "9".repeat(50_000);

        // Execute & Verify: completes without hanging
        assertDoesNotThrow(() -> bundledMatcher().match(message));
    }

    @Test
    void controlCharactersAndNullBytes() {
        // Setup
        String message = "iphone\u0000 15\u0007 for\t$400\u001b[31m";

        // Execute & Verify
        assertDoesNotThrow(() -> bundledMatcher().match(message));
    }

    @Test
    void emojiAndSurrogatePairs() {
        // Setup
        String message = "🔥🔥 iPhone 15 🔥 only 450€ 📱";

        // Execute
        List<MatchResult> results = bundledMatcher().match(message);

        // Verify
        assertEquals(1, results.size());
        assertEquals(Currency.EURO, results.get(0).currency());
    }

    @Test
    void nonLatinDigitsAreParsed() {
        // Setup: Arabic-Indic digits
        PriceExtractor extractor = new PriceExtractor(
                List.of(new PricePattern("\\$\\s*{price}", 1, null)), PriceNumberFormat.DEFAULT_REGEX);

        // Execute & Verify
        assertEquals(250.0, extractor.extract("$٢٥٠").get().value());
    }

    // ==================== Catalog Tests ====================

    @Test
    void hostileKeywordsDoNotThrow() {
        // Setup: keywords that are broken or unusual regular expressions
        Product product = new Product("Hostile", List.of("(", ")", "[", "\\", "*", "?+", "{1,", "\\Q", "(?<name"));
        ProductMatcher matcher = new ProductMatcher(
                List.of(product),
                new TextNormalizer(),
                new KeywordMatcher(MatchingSettings.defaults()),
                new PriceExtractor(List.of(), null));

        // Execute
        List<MatchResult> results = matcher.match("nothing special (really) \\ *");

        // Verify: the literal keywords that occur in the message matched
        assertEquals(1, results.size());
        assertTrue(results.get(0).matchedKeywords().containsAll(List.of("(", ")", "\\", "*")));
    }

    @Test
    void hostilePricePatternsAreSkipped() {
        // Setup
        List<PricePattern> patterns = List.of(
                new PricePattern("((("),
                new PricePattern("{price"),
                new PricePattern("no placeholder"),
                new PricePattern("\\$\\s*{price}", 1, null));

        // Execute
        PriceExtractor extractor = new PriceExtractor(patterns, PriceNumberFormat.DEFAULT_REGEX);

        // Verify: invalid patterns are dropped, the pattern without a group never yields a price
        assertEquals(2, extractor.getPatternCount());
        assertEquals(12.0, extractor.extract("no placeholder here, $12").get().value());
    }
}
