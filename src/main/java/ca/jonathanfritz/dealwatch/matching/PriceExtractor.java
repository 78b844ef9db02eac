package ca.jonathanfritz.dealwatch.matching;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the price in a message by trying the configured {@link PricePattern}s in order.
 * The first pattern that yields a number at or above its minimum value wins; later patterns are not evaluated.
 * Patterns are compiled once, when the extractor is built. Invalid patterns are reported then and skipped afterwards.
 */
public class PriceExtractor {

    private static final Logger logger = LogManager.getLogger(PriceExtractor.class);

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    private final List<Candidate> candidates;

    public PriceExtractor(List<PricePattern> pricePatterns, String numberRegex) {
        final String regex = StringUtils.isNotBlank(numberRegex) ? numberRegex : PriceNumberFormat.DEFAULT_REGEX;

        final List<Candidate> compiled = new ArrayList<>();
        if (pricePatterns != null) {
            for (PricePattern pricePattern : pricePatterns) {
                if (pricePattern == null || StringUtils.isBlank(pricePattern.getPattern())) {
                    logger.warn("Ignoring price pattern without a pattern: {}", pricePattern);
                    continue;
                }
                final CompiledPattern result = CompiledPattern.compile(pricePattern.expand(regex), FLAGS);
                if (!result.isValid()) {
                    logger.warn("Ignoring invalid price pattern '{}': {}", result.source(), result.error());
                    continue;
                }
                compiled.add(new Candidate(pricePattern, result.pattern()));
            }
        }

        if (compiled.isEmpty()) {
            logger.warn("No usable price patterns configured, prices will never be extracted");
        }
        logger.debug("Compiled {} price patterns", compiled.size());
        this.candidates = Collections.unmodifiableList(compiled);
    }

    /**
     * Extracts the first qualifying price from the raw, un-normalized message text.
     *
     * @param text the original message text
     * @return the price and currency, or empty if no pattern yields a qualifying value
     */
    public Optional<ExtractedPrice> extract(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }

        for (Candidate candidate : candidates) {
            final Matcher matcher = candidate.pattern().matcher(text);
            if (!matcher.find()) {
                continue;
            }
            if (matcher.groupCount() < 1 || matcher.group(1) == null) {
                logger.debug("Price pattern '{}' matched without capturing a number", candidate.describe());
                continue;
            }

            final OptionalDouble parsed = PriceParser.parse(matcher.group(1));
            if (parsed.isEmpty()) {
                logger.debug("Could not parse '{}' matched by price pattern '{}'", matcher.group(1), candidate.describe());
                continue;
            }

            final double value = parsed.getAsDouble();
            if (value < candidate.config().getMinValue()) {
                logger.debug("Price {} below min_value {} of pattern '{}', trying next pattern",
                        value, candidate.config().getMinValue(), candidate.describe());
                continue;
            }

            final Currency currency = Currency.detect(matcher.group());
            logger.debug("Price {} {} extracted using pattern '{}'", value, currency.getSymbol(), candidate.describe());
            return Optional.of(new ExtractedPrice(value, currency));
        }

        logger.debug("No price found in message");
        return Optional.empty();
    }

    /**
     * Returns the number of patterns that compiled successfully.
     */
    public int getPatternCount() {
        return candidates.size();
    }

    private record Candidate(PricePattern config, Pattern pattern) {
        String describe() {
            return StringUtils.defaultIfBlank(config.getDescription(), config.getPattern());
        }
    }
}
