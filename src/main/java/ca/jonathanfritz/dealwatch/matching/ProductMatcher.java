package ca.jonathanfritz.dealwatch.matching;

import com.google.inject.Inject;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides which products of the catalog a message refers to.
 * Instances hold no mutable state and may be shared between threads.
 */
public class ProductMatcher {

    private static final Logger logger = LogManager.getLogger(ProductMatcher.class);

    static final String UNKNOWN_PRODUCT_NAME = "Unknown";

    private final List<Product> products;
    private final TextNormalizer textNormalizer;
    private final KeywordMatcher keywordMatcher;
    private final PriceExtractor priceExtractor;

    @Inject
    public ProductMatcher(ProductCatalog catalog, TextNormalizer textNormalizer, KeywordMatcher keywordMatcher, PriceExtractor priceExtractor) {
        this(catalog.getProducts(), textNormalizer, keywordMatcher, priceExtractor);
    }

    public ProductMatcher(List<Product> products, TextNormalizer textNormalizer, KeywordMatcher keywordMatcher, PriceExtractor priceExtractor) {
        this.products = List.copyOf(products);
        this.textNormalizer = textNormalizer;
        this.keywordMatcher = keywordMatcher;
        this.priceExtractor = priceExtractor;
    }

    /**
     * Checks the message against every product in catalog order.
     *
     * @param messageText the raw message text
     * @return one result per matching product, in catalog order. Empty if nothing matched or the message is empty
     */
    public List<MatchResult> match(String messageText) {
        if (messageText == null || messageText.isEmpty()) {
            return List.of();
        }

        final String text = textNormalizer.canonicalize(messageText);

        final List<MatchResult> results = new ArrayList<>();
        for (Product product : products) {
            final List<String> matchedKeywords = findMatchingKeywords(text, product.getKeywords());
            if (matchedKeywords.isEmpty()) {
                continue;
            }

            final Optional<String> excludedBy = findFirstMatchingKeyword(text, product.getExcludeKeywords());
            if (excludedBy.isPresent()) {
                logger.debug("Product {} excluded due to keyword: {}", product.getName(), excludedBy.get());
                continue;
            }

            final PriceRange priceRange = product.getPriceRange();
            if (priceRange == null) {
                results.add(toResult(product, matchedKeywords, null));
                continue;
            }

            // prices are extracted from the original text, look-alike characters included
            final Optional<ExtractedPrice> price = priceExtractor.extract(messageText);
            if (price.isEmpty()) {
                logger.debug("Product {} requires a price but none was found", product.getName());
                continue;
            }
            if (!priceRange.contains(price.get().value())) {
                logger.debug("Price {} outside range {} of product {}", price.get().value(), priceRange, product.getName());
                continue;
            }
            results.add(toResult(product, matchedKeywords, price.get()));
        }
        return results;
    }

    private List<String> findMatchingKeywords(String text, List<String> keywords) {
        final List<String> matched = new ArrayList<>();
        for (String keyword : keywords) {
            if (keyword != null && keywordMatcher.matches(text, textNormalizer.canonicalize(keyword))) {
                matched.add(keyword);
            }
        }
        return matched;
    }

    private Optional<String> findFirstMatchingKeyword(String text, List<String> keywords) {
        return keywords.stream()
                .filter(keyword -> keyword != null && keywordMatcher.matches(text, textNormalizer.canonicalize(keyword)))
                .findFirst();
    }

    private MatchResult toResult(Product product, List<String> matchedKeywords, ExtractedPrice price) {
        final String name = product.getName() != null ? product.getName() : UNKNOWN_PRODUCT_NAME;
        if (price == null) {
            return new MatchResult(name, matchedKeywords, null, Currency.UNKNOWN, product.isNotify());
        }
        return new MatchResult(name, matchedKeywords, price.value(), price.currency(), product.isNotify());
    }
}
