package ca.jonathanfritz.dealwatch.matching;

import java.util.List;

/**
 * A product to watch for.
 * A message matches when at least one keyword occurs in it, no exclude keyword occurs in it, and, if a price range is
 * set, a price can be extracted from it that lies within the range.
 */
public class Product {

    private String name;
    private List<String> keywords;
    private List<String> excludeKeywords;
    private PriceRange priceRange;
    private boolean notify = true;

    // Default constructor for Jackson deserialization
    public Product() {}

    public Product(String name, List<String> keywords, List<String> excludeKeywords, PriceRange priceRange, boolean notify) {
        this.name = name;
        this.keywords = keywords;
        this.excludeKeywords = excludeKeywords;
        this.priceRange = boundedOrNull(priceRange);
        this.notify = notify;
    }

    public Product(String name, List<String> keywords) {
        this(name, keywords, null, null, true);
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<String> getKeywords() {
        return keywords != null ? keywords : List.of();
    }

    public void setKeywords(List<String> keywords) {
        this.keywords = keywords;
    }

    public List<String> getExcludeKeywords() {
        return excludeKeywords != null ? excludeKeywords : List.of();
    }

    public void setExcludeKeywords(List<String> excludeKeywords) {
        this.excludeKeywords = excludeKeywords;
    }

    public PriceRange getPriceRange() {
        return priceRange;
    }

    /**
     * A range without either bound, such as {@code price_range: {}}, is the same as no range at all.
     */
    public void setPriceRange(PriceRange priceRange) {
        this.priceRange = boundedOrNull(priceRange);
    }

    private static PriceRange boundedOrNull(PriceRange priceRange) {
        if (priceRange == null || (priceRange.getMin() == null && priceRange.getMax() == null)) {
            return null;
        }
        return priceRange;
    }

    /**
     * Whether a match on this product should be announced. Not evaluated by the matching engine itself.
     */
    public boolean isNotify() {
        return notify;
    }

    public void setNotify(boolean notify) {
        this.notify = notify;
    }

    @Override
    public String toString() {
        return "Product{" + "name='"
                + name + '\'' + ", keywords="
                + keywords + ", excludeKeywords="
                + excludeKeywords + ", priceRange="
                + priceRange + ", notify="
                + notify + '}';
    }
}
