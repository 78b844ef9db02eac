package ca.jonathanfritz.dealwatch.matching;

/**
 * Describes where a price appears in a message.
 * The pattern is a regular expression containing the literal token {@value #PRICE_PLACEHOLDER}, which is replaced by
 * the catalog's numeric sub-pattern before evaluation. Its first capturing group must be the number.
 */
public class PricePattern {

    public static final String PRICE_PLACEHOLDER = "{price}";

    private String pattern;
    private double minValue;
    private String description;

    // Default constructor for Jackson deserialization
    public PricePattern() {}

    public PricePattern(String pattern, double minValue, String description) {
        this.pattern = pattern;
        this.minValue = minValue;
        this.description = description;
    }

    public PricePattern(String pattern) {
        this(pattern, 0, null);
    }

    public String getPattern() {
        return pattern;
    }

    public void setPattern(String pattern) {
        this.pattern = pattern;
    }

    /**
     * Values below this floor are ignored, so that a later pattern gets a chance to find a plausible price.
     */
    public double getMinValue() {
        return minValue;
    }

    public void setMinValue(double minValue) {
        this.minValue = minValue;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    /**
     * Substitutes the numeric sub-pattern for the placeholder.
     */
    public String expand(String numberRegex) {
        return pattern.replace(PRICE_PLACEHOLDER, numberRegex);
    }

    @Override
    public String toString() {
        return "PricePattern{" + "pattern='"
                + pattern + '\'' + ", minValue="
                + minValue + ", description='"
                + description + '\'' + '}';
    }
}
