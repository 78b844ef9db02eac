package ca.jonathanfritz.dealwatch.matching;

/**
 * The numeric sub-pattern substituted into every {@link PricePattern}.
 * It must contain exactly one capturing group around the number.
 */
public class PriceNumberFormat {

    /**
     * One to four digits, optionally followed by comma- or space-separated thousands groups and a one or two digit
     * fraction after a dot or comma.
     */
    public static final String DEFAULT_REGEX = "(\\d{1,4}(?:[,\\s]\\d{3})*(?:[.,]\\d{1,2})?)";

    private String regex = DEFAULT_REGEX;

    // Default constructor for Jackson deserialization
    public PriceNumberFormat() {}

    public PriceNumberFormat(String regex) {
        this.regex = regex;
    }

    public String getRegex() {
        return regex;
    }

    public void setRegex(String regex) {
        this.regex = regex;
    }
}
