package ca.jonathanfritz.dealwatch.matching;

/**
 * An inclusive price range. A missing minimum means zero and a missing maximum means unbounded.
 */
public class PriceRange {

    private Double min;
    private Double max;

    // Default constructor for Jackson deserialization
    public PriceRange() {}

    public PriceRange(Double min, Double max) {
        this.min = min;
        this.max = max;
    }

    public Double getMin() {
        return min;
    }

    public void setMin(Double min) {
        this.min = min;
    }

    public Double getMax() {
        return max;
    }

    public void setMax(Double max) {
        this.max = max;
    }

    public boolean contains(double price) {
        final double lower = min != null ? min : 0;
        final double upper = max != null ? max : Double.POSITIVE_INFINITY;
        return lower <= price && price <= upper;
    }

    @Override
    public String toString() {
        return "PriceRange{" + "min=" + min + ", max=" + max + '}';
    }
}
