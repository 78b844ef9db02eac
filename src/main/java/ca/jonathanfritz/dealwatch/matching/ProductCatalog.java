package ca.jonathanfritz.dealwatch.matching;

import java.util.ArrayList;
import java.util.List;

/**
 * The products to watch for and the patterns used to find prices in messages.
 * Products are evaluated in order, and so are price patterns.
 */
public class ProductCatalog {

    private int version = 1;
    private List<Product> products = new ArrayList<>();
    private List<PricePattern> pricePatterns = new ArrayList<>();
    private PriceNumberFormat priceNumberFormat = new PriceNumberFormat();

    // Default constructor for Jackson deserialization
    public ProductCatalog() {}

    public ProductCatalog(List<Product> products, List<PricePattern> pricePatterns) {
        this.products = products != null ? products : new ArrayList<>();
        this.pricePatterns = pricePatterns != null ? pricePatterns : new ArrayList<>();
    }

    public int getVersion() {
        return version;
    }

    public void setVersion(int version) {
        this.version = version;
    }

    public List<Product> getProducts() {
        return products;
    }

    public void setProducts(List<Product> products) {
        this.products = products != null ? products : new ArrayList<>();
    }

    public List<PricePattern> getPricePatterns() {
        return pricePatterns;
    }

    public void setPricePatterns(List<PricePattern> pricePatterns) {
        this.pricePatterns = pricePatterns != null ? pricePatterns : new ArrayList<>();
    }

    public PriceNumberFormat getPriceNumberFormat() {
        return priceNumberFormat;
    }

    public void setPriceNumberFormat(PriceNumberFormat priceNumberFormat) {
        this.priceNumberFormat = priceNumberFormat != null ? priceNumberFormat : new PriceNumberFormat();
    }

    /**
     * Returns true if the catalog has no products, in which case no message can ever match.
     */
    public boolean isEmpty() {
        return products.isEmpty();
    }

    /**
     * Returns an empty catalog with no products and no price patterns.
     */
    public static ProductCatalog empty() {
        return new ProductCatalog(new ArrayList<>(), new ArrayList<>());
    }
}
