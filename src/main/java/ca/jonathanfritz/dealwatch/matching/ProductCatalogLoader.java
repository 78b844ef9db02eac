package ca.jonathanfritz.dealwatch.matching;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads the product catalog from YAML files.
 * Handles missing files, empty files, and invalid YAML gracefully.
 */
public class ProductCatalogLoader {

    private static final Logger logger = LogManager.getLogger(ProductCatalogLoader.class);

    private final ObjectMapper yamlMapper;

    public ProductCatalogLoader() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Loads the catalog from a file path.
     * Returns an empty catalog if the file doesn't exist, is empty, or contains invalid YAML.
     *
     * @param path the path to the YAML catalog file
     * @return the loaded catalog, or an empty catalog on error
     */
    public ProductCatalog load(Path path) {
        if (path == null) {
            logger.debug("Catalog path is null, returning empty catalog");
            return ProductCatalog.empty();
        }

        if (!Files.exists(path)) {
            logger.debug("Catalog file does not exist: {}", path);
            return ProductCatalog.empty();
        }

        try {
            if (Files.size(path) == 0) {
                logger.debug("Catalog file is empty: {}", path);
                return ProductCatalog.empty();
            }
            try (InputStream is = Files.newInputStream(path)) {
                return validate(yamlMapper.readValue(is, ProductCatalog.class));
            }
        } catch (IOException e) {
            logger.error("Failed to load catalog from {}: {}", path, e.getMessage());
            return ProductCatalog.empty();
        }
    }

    /**
     * Loads the catalog from a YAML string.
     *
     * @param yaml the YAML content as a string
     * @return the loaded catalog, or an empty catalog on error
     */
    public ProductCatalog loadFromString(String yaml) {
        if (yaml == null || yaml.isBlank()) {
            logger.debug("YAML string is null or blank, returning empty catalog");
            return ProductCatalog.empty();
        }

        try {
            return validate(yamlMapper.readValue(yaml, ProductCatalog.class));
        } catch (IOException e) {
            logger.error("Failed to parse catalog YAML: {}", e.getMessage());
            return ProductCatalog.empty();
        }
    }

    private ProductCatalog validate(ProductCatalog catalog) {
        if (catalog == null) {
            return ProductCatalog.empty();
        }

        // a bare "-" in a yaml list deserializes to null
        catalog.getProducts().removeIf(Objects::isNull);
        catalog.getPricePatterns().removeIf(Objects::isNull);

        for (Product product : catalog.getProducts()) {
            if (product.getKeywords().isEmpty()) {
                logger.warn("Product {} has no keywords and will never match", product.getName());
            }
        }
        logger.info("Loaded {} products and {} price patterns",
                catalog.getProducts().size(), catalog.getPricePatterns().size());
        return catalog;
    }
}
