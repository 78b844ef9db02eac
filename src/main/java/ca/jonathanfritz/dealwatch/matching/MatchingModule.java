package ca.jonathanfritz.dealwatch.matching;

import ca.jonathanfritz.dealwatch.config.AppConfig;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Guice module for the matching engine.
 * Provides bindings for the product catalog, the normalizer and matchers built from the user's configuration.
 */
public class MatchingModule extends AbstractModule {

    private static final Logger logger = LogManager.getLogger(MatchingModule.class);

    static final String BUNDLED_CATALOG = "catalog.yaml";

    private final AppConfig appConfig;
    private final Path configDirectory;

    public MatchingModule(AppConfig appConfig, Path configDirectory) {
        this.appConfig = appConfig;
        this.configDirectory = configDirectory;
    }

    @Provides
    @Singleton
    public AppConfig provideAppConfig() {
        return appConfig;
    }

    @Provides
    @Singleton
    public MatchingSettings provideMatchingSettings() {
        final AppConfig.MatchingSection matching = appConfig.getMatching();
        final MatchingSettings settings = MatchingSettings.builder()
                .caseSensitive(matching.isCaseSensitive())
                .wholeWord(matching.isWholeWord())
                .patternMatchingEnabled(matching.isRegexEnabled())
                .build();
        logger.debug("Using {}", settings);
        return settings;
    }

    @Provides
    @Singleton
    public TextNormalizer provideTextNormalizer(MatchingSettings settings) {
        return new TextNormalizer(settings);
    }

    @Provides
    @Singleton
    public KeywordMatcher provideKeywordMatcher(MatchingSettings settings) {
        return new KeywordMatcher(settings);
    }

    @Provides
    @Singleton
    public PriceExtractor providePriceExtractor(ProductCatalog catalog) {
        return new PriceExtractor(catalog.getPricePatterns(), catalog.getPriceNumberFormat().getRegex());
    }

    @Provides
    @Singleton
    public ProductCatalog provideProductCatalog() {
        Path catalogPath = appConfig.resolveCatalogPath(configDirectory);

        // First try to load the user's catalog from the config directory
        ProductCatalogLoader loader = new ProductCatalogLoader();
        ProductCatalog userCatalog = loader.load(catalogPath);

        if (!userCatalog.isEmpty()) {
            logger.info("Loaded {} products from {}", userCatalog.getProducts().size(), catalogPath);
            return userCatalog;
        }

        // Fall back to the bundled example catalog from the classpath
        logger.info("No user catalog found at {}, loading bundled example", catalogPath);
        return loadBundledCatalog(loader);
    }

    private ProductCatalog loadBundledCatalog(ProductCatalogLoader loader) {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(BUNDLED_CATALOG)) {
            if (is == null) {
                logger.warn("No bundled {} found in classpath", BUNDLED_CATALOG);
                return ProductCatalog.empty();
            }
            String yaml = new String(is.readAllBytes(), StandardCharsets.UTF_8);
            return loader.loadFromString(yaml);
        } catch (IOException e) {
            logger.error("Failed to load bundled catalog: {}", e.getMessage());
            return ProductCatalog.empty();
        }
    }
}
