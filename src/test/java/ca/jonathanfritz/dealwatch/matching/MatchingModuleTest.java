package ca.jonathanfritz.dealwatch.matching;

import static org.junit.jupiter.api.Assertions.*;

import ca.jonathanfritz.dealwatch.config.AppConfig;
import com.google.inject.Guice;
import com.google.inject.Injector;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MatchingModuleTest {

    @TempDir
    Path tempDir;

    @Test
    void fallsBackToBundledCatalog() {
        // Setup: the config directory has no catalog
        Injector injector = Guice.createInjector(new MatchingModule(AppConfig.defaults(), tempDir));

        // Execute
        ProductCatalog catalog = injector.getInstance(ProductCatalog.class);

        // Verify
        assertFalse(catalog.isEmpty());
        assertFalse(catalog.getPricePatterns().isEmpty());
        assertEquals(catalog.getPricePatterns().size(), injector.getInstance(PriceExtractor.class).getPatternCount());
    }

    @Test
    void bundledCatalogMatchesEndToEnd() {
        // Setup
        Injector injector = Guice.createInjector(new MatchingModule(AppConfig.defaults(), tempDir));
        ProductMatcher matcher = injector.getInstance(ProductMatcher.class);

        // Execute
        List<MatchResult> results = matcher.match("Selling iPhone 15, like new, 500€");

        // Verify
        assertEquals(1, results.size());
        assertEquals("iPhone 15", results.get(0).productName());
        assertEquals(500.0, results.get(0).price());
        assertEquals(Currency.EURO, results.get(0).currency());
    }

    @Test
    void loadsUserCatalogFromConfigDirectory() throws IOException {
        // Setup
        Files.writeString(tempDir.resolve("catalog.yaml"), """
                products:
                  - name: Lamp
                    keywords: [lamp]
                """);
        Injector injector = Guice.createInjector(new MatchingModule(AppConfig.defaults(), tempDir));

        // Execute
        ProductCatalog catalog = injector.getInstance(ProductCatalog.class);
        List<MatchResult> results = injector.getInstance(ProductMatcher.class).match("desk lamp");

        // Verify
        assertEquals(1, catalog.getProducts().size());
        assertEquals("Lamp", results.get(0).productName());
        assertEquals(0, injector.getInstance(PriceExtractor.class).getPatternCount());
    }

    @Test
    void honoursCustomCatalogPath() throws IOException {
        // Setup
        Path catalogFile = tempDir.resolve("other").resolve("products.yaml");
        Files.createDirectories(catalogFile.getParent());
        Files.writeString(catalogFile, """
                products:
                  - name: Lamp
                    keywords: [lamp]
                """);
        AppConfig config = AppConfig.defaults();
        config.setCatalogPath(catalogFile.toString());
        Injector injector = Guice.createInjector(new MatchingModule(config, tempDir));

        // Execute
        ProductCatalog catalog = injector.getInstance(ProductCatalog.class);

        // Verify
        assertEquals("Lamp", catalog.getProducts().get(0).getName());
    }

    @Test
    void settingsComeFromConfiguration() {
        // Setup
        AppConfig config = AppConfig.defaults();
        config.getMatching().setCaseSensitive(true);
        config.getMatching().setWholeWord(true);
        config.getMatching().setRegexEnabled(false);
        Injector injector = Guice.createInjector(new MatchingModule(config, tempDir));

        // Execute
        MatchingSettings settings = injector.getInstance(MatchingSettings.class);

        // Verify
        assertTrue(settings.isCaseSensitive());
        assertTrue(settings.isWholeWord());
        assertFalse(settings.isPatternMatchingEnabled());
    }

    @Test
    void engineComponentsAreSingletons() {
        // Setup
        Injector injector = Guice.createInjector(new MatchingModule(AppConfig.defaults(), tempDir));

        // Execute & Verify
        assertSame(injector.getInstance(ProductCatalog.class), injector.getInstance(ProductCatalog.class));
        assertSame(injector.getInstance(PriceExtractor.class), injector.getInstance(PriceExtractor.class));
        assertSame(injector.getInstance(TextNormalizer.class), injector.getInstance(TextNormalizer.class));
    }
}
