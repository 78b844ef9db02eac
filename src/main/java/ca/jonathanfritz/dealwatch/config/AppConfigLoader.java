package ca.jonathanfritz.dealwatch.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads application configuration from YAML files.
 * Handles auto-creation of config with defaults when file doesn't exist.
 */
public class AppConfigLoader {

    private static final Logger logger = LogManager.getLogger(AppConfigLoader.class);
    private static final String CONFIG_FILE_NAME = "config.yaml";

    private final ObjectMapper yamlMapper;

    public AppConfigLoader() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Result of loading configuration, includes whether the file was newly created.
     */
    public record LoadResult(AppConfig config, Path configPath, boolean wasCreated) {}

    /**
     * Loads configuration from the specified directory.
     * If config.yaml doesn't exist, creates it with default values.
     *
     * @param configDirectory the directory to load config from (typically ~/.dealwatch/)
     * @return the load result containing the config and whether it was newly created
     */
    public LoadResult loadOrCreate(Path configDirectory) {
        Path configPath = configDirectory.resolve(CONFIG_FILE_NAME);

        if (Files.exists(configPath)) {
            return loadExisting(configPath);
        } else {
            return createDefault(configDirectory, configPath);
        }
    }

    private LoadResult loadExisting(Path configPath) {
        try {
            if (Files.size(configPath) == 0) {
                logger.debug("Config file is empty, using defaults: {}", configPath);
                return new LoadResult(AppConfig.defaults(), configPath, false);
            }

            AppConfig config = yamlMapper.readValue(configPath.toFile(), AppConfig.class);
            if (config == null) {
                config = AppConfig.defaults();
            }
            logger.info("Loaded configuration from {}", configPath);
            return new LoadResult(config, configPath, false);
        } catch (IOException e) {
            logger.error("Failed to load config from {}: {}. Using defaults.", configPath, e.getMessage());
            return new LoadResult(AppConfig.defaults(), configPath, false);
        }
    }

    private LoadResult createDefault(Path configDirectory, Path configPath) {
        AppConfig config = AppConfig.defaults();

        try {
            if (!Files.exists(configDirectory)) {
                Files.createDirectories(configDirectory);
                logger.debug("Created config directory: {}", configDirectory);
            }

            Files.writeString(configPath, generateConfigWithComments(config));
            logger.info("Created default configuration at {}", configPath);

            return new LoadResult(config, configPath, true);
        } catch (IOException e) {
            logger.error("Failed to create config file at {}: {}. Using defaults.", configPath, e.getMessage());
            return new LoadResult(config, configPath, false);
        }
    }

    /**
     * Generates YAML configuration content with helpful comments.
     */
    private String generateConfigWithComments(AppConfig config) {
        final AppConfig.MatchingSection matching = config.getMatching();
        return "# DealWatch Configuration\n" + "# Edit this file to customize application behavior.\n"
                + "\n"
                + "# Path to the product catalog (relative to this config directory, or absolute)\n"
                + "# If the file is missing or empty, the bundled example catalog is used\n"
                + "# Default: catalog.yaml\n"
                + "catalog_path: "
                + config.getCatalogPath() + "\n" + "\n"
                + "# How product keywords are compared with message text\n"
                + "matching:\n"
                + "  # Distinguish upper and lower case letters\n"
                + "  case_sensitive: "
                + matching.isCaseSensitive() + "\n"
                + "  # Only match keywords that form whole words\n"
                + "  whole_word: "
                + matching.isWholeWord() + "\n"
                + "  # Treat keywords as regular expressions (invalid ones are matched literally)\n"
                + "  regex_enabled: "
                + matching.isRegexEnabled() + "\n";
    }
}
