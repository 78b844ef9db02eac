package ca.jonathanfritz.dealwatch.config;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Application configuration loaded from ~/.dealwatch/config.yaml.
 * Contains all user-configurable settings.
 */
public class AppConfig {

    private String catalogPath;
    private MatchingSection matching;

    public AppConfig() {
        // Default values
        this.catalogPath = "catalog.yaml";
        this.matching = new MatchingSection();
    }

    /**
     * Creates a default configuration with sensible defaults.
     */
    public static AppConfig defaults() {
        return new AppConfig();
    }

    public String getCatalogPath() {
        return catalogPath;
    }

    public void setCatalogPath(String catalogPath) {
        this.catalogPath = catalogPath;
    }

    public MatchingSection getMatching() {
        return matching;
    }

    public void setMatching(MatchingSection matching) {
        this.matching = matching != null ? matching : new MatchingSection();
    }

    /**
     * Resolves the catalog path relative to the config directory.
     * If the path is absolute, returns it as-is.
     * If the path is relative, resolves it against the config directory.
     *
     * @param configDirectory the directory containing config.yaml
     * @return the resolved path to the product catalog file
     */
    @JsonIgnore
    public Path resolveCatalogPath(Path configDirectory) {
        Path path = Paths.get(catalogPath);
        if (path.isAbsolute()) {
            return path;
        }
        return configDirectory.resolve(path);
    }

    /**
     * Settings that control how keywords are compared with message text.
     */
    public static class MatchingSection {
        private boolean caseSensitive = false;
        private boolean wholeWord = false;
        private boolean regexEnabled = true;

        public boolean isCaseSensitive() {
            return caseSensitive;
        }

        public void setCaseSensitive(boolean caseSensitive) {
            this.caseSensitive = caseSensitive;
        }

        public boolean isWholeWord() {
            return wholeWord;
        }

        public void setWholeWord(boolean wholeWord) {
            this.wholeWord = wholeWord;
        }

        public boolean isRegexEnabled() {
            return regexEnabled;
        }

        public void setRegexEnabled(boolean regexEnabled) {
            this.regexEnabled = regexEnabled;
        }
    }
}
