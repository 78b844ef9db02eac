package ca.jonathanfritz.dealwatch.matching;

/**
 * Process-wide keyword matching behaviour.
 * Use {@link #defaults()} for standard configuration or {@link #builder()} for customization.
 */
public class MatchingSettings {

    private static final boolean DEFAULT_CASE_SENSITIVE = false;
    private static final boolean DEFAULT_WHOLE_WORD = false;
    private static final boolean DEFAULT_PATTERN_MATCHING_ENABLED = true;

    private final boolean caseSensitive;
    private final boolean wholeWord;
    private final boolean patternMatchingEnabled;

    private MatchingSettings(boolean caseSensitive, boolean wholeWord, boolean patternMatchingEnabled) {
        this.caseSensitive = caseSensitive;
        this.wholeWord = wholeWord;
        this.patternMatchingEnabled = patternMatchingEnabled;
    }

    /**
     * Returns the default settings: case-insensitive, substring matching, keywords treated as regular expressions.
     */
    public static MatchingSettings defaults() {
        return new MatchingSettings(DEFAULT_CASE_SENSITIVE, DEFAULT_WHOLE_WORD, DEFAULT_PATTERN_MATCHING_ENABLED);
    }

    /**
     * Returns a builder for creating custom settings.
     */
    public static Builder builder() {
        return new Builder();
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    /**
     * When true, keywords only match if they are delimited by word boundaries in the message text.
     */
    public boolean isWholeWord() {
        return wholeWord;
    }

    /**
     * When true, keywords are compiled as regular expressions, falling back to literal matching if they are invalid.
     */
    public boolean isPatternMatchingEnabled() {
        return patternMatchingEnabled;
    }

    @Override
    public String toString() {
        return "MatchingSettings{" + "caseSensitive="
                + caseSensitive + ", wholeWord="
                + wholeWord + ", patternMatchingEnabled="
                + patternMatchingEnabled + '}';
    }

    public static class Builder {
        private boolean caseSensitive = DEFAULT_CASE_SENSITIVE;
        private boolean wholeWord = DEFAULT_WHOLE_WORD;
        private boolean patternMatchingEnabled = DEFAULT_PATTERN_MATCHING_ENABLED;

        public Builder caseSensitive(boolean caseSensitive) {
            this.caseSensitive = caseSensitive;
            return this;
        }

        public Builder wholeWord(boolean wholeWord) {
            this.wholeWord = wholeWord;
            return this;
        }

        public Builder patternMatchingEnabled(boolean patternMatchingEnabled) {
            this.patternMatchingEnabled = patternMatchingEnabled;
            return this;
        }

        public MatchingSettings build() {
            return new MatchingSettings(caseSensitive, wholeWord, patternMatchingEnabled);
        }
    }
}
