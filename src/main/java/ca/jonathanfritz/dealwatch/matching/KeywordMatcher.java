package ca.jonathanfritz.dealwatch.matching;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.regex.Pattern;

/**
 * Decides whether a keyword occurs in a message.
 * Both arguments to {@link #matches(String, String)} must already have been canonicalized by {@link TextNormalizer}.
 */
public class KeywordMatcher {

    private static final Logger logger = LogManager.getLogger(KeywordMatcher.class);

    // \b and \w follow Unicode word rules, so boundaries work between Cyrillic and Latin letters too
    private static final int FLAGS = Pattern.UNICODE_CHARACTER_CLASS;

    private final boolean wholeWord;
    private final boolean patternMatchingEnabled;

    public KeywordMatcher(MatchingSettings settings) {
        this.wholeWord = settings.isWholeWord();
        this.patternMatchingEnabled = settings.isPatternMatchingEnabled();
    }

    /**
     * Tests whether the keyword occurs in the text.
     * If pattern matching is enabled the keyword is evaluated as a regular expression. A keyword that is not a valid
     * regular expression is matched literally instead, and the fallback is logged.
     *
     * @param text    the canonicalized message text
     * @param keyword the canonicalized keyword
     * @return true if the keyword occurs in the text
     */
    public boolean matches(String text, String keyword) {
        if (text == null || keyword == null) {
            return false;
        }

        if (patternMatchingEnabled) {
            final CompiledPattern compiled = compileKeyword(keyword);
            if (compiled.isValid()) {
                return compiled.pattern().matcher(text).find();
            }
            logger.warn("Invalid keyword pattern '{}', falling back to literal matching: {}", keyword, compiled.error());
        }

        return matchesLiterally(text, keyword);
    }

    private CompiledPattern compileKeyword(String keyword) {
        // validate the bare keyword first: wrapping it in a group can turn some malformed patterns into valid ones
        final CompiledPattern bare = CompiledPattern.compile(keyword, FLAGS);
        if (!bare.isValid() || !wholeWord) {
            return bare;
        }
        return CompiledPattern.compile("\\b(?:" + keyword + ")\\b", FLAGS);
    }

    private boolean matchesLiterally(String text, String keyword) {
        if (wholeWord) {
            return Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b", FLAGS)
                    .matcher(text)
                    .find();
        }
        return text.contains(keyword);
    }
}
