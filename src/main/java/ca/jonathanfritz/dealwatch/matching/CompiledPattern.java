package ca.jonathanfritz.dealwatch.matching;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * The outcome of compiling a user-supplied regular expression.
 * Exactly one of {@link #pattern()} and {@link #error()} is non-null, so callers branch on {@link #isValid()} instead
 * of catching {@link PatternSyntaxException} themselves.
 */
public record CompiledPattern(String source, Pattern pattern, String error) {

    public static CompiledPattern compile(String source, int flags) {
        if (source == null) {
            return new CompiledPattern(null, null, "pattern is null");
        }
        try {
            return new CompiledPattern(source, Pattern.compile(source, flags), null);
        } catch (PatternSyntaxException e) {
            return new CompiledPattern(source, null, e.getDescription());
        }
    }

    public boolean isValid() {
        return pattern != null;
    }
}
