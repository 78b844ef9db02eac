package ca.jonathanfritz.dealwatch.utils;

public class StringUtils {

    public static String coerceNullableString(String value) {
        return org.apache.commons.lang3.StringUtils.isNotBlank(value) ? value.trim() : "";
    }

    /**
     * Cuts text that is longer than maxLength off and suffixes it with an ellipsis
     */
    public static String truncate(String value, int maxLength) {
        if (value == null) {
            return "";
        }
        if (value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength) + "...";
    }

    /**
     * Like {@link #truncate(String, int)}, but also flattens newlines into spaces so that the result fits on one line
     */
    public static String preview(String value, int maxLength) {
        if (value == null) {
            return "";
        }
        return truncate(value.replace('\r', ' ').replace('\n', ' '), maxLength);
    }
}
