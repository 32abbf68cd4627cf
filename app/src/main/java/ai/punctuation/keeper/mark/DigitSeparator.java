package ai.punctuation.keeper.mark;

import java.util.regex.Pattern;

/**
 * Separators protected when they sit between two digits, as in {@code 3,14} or {@code 1.000}.
 *
 * <p>Each separator has a private-use escape character that stands in for it while marks are
 * detected. Escape characters can never be configured as marks.
 */
public enum DigitSeparator {
    COMMA(',', '\uE000'),
    PERIOD('.', '\uE001');

    private final char separator;
    private final char escape;
    private final Pattern between;

    DigitSeparator(char separator, char escape) {
        this.separator = separator;
        this.escape = escape;
        this.between = Pattern.compile("(?<=\\p{Nd})" + Pattern.quote(String.valueOf(separator)) + "(?=\\p{Nd})");
    }

    public static String escapeAll(String text) {
        String result = text;
        for (DigitSeparator value : values()) {
            if (result.indexOf(value.separator) >= 0) {
                result = value.between.matcher(result).replaceAll(String.valueOf(value.escape));
            }
        }
        return result;
    }

    public static String unescapeAll(String text) {
        String result = text;
        for (DigitSeparator value : values()) {
            result = result.replace(value.escape, value.separator);
        }
        return result;
    }

    public static boolean isReserved(int codePoint) {
        for (DigitSeparator value : values()) {
            if (value.escape == codePoint) {
                return true;
            }
        }
        return false;
    }
}
