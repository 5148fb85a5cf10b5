package im.arun.tocclassifier.util;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Roman numeral helpers for front-matter pagination ("i", "ii", ... "xiv").
 * Tokens containing M are rejected: front matter never runs that long.
 */
public final class RomanNumerals {

    private static final Pattern ROMAN_GRAMMAR = Pattern.compile(
        "^M{0,4}(CM|CD|D?C{0,3})(XC|XL|L?X{0,3})(IX|IV|V?I{0,3})$");
    private static final int MAX_TOKEN_LENGTH = 6;
    private static final Map<Character, Integer> VALUES = Map.of(
        'I', 1, 'V', 5, 'X', 10, 'L', 50, 'C', 100, 'D', 500, 'M', 1000);

    private RomanNumerals() {}

    /**
     * Whether a token looks like a roman page label.
     */
    public static boolean isRomanToken(String token) {
        if (token == null) {
            return false;
        }
        String stripped = token.strip();
        if (stripped.isEmpty() || stripped.length() > MAX_TOKEN_LENGTH || stripped.chars().allMatch(Character::isDigit)) {
            return false;
        }
        String normalized = stripped.toUpperCase(Locale.ROOT);
        if (normalized.indexOf('M') >= 0) {
            return false;
        }
        return ROMAN_GRAMMAR.matcher(normalized).matches();
    }

    /**
     * Subtractive parse ("iv" = 4). Empty for blank tokens, tokens with M, and unknown characters.
     */
    public static Optional<Integer> toInt(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String normalized = token.strip().toUpperCase(Locale.ROOT);
        if (normalized.isEmpty() || normalized.indexOf('M') >= 0) {
            return Optional.empty();
        }

        int total = 0;
        int previous = 0;
        for (int i = normalized.length() - 1; i >= 0; i--) {
            Integer value = VALUES.get(normalized.charAt(i));
            if (value == null) {
                return Optional.empty();
            }
            if (value < previous) {
                total -= value;
            } else {
                total += value;
                previous = value;
            }
        }
        return Optional.of(total);
    }

    /**
     * True when the token has cased characters and all of them are lower case.
     */
    public static boolean isLowerCase(String token) {
        if (token == null) {
            return false;
        }
        String stripped = token.strip();
        return stripped.equals(stripped.toLowerCase(Locale.ROOT))
            && !stripped.equals(stripped.toUpperCase(Locale.ROOT));
    }
}
