package im.arun.tocclassifier.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Title cleanup and normalization shared by the parser, the keyword rules and chunk lookup.
 */
public final class TitleUtils {

    private static final Pattern DOT_LEADERS = Pattern.compile("\\.{2,}");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private TitleUtils() {}

    /**
     * Replace dot leaders ("Introduction ........ 4") with a single space and trim.
     */
    public static String cleanTitle(String title) {
        if (title == null) {
            return "";
        }
        return DOT_LEADERS.matcher(title).replaceAll(" ").strip();
    }

    /**
     * Normalize a title for matching: trimmed, lower-cased, whitespace runs collapsed.
     */
    public static String normalizeTitle(String title) {
        if (title == null) {
            return "";
        }
        String lowered = title.strip().toLowerCase(Locale.ROOT);
        return WHITESPACE_RUN.matcher(lowered).replaceAll(" ");
    }
}
