package im.arun.tocclassifier.toc;

import im.arun.tocclassifier.model.TocEntry;
import im.arun.tocclassifier.util.TitleUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses raw TOC text into structured entries.
 *
 * <p>One entry per line, in the form:
 * <pre>
 *   [H2] Heading Title | page 12 (iv) [Front]
 * </pre>
 * The page suffix is optional, and so are the roman token and the front-matter marker
 * after it. Lines that do not follow this grammar are skipped.
 */
public class TocParser {
    private static final Logger logger = LoggerFactory.getLogger(TocParser.class);

    static final Pattern TOC_LINE_PATTERN = Pattern.compile(
        "^(?<indent>\\s*)\\[H(?<level>\\d+)\\]\\s*(?<title>.*?)"
            + "(?:\\s*\\|\\s*page\\s*(?<page>\\d+)"
            + "(?:\\s*\\((?<roman>[^)]+)\\))?\\s*(?<fm>\\[Front\\])?)?\\s*$",
        Pattern.CASE_INSENSITIVE
    );

    /**
     * Parse TOC text. Entry indices are assigned in line order, starting at 0.
     *
     * @param tocText Raw TOC text, may be null or empty
     * @return Parsed entries, never null
     */
    public List<TocEntry> parse(String tocText) {
        List<TocEntry> entries = new ArrayList<>();
        if (tocText == null || tocText.isEmpty()) {
            return entries;
        }

        int skipped = 0;
        for (String line : tocText.lines().toList()) {
            if (line.isBlank()) {
                continue;
            }

            TocEntry entry = parseLine(line, entries.size());
            if (entry == null) {
                skipped++;
                continue;
            }
            entries.add(entry);
        }

        if (skipped > 0) {
            logger.debug("Skipped {} unrecognized TOC lines", skipped);
        }
        return entries;
    }

    /**
     * Parse a single line, or return null when it is not a TOC entry.
     */
    TocEntry parseLine(String line, int index) {
        Matcher matcher = TOC_LINE_PATTERN.matcher(line);
        if (!matcher.matches()) {
            return null;
        }

        int level;
        try {
            level = Integer.parseInt(matcher.group("level"));
        } catch (NumberFormatException e) {
            logger.debug("Heading level out of range: {}", line);
            return null;
        }

        String title = TitleUtils.cleanTitle(matcher.group("title"));
        String roman = matcher.group("roman");
        if (roman != null) {
            roman = roman.strip();
            if (roman.isEmpty()) {
                roman = null;
            }
        }

        return TocEntry.builder()
            .index(index)
            .title(title)
            .normalizedTitle(TitleUtils.normalizeTitle(title))
            .level(level)
            .page(parsePage(matcher.group("page")))
            .roman(roman)
            .fm(matcher.group("fm") != null)
            .indentation(matcher.group("indent"))
            .originalLine(line)
            .build();
    }

    private Integer parsePage(String pageText) {
        if (pageText == null || pageText.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(pageText);
        } catch (NumberFormatException e) {
            logger.debug("Failed to parse page number: {}", pageText);
            return null;
        }
    }
}
