package im.arun.tocclassifier.toc;

import im.arun.tocclassifier.config.ClassifierConfig;
import im.arun.tocclassifier.util.RomanNumerals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Annotates TOC lines with roman page tokens and {@code [Front]} markers, given the roman
 * page labels detected in the document ({@code page -> token}).
 *
 * <p>The front-matter end page is found by run analysis over the roman values in page order:
 * a run is a non-decreasing sequence of values, and the end of the last run that is long
 * enough marks the end of front matter.
 */
public class RomanPagination {
    private static final Logger logger = LoggerFactory.getLogger(RomanPagination.class);

    private static final Pattern PAGE_LINE = Pattern.compile(
        "^(?<prefix>.*?\\|\\s*page\\s*)(?<page>\\d+)(?<suffix>\\s*)$");
    private static final Pattern PAGE_LINE_WITH_MARKERS = Pattern.compile(
        "^(?<prefix>.*?\\|\\s*page\\s*)(?<page>\\d+)"
            + "(?<roman>\\s*\\([^)]+\\))?(?<fm>\\s*\\[Front\\])?(?<suffix>\\s*)$");

    private final int frontMatterDivisor;
    private final int minRunLength;

    public RomanPagination() {
        this(new ClassifierConfig());
    }

    public RomanPagination(ClassifierConfig config) {
        this.frontMatterDivisor = config.getFrontMatterDivisor();
        this.minRunLength = config.getRomanMinRunLength();
    }

    /**
     * Append {@code (token)} to every {@code | page N} line whose page has a roman label.
     */
    public String annotateWithRoman(String tocText, Map<Integer, String> pageToRoman) {
        if (tocText == null || tocText.isEmpty()) {
            return tocText;
        }
        return tocText.lines()
            .map(line -> {
                Matcher matcher = PAGE_LINE.matcher(line);
                if (!matcher.matches()) {
                    return line;
                }
                Integer page = parsePage(matcher.group("page"));
                if (page == null) {
                    return line;
                }
                String roman = pageToRoman.get(page);
                if (roman == null || roman.isEmpty()) {
                    return line;
                }
                return matcher.group("prefix") + page + " (" + roman + ")" + matcher.group("suffix");
            })
            .collect(Collectors.joining("\n"));
    }

    /**
     * Mark lines at or before the front-matter end page with {@code [Front]}; clear the marker elsewhere.
     */
    public String annotateWithFrontMatter(String tocText, Map<Integer, String> pageToRoman, Integer totalPages) {
        if (tocText == null || tocText.isEmpty() || pageToRoman == null || pageToRoman.isEmpty()) {
            return tocText;
        }

        int frontEnd = resolveFrontMatterEnd(pageToRoman, totalPages).orElse(0);
        logger.info("Front matter ends at page {}", frontEnd);

        return tocText.lines()
            .map(line -> {
                Matcher matcher = PAGE_LINE_WITH_MARKERS.matcher(line);
                if (!matcher.matches()) {
                    return line;
                }
                Integer page = parsePage(matcher.group("page"));
                if (page == null) {
                    return line;
                }
                String roman = matcher.group("roman") == null ? "" : matcher.group("roman");
                String marker = page <= frontEnd ? " [Front]" : "";
                return matcher.group("prefix") + matcher.group("page") + roman + marker + matcher.group("suffix");
            })
            .collect(Collectors.joining("\n"));
    }

    /**
     * Resolve the last page of roman-paginated front matter.
     *
     * @param pageToRoman Roman page labels keyed by physical page
     * @param totalPages Document page count; labels beyond the first part of the document are ignored
     * @return End page, or empty when no run is long enough
     */
    public Optional<Integer> resolveFrontMatterEnd(Map<Integer, String> pageToRoman, Integer totalPages) {
        List<PageValue> values = collectValues(pageToRoman, totalPages);
        if (values.isEmpty()) {
            return Optional.empty();
        }

        List<PageValue> lowerCase = values.stream()
            .filter(value -> RomanNumerals.isLowerCase(value.token))
            .collect(Collectors.toList());
        if (hasMonotonicRun(lowerCase)) {
            values = lowerCase;
        }
        return lastLongRunEnd(values);
    }

    private Integer parsePage(String pageText) {
        try {
            return Integer.parseInt(pageText);
        } catch (NumberFormatException e) {
            logger.debug("Page number out of range, leaving line as is: {}", pageText);
            return null;
        }
    }

    private List<PageValue> collectValues(Map<Integer, String> pageToRoman, Integer totalPages) {
        List<PageValue> values = new ArrayList<>();
        if (pageToRoman == null) {
            return values;
        }
        pageToRoman.forEach((page, token) -> {
            if (page == null || isBeyondFrontThreshold(page, totalPages)) {
                return;
            }
            RomanNumerals.toInt(token).ifPresent(value -> values.add(new PageValue(page, value, token)));
        });
        values.sort(Comparator.comparingInt((PageValue v) -> v.page).thenComparingInt(v -> v.value));
        return values;
    }

    private boolean isBeyondFrontThreshold(int page, Integer totalPages) {
        return totalPages != null && totalPages > 0 && page > totalPages / (double) frontMatterDivisor;
    }

    private boolean hasMonotonicRun(List<PageValue> values) {
        if (values.size() < minRunLength) {
            return false;
        }
        int runLength = 1;
        int previous = values.get(0).value;
        for (PageValue current : values.subList(1, values.size())) {
            if (current.value < previous) {
                runLength = 1;
                previous = current.value;
                continue;
            }
            runLength++;
            previous = current.value;
            if (runLength >= minRunLength) {
                return true;
            }
        }
        return false;
    }

    private Optional<Integer> lastLongRunEnd(List<PageValue> values) {
        List<Run> runs = new ArrayList<>();
        Run run = new Run(values.get(0).page);
        int previous = values.get(0).value;
        boolean restartedAtOne = false;

        for (PageValue current : values.subList(1, values.size())) {
            // Numbering restarting at "i" after a longer sequence ends the front matter scan.
            if (current.value == 1 && previous > 1) {
                runs.add(run);
                restartedAtOne = true;
                break;
            }
            if (current.value < previous) {
                runs.add(run);
                run = new Run(current.page);
                previous = current.value;
                continue;
            }
            run.extend(current.page);
            previous = current.value;
        }
        if (!restartedAtOne) {
            runs.add(run);
        }

        Integer end = null;
        for (Run candidate : runs) {
            if (candidate.length >= minRunLength) {
                end = candidate.end;
            }
        }
        return Optional.ofNullable(end);
    }

    private static final class PageValue {
        private final int page;
        private final int value;
        private final String token;

        private PageValue(int page, int value, String token) {
            this.page = page;
            this.value = value;
            this.token = token;
        }
    }

    private static final class Run {
        private int end;
        private int length = 1;

        private Run(int start) {
            this.end = start;
        }

        private void extend(int page) {
            end = page;
            length++;
        }
    }
}
