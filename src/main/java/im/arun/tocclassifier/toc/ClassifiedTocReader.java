package im.arun.tocclassifier.toc;

import im.arun.tocclassifier.model.SectionType;
import im.arun.tocclassifier.model.TocEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Reads the label column back out of a previously rendered classified TOC.
 * See {@link TocLineFormatter} for the line format.
 */
public class ClassifiedTocReader {
    private static final Logger logger = LoggerFactory.getLogger(ClassifiedTocReader.class);

    private static final Pattern PAGE_SUFFIX = Pattern.compile(
        "\\s*\\|\\s*page\\s*\\d+(?:\\s*\\([^)]+\\))?(?:\\s*\\[Front\\])?\\s*$");
    private static final Pattern ROMAN_SUFFIX = Pattern.compile(
        "\\|\\s*page\\s*\\d+\\s*\\([^)]+\\)\\s*(?:\\[Front\\])?\\s*$");
    private static final Pattern FRONT_SUFFIX = Pattern.compile("\\[Front\\]\\s*$");

    /**
     * Read one label per entry from the classified text.
     *
     * @param entries Entries parsed from the raw TOC the classified text was rendered from
     * @param classifiedText Rendered classified TOC
     * @return Labels keyed by entry index, or empty when the text does not line up with the entries
     */
    public Optional<Map<Integer, SectionType>> readLabels(List<TocEntry> entries, String classifiedText) {
        List<String> lines = nonBlankLines(classifiedText);
        if (entries.isEmpty() || lines.size() != entries.size()) {
            logger.debug("Classified TOC has {} lines for {} entries", lines.size(), entries.size());
            return Optional.empty();
        }

        Map<Integer, SectionType> labels = new TreeMap<>();
        for (int i = 0; i < lines.size(); i++) {
            String withoutPage = PAGE_SUFFIX.matcher(lines.get(i)).replaceFirst("");
            int separator = withoutPage.lastIndexOf('|');
            if (separator < 0) {
                logger.warn("Classified TOC line has no label column: {}", lines.get(i));
                return Optional.empty();
            }

            String candidate = withoutPage.substring(separator + 1);
            Optional<SectionType> sectionType = SectionType.parse(candidate);
            if (sectionType.isEmpty()) {
                logger.warn("Classified TOC line has unknown label '{}'", candidate.strip());
                return Optional.empty();
            }
            labels.put(entries.get(i).getIndex(), sectionType.get());
        }
        return Optional.of(labels);
    }

    public boolean hasRomanTokens(String classifiedText) {
        return nonBlankLines(classifiedText).stream().anyMatch(line -> ROMAN_SUFFIX.matcher(line).find());
    }

    public boolean hasFrontMarkers(String classifiedText) {
        return nonBlankLines(classifiedText).stream().anyMatch(line -> FRONT_SUFFIX.matcher(line).find());
    }

    private List<String> nonBlankLines(String text) {
        if (text == null) {
            return List.of();
        }
        return text.lines().filter(line -> !line.isBlank()).collect(Collectors.toList());
    }
}
