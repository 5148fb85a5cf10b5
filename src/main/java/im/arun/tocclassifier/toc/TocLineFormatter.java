package im.arun.tocclassifier.toc;

import im.arun.tocclassifier.model.SectionType;
import im.arun.tocclassifier.model.TocEntry;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders classified TOC entries back to text, one line per entry:
 * <pre>
 *   [H2] Title | findings | page 12 (iv) [Front]
 * </pre>
 */
public class TocLineFormatter {

    public String formatLine(TocEntry entry, SectionType sectionType) {
        String indentation = entry.getIndentation() == null ? "" : entry.getIndentation();
        String label = (sectionType == null ? SectionType.OTHER : sectionType).getLabel();

        StringBuilder line = new StringBuilder()
            .append(indentation)
            .append("[H").append(entry.getLevel()).append("] ")
            .append(entry.getTitle())
            .append(" | ").append(label);

        if (entry.getPage() == null) {
            return line.toString();
        }

        line.append(" | page ").append(entry.getPage());
        if (entry.getRoman() != null) {
            line.append(" (").append(entry.getRoman()).append(")");
        }
        if (entry.isFm()) {
            line.append(" [Front]");
        }
        return line.toString();
    }

    /**
     * Render all entries; indices without a label are rendered as {@code other}.
     */
    public String render(List<TocEntry> entries, Map<Integer, SectionType> labels) {
        return entries.stream()
            .map(entry -> formatLine(entry, labels.getOrDefault(entry.getIndex(), SectionType.OTHER)))
            .collect(Collectors.joining("\n"));
    }
}
