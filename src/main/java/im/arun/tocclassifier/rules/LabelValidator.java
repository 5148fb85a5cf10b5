package im.arun.tocclassifier.rules;

import im.arun.tocclassifier.model.SectionType;
import im.arun.tocclassifier.model.TocEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Last step of the pipeline. Whatever comes in, every label that goes out is in the taxonomy.
 */
public class LabelValidator {
    private static final Logger logger = LoggerFactory.getLogger(LabelValidator.class);

    /**
     * Validate raw labels, e.g. read back from stored text. Unknown or blank labels become {@code other}.
     */
    public Map<Integer, SectionType> validate(Map<Integer, String> rawLabels) {
        Map<Integer, SectionType> validated = new TreeMap<>();
        rawLabels.forEach((index, label) -> {
            if (!SectionType.isValidLabel(label)) {
                logger.debug("Label '{}' at entry {} is not a section type, using other", label, index);
            }
            validated.put(index, SectionType.fromLabel(label));
        });
        return validated;
    }

    /**
     * @param entries Entries the labels belong to
     * @param labels Labels from the sequence rules
     * @return Dense map: entries without a label get {@code other}
     */
    public Map<Integer, SectionType> validate(List<TocEntry> entries, Map<Integer, SectionType> labels) {
        Map<Integer, SectionType> validated = new TreeMap<>();
        for (TocEntry entry : entries) {
            SectionType label = labels.get(entry.getIndex());
            validated.put(entry.getIndex(), label == null ? SectionType.OTHER : label);
        }
        return validated;
    }
}
