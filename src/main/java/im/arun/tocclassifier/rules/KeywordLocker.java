package im.arun.tocclassifier.rules;

import im.arun.tocclassifier.model.SectionType;
import im.arun.tocclassifier.model.TocEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Locks an initial section type onto every entry whose title matches a keyword rule.
 */
public class KeywordLocker {
    private static final Logger logger = LoggerFactory.getLogger(KeywordLocker.class);

    private final KeywordRuleTable ruleTable;

    public KeywordLocker() {
        this(KeywordRuleTable.getInstance());
    }

    public KeywordLocker(KeywordRuleTable ruleTable) {
        this.ruleTable = ruleTable;
    }

    /**
     * @param entries Parsed TOC entries
     * @return Sparse map of entry index to locked section type; unmatched entries are absent
     */
    public Map<Integer, SectionType> lockKeywords(List<TocEntry> entries) {
        Map<Integer, SectionType> locked = new TreeMap<>();
        for (TocEntry entry : entries) {
            if (entry.getTitle() == null || entry.getTitle().isEmpty()) {
                continue;
            }
            ruleTable.firstMatch(entry.getNormalizedTitle())
                .ifPresent(sectionType -> locked.put(entry.getIndex(), sectionType));
        }
        logger.debug("Keyword rules locked {} of {} entries", locked.size(), entries.size());
        return locked;
    }
}
