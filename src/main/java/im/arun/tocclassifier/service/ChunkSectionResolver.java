package im.arun.tocclassifier.service;

import im.arun.tocclassifier.model.SectionType;
import im.arun.tocclassifier.model.TocClassification;
import im.arun.tocclassifier.model.TocEntry;
import im.arun.tocclassifier.util.TitleUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up the section type of a document chunk from the classified TOC, using the chunk's
 * page first and its heading trail second.
 */
public class ChunkSectionResolver {

    /**
     * @return Normalized title to the indices of the entries carrying it, in TOC order
     */
    public Map<String, List<Integer>> normalizedTitleIndex(List<TocEntry> entries) {
        Map<String, List<Integer>> index = new LinkedHashMap<>();
        for (TocEntry entry : entries) {
            index.computeIfAbsent(entry.getNormalizedTitle(), key -> new ArrayList<>()).add(entry.getIndex());
        }
        return index;
    }

    /**
     * Entry with the greatest page not after the chunk page. On equal pages the later entry wins.
     */
    public Optional<TocEntry> selectByPage(List<TocEntry> entries, Integer chunkPage) {
        if (chunkPage == null) {
            return Optional.empty();
        }
        TocEntry best = null;
        for (TocEntry entry : entries) {
            if (!entry.hasPage() || entry.getPage() > chunkPage) {
                continue;
            }
            if (best == null || entry.getPage() >= best.getPage()) {
                best = entry;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Match the innermost heading of the chunk that appears in the TOC.
     *
     * @param entries Classified entries
     * @param titleIndex Result of {@link #normalizedTitleIndex(List)}
     * @param headings Heading trail of the chunk, outermost first
     * @param chunkPage Page of the chunk, may be null
     */
    public Optional<TocEntry> selectByHeadings(List<TocEntry> entries, Map<String, List<Integer>> titleIndex,
                                               List<String> headings, Integer chunkPage) {
        if (headings == null || headings.isEmpty()) {
            return Optional.empty();
        }

        for (int i = headings.size() - 1; i >= 0; i--) {
            List<Integer> candidates = titleIndex.get(TitleUtils.normalizeTitle(headings.get(i)));
            if (candidates == null || candidates.isEmpty()) {
                continue;
            }

            TocEntry best = null;
            TocEntry last = null;
            for (Integer candidate : candidates) {
                TocEntry entry = entryAt(entries, candidate);
                if (entry == null) {
                    continue;
                }
                last = entry;
                if (chunkPage == null || !entry.hasPage() || entry.getPage() > chunkPage) {
                    continue;
                }
                if (best == null || entry.getPage() >= best.getPage()) {
                    best = entry;
                }
            }
            if (best != null) {
                return Optional.of(best);
            }
            if (last != null) {
                return Optional.of(last);
            }
        }
        return Optional.empty();
    }

    // Title indices may come from another entry list.
    private TocEntry entryAt(List<TocEntry> entries, Integer index) {
        if (index == null || index < 0 || index >= entries.size()) {
            return null;
        }
        return entries.get(index);
    }

    public SectionType sectionTypeForChunk(TocClassification classification, Integer chunkPage, List<String> headings) {
        List<TocEntry> entries = classification.getEntries();
        Optional<TocEntry> match = selectByPage(entries, chunkPage);
        if (match.isEmpty()) {
            match = selectByHeadings(entries, normalizedTitleIndex(entries), headings, chunkPage);
        }
        return match.map(entry -> classification.labelFor(entry.getIndex())).orElse(SectionType.OTHER);
    }

    /**
     * Title-keyed view of the labels for callers that still look sections up by title.
     * When titles repeat, the later entry wins.
     */
    public Map<String, SectionType> legacyTitleMapping(TocClassification classification) {
        Map<String, SectionType> mapping = new LinkedHashMap<>();
        for (TocEntry entry : classification.getEntries()) {
            mapping.put(entry.getNormalizedTitle(), classification.labelFor(entry.getIndex()));
        }
        return mapping;
    }
}
