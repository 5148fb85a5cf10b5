package im.arun.tocclassifier.model;

import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Result of classifying one document's TOC: the parsed entries, the keyword-locked labels
 * and the final, dense, taxonomy-valid labels keyed by entry index.
 */
@Value
public class TocClassification {

    List<TocEntry> entries;

    /** Sparse: only entries whose title matched a keyword rule. */
    Map<Integer, SectionType> lockedLabels;

    /** Dense: one label per entry index. */
    Map<Integer, SectionType> labels;

    RuleTrace trace;

    public TocClassification(List<TocEntry> entries, Map<Integer, SectionType> lockedLabels,
                             Map<Integer, SectionType> labels, RuleTrace trace) {
        this.entries = List.copyOf(entries);
        this.lockedLabels = Collections.unmodifiableMap(new TreeMap<>(lockedLabels));
        this.labels = Collections.unmodifiableMap(new TreeMap<>(labels));
        this.trace = trace;
    }

    public static TocClassification empty() {
        return new TocClassification(List.of(), Map.of(), Map.of(), new RuleTrace());
    }

    public SectionType labelFor(int index) {
        return labels.getOrDefault(index, SectionType.OTHER);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
