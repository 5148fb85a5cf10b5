package im.arun.tocclassifier.rules;

import im.arun.tocclassifier.model.SectionType;
import im.arun.tocclassifier.model.TocEntry;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Resolves labels through the heading hierarchy.
 *
 * <p>Entries are walked in TOC order with a stack of (level, label) ancestors. Under a labeled
 * parent a child keeps the parent's label, unless the override table allows the child's own
 * label and the child's title really carries that label's keywords (a "Recommendations"
 * heading inside a findings chapter, for instance). Unlabeled children inherit from their parent.
 */
public class HierarchyPropagator {

    private static final Set<SectionType> STRONG_CONTAINERS = Collections.unmodifiableSet(
        EnumSet.complementOf(EnumSet.of(SectionType.OTHER)));

    private static final Map<SectionType, Set<SectionType>> OVERRIDE_ALLOWED;

    static {
        Map<SectionType, Set<SectionType>> overrides = new EnumMap<>(SectionType.class);
        overrides.put(SectionType.FINDINGS, EnumSet.of(
            SectionType.RECOMMENDATIONS, SectionType.CONCLUSIONS,
            SectionType.ANNEXES, SectionType.APPENDIX, SectionType.BIBLIOGRAPHY));
        overrides.put(SectionType.RECOMMENDATIONS, EnumSet.of(
            SectionType.CONCLUSIONS, SectionType.ANNEXES, SectionType.APPENDIX, SectionType.BIBLIOGRAPHY));
        overrides.put(SectionType.CONCLUSIONS, EnumSet.of(
            SectionType.RECOMMENDATIONS, SectionType.ANNEXES, SectionType.APPENDIX, SectionType.BIBLIOGRAPHY));
        OVERRIDE_ALLOWED = Collections.unmodifiableMap(overrides);
    }

    private final KeywordRuleTable ruleTable;

    public HierarchyPropagator() {
        this(KeywordRuleTable.getInstance());
    }

    public HierarchyPropagator(KeywordRuleTable ruleTable) {
        this.ruleTable = ruleTable;
    }

    /**
     * @param entries Entries in TOC order
     * @param labels Labels so far, possibly sparse
     * @return Dense map with one label per entry
     */
    public Map<Integer, SectionType> propagateHierarchy(List<TocEntry> entries, Map<Integer, SectionType> labels) {
        Map<Integer, SectionType> resolved = new TreeMap<>(labels);
        Deque<Ancestor> stack = new ArrayDeque<>();

        for (TocEntry entry : entries) {
            while (!stack.isEmpty() && stack.peek().level >= entry.getLevel()) {
                stack.pop();
            }

            SectionType parent = stack.isEmpty() ? null : stack.peek().sectionType;
            SectionType locked = resolved.get(entry.getIndex());
            SectionType current = locked == null ? SectionType.OTHER : locked;
            SectionType label = resolve(current, parent, entry);

            resolved.put(entry.getIndex(), label);
            stack.push(new Ancestor(entry.getLevel(), label));
        }
        return resolved;
    }

    private SectionType resolve(SectionType current, SectionType parent, TocEntry entry) {
        if (parent != null && STRONG_CONTAINERS.contains(parent)) {
            if (current == parent || canOverride(current, parent, entry)) {
                return current;
            }
            return parent;
        }
        if (current == SectionType.OTHER && parent != null) {
            return parent;
        }
        return current;
    }

    private boolean canOverride(SectionType current, SectionType parent, TocEntry entry) {
        Set<SectionType> allowed = OVERRIDE_ALLOWED.get(parent);
        if (allowed == null || !allowed.contains(current)) {
            return false;
        }
        // The label must be earned by the title itself, not just carried in from elsewhere.
        return ruleTable.matches(current, entry.getTitle());
    }

    private static final class Ancestor {
        private final int level;
        private final SectionType sectionType;

        private Ancestor(int level, SectionType sectionType) {
            this.level = level;
            this.sectionType = sectionType;
        }
    }
}
