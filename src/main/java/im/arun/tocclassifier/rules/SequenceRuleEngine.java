package im.arun.tocclassifier.rules;

import im.arun.tocclassifier.config.ClassifierConfig;
import im.arun.tocclassifier.model.DocumentContext;
import im.arun.tocclassifier.model.RuleTrace;
import im.arun.tocclassifier.model.SectionType;
import im.arun.tocclassifier.model.TocEntry;
import im.arun.tocclassifier.toc.RomanPagination;
import im.arun.tocclassifier.util.RomanNumerals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Structural corrections that need whole-document signals: page count, roman front-matter
 * pagination and where the annexes start.
 *
 * <p>The passes run in a fixed order and each one relies on the corrections of the passes
 * before it:
 * <ol start="0">
 *   <li>short document: everything is executive summary, nothing else runs</li>
 *   <li>front matter must sit in the first third of the document</li>
 *   <li>roman front matter only holds front matter, executive summary and acronyms</li>
 *   <li>entries after the roman pages drop labels that only belong in front matter</li>
 *   <li>executive summary dominates the roman pages once it starts</li>
 *   <li>roman front matter label check again, after passes 3 and 4</li>
 *   <li>explicit annex titles become annexes</li>
 *   <li>nothing but annex-type content after the first annex</li>
 *   <li>a single contiguous executive summary</li>
 *   <li>front matter needs a front page</li>
 * </ol>
 * Page-dependent passes do nothing without a page count; roman passes do nothing without
 * front-matter markers or roman page tokens.
 */
public class SequenceRuleEngine {
    private static final Logger logger = LoggerFactory.getLogger(SequenceRuleEngine.class);

    public static final String SHORT_DOCUMENT = "short-document";
    public static final String FRONT_MATTER_BOUNDARY = "front-matter-boundary";
    public static final String ROMAN_RESTRICTION = "roman-restriction";
    public static final String ROMAN_BOUNDARY_RESET = "roman-boundary-reset";
    public static final String EXEC_SUMMARY_DOMINANCE = "exec-summary-dominance";
    public static final String ROMAN_RECHECK = "roman-recheck";
    public static final String EXPLICIT_ANNEX = "explicit-annex";
    public static final String ANNEX_BOUNDARY = "annex-boundary";
    public static final String EXEC_SUMMARY_UNIQUENESS = "exec-summary-uniqueness";
    public static final String FRONT_MATTER_FRONT_PAGES = "front-matter-front-pages";

    private static final Set<SectionType> ROMAN_ALLOWED = Collections.unmodifiableSet(EnumSet.of(
        SectionType.FRONT_MATTER, SectionType.EXECUTIVE_SUMMARY, SectionType.ACRONYMS));

    private static final Set<SectionType> PRE_CONTENT = Collections.unmodifiableSet(EnumSet.of(
        SectionType.FRONT_MATTER, SectionType.EXECUTIVE_SUMMARY, SectionType.ACRONYMS,
        SectionType.INTRODUCTION, SectionType.CONTEXT, SectionType.METHODOLOGY,
        SectionType.FINDINGS, SectionType.RECOMMENDATIONS, SectionType.CONCLUSIONS));

    private final KeywordRuleTable ruleTable;
    private final RomanPagination romanPagination;
    private final int shortDocumentMaxPages;
    private final int frontMatterDivisor;

    public SequenceRuleEngine() {
        this(new ClassifierConfig());
    }

    public SequenceRuleEngine(ClassifierConfig config) {
        this(config, KeywordRuleTable.getInstance());
    }

    public SequenceRuleEngine(ClassifierConfig config, KeywordRuleTable ruleTable) {
        this.ruleTable = ruleTable;
        this.romanPagination = new RomanPagination(config);
        this.shortDocumentMaxPages = config.getShortDocumentMaxPages();
        this.frontMatterDivisor = config.getFrontMatterDivisor();
    }

    public Map<Integer, SectionType> applySequenceRules(
            List<TocEntry> entries, Map<Integer, SectionType> labels, DocumentContext context) {
        return applySequenceRules(entries, labels, context, new RuleTrace());
    }

    /**
     * Run all passes over a copy of the labels.
     *
     * @param entries Entries in TOC order with contiguous indices
     * @param labels Labels after hierarchy propagation
     * @param context Document facts; may be null
     * @param trace Receives every label change
     * @return Corrected labels
     */
    public Map<Integer, SectionType> applySequenceRules(
            List<TocEntry> entries, Map<Integer, SectionType> labels, DocumentContext context, RuleTrace trace) {
        Objects.requireNonNull(entries, "entries");
        Objects.requireNonNull(labels, "labels");
        requireContiguousIndices(entries);

        Run run = new Run(entries, labels, context == null ? DocumentContext.empty() : context, trace);

        if (applyShortDocumentOverride(run)) {
            return run.labels;
        }
        applyFrontMatterBoundary(run);
        applyRomanRestriction(run, ROMAN_RESTRICTION);
        applyRomanBoundaryReset(run);
        applyExecSummaryDominance(run);
        applyRomanRestriction(run, ROMAN_RECHECK);
        applyExplicitAnnexDetection(run);
        applyAnnexBoundary(run);
        applyExecSummaryUniqueness(run);
        applyFrontMatterRequiresFrontPages(run);
        return run.labels;
    }

    private boolean applyShortDocumentOverride(Run run) {
        Integer totalPages = run.context.getTotalPages();
        if (!run.context.hasTotalPages() || totalPages > shortDocumentMaxPages) {
            return false;
        }
        for (TocEntry entry : run.entries) {
            run.relabel(SHORT_DOCUMENT, entry.getIndex(), SectionType.EXECUTIVE_SUMMARY);
        }
        return true;
    }

    private void applyFrontMatterBoundary(Run run) {
        if (run.firstThirdPage == null) {
            return;
        }
        for (TocEntry entry : run.entries) {
            if (entry.hasPage() && entry.getPage() > run.firstThirdPage
                    && run.labelOf(entry) == SectionType.FRONT_MATTER) {
                run.relabel(FRONT_MATTER_BOUNDARY, entry.getIndex(), SectionType.OTHER);
            }
        }

        // Annex titles listed within the first third belong to a front-matter index.
        for (TocEntry entry : run.entries) {
            if (!entry.hasPage() || entry.getPage() > run.firstThirdPage) {
                continue;
            }
            String normalizedTitle = entry.getNormalizedTitle();
            if (normalizedTitle != null && !normalizedTitle.isEmpty()
                    && ruleTable.matches(SectionType.ANNEXES, normalizedTitle)) {
                run.relabel(FRONT_MATTER_BOUNDARY, entry.getIndex(), SectionType.FRONT_MATTER);
            }
        }
    }

    private void applyRomanRestriction(Run run, String pass) {
        if (run.romanRange == null) {
            return;
        }
        if (ROMAN_RESTRICTION.equals(pass)) {
            logger.info("Applying roman front-matter scope through page {}", run.romanRange.end);
        }
        for (TocEntry entry : run.entries) {
            if (!entry.hasPage() || entry.getPage() > run.romanRange.end) {
                continue;
            }
            if (!ROMAN_ALLOWED.contains(run.labelOf(entry))) {
                run.relabel(pass, entry.getIndex(), SectionType.FRONT_MATTER);
            }
        }
    }

    private void applyRomanBoundaryReset(Run run) {
        if (run.romanRange == null) {
            return;
        }
        Deque<Ancestor> stack = new ArrayDeque<>();

        for (TocEntry entry : run.entries) {
            while (!stack.isEmpty() && stack.peek().level >= entry.getLevel()) {
                stack.pop();
            }

            SectionType current = run.labelOf(entry);
            if (!entry.hasPage() || entry.getPage() <= run.romanRange.end) {
                if (current != null) {
                    stack.push(new Ancestor(entry.getLevel(), current));
                }
                continue;
            }

            SectionType parent = stack.isEmpty() ? null : stack.peek().sectionType;
            SectionType resolved = resolveAfterRomanPages(entry, parent, current);
            if (resolved != null) {
                run.relabel(ROMAN_BOUNDARY_RESET, entry.getIndex(), resolved);
                stack.push(new Ancestor(entry.getLevel(), resolved));
            } else if (current != null) {
                stack.push(new Ancestor(entry.getLevel(), current));
            }
        }
    }

    private SectionType resolveAfterRomanPages(TocEntry entry, SectionType parent, SectionType current) {
        if (parent == SectionType.EXECUTIVE_SUMMARY) {
            return SectionType.EXECUTIVE_SUMMARY;
        }
        if (ruleTable.matches(SectionType.EXECUTIVE_SUMMARY, entry.getTitle())) {
            return SectionType.EXECUTIVE_SUMMARY;
        }
        if (ruleTable.matches(SectionType.ACRONYMS, entry.getTitle())) {
            return SectionType.ACRONYMS;
        }
        if (ROMAN_ALLOWED.contains(current)) {
            return SectionType.OTHER;
        }
        return null;
    }

    private void applyExecSummaryDominance(Run run) {
        if (run.romanRange == null) {
            return;
        }

        Integer startIndex = null;
        for (TocEntry entry : run.entries) {
            if (!run.romanRange.contains(entry)) {
                continue;
            }
            if (run.labelOf(entry) == SectionType.EXECUTIVE_SUMMARY
                    || ruleTable.matches(SectionType.EXECUTIVE_SUMMARY, entry.getTitle())) {
                run.relabel(EXEC_SUMMARY_DOMINANCE, entry.getIndex(), SectionType.EXECUTIVE_SUMMARY);
                startIndex = entry.getIndex() + 1;
                break;
            }
        }
        if (startIndex == null) {
            return;
        }

        for (TocEntry entry : run.entries) {
            if (entry.getIndex() < startIndex || !run.romanRange.contains(entry)) {
                continue;
            }
            SectionType label;
            if (ruleTable.matches(SectionType.FRONT_MATTER, entry.getTitle())) {
                label = SectionType.FRONT_MATTER;
            } else if (ruleTable.matches(SectionType.ACRONYMS, entry.getTitle())) {
                label = SectionType.ACRONYMS;
            } else {
                label = SectionType.EXECUTIVE_SUMMARY;
            }
            run.relabel(EXEC_SUMMARY_DOMINANCE, entry.getIndex(), label);
        }
    }

    private void applyExplicitAnnexDetection(Run run) {
        for (TocEntry entry : run.entries) {
            if (ruleTable.isExplicitAnnex(entry.getTitle()) && run.labelOf(entry) != SectionType.FRONT_MATTER) {
                run.relabel(EXPLICIT_ANNEX, entry.getIndex(), SectionType.ANNEXES);
            }
        }
    }

    private void applyAnnexBoundary(Run run) {
        int annexStart = -1;
        for (TocEntry entry : run.entries) {
            if (run.labelOf(entry) == SectionType.ANNEXES) {
                annexStart = entry.getIndex();
                break;
            }
        }
        if (annexStart < 0) {
            return;
        }
        for (TocEntry entry : run.entries) {
            if (entry.getIndex() > annexStart && PRE_CONTENT.contains(run.labelOf(entry))) {
                run.relabel(ANNEX_BOUNDARY, entry.getIndex(), SectionType.ANNEXES);
            }
        }
    }

    private void applyExecSummaryUniqueness(Run run) {
        boolean seenExecSummary = false;
        boolean inExecSummary = false;
        for (TocEntry entry : run.entries) {
            if (run.labelOf(entry) == SectionType.EXECUTIVE_SUMMARY) {
                if (seenExecSummary && !inExecSummary) {
                    run.relabel(EXEC_SUMMARY_UNIQUENESS, entry.getIndex(), SectionType.FINDINGS);
                } else {
                    seenExecSummary = true;
                    inExecSummary = true;
                }
            } else {
                inExecSummary = false;
            }
        }
    }

    private void applyFrontMatterRequiresFrontPages(Run run) {
        if (run.firstThirdPage == null) {
            return;
        }
        for (TocEntry entry : run.entries) {
            if (run.labelOf(entry) != SectionType.FRONT_MATTER || entry.isFm()) {
                continue;
            }
            boolean onFrontPage = entry.hasPage() && entry.getPage() <= run.firstThirdPage;
            if (onFrontPage && ruleTable.matches(SectionType.FRONT_MATTER, entry.getTitle())) {
                continue;
            }
            run.relabel(FRONT_MATTER_FRONT_PAGES, entry.getIndex(), SectionType.OTHER);
        }
    }

    /**
     * Page span of the roman front matter. Explicit {@code [Front]} markers win; without them
     * the parsed roman tokens within the first third of the document are used.
     */
    RomanRange findRomanRange(List<TocEntry> entries, DocumentContext context, Double firstThirdPage) {
        TreeSet<Integer> frontPages = new TreeSet<>();
        for (TocEntry entry : entries) {
            if (entry.isFm() && entry.hasPage() && entry.getPage() != 0) {
                frontPages.add(entry.getPage());
            }
        }
        if (!frontPages.isEmpty()) {
            return new RomanRange(frontPages.first(), frontPages.last());
        }

        Map<Integer, String> pageToRoman = new LinkedHashMap<>();
        for (TocEntry entry : entries) {
            if (entry.getRoman() == null || !entry.hasPage() || entry.getPage() <= 0) {
                continue;
            }
            if (firstThirdPage != null && entry.getPage() > firstThirdPage) {
                continue;
            }
            if (RomanNumerals.isRomanToken(entry.getRoman())) {
                pageToRoman.putIfAbsent(entry.getPage(), entry.getRoman());
            }
        }
        if (pageToRoman.isEmpty()) {
            return null;
        }

        TreeSet<Integer> romanPages = new TreeSet<>(pageToRoman.keySet());
        int end = romanPagination.resolveFrontMatterEnd(pageToRoman, context.getTotalPages())
            .orElse(romanPages.last());
        return new RomanRange(romanPages.first(), end);
    }

    private static void requireContiguousIndices(List<TocEntry> entries) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).getIndex() != i) {
                throw new IllegalArgumentException(
                    "TOC entry indices must be contiguous from 0, found " + entries.get(i).getIndex() + " at position " + i);
            }
        }
    }

    static final class RomanRange {
        final int start;
        final int end;

        RomanRange(int start, int end) {
            this.start = start;
            this.end = end;
        }

        boolean contains(TocEntry entry) {
            return entry.hasPage() && entry.getPage() >= start && entry.getPage() <= end;
        }
    }

    private static final class Ancestor {
        private final int level;
        private final SectionType sectionType;

        private Ancestor(int level, SectionType sectionType) {
            this.level = level;
            this.sectionType = sectionType;
        }
    }

    /**
     * State of one engine invocation.
     */
    private final class Run {
        private final List<TocEntry> entries;
        private final Map<Integer, SectionType> labels;
        private final DocumentContext context;
        private final RuleTrace trace;
        private final Double firstThirdPage;
        private final RomanRange romanRange;

        private Run(List<TocEntry> entries, Map<Integer, SectionType> labels, DocumentContext context, RuleTrace trace) {
            this.entries = entries;
            this.labels = new TreeMap<>(labels);
            this.context = context;
            this.trace = trace == null ? new RuleTrace() : trace;
            this.firstThirdPage = context.hasTotalPages()
                ? context.getTotalPages() / (double) frontMatterDivisor
                : null;
            this.romanRange = findRomanRange(entries, context, firstThirdPage);
        }

        private SectionType labelOf(TocEntry entry) {
            return labels.get(entry.getIndex());
        }

        private void relabel(String pass, int index, SectionType to) {
            SectionType from = labels.get(index);
            if (from == to) {
                return;
            }
            labels.put(index, to);
            trace.record(pass, index, from, to);
            logger.debug("{}: entry {} {} -> {}", pass, index, from, to);
        }
    }
}
