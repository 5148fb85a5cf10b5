package im.arun.tocclassifier.rules;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import im.arun.tocclassifier.config.ClassifierConfig;
import im.arun.tocclassifier.model.DocumentContext;
import im.arun.tocclassifier.model.RuleTrace;
import im.arun.tocclassifier.model.SectionType;
import im.arun.tocclassifier.model.TocEntry;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SequenceRuleEngineTest {

    private static final DocumentContext THIRTY_PAGES = DocumentContext.of(30);

    private final SequenceRuleEngine engine = new SequenceRuleEngine();

    @Test
    void romanBoundaryMarksAllPriorPagesFrontMatter() {
        List<TocEntry> entries = List.of(
            entry(0, "Key personnel", 3, null, true),
            entry(1, "Contents", 4, "i", true),
            entry(2, "List of figures", 6, null, true),
            entry(3, "List of tables", 7, "iv", true),
            entry(4, "Executive summary", 8, null, false));

        Map<Integer, SectionType> result = engine.applySequenceRules(entries, allOther(entries), THIRTY_PAGES);

        assertThat(result).containsEntry(0, SectionType.FRONT_MATTER)
            .containsEntry(1, SectionType.FRONT_MATTER)
            .containsEntry(2, SectionType.FRONT_MATTER)
            .containsEntry(3, SectionType.FRONT_MATTER);
        assertThat(result.get(4)).isNotEqualTo(SectionType.FRONT_MATTER);
    }

    @Test
    void allRomanPagesStayFrontMatter() {
        List<TocEntry> entries = List.of(
            entry(0, "Contents", 2, "i", true),
            entry(1, "List of figures", 3, "ii", true),
            entry(2, "List of tables", 4, "iii", true));

        Map<Integer, SectionType> result = engine.applySequenceRules(entries, allOther(entries), THIRTY_PAGES);

        assertThat(result.values()).containsOnly(SectionType.FRONT_MATTER);
    }

    @Test
    void nonRomanPagesBeforeFirstRomanAreFrontMatter() {
        List<TocEntry> entries = List.of(
            entry(0, "Key personnel", 1, null, true),
            entry(1, "Contents", 3, "i", true),
            entry(2, "List of figures", 4, null, true),
            entry(3, "List of tables", 5, "ii", true),
            entry(4, "Executive summary", 6, null, false));

        Map<Integer, SectionType> result = engine.applySequenceRules(entries, allOther(entries), THIRTY_PAGES);

        assertThat(result).containsEntry(0, SectionType.FRONT_MATTER)
            .containsEntry(3, SectionType.FRONT_MATTER);
        assertThat(result.get(4)).isNotEqualTo(SectionType.FRONT_MATTER);
    }

    @Test
    void boundaryStopsWhenRomanNumbersDecrease() {
        List<TocEntry> entries = List.of(
            entry(0, "Contents", 3, "i", true),
            entry(1, "List of figures", 4, "ii", true),
            entry(2, "List of tables", 5, "iii", true),
            entry(3, "Annex", 6, "i", false),
            entry(4, "Executive summary", 7, null, false));

        Map<Integer, SectionType> result = engine.applySequenceRules(entries, allOther(entries), THIRTY_PAGES);

        assertThat(result).containsEntry(0, SectionType.FRONT_MATTER)
            .containsEntry(1, SectionType.FRONT_MATTER)
            .containsEntry(2, SectionType.FRONT_MATTER);
        assertThat(result.get(3)).isNotEqualTo(SectionType.FRONT_MATTER);
        assertThat(result.get(4)).isNotEqualTo(SectionType.FRONT_MATTER);
    }

    @Test
    void lateRomanPagesDoNotSetBoundary() {
        List<TocEntry> entries = List.of(
            entry(0, "Key personnel", 2, null, false),
            entry(1, "Contents", 12, "i", false));

        Map<Integer, SectionType> result = engine.applySequenceRules(entries, allOther(entries), THIRTY_PAGES);

        assertThat(result).containsEntry(0, SectionType.OTHER);
    }

    @Test
    void singleLaterRomanAfterDecreaseDoesNotExtendBoundary() {
        List<TocEntry> entries = List.of(
            entry(0, "Contents", 3, "i", true),
            entry(1, "List of figures", 4, "ii", true),
            entry(2, "List of tables", 5, "iii", true),
            entry(3, "Later section", 6, "i", false));

        Map<Integer, SectionType> result = engine.applySequenceRules(entries, allOther(entries), THIRTY_PAGES);

        assertThat(result).containsEntry(2, SectionType.FRONT_MATTER)
            .containsEntry(3, SectionType.OTHER);
    }

    @Test
    void laterMarkedRunExtendsBoundary() {
        List<TocEntry> entries = List.of(
            entry(0, "Contents", 3, "i", true),
            entry(1, "List of figures", 4, "ii", true),
            entry(2, "Later section", 6, "i", true),
            entry(3, "Later section 2", 7, "ii", true),
            entry(4, "Executive summary", 8, null, false));

        Map<Integer, SectionType> result = engine.applySequenceRules(entries, allOther(entries), THIRTY_PAGES);

        assertThat(result).containsEntry(2, SectionType.FRONT_MATTER)
            .containsEntry(3, SectionType.FRONT_MATTER);
        assertThat(result.get(4)).isNotEqualTo(SectionType.FRONT_MATTER);
    }

    @Test
    void romanTokensDefineBoundaryWithoutFrontMarkers() {
        List<TocEntry> entries = List.of(
            entry(0, "Foreword", 2, "ii", false),
            entry(1, "Disclaimer", 3, "iii", false),
            entry(2, "Executive summary", 4, "iv", false),
            entry(3, "Introduction", 7, null, false));
        Map<Integer, SectionType> labels = Map.of(
            0, SectionType.FRONT_MATTER,
            1, SectionType.CONTEXT,
            2, SectionType.EXECUTIVE_SUMMARY,
            3, SectionType.INTRODUCTION);

        Map<Integer, SectionType> result = engine.applySequenceRules(entries, labels, THIRTY_PAGES);

        assertThat(result).containsEntry(0, SectionType.FRONT_MATTER)
            .containsEntry(1, SectionType.FRONT_MATTER)
            .containsEntry(2, SectionType.EXECUTIVE_SUMMARY)
            .containsEntry(3, SectionType.INTRODUCTION);
    }

    @Test
    void shortDocumentIsAllExecutiveSummary() {
        List<TocEntry> entries = List.of(
            entry(0, "Pan-Asia evaluation brief", 1, null, false),
            entry(1, "Findings", 2, null, false),
            entry(2, "Annex 1", 3, null, false));
        Map<Integer, SectionType> labels = Map.of(1, SectionType.FINDINGS, 2, SectionType.ANNEXES);

        for (int pages = 1; pages <= 3; pages++) {
            Map<Integer, SectionType> result = engine.applySequenceRules(entries, labels, DocumentContext.of(pages));
            assertThat(result.values()).hasSize(3).containsOnly(SectionType.EXECUTIVE_SUMMARY);
        }
    }

    @Test
    void shortDocumentThresholdComesFromConfig() {
        ClassifierConfig config = new ClassifierConfig();
        config.setShortDocumentMaxPages(0);
        List<TocEntry> entries = List.of(entry(0, "Findings", 1, null, false));

        Map<Integer, SectionType> result = new SequenceRuleEngine(config)
            .applySequenceRules(entries, Map.of(0, SectionType.FINDINGS), DocumentContext.of(2));

        assertThat(result).containsEntry(0, SectionType.FINDINGS);
    }

    @Test
    void frontMatterBeyondFirstThirdIsDemoted() {
        List<TocEntry> entries = List.of(
            entry(0, "Foreword", 2, null, false),
            entry(1, "Foreword to part two", 20, null, false));
        Map<Integer, SectionType> labels = Map.of(0, SectionType.FRONT_MATTER, 1, SectionType.FRONT_MATTER);

        RuleTrace trace = new RuleTrace();
        Map<Integer, SectionType> result = engine.applySequenceRules(entries, labels, THIRTY_PAGES, trace);

        assertThat(result).containsEntry(0, SectionType.FRONT_MATTER)
            .containsEntry(1, SectionType.OTHER);
        assertThat(trace.changesFor(SequenceRuleEngine.FRONT_MATTER_BOUNDARY))
            .extracting(RuleTrace.Change::getIndex).containsExactly(1);
    }

    @Test
    void earlyAnnexTitleIsPulledIntoFrontMatterThenDemoted() {
        List<TocEntry> entries = List.of(
            entry(0, "Annexes", 3, null, false),
            entry(1, "Introduction", 5, null, false));
        Map<Integer, SectionType> labels = Map.of(0, SectionType.ANNEXES, 1, SectionType.INTRODUCTION);

        RuleTrace trace = new RuleTrace();
        Map<Integer, SectionType> result = engine.applySequenceRules(entries, labels, THIRTY_PAGES, trace);

        assertThat(trace.getChanges()).extracting(RuleTrace.Change::getPass).containsExactly(
            SequenceRuleEngine.FRONT_MATTER_BOUNDARY, SequenceRuleEngine.FRONT_MATTER_FRONT_PAGES);
        assertThat(result).containsEntry(0, SectionType.OTHER)
            .containsEntry(1, SectionType.INTRODUCTION);
    }

    @Test
    void romanPagesAfterExecutiveSummaryBelongToIt() {
        List<TocEntry> entries = List.of(
            entry(0, "Contents", 2, "ii", true),
            entry(1, "Executive summary", 3, "iii", true),
            entry(2, "Evaluation scope", 4, "iv", true),
            entry(3, "Acronyms", 5, "v", true),
            entry(4, "Introduction", 6, null, false));
        Map<Integer, SectionType> labels = Map.of(
            0, SectionType.FRONT_MATTER,
            1, SectionType.EXECUTIVE_SUMMARY,
            2, SectionType.INTRODUCTION,
            3, SectionType.ACRONYMS,
            4, SectionType.INTRODUCTION);

        Map<Integer, SectionType> result = engine.applySequenceRules(entries, labels, THIRTY_PAGES);

        assertThat(result).containsEntry(0, SectionType.FRONT_MATTER)
            .containsEntry(1, SectionType.EXECUTIVE_SUMMARY)
            .containsEntry(2, SectionType.EXECUTIVE_SUMMARY)
            .containsEntry(3, SectionType.ACRONYMS)
            .containsEntry(4, SectionType.INTRODUCTION);
    }

    @Test
    void frontMatterOnlyLabelsResetAfterRomanPages() {
        List<TocEntry> entries = List.of(
            entry(0, "Contents", 2, "i", true),
            entry(1, "Glossary", 3, "ii", true),
            entry(2, "Chapter one", 6, null, false),
            entry(3, "Summary", 7, null, false),
            entry(4, "Details", 8, null, false));
        Map<Integer, SectionType> labels = Map.of(
            0, SectionType.FRONT_MATTER,
            1, SectionType.ACRONYMS,
            2, SectionType.FRONT_MATTER,
            3, SectionType.OTHER,
            4, SectionType.OTHER);
        List<TocEntry> nested = List.of(entries.get(0), entries.get(1), entries.get(2), entries.get(3),
            entries.get(4).toBuilder().level(3).build());

        Map<Integer, SectionType> result = engine.applySequenceRules(nested, labels, THIRTY_PAGES);

        assertThat(result).containsEntry(2, SectionType.OTHER)
            .containsEntry(3, SectionType.EXECUTIVE_SUMMARY)
            .containsEntry(4, SectionType.EXECUTIVE_SUMMARY);
    }

    @Test
    void explicitAnnexTitlesBecomeAnnexes() {
        List<TocEntry> entries = List.of(
            entry(0, "Findings", 12, null, false),
            entry(1, "Terms of reference", 25, null, false));
        Map<Integer, SectionType> labels = Map.of(0, SectionType.FINDINGS, 1, SectionType.INTRODUCTION);

        Map<Integer, SectionType> result = engine.applySequenceRules(entries, labels, THIRTY_PAGES);

        assertThat(result).containsEntry(1, SectionType.ANNEXES);
    }

    @Test
    void noPreContentLabelsAfterFirstAnnex() {
        List<TocEntry> entries = List.of(
            entry(0, "Findings", 12, null, false),
            entry(1, "Annex A", 20, null, false),
            entry(2, "Conclusions of the field visit", 22, null, false),
            entry(3, "Interview list", 24, null, false),
            entry(4, "Bibliography", 26, null, false));
        Map<Integer, SectionType> labels = Map.of(
            0, SectionType.FINDINGS,
            1, SectionType.ANNEXES,
            2, SectionType.CONCLUSIONS,
            3, SectionType.OTHER,
            4, SectionType.BIBLIOGRAPHY);

        Map<Integer, SectionType> result = engine.applySequenceRules(entries, labels, THIRTY_PAGES);

        assertThat(result).containsEntry(0, SectionType.FINDINGS)
            .containsEntry(2, SectionType.ANNEXES)
            .containsEntry(3, SectionType.OTHER)
            .containsEntry(4, SectionType.BIBLIOGRAPHY);
    }

    @Test
    void secondExecutiveSummaryBlockBecomesFindings() {
        List<TocEntry> entries = List.of(
            entry(0, "Executive summary", 5, null, false),
            entry(1, "Overview", 6, null, false),
            entry(2, "Introduction", 7, null, false),
            entry(3, "Summary", 9, null, false));
        Map<Integer, SectionType> labels = Map.of(
            0, SectionType.EXECUTIVE_SUMMARY,
            1, SectionType.EXECUTIVE_SUMMARY,
            2, SectionType.INTRODUCTION,
            3, SectionType.EXECUTIVE_SUMMARY);

        RuleTrace trace = new RuleTrace();
        Map<Integer, SectionType> result = engine.applySequenceRules(entries, labels, THIRTY_PAGES, trace);

        assertThat(result).containsEntry(1, SectionType.EXECUTIVE_SUMMARY)
            .containsEntry(3, SectionType.FINDINGS);
        assertThat(trace.getChanges()).singleElement().satisfies(change -> {
            assertThat(change.getPass()).isEqualTo(SequenceRuleEngine.EXEC_SUMMARY_UNIQUENESS);
            assertThat(change.getFrom()).isEqualTo(SectionType.EXECUTIVE_SUMMARY);
            assertThat(change.getTo()).isEqualTo(SectionType.FINDINGS);
        });
    }

    @Test
    void frontMatterWithoutMarkerOrKeywordIsDemoted() {
        List<TocEntry> entries = List.of(
            entry(0, "Preface", 2, null, false),
            entry(1, "Map of the region", 3, null, false),
            entry(2, "Photo credits", 4, null, true));
        Map<Integer, SectionType> labels = Map.of(
            0, SectionType.FRONT_MATTER,
            1, SectionType.FRONT_MATTER,
            2, SectionType.FRONT_MATTER);

        Map<Integer, SectionType> result = engine.applySequenceRules(entries, labels, THIRTY_PAGES);

        assertThat(result).containsEntry(0, SectionType.FRONT_MATTER)
            .containsEntry(1, SectionType.OTHER)
            .containsEntry(2, SectionType.FRONT_MATTER);
    }

    @Test
    void pageRulesAreSkippedWithoutPageCount() {
        List<TocEntry> entries = List.of(
            entry(0, "Map of the region", null, null, false),
            entry(1, "Foreword", 40, null, false));
        Map<Integer, SectionType> labels = Map.of(0, SectionType.FRONT_MATTER, 1, SectionType.FRONT_MATTER);

        RuleTrace trace = new RuleTrace();
        Map<Integer, SectionType> result = engine.applySequenceRules(entries, labels, DocumentContext.empty(), trace);

        assertThat(result).isEqualTo(labels);
        assertThat(trace.isEmpty()).isTrue();
    }

    @Test
    void inputLabelsAreNotModified() {
        List<TocEntry> entries = List.of(entry(0, "Foreword", 25, null, false));
        Map<Integer, SectionType> labels = new HashMap<>(Map.of(0, SectionType.FRONT_MATTER));

        engine.applySequenceRules(entries, labels, THIRTY_PAGES);

        assertThat(labels).containsEntry(0, SectionType.FRONT_MATTER);
    }

    @Test
    void sameInputGivesSameLabels() {
        List<TocEntry> entries = List.of(
            entry(0, "Contents", 2, "ii", false),
            entry(1, "Acronyms", 3, "iii", false),
            entry(2, "Executive summary", 4, "iv", false),
            entry(3, "Findings", 9, null, false),
            entry(4, "Annex 1", 20, null, false));
        Map<Integer, SectionType> labels = Map.of(
            0, SectionType.FRONT_MATTER,
            1, SectionType.ACRONYMS,
            2, SectionType.EXECUTIVE_SUMMARY,
            3, SectionType.FINDINGS,
            4, SectionType.ANNEXES);

        assertThat(engine.applySequenceRules(entries, labels, THIRTY_PAGES))
            .isEqualTo(engine.applySequenceRules(entries, labels, THIRTY_PAGES));
    }

    @Test
    void rejectsNonContiguousIndices() {
        List<TocEntry> entries = List.of(entry(0, "Findings", 3, null, false), entry(2, "Annex", 9, null, false));

        assertThatThrownBy(() -> engine.applySequenceRules(entries, Map.of(), THIRTY_PAGES))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static TocEntry entry(int index, String title, Integer page, String roman, boolean fm) {
        return TocEntry.of(index, title, 2, page, roman, fm);
    }

    private static Map<Integer, SectionType> allOther(List<TocEntry> entries) {
        Map<Integer, SectionType> labels = new HashMap<>();
        entries.forEach(entry -> labels.put(entry.getIndex(), SectionType.OTHER));
        return labels;
    }
}
