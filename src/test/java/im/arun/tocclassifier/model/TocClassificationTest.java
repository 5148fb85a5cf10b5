package im.arun.tocclassifier.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TocClassificationTest {

    @Test
    void callerCollectionsAreCopied() {
        List<TocEntry> entries = new ArrayList<>(List.of(TocEntry.of(0, "Findings", 1, 10)));
        Map<Integer, SectionType> locked = new HashMap<>(Map.of(0, SectionType.FINDINGS));
        Map<Integer, SectionType> labels = new HashMap<>(Map.of(0, SectionType.FINDINGS));

        TocClassification classification = new TocClassification(entries, locked, labels, new RuleTrace());
        entries.add(TocEntry.of(1, "Annexes", 1, 30));
        locked.put(1, SectionType.ANNEXES);
        labels.put(0, SectionType.OTHER);

        assertThat(classification.getEntries()).hasSize(1);
        assertThat(classification.getLockedLabels()).containsOnlyKeys(0);
        assertThat(classification.labelFor(0)).isEqualTo(SectionType.FINDINGS);
    }

    @Test
    void exposedCollectionsAreReadOnly() {
        TocClassification classification = new TocClassification(
            List.of(TocEntry.of(0, "Findings", 1, 10)), Map.of(), Map.of(0, SectionType.FINDINGS), new RuleTrace());

        assertThatThrownBy(() -> classification.getEntries().clear())
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> classification.getLockedLabels().put(0, SectionType.OTHER))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> classification.getLabels().put(0, SectionType.OTHER))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void labelsIterateInEntryOrder() {
        Map<Integer, SectionType> labels = new HashMap<>();
        labels.put(2, SectionType.ANNEXES);
        labels.put(0, SectionType.FRONT_MATTER);
        labels.put(1, SectionType.FINDINGS);

        TocClassification classification = new TocClassification(List.of(), Map.of(), labels, new RuleTrace());

        assertThat(classification.getLabels().keySet()).containsExactly(0, 1, 2);
        assertThat(classification.labelFor(5)).isEqualTo(SectionType.OTHER);
    }
}
