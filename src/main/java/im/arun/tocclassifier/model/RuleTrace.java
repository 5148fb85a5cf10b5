package im.arun.tocclassifier.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered record of the label changes made by the sequence rules for one document.
 * Call-scoped: a trace is created per classification and never shared between threads.
 */
public class RuleTrace {

    private final List<Change> changes = new ArrayList<>();

    public void record(String pass, int index, SectionType from, SectionType to) {
        changes.add(new Change(pass, index, from, to));
    }

    public List<Change> getChanges() {
        return Collections.unmodifiableList(changes);
    }

    public List<Change> changesFor(String pass) {
        return changes.stream()
            .filter(change -> change.getPass().equals(pass))
            .collect(Collectors.toList());
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    @Value
    public static class Change {
        @JsonProperty("pass")
        String pass;

        @JsonProperty("index")
        int index;

        /** Null when the index had no label before the pass. */
        @JsonProperty("from")
        SectionType from;

        @JsonProperty("to")
        SectionType to;

        @Override
        public String toString() {
            return String.format("%s: #%d %s -> %s", pass, index, from == null ? "-" : from.getLabel(), to.getLabel());
        }
    }
}
