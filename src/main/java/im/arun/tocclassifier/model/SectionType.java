package im.arun.tocclassifier.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed taxonomy of section types a TOC entry can receive.
 * The wire label (e.g. {@code executive_summary}) is what gets rendered and persisted.
 */
public enum SectionType {
    FRONT_MATTER("front_matter"),
    EXECUTIVE_SUMMARY("executive_summary"),
    ACRONYMS("acronyms"),
    INTRODUCTION("introduction"),
    CONTEXT("context"),
    METHODOLOGY("methodology"),
    FINDINGS("findings"),
    RECOMMENDATIONS("recommendations"),
    CONCLUSIONS("conclusions"),
    ANNEXES("annexes"),
    APPENDIX("appendix"),
    BIBLIOGRAPHY("bibliography"),
    OTHER("other");

    private static final Map<String, SectionType> BY_LABEL = Collections.unmodifiableMap(
        Arrays.stream(values()).collect(Collectors.toMap(SectionType::getLabel, Function.identity())));

    private final String label;

    SectionType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Strict lookup by wire label. Surrounding whitespace is ignored, case is not.
     */
    public static Optional<SectionType> parse(String label) {
        if (label == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_LABEL.get(label.strip()));
    }

    /**
     * Lenient lookup: anything outside the taxonomy becomes {@link #OTHER}.
     */
    public static SectionType fromLabel(String label) {
        return parse(label).orElse(OTHER);
    }

    public static boolean isValidLabel(String label) {
        return parse(label).isPresent();
    }

    @Override
    public String toString() {
        return label;
    }
}
