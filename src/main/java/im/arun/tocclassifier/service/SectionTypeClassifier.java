package im.arun.tocclassifier.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.tocclassifier.config.ClassifierConfig;
import im.arun.tocclassifier.model.ClassifiedEntry;
import im.arun.tocclassifier.model.ClassifiedToc;
import im.arun.tocclassifier.model.DocumentContext;
import im.arun.tocclassifier.model.RestoredClassification;
import im.arun.tocclassifier.model.RuleTrace;
import im.arun.tocclassifier.model.SectionType;
import im.arun.tocclassifier.model.TocClassification;
import im.arun.tocclassifier.model.TocEntry;
import im.arun.tocclassifier.rules.HierarchyPropagator;
import im.arun.tocclassifier.rules.KeywordLocker;
import im.arun.tocclassifier.rules.KeywordRuleTable;
import im.arun.tocclassifier.rules.LabelValidator;
import im.arun.tocclassifier.rules.SequenceRuleEngine;
import im.arun.tocclassifier.toc.ClassifiedTocReader;
import im.arun.tocclassifier.toc.TocLineFormatter;
import im.arun.tocclassifier.toc.TocParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Main entry point for section-type classification of a table of contents.
 *
 * <p>Pipeline: parse, lock keywords, propagate through the hierarchy, apply the sequence
 * rules, validate. Instances hold no per-document state and can be shared between threads.
 */
public class SectionTypeClassifier {
    private static final Logger logger = LoggerFactory.getLogger(SectionTypeClassifier.class);

    private final TocParser tocParser;
    private final KeywordLocker keywordLocker;
    private final HierarchyPropagator hierarchyPropagator;
    private final SequenceRuleEngine sequenceRuleEngine;
    private final LabelValidator labelValidator;
    private final TocLineFormatter lineFormatter;
    private final ClassifiedTocReader classifiedTocReader;
    private final ObjectMapper objectMapper;

    public SectionTypeClassifier() {
        this(new ClassifierConfig());
    }

    public SectionTypeClassifier(ClassifierConfig config) {
        KeywordRuleTable ruleTable = KeywordRuleTable.getInstance();
        this.tocParser = new TocParser();
        this.keywordLocker = new KeywordLocker(ruleTable);
        this.hierarchyPropagator = new HierarchyPropagator(ruleTable);
        this.sequenceRuleEngine = new SequenceRuleEngine(config, ruleTable);
        this.labelValidator = new LabelValidator();
        this.lineFormatter = new TocLineFormatter();
        this.classifiedTocReader = new ClassifiedTocReader();
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Classify raw TOC text.
     */
    public TocClassification classify(String tocText, DocumentContext context) {
        return classify(tocParser.parse(tocText), context);
    }

    /**
     * Classify already parsed entries.
     *
     * @param entries Entries with contiguous indices starting at 0
     * @param context Document facts, may be null
     */
    public TocClassification classify(List<TocEntry> entries, DocumentContext context) {
        Objects.requireNonNull(entries, "entries");
        if (entries.isEmpty()) {
            return TocClassification.empty();
        }
        DocumentContext effectiveContext = context == null ? DocumentContext.empty() : context;
        logger.info("Classifying {} TOC entries (total pages: {})", entries.size(), effectiveContext.getTotalPages());

        Map<Integer, SectionType> locked = keywordLocker.lockKeywords(entries);
        Map<Integer, SectionType> propagated = hierarchyPropagator.propagateHierarchy(entries, locked);

        RuleTrace trace = new RuleTrace();
        Map<Integer, SectionType> sequenced =
            sequenceRuleEngine.applySequenceRules(entries, propagated, effectiveContext, trace);
        Map<Integer, SectionType> labels = labelValidator.validate(entries, sequenced);

        logger.info("Classification finished: {} entries, {} sequence rule changes",
            entries.size(), trace.getChanges().size());
        return new TocClassification(entries, locked, labels, trace);
    }

    /**
     * Render a classification in the stored classified-TOC line format.
     */
    public String render(TocClassification classification) {
        return lineFormatter.render(classification.getEntries(), classification.getLabels());
    }

    /**
     * Rebuild a classification from a stored classified TOC and re-apply the sequence rules.
     *
     * @param tocText Raw TOC text the stored text was rendered from
     * @param classifiedText Stored classified TOC
     * @param context Document facts, may be null
     * @return Restored classification, or empty when the stored text is unusable and the TOC
     *     has to be classified again
     */
    public Optional<RestoredClassification> restore(String tocText, String classifiedText, DocumentContext context) {
        List<TocEntry> entries = tocParser.parse(tocText);
        if (entries.isEmpty() || classifiedText == null || classifiedText.isBlank()) {
            return Optional.empty();
        }

        Optional<Map<Integer, SectionType>> storedLabels = classifiedTocReader.readLabels(entries, classifiedText);
        if (storedLabels.isEmpty()) {
            return Optional.empty();
        }

        RuleTrace trace = new RuleTrace();
        Map<Integer, SectionType> sequenced = sequenceRuleEngine.applySequenceRules(
            entries, storedLabels.get(), context == null ? DocumentContext.empty() : context, trace);
        Map<Integer, SectionType> labels = labelValidator.validate(entries, sequenced);

        boolean labelsChanged = !labels.equals(storedLabels.get());
        boolean missingRoman = entries.stream().anyMatch(entry -> entry.getRoman() != null)
            && !classifiedTocReader.hasRomanTokens(classifiedText);
        boolean missingFront = entries.stream().anyMatch(TocEntry::isFm)
            && !classifiedTocReader.hasFrontMarkers(classifiedText);
        boolean needsResave = labelsChanged || missingRoman || missingFront;
        if (needsResave) {
            logger.info("Stored classified TOC is stale (labels changed: {}, missing roman: {}, missing front: {})",
                labelsChanged, missingRoman, missingFront);
        }

        TocClassification classification = new TocClassification(entries, storedLabels.get(), labels, trace);
        return Optional.of(new RestoredClassification(classification, needsResave));
    }

    public ClassifiedToc toClassifiedToc(String docName, Integer pageCount,
                                         TocClassification classification, boolean includeTrace) {
        List<ClassifiedEntry> classifiedEntries = classification.getEntries().stream()
            .map(entry -> ClassifiedEntry.from(entry, classification.labelFor(entry.getIndex())))
            .collect(Collectors.toList());
        return new ClassifiedToc(docName, pageCount, classifiedEntries,
            includeTrace ? classification.getTrace().getChanges() : null);
    }

    public String toJson(ClassifiedToc classifiedToc) throws JsonProcessingException {
        return objectMapper.writeValueAsString(classifiedToc);
    }
}
