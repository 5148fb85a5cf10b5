package im.arun.tocclassifier.cli;

import im.arun.tocclassifier.config.ClassifierConfig;
import im.arun.tocclassifier.config.ConfigLoader;
import im.arun.tocclassifier.model.ClassifiedToc;
import im.arun.tocclassifier.model.DocumentContext;
import im.arun.tocclassifier.model.RuleTrace;
import im.arun.tocclassifier.model.TocClassification;
import im.arun.tocclassifier.service.SectionTypeClassifier;
import im.arun.tocclassifier.util.ExecutorProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * Command-line interface for TOC section-type classification using Picocli.
 */
@Command(
    name = "toc-classify",
    description = "Assign a section type to every entry of one or more table-of-contents files",
    mixinStandardHelpOptions = true,
    version = "toc-classify 1.0"
)
public class TocClassifierCLI implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(TocClassifierCLI.class);

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "TOC text files, one heading per line")
    private List<Path> tocFiles;

    @Option(names = {"--page-count"}, description = "Total page count of the document")
    private Integer pageCount;

    @Option(names = {"--config"}, description = "Path to a classifier.yaml")
    private String configPath;

    @Option(names = {"--format"}, description = "Output format (text/json)")
    private String format;

    @Option(names = {"--output"}, description = "Output file path (single input file only)")
    private Path outputPath;

    @Option(names = {"--trace"}, description = "Include the label changes made by the sequence rules")
    private boolean trace;

    @Override
    public Integer call() throws Exception {
        for (Path tocFile : tocFiles) {
            if (!Files.isRegularFile(tocFile)) {
                System.err.println("Error: TOC file not found: " + tocFile);
                return 1;
            }
        }
        if (outputPath != null && tocFiles.size() > 1) {
            System.err.println("Error: --output accepts a single input file");
            return 1;
        }
        if (pageCount != null && pageCount <= 0) {
            System.err.println("Error: --page-count must be positive");
            return 1;
        }

        Map<String, Object> overrides = new HashMap<>();
        if (format != null) {
            overrides.put("output_format", format);
        }
        ClassifierConfig config = new ConfigLoader(configPath).load(overrides);
        SectionTypeClassifier classifier = new SectionTypeClassifier(config);
        DocumentContext context = DocumentContext.of(pageCount);

        List<String> outputs;
        ExecutorService executor = ExecutorProvider.newBatchExecutor(tocFiles.size());
        try {
            List<CompletableFuture<String>> futures = new ArrayList<>();
            for (Path tocFile : tocFiles) {
                futures.add(CompletableFuture.supplyAsync(
                    () -> classifyFile(classifier, config, tocFile, context), executor));
            }
            outputs = futures.stream().map(CompletableFuture::join).collect(Collectors.toList());
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.warn("Classification failed", cause);
            System.err.println("Error reading TOC file: " + cause.getMessage());
            return 1;
        } finally {
            executor.shutdown();
        }

        String result = String.join(System.lineSeparator(), outputs);
        if (outputPath != null) {
            Files.writeString(outputPath, result + System.lineSeparator(), StandardCharsets.UTF_8);
            System.err.println("Output written to: " + outputPath);
        } else {
            System.out.println(result);
        }
        return 0;
    }

    private String classifyFile(SectionTypeClassifier classifier, ClassifierConfig config,
                                Path tocFile, DocumentContext context) {
        String tocText;
        try {
            tocText = Files.readString(tocFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(tocFile + ": " + e.getMessage(), e);
        }

        logger.info("Classifying {}", tocFile);
        TocClassification classification = classifier.classify(tocText, context);
        String docName = tocFile.getFileName().toString();

        if ("json".equals(config.getOutputFormat())) {
            ClassifiedToc classifiedToc = classifier.toClassifiedToc(
                docName, context.getTotalPages(), classification, trace);
            try {
                return classifier.toJson(classifiedToc);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        StringBuilder text = new StringBuilder();
        if (tocFiles.size() > 1) {
            text.append("== ").append(docName).append(" ==").append(System.lineSeparator());
        }
        text.append(classifier.render(classification));
        if (trace && !classification.getTrace().isEmpty()) {
            text.append(System.lineSeparator()).append("-- sequence rule changes --");
            for (RuleTrace.Change change : classification.getTrace().getChanges()) {
                text.append(System.lineSeparator()).append(change);
            }
        }
        return text.toString();
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TocClassifierCLI()).execute(args);
        System.exit(exitCode);
    }
}
