package im.arun.tocclassifier.cli;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class TocClassifierCLITest {

    private static final String TOC = "[H1] Contents | page 2 (ii)\n"
        + "[H1] Executive summary | page 4\n"
        + "[H1] Findings | page 10\n"
        + "[H1] Summary | page 12\n"
        + "[H1] Annex 1 | page 20\n";

    @TempDir
    Path tempDir;

    @Test
    void writesClassifiedTocAsText() throws IOException {
        Path toc = write("report.txt", TOC);
        Path output = tempDir.resolve("classified.txt");

        int exitCode = execute(toc.toString(), "--page-count", "30", "--output", output.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readAllLines(output)).containsExactly(
            "[H1] Contents | front_matter | page 2 (ii)",
            "[H1] Executive summary | executive_summary | page 4",
            "[H1] Findings | findings | page 10",
            "[H1] Summary | findings | page 12",
            "[H1] Annex 1 | annexes | page 20");
    }

    @Test
    void appendsTraceWhenAsked() throws IOException {
        Path toc = write("report.txt", TOC);
        Path output = tempDir.resolve("classified.txt");

        execute(toc.toString(), "--page-count", "30", "--trace", "--output", output.toString());

        assertThat(Files.readString(output))
            .contains("-- sequence rule changes --")
            .contains("exec-summary-uniqueness: #3 executive_summary -> findings");
    }

    @Test
    void writesJsonWhenRequested() throws IOException {
        Path toc = write("report.txt", TOC);
        Path output = tempDir.resolve("classified.json");

        int exitCode = execute(toc.toString(), "--format", "json", "--page-count", "30", "--output", output.toString());

        assertThat(exitCode).isZero();
        JsonNode json = new ObjectMapper().readTree(output.toFile());
        assertThat(json.get("doc_name").asText()).isEqualTo("report.txt");
        assertThat(json.get("entries").get(4).get("section_type").asText()).isEqualTo("annexes");
        assertThat(json.has("trace")).isFalse();
    }

    @Test
    void readsOptionsFromConfigFile() throws IOException {
        Path toc = write("brief.txt", "[H1] Findings | page 2\n[H1] Annex | page 4\n");
        Path config = write("classifier.yaml", "shortDocumentMaxPages: 5\n");
        Path output = tempDir.resolve("classified.txt");

        execute(toc.toString(), "--page-count", "5", "--config", config.toString(), "--output", output.toString());

        assertThat(Files.readAllLines(output)).containsExactly(
            "[H1] Findings | executive_summary | page 2",
            "[H1] Annex | executive_summary | page 4");
    }

    @Test
    void missingFileFails() {
        assertThat(execute(tempDir.resolve("nope.txt").toString())).isEqualTo(1);
    }

    @Test
    void outputRequiresSingleInput() throws IOException {
        Path first = write("a.txt", TOC);
        Path second = write("b.txt", TOC);

        int exitCode = execute(first.toString(), second.toString(), "--output", tempDir.resolve("out.txt").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(tempDir.resolve("out.txt")).doesNotExist();
    }

    @Test
    void rejectsNonPositivePageCount() throws IOException {
        Path toc = write("report.txt", TOC);

        assertThat(execute(toc.toString(), "--page-count", "0")).isEqualTo(1);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    private static int execute(String... args) {
        return new CommandLine(new TocClassifierCLI()).execute(args);
    }
}
