package im.arun.htmldiff.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.htmldiff.ExampleDocuments;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HtmlDiffCLITest {

    @TempDir
    Path tempDir;

    private Path original;
    private Path modified;
    private Path output;

    @BeforeEach
    void setUp() throws Exception {
        Map<String, String> example = ExampleDocuments.byId("safety-equipment");
        original = Files.writeString(tempDir.resolve("original.html"), example.get("original"));
        modified = Files.writeString(tempDir.resolve("modified.html"), example.get("modified"));
        output = tempDir.resolve("out.txt");
    }

    private int run(String... extra) {
        List<String> args = new ArrayList<>(List.of(
            "--original", original.toString(),
            "--modified", modified.toString(),
            "--output", output.toString()));
        args.addAll(List.of(extra));
        return new CommandLine(new HtmlDiffCLI()).execute(args.toArray(new String[0]));
    }

    @Test
    void htmlFormatKeepsTheOriginalWhenNothingIsDecided() throws Exception {
        assertThat(run("--format", "html")).isZero();

        assertThat(Files.readString(output)).isEqualTo(
            "<p>Safety equipment required:</p><ul><li>Hard hat (Class G)</li><li>Safety goggles</li><li>Steel-toed boots</li></ul>");
    }

    @Test
    void acceptAllProducesTheModifiedDocument() throws Exception {
        assertThat(run("--format", "html", "--accept-all")).isZero();

        assertThat(Files.readString(output)).isEqualTo(
            "<p>Safety equipment required:</p><ul><li>Hard hat (Class E or G)</li><li>Safety goggles (Anti-fog)</li></ul>");
    }

    @Test
    void decisionsFileIsApplied() throws Exception {
        Path decisions = Files.writeString(tempDir.resolve("decisions.json"), "{\"li-2\": \"accept\"}");

        assertThat(run("--format", "summary", "--decisions", decisions.toString())).isZero();

        assertThat(Files.readString(output)).isEqualTo("unchanged=1 added=0 removed=1 changed=2 pending=2");
    }

    @Test
    void summaryOfIdenticalDocumentsReportsNoChanges() throws Exception {
        Files.writeString(modified, Files.readString(original));

        assertThat(run("--format", "summary")).isZero();

        assertThat(Files.readString(output)).isEqualTo("no changes in 4 nodes");
    }

    @Test
    void treeFormatWritesTheDiffDocument() throws Exception {
        assertThat(run()).isZero();

        JsonNode json = new ObjectMapper().readTree(output.toFile());
        assertThat(json.get("original_name").asText()).isEqualTo("original.html");
        assertThat(json.get("summary").get("changed").asInt()).isEqualTo(2);
        assertThat(json.get("tree").get("type").asText()).isEqualTo("root");
        assertThat(json.get("tree").get("children").get(1).get("children").get(2).get("status").asText())
            .isEqualTo("removed");
        assertThat(json.get("resolved").asText()).startsWith("<p>Safety equipment required:</p>");
    }

    @Test
    void granularityOptionIsPassedThrough() throws Exception {
        Files.writeString(original, "<p>cat</p>");
        Files.writeString(modified, "<p>cut</p>");

        assertThat(run("--granularity", "character")).isZero();

        JsonNode content = new ObjectMapper().readTree(output.toFile())
            .get("tree").get("children").get(0).get("content");
        assertThat(content.size()).isEqualTo(4);
        assertThat(content.get(1).get("text").asText()).isEqualTo("a");
    }

    @Test
    void nothingToDiffIsNotAnError() throws Exception {
        Files.writeString(modified, "   ");

        assertThat(run()).isZero();
        assertThat(Files.exists(output)).isFalse();
    }

    @Test
    void usageProblemsExitWithOne() throws Exception {
        assertThat(run("--format", "pdf")).isEqualTo(1);
        assertThat(run("--accept-all", "--reject-all")).isEqualTo(1);
        assertThat(run("--decisions", tempDir.resolve("missing.json").toString())).isEqualTo(1);

        Path badDecisions = Files.writeString(tempDir.resolve("bad.json"), "{\"li-0\": \"maybe\"}");
        assertThat(run("--decisions", badDecisions.toString())).isEqualTo(1);

        Files.delete(original);
        assertThat(run()).isEqualTo(1);
    }
}
