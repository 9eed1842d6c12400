package im.arun.htmldiff.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.htmldiff.config.ConfigLoader;
import im.arun.htmldiff.config.HtmlDiffConfig;
import im.arun.htmldiff.merge.DecisionMaps;
import im.arun.htmldiff.model.Decision;
import im.arun.htmldiff.model.DiffDocument;
import im.arun.htmldiff.model.DiffSummary;
import im.arun.htmldiff.service.HtmlDiffService;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface: compares two HTML files and prints the annotated tree,
 * the merged markup or a status summary.
 */
@Command(
    name = "htmldiff",
    description = "Structural diff of two HTML documents with per-node accept/reject merging",
    mixinStandardHelpOptions = true,
    version = "HtmlDiff 1.0"
)
public class HtmlDiffCLI implements Callable<Integer> {

    @Option(names = {"--original"}, description = "Path to the original HTML file", required = true)
    private String originalPath;

    @Option(names = {"--modified"}, description = "Path to the modified HTML file", required = true)
    private String modifiedPath;

    @Option(names = {"--decisions"}, description = "JSON file mapping node id to accept/reject/undecided")
    private String decisionsPath;

    @Option(names = {"--accept-all"}, description = "Accept every change")
    private boolean acceptAll;

    @Option(names = {"--reject-all"}, description = "Reject every change")
    private boolean rejectAll;

    @Option(names = {"--format"}, description = "Output format: tree, html or summary", defaultValue = "tree")
    private String format;

    @Option(names = {"--granularity"}, description = "Inline diff granularity: word, character or line")
    private String granularity;

    @Option(names = {"--config"}, description = "Path to a YAML configuration file")
    private String configPath;

    @Option(names = {"--session-log"}, description = "Write a JSON session log (yes/no)")
    private String sessionLog;

    @Option(names = {"--output"}, description = "Output file path")
    private String outputPath;

    @Override
    public Integer call() throws Exception {
        if (acceptAll && rejectAll) {
            System.err.println("Error: --accept-all and --reject-all cannot be combined");
            return 1;
        }

        if (!"tree".equals(format) && !"html".equals(format) && !"summary".equals(format)) {
            System.err.println("Error: Unknown format: " + format + " (expected tree, html or summary)");
            return 1;
        }

        Path original = Paths.get(originalPath);
        Path modified = Paths.get(modifiedPath);
        for (Path path : List.of(original, modified)) {
            if (!Files.exists(path)) {
                System.err.println("Error: HTML file not found: " + path);
                return 1;
            }
        }

        Map<String, Object> userOptions = new HashMap<>();
        if (granularity != null) userOptions.put("granularity", granularity);
        if (sessionLog != null) userOptions.put("sessionLog", sessionLog);
        HtmlDiffConfig config = new ConfigLoader(configPath).load(userOptions);

        HtmlDiffService service = new HtmlDiffService(config);

        String output;
        try {
            DiffDocument document = service.compare(
                original.getFileName().toString(), Files.readString(original),
                modified.getFileName().toString(), Files.readString(modified));

            if (document.getTree() == null) {
                System.out.println("Nothing to diff: one of the documents has no content");
                return 0;
            }

            Map<String, Decision> decisions = buildDecisions(document);
            String merged = service.resolve(document.getTree(), decisions);

            switch (format) {
                case "html":
                    output = merged;
                    break;
                case "summary":
                    output = formatSummary(document.getSummary(),
                        DecisionMaps.pending(document.getTree(), decisions).size());
                    break;
                default:
                    document.setResolved(merged);
                    ObjectMapper mapper = new ObjectMapper();
                    if (config.isIndentOutput()) {
                        mapper.enable(SerializationFeature.INDENT_OUTPUT);
                    }
                    output = mapper.writeValueAsString(document);
            }
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("Error comparing documents: " + e.getMessage());
            if (service.getJsonLogger() != null) {
                service.getJsonLogger().error("Comparison failed", Map.of("reason", String.valueOf(e.getMessage())));
            }
            return 1;
        }

        if (outputPath != null) {
            Files.writeString(Paths.get(outputPath), output);
            System.out.println("Output written to: " + outputPath);
        } else {
            System.out.println(output);
        }

        return 0;
    }

    private Map<String, Decision> buildDecisions(DiffDocument document) throws IOException {
        Map<String, Decision> decisions = new LinkedHashMap<>();
        if (acceptAll) {
            decisions.putAll(DecisionMaps.acceptAll(document.getTree()));
        } else if (rejectAll) {
            decisions.putAll(DecisionMaps.rejectAll(document.getTree()));
        }

        if (decisionsPath != null) {
            Path path = Paths.get(decisionsPath);
            if (!Files.exists(path)) {
                throw new IOException("Decisions file not found: " + decisionsPath);
            }
            Map<String, Decision> fromFile = new ObjectMapper()
                .readValue(path.toFile(), new TypeReference<Map<String, Decision>>() {});
            decisions.putAll(fromFile);
        }
        return decisions;
    }

    static String formatSummary(DiffSummary summary, int pending) {
        if (!summary.hasChanges()) {
            return String.format("no changes in %d nodes", summary.getTotal());
        }
        return String.format("unchanged=%d added=%d removed=%d changed=%d pending=%d",
            summary.getUnchanged(), summary.getAdded(), summary.getRemoved(), summary.getChanged(), pending);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new HtmlDiffCLI()).execute(args);
        System.exit(exitCode);
    }
}
