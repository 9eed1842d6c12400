package im.arun.htmldiff.service;

import im.arun.htmldiff.config.HtmlDiffConfig;
import im.arun.htmldiff.diff.InlineDiffer;
import im.arun.htmldiff.merge.TreeResolver;
import im.arun.htmldiff.model.Decision;
import im.arun.htmldiff.model.DiffDocument;
import im.arun.htmldiff.model.DiffSummary;
import im.arun.htmldiff.model.DocumentNode;
import im.arun.htmldiff.model.RootNode;
import im.arun.htmldiff.tree.HtmlTreeParser;
import im.arun.htmldiff.tree.TreeDiffer;
import im.arun.htmldiff.util.JsonLogger;
import im.arun.htmldiff.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.Map;

/**
 * Entry point tying together parsing, tree diffing and resolving.
 * Every call recomputes from scratch; no state is kept between calls apart from the
 * optional session log.
 */
public class HtmlDiffService {
    private static final Logger logger = LoggerFactory.getLogger(HtmlDiffService.class);

    private final HtmlTreeParser parser;
    private final TreeDiffer treeDiffer;
    private final TreeResolver resolver;
    private final JsonLogger jsonLogger;

    public HtmlDiffService() {
        this(new HtmlDiffConfig());
    }

    public HtmlDiffService(HtmlDiffConfig config) {
        this(config, config.isSessionLog()
            ? new JsonLogger(Paths.get(config.getLogDirectory()), "htmldiff")
            : null);
    }

    public HtmlDiffService(HtmlDiffConfig config, JsonLogger jsonLogger) {
        this.parser = new HtmlTreeParser(config);
        this.treeDiffer = new TreeDiffer(new InlineDiffer(config.getGranularity()));
        this.resolver = new TreeResolver();
        this.jsonLogger = jsonLogger;
    }

    /**
     * Parse both documents and diff them.
     *
     * @return the annotated tree, or null when either side has nothing to diff
     */
    public RootNode diffHtml(String original, String modified) {
        RootNode treeA = parser.parse(original);
        RootNode treeB = parser.parse(modified);

        if (treeA == null || treeB == null) {
            logger.info("Nothing to diff (original empty: {}, modified empty: {})", treeA == null, treeB == null);
            if (jsonLogger != null) {
                jsonLogger.warn("Nothing to diff");
            }
            return null;
        }

        log("Parsed documents", Map.of(
            "original_nodes", treeA.getChildren().size(),
            "modified_nodes", treeB.getChildren().size()));

        RootNode tree = treeDiffer.diff(treeA, treeB);
        DiffSummary summary = TreeUtils.summarize(tree);
        log("Diffed documents", Map.of(
            "unchanged", summary.getUnchanged(),
            "added", summary.getAdded(),
            "removed", summary.getRemoved(),
            "changed", summary.getChanged()));

        return tree;
    }

    /**
     * Diff two named documents into a serialisable result. The tree and summary are
     * left null when there is nothing to diff.
     */
    public DiffDocument compare(String originalName, String original, String modifiedName, String modified) {
        RootNode tree = diffHtml(original, modified);

        DiffDocument document = new DiffDocument();
        document.setOriginalName(originalName);
        document.setModifiedName(modifiedName);
        if (tree != null) {
            document.setTree(tree);
            document.setSummary(TreeUtils.summarize(tree));
        }
        return document;
    }

    public String resolve(DocumentNode tree, Map<String, Decision> decisions) {
        String merged = resolver.resolve(tree, decisions);
        log("Resolved tree", Map.of(
            "decisions", decisions == null ? 0 : decisions.size(),
            "length", merged.length()));
        return merged;
    }

    public DiffSummary summarize(DocumentNode tree) {
        return TreeUtils.summarize(tree);
    }

    public JsonLogger getJsonLogger() {
        return jsonLogger;
    }

    private void log(String message, Map<String, ?> details) {
        if (jsonLogger != null) {
            jsonLogger.info(message, details);
        }
    }
}
