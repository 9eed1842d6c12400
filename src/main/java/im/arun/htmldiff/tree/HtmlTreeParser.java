package im.arun.htmldiff.tree;

import im.arun.htmldiff.config.HtmlDiffConfig;
import im.arun.htmldiff.model.BlockNode;
import im.arun.htmldiff.model.BlockTag;
import im.arun.htmldiff.model.DocumentNode;
import im.arun.htmldiff.model.InlinePart;
import im.arun.htmldiff.model.ListItemNode;
import im.arun.htmldiff.model.ListKind;
import im.arun.htmldiff.model.ListNode;
import im.arun.htmldiff.model.NodeStatus;
import im.arun.htmldiff.model.RootNode;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Parses an HTML fragment into the simplified tree used by the diff.
 *
 * <p>Elements are walked top-down in document order:</p>
 * <ul>
 *   <li>{@code p}, {@code h1}..{@code h6} become blocks holding their inner markup;</li>
 *   <li>{@code ul}, {@code ol} become lists of their direct {@code li} children;</li>
 *   <li>{@code div}, {@code section}, {@code article} are recursed into and, when nothing
 *       structured is found inside, become a paragraph of their own markup;</li>
 *   <li>anything else is transparent.</li>
 * </ul>
 */
public class HtmlTreeParser {
    private static final Logger logger = LoggerFactory.getLogger(HtmlTreeParser.class);

    private static final Set<String> CONTAINER_TAGS = Set.of("div", "section", "article");

    /**
     * Everything the nested walk of a list item turns into children.
     */
    private static final String NESTED_STRUCTURE_SELECTOR =
        "ul, ol, p, h1, h2, h3, h4, h5, h6, div, section, article";

    private final boolean containerFallback;
    private final boolean documentTextFallback;

    public HtmlTreeParser() {
        this(new HtmlDiffConfig());
    }

    public HtmlTreeParser(HtmlDiffConfig config) {
        this.containerFallback = config.isContainerFallback();
        this.documentTextFallback = config.isDocumentTextFallback();
    }

    /**
     * Parse an HTML string.
     *
     * @param html HTML fragment or document, malformed markup is tolerated
     * @return the document root, or null when the input has no content to diff
     */
    public RootNode parse(String html) {
        if (html == null || html.isBlank()) {
            return null;
        }

        Document doc = Jsoup.parseBodyFragment(html);
        doc.outputSettings().prettyPrint(false);
        Element body = doc.body();

        NodeIdSequence ids = new NodeIdSequence();
        List<DocumentNode> children = collectNodes(body, ids);

        if (children.isEmpty() && documentTextFallback) {
            String text = body.text();
            if (!text.isEmpty()) {
                logger.debug("No structured content found, using document text as a single paragraph");
                children.add(newBlock(BlockTag.PARAGRAPH, text, ids));
            }
        }

        if (children.isEmpty()) {
            logger.debug("Nothing to diff in input of {} characters", html.length());
            return null;
        }

        logger.debug("Parsed {} top-level nodes", children.size());
        return new RootNode(children);
    }

    private List<DocumentNode> collectNodes(Element parent, NodeIdSequence ids) {
        List<DocumentNode> nodes = new ArrayList<>();

        for (Element child : parent.children()) {
            String tag = child.normalName();

            BlockTag blockTag = BlockTag.fromTagName(tag);
            if (blockTag != null) {
                nodes.add(newBlock(blockTag, child.html(), ids));
                continue;
            }

            ListKind listKind = ListKind.fromTagName(tag);
            if (listKind != null) {
                nodes.add(parseList(child, listKind, ids));
                continue;
            }

            if (CONTAINER_TAGS.contains(tag)) {
                List<DocumentNode> inner = collectNodes(child, ids);
                if (inner.isEmpty() && containerFallback) {
                    String markup = child.html().trim();
                    if (!markup.isEmpty()) {
                        nodes.add(newBlock(BlockTag.PARAGRAPH, markup, ids));
                    }
                } else {
                    nodes.addAll(inner);
                }
                continue;
            }

            nodes.addAll(collectNodes(child, ids));
        }

        return nodes;
    }

    private ListNode parseList(Element list, ListKind kind, NodeIdSequence ids) {
        List<DocumentNode> items = new ArrayList<>();

        for (Element child : list.children()) {
            if (!"li".equals(child.normalName())) {
                continue;
            }

            String id = ids.nextItemId();
            String top = topContent(child);
            List<DocumentNode> nested = collectNodes(child, ids);

            if (top.isEmpty() && nested.isEmpty()) {
                ids.releaseItemId();
                continue;
            }

            List<InlinePart> content = top.isEmpty() ? List.of() : List.of(InlinePart.unchanged(top));
            items.add(new ListItemNode(id, NodeStatus.UNCHANGED, content, nested));
        }

        return new ListNode(kind, items);
    }

    /**
     * The item's own markup with nested lists and blocks cut out.
     */
    private static String topContent(Element item) {
        Document holder = Document.createShell("");
        holder.outputSettings().prettyPrint(false);

        Element copy = item.clone();
        holder.body().appendChild(copy);
        copy.select(NESTED_STRUCTURE_SELECTOR).remove();

        return copy.html().trim();
    }

    private static BlockNode newBlock(BlockTag tag, String markup, NodeIdSequence ids) {
        return new BlockNode(tag, ids.nextBlockId(), NodeStatus.UNCHANGED, List.of(InlinePart.unchanged(markup)));
    }
}
