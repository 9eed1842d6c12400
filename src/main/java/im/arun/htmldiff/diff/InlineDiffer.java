package im.arun.htmldiff.diff;

import com.github.difflib.DiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.Chunk;
import com.github.difflib.patch.Patch;
import im.arun.htmldiff.model.InlinePart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes ordered added/removed/unchanged runs between two text spans.
 *
 * <p>The common token prefix is matched first, then the common token suffix, and only
 * the remaining middle goes through the Myers difference algorithm. This fixes which
 * of several equally short edit scripts is reported.</p>
 *
 * <p>Concatenating the result without added parts gives back {@code original};
 * concatenating it without removed parts gives back {@code modified}.</p>
 */
public class InlineDiffer {
    private static final Logger logger = LoggerFactory.getLogger(InlineDiffer.class);

    private final Granularity granularity;

    public InlineDiffer() {
        this(Granularity.WORD);
    }

    public InlineDiffer(Granularity granularity) {
        this.granularity = granularity == null ? Granularity.WORD : granularity;
    }

    public Granularity getGranularity() {
        return granularity;
    }

    public List<InlinePart> diff(String original, String modified) {
        List<String> a = Tokenizer.tokenize(original, granularity);
        List<String> b = Tokenizer.tokenize(modified, granularity);

        int prefix = 0;
        int maxPrefix = Math.min(a.size(), b.size());
        while (prefix < maxPrefix && a.get(prefix).equals(b.get(prefix))) {
            prefix++;
        }

        int suffix = 0;
        int maxSuffix = maxPrefix - prefix;
        while (suffix < maxSuffix
                && a.get(a.size() - 1 - suffix).equals(b.get(b.size() - 1 - suffix))) {
            suffix++;
        }

        List<Run> runs = new ArrayList<>();
        append(runs, Kind.EQUAL, join(a.subList(0, prefix)));

        List<String> middleA = a.subList(prefix, a.size() - suffix);
        List<String> middleB = b.subList(prefix, b.size() - suffix);
        if (middleA.isEmpty()) {
            append(runs, Kind.ADDED, join(middleB));
        } else if (middleB.isEmpty()) {
            append(runs, Kind.REMOVED, join(middleA));
        } else {
            appendMyers(runs, middleA, middleB);
        }

        append(runs, Kind.EQUAL, join(a.subList(a.size() - suffix, a.size())));

        List<InlinePart> parts = coalesce(runs);
        logger.debug("Inline diff ({}): {} vs {} tokens -> {} parts",
            granularity.getValue(), a.size(), b.size(), parts.size());
        return parts;
    }

    private void appendMyers(List<Run> runs, List<String> a, List<String> b) {
        Patch<String> patch = DiffUtils.diff(a, b);

        int cursor = 0;
        for (AbstractDelta<String> delta : patch.getDeltas()) {
            Chunk<String> source = delta.getSource();
            Chunk<String> target = delta.getTarget();

            append(runs, Kind.EQUAL, join(a.subList(cursor, source.getPosition())));
            append(runs, Kind.REMOVED, join(source.getLines()));
            append(runs, Kind.ADDED, join(target.getLines()));
            cursor = source.getPosition() + source.size();
        }
        append(runs, Kind.EQUAL, join(a.subList(cursor, a.size())));
    }

    /**
     * Fold whitespace-only equal runs that sit between two changes into the change,
     * then emit every changed stretch as one removed part followed by one added part.
     */
    private static List<InlinePart> coalesce(List<Run> runs) {
        List<InlinePart> parts = new ArrayList<>();
        StringBuilder removed = new StringBuilder();
        StringBuilder added = new StringBuilder();

        for (int i = 0; i < runs.size(); i++) {
            Run run = runs.get(i);
            boolean absorbed = run.kind == Kind.EQUAL
                && run.text.isBlank()
                && i > 0 && runs.get(i - 1).kind != Kind.EQUAL
                && i < runs.size() - 1 && runs.get(i + 1).kind != Kind.EQUAL;

            if (run.kind == Kind.REMOVED || absorbed) {
                removed.append(run.text);
            }
            if (run.kind == Kind.ADDED || absorbed) {
                added.append(run.text);
            }
            if (run.kind == Kind.EQUAL && !absorbed) {
                flush(parts, removed, added);
                parts.add(InlinePart.unchanged(run.text));
            }
        }
        flush(parts, removed, added);
        return parts;
    }

    private static void flush(List<InlinePart> parts, StringBuilder removed, StringBuilder added) {
        if (removed.length() > 0) {
            parts.add(InlinePart.removed(removed.toString()));
            removed.setLength(0);
        }
        if (added.length() > 0) {
            parts.add(InlinePart.added(added.toString()));
            added.setLength(0);
        }
    }

    private static void append(List<Run> runs, Kind kind, String text) {
        if (text.isEmpty()) {
            return;
        }
        if (!runs.isEmpty()) {
            Run last = runs.get(runs.size() - 1);
            if (last.kind == kind) {
                runs.set(runs.size() - 1, new Run(kind, last.text + text));
                return;
            }
        }
        runs.add(new Run(kind, text));
    }

    private static String join(List<String> tokens) {
        return String.join("", tokens);
    }

    private enum Kind { EQUAL, ADDED, REMOVED }

    private static final class Run {
        final Kind kind;
        final String text;

        Run(Kind kind, String text) {
            this.kind = kind;
            this.text = text;
        }
    }
}
