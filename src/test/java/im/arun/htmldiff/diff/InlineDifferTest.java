package im.arun.htmldiff.diff;

import im.arun.htmldiff.model.InlinePart;
import im.arun.htmldiff.util.TreeUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InlineDifferTest {

    private final InlineDiffer differ = new InlineDiffer();

    @Test
    void insertedWordsAreShownBeforeTheRetainedToken() {
        List<InlinePart> parts = differ.diff("Hard hat (Class G)", "Hard hat (Class E or G)");

        assertThat(parts).containsExactly(
            InlinePart.unchanged("Hard hat (Class "),
            InlinePart.added("E or "),
            InlinePart.unchanged("G)"));
    }

    @Test
    void appendedTextIsOneAddedPart() {
        assertThat(differ.diff("Safety goggles", "Safety goggles (Anti-fog)")).containsExactly(
            InlinePart.unchanged("Safety goggles"),
            InlinePart.added(" (Anti-fog)"));
    }

    @Test
    void replacedPhraseIsOneRemovedThenOneAddedPart() {
        assertThat(differ.diff("Stay calm and do not run.", "Stay calm and walk quickly.")).containsExactly(
            InlinePart.unchanged("Stay calm and "),
            InlinePart.removed("do not run"),
            InlinePart.added("walk quickly"),
            InlinePart.unchanged("."));
    }

    @Test
    void markupTagsAreNotSplit() {
        assertThat(differ.diff("<strong>Workers</strong> must", "<strong>All workers</strong> must")).containsExactly(
            InlinePart.unchanged("<strong>"),
            InlinePart.removed("Workers"),
            InlinePart.added("All workers"),
            InlinePart.unchanged("</strong> must"));
    }

    @Test
    void identicalTextIsOneUnchangedPart() {
        assertThat(differ.diff("Use the nearest exit.", "Use the nearest exit."))
            .containsExactly(InlinePart.unchanged("Use the nearest exit."));
    }

    @Test
    void emptySidesProducePureAdditionsOrRemovals() {
        assertThat(differ.diff("", "")).isEmpty();
        assertThat(differ.diff("", "new text")).containsExactly(InlinePart.added("new text"));
        assertThat(differ.diff("old text", null)).containsExactly(InlinePart.removed("old text"));
    }

    @Test
    void characterGranularityHighlightsSingleLetters() {
        InlineDiffer characters = new InlineDiffer(Granularity.CHARACTER);

        assertThat(characters.diff("cat", "cut")).containsExactly(
            InlinePart.unchanged("c"),
            InlinePart.removed("a"),
            InlinePart.added("u"),
            InlinePart.unchanged("t"));
    }

    @Test
    void lineGranularityComparesWholeLines() {
        InlineDiffer lines = new InlineDiffer(Granularity.LINE);

        assertThat(lines.diff("a\nb\nc\n", "a\nB\nc\n")).containsExactly(
            InlinePart.unchanged("a\n"),
            InlinePart.removed("b\n"),
            InlinePart.added("B\n"),
            InlinePart.unchanged("c\n"));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "Hard hat (Class G)|Hard hat (Class E or G)",
        "Cement: C25/30|Cement: C30/37",
        "Aggregate size: 10mm|Aggregate size: 10–14mm",
        "Check lighting levels in all areas.|Check lighting levels in all areas (lux meter if available).",
        "the quick brown fox|a quick red fox jumps",
        "one two three|three two one",
        "<em>x</em> y|<b>x</b> y z",
        "a  b   c|a b c"
    })
    void partsReconstructBothSides(String original, String modified) {
        for (Granularity granularity : Granularity.values()) {
            List<InlinePart> parts = new InlineDiffer(granularity).diff(original, modified);

            assertThat(TreeUtils.originalText(parts)).as(granularity.getValue()).isEqualTo(original);
            assertThat(TreeUtils.modifiedText(parts)).as(granularity.getValue()).isEqualTo(modified);
            assertThat(parts).noneMatch(part -> part.isAdded() && part.isRemoved());
            assertThat(parts).noneMatch(part -> part.getText().isEmpty());
        }
    }

    @Test
    void defaultGranularityIsWord() {
        assertThat(differ.getGranularity()).isEqualTo(Granularity.WORD);
        assertThat(new InlineDiffer(null).getGranularity()).isEqualTo(Granularity.WORD);
    }
}
