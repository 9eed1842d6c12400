package im.arun.htmldiff.diff;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TokenizerTest {

    @Test
    void wordTokensSplitWordsWhitespaceAndPunctuation() {
        assertThat(Tokenizer.tokenize("Hard hat (Class G)", Granularity.WORD))
            .containsExactly("Hard", " ", "hat", " ", "(", "Class", " ", "G", ")");
    }

    @Test
    void wordTokensKeepTagsAndEntitiesWhole() {
        assertThat(Tokenizer.tokenize("a&amp;b <em>x</em>", Granularity.WORD))
            .containsExactly("a", "&amp;", "b", " ", "<em>", "x", "</em>");
    }

    @Test
    void wordTokensGroupWhitespaceRuns() {
        assertThat(Tokenizer.tokenize("one \n\t two", Granularity.WORD))
            .containsExactly("one", " \n\t ", "two");
    }

    @Test
    void characterTokensAreCodePoints() {
        assertThat(Tokenizer.tokenize("añ😀", Granularity.CHARACTER))
            .containsExactly("a", "ñ", "😀");
    }

    @Test
    void lineTokensKeepTerminators() {
        assertThat(Tokenizer.tokenize("first\nsecond\n\nlast", Granularity.LINE))
            .containsExactly("first\n", "second\n", "\n", "last");
    }

    @Test
    void tokensConcatenateBackToInput() {
        String text = "Slump: 80mm ± 20mm <b>bold</b> &nbsp; a < b\n";
        for (Granularity granularity : Granularity.values()) {
            assertThat(String.join("", Tokenizer.tokenize(text, granularity)))
                .as(granularity.getValue())
                .isEqualTo(text);
        }
    }

    @Test
    void emptyAndNullInputHaveNoTokens() {
        assertThat(Tokenizer.tokenize("", Granularity.WORD)).isEmpty();
        assertThat(Tokenizer.tokenize(null, Granularity.LINE)).isEmpty();
    }
}
