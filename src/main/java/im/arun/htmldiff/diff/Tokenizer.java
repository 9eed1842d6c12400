package im.arun.htmldiff.diff;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits text into diff tokens. Concatenating the tokens always gives back the input.
 */
public final class Tokenizer {

    /**
     * Markup tag, character entity, word, whitespace run, or any single other character.
     */
    private static final Pattern WORD_TOKEN = Pattern.compile(
        "<[^<>]*>|&#?[A-Za-z0-9]+;|[\\p{L}\\p{N}_]+|\\s+|.",
        Pattern.DOTALL);

    private static final Pattern LINE_TOKEN = Pattern.compile("[^\\n]*\\n|[^\\n]+");

    private Tokenizer() {}

    public static List<String> tokenize(String text, Granularity granularity) {
        if (text == null || text.isEmpty()) {
            return new ArrayList<>();
        }

        switch (granularity) {
            case CHARACTER:
                return characters(text);
            case LINE:
                return matches(LINE_TOKEN, text);
            case WORD:
            default:
                return matches(WORD_TOKEN, text);
        }
    }

    private static List<String> characters(String text) {
        List<String> tokens = new ArrayList<>(text.length());
        text.codePoints().forEach(cp -> tokens.add(new String(Character.toChars(cp))));
        return tokens;
    }

    private static List<String> matches(Pattern pattern, String text) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }
}
