package de.bsommerfeld.redditindexer.core.text;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns item text into the token set stored in the full-text field.
 *
 * <p>
 * A token is a run of word characters or apostrophes ({@code [\w']+},
 * Unicode-aware), lower-cased with {@link Locale#ROOT}. Duplicates collapse;
 * the set keeps first-seen order so output is deterministic.
 */
public final class Tokenizer {

    private static final Pattern WORD = Pattern.compile("[\\w']+", Pattern.UNICODE_CHARACTER_CLASS);

    /** Separator used when the token set is written to the store. */
    public static final String SEPARATOR = " ";

    private Tokenizer() {
    }

    public static Set<String> tokenize(String body) {
        if (body == null || body.isBlank())
            return Collections.emptySet();

        Set<String> tokens = new LinkedHashSet<>();
        Matcher m = WORD.matcher(body);
        while (m.find()) {
            tokens.add(m.group().toLowerCase(Locale.ROOT));
        }
        return tokens;
    }

    /** Serializes a token set into the single string kept in the token field. */
    public static String join(Set<String> tokens) {
        return String.join(SEPARATOR, tokens);
    }
}
