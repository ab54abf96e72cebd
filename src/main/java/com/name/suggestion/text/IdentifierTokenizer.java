package com.name.suggestion.text;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Splits identifiers into lowercase word tokens along casing, underscore,
 * whitespace and digit boundaries.
 *
 * <p>A boundary is placed before every uppercase letter, so a run of capitals
 * yields one-letter tokens ({@code XMLHttpRequest -> x, m, l, http, request}).
 * Digits act as separators only and never appear in the output. Whitespace and digit
 * classes are Unicode-aware, so a no-break space splits like an ordinary one.</p>
 */
public class IdentifierTokenizer {

    private static final Pattern SPLIT_PATTERN = Pattern.compile("(?=[A-Z])|[_\\s\\d]", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * Tokenizes an identifier.
     *
     * @param identifier raw identifier, may be null
     * @return unmodifiable list of non-empty lowercase tokens, never null
     */
    public List<String> splitIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return List.of();
        }

        String[] fragments = SPLIT_PATTERN.split(identifier);
        List<String> tokens = new ArrayList<>(fragments.length);
        for (String fragment : fragments) {
            if (!fragment.isEmpty()) {
                tokens.add(fragment.toLowerCase(Locale.ROOT));
            }
        }
        return Collections.unmodifiableList(tokens);
    }
}
