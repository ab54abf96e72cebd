package com.name.suggestion.text;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical comparison form of an identifier: lowercased, with every
 * underscore and Unicode whitespace character removed. Other punctuation is kept.
 *
 * <p>{@code normalize(normalize(x)).equals(normalize(x))} holds for every input.</p>
 */
public class IdentifierNormalizer {

    private static final Pattern SEPARATORS = Pattern.compile("[_\\s]", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * Normalizes an identifier.
     *
     * @param identifier raw identifier, may be null
     * @return the normalized form, {@code ""} for null or empty input
     */
    public String normalize(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            return "";
        }
        return SEPARATORS.matcher(identifier.toLowerCase(Locale.ROOT)).replaceAll("");
    }
}
