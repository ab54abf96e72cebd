package com.name.suggestion.diagnostic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.MissingResourceException;
import java.util.Optional;
import java.util.ResourceBundle;

/**
 * Diagnostic titles and message templates, read from the {@code diagnostic-messages} resource bundle.
 * Keys missing from the bundle, or a missing bundle, fall back to built-in English texts.
 */
public class DiagnosticMessages {
    private static final Logger log = LoggerFactory.getLogger(DiagnosticMessages.class);

    public static final String DEFAULT_BUNDLE = "diagnostic-messages";

    static final String SUGGESTIONS_HEADER = "suggestions.header";
    static final String SUGGESTIONS_NONE = "suggestions.none";

    private static final Map<String, String> FALLBACKS = Map.ofEntries(
            Map.entry("member.not.found.title", "Member not found"),
            Map.entry("member.not.found.message", "Member '%1$s' does not exist on type '%2$s'.%3$s"),
            Map.entry("member.not.found.description", "This member does not exist on the given type."),
            Map.entry("variable.not.found.title", "Variable not found"),
            Map.entry("variable.not.found.message", "Variable '%1$s' does not exist in the current scope.%3$s"),
            Map.entry("variable.not.found.description", "This variable does not exist in the current scope."),
            Map.entry("namespace.not.found.title", "Namespace not found"),
            Map.entry("namespace.not.found.message", "Namespace '%1$s' does not exist.%3$s"),
            Map.entry("namespace.not.found.description", "This namespace does not exist."),
            Map.entry("named.argument.not.found.title", "Named argument not found"),
            Map.entry("named.argument.not.found.message", "Parameter '%1$s' does not exist for '%2$s'.%3$s"),
            Map.entry("named.argument.not.found.description",
                    "This named argument does not exist for the method or constructor."),
            Map.entry("invalid.nameof.argument.title", "Invalid nameof argument"),
            Map.entry("invalid.nameof.argument.message", "Argument '%1$s' in nameof() does not exist.%3$s"),
            Map.entry("invalid.nameof.argument.description",
                    "The argument used in the nameof() operator does not exist in the current scope."),
            Map.entry(SUGGESTIONS_HEADER, " Did you mean:"),
            Map.entry(SUGGESTIONS_NONE, " No suggestions available")
    );

    private final ResourceBundle bundle;

    public DiagnosticMessages() {
        this(DEFAULT_BUNDLE);
    }

    public DiagnosticMessages(String bundleName) {
        this.bundle = loadBundle(bundleName).orElse(null);
    }

    public String title(DiagnosticCategory category) {
        return get(category.messageKeyPrefix() + ".title");
    }

    public String messageTemplate(DiagnosticCategory category) {
        return get(category.messageKeyPrefix() + ".message");
    }

    public String description(DiagnosticCategory category) {
        return get(category.messageKeyPrefix() + ".description");
    }

    public String suggestionsHeader() {
        return get(SUGGESTIONS_HEADER);
    }

    public String noSuggestions() {
        return get(SUGGESTIONS_NONE);
    }

    /**
     * Returns true if texts come from a resource bundle rather than the built-in fallbacks only.
     */
    public boolean isBundleLoaded() {
        return bundle != null;
    }

    String get(String key) {
        if (bundle != null && bundle.containsKey(key)) {
            return bundle.getString(key);
        }
        String fallback = FALLBACKS.get(key);
        if (fallback == null) {
            throw new IllegalArgumentException("Unknown message key: " + key);
        }
        return fallback;
    }

    private static Optional<ResourceBundle> loadBundle(String bundleName) {
        try {
            return Optional.of(ResourceBundle.getBundle(bundleName, Locale.ROOT));
        } catch (MissingResourceException e) {
            log.warn("Message bundle '{}' not found, using built-in messages", bundleName);
            return Optional.empty();
        }
    }
}
