package com.name.suggestion.diagnostic;

import com.name.suggestion.ranking.ScoredCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Renders ranked suggestions into the text of a "Did you mean" diagnostic.
 */
public class SuggestionMessageFormatter {
    private static final Logger log = LoggerFactory.getLogger(SuggestionMessageFormatter.class);

    private static final String ITEM_PREFIX = "\n- ";

    private final DiagnosticMessages messages;

    public SuggestionMessageFormatter() {
        this(new DiagnosticMessages());
    }

    public SuggestionMessageFormatter(DiagnosticMessages messages) {
        this.messages = messages;
    }

    /**
     * Renders the suggestion list: the header followed by one {@code "\n- "} line per suggestion,
     * or the "no suggestions" text when the list is empty.
     * A formatter that fails on a payload falls back to the candidate name.
     */
    public <T> String formatSuggestions(List<ScoredCandidate<T>> suggestions, PayloadFormatter<T> formatter) {
        if (suggestions == null || suggestions.isEmpty()) {
            return messages.noSuggestions();
        }

        StringBuilder text = new StringBuilder(messages.suggestionsHeader());
        for (ScoredCandidate<T> suggestion : suggestions) {
            text.append(ITEM_PREFIX).append(formatLine(suggestion, formatter));
        }
        return text.toString();
    }

    /**
     * Renders the complete diagnostic message for a category.
     *
     * @param category    diagnostic category
     * @param unknownName the unresolved name
     * @param container   containing element (type, method); may be null when the category does not use it
     * @param suggestions ranked suggestions
     * @param formatter   payload formatter
     */
    public <T> String formatMessage(DiagnosticCategory category, String unknownName, String container,
                                    List<ScoredCandidate<T>> suggestions, PayloadFormatter<T> formatter) {
        String template = messages.messageTemplate(category);
        return String.format(template,
                unknownName == null ? "" : unknownName,
                container == null ? "" : container,
                formatSuggestions(suggestions, formatter));
    }

    public DiagnosticMessages getMessages() {
        return messages;
    }

    private <T> String formatLine(ScoredCandidate<T> suggestion, PayloadFormatter<T> formatter) {
        try {
            String line = formatter.format(suggestion.name(), suggestion.value());
            return line == null || line.isBlank() ? suggestion.name() : line;
        } catch (RuntimeException e) {
            log.warn("Failed to format suggestion '{}', falling back to its name", suggestion.name(), e);
            return suggestion.name();
        }
    }
}
