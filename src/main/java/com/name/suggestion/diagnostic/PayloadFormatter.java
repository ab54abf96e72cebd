package com.name.suggestion.diagnostic;

/**
 * Renders a suggested candidate as one human-readable line, for example a method signature
 * or a field with its type. Each diagnostic category supplies its own formatter; the ranking
 * engine never looks at the payload itself.
 *
 * @param <T> payload type
 */
@FunctionalInterface
public interface PayloadFormatter<T> {

    String format(String name, T value);

    /**
     * Renders only the candidate name.
     */
    static <T> PayloadFormatter<T> names() {
        return (name, value) -> name;
    }

    /**
     * Renders the payload's {@code toString()}, or the name when the payload is null.
     */
    static <T> PayloadFormatter<T> values() {
        return (name, value) -> value == null ? name : value.toString();
    }
}
