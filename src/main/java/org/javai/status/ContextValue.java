package org.javai.status;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A value attached to a status under a context key.
 *
 * <p>The union is closed: {@link Text}, {@link Int}, {@link Bool} and {@link Structured}. Every
 * variant carries its own type on the wire, so an integer never comes back as a string.
 */
public sealed interface ContextValue permits ContextValue.Text, ContextValue.Int, ContextValue.Bool, ContextValue.Structured {

    /**
     * A string value.
     *
     * @param value the text, never null
     */
    record Text(String value) implements ContextValue {

        public Text {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public String render() {
            return value;
        }
    }

    /**
     * A signed 64-bit integer value.
     */
    record Int(long value) implements ContextValue {

        @Override
        public String render() {
            return Long.toString(value);
        }
    }

    /**
     * A boolean value.
     */
    record Bool(boolean value) implements ContextValue {

        @Override
        public String render() {
            return Boolean.toString(value);
        }
    }

    /**
     * A nested, ordered group of entries. Duplicate keys follow the same rules as a {@link Context}.
     *
     * @param entries the nested entries, in insertion order
     */
    record Structured(List<ContextEntry> entries) implements ContextValue {

        public Structured {
            Objects.requireNonNull(entries, "entries must not be null");
            entries = List.copyOf(entries);
        }

        /**
         * Returns the value of the last nested entry with the given key.
         */
        public Optional<ContextValue> latest(String key) {
            Objects.requireNonNull(key, "key must not be null");
            for (int i = entries.size() - 1; i >= 0; i--) {
                ContextEntry entry = entries.get(i);
                if (entry.key().equals(key)) {
                    return Optional.of(entry.value());
                }
            }
            return Optional.empty();
        }

        @Override
        public String render() {
            return entries.stream()
                    .map(ContextEntry::toString)
                    .collect(Collectors.joining(", ", "{", "}"));
        }
    }

    /**
     * Renders this value as text suitable for substitution into a message template.
     */
    String render();

    static ContextValue of(String value) {
        return new Text(value);
    }

    static ContextValue of(long value) {
        return new Int(value);
    }

    static ContextValue of(boolean value) {
        return new Bool(value);
    }

    /**
     * Creates a nested value from the given entries.
     */
    static ContextValue structured(ContextEntry... entries) {
        return new Structured(Arrays.asList(entries));
    }
}
