package org.javai.status;

import java.util.Objects;

/**
 * One key-value pair of status context.
 *
 * @param key A short, stable field name (e.g., "file_path")
 * @param value The typed value
 */
public record ContextEntry(String key, ContextValue value) {

    public ContextEntry {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        if (key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
    }

    public static ContextEntry of(String key, ContextValue value) {
        return new ContextEntry(key, value);
    }

    public static ContextEntry of(String key, String value) {
        return new ContextEntry(key, ContextValue.of(value));
    }

    public static ContextEntry of(String key, long value) {
        return new ContextEntry(key, ContextValue.of(value));
    }

    public static ContextEntry of(String key, boolean value) {
        return new ContextEntry(key, ContextValue.of(value));
    }

    @Override
    public String toString() {
        return key + "=" + value.render();
    }
}
