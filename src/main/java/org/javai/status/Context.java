package org.javai.status;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The ordered, append-only metadata of a {@link Status}.
 *
 * <p>Keys may repeat: a low-level frame might record a generic {@code path}, and a caller higher
 * up the stack a more specific one. Both stay in the sequence. Use {@link #latest(String)} when a
 * single value is wanted (the last one appended wins) and {@link #entries()} or
 * {@link #history(String)} when the full history matters.
 *
 * <p>Entries are only ever appended through the owning {@link Status}; nothing is removed or
 * replaced. Not thread-safe.
 */
public final class Context implements Iterable<ContextEntry> {

    private final List<ContextEntry> entries = new ArrayList<>();

    Context() {
    }

    void append(ContextEntry entry) {
        entries.add(Objects.requireNonNull(entry, "entry must not be null"));
    }

    /**
     * Returns a snapshot of all entries in insertion order, duplicates included.
     */
    public List<ContextEntry> entries() {
        return List.copyOf(entries);
    }

    /**
     * Resolves a key to the value of its most recently appended entry.
     *
     * @param key the key
     * @return the last value appended under the key, or empty if the key was never used
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

    /**
     * Returns every value appended under the key, oldest first.
     */
    public List<ContextValue> history(String key) {
        Objects.requireNonNull(key, "key must not be null");
        return entries.stream()
                .filter(e -> e.key().equals(key))
                .map(ContextEntry::value)
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Returns the distinct keys in order of first appearance.
     */
    public Set<String> keys() {
        Set<String> keys = new LinkedHashSet<>();
        for (ContextEntry entry : entries) {
            keys.add(entry.key());
        }
        return Collections.unmodifiableSet(keys);
    }

    public boolean containsKey(String key) {
        return latest(key).isPresent();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Stream<ContextEntry> stream() {
        return entries.stream();
    }

    @Override
    public Iterator<ContextEntry> iterator() {
        return Collections.unmodifiableList(entries).iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Context other)) {
            return false;
        }
        return entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.stream()
                .map(ContextEntry::toString)
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
