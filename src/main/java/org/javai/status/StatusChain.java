package org.javai.status;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * The statuses reachable from an outer status by following causes, outermost first.
 *
 * <p>Iteration walks the links lazily and can be repeated; the chain does not change once built.
 */
public final class StatusChain implements Iterable<Status> {

    private final Status head;

    StatusChain(Status head) {
        this.head = Objects.requireNonNull(head, "head must not be null");
    }

    @Override
    public Iterator<Status> iterator() {
        return new Iterator<>() {
            private Status next = head;

            @Override
            public boolean hasNext() {
                return next != null;
            }

            @Override
            public Status next() {
                if (next == null) {
                    throw new NoSuchElementException();
                }
                Status current = next;
                next = current.cause().orElse(null);
                return current;
            }
        };
    }

    public Stream<Status> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    /**
     * Returns the innermost status.
     */
    public Status root() {
        Status current = head;
        while (current.cause().isPresent()) {
            current = current.cause().get();
        }
        return current;
    }

    /**
     * Returns the outermost status in the chain with the given classification.
     */
    public Optional<Status> find(Classification classification) {
        Objects.requireNonNull(classification, "classification must not be null");
        return stream().filter(s -> s.is(classification)).findFirst();
    }

    public int depth() {
        return (int) stream().count();
    }
}
