package org.javai.status;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The closed set of classifications a process knows about, indexed by stable identifier.
 *
 * <p>Decoders use this to turn wire identifiers back into the application's own classification
 * values. Two processes built from the same set agree on equality for every status they exchange.
 *
 * <p>Example usage:
 * <pre>{@code
 * ClassificationSet known = ClassificationSet.of(StorageError.class);
 * Classification kind = known.resolve("storage.not_found");
 * }</pre>
 */
public final class ClassificationSet {

    private static final ClassificationSet ADHOC = new ClassificationSet(Map.of(), true);

    private final Map<String, Classification> byId;
    private final boolean adhoc;

    private ClassificationSet(Map<String, Classification> byId, boolean adhoc) {
        this.byId = byId;
        this.adhoc = adhoc;
    }

    /**
     * Creates a set from every constant of an enum that implements {@link Classification}.
     *
     * @param enumType the enum class
     * @return the set of its constants
     * @throws IllegalArgumentException if two constants share an id
     */
    public static <E extends Enum<E> & Classification> ClassificationSet of(Class<E> enumType) {
        Objects.requireNonNull(enumType, "enumType must not be null");
        return of(Arrays.asList(enumType.getEnumConstants()));
    }

    /**
     * Creates a set from explicit classification values.
     *
     * @throws IllegalArgumentException if two values share an id
     */
    public static ClassificationSet of(Classification... classifications) {
        return of(Arrays.asList(classifications));
    }

    /**
     * Creates a set from a collection of classification values.
     *
     * @param classifications the values, in the order they should be listed
     * @return the set
     * @throws IllegalArgumentException if two values share an id, or a value is unrecognized
     */
    public static ClassificationSet of(Collection<? extends Classification> classifications) {
        Objects.requireNonNull(classifications, "classifications must not be null");
        Map<String, Classification> byId = new LinkedHashMap<>();
        for (Classification classification : classifications) {
            Objects.requireNonNull(classification, "classification must not be null");
            if (!classification.isRecognized()) {
                throw new IllegalArgumentException("unrecognized classification cannot be registered: "
                        + classification.id());
            }
            String id = Classification.requireValidId(classification.id());
            Classification previous = byId.putIfAbsent(id, classification);
            if (previous != null && !previous.equals(classification)) {
                throw new IllegalArgumentException("duplicate classification id '" + id + "': "
                        + previous + " and " + classification);
            }
        }
        return new ClassificationSet(Collections.unmodifiableMap(byId), false);
    }

    /**
     * Returns a set that accepts every identifier as an {@link AdhocClassification}.
     *
     * <p>Handy for prototypes and for tools that only inspect or forward statuses.
     */
    public static ClassificationSet adhoc() {
        return ADHOC;
    }

    /**
     * Looks up a classification by its stable identifier.
     *
     * @param id the identifier
     * @return the classification, or empty if this set does not contain it
     */
    public Optional<Classification> lookup(String id) {
        Objects.requireNonNull(id, "id must not be null");
        if (adhoc) {
            return id.isBlank() ? Optional.empty() : Optional.of(new AdhocClassification(id));
        }
        return Optional.ofNullable(byId.get(id));
    }

    /**
     * Resolves an identifier, mapping unknown ids to an {@link UnrecognizedClassification}.
     */
    public Classification resolve(String id) {
        return lookup(id).orElseGet(() -> new UnrecognizedClassification(id));
    }

    public boolean contains(Classification classification) {
        Objects.requireNonNull(classification, "classification must not be null");
        return lookup(classification.id())
                .map(classification::equals)
                .orElse(false);
    }

    /**
     * Returns the registered values in registration order. Empty for the ad-hoc set.
     */
    public List<Classification> values() {
        return List.copyOf(byId.values());
    }

    public boolean isAdhoc() {
        return adhoc;
    }

    @Override
    public String toString() {
        return adhoc ? "ClassificationSet[adhoc]" : "ClassificationSet" + byId.keySet();
    }
}
