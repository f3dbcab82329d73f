package org.javai.status;

/**
 * Identifies the category of a failure.
 *
 * <p>The set of classifications belongs to the consuming application, typically as an enum:
 * <pre>{@code
 * enum StorageError implements Classification {
 *     NOT_FOUND("storage.not_found"),
 *     PERMISSION_DENIED("storage.permission_denied");
 *
 *     private final String id;
 *
 *     StorageError(String id) { this.id = id; }
 *
 *     @Override
 *     public String id() { return id; }
 * }
 * }</pre>
 *
 * <p>The {@link #id()} is what crosses process boundaries and what localization catalogs are keyed
 * by. It must stay stable across releases; ordinals and class names are never used in its place.
 */
public interface Classification {

    /**
     * Returns the stable, cross-process identifier of this classification.
     */
    String id();

    /**
     * Returns false only for the sentinel produced when a peer sends an id this process does not know.
     */
    default boolean isRecognized() {
        return true;
    }

    /**
     * Creates an ad-hoc classification, useful while prototyping before a proper enum exists.
     *
     * @param id the stable identifier
     * @return an ad-hoc classification
     */
    static Classification adhoc(String id) {
        return new AdhocClassification(id);
    }

    /**
     * Validates a classification identifier.
     *
     * @throws NullPointerException if id is null
     * @throws IllegalArgumentException if id is blank
     */
    static String requireValidId(String id) {
        if (id == null) {
            throw new NullPointerException("id must not be null");
        }
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        return id;
    }
}
