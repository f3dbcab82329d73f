package org.javai.status;

/**
 * Stands in for a classification id that the local {@link ClassificationSet} does not contain.
 *
 * <p>Produced by the wire codecs when a newer producer sends a classification an older consumer
 * has never heard of. The original id is kept, so the status can be re-encoded unchanged and
 * still rendered with its identifier.
 *
 * @param id The identifier as received
 */
public record UnrecognizedClassification(String id) implements Classification {

    public UnrecognizedClassification {
        Classification.requireValidId(id);
    }

    @Override
    public boolean isRecognized() {
        return false;
    }

    @Override
    public String toString() {
        return "unrecognized:" + id;
    }
}
