package org.javai.status;

/**
 * A classification defined by its identifier alone.
 *
 * @param id The stable identifier (e.g., "config.missing")
 */
public record AdhocClassification(String id) implements Classification {

    public AdhocClassification {
        Classification.requireValidId(id);
    }

    @Override
    public String toString() {
        return id;
    }
}
