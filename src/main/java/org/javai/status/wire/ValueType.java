package org.javai.status.wire;

import java.util.Objects;
import java.util.Optional;
import org.javai.status.ContextValue;

/**
 * The closed set of context value types and their wire tags.
 * Both the tag bytes and the names are part of the interop contract and must never change.
 */
public enum ValueType {
    TEXT(0x01, "text"),
    INT(0x02, "int"),
    BOOL(0x03, "bool"),
    STRUCTURED(0x04, "structured");

    private final int tag;
    private final String wireName;

    ValueType(int tag, String wireName) {
        this.tag = tag;
        this.wireName = wireName;
    }

    public int tag() {
        return tag;
    }

    public String wireName() {
        return wireName;
    }

    public static ValueType of(ContextValue value) {
        Objects.requireNonNull(value, "value must not be null");
        if (value instanceof ContextValue.Text) {
            return TEXT;
        } else if (value instanceof ContextValue.Int) {
            return INT;
        } else if (value instanceof ContextValue.Bool) {
            return BOOL;
        }
        return STRUCTURED;
    }

    public static Optional<ValueType> fromTag(int tag) {
        for (ValueType type : values()) {
            if (type.tag == tag) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public static Optional<ValueType> fromWireName(String name) {
        for (ValueType type : values()) {
            if (type.wireName.equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
