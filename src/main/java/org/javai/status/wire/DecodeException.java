package org.javai.status.wire;

import java.util.Objects;

/**
 * Thrown when a wire payload cannot be decoded into a status.
 *
 * <p>This is a checked exception: malformed input from a peer is an expected operational
 * condition, and the caller decides whether to reject the payload or report it.
 * Unknown classification ids are not decode failures; see
 * {@link org.javai.status.UnrecognizedClassification}.
 */
public class DecodeException extends Exception {

    /**
     * Why a payload was rejected.
     */
    public enum Reason {
        /** The version tag is not one this codec understands. */
        UNSUPPORTED_VERSION,
        /** The payload ended before a complete status was read. */
        TRUNCATED,
        /** A context value carries a type tag outside the value-type union. */
        UNKNOWN_VALUE_TAG,
        /** A field is structurally invalid (negative length, bad marker byte, invalid UTF-8, blank key). */
        MALFORMED,
        /** Bytes remain after a complete status. */
        TRAILING_BYTES,
        /** Cause chain or structured values are nested deeper than the configured limit. */
        DEPTH_EXCEEDED
    }

    private final Reason reason;
    private final long offset;

    public DecodeException(Reason reason, long offset, String message) {
        super(message + " (" + reason + " at offset " + offset + ")");
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
        this.offset = offset;
    }

    public DecodeException(Reason reason, String message) {
        super(message + " (" + reason + ")");
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
        this.offset = -1;
    }

    public DecodeException(Reason reason, String message, Throwable cause) {
        super(message + " (" + reason + ")", cause);
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
        this.offset = -1;
    }

    public Reason reason() {
        return reason;
    }

    /**
     * Returns the byte offset at which decoding failed, or -1 when not applicable.
     */
    public long offset() {
        return offset;
    }
}
