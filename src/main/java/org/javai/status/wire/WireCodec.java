package org.javai.status.wire;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.status.Classification;
import org.javai.status.ClassificationSet;
import org.javai.status.ContextEntry;
import org.javai.status.ContextValue;
import org.javai.status.Status;
import org.javai.status.wire.DecodeException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes statuses, cause chains included, to a compact binary form and back.
 *
 * <p>Layout, all integers big-endian:
 * <pre>
 * wire      := version:u8 classification:string message:optional(string) context cause
 * string    := length:i32 utf8-bytes
 * optional  := 0x00 | 0x01 value
 * context   := count:i32 entry*
 * entry     := key:string tag:u8 value
 * value     := 0x01 string | 0x02 i64 | 0x03 u8(0|1) | 0x04 count:i32 entry*
 * cause     := 0x00 | 0x01 wire
 * </pre>
 *
 * <p>Classifications travel as their stable id. Ids missing from the decoder's
 * {@link ClassificationSet} decode to an {@link org.javai.status.UnrecognizedClassification}, which
 * re-encodes to the same bytes. Decoding either yields a complete status or throws
 * {@link DecodeException}; it never returns a partial one.
 *
 * <p>Example usage:
 * <pre>{@code
 * WireCodec codec = WireCodec.forClassifications(ClassificationSet.of(AppError.class));
 * byte[] bytes = codec.encode(status);
 * Status received = codec.decode(bytes);
 * }</pre>
 */
public final class WireCodec {

    private static final Logger LOGGER = LoggerFactory.getLogger(WireCodec.class);

    public static final int VERSION = 1;
    public static final int DEFAULT_MAX_DEPTH = 128;

    private static final int ABSENT = 0x00;
    private static final int PRESENT = 0x01;

    private final ClassificationSet classifications;
    private final int maxDepth;

    private WireCodec(ClassificationSet classifications, int maxDepth) {
        this.classifications = Objects.requireNonNull(classifications, "classifications must not be null");
        this.maxDepth = maxDepth;
    }

    /**
     * Creates a codec that decodes against the given classification set with default limits.
     */
    public static WireCodec forClassifications(ClassificationSet classifications) {
        return new WireCodec(classifications, DEFAULT_MAX_DEPTH);
    }

    public static Builder builder(ClassificationSet classifications) {
        return new Builder(classifications);
    }

    // === Encoding ===

    /**
     * Encodes a status and its cause chain.
     *
     * @param status the outermost status
     * @return the wire bytes
     */
    public byte[] encode(Status status) {
        Objects.requireNonNull(status, "status must not be null");
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            Status current = status;
            while (current != null) {
                out.writeByte(VERSION);
                writeString(out, current.classification().id());
                if (current.message().isPresent()) {
                    out.writeByte(PRESENT);
                    writeString(out, current.message().get());
                } else {
                    out.writeByte(ABSENT);
                }
                writeEntries(out, current.contextEntries());
                current = current.cause().orElse(null);
                out.writeByte(current == null ? ABSENT : PRESENT);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("in-memory encoding failed", e);
        }
        return bytes.toByteArray();
    }

    private static void writeEntries(DataOutputStream out, List<ContextEntry> entries) throws IOException {
        out.writeInt(entries.size());
        for (ContextEntry entry : entries) {
            writeString(out, entry.key());
            writeValue(out, entry.value());
        }
    }

    private static void writeValue(DataOutputStream out, ContextValue value) throws IOException {
        ValueType type = ValueType.of(value);
        out.writeByte(type.tag());
        switch (type) {
            case TEXT -> writeString(out, ((ContextValue.Text) value).value());
            case INT -> out.writeLong(((ContextValue.Int) value).value());
            case BOOL -> out.writeByte(((ContextValue.Bool) value).value() ? 1 : 0);
            case STRUCTURED -> writeEntries(out, ((ContextValue.Structured) value).entries());
        }
    }

    private static void writeString(DataOutputStream out, String s) throws IOException {
        byte[] utf8 = s.getBytes(StandardCharsets.UTF_8);
        out.writeInt(utf8.length);
        out.write(utf8);
    }

    // === Decoding ===

    /**
     * Decodes a status and its cause chain.
     *
     * @param bytes the wire bytes
     * @return the decoded outermost status
     * @throws DecodeException if the bytes are not a complete, well-formed wire form
     */
    public Status decode(byte[] bytes) throws DecodeException {
        Objects.requireNonNull(bytes, "bytes must not be null");
        try {
            return new Reader(ByteBuffer.wrap(bytes)).readChain();
        } catch (DecodeException e) {
            LOGGER.debug("Rejected wire payload of {} bytes: {}", bytes.length, e.getMessage());
            throw e;
        }
    }

    private record Level(Classification classification, String message, List<ContextEntry> entries) {
    }

    private final class Reader {
        private final ByteBuffer buffer;

        Reader(ByteBuffer buffer) {
            this.buffer = buffer;
        }

        Status readChain() throws DecodeException {
            List<Level> levels = new ArrayList<>();
            boolean more = true;
            while (more) {
                if (levels.size() >= maxDepth) {
                    throw error(Reason.DEPTH_EXCEEDED, "cause chain deeper than " + maxDepth);
                }
                levels.add(readLevel());
                more = readPresence("cause marker");
            }
            if (buffer.hasRemaining()) {
                throw error(Reason.TRAILING_BYTES, buffer.remaining() + " bytes after status");
            }

            Status status = null;
            for (int i = levels.size() - 1; i >= 0; i--) {
                Level level = levels.get(i);
                Status next = status == null
                        ? Status.of(level.classification())
                        : Status.wrap(level.classification(), status);
                level.entries().forEach(next::withContext);
                if (level.message() != null) {
                    next.withMessage(level.message());
                }
                status = next;
            }
            return status;
        }

        private Level readLevel() throws DecodeException {
            int version = u8("version");
            if (version != VERSION) {
                throw new DecodeException(Reason.UNSUPPORTED_VERSION, buffer.position() - 1L,
                        "unsupported wire version " + version);
            }
            Classification classification = readClassification();
            String message = readPresence("message marker") ? string("message") : null;
            List<ContextEntry> entries = readEntries(0);
            return new Level(classification, message, entries);
        }

        private Classification readClassification() throws DecodeException {
            String id = string("classification id");
            if (id.isBlank()) {
                throw error(Reason.MALFORMED, "blank classification id");
            }
            Classification classification = classifications.resolve(id);
            if (!classification.isRecognized()) {
                LOGGER.debug("Unrecognized classification id '{}', decoding as sentinel", id);
            }
            return classification;
        }

        private List<ContextEntry> readEntries(int depth) throws DecodeException {
            if (depth >= maxDepth) {
                throw error(Reason.DEPTH_EXCEEDED, "structured value nested deeper than " + maxDepth);
            }
            int count = i32("context length");
            if (count < 0) {
                throw error(Reason.MALFORMED, "negative context length " + count);
            }
            List<ContextEntry> entries = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                String key = string("context key");
                if (key.isBlank()) {
                    throw error(Reason.MALFORMED, "blank context key");
                }
                entries.add(new ContextEntry(key, readValue(depth)));
            }
            return entries;
        }

        private ContextValue readValue(int depth) throws DecodeException {
            int tag = u8("value tag");
            ValueType type = ValueType.fromTag(tag)
                    .orElseThrow(() -> new DecodeException(Reason.UNKNOWN_VALUE_TAG, buffer.position() - 1L,
                            "unknown value tag 0x" + Integer.toHexString(tag)));
            return switch (type) {
                case TEXT -> ContextValue.of(string("text value"));
                case INT -> ContextValue.of(i64("integer value"));
                case BOOL -> ContextValue.of(readPresence("boolean value"));
                case STRUCTURED -> new ContextValue.Structured(readEntries(depth + 1));
            };
        }

        private boolean readPresence(String field) throws DecodeException {
            int marker = u8(field);
            if (marker == ABSENT) {
                return false;
            }
            if (marker == PRESENT) {
                return true;
            }
            throw new DecodeException(Reason.MALFORMED, buffer.position() - 1L,
                    "invalid " + field + " 0x" + Integer.toHexString(marker));
        }

        private String string(String field) throws DecodeException {
            int length = i32(field + " length");
            if (length < 0) {
                throw error(Reason.MALFORMED, "negative " + field + " length " + length);
            }
            if (length > buffer.remaining()) {
                throw error(Reason.TRUNCATED, field + " needs " + length + " bytes, "
                        + buffer.remaining() + " remain");
            }
            ByteBuffer slice = buffer.slice();
            slice.limit(length);
            try {
                CharBuffer chars = StandardCharsets.UTF_8.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                        .decode(slice);
                buffer.position(buffer.position() + length);
                return chars.toString();
            } catch (CharacterCodingException e) {
                throw error(Reason.MALFORMED, field + " is not valid UTF-8");
            }
        }

        private int u8(String field) throws DecodeException {
            try {
                return buffer.get() & 0xFF;
            } catch (BufferUnderflowException e) {
                throw error(Reason.TRUNCATED, "missing " + field);
            }
        }

        private int i32(String field) throws DecodeException {
            if (buffer.remaining() < Integer.BYTES) {
                throw error(Reason.TRUNCATED, "missing " + field);
            }
            return buffer.getInt();
        }

        private long i64(String field) throws DecodeException {
            if (buffer.remaining() < Long.BYTES) {
                throw error(Reason.TRUNCATED, "missing " + field);
            }
            return buffer.getLong();
        }

        private DecodeException error(Reason reason, String message) {
            return new DecodeException(reason, buffer.position(), message);
        }
    }

    /**
     * Builder for configuring a {@link WireCodec}.
     */
    public static final class Builder {
        private final ClassificationSet classifications;
        private int maxDepth = DEFAULT_MAX_DEPTH;

        private Builder(ClassificationSet classifications) {
            this.classifications = Objects.requireNonNull(classifications, "classifications must not be null");
        }

        /**
         * Limits how deeply cause chains and structured values may nest when decoding.
         *
         * @param maxDepth the limit, at least 1 (defaults to {@value WireCodec#DEFAULT_MAX_DEPTH})
         * @return this builder
         */
        public Builder maxDepth(int maxDepth) {
            if (maxDepth < 1) {
                throw new IllegalArgumentException("maxDepth must be at least 1");
            }
            this.maxDepth = maxDepth;
            return this;
        }

        public WireCodec build() {
            return new WireCodec(classifications, maxDepth);
        }
    }
}
