package org.javai.status.wire;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
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
 * Encodes statuses as JSON documents for HTTP-style boundaries.
 *
 * <p>The document mirrors the binary wire form field for field:
 * <pre>{@code
 * {"version":1,"classification":"config.load_failed","message":null,
 *  "context":[{"key":"profile","type":"text","value":"prod"}],
 *  "cause":{"version":1,"classification":"io.error","message":"disk full","context":[],"cause":null}}
 * }</pre>
 * Context values carry their type name, so integers stay integers and nested values stay nested.
 *
 * <p>Every cause adds a level of JSON nesting. {@code maxDepth} bounds both the cause chain and
 * structured-value nesting, on encode as well as decode: {@link #encode} rejects deeper statuses
 * with {@link IllegalArgumentException}. The default {@link ObjectMapper} has its stream nesting
 * limits sized to match; a caller-supplied mapper must allow {@link #requiredNestingDepth(int)}.
 */
public final class JsonWireCodec {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonWireCodec.class);

    static final String VERSION = "version";
    static final String CLASSIFICATION = "classification";
    static final String MESSAGE = "message";
    static final String CONTEXT = "context";
    static final String CAUSE = "cause";
    static final String KEY = "key";
    static final String TYPE = "type";
    static final String VALUE = "value";

    private final ClassificationSet classifications;
    private final ObjectMapper objectMapper;
    private final int maxDepth;

    public JsonWireCodec(ClassificationSet classifications) {
        this(classifications, WireCodec.DEFAULT_MAX_DEPTH);
    }

    public JsonWireCodec(ClassificationSet classifications, int maxDepth) {
        this(classifications, objectMapperFor(maxDepth), maxDepth);
    }

    public JsonWireCodec(ClassificationSet classifications, ObjectMapper objectMapper, int maxDepth) {
        this.classifications = Objects.requireNonNull(classifications, "classifications must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1");
        }
        this.maxDepth = maxDepth;
    }

    /**
     * Returns the JSON nesting depth a document needs when chains and structured values are
     * nested up to {@code maxDepth} levels each.
     */
    public static int requiredNestingDepth(int maxDepth) {
        return 3 * maxDepth + 8;
    }

    private static ObjectMapper objectMapperFor(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1");
        }
        int nesting = requiredNestingDepth(maxDepth);
        JsonFactory factory = JsonFactory.builder()
                .streamReadConstraints(StreamReadConstraints.builder().maxNestingDepth(nesting).build())
                .streamWriteConstraints(StreamWriteConstraints.builder().maxNestingDepth(nesting).build())
                .build();
        return new ObjectMapper(factory);
    }

    // === Encoding ===

    /**
     * Encodes a status and its cause chain as JSON text.
     *
     * @throws IllegalArgumentException if the chain or a structured value nests deeper than maxDepth
     */
    public String encode(Status status) {
        try {
            return objectMapper.writeValueAsString(toJson(status));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to serialize status tree", e);
        }
    }

    /**
     * Builds the JSON tree for a status and its cause chain.
     */
    public ObjectNode toJson(Status status) {
        Objects.requireNonNull(status, "status must not be null");
        requireWithinDepth(status);
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode node = root;
        Status current = status;
        while (true) {
            node.put(VERSION, WireCodec.VERSION);
            node.put(CLASSIFICATION, current.classification().id());
            if (current.message().isPresent()) {
                node.put(MESSAGE, current.message().get());
            } else {
                node.putNull(MESSAGE);
            }
            node.set(CONTEXT, entriesToJson(current.contextEntries()));
            if (current.cause().isEmpty()) {
                node.putNull(CAUSE);
                return root;
            }
            current = current.cause().get();
            node = node.putObject(CAUSE);
        }
    }

    private void requireWithinDepth(Status status) {
        int levels = 0;
        for (Status level : status.chain()) {
            if (++levels > maxDepth) {
                throw new IllegalArgumentException("cause chain deeper than maxDepth " + maxDepth);
            }
            if (structuredNesting(level.contextEntries()) > maxDepth) {
                throw new IllegalArgumentException("structured value nested deeper than maxDepth " + maxDepth
                        + " in " + level.classification().id());
            }
        }
    }

    private static int structuredNesting(List<ContextEntry> entries) {
        int deepest = 0;
        for (ContextEntry entry : entries) {
            if (entry.value() instanceof ContextValue.Structured structured) {
                deepest = Math.max(deepest, structuredNesting(structured.entries()));
            }
        }
        return deepest + 1;
    }

    private ArrayNode entriesToJson(List<ContextEntry> entries) {
        ArrayNode array = objectMapper.createArrayNode();
        for (ContextEntry entry : entries) {
            ObjectNode item = array.addObject();
            item.put(KEY, entry.key());
            ContextValue value = entry.value();
            ValueType type = ValueType.of(value);
            item.put(TYPE, type.wireName());
            switch (type) {
                case TEXT -> item.put(VALUE, ((ContextValue.Text) value).value());
                case INT -> item.put(VALUE, ((ContextValue.Int) value).value());
                case BOOL -> item.put(VALUE, ((ContextValue.Bool) value).value());
                case STRUCTURED -> item.set(VALUE, entriesToJson(((ContextValue.Structured) value).entries()));
            }
        }
        return array;
    }

    // === Decoding ===

    /**
     * Parses and decodes a JSON document.
     *
     * @throws DecodeException if the text is not JSON or not a well-formed status document
     */
    public Status decode(String json) throws DecodeException {
        Objects.requireNonNull(json, "json must not be null");
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            LOGGER.debug("Rejected JSON status payload: {}", e.getOriginalMessage());
            throw new DecodeException(Reason.MALFORMED, "not a JSON document", e);
        }
        if (node == null || node.isMissingNode()) {
            throw new DecodeException(Reason.TRUNCATED, "empty JSON document");
        }
        return fromJson(node);
    }

    /**
     * Decodes a status from an already parsed JSON tree.
     */
    public Status fromJson(JsonNode node) throws DecodeException {
        Objects.requireNonNull(node, "node must not be null");
        if (!node.isObject()) {
            throw new DecodeException(Reason.MALFORMED, "status must be a JSON object");
        }
        List<JsonNode> levels = new ArrayList<>();
        JsonNode current = node;
        while (current != null && !current.isNull()) {
            if (levels.size() >= maxDepth) {
                throw new DecodeException(Reason.DEPTH_EXCEEDED, "cause chain deeper than " + maxDepth);
            }
            if (!current.isObject()) {
                throw new DecodeException(Reason.MALFORMED, "status must be a JSON object");
            }
            levels.add(current);
            current = required(current, CAUSE);
        }

        Status status = null;
        for (int i = levels.size() - 1; i >= 0; i--) {
            JsonNode level = levels.get(i);
            int version = required(level, VERSION).asInt(-1);
            if (!level.get(VERSION).isInt() || version != WireCodec.VERSION) {
                throw new DecodeException(Reason.UNSUPPORTED_VERSION, "unsupported version " + level.get(VERSION));
            }
            Classification classification = classification(level);
            JsonNode message = required(level, MESSAGE);
            if (!message.isNull() && !message.isTextual()) {
                throw new DecodeException(Reason.MALFORMED, "message must be a string or null");
            }
            List<ContextEntry> entries = entriesFromJson(required(level, CONTEXT), 0);

            Status next = status == null ? Status.of(classification) : Status.wrap(classification, status);
            entries.forEach(next::withContext);
            if (message.isTextual()) {
                next.withMessage(message.textValue());
            }
            status = next;
        }
        return status;
    }

    private Classification classification(JsonNode level) throws DecodeException {
        JsonNode id = required(level, CLASSIFICATION);
        if (!id.isTextual() || id.textValue().isBlank()) {
            throw new DecodeException(Reason.MALFORMED, "classification must be a non-blank string");
        }
        Classification classification = classifications.resolve(id.textValue());
        if (!classification.isRecognized()) {
            LOGGER.debug("Unrecognized classification id '{}', decoding as sentinel", id.textValue());
        }
        return classification;
    }

    private List<ContextEntry> entriesFromJson(JsonNode array, int depth) throws DecodeException {
        if (depth >= maxDepth) {
            throw new DecodeException(Reason.DEPTH_EXCEEDED, "structured value nested deeper than " + maxDepth);
        }
        if (!array.isArray()) {
            throw new DecodeException(Reason.MALFORMED, "context must be an array");
        }
        List<ContextEntry> entries = new ArrayList<>();
        for (JsonNode item : array) {
            if (!item.isObject()) {
                throw new DecodeException(Reason.MALFORMED, "context entry must be an object");
            }
            JsonNode key = required(item, KEY);
            if (!key.isTextual() || key.textValue().isBlank()) {
                throw new DecodeException(Reason.MALFORMED, "context key must be a non-blank string");
            }
            String typeName = required(item, TYPE).asText();
            ValueType type = ValueType.fromWireName(typeName)
                    .orElseThrow(() -> new DecodeException(Reason.UNKNOWN_VALUE_TAG, "unknown value type '" + typeName + "'"));
            entries.add(new ContextEntry(key.textValue(), valueFromJson(type, required(item, VALUE), depth)));
        }
        return entries;
    }

    private ContextValue valueFromJson(ValueType type, JsonNode value, int depth) throws DecodeException {
        switch (type) {
            case TEXT:
                if (value.isTextual()) {
                    return ContextValue.of(value.textValue());
                }
                break;
            case INT:
                if (value.isIntegralNumber() && value.canConvertToLong()) {
                    return ContextValue.of(value.longValue());
                }
                break;
            case BOOL:
                if (value.isBoolean()) {
                    return ContextValue.of(value.booleanValue());
                }
                break;
            case STRUCTURED:
                return new ContextValue.Structured(entriesFromJson(value, depth + 1));
        }
        throw new DecodeException(Reason.MALFORMED, "value " + value + " does not match type " + type.wireName());
    }

    private static JsonNode required(JsonNode node, String field) throws DecodeException {
        JsonNode value = node.get(field);
        if (value == null) {
            throw new DecodeException(Reason.TRUNCATED, "missing field '" + field + "'");
        }
        return value;
    }
}
