package org.javai.status.wire;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.javai.status.Classification;
import org.javai.status.ClassificationSet;
import org.javai.status.ContextEntry;
import org.javai.status.ContextValue;
import org.javai.status.SampleError;
import org.javai.status.Status;
import org.javai.status.render.Renderer;
import org.javai.status.render.TemplateResolver;
import org.javai.status.wire.DecodeException.Reason;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class WireCodecTest {

    private final WireCodec codec = WireCodec.forClassifications(ClassificationSet.of(SampleError.class));

    private static Status sampleChain() {
        return Status.of(SampleError.IO_ERROR)
                .withContext("path", "/etc/app.yaml")
                .withContext("errno", 28)
                .withContext("retryable", false)
                .withContext("request", ContextValue.structured(
                        ContextEntry.of("method", "GET"),
                        ContextEntry.of("attempt", 2)))
                .withContext("path", "/etc/app.yml")
                .withMessage("disk full")
                .wrap(SampleError.CONFIG_LOAD_FAILED)
                .withContext("profile", "prod");
    }

    @Test
    void roundTrip_preservesWholeChain() throws DecodeException {
        Status original = sampleChain();

        Status decoded = codec.decode(codec.encode(original));

        assertThat(decoded).isEqualTo(original);
        assertThat(decoded.classification()).isSameAs(SampleError.CONFIG_LOAD_FAILED);
        assertThat(decoded.rootCause().message()).contains("disk full");
        assertThat(decoded.rootCause().context().history("path"))
                .containsExactly(ContextValue.of("/etc/app.yaml"), ContextValue.of("/etc/app.yml"));
        assertThat(decoded.chain().depth()).isEqualTo(2);
    }

    @Test
    void roundTrip_decodedStatusIsStillExtensible() throws DecodeException {
        Status decoded = codec.decode(codec.encode(Status.of(SampleError.NOT_FOUND)));

        decoded.withContext("hop", "gateway");

        assertThat(decoded.context().latest("hop")).contains(ContextValue.of("gateway"));
        assertThat(decoded.wrap(SampleError.PERMISSION_DENIED).cause()).containsSame(decoded);
    }

    @Test
    void encode_isIdempotentThroughDecode() throws DecodeException {
        byte[] first = codec.encode(sampleChain());

        byte[] second = codec.encode(codec.decode(first));

        assertThat(second).isEqualTo(first);
    }

    @Test
    void encode_startsWithVersionAndClassificationId() {
        byte[] bytes = codec.encode(Status.of(SampleError.NOT_FOUND));

        assertThat(bytes[0]).isEqualTo((byte) WireCodec.VERSION);
        assertThat(new String(bytes, 5, 8, StandardCharsets.UTF_8)).isEqualTo("NotFound");
        assertThat(bytes).hasSize(1 + 4 + 8 + 1 + 4 + 1);
    }

    @Test
    void decode_unknownClassification_yieldsSentinelAndReencodesIdentically() throws DecodeException {
        byte[] bytes = codec.encode(Status.of(Classification.adhoc("RateLimited")).withContext("retry_after", 30));

        Status decoded = codec.decode(bytes);

        assertThat(decoded.classification().isRecognized()).isFalse();
        assertThat(decoded.classification().id()).isEqualTo("RateLimited");
        assertThat(decoded.context().latest("retry_after")).contains(ContextValue.of(30));
        assertThat(codec.encode(decoded)).isEqualTo(bytes);
    }

    @Test
    void decode_truncatedContext_isRejected() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(bytes);
        out.writeByte(WireCodec.VERSION);
        writeString(out, "NotFound");
        out.writeByte(0);

        assertDecodeFails(bytes.toByteArray(), Reason.TRUNCATED);
    }

    @Test
    void decode_everyProperPrefix_isRejected() {
        byte[] bytes = codec.encode(sampleChain());

        for (int length = 0; length < bytes.length; length++) {
            byte[] prefix = Arrays.copyOf(bytes, length);
            assertThatThrownBy(() -> codec.decode(prefix))
                    .as("prefix of %d bytes", length)
                    .isInstanceOf(DecodeException.class);
        }
    }

    @Test
    void decode_emptyInput_isTruncated() {
        assertDecodeFails(new byte[0], Reason.TRUNCATED);
    }

    @Test
    void decode_unsupportedVersion_isRejected() {
        byte[] bytes = codec.encode(Status.of(SampleError.NOT_FOUND));
        bytes[0] = 2;

        DecodeException e = assertDecodeFails(bytes, Reason.UNSUPPORTED_VERSION);
        assertThat(e.offset()).isZero();
    }

    @Test
    void decode_unknownValueTag_isRejected() throws IOException {
        byte[] bytes = singleEntry(out -> out.writeByte(0x09));

        assertDecodeFails(bytes, Reason.UNKNOWN_VALUE_TAG);
    }

    @Test
    void decode_invalidBooleanByte_isMalformed() throws IOException {
        byte[] bytes = singleEntry(out -> {
            out.writeByte(0x03);
            out.writeByte(2);
        });

        assertDecodeFails(bytes, Reason.MALFORMED);
    }

    @Test
    void decode_negativeLength_isMalformed() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(bytes);
        out.writeByte(WireCodec.VERSION);
        out.writeInt(-1);

        assertDecodeFails(bytes.toByteArray(), Reason.MALFORMED);
    }

    @Test
    void decode_invalidUtf8_isMalformed() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(bytes);
        out.writeByte(WireCodec.VERSION);
        out.writeInt(2);
        out.write(new byte[] {(byte) 0xC3, (byte) 0x28});
        out.writeByte(0);
        out.writeInt(0);
        out.writeByte(0);

        assertDecodeFails(bytes.toByteArray(), Reason.MALFORMED);
    }

    @Test
    void decode_trailingBytes_isRejected() {
        byte[] encoded = codec.encode(Status.of(SampleError.NOT_FOUND));
        byte[] bytes = Arrays.copyOf(encoded, encoded.length + 1);

        assertDecodeFails(bytes, Reason.TRAILING_BYTES);
    }

    @Test
    void decode_chainDeeperThanLimit_isRejected() throws DecodeException {
        WireCodec shallow = WireCodec.builder(ClassificationSet.of(SampleError.class)).maxDepth(2).build();
        Status two = Status.of(SampleError.IO_ERROR).wrap(SampleError.CONFIG_LOAD_FAILED);
        Status three = Status.of(SampleError.IO_ERROR)
                .wrap(SampleError.CONFIG_LOAD_FAILED)
                .wrap(SampleError.PERMISSION_DENIED);

        assertThat(shallow.decode(shallow.encode(two))).isEqualTo(two);
        assertThatThrownBy(() -> shallow.decode(shallow.encode(three)))
                .isInstanceOf(DecodeException.class)
                .extracting(e -> ((DecodeException) e).reason())
                .isEqualTo(Reason.DEPTH_EXCEEDED);
    }

    @Test
    void decode_structuredNestingDeeperThanLimit_isRejected() {
        WireCodec shallow = WireCodec.builder(ClassificationSet.of(SampleError.class)).maxDepth(2).build();
        Status status = Status.of(SampleError.IO_ERROR).withContext("outer", ContextValue.structured(
                ContextEntry.of("inner", ContextValue.structured(ContextEntry.of("leaf", 1)))));

        assertThatThrownBy(() -> shallow.decode(shallow.encode(status)))
                .isInstanceOf(DecodeException.class)
                .extracting(e -> ((DecodeException) e).reason())
                .isEqualTo(Reason.DEPTH_EXCEEDED);
    }

    @Test
    void decode_longChain_doesNotOverflowStack() throws DecodeException {
        WireCodec deep = WireCodec.builder(ClassificationSet.of(SampleError.class)).maxDepth(20_000).build();
        Status status = Status.of(SampleError.IO_ERROR);
        for (int i = 0; i < 10_000; i++) {
            status = status.wrap(SampleError.CONFIG_LOAD_FAILED);
        }

        Status decoded = deep.decode(deep.encode(status));

        assertThat(decoded.chain().depth()).isEqualTo(10_001);
        assertThat(decoded.rootCause().classification()).isEqualTo(SampleError.IO_ERROR);
    }

    @Test
    void builder_rejectsNonPositiveDepth() {
        assertThatThrownBy(() -> WireCodec.builder(ClassificationSet.of(SampleError.class)).maxDepth(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void decodedChain_rendersOutermostFirst() throws DecodeException {
        Status io = Status.of(SampleError.IO_ERROR).withContext("path", "/etc/app.yaml");
        Status config = io.wrap(SampleError.CONFIG_LOAD_FAILED).withContext("profile", "prod");

        Status received = codec.decode(codec.encode(config));
        List<String> lines = Renderer.of(TemplateResolver.empty()).renderChain(received, Locale.ROOT);

        assertThat(lines).containsExactly("ConfigLoadFailed [profile]", "IOError [path]");
    }

    private interface ValueWriter {
        void write(DataOutputStream out) throws IOException;
    }

    private static byte[] singleEntry(ValueWriter value) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(bytes);
        out.writeByte(WireCodec.VERSION);
        writeString(out, "NotFound");
        out.writeByte(0);
        out.writeInt(1);
        writeString(out, "k");
        value.write(out);
        out.writeByte(0);
        return bytes.toByteArray();
    }

    private static void writeString(DataOutputStream out, String s) throws IOException {
        byte[] utf8 = s.getBytes(StandardCharsets.UTF_8);
        out.writeInt(utf8.length);
        out.write(utf8);
    }

    private DecodeException assertDecodeFails(byte[] bytes, Reason reason) {
        Throwable thrown = catchThrowable(() -> codec.decode(bytes));
        assertThat(thrown).as("expected %s", reason).isInstanceOf(DecodeException.class);
        DecodeException e = (DecodeException) thrown;
        assertThat(e.reason()).isEqualTo(reason);
        return e;
    }
}
