package com.adapterhost.ipc.protocol;

import com.adapterhost.codec.WireCodec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnvelopeCodecTest {

    private final WireCodec codec = new WireCodec();
    private final EnvelopeCodec envelopes = new EnvelopeCodec(codec.mapper());

    @Test
    void encode_writesSingleLineTerminatedByNewline() {
        AdapterCall call = AdapterCall.create("r1", "cache", "set",
                List.of(TextNode.valueOf("k"), TextNode.valueOf("line1\nline2")), CallContext.forPlugin("p"));

        byte[] frame = envelopes.encode(call);
        String text = new String(frame, StandardCharsets.UTF_8);

        assertEquals('\n', text.charAt(text.length() - 1));
        assertEquals(text.length() - 1, text.indexOf('\n'));
    }

    @Test
    void decodeCall_readsWhatEncodeWrote() throws Exception {
        AdapterCall call = AdapterCall.create("r1", "cache", "get", List.of(TextNode.valueOf("k")),
                CallContext.forPlugin("plugin-a").withTraceId("t-1"));

        byte[] frame = envelopes.encode(call);
        AdapterCall decoded = envelopes.decodeCall(Arrays.copyOf(frame, frame.length - 1));

        assertEquals(call, decoded);
        JsonNode tree = codec.mapper().readTree(frame);
        assertEquals("adapter:call", tree.get("type").asText());
        assertEquals(2, tree.get("version").asInt());
    }

    @Test
    void decodeCall_rejectsWrongType() {
        byte[] frame = "{\"type\":\"adapter:response\",\"requestId\":\"r\"}".getBytes(StandardCharsets.UTF_8);

        assertThrows(ProtocolException.class, () -> envelopes.decodeCall(frame));
    }

    @Test
    void decodeCall_rejectsMissingMethod() {
        byte[] frame = "{\"type\":\"adapter:call\",\"requestId\":\"r\",\"adapter\":\"cache\"}".getBytes(StandardCharsets.UTF_8);

        assertThrows(ProtocolException.class, () -> envelopes.decodeCall(frame));
    }

    @Test
    void decodeCall_rejectsNonJson() {
        assertThrows(ProtocolException.class, () -> envelopes.decodeCall("not json".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void decodeResponse_distinguishesResultAndError() {
        AdapterResponse ok = envelopes.decodeResponse(
                "{\"type\":\"adapter:response\",\"requestId\":\"r\",\"result\":null}".getBytes(StandardCharsets.UTF_8));
        AdapterResponse failed = envelopes.decodeResponse(
                "{\"type\":\"adapter:response\",\"requestId\":\"r\",\"error\":{\"__type\":\"Error\",\"name\":\"Error\",\"message\":\"x\"}}"
                        .getBytes(StandardCharsets.UTF_8));

        assertFalse(ok.hasError());
        assertTrue(failed.hasError());
    }
}
