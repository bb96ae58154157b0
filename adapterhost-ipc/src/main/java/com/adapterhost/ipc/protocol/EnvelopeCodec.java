package com.adapterhost.ipc.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Objects;

/**
 * Envelope ↔ frame bytes. A frame is one UTF-8 JSON document terminated by {@code '\n'}; JSON string
 * escaping guarantees the document itself contains no raw newline.
 */
public final class EnvelopeCodec {

    public static final String CALL_TYPE = "adapter:call";
    public static final String RESPONSE_TYPE = "adapter:response";
    public static final int PROTOCOL_VERSION = 2;
    public static final byte FRAME_DELIMITER = '\n';

    private final ObjectMapper mapper;

    public EnvelopeCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /** Serializes an envelope and appends the frame delimiter. */
    public byte[] encode(Object envelope) {
        byte[] json;
        try {
            json = mapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Cannot encode " + envelope.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
        byte[] frame = new byte[json.length + 1];
        System.arraycopy(json, 0, frame, 0, json.length);
        frame[json.length] = FRAME_DELIMITER;
        return frame;
    }

    /**
     * @throws ProtocolException if the frame is not a call envelope with requestId, adapter and method
     */
    public AdapterCall decodeCall(byte[] frame) {
        JsonNode tree = readEnvelope(frame, CALL_TYPE);
        AdapterCall call = bind(tree, AdapterCall.class);
        if (isBlank(call.requestId()) || isBlank(call.adapter()) || isBlank(call.method())) {
            throw new ProtocolException("Call envelope needs requestId, adapter and method");
        }
        return call;
    }

    /**
     * @throws ProtocolException if the frame is not a response envelope with a requestId
     */
    public AdapterResponse decodeResponse(byte[] frame) {
        JsonNode tree = readEnvelope(frame, RESPONSE_TYPE);
        AdapterResponse response = bind(tree, AdapterResponse.class);
        if (isBlank(response.requestId())) {
            throw new ProtocolException("Response envelope has no requestId");
        }
        return response;
    }

    private JsonNode readEnvelope(byte[] frame, String expectedType) {
        JsonNode tree;
        try {
            tree = mapper.readTree(frame);
        } catch (IOException e) {
            throw new ProtocolException("Malformed frame: " + e.getMessage(), e);
        }
        if (tree == null || !tree.isObject()) {
            throw new ProtocolException("Frame is not a JSON object");
        }
        String type = tree.path("type").asText(null);
        if (!expectedType.equals(type)) {
            throw new ProtocolException("Expected message type " + expectedType + ", got " + type);
        }
        return tree;
    }

    private <T> T bind(JsonNode tree, Class<T> type) {
        try {
            return mapper.treeToValue(tree, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ProtocolException("Invalid " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
