package com.adapterhost.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Base64;

/**
 * Tagged wire objects. A tagged object has a string {@value #TYPE_FIELD} member naming its kind:
 * <pre>
 * {"__type":"Buffer","data":"&lt;base64&gt;"}
 * {"__type":"Date","iso":"2024-01-01T00:00:00Z"}
 * {"__type":"Error","name":"...","message":"...","stack":"...","code":"..."}
 * {"__type":"BulkTransfer","path":"...","size":123}
 * </pre>
 * Objects with an unknown tag are ordinary maps.
 */
public final class WireTypes {

    public static final String TYPE_FIELD = "__type";
    public static final String BUFFER = "Buffer";
    public static final String DATE = "Date";
    public static final String ERROR = "Error";
    public static final String BULK_TRANSFER = "BulkTransfer";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private WireTypes() {
    }

    /** Returns the tag of a tagged object, or null when the node is not a tagged object. */
    public static String tagOf(JsonNode node) {
        if (node == null || !node.isObject()) return null;
        JsonNode tag = node.get(TYPE_FIELD);
        return tag != null && tag.isTextual() ? tag.textValue() : null;
    }

    public static boolean isTagged(JsonNode node, String tag) {
        return tag.equals(tagOf(node));
    }

    public static ObjectNode buffer(byte[] data) {
        ObjectNode node = NODES.objectNode();
        node.put(TYPE_FIELD, BUFFER);
        node.put("data", Base64.getEncoder().encodeToString(data));
        return node;
    }

    public static ObjectNode date(Instant instant) {
        ObjectNode node = NODES.objectNode();
        node.put(TYPE_FIELD, DATE);
        node.put("iso", instant.toString());
        return node;
    }

    public static ObjectNode error(Throwable error) {
        String name;
        if (error instanceof RemoteAdapterException) {
            name = ((RemoteAdapterException) error).getName();
        } else {
            name = error.getClass().getSimpleName();
        }
        String stack = error instanceof RemoteAdapterException
                ? ((RemoteAdapterException) error).getRemoteStack()
                : stackTraceOf(error);
        String code = error instanceof CodedError ? ((CodedError) error).getCode() : null;
        return error(name, error.getMessage(), stack, code);
    }

    public static ObjectNode error(String name, String message, String stack, String code) {
        ObjectNode node = NODES.objectNode();
        node.put(TYPE_FIELD, ERROR);
        node.put("name", name != null ? name : "Error");
        node.put("message", message != null ? message : "");
        if (stack != null) node.put("stack", stack);
        if (code != null) node.put("code", code);
        return node;
    }

    static byte[] readBuffer(JsonNode node) {
        JsonNode data = node.get("data");
        if (data == null || !data.isTextual()) {
            throw new DeserializationException("Invalid Buffer payload: missing base64 'data'");
        }
        try {
            return Base64.getDecoder().decode(data.textValue());
        } catch (IllegalArgumentException e) {
            throw new DeserializationException("Invalid Buffer payload: " + e.getMessage(), e);
        }
    }

    static Instant readDate(JsonNode node) {
        JsonNode iso = node.get("iso");
        if (iso == null || !iso.isTextual()) {
            throw new DeserializationException("Invalid Date payload: missing 'iso'");
        }
        try {
            return Instant.parse(iso.textValue());
        } catch (DateTimeParseException e) {
            throw new DeserializationException("Invalid Date payload: " + iso.textValue(), e);
        }
    }

    static RemoteAdapterException readError(JsonNode node) {
        JsonNode message = node.get("message");
        if (message == null || !message.isTextual()) {
            throw new DeserializationException("Invalid Error payload: missing 'message'");
        }
        return new RemoteAdapterException(
                textOrNull(node.get("name")),
                message.textValue(),
                textOrNull(node.get("code")),
                textOrNull(node.get("stack")));
    }

    private static String textOrNull(JsonNode node) {
        return node != null && node.isTextual() ? node.textValue() : null;
    }

    private static String stackTraceOf(Throwable error) {
        StringWriter out = new StringWriter();
        error.printStackTrace(new PrintWriter(out));
        return out.toString();
    }
}
