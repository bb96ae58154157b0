package com.adapterhost.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Converts values to and from their wire form. Supported: null, strings, booleans, finite numbers,
 * lists, arrays, maps with string keys, {@code byte[]} (Buffer tag), {@link Instant} and {@link Date}
 * (Date tag), {@link Throwable} (Error tag), and beans Jackson can serialize.
 * <p>
 * Circular references among maps, collections and arrays are rejected with
 * {@link SerializationException} instead of overflowing the stack.
 * <p>
 * Thread-safe; a single instance is normally shared through {@link #shared()}.
 */
public final class WireCodec {

    private static final WireCodec SHARED = new WireCodec();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ObjectMapper mapper;

    public WireCodec() {
        this(new ObjectMapper());
    }

    /** Uses a copy of {@code base} with the wire type module installed; {@code base} itself is not modified. */
    public WireCodec(ObjectMapper base) {
        this.mapper = base.copy()
                .registerModule(new WireTypesModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public static WireCodec shared() {
        return SHARED;
    }

    /** Mapper with the wire type module installed; used for envelopes and bulk payloads. */
    public ObjectMapper mapper() {
        return mapper;
    }

    public JsonNode serialize(Object value) {
        return toNode(value, Collections.newSetFromMap(new IdentityHashMap<>()), "$");
    }

    /** Serializes each value in order; null entries become JSON null. */
    public ArrayNode serializeAll(List<?> values) {
        ArrayNode out = NODES.arrayNode();
        if (values == null) return out;
        for (int i = 0; i < values.size(); i++) {
            out.add(toNode(values.get(i), Collections.newSetFromMap(new IdentityHashMap<>()), "$[" + i + "]"));
        }
        return out;
    }

    public ObjectNode serializeError(Throwable error) {
        return WireTypes.error(error);
    }

    /**
     * Generic decode: objects become {@code LinkedHashMap}, arrays {@code ArrayList}, and tagged objects
     * become {@code byte[]}, {@link Instant} or {@link RemoteAdapterException}.
     */
    public Object deserialize(JsonNode node) {
        return WireValues.toJava(node);
    }

    public <T> T deserialize(JsonNode node, Class<T> type) {
        return deserialize(node, mapper.constructType(type));
    }

    public <T> T deserialize(JsonNode node, TypeReference<T> type) {
        return deserialize(node, mapper.getTypeFactory().constructType(type));
    }

    /**
     * Typed decode. JSON null (or a missing node) yields null, so primitive targets should be
     * requested through their wrapper class.
     */
    @SuppressWarnings("unchecked")
    public <T> T deserialize(JsonNode node, JavaType type) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        Class<?> raw = type.getRawClass();
        if (raw == Object.class) {
            return (T) WireValues.toJava(node);
        }
        if (Throwable.class.isAssignableFrom(raw)) {
            if (!WireTypes.isTagged(node, WireTypes.ERROR)) {
                throw new DeserializationException("Expected a tagged Error, got " + node.getNodeType());
            }
            RemoteAdapterException error = WireTypes.readError(node);
            if (!raw.isInstance(error)) {
                throw new DeserializationException("Remote errors decode as RemoteAdapterException, not " + raw.getName());
            }
            return (T) error;
        }
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            if (e.getCause() instanceof DeserializationException) {
                throw (DeserializationException) e.getCause();
            }
            throw new DeserializationException("Cannot decode " + type.toCanonical() + ": " + e.getMessage(), e);
        }
    }

    /** Decodes a tagged Error object into a {@link RemoteAdapterException}. */
    public RemoteAdapterException deserializeError(JsonNode node) {
        if (!WireTypes.isTagged(node, WireTypes.ERROR)) {
            if (node != null && node.isTextual()) {
                return new RemoteAdapterException("Error", node.textValue(), null, null);
            }
            throw new DeserializationException("Expected a tagged Error object");
        }
        return WireTypes.readError(node);
    }

    public JavaType constructType(TypeReference<?> type) {
        return mapper.getTypeFactory().constructType(type);
    }

    public JavaType constructType(Class<?> type) {
        return mapper.constructType(type);
    }

    private JsonNode toNode(Object value, Set<Object> path, String location) {
        if (value == null) return NullNode.getInstance();
        if (value instanceof JsonNode) return (JsonNode) value;
        if (value instanceof String) return NODES.textNode((String) value);
        if (value instanceof Boolean) return NODES.booleanNode((Boolean) value);
        if (value instanceof Number) return number((Number) value, location);
        if (value instanceof Character) return NODES.textNode(value.toString());
        if (value instanceof byte[]) return WireTypes.buffer((byte[]) value);
        if (value instanceof Instant) return WireTypes.date((Instant) value);
        if (value instanceof Date) return WireTypes.date(((Date) value).toInstant());
        if (value instanceof Throwable) return WireTypes.error((Throwable) value);
        if (value instanceof Optional) {
            return toNode(((Optional<?>) value).orElse(null), path, location);
        }
        if (value instanceof Map || value instanceof Collection || value instanceof Object[]) {
            if (!path.add(value)) {
                throw new SerializationException("Circular reference", location);
            }
            try {
                return container(value, path, location);
            } finally {
                path.remove(value);
            }
        }
        try {
            return mapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            throw new SerializationException("Cannot serialize " + value.getClass().getName() + ": " + e.getMessage(), location, e);
        }
    }

    private JsonNode container(Object value, Set<Object> path, String location) {
        if (value instanceof Map) {
            ObjectNode object = NODES.objectNode();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                String key = String.valueOf(entry.getKey());
                object.set(key, toNode(entry.getValue(), path, location + "." + key));
            }
            return object;
        }
        ArrayNode array = NODES.arrayNode();
        Iterable<?> items = value instanceof Collection ? (Collection<?>) value : Arrays.asList((Object[]) value);
        int i = 0;
        for (Object item : items) {
            array.add(toNode(item, path, location + "[" + i++ + "]"));
        }
        return array;
    }

    private static JsonNode number(Number n, String location) {
        if (n instanceof Integer || n instanceof Short || n instanceof Byte) return NODES.numberNode(n.intValue());
        if (n instanceof Long) return NODES.numberNode(n.longValue());
        if (n instanceof BigInteger) return NODES.numberNode((BigInteger) n);
        if (n instanceof BigDecimal) return NODES.numberNode((BigDecimal) n);
        if (n instanceof Float || n instanceof Double) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new SerializationException("Non-finite number " + d + " has no JSON form", location);
            }
            return n instanceof Float ? NODES.numberNode(n.floatValue()) : NODES.numberNode(d);
        }
        return NODES.numberNode(n.longValue());
    }
}
