package com.adapterhost.codec;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.Iterator;
import java.util.Map;

/**
 * Jackson module that writes binary, date and error values as tagged objects and reads them back,
 * so the wire format holds for values nested inside typed beans as well.
 */
final class WireTypesModule extends SimpleModule {

    WireTypesModule() {
        super("adapterhost-wire-types");
        addSerializer(byte[].class, new TaggedSerializer<>(byte[].class) {
            @Override
            ObjectNode toTagged(byte[] value) {
                return WireTypes.buffer(value);
            }
        });
        addSerializer(Instant.class, new TaggedSerializer<>(Instant.class) {
            @Override
            ObjectNode toTagged(Instant value) {
                return WireTypes.date(value);
            }
        });
        addSerializer(Date.class, new TaggedSerializer<>(Date.class) {
            @Override
            ObjectNode toTagged(Date value) {
                return WireTypes.date(value.toInstant());
            }
        });
        addSerializer(Throwable.class, new TaggedSerializer<>(Throwable.class) {
            @Override
            ObjectNode toTagged(Throwable value) {
                return WireTypes.error(value);
            }
        });
        addDeserializer(byte[].class, new BufferDeserializer());
        addDeserializer(Instant.class, new InstantDeserializer());
        addDeserializer(Object.class, new UntypedDeserializer());
    }

    private abstract static class TaggedSerializer<T> extends StdSerializer<T> {

        TaggedSerializer(Class<T> type) {
            super(type);
        }

        abstract ObjectNode toTagged(T value);

        @Override
        public void serialize(T value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            Iterator<Map.Entry<String, JsonNode>> fields = toTagged(value).fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode v = field.getValue();
                if (v.isNumber()) {
                    gen.writeNumberField(field.getKey(), v.longValue());
                } else {
                    gen.writeStringField(field.getKey(), v.asText());
                }
            }
            gen.writeEndObject();
        }
    }

    private static final class BufferDeserializer extends StdDeserializer<byte[]> {

        BufferDeserializer() {
            super(byte[].class);
        }

        @Override
        public byte[] deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = ctxt.readTree(p);
            if (WireTypes.isTagged(node, WireTypes.BUFFER)) {
                return WireTypes.readBuffer(node);
            }
            if (node.isTextual()) {
                try {
                    return Base64.getDecoder().decode(node.textValue());
                } catch (IllegalArgumentException e) {
                    throw new DeserializationException("Invalid base64 text for byte[]", e);
                }
            }
            if (node.isBinary()) {
                return node.binaryValue();
            }
            if (node.isArray()) {
                byte[] out = new byte[node.size()];
                for (int i = 0; i < out.length; i++) {
                    out[i] = (byte) node.get(i).intValue();
                }
                return out;
            }
            throw new DeserializationException("Cannot read byte[] from " + node.getNodeType());
        }
    }

    private static final class InstantDeserializer extends StdDeserializer<Instant> {

        InstantDeserializer() {
            super(Instant.class);
        }

        @Override
        public Instant deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = ctxt.readTree(p);
            if (WireTypes.isTagged(node, WireTypes.DATE)) {
                return WireTypes.readDate(node);
            }
            if (node.isIntegralNumber()) {
                return Instant.ofEpochMilli(node.longValue());
            }
            if (node.isTextual()) {
                try {
                    return Instant.parse(node.textValue());
                } catch (RuntimeException e) {
                    throw new DeserializationException("Invalid instant: " + node.textValue(), e);
                }
            }
            throw new DeserializationException("Cannot read Instant from " + node.getNodeType());
        }
    }

    /** Object-typed slots (map values, list elements, bean fields) decode tagged objects too. */
    private static final class UntypedDeserializer extends StdDeserializer<Object> {

        UntypedDeserializer() {
            super(Object.class);
        }

        @Override
        public Object deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            return WireValues.toJava(ctxt.readTree(p));
        }
    }
}
