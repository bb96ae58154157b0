package com.adapterhost.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.POJONode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Converts wire trees into plain Java values: maps, lists, strings, numbers, booleans and tagged types. */
final class WireValues {

    private WireValues() {
    }

    static Object toJava(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        switch (node.getNodeType()) {
            case OBJECT:
                return objectToJava(node);
            case ARRAY:
                List<Object> list = new ArrayList<>(node.size());
                for (JsonNode element : node) {
                    list.add(toJava(element));
                }
                return list;
            case STRING:
                return node.textValue();
            case BOOLEAN:
                return node.booleanValue();
            case NUMBER:
                return node.numberValue();
            case BINARY:
                try {
                    return node.binaryValue();
                } catch (IOException e) {
                    throw new DeserializationException("Invalid binary node", e);
                }
            case POJO:
                return ((POJONode) node).getPojo();
            default:
                return null;
        }
    }

    private static Object objectToJava(JsonNode node) {
        String tag = WireTypes.tagOf(node);
        if (WireTypes.BUFFER.equals(tag)) return WireTypes.readBuffer(node);
        if (WireTypes.DATE.equals(tag)) return WireTypes.readDate(node);
        if (WireTypes.ERROR.equals(tag)) return WireTypes.readError(node);
        Map<String, Object> map = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            map.put(field.getKey(), toJava(field.getValue()));
        }
        return map;
    }
}
