package io.blamechain.core.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.TreeSet;

/**
 * Key-order independent JSON encoding for payload entries.
 * Object fields are sorted recursively; arrays keep their order.
 */
public final class CanonicalJson {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CanonicalJson() {}

    public static byte[] toBytes(JsonNode node) {
        try {
            return MAPPER.writeValueAsBytes(canonicalize(node));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Entry is not serializable", e);
        }
    }

    static JsonNode canonicalize(JsonNode node) {
        if (node == null) {
            return JsonNodeFactory.instance.nullNode();
        }
        if (node.isObject()) {
            TreeSet<String> names = new TreeSet<>();
            Iterator<String> it = node.fieldNames();
            while (it.hasNext()) names.add(it.next());
            ObjectNode out = JsonNodeFactory.instance.objectNode();
            for (String name : names) {
                out.set(name, canonicalize(node.get(name)));
            }
            return out;
        }
        if (node.isArray()) {
            ArrayNode out = JsonNodeFactory.instance.arrayNode(node.size());
            for (JsonNode child : node) out.add(canonicalize(child));
            return out;
        }
        return node;
    }
}
