package io.blamechain.core.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of a block, shared by the HTTP snapshot and the RocksDB store:
 * {"index":..,"timestamp":..,"payload":[..],"previousHash":"..","nonce":..,"hash":".."}
 */
public final class BlockCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private BlockCodec(){}

    public static ObjectNode toJson(Block block) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("index", block.index());
        node.put("timestamp", block.timestamp());
        ArrayNode payload = node.putArray("payload");
        for (JsonNode entry : block.payload()) {
            payload.add(entry);
        }
        node.put("previousHash", block.previousHash());
        node.put("nonce", block.nonce());
        node.put("hash", block.hash());
        return node;
    }

    public static ArrayNode toJson(List<Block> blocks) {
        ArrayNode array = MAPPER.createArrayNode();
        for (Block block : blocks) {
            array.add(toJson(block));
        }
        return array;
    }

    public static Block fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Block must be a JSON object");
        }
        JsonNode payloadNode = node.path("payload");
        if (!payloadNode.isArray()) {
            throw new IllegalArgumentException("Block payload must be an array");
        }
        List<JsonNode> payload = new ArrayList<>(payloadNode.size());
        for (JsonNode entry : payloadNode) {
            payload.add(entry);
        }
        return new Block(
                requiredLong(node, "index"),
                requiredLong(node, "timestamp"),
                payload,
                requiredText(node, "previousHash"),
                requiredLong(node, "nonce"),
                requiredText(node, "hash")
        );
    }

    public static byte[] toBytes(Block block) {
        try {
            return MAPPER.writeValueAsBytes(toJson(block));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode block " + block.index(), e);
        }
    }

    public static Block fromBytes(byte[] bytes) {
        try {
            return fromJson(MAPPER.readTree(bytes));
        } catch (IOException | RuntimeException ex) {
            throw new IllegalArgumentException("Malformed block bytes", ex);
        }
    }

    private static long requiredLong(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.canConvertToLong() || !value.isIntegralNumber()) {
            throw new IllegalArgumentException("Field '" + field + "' must be an integer");
        }
        return value.asLong();
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new IllegalArgumentException("Field '" + field + "' must be a string");
        }
        return value.asText();
    }
}
