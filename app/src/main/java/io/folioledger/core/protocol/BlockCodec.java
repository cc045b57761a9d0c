package io.folioledger.core.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

public final class BlockCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private BlockCodec(){}

    public static ObjectNode toJson(Block block) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("sequence", block.sequence());
        node.put("timestamp", block.timestamp());
        node.put("previousHash", block.previousHash());
        node.put("producerId", block.producerId());
        node.put("contentHash", block.contentHash());
        node.put("status", block.status().name());
        ArrayNode txs = node.putArray("transactions");
        for (Transaction tx : block.transactions()) {
            txs.add(TransactionCodec.toJson(tx));
        }
        return node;
    }

    public static ArrayNode toJson(List<Block> blocks) {
        ArrayNode array = MAPPER.createArrayNode();
        for (Block block : blocks) {
            array.add(toJson(block));
        }
        return array;
    }

    /** Bytes the block takes as UTF-8 JSON. */
    public static int encodedSize(Block block) {
        try {
            return MAPPER.writeValueAsBytes(toJson(block)).length;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode block " + block.sequence(), e);
        }
    }

    public static Block fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Malformed Block JSON: object expected");
        }
        try {
            JsonNode txsNode = node.path("transactions");
            if (!txsNode.isArray()) {
                throw new IllegalArgumentException("transactions must be an array");
            }
            int count = txsNode.size();
            if (count > ProtocolLimits.MAX_TXS_PER_BLOCK) {
                throw new IllegalArgumentException("bad tx count: " + count);
            }
            List<Transaction> txs = new ArrayList<>(count);
            for (JsonNode txNode : txsNode) {
                txs.add(TransactionCodec.fromJson(txNode));
            }
            return Block.of(
                    TransactionCodec.requireLong(node, "sequence"),
                    TransactionCodec.requireLong(node, "timestamp"),
                    node.path("previousHash").asText(""),
                    txs,
                    TransactionCodec.text(node, "producerId"),
                    TransactionCodec.text(node, "contentHash"),
                    BlockStatus.valueOf(TransactionCodec.text(node, "status"))
            );
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed Block JSON", ex);
        }
    }

    public static List<Block> listFromJson(JsonNode array) {
        if (array == null || !array.isArray()) {
            throw new IllegalArgumentException("Malformed block list: array expected");
        }
        List<Block> out = new ArrayList<>(array.size());
        for (JsonNode node : array) {
            out.add(fromJson(node));
        }
        return out;
    }

    public static Block fromValue(Object value) {
        return fromJson(MAPPER.valueToTree(value));
    }

    public static List<Block> listFromValue(Object value) {
        return listFromJson(MAPPER.valueToTree(value));
    }
}
