package io.folioledger.core.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON form of a transaction, shared by the peer wire format, the chain file and the node database.
 */
public final class TransactionCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TransactionCodec(){}

    public static ObjectNode toJson(Transaction tx) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("id", tx.id());
        node.put("kind", tx.kind().name());
        node.put("payload", tx.payload());
        node.put("submitterId", tx.submitterId());
        node.put("createdAt", tx.createdAt());
        node.put("status", tx.status().name());
        return node;
    }

    public static Transaction fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Malformed Transaction JSON: object expected");
        }
        try {
            return Transaction.builder()
                    .id(text(node, "id"))
                    .kind(TransactionKind.parse(text(node, "kind")))
                    .payload(node.path("payload").asText(""))
                    .submitterId(node.path("submitterId").asText(""))
                    .createdAt(requireLong(node, "createdAt"))
                    .status(TransactionStatus.valueOf(node.path("status").asText(TransactionStatus.PENDING.name())))
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed Transaction JSON", ex);
        }
    }

    /** Accepts the loosely typed maps Jackson produces for message payloads. */
    public static Transaction fromValue(Object value) {
        return fromJson(MAPPER.valueToTree(value));
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new IllegalArgumentException("Missing text field: " + field);
        }
        return value.asText();
    }

    static long requireLong(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.canConvertToLong()) {
            throw new IllegalArgumentException("Missing numeric field: " + field);
        }
        return value.asLong();
    }
}
