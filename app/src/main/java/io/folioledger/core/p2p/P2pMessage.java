package io.folioledger.core.p2p;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record P2pMessage(String type, Map<String, Object> payload) {
    public static final String PING = "ping";
    public static final String PONG = "pong";

    public P2pMessage {
        Objects.requireNonNull(type, "type");
        payload = payload == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static P2pMessage ping() {
        return new P2pMessage(PING, Map.of("ts", System.currentTimeMillis()));
    }

    public static P2pMessage pong() {
        return new P2pMessage(PONG, Map.of("ts", System.currentTimeMillis()));
    }

    @JsonIgnore
    public boolean isHeartbeat() {
        return PING.equals(type) || PONG.equals(type);
    }

    public String text(String key) {
        Object value = payload.get(key);
        return value == null ? "" : value.toString();
    }

    /** Numeric payload field; JSON decoding may produce Integer or Long. */
    public long number(String key, long fallback) {
        Object value = payload.get(key);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String str && !str.isBlank()) {
            try {
                return Long.parseLong(str.trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    public Object value(String key) {
        return payload.get(key);
    }
}
