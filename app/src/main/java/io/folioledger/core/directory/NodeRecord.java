package io.folioledger.core.directory;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

public record NodeRecord(
        String nodeId,
        NodeRole role,
        String host,
        int port,
        long registeredAt,
        long lastSeen,
        NodeState state
) {
    public NodeRecord {
        Objects.requireNonNull(role, "role");
        nodeId = nodeId == null ? "" : nodeId;
        host = host == null ? "" : host;
        state = state == null ? NodeState.DISCONNECTED : state;
    }

    /** A record that still needs an id from the authority. */
    public static NodeRecord candidate(String nodeId, NodeRole role, String host, int port) {
        return new NodeRecord(nodeId, role, host, port, 0L, 0L, NodeState.CONNECTING);
    }

    public NodeRecord withState(NodeState next) {
        return new NodeRecord(nodeId, role, host, port, registeredAt, lastSeen, next);
    }

    public NodeRecord withLastSeen(long timestamp) {
        return new NodeRecord(nodeId, role, host, port, registeredAt, timestamp, state);
    }

    @JsonIgnore
    public boolean isActive() {
        return state != NodeState.DISCONNECTED;
    }

    @JsonIgnore
    public String address() {
        return host + ':' + port;
    }
}
