package io.folioledger.core.directory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.LongSupplier;
import java.util.logging.Logger;

/**
 * Known nodes of the network. The authority keeps one record per registered miner; a miner keeps
 * the authority's record. Records are never deleted, only moved between states.
 */
public final class NodeDirectory {
    private static final Logger LOG = Logger.getLogger(NodeDirectory.class.getName());

    public static final String NODE_ID_PREFIX = "fl";

    private final Map<String, NodeRecord> records = new LinkedHashMap<>();
    private final LongSupplier clock;

    public NodeDirectory() {
        this(System::currentTimeMillis);
    }

    public NodeDirectory(LongSupplier clock) {
        this.clock = clock;
    }

    public static String newNodeId() {
        return NODE_ID_PREFIX + UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * Inserts or refreshes a record and returns its id. A blank id gets a freshly assigned one.
     *
     * @throws DuplicateNodeException if the id is held by an active record, or a second authority appears
     */
    public synchronized String register(NodeRecord candidate) {
        if (candidate == null) throw new IllegalArgumentException("node record required");
        long now = clock.getAsLong();
        String nodeId = candidate.nodeId().isBlank() ? newNodeId() : candidate.nodeId();
        NodeRecord existing = records.get(nodeId);
        if (existing != null && existing.isActive()) {
            throw new DuplicateNodeException("Node " + nodeId + " is already " + existing.state());
        }
        if (candidate.role() == NodeRole.AUTHORITY) {
            for (NodeRecord other : records.values()) {
                if (other.role() == NodeRole.AUTHORITY && !other.nodeId().equals(nodeId)) {
                    throw new DuplicateNodeException("Authority " + other.nodeId() + " is already registered");
                }
            }
        }
        long registeredAt = existing != null ? existing.registeredAt() : now;
        NodeState state = candidate.state() == NodeState.DISCONNECTED ? NodeState.CONNECTING : candidate.state();
        NodeRecord stored = new NodeRecord(nodeId, candidate.role(), candidate.host(), candidate.port(), registeredAt, now, state);
        records.put(nodeId, stored);
        LOG.fine(() -> (existing == null ? "Registered " : "Re-registered ") + stored);
        return nodeId;
    }

    /** Refreshes last-seen; a DISCONNECTED record goes back to CONNECTING. */
    public synchronized void markSeen(String nodeId) {
        NodeRecord record = records.get(nodeId);
        if (record == null) {
            return;
        }
        NodeRecord updated = record.withLastSeen(clock.getAsLong());
        if (updated.state() == NodeState.DISCONNECTED) {
            updated = updated.withState(NodeState.CONNECTING);
        }
        records.put(nodeId, updated);
    }

    public synchronized void transition(String nodeId, NodeState state) {
        NodeRecord record = records.get(nodeId);
        if (record == null) {
            throw new IllegalArgumentException("Unknown node " + nodeId);
        }
        if (record.state() != state) {
            records.put(nodeId, record.withState(state).withLastSeen(clock.getAsLong()));
        }
    }

    public synchronized void markDisconnected(String nodeId) {
        NodeRecord record = records.get(nodeId);
        if (record != null && record.state() != NodeState.DISCONNECTED) {
            records.put(nodeId, record.withState(NodeState.DISCONNECTED));
        }
    }

    public synchronized Optional<NodeRecord> get(String nodeId) {
        return Optional.ofNullable(records.get(nodeId));
    }

    public synchronized boolean contains(String nodeId) {
        return nodeId != null && records.containsKey(nodeId);
    }

    public synchronized List<NodeRecord> snapshot() {
        return List.copyOf(records.values());
    }

    public synchronized List<NodeRecord> registeredMiners() {
        return select(null);
    }

    public synchronized List<NodeRecord> syncedMiners() {
        return select(NodeState.SYNCED);
    }

    /** Miners with a live connection, whatever their sync progress. */
    public synchronized List<NodeRecord> activeMiners() {
        List<NodeRecord> out = new ArrayList<>();
        for (NodeRecord record : records.values()) {
            if (record.role() == NodeRole.ARCHIVAL_MINER && record.isActive()) {
                out.add(record);
            }
        }
        return out;
    }

    /** Loads persisted records. No connection survives a restart, so every state becomes DISCONNECTED. */
    public synchronized void restore(Collection<NodeRecord> persisted) {
        records.clear();
        for (NodeRecord record : persisted) {
            records.put(record.nodeId(), record.withState(NodeState.DISCONNECTED));
        }
    }

    public synchronized int size() {
        return records.size();
    }

    private List<NodeRecord> select(NodeState state) {
        List<NodeRecord> out = new ArrayList<>();
        for (NodeRecord record : records.values()) {
            if (record.role() == NodeRole.ARCHIVAL_MINER && (state == null || record.state() == state)) {
                out.add(record);
            }
        }
        return out;
    }
}
