package io.folioledger.core.storage;

import io.folioledger.core.directory.NodeRecord;
import io.folioledger.core.protocol.Block;
import io.folioledger.core.protocol.Transaction;

import java.util.List;
import java.util.Optional;

/**
 * Full persisted state of one node: ledger, directory, pending pool and the node's own id.
 */
public record Snapshot(List<Block> chain, List<NodeRecord> nodes, List<Transaction> pool, String selfId) {
    public Snapshot {
        chain = chain == null ? List.of() : List.copyOf(chain);
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        pool = pool == null ? List.of() : List.copyOf(pool);
    }

    public static Snapshot empty() {
        return new Snapshot(List.of(), List.of(), List.of(), null);
    }

    public Optional<String> selfIdIfPresent() {
        return (selfId == null || selfId.isBlank()) ? Optional.empty() : Optional.of(selfId);
    }
}
