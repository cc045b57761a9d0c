package io.folioledger.core.node;

import io.folioledger.core.directory.NodeDirectory;
import io.folioledger.core.directory.NodeRole;
import io.folioledger.core.mempool.TransactionPool;
import io.folioledger.core.mempool.TxValidator;
import io.folioledger.core.storage.InMemoryLedgerStore;
import io.folioledger.core.storage.LedgerStore;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * State owned by one node process, handed to every component that needs it.
 */
public final class NodeContext {
    private static final Logger LOG = Logger.getLogger(NodeContext.class.getName());

    private final NodeConfig config;
    private final LedgerStore ledger;
    private final TransactionPool pool;
    private final NodeDirectory directory;
    private final AtomicReference<String> selfId;
    private volatile Runnable checkpoint = () -> {};

    public NodeContext(NodeConfig config, LedgerStore ledger, TransactionPool pool, NodeDirectory directory, String selfId) {
        this.config = Objects.requireNonNull(config, "config");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.pool = Objects.requireNonNull(pool, "pool");
        this.directory = Objects.requireNonNull(directory, "directory");
        this.selfId = new AtomicReference<>(selfId);
    }

    /** Genesis-only ledger, empty pool and directory, nothing persisted. */
    public static NodeContext inMemory(NodeConfig config, String selfId) {
        LedgerStore ledger = new InMemoryLedgerStore();
        GenesisBuilder.initIfNeeded(ledger);
        TransactionPool pool = new TransactionPool(new TxValidator(), ledger::containsTransaction);
        return new NodeContext(config, ledger, pool, new NodeDirectory(), selfId);
    }

    public NodeConfig config() { return config; }
    public NodeRole role() { return config.role; }
    public LedgerStore ledger() { return ledger; }
    public TransactionPool pool() { return pool; }
    public NodeDirectory directory() { return directory; }

    /** Empty until a miner has been registered by the authority. */
    public Optional<String> selfId() {
        String id = selfId.get();
        return id == null || id.isBlank() ? Optional.empty() : Optional.of(id);
    }

    public String selfIdOrEmpty() {
        return selfId().orElse("");
    }

    public void assignSelfId(String nodeId) {
        selfId.set(nodeId);
    }

    public void onCheckpoint(Runnable hook) {
        this.checkpoint = hook == null ? () -> {} : hook;
    }

    /** Writes the full snapshot. A failure is logged; the in-memory state stays authoritative. */
    public void checkpoint() {
        try {
            checkpoint.run();
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "Snapshot write failed", e);
        }
    }
}
