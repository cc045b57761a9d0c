package io.folioledger.core.node;

import io.folioledger.core.api.ApiServer;
import io.folioledger.core.directory.DuplicateNodeException;
import io.folioledger.core.directory.NodeDirectory;
import io.folioledger.core.directory.NodeRecord;
import io.folioledger.core.directory.NodeRole;
import io.folioledger.core.directory.NodeState;
import io.folioledger.core.mempool.TransactionPool;
import io.folioledger.core.mempool.TxValidator;
import io.folioledger.core.p2p.P2pServer;
import io.folioledger.core.protocol.Block;
import io.folioledger.core.protocol.Transaction;
import io.folioledger.core.storage.ChainIntegrityException;
import io.folioledger.core.storage.DurableLedgerStore;
import io.folioledger.core.storage.InMemoryLedgerStore;
import io.folioledger.core.storage.LedgerStore;
import io.folioledger.core.storage.Snapshot;
import io.folioledger.core.storage.SnapshotStore;
import io.folioledger.core.storage.StartupIntegrityException;
import io.folioledger.core.sync.AuthoritySyncEngine;
import io.folioledger.core.sync.ConnectionState;
import io.folioledger.core.sync.MinerSyncEngine;
import io.folioledger.core.sync.PeerConnection;
import io.folioledger.core.sync.SyncEngine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * One node process: loads the snapshot, wires the role's sync engine (and, on the authority, the
 * block producer) and owns the transport and optional HTTP API.
 */
public final class NodeRuntime implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(NodeRuntime.class.getName());

    private final NodeConfig config;
    private final SnapshotStore store;
    private final NodeContext ctx;
    private final SyncEngine engine;
    private final BlockProducer producer;

    private volatile P2pServer transport;
    private volatile ApiServer api;
    private volatile boolean started;
    private volatile boolean closed;

    private NodeRuntime(NodeConfig config, SnapshotStore store, NodeContext ctx) {
        this.config = config;
        this.store = store;
        this.ctx = ctx;
        ctx.onCheckpoint(this::checkpoint);
        if (config.role == NodeRole.AUTHORITY) {
            AuthoritySyncEngine authority = new AuthoritySyncEngine(ctx);
            this.producer = new BlockProducer(ctx, authority, authority::productionAllowed);
            authority.attachProducer(producer);
            this.engine = authority;
        } else {
            this.engine = new MinerSyncEngine(ctx);
            this.producer = null;
        }
    }

    /**
     * Loads the node's data directory and builds the runtime without starting anything.
     *
     * @throws ConfigurationException     for settings the role cannot run with
     * @throws StartupIntegrityException  for a corrupt or inconsistent snapshot
     */
    public static NodeRuntime open(NodeConfig config) {
        config.validate();
        if (config.resetChain) {
            resetChain(config.dataDir);
        }
        SnapshotStore store = SnapshotStore.open(config.dataDir);
        try {
            Snapshot snapshot = store.load();
            LedgerStore ledger = loadLedger(snapshot, store);

            TransactionPool pool = new TransactionPool(new TxValidator(), ledger::containsTransaction);
            pool.restore(snapshot.pool());
            NodeDirectory directory = new NodeDirectory();
            directory.restore(snapshot.nodes());

            String selfId = resolveSelfId(config, snapshot);
            NodeContext ctx = new NodeContext(config, ledger, pool, directory, selfId);
            if (config.role == NodeRole.AUTHORITY) {
                try {
                    directory.register(new NodeRecord(selfId, NodeRole.AUTHORITY, config.listenHost, config.listenPort,
                            0L, 0L, NodeState.SYNCED));
                } catch (DuplicateNodeException e) {
                    throw new ConfigurationException("Data directory belongs to another authority: " + e.getMessage());
                }
            }
            LOG.info(() -> "Opened " + config.role + " node " + (selfId == null ? "(unregistered)" : selfId)
                    + " at tip " + ledger.tip().sequence() + " with " + pool.size() + " pending transaction(s)");
            return new NodeRuntime(config, store, ctx);
        } catch (RuntimeException e) {
            store.close();
            throw e;
        }
    }

    private static LedgerStore loadLedger(Snapshot snapshot, SnapshotStore store) {
        InMemoryLedgerStore memory = new InMemoryLedgerStore();
        memory.restore(snapshot.chain());
        try {
            memory.verifyChain();
        } catch (ChainIntegrityException e) {
            throw new StartupIntegrityException("Chain file fails verification at block " + e.sequence(), e);
        }
        if (memory.size() > 0 && !memory.get(0).contentHash().equals(GenesisBuilder.buildGenesis().contentHash())) {
            throw new StartupIntegrityException("Chain file does not start with the genesis block");
        }
        LedgerStore ledger = new DurableLedgerStore(memory, store);
        GenesisBuilder.initIfNeeded(ledger);
        return ledger;
    }

    /** Configured id, then the stored one; a fresh id for the authority, none for a miner yet to register. */
    private static String resolveSelfId(NodeConfig config, Snapshot snapshot) {
        if (config.nodeId != null) {
            return config.nodeId;
        }
        Optional<String> stored = snapshot.selfIdIfPresent();
        if (stored.isPresent()) {
            return stored.get();
        }
        return config.role == NodeRole.AUTHORITY ? NodeDirectory.newNodeId() : null;
    }

    private static void resetChain(Path dataDir) {
        Path chainFile = dataDir.resolve(SnapshotStore.CHAIN_FILE);
        Path nodeDb = dataDir.resolve(SnapshotStore.NODE_DB);
        try {
            Files.deleteIfExists(chainFile);
            if (Files.exists(nodeDb)) {
                try (Stream<Path> stream = Files.walk(nodeDb)) {
                    stream.sorted(Comparator.reverseOrder()).forEach(path -> {
                        try {
                            Files.deleteIfExists(path);
                        } catch (IOException e) {
                            throw new IllegalStateException("Failed to delete " + path, e);
                        }
                    });
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to reset chain data in " + dataDir, e);
        }
        LOG.info(() -> "Cleared chain file and node database under " + dataDir);
    }

    /** Starts the transport, the sync engine, the producer (authority only) and the HTTP API if enabled. */
    public synchronized void start() {
        if (started) {
            throw new IllegalStateException("Node already started");
        }
        if (closed) {
            throw new IllegalStateException("Node is closed");
        }
        started = true;
        long pingInterval = Math.max(100L, config.peerTimeoutMillis / 3);
        String name = config.role.name().toLowerCase(Locale.ROOT) + "-" + ctx.selfId().orElse("new");
        transport = new P2pServer(name, config.listenHost, config.listenPort, engine, pingInterval, config.peerTimeoutMillis, true);
        if (config.role == NodeRole.AUTHORITY) {
            transport.start();
            engine.start(transport);
            producer.restorePending();
            producer.start();
        } else {
            engine.start(transport);
        }
        if (config.apiEnabled) {
            api = new ApiServer(this, config.apiBind, config.apiPort, config.apiToken);
            try {
                api.start();
            } catch (IOException e) {
                throw new IllegalStateException("Failed to start HTTP API on " + config.apiBind + ':' + config.apiPort, e);
            }
        }
        LOG.info(() -> config.role + " node started");
    }

    /** Writes the full snapshot: chain file, anchor, directory, pool and self id. */
    public void checkpoint() {
        synchronized (store) {
            store.save(new Snapshot(ctx.ledger().blocks(), ctx.directory().snapshot(), ctx.pool().pending(), ctx.selfIdOrEmpty()));
        }
    }

    /** Pools a transaction; a miner forwards it to the authority once synced. */
    public Transaction submit(Transaction tx) {
        return ctx.pool().submit(tx);
    }

    /** Node properties and directory statistics, as shown on {@code /node/info}. */
    public Map<String, Object> info() {
        LedgerStore ledger = ctx.ledger();
        NodeDirectory directory = ctx.directory();
        Block tip = ledger.tip();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("nodeId", ctx.selfIdOrEmpty());
        out.put("role", config.role.name());
        out.put("state", state());
        out.put("listenHost", config.listenHost);
        out.put("listenPort", p2pPort());
        out.put("tip", tip.sequence());
        out.put("tipHash", tip.contentHash());
        out.put("tipStatus", tip.status().name());
        out.put("confirmedTip", ledger.confirmedTip().sequence());
        out.put("poolSize", ctx.pool().size());
        out.put("envFilePresent", Files.exists(store.envFile()));
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("nodes", directory.size());
        stats.put("registeredMiners", directory.registeredMiners().size());
        stats.put("activeMiners", directory.activeMiners().size());
        stats.put("syncedMiners", directory.syncedMiners().size());
        stats.put("connections", engine.connections().size());
        out.put("directory", stats);
        return out;
    }

    private String state() {
        if (config.role == NodeRole.AUTHORITY) {
            return started && !closed ? NodeState.SYNCED.name() : NodeState.DISCONNECTED.name();
        }
        for (PeerConnection conn : engine.connections()) {
            if (conn.state() != ConnectionState.DISCONNECTED) {
                return conn.state().name();
            }
        }
        return ConnectionState.DISCONNECTED.name();
    }

    public int p2pPort() {
        P2pServer current = transport;
        if (current != null && current.boundPort() > 0) {
            return current.boundPort();
        }
        return config.listenPort;
    }

    public int apiPort() {
        ApiServer current = api;
        return current == null ? -1 : current.boundPort();
    }

    public NodeConfig config() { return config; }
    public NodeContext context() { return ctx; }
    public SyncEngine engine() { return engine; }
    public Optional<BlockProducer> producer() { return Optional.ofNullable(producer); }

    /** Stops every component, then always writes the final snapshot and closes the store. */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (api != null) {
                api.stop();
            }
            if (producer != null) {
                producer.stop();
            }
            engine.stop();
            if (transport != null) {
                transport.stop();
            }
        } finally {
            try {
                checkpoint();
            } finally {
                store.close();
                LOG.info(() -> config.role + " node closed");
            }
        }
    }
}
