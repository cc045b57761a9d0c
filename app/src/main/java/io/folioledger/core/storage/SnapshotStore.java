package io.folioledger.core.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.folioledger.core.protocol.Block;
import io.folioledger.core.protocol.BlockCodec;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Files of one node's data directory:
 * <ul>
 *   <li>{@value #CHAIN_FILE}: {@code {"chain": [...]}}, every block in sequence order</li>
 *   <li>{@value #NODE_DB}: {@link NodeDatabase} with directory, pool, self id and chain anchor</li>
 *   <li>{@value #ENV_FILE}: operator credentials, never parsed here</li>
 * </ul>
 */
public final class SnapshotStore implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(SnapshotStore.class.getName());

    public static final String CHAIN_FILE = "folioledger-chain.json";
    public static final String NODE_DB = "folioledger-node.db";
    public static final String ENV_FILE = "node-env.vars";

    private final Path dataDir;
    private final Path chainFile;
    private final NodeDatabase nodeDb;
    private final ObjectMapper mapper = new ObjectMapper();

    private SnapshotStore(Path dataDir, NodeDatabase nodeDb) {
        this.dataDir = dataDir;
        this.chainFile = dataDir.resolve(CHAIN_FILE);
        this.nodeDb = nodeDb;
    }

    public static SnapshotStore open(Path dataDir) {
        try {
            Files.createDirectories(dataDir);
        } catch (IOException e) {
            throw new StartupIntegrityException("Cannot create data directory " + dataDir, e);
        }
        return new SnapshotStore(dataDir, NodeDatabase.open(dataDir.resolve(NODE_DB)));
    }

    /**
     * Reads the full snapshot. A missing chain file yields an empty chain; an unreadable one, or a
     * chain that does not hold the recorded anchor, is fatal.
     */
    public Snapshot load() {
        List<Block> chain = readChain().orElse(List.of());
        Optional<ChainAnchor> anchor = nodeDb.loadAnchor();
        if (anchor.isPresent()) {
            if (chain.isEmpty()) {
                LOG.warning(() -> "Chain file missing; ignoring anchor at block " + anchor.get().sequence() + " and starting from genesis");
            } else {
                ChainAnchor a = anchor.get();
                boolean held = a.sequence() >= 0 && a.sequence() < chain.size() && a.matches(chain.get((int) a.sequence()));
                if (!held) {
                    throw new StartupIntegrityException("Chain file does not contain confirmed block " + a.sequence()
                            + " recorded in the node database");
                }
            }
        }
        return new Snapshot(chain, nodeDb.loadNodes(), nodeDb.loadPool(), nodeDb.loadSelfId().orElse(null));
    }

    /** Writes every part of the snapshot. */
    public void save(Snapshot snapshot) {
        writeChain(snapshot.chain());
        for (int i = snapshot.chain().size() - 1; i >= 0; i--) {
            Block block = snapshot.chain().get(i);
            if (block.isConfirmed()) {
                nodeDb.putAnchor(ChainAnchor.of(block));
                break;
            }
        }
        nodeDb.saveState(snapshot.nodes(), snapshot.pool(), snapshot.selfId());
    }

    /** Atomically replaces the chain file. */
    public synchronized void writeChain(List<Block> chain) {
        ObjectNode root = mapper.createObjectNode();
        root.set("chain", BlockCodec.toJson(chain));
        Path tmp = chainFile.resolveSibling(CHAIN_FILE + ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(tmp,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                mapper.writeValue(out, root);
            }
            try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.WRITE)) {
                channel.force(true);
            }
            try {
                Files.move(tmp, chainFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, chainFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write chain file " + chainFile, e);
        }
    }

    public void putAnchor(ChainAnchor anchor) {
        nodeDb.putAnchor(anchor);
    }

    public Path dataDir() {
        return dataDir;
    }

    public Path chainFile() {
        return chainFile;
    }

    public Path envFile() {
        return dataDir.resolve(ENV_FILE);
    }

    private Optional<List<Block>> readChain() {
        if (!Files.exists(chainFile)) {
            return Optional.empty();
        }
        try {
            JsonNode root = mapper.readTree(chainFile.toFile());
            if (root == null || !root.has("chain")) {
                throw new StartupIntegrityException("Chain file " + chainFile + " has no chain array");
            }
            return Optional.of(BlockCodec.listFromJson(root.get("chain")));
        } catch (IOException | IllegalArgumentException e) {
            throw new StartupIntegrityException("Chain file " + chainFile + " is corrupt", e);
        }
    }

    @Override
    public void close() {
        nodeDb.close();
    }
}
