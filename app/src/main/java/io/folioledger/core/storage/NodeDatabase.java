package io.folioledger.core.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.folioledger.core.directory.NodeRecord;
import io.folioledger.core.protocol.Transaction;
import io.folioledger.core.protocol.TransactionCodec;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.DBOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Node database on RocksDB.
 *
 * Layout (column families):
 *  - "nodes" : key = node id,                 val = NodeRecord JSON
 *  - "pool"  : key = position (8, big-endian), val = Transaction JSON, in pool order
 *  - "meta"  : key = "selfId" | "anchor",      val = UTF-8 id | ChainAnchor JSON
 */
public final class NodeDatabase implements AutoCloseable {

    static {
        RocksDB.loadLibrary();
    }

    private static final byte[] KEY_SELF_ID = "selfId".getBytes(StandardCharsets.UTF_8);
    private static final byte[] KEY_ANCHOR = "anchor".getBytes(StandardCharsets.UTF_8);

    private final RocksDB db;
    private final ColumnFamilyHandle cfDefault;
    private final ColumnFamilyHandle cfNodes;
    private final ColumnFamilyHandle cfPool;
    private final ColumnFamilyHandle cfMeta;
    private final DBOptions dbOptions;
    private final ObjectMapper mapper = new ObjectMapper();

    private NodeDatabase(RocksDB db,
                         ColumnFamilyHandle cfDefault,
                         ColumnFamilyHandle cfNodes,
                         ColumnFamilyHandle cfPool,
                         ColumnFamilyHandle cfMeta,
                         DBOptions dbOptions) {
        this.db = db;
        this.cfDefault = cfDefault;
        this.cfNodes = cfNodes;
        this.cfPool = cfPool;
        this.cfMeta = cfMeta;
        this.dbOptions = dbOptions;
    }

    /** Opens or creates the database directory. */
    public static NodeDatabase open(Path dir) {
        DBOptions dbOpts = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
        try {
            List<ColumnFamilyDescriptor> cfDescs = Arrays.asList(
                    new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                    new ColumnFamilyDescriptor("nodes".getBytes(StandardCharsets.UTF_8)),
                    new ColumnFamilyDescriptor("pool".getBytes(StandardCharsets.UTF_8)),
                    new ColumnFamilyDescriptor("meta".getBytes(StandardCharsets.UTF_8))
            );
            List<ColumnFamilyHandle> cfHandles = new ArrayList<>();
            RocksDB db = RocksDB.open(dbOpts, dir.toString(), cfDescs, cfHandles);
            return new NodeDatabase(db, cfHandles.get(0), cfHandles.get(1), cfHandles.get(2), cfHandles.get(3), dbOpts);
        } catch (RocksDBException e) {
            dbOpts.close();
            throw new StartupIntegrityException("Failed to open node database at " + dir, e);
        }
    }

    /** Replaces directory, pool and self id in one synced batch. */
    public synchronized void saveState(List<NodeRecord> nodes, List<Transaction> pool, String selfId) {
        try (WriteBatch batch = new WriteBatch();
             WriteOptions wo = new WriteOptions().setSync(true)) {
            Set<String> liveIds = new HashSet<>();
            for (NodeRecord record : nodes) {
                liveIds.add(record.nodeId());
                batch.put(cfNodes, record.nodeId().getBytes(StandardCharsets.UTF_8), mapper.writeValueAsBytes(record));
            }
            for (byte[] key : keys(cfNodes)) {
                if (!liveIds.contains(new String(key, StandardCharsets.UTF_8))) {
                    batch.delete(cfNodes, key);
                }
            }
            for (byte[] key : keys(cfPool)) {
                batch.delete(cfPool, key);
            }
            long position = 0;
            for (Transaction tx : pool) {
                batch.put(cfPool, longToBytes(position++), mapper.writeValueAsBytes(TransactionCodec.toJson(tx)));
            }
            if (selfId != null && !selfId.isBlank()) {
                batch.put(cfMeta, KEY_SELF_ID, selfId.getBytes(StandardCharsets.UTF_8));
            }
            db.write(wo, batch);
        } catch (RocksDBException | IOException e) {
            throw new IllegalStateException("Failed to write node database", e);
        }
    }

    public synchronized void putAnchor(ChainAnchor anchor) {
        try (WriteOptions wo = new WriteOptions().setSync(true)) {
            db.put(cfMeta, wo, KEY_ANCHOR, mapper.writeValueAsBytes(anchor));
        } catch (RocksDBException | IOException e) {
            throw new IllegalStateException("Failed to write chain anchor", e);
        }
    }

    public synchronized List<NodeRecord> loadNodes() {
        List<NodeRecord> out = new ArrayList<>();
        try (RocksIterator it = db.newIterator(cfNodes)) {
            for (it.seekToFirst(); it.isValid(); it.next()) {
                out.add(mapper.readValue(it.value(), NodeRecord.class));
            }
        } catch (IOException e) {
            throw new StartupIntegrityException("Corrupt node record in node database", e);
        }
        return out;
    }

    public synchronized List<Transaction> loadPool() {
        List<Transaction> out = new ArrayList<>();
        try (RocksIterator it = db.newIterator(cfPool)) {
            for (it.seekToFirst(); it.isValid(); it.next()) {
                out.add(TransactionCodec.fromJson(mapper.readTree(it.value())));
            }
        } catch (IOException | IllegalArgumentException e) {
            throw new StartupIntegrityException("Corrupt pool entry in node database", e);
        }
        return out;
    }

    public synchronized Optional<ChainAnchor> loadAnchor() {
        try {
            byte[] raw = db.get(cfMeta, KEY_ANCHOR);
            return raw == null ? Optional.empty() : Optional.of(mapper.readValue(raw, ChainAnchor.class));
        } catch (RocksDBException | IOException e) {
            throw new StartupIntegrityException("Corrupt chain anchor in node database", e);
        }
    }

    public synchronized Optional<String> loadSelfId() {
        try {
            byte[] raw = db.get(cfMeta, KEY_SELF_ID);
            return raw == null ? Optional.empty() : Optional.of(new String(raw, StandardCharsets.UTF_8));
        } catch (RocksDBException e) {
            throw new StartupIntegrityException("Failed to read node id from node database", e);
        }
    }

    private List<byte[]> keys(ColumnFamilyHandle cf) {
        List<byte[]> out = new ArrayList<>();
        try (RocksIterator it = db.newIterator(cf)) {
            for (it.seekToFirst(); it.isValid(); it.next()) {
                out.add(it.key());
            }
        }
        return out;
    }

    private static byte[] longToBytes(long v) {
        return ByteBuffer.allocate(8).putLong(v).array();
    }

    @Override
    public synchronized void close() {
        cfNodes.close();
        cfPool.close();
        cfMeta.close();
        cfDefault.close();
        db.close();
        dbOptions.close();
    }
}
