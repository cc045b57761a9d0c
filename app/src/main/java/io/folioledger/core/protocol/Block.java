package io.folioledger.core.protocol;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Hash-linked batch of transactions.
 * The content hash is SHA-256 over sequence, timestamp, previous hash, producer id and every
 * transaction's canonical bytes, rendered as lowercase hex. Status is excluded so it can change
 * without breaking linkage.
 */
public final class Block {
    public static final String GENESIS_PRODUCER = "genesis";

    private static final Block SENTINEL = new Block(-1L, 0L, "", List.of(), "", "", BlockStatus.CONFIRMED);

    private final long sequence;
    private final long timestamp;
    private final String previousHash;
    private final List<Transaction> transactions;
    private final String producerId;
    private final String contentHash;
    private final BlockStatus status;

    private Block(long sequence,
                  long timestamp,
                  String previousHash,
                  List<Transaction> transactions,
                  String producerId,
                  String contentHash,
                  BlockStatus status) {
        this.sequence = sequence;
        this.timestamp = timestamp;
        this.previousHash = previousHash;
        this.transactions = transactions;
        this.producerId = producerId;
        this.contentHash = contentHash;
        this.status = status;
    }

    /** Builds a new block and computes its content hash. */
    public static Block create(long sequence,
                               long timestamp,
                               String previousHash,
                               List<Transaction> transactions,
                               String producerId,
                               BlockStatus status) {
        List<Transaction> txs = copyTransactions(transactions);
        String prev = previousHash != null ? previousHash : "";
        String producer = Objects.requireNonNull(producerId, "producerId");
        validateShape(sequence, txs);
        String hash = Hashes.sha256Hex(canonicalBytes(sequence, timestamp, prev, txs, producer));
        return new Block(sequence, timestamp, prev, txs, producer, hash, Objects.requireNonNull(status, "status"));
    }

    /** Rebuilds a block received from a peer or a file; the hash is taken as given and checked later. */
    public static Block of(long sequence,
                           long timestamp,
                           String previousHash,
                           List<Transaction> transactions,
                           String producerId,
                           String contentHash,
                           BlockStatus status) {
        List<Transaction> txs = copyTransactions(transactions);
        validateShape(sequence, txs);
        return new Block(sequence, timestamp,
                previousHash != null ? previousHash : "",
                txs,
                Objects.requireNonNull(producerId, "producerId"),
                Objects.requireNonNull(contentHash, "contentHash"),
                Objects.requireNonNull(status, "status"));
    }

    /** Tip of an empty store: sequence -1 with an empty hash, so genesis links to it. */
    public static Block sentinel() {
        return SENTINEL;
    }

    public long sequence() { return sequence; }
    public long timestamp() { return timestamp; }
    public String previousHash() { return previousHash; }
    public List<Transaction> transactions() { return transactions; }
    public String producerId() { return producerId; }
    public String contentHash() { return contentHash; }
    public BlockStatus status() { return status; }

    public boolean isSentinel() {
        return sequence < 0;
    }

    public boolean isConfirmed() {
        return status == BlockStatus.CONFIRMED;
    }

    public Block withStatus(BlockStatus next) {
        if (next == status) {
            return this;
        }
        return new Block(sequence, timestamp, previousHash, transactions, producerId, contentHash, next);
    }

    public String computeContentHash() {
        return Hashes.sha256Hex(canonicalBytes(sequence, timestamp, previousHash, transactions, producerId));
    }

    public boolean hasValidContentHash() {
        return contentHash.equals(computeContentHash());
    }

    public List<String> transactionIds() {
        List<String> ids = new ArrayList<>(transactions.size());
        for (Transaction tx : transactions) {
            ids.add(tx.id());
        }
        return ids;
    }

    private static byte[] canonicalBytes(long sequence,
                                         long timestamp,
                                         String previousHash,
                                         List<Transaction> txs,
                                         String producerId) {
        byte[] prev = previousHash.getBytes(StandardCharsets.UTF_8);
        byte[] producer = producerId.getBytes(StandardCharsets.UTF_8);
        List<byte[]> encoded = new ArrayList<>(txs.size());
        int size = 8 + 8 + 4 + prev.length + 4 + producer.length + 4;
        for (Transaction tx : txs) {
            byte[] b = tx.canonicalBytes();
            encoded.add(b);
            size += 4 + b.length;
        }
        ByteBuffer buf = ByteBuffer.allocate(size);
        buf.putLong(sequence);
        buf.putLong(timestamp);
        buf.putInt(prev.length).put(prev);
        buf.putInt(producer.length).put(producer);
        buf.putInt(encoded.size());
        for (byte[] b : encoded) {
            buf.putInt(b.length).put(b);
        }
        return buf.array();
    }

    private static List<Transaction> copyTransactions(List<Transaction> transactions) {
        return transactions != null ? List.copyOf(transactions) : List.of();
    }

    private static void validateShape(long sequence, List<Transaction> txs) {
        if (sequence < 0) throw new IllegalArgumentException("sequence must be >= 0");
        if (txs.size() > ProtocolLimits.MAX_TXS_PER_BLOCK) throw new IllegalArgumentException("too many txs");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Block other)) return false;
        return sequence == other.sequence
                && timestamp == other.timestamp
                && previousHash.equals(other.previousHash)
                && transactions.equals(other.transactions)
                && producerId.equals(other.producerId)
                && contentHash.equals(other.contentHash)
                && status == other.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(sequence, contentHash, status);
    }

    @Override public String toString() {
        return "Block{seq=" + sequence + ", txs=" + transactions.size() + ", status=" + status
                + ", hash=" + (contentHash.length() > 8 ? contentHash.substring(0, 8) : contentHash) + "}";
    }
}
