package io.folioledger.core.protocol;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Immutable ledger transaction. The payload is opaque to the core: record metadata for issuances,
 * registration details for node registrations.
 */
public final class Transaction {

    private final String id;
    private final TransactionKind kind;
    private final String payload;
    private final String submitterId;
    private final long createdAt;
    private final TransactionStatus status;

    private Transaction(String id,
                        TransactionKind kind,
                        String payload,
                        String submitterId,
                        long createdAt,
                        TransactionStatus status) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.payload = payload != null ? payload : "";
        this.submitterId = submitterId != null ? submitterId : "";
        this.createdAt = createdAt;
        this.status = status != null ? status : TransactionStatus.PENDING;
        this.id = (id == null || id.isBlank()) ? Hashes.sha256Hex(contentBytes(null)) : id;
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String id;
        private TransactionKind kind = TransactionKind.RECORD_ISSUANCE;
        private String payload = "";
        private String submitterId = "";
        private long createdAt = System.currentTimeMillis();
        private TransactionStatus status = TransactionStatus.PENDING;

        public Builder id(String v) { this.id = v; return this; }
        public Builder kind(TransactionKind k) { this.kind = k; return this; }
        public Builder payload(String p) { this.payload = p; return this; }
        public Builder submitterId(String s) { this.submitterId = s; return this; }
        public Builder createdAt(long ts) { this.createdAt = ts; return this; }
        public Builder status(TransactionStatus s) { this.status = s; return this; }

        public Transaction build() {
            return new Transaction(id, kind, payload, submitterId, createdAt, status);
        }
    }

    public String id() { return id; }
    public TransactionKind kind() { return kind; }
    public String payload() { return payload; }
    public String submitterId() { return submitterId; }
    public long createdAt() { return createdAt; }
    public TransactionStatus status() { return status; }

    public Transaction withStatus(TransactionStatus next) {
        if (next == status) {
            return this;
        }
        return new Transaction(id, kind, payload, submitterId, createdAt, next);
    }

    /** Canonical bytes used in block content hashes. Status is not part of the content. */
    public byte[] canonicalBytes() {
        return contentBytes(id);
    }

    private byte[] contentBytes(String idOrNull) {
        byte[] idBytes = idOrNull == null ? new byte[0] : idOrNull.getBytes(StandardCharsets.UTF_8);
        byte[] kindBytes = kind.name().getBytes(StandardCharsets.UTF_8);
        byte[] payloadBytes = payload.getBytes(StandardCharsets.UTF_8);
        byte[] submitterBytes = submitterId.getBytes(StandardCharsets.UTF_8);
        ByteBuffer buf = ByteBuffer.allocate(4 * 4 + 8 + idBytes.length + kindBytes.length
                + payloadBytes.length + submitterBytes.length);
        putBytes(buf, idBytes);
        putBytes(buf, kindBytes);
        putBytes(buf, payloadBytes);
        putBytes(buf, submitterBytes);
        buf.putLong(createdAt);
        return buf.array();
    }

    private static void putBytes(ByteBuffer buf, byte[] b){
        buf.putInt(b.length); buf.put(b);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Transaction other)) return false;
        return createdAt == other.createdAt
                && id.equals(other.id)
                && kind == other.kind
                && payload.equals(other.payload)
                && submitterId.equals(other.submitterId)
                && status == other.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind, payload, submitterId, createdAt, status);
    }

    @Override public String toString() {
        return "Transaction{id=" + id + ", kind=" + kind + ", status=" + status + "}";
    }
}
