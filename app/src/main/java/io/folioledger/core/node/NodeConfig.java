package io.folioledger.core.node;

import io.folioledger.core.directory.NodeRole;
import io.folioledger.core.protocol.ProtocolLimits;

import java.nio.file.Path;

/** Immutable configuration of one node process. */
public final class NodeConfig {
    public final NodeRole role;
    public final String nodeId;
    public final String listenHost;
    public final int listenPort;
    public final String authorityHost;
    public final int authorityPort;
    public final Path dataDir;
    public final String logLevel;
    public final long batchIntervalMillis;
    public final int batchMaxSize;
    public final double quorumFraction;
    public final long peerTimeoutMillis;
    public final long reconnectDelayMillis;
    public final int catchUpChunkSize;
    public final int maxMiners;
    public final int maxRejections;
    public final boolean resetChain;
    public final boolean apiEnabled;
    public final String apiBind;
    public final int apiPort;
    public final String apiToken;

    private NodeConfig(Builder b) {
        this.role = b.role;
        this.nodeId = b.nodeId == null || b.nodeId.isBlank() ? null : b.nodeId.trim();
        this.listenHost = b.listenHost;
        this.listenPort = b.listenPort;
        this.authorityHost = b.authorityHost == null || b.authorityHost.isBlank() ? null : b.authorityHost.trim();
        this.authorityPort = b.authorityPort;
        this.dataDir = b.dataDir;
        this.logLevel = b.logLevel;
        this.batchIntervalMillis = b.batchIntervalMillis;
        this.batchMaxSize = b.batchMaxSize;
        this.quorumFraction = b.quorumFraction;
        this.peerTimeoutMillis = b.peerTimeoutMillis;
        this.reconnectDelayMillis = b.reconnectDelayMillis;
        this.catchUpChunkSize = b.catchUpChunkSize;
        this.maxMiners = b.maxMiners;
        this.maxRejections = b.maxRejections;
        this.resetChain = b.resetChain;
        this.apiEnabled = b.apiEnabled;
        this.apiBind = b.apiBind;
        this.apiPort = b.apiPort;
        this.apiToken = b.apiToken == null || b.apiToken.isBlank() ? null : b.apiToken;
    }

    /** An authority on 127.0.0.1:7000 storing its data under ./data/node. */
    public static NodeConfig defaultLocal() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .role(role)
                .nodeId(nodeId)
                .listenHost(listenHost)
                .listenPort(listenPort)
                .authority(authorityHost, authorityPort)
                .dataDir(dataDir)
                .logLevel(logLevel)
                .batchIntervalMillis(batchIntervalMillis)
                .batchMaxSize(batchMaxSize)
                .quorumFraction(quorumFraction)
                .peerTimeoutMillis(peerTimeoutMillis)
                .reconnectDelayMillis(reconnectDelayMillis)
                .catchUpChunkSize(catchUpChunkSize)
                .maxMiners(maxMiners)
                .maxRejections(maxRejections)
                .resetChain(resetChain)
                .api(apiEnabled, apiBind, apiPort, apiToken);
    }

    /**
     * @throws ConfigurationException when the role cannot run with these settings
     */
    public NodeConfig validate() {
        if (role == null) {
            throw new ConfigurationException("Node role is required");
        }
        if (role == NodeRole.ARCHIVAL_MINER && (authorityHost == null || authorityPort <= 0 || authorityPort > 65_535)) {
            throw new ConfigurationException("An archival miner needs the authority host and port (--authority=host:port)");
        }
        if (listenPort < 0 || listenPort > 65_535) {
            throw new ConfigurationException("Invalid listen port: " + listenPort);
        }
        if (!(quorumFraction > 0.0 && quorumFraction <= 1.0)) {
            throw new ConfigurationException("Quorum fraction must be in (0, 1]: " + quorumFraction);
        }
        if (batchIntervalMillis <= 0 || batchMaxSize <= 0) {
            throw new ConfigurationException("Batch interval and size must be positive");
        }
        if (batchMaxSize > ProtocolLimits.MAX_TXS_PER_BLOCK) {
            throw new ConfigurationException("Batch size must not exceed " + ProtocolLimits.MAX_TXS_PER_BLOCK);
        }
        if (peerTimeoutMillis <= 0 || reconnectDelayMillis <= 0 || catchUpChunkSize <= 0) {
            throw new ConfigurationException("Peer timeout, reconnect delay and catch-up chunk size must be positive");
        }
        if (maxMiners <= 0 || maxRejections <= 0) {
            throw new ConfigurationException("Miner limit and rejection limit must be positive");
        }
        if (dataDir == null) {
            throw new ConfigurationException("Data directory is required");
        }
        return this;
    }

    public static final class Builder {
        private NodeRole role = NodeRole.AUTHORITY;
        private String nodeId;
        private String listenHost = "127.0.0.1";
        private int listenPort = 7000;
        private String authorityHost;
        private int authorityPort = -1;
        private Path dataDir = Path.of("./data/node");
        private String logLevel = "INFO";
        private long batchIntervalMillis = 5_000L;
        private int batchMaxSize = 32;
        private double quorumFraction = 1.0;
        private long peerTimeoutMillis = 10_000L;
        private long reconnectDelayMillis = 2_000L;
        private int catchUpChunkSize = 64;
        private int maxMiners = 4;
        private int maxRejections = 3;
        private boolean resetChain;
        private boolean apiEnabled;
        private String apiBind = "127.0.0.1";
        private int apiPort = 8080;
        private String apiToken;

        public Builder role(NodeRole v) { this.role = v; return this; }
        public Builder nodeId(String v) { this.nodeId = v; return this; }
        public Builder listenHost(String v) { this.listenHost = v; return this; }
        public Builder listenPort(int v) { this.listenPort = v; return this; }
        public Builder authority(String host, int port) { this.authorityHost = host; this.authorityPort = port; return this; }
        public Builder dataDir(Path v) { this.dataDir = v; return this; }
        public Builder logLevel(String v) { this.logLevel = v; return this; }
        public Builder batchIntervalMillis(long v) { this.batchIntervalMillis = v; return this; }
        public Builder batchMaxSize(int v) { this.batchMaxSize = v; return this; }
        public Builder quorumFraction(double v) { this.quorumFraction = v; return this; }
        public Builder peerTimeoutMillis(long v) { this.peerTimeoutMillis = v; return this; }
        public Builder reconnectDelayMillis(long v) { this.reconnectDelayMillis = v; return this; }
        public Builder catchUpChunkSize(int v) { this.catchUpChunkSize = v; return this; }
        public Builder maxMiners(int v) { this.maxMiners = v; return this; }
        public Builder maxRejections(int v) { this.maxRejections = v; return this; }
        public Builder resetChain(boolean v) { this.resetChain = v; return this; }
        public Builder api(boolean enabled, String bind, int port, String token) {
            this.apiEnabled = enabled;
            this.apiBind = bind;
            this.apiPort = port;
            this.apiToken = token;
            return this;
        }

        public NodeConfig build() {
            return new NodeConfig(this);
        }
    }
}
