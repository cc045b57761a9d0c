package io.folioledger.core;

import io.folioledger.core.directory.NodeRole;
import io.folioledger.core.node.ConfigurationException;
import io.folioledger.core.node.NodeConfig;
import io.folioledger.core.node.NodeRuntime;
import io.folioledger.core.storage.StartupIntegrityException;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    static final int EXIT_USAGE = 1;
    static final int EXIT_CONFIGURATION = 2;
    static final int EXIT_INTEGRITY = 3;

    public static void main(String[] args) throws InterruptedException {
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(EXIT_USAGE);
            }
            return;
        }
        applyLogLevel(toJulLevel(options.logLevel()));

        NodeRuntime runtime;
        try {
            runtime = NodeRuntime.open(options.toConfig());
        } catch (ConfigurationException e) {
            LOG.severe(() -> "Invalid configuration: " + e.getMessage());
            System.exit(EXIT_CONFIGURATION);
            return;
        } catch (StartupIntegrityException e) {
            LOG.log(Level.SEVERE, "Refusing to start: snapshot failed integrity checks", e);
            System.exit(EXIT_INTEGRITY);
            return;
        }

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            runtime.close();
            shutdownLatch.countDown();
        }, "folioledger-shutdown"));
        try {
            runtime.start();
            LOG.info("Node running. Press CTRL+C to exit.");
            shutdownLatch.await();
        } finally {
            runtime.close();
        }
    }

    /**
     * Maps the CLI log levels onto JUL: TRACE→FINEST, DEBUG→FINE, INFO, WARNING, ERROR and CRITICAL→SEVERE.
     */
    static Level toJulLevel(String value) {
        if (value == null || value.isBlank()) {
            return Level.INFO;
        }
        switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "TRACE":
                return Level.FINEST;
            case "DEBUG":
                return Level.FINE;
            case "INFO":
                return Level.INFO;
            case "WARN":
            case "WARNING":
                return Level.WARNING;
            case "ERROR":
            case "CRITICAL":
                return Level.SEVERE;
            default:
                throw new IllegalArgumentException("Unknown log level: " + value);
        }
    }

    static void applyLogLevel(Level level) {
        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler handler : root.getHandlers()) {
            handler.setLevel(level);
        }
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            String role,
            String host,
            int port,
            String authorityHost,
            int authorityPort,
            String logLevel,
            Path dataDir,
            String nodeId,
            long batchIntervalMillis,
            int batchMaxSize,
            double quorumFraction,
            long peerTimeoutMillis,
            int maxMiners,
            boolean resetChain,
            boolean enableApi,
            String apiBind,
            int apiPort,
            String apiToken
    ) {
        static CliOptions parse(String[] args) {
            return parse(args, System.getenv());
        }

        static CliOptions parse(String[] args, Map<String, String> env) {
            NodeConfig defaults = NodeConfig.defaultLocal();
            String role = envOrDefault(env, "FOLIO_ROLE", defaults.role.name());
            String host = envOrDefault(env, "FOLIO_HOST", defaults.listenHost);
            int port = defaults.listenPort;
            String authorityHost = null;
            int authorityPort = -1;
            String logLevel = envOrDefault(env, "FOLIO_LOG_LEVEL", defaults.logLevel);
            Path dataDir = Path.of(envOrDefault(env, "FOLIO_DATA_DIR", defaults.dataDir.toString()));
            String nodeId = envOrDefault(env, "FOLIO_NODE_ID", null);
            long batchIntervalMillis = defaults.batchIntervalMillis;
            int batchMaxSize = defaults.batchMaxSize;
            double quorumFraction = defaults.quorumFraction;
            long peerTimeoutMillis = defaults.peerTimeoutMillis;
            int maxMiners = defaults.maxMiners;
            boolean reset = false;
            boolean enableApi = "true".equalsIgnoreCase(env.get("FOLIO_ENABLE_API"));
            String apiBind = defaults.apiBind;
            int apiPort = defaults.apiPort;
            String apiToken = null;
            boolean showHelp = false;
            String error = null;

            try {
                String portEnv = env.get("FOLIO_PORT");
                if (portEnv != null && !portEnv.isBlank()) {
                    port = parsePort(portEnv, "FOLIO_PORT");
                }
                String authorityEnv = env.get("FOLIO_AUTHORITY");
                if (authorityEnv != null && !authorityEnv.isBlank()) {
                    authorityHost = hostOf(authorityEnv, "FOLIO_AUTHORITY");
                    authorityPort = portOf(authorityEnv, "FOLIO_AUTHORITY");
                }

                String[] argv = args == null ? new String[0] : args;
                for (int i = 0; i < argv.length; i++) {
                    String arg = argv[i];
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if ("--help".equals(arg) || "-h".equals(arg)) {
                        showHelp = true;
                    } else if (arg.startsWith("--role=")) {
                        role = arg.substring("--role=".length());
                    } else if (arg.equals("-nr")) {
                        role = valueAfter(argv, ++i, arg);
                    } else if (arg.startsWith("--host=")) {
                        host = arg.substring("--host=".length());
                    } else if (arg.equals("-nh")) {
                        host = valueAfter(argv, ++i, arg);
                    } else if (arg.startsWith("--port=")) {
                        port = parsePort(arg.substring("--port=".length()), "--port");
                    } else if (arg.equals("-np")) {
                        port = parsePort(valueAfter(argv, ++i, arg), arg);
                    } else if (arg.startsWith("--authority=")) {
                        String value = arg.substring("--authority=".length());
                        authorityHost = hostOf(value, "--authority");
                        authorityPort = portOf(value, "--authority");
                    } else if (arg.startsWith("--target-host=")) {
                        authorityHost = arg.substring("--target-host=".length());
                    } else if (arg.equals("-th")) {
                        authorityHost = valueAfter(argv, ++i, arg);
                    } else if (arg.startsWith("--target-port=")) {
                        authorityPort = parsePort(arg.substring("--target-port=".length()), "--target-port");
                    } else if (arg.equals("-tp")) {
                        authorityPort = parsePort(valueAfter(argv, ++i, arg), arg);
                    } else if (arg.startsWith("--log-level=")) {
                        logLevel = arg.substring("--log-level=".length());
                    } else if (arg.equals("-ll")) {
                        logLevel = valueAfter(argv, ++i, arg);
                    } else if (arg.startsWith("--data-dir=")) {
                        dataDir = Path.of(arg.substring("--data-dir=".length()));
                    } else if (arg.startsWith("--node-id=")) {
                        nodeId = arg.substring("--node-id=".length());
                    } else if (arg.startsWith("--batch-interval-ms=")) {
                        batchIntervalMillis = parsePositiveLong(arg.substring("--batch-interval-ms=".length()), "--batch-interval-ms");
                    } else if (arg.startsWith("--batch-max-size=")) {
                        batchMaxSize = (int) parsePositiveLong(arg.substring("--batch-max-size=".length()), "--batch-max-size");
                    } else if (arg.startsWith("--quorum=")) {
                        quorumFraction = parseFraction(arg.substring("--quorum=".length()));
                    } else if (arg.startsWith("--peer-timeout-ms=")) {
                        peerTimeoutMillis = parsePositiveLong(arg.substring("--peer-timeout-ms=".length()), "--peer-timeout-ms");
                    } else if (arg.startsWith("--max-miners=")) {
                        maxMiners = (int) parsePositiveLong(arg.substring("--max-miners=".length()), "--max-miners");
                    } else if (arg.equals("--reset-chain")) {
                        reset = true;
                    } else if (arg.equals("--enable-api")) {
                        enableApi = true;
                    } else if (arg.startsWith("--api-bind=")) {
                        apiBind = arg.substring("--api-bind=".length());
                    } else if (arg.startsWith("--api-port=")) {
                        apiPort = parsePort(arg.substring("--api-port=".length()), "--api-port");
                    } else if (arg.startsWith("--api-token=")) {
                        apiToken = arg.substring("--api-token=".length());
                    } else {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                }
                toJulLevel(logLevel);
            } catch (IllegalArgumentException ex) {
                showHelp = true;
                error = ex.getMessage();
            }

            if (apiToken == null || apiToken.isBlank()) {
                apiToken = envOrDefault(env, "FOLIO_API_TOKEN", null);
            }
            if (nodeId != null && nodeId.isBlank()) {
                nodeId = null;
            }

            return new CliOptions(
                    showHelp,
                    error,
                    role,
                    host,
                    port,
                    authorityHost,
                    authorityPort,
                    logLevel,
                    dataDir,
                    nodeId,
                    batchIntervalMillis,
                    batchMaxSize,
                    quorumFraction,
                    peerTimeoutMillis,
                    maxMiners,
                    reset,
                    enableApi,
                    apiBind,
                    apiPort,
                    apiToken
            );
        }

        /**
         * @throws ConfigurationException for an unknown role, or settings the role cannot run with
         */
        NodeConfig toConfig() {
            NodeRole nodeRole;
            try {
                nodeRole = NodeRole.parse(role);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(e.getMessage());
            }
            return NodeConfig.builder()
                    .role(nodeRole)
                    .nodeId(nodeId)
                    .listenHost(host)
                    .listenPort(port)
                    .authority(authorityHost, authorityPort)
                    .dataDir(dataDir)
                    .logLevel(logLevel)
                    .batchIntervalMillis(batchIntervalMillis)
                    .batchMaxSize(batchMaxSize)
                    .quorumFraction(quorumFraction)
                    .peerTimeoutMillis(peerTimeoutMillis)
                    .maxMiners(maxMiners)
                    .resetChain(resetChain)
                    .api(enableApi, apiBind, apiPort, apiToken)
                    .build()
                    .validate();
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: folio-ledger [options]

Options:
  --help, -h                     Show this help message and exit
  --role=<role>, -nr <role>      AUTHORITY (default) or ARCHIVAL_MINER; MASTER_NODE and
                                 ARCHIVAL_MINER_NODE are accepted too
  --host=<host>, -nh <host>      Listen host for peer connections (default 127.0.0.1)
  --port=<port>, -np <port>      Listen port for peer connections (default 7000)
  --authority=<host:port>        Authority address, required for archival miners
  --target-host=<host>, -th <host>
  --target-port=<port>, -tp <port>
                                 Authority address given as separate host and port
  --log-level=<lvl>, -ll <lvl>   TRACE, DEBUG, INFO (default), WARNING, ERROR or CRITICAL
  --data-dir=<path>              Chain file, node database and env file (default ./data/node)
  --node-id=<id>                 Explicit node id (default: stored, or assigned)
  --batch-interval-ms=<ms>       Block production interval (default 5000)
  --batch-max-size=<n>           Pool size that triggers a block early (default 32)
  --quorum=<fraction>            Share of synced miners that must ack a block, in (0, 1] (default 1.0)
  --peer-timeout-ms=<ms>         Request and idle timeout between nodes (default 10000)
  --max-miners=<n>               Miners the authority accepts at once (default 4)
  --reset-chain                  Delete the chain file and node database before starting
  --enable-api                   Start the HTTP API (default bind 127.0.0.1:8080)
  --api-bind=<host>              Bind address for the HTTP API
  --api-port=<port>              Port for the HTTP API (default 8080)
  --api-token=<token>            Require Bearer/X-API-Key token for the HTTP API

Environment overrides:
  FOLIO_ROLE                     Default for --role
  FOLIO_HOST, FOLIO_PORT         Defaults for --host and --port
  FOLIO_AUTHORITY                Default for --authority (host:port)
  FOLIO_LOG_LEVEL                Default for --log-level
  FOLIO_DATA_DIR                 Default for --data-dir
  FOLIO_NODE_ID                  Default for --node-id
  FOLIO_ENABLE_API               Set to "true" to enable the HTTP API without the CLI flag
  FOLIO_API_TOKEN                Token for HTTP API auth (if --api-token not supplied)
""");
        }

        private static String envOrDefault(Map<String, String> env, String key, String fallback) {
            String value = env.get(key);
            return (value == null || value.isBlank()) ? fallback : value;
        }

        private static String valueAfter(String[] argv, int index, String flag) {
            if (index >= argv.length || argv[index] == null || argv[index].startsWith("-")) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            return argv[index];
        }

        private static String hostOf(String hostPort, String flag) {
            int colon = hostPort.lastIndexOf(':');
            if (colon <= 0) {
                throw new IllegalArgumentException("Expected host:port for " + flag + ": " + hostPort);
            }
            return hostPort.substring(0, colon);
        }

        private static int portOf(String hostPort, String flag) {
            int colon = hostPort.lastIndexOf(':');
            if (colon <= 0) {
                throw new IllegalArgumentException("Expected host:port for " + flag + ": " + hostPort);
            }
            return parsePort(hostPort.substring(colon + 1), flag);
        }

        private static int parsePort(String value, String flag) {
            try {
                int port = Integer.parseInt(value.trim());
                if (port < 0 || port > 65_535) {
                    throw new NumberFormatException();
                }
                return port;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port for " + flag + ": " + value);
            }
        }

        private static long parsePositiveLong(String value, String flag) {
            try {
                long parsed = Long.parseLong(value.trim());
                if (parsed <= 0) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }

        private static double parseFraction(String value) {
            try {
                return Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for --quorum: " + value);
            }
        }
    }
}
