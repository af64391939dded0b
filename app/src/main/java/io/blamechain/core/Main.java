package io.blamechain.core;

import io.blamechain.core.api.ApiServer;
import io.blamechain.core.metrics.BlockMetrics;
import io.blamechain.core.node.Node;
import io.blamechain.core.node.NodeConfig;
import io.blamechain.core.protocol.Block;
import io.blamechain.core.protocol.ProtocolLimits;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.stream.Stream;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) throws Exception {
        configureLogging();
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        NodeConfig config = new NodeConfig(options.difficulty(), options.flushThreshold(), options.maxMiningTries());
        Node node;
        if (options.persistent()) {
            Path dataPath = options.dataDir().toAbsolutePath().normalize();
            if (options.resetChain()) {
                resetChainState(dataPath);
            }
            Files.createDirectories(dataPath);
            node = Node.rocks(config, dataPath.toString());
        } else {
            node = Node.inMemory(config);
        }
        node.chain().addListener(block -> LOG.info(() -> "Block " + block.index() + " appended: "
                + block.payload().size() + " entries, hash " + block.hash()));

        ApiServer apiServer = new ApiServer(node, options.apiBind(), options.apiPort(), options.apiToken());
        ScheduledExecutorService flusher = null;
        try {
            apiServer.start();
            if (options.flushIntervalMillis() > 0) {
                flusher = startFlusher(node, options.flushIntervalMillis());
            }
        } catch (IOException | RuntimeException e) {
            shutdown(node, apiServer, flusher);
            throw e;
        }

        // the JVM halts once hooks return, so the hook itself seals and closes
        ScheduledExecutorService startedFlusher = flusher;
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                shutdown(node, apiServer, startedFlusher);
            } finally {
                stopped.countDown();
            }
        }, "blamechain-shutdown"));
        LOG.info("Node running. Press CTRL+C to exit.");
        stopped.await();
    }

    /** Stops intake, seals pending entries into a final block and closes the store. */
    static void shutdown(Node node, ApiServer apiServer, ScheduledExecutorService flusher) {
        if (flusher != null) {
            flusher.shutdownNow();
        }
        if (apiServer != null) {
            apiServer.stop();
        }
        try {
            flushOnExit(node);
        } finally {
            node.close();
        }
    }

    private static ScheduledExecutorService startFlusher(Node node, long intervalMillis) {
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "blamechain-flusher");
            t.setDaemon(true);
            return t;
        });
        Runnable task = () -> {
            try {
                node.buffer().flush();
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Background flush failed", e);
            }
        };
        executor.scheduleWithFixedDelay(task, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        LOG.info("Flushing pending entries every " + intervalMillis + " ms");
        return executor;
    }

    private static void flushOnExit(Node node) {
        int pending = node.buffer().size();
        if (pending == 0) {
            return;
        }
        try {
            Optional<Block> block = node.buffer().flush();
            block.ifPresent(b -> LOG.info("Sealed " + pending + " pending entries into block " + b.index() + " on exit"));
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Could not seal " + pending + " pending entries on exit; they are lost", e);
        }
        LOG.info("=== Metrics ===\n" + BlockMetrics.scrapeMetrics());
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to load logging.properties; using JDK defaults", e);
        }
    }

    private static void resetChainState(Path dataPath) {
        if (!Files.exists(dataPath)) {
            return;
        }
        try (Stream<Path> stream = Files.walk(dataPath)) {
            stream.sorted(Comparator.reverseOrder())
                    .filter(path -> !path.equals(dataPath))
                    .forEach(path -> {
                        try {
                            Files.deleteIfExists(path);
                        } catch (IOException e) {
                            throw new IllegalStateException("Failed to delete " + path, e);
                        }
                    });
        } catch (IOException e) {
            throw new IllegalStateException("Failed to reset chain data in " + dataPath, e);
        }
        LOG.info("Cleared chain data under " + dataPath);
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            boolean persistent,
            Path dataDir,
            boolean resetChain,
            int difficulty,
            int flushThreshold,
            long maxMiningTries,
            long flushIntervalMillis,
            String apiBind,
            int apiPort,
            String apiToken
    ) {
        static CliOptions parse(String[] args) {
            NodeConfig defaults = NodeConfig.defaultLocal();
            boolean showHelp = false;
            String error = null;

            Path dataDir = envPath("BLAMECHAIN_DATA_DIR", Path.of("./data/chain"));
            String storage = envOrDefault("BLAMECHAIN_STORAGE", "memory");
            boolean reset = false;
            String apiBind = envOrDefault("BLAMECHAIN_API_BIND", "127.0.0.1");
            String apiToken = System.getenv("BLAMECHAIN_API_TOKEN");

            int difficulty = defaults.difficulty;
            int flushThreshold = defaults.flushThreshold;
            long maxMiningTries = defaults.maxMiningTries;
            long flushIntervalMillis = 0L;
            int apiPort = 8080;
            try {
                difficulty = envInt("BLAMECHAIN_DIFFICULTY", difficulty, 0, ProtocolLimits.MAX_DIFFICULTY);
                flushThreshold = envInt("BLAMECHAIN_FLUSH_THRESHOLD", flushThreshold, 1, ProtocolLimits.MAX_ENTRIES_PER_BLOCK);
                maxMiningTries = envLong("BLAMECHAIN_MAX_MINING_TRIES", maxMiningTries);
                flushIntervalMillis = envLong("BLAMECHAIN_FLUSH_INTERVAL_MS", flushIntervalMillis);
                apiPort = envPort("BLAMECHAIN_API_PORT", apiPort);
            } catch (IllegalArgumentException ex) {
                showHelp = true;
                error = ex.getMessage();
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    try {
                        if ("--help".equals(arg) || "-h".equals(arg)) {
                            showHelp = true;
                        } else if (arg.startsWith("--data-dir=")) {
                            dataDir = Path.of(arg.substring("--data-dir=".length()));
                            storage = "rocksdb";
                        } else if (arg.startsWith("--storage=")) {
                            storage = arg.substring("--storage=".length()).trim();
                        } else if (arg.equals("--reset-chain")) {
                            reset = true;
                        } else if (arg.startsWith("--difficulty=")) {
                            difficulty = parseDifficulty(arg.substring("--difficulty=".length()), "--difficulty");
                        } else if (arg.startsWith("--flush-threshold=")) {
                            flushThreshold = parseThreshold(arg.substring("--flush-threshold=".length()), "--flush-threshold");
                        } else if (arg.startsWith("--max-mining-tries=")) {
                            maxMiningTries = parsePositiveLong(arg.substring("--max-mining-tries=".length()), "--max-mining-tries");
                        } else if (arg.startsWith("--flush-interval-ms=")) {
                            flushIntervalMillis = parsePositiveLong(arg.substring("--flush-interval-ms=".length()), "--flush-interval-ms");
                        } else if (arg.startsWith("--api-bind=")) {
                            apiBind = arg.substring("--api-bind=".length());
                        } else if (arg.startsWith("--api-port=")) {
                            apiPort = parsePort(arg.substring("--api-port=".length()), "--api-port");
                        } else if (arg.startsWith("--api-token=")) {
                            apiToken = arg.substring("--api-token=".length());
                        } else if (error == null) {
                            showHelp = true;
                            error = "Unknown option: " + arg;
                        }
                    } catch (IllegalArgumentException ex) {
                        showHelp = true;
                        if (error == null) {
                            error = ex.getMessage();
                        }
                    }
                }
            }

            boolean persistent = false;
            if ("rocksdb".equalsIgnoreCase(storage)) {
                persistent = true;
            } else if (!"memory".equalsIgnoreCase(storage) && error == null) {
                showHelp = true;
                error = "Invalid value for --storage: " + storage + " (expected memory or rocksdb)";
            }
            if (apiToken != null && apiToken.isBlank()) {
                apiToken = null;
            }

            return new CliOptions(
                    showHelp,
                    error,
                    persistent,
                    dataDir,
                    reset,
                    difficulty,
                    flushThreshold,
                    maxMiningTries,
                    flushIntervalMillis,
                    apiBind,
                    apiPort,
                    apiToken
            );
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: blamechain [options]

Options:
  --help, -h                 Show this help message and exit
  --storage=<memory|rocksdb> Where mined blocks are kept (default memory)
  --data-dir=<path>          RocksDB directory (default ./data/chain); implies --storage=rocksdb
  --reset-chain              Delete stored blocks before starting
  --difficulty=<n>           Leading hex zeros required in every block hash, 0..64 (default 4)
  --flush-threshold=<n>      Entries per block (default 3)
  --max-mining-tries=<n>     Give up mining a block after n nonces; 0 = never (default 0)
  --flush-interval-ms=<ms>   Also seal pending entries on this interval; 0 = off (default 0)
  --api-bind=<host>          Bind address for the REST API (default 127.0.0.1)
  --api-port=<port>          Port for the REST API (default 8080)
  --api-token=<token>        Require Bearer/X-API-Key token for the REST API

Environment overrides:
  BLAMECHAIN_STORAGE, BLAMECHAIN_DATA_DIR, BLAMECHAIN_DIFFICULTY,
  BLAMECHAIN_FLUSH_THRESHOLD, BLAMECHAIN_MAX_MINING_TRIES, BLAMECHAIN_FLUSH_INTERVAL_MS,
  BLAMECHAIN_API_BIND, BLAMECHAIN_API_PORT, BLAMECHAIN_API_TOKEN
""");
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }

        private static String envOrDefault(String key, String fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : value;
        }

        private static int envInt(String key, int fallback, int min, int max) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : (int) parseBounded(value, key, min, max);
        }

        private static long envLong(String key, long fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : parsePositiveLong(value, key);
        }

        private static int envPort(String key, int fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : parsePort(value, key);
        }

        private static int parsePort(String value, String flag) {
            try {
                int port = Integer.parseInt(value);
                if (port <= 0 || port > 65_535) {
                    throw new NumberFormatException();
                }
                return port;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port for " + flag + ": " + value);
            }
        }

        private static int parseDifficulty(String value, String flag) {
            return (int) parseBounded(value, flag, 0, ProtocolLimits.MAX_DIFFICULTY);
        }

        private static int parseThreshold(String value, String flag) {
            return (int) parseBounded(value, flag, 1, ProtocolLimits.MAX_ENTRIES_PER_BLOCK);
        }

        private static long parsePositiveLong(String value, String flag) {
            return parseBounded(value, flag, 0, Long.MAX_VALUE);
        }

        private static long parseBounded(String value, String flag, long min, long max) {
            try {
                long parsed = Long.parseLong(value.trim());
                if (parsed < min || parsed > max) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }
    }
}
