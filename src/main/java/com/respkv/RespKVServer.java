package com.respkv;

import com.respkv.command.CommandRegistry;
import com.respkv.config.ServerConfig;
import com.respkv.core.StorageEngine;
import com.respkv.core.StorageEngines;
import com.respkv.core.StorageException;
import com.respkv.network.TcpServer;
import com.respkv.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;

/**
 * RespKV Server entry point.
 * Opens the configured storage engine and serves it over RESP.
 */
public class RespKVServer {

    private static final Logger logger = LoggerFactory.getLogger(RespKVServer.class);

    static final String VERSION = "1.0.0";

    private final ServerConfig config;
    private final MetricsCollector metrics;
    private final CountDownLatch shutdownLatch;
    private volatile StorageEngine store;
    private volatile TcpServer tcpServer;

    /**
     * Create a new RespKV server.
     *
     * @param config the server configuration
     */
    public RespKVServer(ServerConfig config) {
        this(config, null, new MetricsCollector());
    }

    /**
     * Create a server with a custom store and metrics.
     *
     * @param config  the server configuration
     * @param store   an initialized storage engine, or null to open the configured one;
     *                a failed {@link #start()} leaves a supplied engine open
     * @param metrics the metrics collector to use
     */
    public RespKVServer(ServerConfig config, StorageEngine store, MetricsCollector metrics) {
        this.config = config;
        this.store = store;
        this.metrics = metrics;
        this.shutdownLatch = new CountDownLatch(1);
    }

    /**
     * Open the storage engine and start listening.
     *
     * @throws StorageException if the storage engine cannot be initialized
     * @throws IOException      if the listener cannot be bound
     */
    public void start() throws IOException {
        logger.info("Starting RespKV Server v{}", VERSION);
        logger.info("Storage: {}", config.getStorage());

        boolean opened = false;
        if (store == null) {
            store = StorageEngines.open(config.getStorage(), config.getSweepIntervalMs());
            opened = true;
        }

        CommandRegistry registry = CommandRegistry.withDefaults(store, metrics);
        tcpServer = new TcpServer(config.getHost(), config.getPort(), registry, metrics);
        try {
            tcpServer.start();
        } catch (IOException e) {
            if (opened) {
                store.close();
            }
            throw e;
        }

        logger.info("RespKV Server started successfully with {} commands", registry.size());
    }

    /**
     * Start the server and block until stopped.
     */
    public void startAndBlock() throws IOException, InterruptedException {
        start();
        shutdownLatch.await();
    }

    /**
     * Stop the server.
     */
    public void stop() {
        logger.info("Stopping RespKV Server");

        if (tcpServer != null) {
            tcpServer.stop();
        }
        if (store != null) {
            store.close();
        }

        shutdownLatch.countDown();
        logger.info("RespKV Server stopped");
    }

    /**
     * Check if the server is running.
     */
    public boolean isRunning() {
        return tcpServer != null && tcpServer.isRunning();
    }

    /**
     * Get the bound port.
     */
    public int getPort() {
        return tcpServer != null ? tcpServer.getPort() : config.getPort();
    }

    /**
     * Get the underlying store.
     */
    public StorageEngine getStore() {
        return store;
    }

    /**
     * Get the metrics collector.
     */
    public MetricsCollector getMetrics() {
        return metrics;
    }

    /**
     * Get the number of active connections.
     */
    public int getConnectionCount() {
        return tcpServer != null ? tcpServer.getConnectionCount() : 0;
    }

    /**
     * Main entry point.
     */
    public static void main(String[] args) {
        ServerConfig config = ServerConfig.load();

        // Parse command line arguments
        try {
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--host":
                    case "-H":
                        config.setHost(requireValue(args, ++i, "--host"));
                        break;
                    case "--port":
                    case "-p":
                        String portValue = requireValue(args, ++i, "--port");
                        try {
                            config.setPort(Integer.parseInt(portValue));
                        } catch (NumberFormatException e) {
                            exitWithError("Invalid port number: " + portValue);
                        }
                        break;
                    case "--storage":
                    case "-s":
                        config.setStorage(requireValue(args, ++i, "--storage"));
                        break;
                    case "--sweep-interval":
                        String sweepValue = requireValue(args, ++i, "--sweep-interval");
                        try {
                            config.setSweepIntervalMs(Long.parseLong(sweepValue));
                        } catch (NumberFormatException e) {
                            exitWithError("Invalid sweep interval: " + sweepValue);
                        }
                        break;
                    case "--help":
                    case "-h":
                        printHelp();
                        return;
                    case "--version":
                    case "-v":
                        System.out.println("RespKV Server v" + VERSION);
                        return;
                    default:
                        exitWithError("Unknown option: " + args[i]);
                }
            }
        } catch (IllegalArgumentException e) {
            exitWithError(e.getMessage());
        }

        printBanner();

        RespKVServer server = new RespKVServer(config);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received");
            server.stop();
        }, "respkv-shutdown"));

        try {
            server.startAndBlock();
        } catch (IOException e) {
            logger.error("Failed to bind {}:{}: {}", config.getHost(), config.getPort(), e.getMessage());
            System.exit(1);
        } catch (StorageException e) {
            logger.error("Failed to initialize storage {}: {}", config.getStorage(), e.getMessage(), e);
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length) {
            exitWithError(option + " requires a value");
        }
        return args[index];
    }

    private static void printBanner() {
        System.out.println();
        System.out.println("  RespKV Server v" + VERSION);
        System.out.println("  Redis-protocol key-value store");
        System.out.println();
    }

    private static void exitWithError(String message) {
        System.err.println("Error: " + message);
        System.err.println("Use --help for usage information");
        System.exit(1);
    }

    private static void printHelp() {
        System.out.println("RespKV Server - Redis-protocol key-value store");
        System.out.println();
        System.out.println("Usage: respkv [options]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  -H, --host <address>         Address to bind (default: 0.0.0.0)");
        System.out.println("  -p, --port <port>            Port to listen on (default: 6379)");
        System.out.println("  -s, --storage <backend>      'volatile' or a SQLite data file path (default: volatile)");
        System.out.println("      --sweep-interval <ms>    Expired key sweep interval (default: 60000)");
        System.out.println("  -h, --help                   Show this help message");
        System.out.println("  -v, --version                Show version");
        System.out.println();
        System.out.println("Environment:");
        System.out.println("  RESPKV_HOST, RESPKV_PORT, RESPKV_STORAGE, RESPKV_SWEEP_INTERVAL_MS");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  respkv --port 6379");
        System.out.println("  respkv --storage data/respkv.db");
        System.out.println();
    }
}
