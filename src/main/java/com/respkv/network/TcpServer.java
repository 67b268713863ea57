package com.respkv.network;

import com.respkv.command.CommandRegistry;
import com.respkv.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Blocking TCP server for RespKV.
 * An acceptor thread hands every accepted socket to its own worker task,
 * which runs a {@link DispatchLoop} until the peer disconnects.
 */
public class TcpServer {

    private static final Logger logger = LoggerFactory.getLogger(TcpServer.class);
    private static final int BACKLOG = 511;

    private final String host;
    private final int requestedPort;
    private final CommandRegistry registry;
    private final MetricsCollector metrics;
    private final AtomicBoolean running;
    private final Set<Connection> connections;
    private final ExecutorService workerPool;

    private ServerSocket serverSocket;
    private Thread acceptorThread;

    /**
     * Create a new TCP server.
     *
     * @param host     the address to bind
     * @param port     the port to listen on, 0 for an ephemeral port
     * @param registry the command table
     * @param metrics  the metrics collector
     */
    public TcpServer(String host, int port, CommandRegistry registry, MetricsCollector metrics) {
        this.host = host;
        this.requestedPort = port;
        this.registry = registry;
        this.metrics = metrics;
        this.running = new AtomicBoolean(false);
        this.connections = ConcurrentHashMap.newKeySet();
        AtomicInteger threadIds = new AtomicInteger();
        this.workerPool = new ThreadPoolExecutor(
                0,
                Integer.MAX_VALUE,
                60L,
                TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                r -> {
                    Thread t = new Thread(r, "respkv-conn-" + threadIds.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
    }

    /**
     * Bind the listener and start accepting connections.
     *
     * @throws IOException if the address cannot be bound
     */
    public void start() throws IOException {
        if (running.getAndSet(true)) {
            throw new IllegalStateException("Server already running");
        }

        try {
            serverSocket = new ServerSocket();
            serverSocket.setReuseAddress(true);
            serverSocket.bind(new InetSocketAddress(host, requestedPort), BACKLOG);
        } catch (IOException e) {
            running.set(false);
            closeServerSocket();
            throw e;
        }

        acceptorThread = new Thread(this::acceptLoop, "respkv-acceptor-" + getPort());
        acceptorThread.start();

        logger.info("RespKV server listening on {}:{}", host, getPort());
    }

    private void acceptLoop() {
        while (running.get()) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (SocketException e) {
                if (running.get()) {
                    logger.error("Accept failed: {}", e.getMessage());
                }
                break;
            } catch (IOException e) {
                logger.warn("Accept error: {}", e.getMessage());
                continue;
            }
            handle(socket);
        }
    }

    private void handle(Socket socket) {
        RespConnection connection;
        try {
            socket.setTcpNoDelay(true);
            socket.setKeepAlive(true);
            connection = new RespConnection(socket);
        } catch (IOException e) {
            logger.warn("Failed to set up connection from {}: {}", socket.getRemoteSocketAddress(), e.getMessage());
            closeQuietly(socket);
            return;
        }

        connections.add(connection);
        DispatchLoop loop = new DispatchLoop(connection, registry, metrics);
        try {
            workerPool.execute(() -> {
                try {
                    loop.run();
                } finally {
                    connections.remove(connection);
                }
            });
        } catch (RejectedExecutionException e) {
            logger.warn("Rejected connection from {}: server shutting down", connection.getRemoteAddress());
            connections.remove(connection);
            connection.close();
            metrics.connectionClosed();
        }
    }

    /**
     * Stop accepting, close every open connection and wait for the workers.
     */
    public void stop() {
        if (!running.getAndSet(false)) {
            return;
        }

        logger.info("Stopping RespKV server on port {}", getPort());

        closeServerSocket();

        if (acceptorThread != null && acceptorThread != Thread.currentThread()) {
            try {
                acceptorThread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        // Closing the sockets unblocks the workers' reads
        for (Connection connection : connections) {
            connection.close();
        }

        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(5, TimeUnit.SECONDS)) {
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        connections.clear();

        logger.info("RespKV server stopped");
    }

    private void closeServerSocket() {
        if (serverSocket != null) {
            try {
                serverSocket.close();
            } catch (IOException e) {
                logger.debug("Error closing server socket: {}", e.getMessage());
            }
        }
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("Error closing socket: {}", e.getMessage());
        }
    }

    /**
     * Check if the server is running.
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * Get the number of active connections.
     */
    public int getConnectionCount() {
        return connections.size();
    }

    /**
     * Get the bound port, or the requested one before {@link #start()}.
     */
    public int getPort() {
        ServerSocket socket = serverSocket;
        return socket != null && socket.isBound() ? socket.getLocalPort() : requestedPort;
    }

    public String getHost() {
        return host;
    }
}
