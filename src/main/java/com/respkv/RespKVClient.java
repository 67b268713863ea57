package com.respkv;

import com.respkv.client.ClientConfig;
import com.respkv.protocol.Reply;
import com.respkv.protocol.RespReader;
import com.respkv.protocol.RespWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * RespKV client library.
 * Blocking RESP client over a single connection; calls are serialized.
 */
public class RespKVClient implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(RespKVClient.class);

    private final String host;
    private final int port;
    private final Socket socket;
    private final RespReader reader;
    private final RespWriter writer;
    private volatile boolean closed = false;

    /**
     * Connect to a server with default settings.
     *
     * @param host server host
     * @param port server port
     * @throws IOException if the connection cannot be established
     */
    public RespKVClient(String host, int port) throws IOException {
        this(new ClientConfig(), host, port);
    }

    /**
     * Connect to a server with custom configuration.
     *
     * @param config the client configuration
     * @param host   server host
     * @param port   server port
     * @throws IOException if the connection cannot be established
     */
    public RespKVClient(ClientConfig config, String host, int port) throws IOException {
        this.host = host;
        this.port = port;
        this.socket = new Socket();
        try {
            socket.setTcpNoDelay(true);
            socket.setSoTimeout(config.getReadTimeoutMs());
            socket.connect(new InetSocketAddress(host, port), config.getConnectTimeoutMs());
            this.reader = new RespReader(new BufferedInputStream(socket.getInputStream()));
            this.writer = new RespWriter(new BufferedOutputStream(socket.getOutputStream()));
        } catch (IOException e) {
            socket.close();
            throw e;
        }
        logger.debug("RespKV client connected to {}:{}", host, port);
    }

    /**
     * Check if the server is reachable.
     *
     * @return true if the server answered PONG
     */
    public boolean ping() {
        try {
            Reply reply = execute("PING");
            return "PONG".equals(reply.getText());
        } catch (IOException e) {
            logger.debug("Ping to {}:{} failed: {}", host, port, e.getMessage());
            return false;
        }
    }

    /**
     * Store a value, clearing any expiration on the key.
     */
    public void set(String key, String value) throws IOException {
        checked(execute("SET", key, value));
    }

    /**
     * Get a value by key.
     *
     * @return the value if present, empty otherwise
     */
    public Optional<String> get(String key) throws IOException {
        Reply reply = checked(execute("GET", key));
        return reply.isNil() ? Optional.empty() : Optional.of(reply.getText());
    }

    /**
     * Delete keys.
     *
     * @return the number of keys removed
     */
    public long del(String... keys) throws IOException {
        return checked(execute(prepend("DEL", keys))).getInteger();
    }

    /**
     * Count how many of the given keys exist.
     */
    public long exists(String... keys) throws IOException {
        return checked(execute(prepend("EXISTS", keys))).getInteger();
    }

    /**
     * List keys matching a glob pattern.
     */
    public List<String> keys(String pattern) throws IOException {
        Reply reply = checked(execute("KEYS", pattern));
        List<String> keys = new ArrayList<>(reply.getElements().size());
        for (Reply element : reply.getElements()) {
            keys.add(element.getText());
        }
        return keys;
    }

    /**
     * Set a key's time to live.
     *
     * @return true if the key existed
     */
    public boolean expire(String key, long seconds) throws IOException {
        return checked(execute("EXPIRE", key, Long.toString(seconds))).getInteger() == 1;
    }

    /**
     * Get a key's remaining time to live.
     *
     * @return seconds remaining, -1 for no expiration, -2 for a missing key
     */
    public long ttl(String key) throws IOException {
        return checked(execute("TTL", key)).getInteger();
    }

    /**
     * Get the number of live keys.
     */
    public long dbSize() throws IOException {
        return checked(execute("DBSIZE")).getInteger();
    }

    /**
     * Send a raw command and return the reply as is, error replies included.
     *
     * @param argv command name followed by its arguments
     * @throws IOException if the connection fails
     */
    public synchronized Reply execute(String... argv) throws IOException {
        if (closed) {
            throw new IOException("Client is closed");
        }
        writer.writeCommand(Arrays.asList(argv));
        writer.flush();
        return reader.readReply();
    }

    private static Reply checked(Reply reply) throws IOException {
        if (reply.isError()) {
            throw new IOException("Server error: " + reply.getText());
        }
        return reply;
    }

    private static String[] prepend(String command, String[] args) {
        String[] argv = new String[args.length + 1];
        argv[0] = command;
        System.arraycopy(args, 0, argv, 1, args.length);
        return argv;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("Error closing client socket: {}", e.getMessage());
        }
        logger.debug("RespKV client closed");
    }
}
