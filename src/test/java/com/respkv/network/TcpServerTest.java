package com.respkv.network;

import com.respkv.RespKVClient;
import com.respkv.command.CommandRegistry;
import com.respkv.core.VolatileStore;
import com.respkv.protocol.Reply;
import com.respkv.util.MetricsCollector;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for the TCP server with real socket connections.
 */
class TcpServerTest {

    private static final String HOST = "127.0.0.1";

    private VolatileStore store;
    private MetricsCollector metrics;
    private TcpServer server;
    private RespKVClient client;

    @BeforeEach
    void setUp() throws Exception {
        store = new VolatileStore();
        store.init("volatile");
        metrics = new MetricsCollector();
        server = new TcpServer(HOST, 0, CommandRegistry.withDefaults(store, metrics), metrics);
        server.start();

        client = new RespKVClient(HOST, server.getPort());
    }

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.close();
        }
        if (server != null) {
            server.stop();
        }
        store.close();
    }

    @Test
    void serverStartsAndAcceptsConnections() {
        assertThat(server.isRunning()).isTrue();
        assertThat(server.getPort()).isPositive();
        assertThat(server.getHost()).isEqualTo(HOST);
        assertThat(client.ping()).isTrue();
    }

    @Test
    void start_whenRunning_throwsException() {
        assertThatThrownBy(() -> server.start())
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void start_portInUse_throwsIOException() {
        TcpServer other = new TcpServer(HOST, server.getPort(),
            CommandRegistry.withDefaults(store, metrics), metrics);

        assertThatThrownBy(other::start).isInstanceOf(IOException.class);
        assertThat(other.isRunning()).isFalse();
    }

    @Test
    void setAndGet_overTheWire() throws IOException {
        client.set("testKey", "testValue");

        assertThat(client.get("testKey")).contains("testValue");
        assertThat(client.get("missing")).isEmpty();
    }

    @Test
    void inlineCommand_overRawSocket() throws IOException {
        try (Socket socket = new Socket(HOST, server.getPort())) {
            OutputStream out = socket.getOutputStream();
            out.write("PING\r\n".getBytes(StandardCharsets.US_ASCII));
            out.flush();

            assertThat(readExactly(socket.getInputStream(), 7)).isEqualTo("+PONG\r\n");
        }
    }

    @Test
    void protocolError_closesOnlyThatConnection() throws IOException {
        try (Socket socket = new Socket(HOST, server.getPort())) {
            OutputStream out = socket.getOutputStream();
            out.write("*1\r\n:5\r\n".getBytes(StandardCharsets.US_ASCII));
            out.flush();

            String reply = readExactly(socket.getInputStream(), "-ERR Protocol error".length());
            assertThat(reply).isEqualTo("-ERR Protocol error");
        }

        assertThat(client.ping()).isTrue();
    }

    @Test
    void unknownCommand_keepsConnectionOpen() throws IOException {
        Reply reply = client.execute("FLUSHALL");

        assertThat(reply).isEqualTo(Reply.error("ERR unknown command 'FLUSHALL'"));
        assertThat(client.ping()).isTrue();
    }

    @Test
    void connectionCount_tracksOpenClients() throws Exception {
        client.ping();
        assertThat(server.getConnectionCount()).isEqualTo(1);

        client.close();
        client = null;

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (server.getConnectionCount() > 0 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertThat(server.getConnectionCount()).isZero();
        assertThat(metrics.getActiveConnections()).isZero();
        assertThat(metrics.getTotalConnections()).isEqualTo(1);
    }

    @Test
    void concurrentClients_operateIndependently() throws Exception {
        int numClients = 10;
        int opsPerClient = 50;
        ExecutorService executor = Executors.newFixedThreadPool(numClients);
        CountDownLatch latch = new CountDownLatch(numClients);
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);

        for (int c = 0; c < numClients; c++) {
            final int clientId = c;
            executor.submit(() -> {
                try (RespKVClient own = new RespKVClient(HOST, server.getPort())) {
                    for (int i = 0; i < opsPerClient; i++) {
                        String key = "client" + clientId + "_key" + i;
                        String value = "value" + i;
                        own.set(key, value);
                        if (own.get(key).filter(value::equals).isPresent()) {
                            successCount.incrementAndGet();
                        } else {
                            errorCount.incrementAndGet();
                        }
                    }
                } catch (IOException e) {
                    errorCount.incrementAndGet();
                } finally {
                    latch.countDown();
                }
            });
        }

        assertThat(latch.await(30, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(errorCount.get()).isZero();
        assertThat(successCount.get()).isEqualTo(numClients * opsPerClient);
        assertThat(client.dbSize()).isEqualTo(numClients * opsPerClient);
    }

    @Test
    void stop_closesOpenConnections() throws Exception {
        assertThat(client.ping()).isTrue();

        server.stop();

        assertThat(server.isRunning()).isFalse();
        assertThat(server.getConnectionCount()).isZero();
        assertThatThrownBy(() -> client.execute("PING"))
            .isInstanceOf(IOException.class);
    }

    @Test
    void stop_isIdempotent() {
        server.stop();
        server.stop();

        assertThat(server.isRunning()).isFalse();
    }

    private static String readExactly(InputStream in, int length) throws IOException {
        byte[] data = in.readNBytes(length);
        return new String(data, StandardCharsets.US_ASCII);
    }
}
