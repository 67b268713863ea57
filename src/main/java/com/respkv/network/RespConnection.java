package com.respkv.network;

import com.respkv.protocol.Reply;
import com.respkv.protocol.RespReader;
import com.respkv.protocol.RespWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.net.Socket;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * RESP connection over a blocking socket.
 */
public class RespConnection implements Connection {

    private static final Logger logger = LoggerFactory.getLogger(RespConnection.class);
    private static final int BUFFER_SIZE = 16 * 1024;

    private final Socket socket;
    private final RespReader reader;
    private final RespWriter writer;
    private final String remoteAddress;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public RespConnection(Socket socket) throws IOException {
        this.socket = socket;
        this.reader = new RespReader(new BufferedInputStream(socket.getInputStream(), BUFFER_SIZE));
        this.writer = new RespWriter(new BufferedOutputStream(socket.getOutputStream(), BUFFER_SIZE));
        this.remoteAddress = String.valueOf(socket.getRemoteSocketAddress());
    }

    @Override
    public List<String> readCommand() throws IOException {
        return reader.readCommand();
    }

    @Override
    public void sendReply(Reply reply) throws IOException {
        writer.write(reply);
        writer.flush();
    }

    @Override
    public String getRemoteAddress() {
        return remoteAddress;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("Error closing connection {}: {}", remoteAddress, e.getMessage());
        }
    }

    public boolean isClosed() {
        return closed.get();
    }
}
