package com.respkv.network;

import com.respkv.protocol.Reply;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * A client connection as seen by the dispatch loop: parsed commands in,
 * replies out. Framing is the implementation's concern.
 */
public interface Connection extends Closeable {

    /**
     * Block until the next command arrives.
     *
     * @return the argument vector, or null when the peer closed the connection
     * @throws IOException on read failure
     * @throws com.respkv.protocol.ProtocolException on malformed framing
     */
    List<String> readCommand() throws IOException;

    /**
     * Serialize a reply and push it to the peer.
     */
    void sendReply(Reply reply) throws IOException;

    /**
     * Printable peer address for logging.
     */
    String getRemoteAddress();

    /**
     * Close the connection. Never throws; safe to call more than once.
     */
    @Override
    void close();
}
