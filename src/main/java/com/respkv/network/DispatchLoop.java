package com.respkv.network;

import com.respkv.command.CommandDescriptor;
import com.respkv.command.CommandRegistry;
import com.respkv.command.ServerCommands;
import com.respkv.core.StorageException;
import com.respkv.protocol.ProtocolException;
import com.respkv.protocol.Reply;
import com.respkv.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Per-connection control loop: read one command, dispatch it, write the reply.
 *
 * Exactly one command is in flight per connection. A read failure, a
 * protocol violation or a storage failure ends this connection only;
 * unknown commands and bad arity are answered with an error and the loop
 * keeps reading.
 */
public class DispatchLoop implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(DispatchLoop.class);

    /**
     * Loop states.
     */
    public enum State {
        READING,
        DISPATCHING,
        CLOSED
    }

    private final Connection connection;
    private final CommandRegistry registry;
    private final MetricsCollector metrics;
    private volatile State state = State.READING;
    private boolean quitRequested;

    public DispatchLoop(Connection connection, CommandRegistry registry, MetricsCollector metrics) {
        this.connection = connection;
        this.registry = registry;
        this.metrics = metrics;
        metrics.connectionOpened();
        logger.debug("New connection from {}", connection.getRemoteAddress());
    }

    @Override
    public void run() {
        try {
            while (state != State.CLOSED) {
                List<String> argv = readNext();
                if (argv == null) {
                    break;
                }
                if (argv.isEmpty()) {
                    continue;
                }

                state = State.DISPATCHING;
                Reply reply = dispatch(argv);
                connection.sendReply(reply);
                if (quitRequested) {
                    break;
                }
                state = State.READING;
            }
        } catch (IOException e) {
            logger.debug("Write error to {}: {}", connection.getRemoteAddress(), e.getMessage());
        } catch (StorageException e) {
            logger.error("Storage failure on connection {}, closing: {}",
                    connection.getRemoteAddress(), e.getMessage(), e);
            sendQuietly(Reply.error("ERR storage failure"));
        } finally {
            state = State.CLOSED;
            connection.close();
            metrics.connectionClosed();
            logger.debug("Connection {} closed", connection.getRemoteAddress());
        }
    }

    /**
     * @return the next command, or null when the connection should close
     */
    private List<String> readNext() {
        try {
            List<String> argv = connection.readCommand();
            if (argv == null) {
                logger.debug("Client {} disconnected", connection.getRemoteAddress());
            }
            return argv;
        } catch (ProtocolException e) {
            logger.warn("Protocol violation from {} (closing connection): {}",
                    connection.getRemoteAddress(), e.getMessage());
            metrics.recordError();
            sendQuietly(Reply.error("ERR Protocol error: " + e.getMessage()));
            return null;
        } catch (IOException e) {
            logger.debug("Read error from {}: {}", connection.getRemoteAddress(), e.getMessage());
            return null;
        }
    }

    /**
     * Resolve and run one command.
     *
     * @param argv non-empty argument vector, command name first
     * @return the reply to send
     * @throws StorageException if the storage engine failed
     */
    Reply dispatch(List<String> argv) {
        String name = argv.get(0);
        Optional<CommandDescriptor> found = registry.lookup(name);
        if (found.isEmpty()) {
            logger.warn("Unknown command '{}' from {}", name, connection.getRemoteAddress());
            metrics.recordUnknownCommand();
            metrics.recordError();
            return Reply.error("ERR unknown command '" + name + "'");
        }

        CommandDescriptor command = found.get();
        if (!command.acceptsArgc(argv.size())) {
            metrics.recordError();
            return Reply.error("ERR wrong number of arguments for '" + name.toLowerCase(Locale.ROOT) + "' command");
        }

        if (ServerCommands.QUIT.equals(command.getName())) {
            quitRequested = true;
        }

        long start = System.nanoTime();
        try {
            Reply reply = command.execute(argv.subList(1, argv.size()));
            if (reply.isError()) {
                metrics.recordError();
            }
            logger.trace("{} {} -> {}", command.getName(), connection.getRemoteAddress(), reply);
            return reply;
        } catch (StorageException e) {
            metrics.recordError();
            throw e;
        } catch (RuntimeException e) {
            logger.error("Command {} failed for {}: {}",
                    command.getName(), connection.getRemoteAddress(), e.getMessage(), e);
            metrics.recordError();
            return Reply.error("ERR internal error");
        } finally {
            metrics.recordCommand(command.getName(), System.nanoTime() - start);
        }
    }

    private void sendQuietly(Reply reply) {
        try {
            connection.sendReply(reply);
        } catch (IOException e) {
            logger.debug("Could not send error to {}: {}", connection.getRemoteAddress(), e.getMessage());
        }
    }

    public State getState() {
        return state;
    }
}
