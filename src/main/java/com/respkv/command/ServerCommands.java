package com.respkv.command;

import com.respkv.protocol.Reply;
import com.respkv.util.MetricsCollector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Connection and server commands: PING, ECHO, COMMAND, INFO, QUIT.
 */
public final class ServerCommands {

    public static final String QUIT = "QUIT";

    private static final List<String> FAST = List.of("fast", "stale");
    private static final List<String> LOADING = List.of("loading", "stale");

    private ServerCommands() {
    }

    public static void register(CommandRegistry registry, MetricsCollector metrics) {
        registry.register("PING", -1, FAST, ServerCommands::ping);
        registry.register("ECHO", 2, FAST, args -> Reply.bulk(args.get(0)));
        registry.register("COMMAND", -1, LOADING, args -> command(registry, args));
        registry.register("INFO", -1, LOADING, args -> Reply.bulk(metrics.info()));
        // The dispatch loop closes the connection after replying
        registry.register(QUIT, 1, FAST, args -> Reply.ok());
    }

    private static Reply ping(List<String> args) {
        if (args.isEmpty()) {
            return Reply.pong();
        }
        if (args.size() == 1) {
            return Reply.bulk(args.get(0));
        }
        return Reply.error("ERR wrong number of arguments for 'ping' command");
    }

    /**
     * Static descriptor of the registered commands, for clients that probe
     * server capabilities when they connect.
     */
    private static Reply command(CommandRegistry registry, List<String> args) {
        if (args.isEmpty()) {
            List<CommandDescriptor> descriptors = registry.descriptors();
            List<Reply> entries = new ArrayList<>(descriptors.size());
            for (CommandDescriptor descriptor : descriptors) {
                entries.add(descriptor.toReply());
            }
            return Reply.array(entries);
        }
        String sub = args.get(0).toUpperCase(Locale.ROOT);
        switch (sub) {
            case "COUNT":
                return Reply.integer(registry.size());
            case "DOCS":
                return Reply.array(Collections.emptyList());
            default:
                return Reply.error("ERR unknown subcommand '" + args.get(0) + "'");
        }
    }
}
