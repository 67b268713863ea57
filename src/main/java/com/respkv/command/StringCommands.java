package com.respkv.command;

import com.respkv.core.StorageEngine;
import com.respkv.protocol.Reply;
import com.respkv.util.MetricsCollector;

import java.util.List;
import java.util.Optional;

/**
 * String value commands: SET and GET.
 */
public final class StringCommands {

    private StringCommands() {
    }

    public static void register(CommandRegistry registry, StorageEngine store, MetricsCollector metrics) {
        registry.register("SET", 3, List.of("write", "denyoom"), 1, 1, 1, args -> {
            store.set(args.get(0), args.get(1));
            return Reply.ok();
        });
        registry.register("GET", 2, List.of("readonly", "fast"), 1, 1, 1, args -> {
            Optional<String> value = store.get(args.get(0));
            metrics.recordKeyspaceLookup(value.isPresent());
            return Reply.bulk(value.orElse(null));
        });
    }
}
