package com.respkv.command;

import com.respkv.core.StorageEngine;
import com.respkv.protocol.Reply;

import java.util.List;

/**
 * Keyspace commands: DEL, EXISTS, KEYS, EXPIRE, TTL, DBSIZE.
 */
public final class KeyCommands {

    static final String NOT_AN_INTEGER = "ERR value is not an integer or out of range";
    static final String INVALID_EXPIRE_TIME = "ERR invalid expire time in 'expire' command";

    private KeyCommands() {
    }

    public static void register(CommandRegistry registry, StorageEngine store) {
        registry.register("DEL", -2, List.of("write"), 1, -1, 1,
                args -> Reply.integer(store.del(args)));
        registry.register("EXISTS", -2, List.of("readonly", "fast"), 1, -1, 1,
                args -> Reply.integer(exists(store, args)));
        registry.register("KEYS", 2, List.of("readonly", "sort_for_script"),
                args -> Reply.bulkArray(store.keys(args.get(0))));
        registry.register("EXPIRE", 3, List.of("write", "fast"), 1, 1, 1,
                args -> expire(store, args));
        registry.register("TTL", 2, List.of("readonly", "random", "fast"), 1, 1, 1,
                args -> Reply.integer(store.ttl(args.get(0))));
        registry.register("DBSIZE", 1, List.of("readonly", "fast"),
                args -> Reply.integer(store.size()));
    }

    private static Reply expire(StorageEngine store, List<String> args) {
        long seconds;
        try {
            seconds = Long.parseLong(args.get(1));
        } catch (NumberFormatException e) {
            return Reply.error(NOT_AN_INTEGER);
        }
        try {
            return Reply.integer(store.expire(args.get(0), seconds) ? 1 : 0);
        } catch (IllegalArgumentException e) {
            return Reply.error(INVALID_EXPIRE_TIME);
        }
    }

    /**
     * Counts repeated keys once per mention, as Redis does.
     */
    private static long exists(StorageEngine store, List<String> keys) {
        long count = 0;
        for (String key : keys) {
            if (store.get(key).isPresent()) {
                count++;
            }
        }
        return count;
    }
}
