package com.respkv.command;

import com.respkv.core.MutableClock;
import com.respkv.core.StorageEngine;
import com.respkv.core.VolatileStore;
import com.respkv.protocol.Reply;
import com.respkv.util.MetricsCollector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Built-in command handlers, run against a volatile store.
 */
class CommandsTest {

    private MutableClock clock;
    private VolatileStore store;
    private MetricsCollector metrics;
    private CommandRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        store = new VolatileStore(clock, 60_000);
        store.init("volatile");
        metrics = new MetricsCollector();
        registry = CommandRegistry.withDefaults(store, metrics);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private Reply run(String... argv) {
        List<String> args = Arrays.asList(argv);
        CommandDescriptor command = registry.lookup(args.get(0)).orElseThrow();
        assertThat(command.acceptsArgc(args.size())).isTrue();
        return command.execute(args.subList(1, args.size()));
    }

    @Test
    void ping_noArgument_repliesPong() {
        assertThat(run("PING")).isEqualTo(Reply.pong());
    }

    @Test
    void ping_withArgument_echoesBulk() {
        assertThat(run("PING", "hello")).isEqualTo(Reply.bulk("hello"));
    }

    @Test
    void ping_tooManyArguments_repliesError() {
        Reply reply = run("PING", "a", "b");

        assertThat(reply.isError()).isTrue();
        assertThat(reply.getText()).contains("wrong number of arguments");
    }

    @Test
    void echo_repliesBulk() {
        assertThat(run("ECHO", "hi there")).isEqualTo(Reply.bulk("hi there"));
    }

    @Test
    void set_repliesOkAndStores() {
        assertThat(run("SET", "key1", "value")).isEqualTo(Reply.ok());

        assertThat(store.get("key1")).contains("value");
    }

    @Test
    void get_existingKey_repliesBulkAndRecordsHit() {
        store.set("key1", "value");

        assertThat(run("GET", "key1")).isEqualTo(Reply.bulk("value"));
        assertThat(metrics.getKeyspaceHits()).isEqualTo(1);
    }

    @Test
    void get_missingKey_repliesNilAndRecordsMiss() {
        assertThat(run("GET", "missing")).isEqualTo(Reply.nil());
        assertThat(metrics.getKeyspaceMisses()).isEqualTo(1);
    }

    @Test
    void del_repliesRemovedCount() {
        store.set("a", "1");
        store.set("b", "2");

        assertThat(run("DEL", "a", "b", "c")).isEqualTo(Reply.integer(2));
        assertThat(store.size()).isZero();
    }

    @Test
    void exists_countsEachMention() {
        store.set("a", "1");

        assertThat(run("EXISTS", "a", "a", "missing")).isEqualTo(Reply.integer(2));
    }

    @Test
    void keys_repliesMatchingKeys() {
        store.set("abc", "1");
        store.set("xyz", "2");

        assertThat(run("KEYS", "a*")).isEqualTo(Reply.bulkArray(List.of("abc")));
    }

    @Test
    void keys_noMatch_repliesEmptyArray() {
        assertThat(run("KEYS", "*").getElements()).isEmpty();
        assertThat(run("KEYS", "*").getType()).isEqualTo(Reply.Type.ARRAY);
    }

    @Test
    void expire_existingKey_repliesOne() {
        store.set("key1", "value");

        assertThat(run("EXPIRE", "key1", "10")).isEqualTo(Reply.integer(1));
        assertThat(run("TTL", "key1")).isEqualTo(Reply.integer(10));
    }

    @Test
    void expire_missingKey_repliesZero() {
        assertThat(run("EXPIRE", "missing", "10")).isEqualTo(Reply.integer(0));
    }

    @Test
    void expire_negative_deletesKey() {
        store.set("key1", "value");

        assertThat(run("EXPIRE", "key1", "-1")).isEqualTo(Reply.integer(1));
        assertThat(run("GET", "key1")).isEqualTo(Reply.nil());
    }

    @Test
    void expire_nonInteger_repliesError() {
        store.set("key1", "value");

        assertThat(run("EXPIRE", "key1", "soon")).isEqualTo(Reply.error(KeyCommands.NOT_AN_INTEGER));
        assertThat(store.ttl("key1")).isEqualTo(StorageEngine.TTL_NO_EXPIRY);
    }

    @Test
    void expire_overflowingSeconds_repliesErrorAndKeepsKey() {
        store.set("key1", "value");

        assertThat(run("EXPIRE", "key1", String.valueOf(Long.MAX_VALUE)))
            .isEqualTo(Reply.error(KeyCommands.INVALID_EXPIRE_TIME));
        assertThat(run("GET", "key1")).isEqualTo(Reply.bulk("value"));
        assertThat(run("TTL", "key1")).isEqualTo(Reply.integer(-1));
    }

    @Test
    void ttl_sentinels() {
        store.set("key1", "value");

        assertThat(run("TTL", "key1")).isEqualTo(Reply.integer(-1));
        assertThat(run("TTL", "missing")).isEqualTo(Reply.integer(-2));
    }

    @Test
    void ttl_afterExpiry_repliesMissing() {
        store.set("key1", "value");
        run("EXPIRE", "key1", "5");
        clock.advanceSeconds(6);

        assertThat(run("TTL", "key1")).isEqualTo(Reply.integer(-2));
    }

    @Test
    void dbsize_countsLiveKeys() {
        store.set("a", "1");
        store.set("b", "2");

        assertThat(run("DBSIZE")).isEqualTo(Reply.integer(2));
    }

    @Test
    void command_noArgs_describesEveryCommand() {
        Reply reply = run("COMMAND");

        assertThat(reply.getElements()).hasSize(registry.size());
        assertThat(reply.getElements().get(0).getElements().get(0)).isEqualTo(Reply.bulk("ping"));
    }

    @Test
    void command_count() {
        assertThat(run("COMMAND", "COUNT")).isEqualTo(Reply.integer(13));
        assertThat(run("command", "count")).isEqualTo(Reply.integer(13));
    }

    @Test
    void command_docs_repliesEmptyArray() {
        Reply reply = run("COMMAND", "DOCS");

        assertThat(reply.getType()).isEqualTo(Reply.Type.ARRAY);
        assertThat(reply.getElements()).isEmpty();
    }

    @Test
    void command_unknownSubcommand_repliesError() {
        Reply reply = run("COMMAND", "BOGUS");

        assertThat(reply).isEqualTo(Reply.error("ERR unknown subcommand 'BOGUS'"));
    }

    @Test
    void info_reportsStats() {
        metrics.connectionOpened();
        metrics.recordCommand("get", 1000);

        Reply reply = run("INFO");

        assertThat(reply.getType()).isEqualTo(Reply.Type.BULK_STRING);
        assertThat(reply.getText())
            .contains("connected_clients:1")
            .contains("total_commands_processed:1");
    }

    @Test
    void quit_repliesOk() {
        assertThat(run("QUIT")).isEqualTo(Reply.ok());
    }
}
