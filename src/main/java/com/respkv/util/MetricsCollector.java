package com.respkv.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * Metrics collector for RespKV.
 * Tracks per-command throughput and latency, keyspace hits, errors and connections.
 */
public class MetricsCollector {

    private final MeterRegistry registry;

    private final ConcurrentMap<String, Counter> commandCounters = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Timer> commandTimers = new ConcurrentHashMap<>();

    private final Counter keyspaceHits;
    private final Counter keyspaceMisses;
    private final Counter errors;
    private final Counter unknownCommands;

    private final LongAdder totalCommands;
    private final LongAdder activeConnections;
    private final LongAdder totalConnections;

    /**
     * Create a metrics collector with a simple registry.
     */
    public MetricsCollector() {
        this(new SimpleMeterRegistry());
    }

    /**
     * Create a metrics collector with a custom registry.
     *
     * @param registry the Micrometer registry to use
     */
    public MetricsCollector(MeterRegistry registry) {
        this.registry = registry;

        this.keyspaceHits = Counter.builder("respkv.keyspace")
            .tag("result", "hit")
            .description("GET lookups that found a live key")
            .register(registry);

        this.keyspaceMisses = Counter.builder("respkv.keyspace")
            .tag("result", "miss")
            .description("GET lookups that found nothing")
            .register(registry);

        this.errors = Counter.builder("respkv.errors")
            .description("Error replies and failed commands")
            .register(registry);

        this.unknownCommands = Counter.builder("respkv.unknown.commands")
            .description("Commands with an unrecognized name")
            .register(registry);

        this.totalCommands = new LongAdder();
        this.activeConnections = new LongAdder();
        this.totalConnections = new LongAdder();

        Gauge.builder("respkv.connections", activeConnections, LongAdder::sum)
            .description("Active connections")
            .register(registry);
    }

    // Command recording

    public void recordCommand(String name, long durationNanos) {
        String command = name.toLowerCase(Locale.ROOT);
        totalCommands.increment();
        commandCounters.computeIfAbsent(command, c -> Counter.builder("respkv.commands")
            .tag("command", c)
            .description("Commands processed")
            .register(registry)).increment();
        commandTimers.computeIfAbsent(command, c -> Timer.builder("respkv.latency")
            .tag("command", c)
            .description("Command latency")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry)).record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordKeyspaceLookup(boolean hit) {
        if (hit) {
            keyspaceHits.increment();
        } else {
            keyspaceMisses.increment();
        }
    }

    public void recordError() {
        errors.increment();
    }

    public void recordUnknownCommand() {
        unknownCommands.increment();
    }

    // Connection tracking

    public void connectionOpened() {
        activeConnections.increment();
        totalConnections.increment();
    }

    public void connectionClosed() {
        activeConnections.decrement();
    }

    // Getters for metrics values

    public long getCommandCount(String name) {
        Counter counter = commandCounters.get(name.toLowerCase(Locale.ROOT));
        return counter != null ? (long) counter.count() : 0;
    }

    public long getTotalCommands() {
        return totalCommands.sum();
    }

    public long getTotalErrors() {
        return (long) errors.count();
    }

    public long getUnknownCommands() {
        return (long) unknownCommands.count();
    }

    public long getActiveConnections() {
        return activeConnections.sum();
    }

    public long getTotalConnections() {
        return totalConnections.sum();
    }

    public long getKeyspaceHits() {
        return (long) keyspaceHits.count();
    }

    public long getKeyspaceMisses() {
        return (long) keyspaceMisses.count();
    }

    public double getHitRate() {
        double hits = keyspaceHits.count();
        double total = hits + keyspaceMisses.count();
        return total > 0 ? hits / total : 0.0;
    }

    public double getMeanLatencyMs(String name) {
        Timer timer = commandTimers.get(name.toLowerCase(Locale.ROOT));
        return timer != null ? timer.mean(TimeUnit.MILLISECONDS) : 0.0;
    }

    /**
     * Get the underlying registry.
     *
     * @return the MeterRegistry
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * Render the current metrics as INFO-style {@code field:value} lines.
     *
     * @return formatted metrics string
     */
    public String info() {
        return "# Clients\r\n"
            + "connected_clients:" + getActiveConnections() + "\r\n"
            + "\r\n"
            + "# Stats\r\n"
            + "total_connections_received:" + getTotalConnections() + "\r\n"
            + "total_commands_processed:" + getTotalCommands() + "\r\n"
            + "keyspace_hits:" + getKeyspaceHits() + "\r\n"
            + "keyspace_misses:" + getKeyspaceMisses() + "\r\n"
            + "unknown_commands:" + getUnknownCommands() + "\r\n"
            + "total_error_replies:" + getTotalErrors() + "\r\n";
    }
}
