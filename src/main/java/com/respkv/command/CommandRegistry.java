package com.respkv.command;

import com.respkv.core.StorageEngine;
import com.respkv.util.MetricsCollector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Name to command table. Lookups are case-insensitive.
 * All registration must happen before the registry is shared with connection threads.
 */
public final class CommandRegistry {

    private final Map<String, CommandDescriptor> commands = new LinkedHashMap<>();

    /**
     * Build the registry with every built-in command bound to a storage engine.
     *
     * @param store   the storage engine shared by all connections
     * @param metrics metrics reported by INFO
     * @return the populated registry
     */
    public static CommandRegistry withDefaults(StorageEngine store, MetricsCollector metrics) {
        CommandRegistry registry = new CommandRegistry();
        ServerCommands.register(registry, metrics);
        StringCommands.register(registry, store, metrics);
        KeyCommands.register(registry, store);
        return registry;
    }

    /**
     * Register a command that takes no key arguments.
     */
    public CommandRegistry register(String name, int arity, List<String> flags, Command handler) {
        return register(name, arity, flags, 0, 0, 0, handler);
    }

    /**
     * Register a command.
     *
     * @param name     command name
     * @param arity    Redis-style arity including the name
     * @param flags    COMMAND flags such as "write" or "readonly"
     * @param firstKey position of the first key argument, 0 if none
     * @param lastKey  position of the last key argument, -1 for "all remaining"
     * @param keyStep  step between key arguments
     * @param handler  implementation
     * @return this registry
     */
    public CommandRegistry register(String name, int arity, List<String> flags,
            int firstKey, int lastKey, int keyStep, Command handler) {
        CommandDescriptor descriptor = new CommandDescriptor(name, arity, flags, firstKey, lastKey, keyStep, handler);
        if (commands.putIfAbsent(descriptor.getName(), descriptor) != null) {
            throw new IllegalArgumentException("Command already registered: " + descriptor.getName());
        }
        return this;
    }

    /**
     * Resolve a command name, ignoring case.
     */
    public Optional<CommandDescriptor> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(commands.get(name.toUpperCase(Locale.ROOT)));
    }

    /**
     * All registered commands in registration order.
     */
    public List<CommandDescriptor> descriptors() {
        return Collections.unmodifiableList(new ArrayList<>(commands.values()));
    }

    public int size() {
        return commands.size();
    }
}
