package com.respkv.command;

import com.respkv.protocol.Reply;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * A registered command: its name, arity, flags, key positions and handler.
 *
 * Arity follows the Redis convention and counts the command name itself:
 * a positive value is an exact argument count, a negative value -N means
 * "at least N".
 */
public final class CommandDescriptor {

    private final String name;
    private final int arity;
    private final List<String> flags;
    private final int firstKey;
    private final int lastKey;
    private final int keyStep;
    private final Command handler;

    CommandDescriptor(String name, int arity, List<String> flags,
            int firstKey, int lastKey, int keyStep, Command handler) {
        if (arity == 0) {
            throw new IllegalArgumentException("arity cannot be 0 for " + name);
        }
        this.name = name.toUpperCase(Locale.ROOT);
        this.arity = arity;
        this.flags = Collections.unmodifiableList(new ArrayList<>(flags));
        this.firstKey = firstKey;
        this.lastKey = lastKey;
        this.keyStep = keyStep;
        this.handler = handler;
    }

    /**
     * Check an argument vector length, including the command name.
     */
    public boolean acceptsArgc(int argc) {
        return arity > 0 ? argc == arity : argc >= -arity;
    }

    public Reply execute(List<String> args) {
        return handler.execute(args);
    }

    /**
     * COMMAND reply entry: name, arity, flags, first key, last key, step.
     */
    public Reply toReply() {
        List<Reply> flagReplies = new ArrayList<>(flags.size());
        for (String flag : flags) {
            flagReplies.add(Reply.simple(flag));
        }
        List<Reply> fields = new ArrayList<>(6);
        fields.add(Reply.bulk(name.toLowerCase(Locale.ROOT)));
        fields.add(Reply.integer(arity));
        fields.add(Reply.array(flagReplies));
        fields.add(Reply.integer(firstKey));
        fields.add(Reply.integer(lastKey));
        fields.add(Reply.integer(keyStep));
        return Reply.array(fields);
    }

    public String getName() {
        return name;
    }

    public int getArity() {
        return arity;
    }

    public List<String> getFlags() {
        return flags;
    }

    @Override
    public String toString() {
        return name + "/" + arity;
    }
}
