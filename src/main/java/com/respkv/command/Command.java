package com.respkv.command;

import com.respkv.protocol.Reply;

import java.util.List;

/**
 * A command implementation. Receives the arguments after the command name;
 * the caller has already checked their count against the registered arity.
 */
@FunctionalInterface
public interface Command {

    Reply execute(List<String> args);
}
