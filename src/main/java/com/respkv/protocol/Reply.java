package com.respkv.protocol;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable reply value produced by a command and serialized by the connection.
 */
public final class Reply {

    /**
     * RESP2 reply kinds.
     */
    public enum Type {
        SIMPLE_STRING,  // +OK\r\n
        ERROR,          // -ERR msg\r\n
        INTEGER,        // :1\r\n
        BULK_STRING,    // $3\r\nfoo\r\n
        NIL,            // $-1\r\n
        ARRAY           // *2\r\n...
    }

    private static final Reply OK = new Reply(Type.SIMPLE_STRING, "OK", 0, null);
    private static final Reply PONG = new Reply(Type.SIMPLE_STRING, "PONG", 0, null);
    private static final Reply NIL = new Reply(Type.NIL, null, 0, null);

    private final Type type;
    private final String text;       // simple string, error message or bulk payload
    private final long integer;
    private final List<Reply> elements;

    private Reply(Type type, String text, long integer, List<Reply> elements) {
        this.type = type;
        this.text = text;
        this.integer = integer;
        this.elements = elements;
    }

    /**
     * Create the +OK reply.
     */
    public static Reply ok() {
        return OK;
    }

    /**
     * Create the +PONG reply.
     */
    public static Reply pong() {
        return PONG;
    }

    /**
     * Create a simple string reply. The text must not contain CR or LF.
     */
    public static Reply simple(String text) {
        Objects.requireNonNull(text, "text");
        return new Reply(Type.SIMPLE_STRING, text, 0, null);
    }

    /**
     * Create an error reply. The message should start with an error code such as ERR.
     */
    public static Reply error(String message) {
        Objects.requireNonNull(message, "message");
        return new Reply(Type.ERROR, message, 0, null);
    }

    /**
     * Create an integer reply.
     */
    public static Reply integer(long value) {
        return new Reply(Type.INTEGER, null, value, null);
    }

    /**
     * Create a bulk string reply, or the nil reply for null.
     */
    public static Reply bulk(String value) {
        return value == null ? NIL : new Reply(Type.BULK_STRING, value, 0, null);
    }

    /**
     * Create the nil bulk reply.
     */
    public static Reply nil() {
        return NIL;
    }

    /**
     * Create an array reply.
     */
    public static Reply array(List<Reply> elements) {
        Objects.requireNonNull(elements, "elements");
        return new Reply(Type.ARRAY, null, 0, Collections.unmodifiableList(new ArrayList<>(elements)));
    }

    /**
     * Create an array reply of bulk strings.
     */
    public static Reply bulkArray(Collection<String> values) {
        List<Reply> elements = new ArrayList<>(values.size());
        for (String value : values) {
            elements.add(bulk(value));
        }
        return new Reply(Type.ARRAY, null, 0, Collections.unmodifiableList(elements));
    }

    public Type getType() {
        return type;
    }

    /**
     * Payload of a simple string, error or bulk string reply; null otherwise.
     */
    public String getText() {
        return text;
    }

    public long getInteger() {
        return integer;
    }

    /**
     * Elements of an array reply; empty for other kinds.
     */
    public List<Reply> getElements() {
        return elements != null ? elements : Collections.emptyList();
    }

    public boolean isError() {
        return type == Type.ERROR;
    }

    public boolean isNil() {
        return type == Type.NIL;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Reply)) {
            return false;
        }
        Reply other = (Reply) o;
        return type == other.type
                && integer == other.integer
                && Objects.equals(text, other.text)
                && Objects.equals(elements, other.elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, integer, elements);
    }

    @Override
    public String toString() {
        switch (type) {
            case SIMPLE_STRING:
                return "+" + text;
            case ERROR:
                return "-" + text;
            case INTEGER:
                return ":" + integer;
            case BULK_STRING:
                return "\"" + text + "\"";
            case NIL:
                return "(nil)";
            default:
                return elements.toString();
        }
    }
}
