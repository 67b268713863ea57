package com.respkv.protocol;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Blocking RESP2 decoder over an input stream.
 *
 * Requests are arrays of bulk strings. Inline commands (a plain text line of
 * space-separated words, as typed into telnet) are accepted as well.
 * The stream should be buffered by the caller.
 */
public class RespReader {

    public static final int MAX_BULK_LENGTH = 512 * 1024 * 1024;   // 512MB, as Redis
    public static final int MAX_ARRAY_LENGTH = 1024 * 1024;
    public static final int MAX_LINE_LENGTH = 64 * 1024;

    private final InputStream in;

    public RespReader(InputStream in) {
        this.in = in;
    }

    /**
     * Read the next command.
     *
     * @return the argument vector (empty for a blank inline line), or null at
     *         end of stream between commands
     * @throws EOFException      if the stream ends in the middle of a command
     * @throws ProtocolException if the framing is malformed
     * @throws IOException       on read failure
     */
    public List<String> readCommand() throws IOException {
        int first = in.read();
        if (first == -1) {
            return null;
        }
        if (first != '*') {
            return splitInline(readLine(first));
        }

        int count = parseLength(readLine(-1), MAX_ARRAY_LENGTH, "multibulk");
        if (count <= 0) {
            return Collections.emptyList();
        }
        List<String> argv = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int prefix = readByte();
            if (prefix != '$') {
                throw new ProtocolException("expected '$', got '" + (char) prefix + "'");
            }
            int len = parseLength(readLine(-1), MAX_BULK_LENGTH, "bulk");
            if (len < 0) {
                throw new ProtocolException("invalid bulk length");
            }
            argv.add(readBulkPayload(len));
        }
        return argv;
    }

    /**
     * Read one reply of any RESP2 type.
     *
     * @throws EOFException      if the stream ends before a complete reply
     * @throws ProtocolException if the framing is malformed
     */
    public Reply readReply() throws IOException {
        int prefix = readByte();
        switch (prefix) {
            case '+':
                return Reply.simple(readLine(-1));
            case '-':
                return Reply.error(readLine(-1));
            case ':':
                return Reply.integer(parseLong(readLine(-1)));
            case '$': {
                int len = parseLength(readLine(-1), MAX_BULK_LENGTH, "bulk");
                return len < 0 ? Reply.nil() : Reply.bulk(readBulkPayload(len));
            }
            case '*': {
                int count = parseLength(readLine(-1), MAX_ARRAY_LENGTH, "multibulk");
                if (count < 0) {
                    return Reply.nil();
                }
                List<Reply> elements = new ArrayList<>(count);
                for (int i = 0; i < count; i++) {
                    elements.add(readReply());
                }
                return Reply.array(elements);
            }
            default:
                throw new ProtocolException("unknown reply type '" + (char) prefix + "'");
        }
    }

    private String readBulkPayload(int len) throws IOException {
        byte[] data = in.readNBytes(len);
        if (data.length < len) {
            throw new EOFException("connection closed inside bulk string");
        }
        if (readByte() != '\r' || readByte() != '\n') {
            throw new ProtocolException("bulk string missing CRLF tail");
        }
        return new String(data, StandardCharsets.UTF_8);
    }

    /**
     * Read up to CRLF (a bare LF is tolerated for inline commands).
     *
     * @param first an already consumed first byte, or -1
     */
    private String readLine(int first) throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream(64);
        int b = first >= 0 ? first : readByte();
        while (b != '\n') {
            if (line.size() >= MAX_LINE_LENGTH) {
                throw new ProtocolException("line too long");
            }
            line.write(b);
            b = readByte();
        }
        byte[] bytes = line.toByteArray();
        int len = bytes.length;
        if (len > 0 && bytes[len - 1] == '\r') {
            len--;
        }
        return new String(bytes, 0, len, StandardCharsets.UTF_8);
    }

    private int readByte() throws IOException {
        int b = in.read();
        if (b == -1) {
            throw new EOFException("connection closed mid-frame");
        }
        return b;
    }

    private static int parseLength(String line, int max, String what) {
        long value = parseLong(line);
        if (value > max) {
            throw new ProtocolException("invalid " + what + " length " + value);
        }
        return (int) Math.max(value, -1);
    }

    private static long parseLong(String line) {
        try {
            return Long.parseLong(line.trim());
        } catch (NumberFormatException e) {
            throw new ProtocolException("invalid integer '" + line + "'", e);
        }
    }

    private static List<String> splitInline(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> argv = new ArrayList<>();
        for (String word : trimmed.split("\\s+")) {
            argv.add(word);
        }
        return argv;
    }
}
