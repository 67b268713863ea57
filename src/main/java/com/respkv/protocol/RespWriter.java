package com.respkv.protocol;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * RESP2 encoder over an output stream.
 * Nothing reaches the peer until {@link #flush()}.
 */
public class RespWriter {

    private static final byte[] CRLF = {'\r', '\n'};
    private static final byte[] NIL = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);

    private final OutputStream out;

    public RespWriter(OutputStream out) {
        this.out = out;
    }

    /**
     * Encode a reply.
     */
    public void write(Reply reply) throws IOException {
        switch (reply.getType()) {
            case SIMPLE_STRING:
                writeLine('+', singleLine(reply.getText()));
                break;
            case ERROR:
                writeLine('-', singleLine(reply.getText()));
                break;
            case INTEGER:
                writeLine(':', Long.toString(reply.getInteger()));
                break;
            case BULK_STRING:
                writeBulk(reply.getText());
                break;
            case NIL:
                out.write(NIL);
                break;
            case ARRAY:
                List<Reply> elements = reply.getElements();
                writeLine('*', Integer.toString(elements.size()));
                for (Reply element : elements) {
                    write(element);
                }
                break;
            default:
                throw new IllegalArgumentException("Unknown reply type: " + reply.getType());
        }
    }

    /**
     * Encode a command as an array of bulk strings, as clients send it.
     */
    public void writeCommand(List<String> argv) throws IOException {
        writeLine('*', Integer.toString(argv.size()));
        for (String arg : argv) {
            writeBulk(arg);
        }
    }

    public void flush() throws IOException {
        out.flush();
    }

    /**
     * Encode a single reply to bytes.
     */
    public static byte[] encode(Reply reply) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try {
            new RespWriter(buffer).write(reply);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return buffer.toByteArray();
    }

    private void writeBulk(String value) throws IOException {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        writeLine('$', Integer.toString(bytes.length));
        out.write(bytes);
        out.write(CRLF);
    }

    private void writeLine(char prefix, String line) throws IOException {
        out.write(prefix);
        out.write(line.getBytes(StandardCharsets.UTF_8));
        out.write(CRLF);
    }

    private static String singleLine(String text) {
        return text.replace('\r', ' ').replace('\n', ' ');
    }
}
