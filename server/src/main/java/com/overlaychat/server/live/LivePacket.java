package com.overlaychat.server.live;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * Binary framing of the live danmaku WebSocket.
 * <pre>
 * | packet length (4) | header length (2) | version (2) | operation (4) | sequence (4) | body |
 * </pre>
 * All integers big-endian. Version 2 bodies are zlib streams holding further packets.
 */
public record LivePacket(int version, int operation, byte[] body) {

    public static final int HEADER_LENGTH = 16;

    public static final int OP_HEARTBEAT = 2;
    public static final int OP_HEARTBEAT_REPLY = 3;
    public static final int OP_SEND_MSG_REPLY = 5;
    public static final int OP_AUTH = 7;
    public static final int OP_AUTH_REPLY = 8;

    public static final int VER_NORMAL = 0;
    public static final int VER_HEARTBEAT = 1;
    public static final int VER_DEFLATE = 2;

    public String bodyText() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public static byte[] encode(int operation, String body) {
        byte[] payload = body.getBytes(StandardCharsets.UTF_8);
        ByteBuffer buf = ByteBuffer.allocate(HEADER_LENGTH + payload.length);
        buf.putInt(HEADER_LENGTH + payload.length);
        buf.putShort((short) HEADER_LENGTH);
        buf.putShort((short) VER_HEARTBEAT);
        buf.putInt(operation);
        buf.putInt(1);
        buf.put(payload);
        return buf.array();
    }

    /**
     * Splits a frame into packets, expanding compressed batches.
     */
    public static List<LivePacket> decode(byte[] frame) throws IOException {
        List<LivePacket> out = new ArrayList<>();
        decodeInto(frame, out);
        return out;
    }

    private static void decodeInto(byte[] data, List<LivePacket> out) throws IOException {
        ByteBuffer buf = ByteBuffer.wrap(data);
        while (buf.remaining() >= HEADER_LENGTH) {
            int start = buf.position();
            int packetLength = buf.getInt();
            int headerLength = buf.getShort() & 0xFFFF;
            int version = buf.getShort() & 0xFFFF;
            int operation = buf.getInt();
            buf.getInt(); // sequence

            if (packetLength < headerLength || headerLength < HEADER_LENGTH || start + packetLength > data.length) {
                throw new IOException("malformed packet: length=" + packetLength + " header=" + headerLength
                        + " available=" + (data.length - start));
            }
            byte[] body = new byte[packetLength - headerLength];
            buf.position(start + headerLength);
            buf.get(body);

            if (version == VER_DEFLATE && operation == OP_SEND_MSG_REPLY) {
                decodeInto(inflate(body), out);
            } else {
                out.add(new LivePacket(version, operation, body));
            }
        }
    }

    static byte[] inflate(byte[] compressed) throws IOException {
        Inflater inflater = new Inflater();
        inflater.setInput(compressed);
        ByteArrayOutputStream out = new ByteArrayOutputStream(compressed.length * 4);
        byte[] chunk = new byte[4096];
        try {
            while (!inflater.finished()) {
                int n = inflater.inflate(chunk);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new IOException("truncated zlib body");
                }
                out.write(chunk, 0, n);
            }
        } catch (DataFormatException e) {
            throw new IOException("bad zlib body", e);
        } finally {
            inflater.end();
        }
        return out.toByteArray();
    }
}
