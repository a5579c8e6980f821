// file: storage/src/main/java/io/boardsync/storage/RecordCodec.java
package io.boardsync.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.boardsync.core.WhiteboardObject;
import io.boardsync.storage.json.ObjectJson;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * Binary framing for WAL records.
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0xD17E
 *     - version (1B)  = 2
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD]
 *     - opId:   int32 len + UTF-8 bytes
 *     - op:     byte (0 = UPSERT, 1 = DELETE)
 *     - object: int32 len + UTF-8 JSON (ObjectDto)
 * <p>
 * Records carry the post-write state of the object (the deleted state for DELETE),
 * so replaying a record twice is harmless.
 */
final class RecordCodec {
    static final short MAGIC = (short) 0xD17E;
    static final byte VERSION = 2;
    static final int HEADER_BYTES = 2 + 1 + 4 + 4;

    private static final ObjectMapper JSON = ObjectJson.newMapper();

    enum Op { UPSERT, DELETE }

    record LogRecord(String opId, Op op, WhiteboardObject object) {}

    static byte[] encode(String opId, Op op, WhiteboardObject object) {
        byte[] payload = encodePayload(opId, op, object);
        ByteBuffer out = ByteBuffer.allocate(HEADER_BYTES + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        out.put(payload);
        return out.array();
    }

    /** Decode a payload (header already stripped and verified). */
    static LogRecord decode(byte[] payload) {
        ByteBuffer b = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        String opId = new String(readBytes(b), StandardCharsets.UTF_8);
        Op op = Op.values()[b.get()];
        byte[] json = readBytes(b);
        try {
            return new LogRecord(opId, op, JSON.readValue(json, WhiteboardObject.class));
        } catch (IOException e) {
            throw new UncheckedIOException("corrupt WAL payload for op " + opId, e);
        }
    }

    private static byte[] encodePayload(String opId, Op op, WhiteboardObject object) {
        byte[] sOp = opId.getBytes(StandardCharsets.UTF_8);
        byte[] json;
        try {
            json = JSON.writeValueAsBytes(object);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("object not serializable: " + object.id(), e);
        }
        ByteBuffer b = ByteBuffer.allocate(4 + sOp.length + 1 + 4 + json.length).order(ByteOrder.LITTLE_ENDIAN);
        b.putInt(sOp.length).put(sOp);
        b.put((byte) op.ordinal());
        b.putInt(json.length).put(json);
        return b.array();
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }

    private static byte[] readBytes(ByteBuffer b) {
        int len = b.getInt();
        byte[] out = new byte[len];
        b.get(out);
        return out;
    }
}
