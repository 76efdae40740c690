// file: storage/src/main/java/io/hslite/storage/RecordCodec.java
package io.hslite.storage;

import io.hslite.core.RoomEvent;
import io.hslite.core.StateKey;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.CRC32;

/**
 * Binary framing for WAL records and snapshot entries.
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0x4D58
 *     - version (1B)  = 1
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD]
 *     - kind: byte (1 admission, 2 cursor, 3 gap, 4 heads)
 *     - admission: event (int32 len + canonical JSON), streamPos int64,
 *       rejection str?, stateBase str?, stateDelta map, extremities list?, currentDelta map
 *     - cursor:    device str, room str, streamPos int64
 *     - gap:       room str, open byte, ids list
 *     - heads:     room str, ids list
 *   where str = int32 len + UTF-8 (len -1 => null), list = int32 count (-1 => null) + str*,
 *   map = int32 count + (type str, state_key str, event id str?)*.
 */
final class RecordCodec {
    static final short MAGIC = (short) 0x4D58;
    static final byte VERSION = 1;
    static final int HEADER_BYTES = 11;

    private static final byte ADMISSION = 1;
    private static final byte CURSOR = 2;
    private static final byte GAP = 3;
    private static final byte HEADS = 4;

    private RecordCodec() {
    }

    /** Encode a record as header+payload, ready for {@link Wal#append}. */
    static byte[] encode(LogRecord record) {
        return frame(encodePayload(record));
    }

    static byte[] frame(byte[] payload) {
        ByteBuffer out = ByteBuffer.allocate(HEADER_BYTES + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        out.put(payload);
        return out.array();
    }

    static byte[] encodePayload(LogRecord record) {
        Writer w = new Writer();
        if (record instanceof LogRecord.Admission a) {
            w.b(ADMISSION);
            w.bytes(a.event().toCanonicalBytes());
            w.i64(a.streamPos());
            w.str(a.rejection());
            w.str(a.stateBase());
            w.map(a.stateDelta());
            w.list(a.extremities());
            w.map(a.currentDelta());
        } else if (record instanceof LogRecord.Cursor c) {
            w.b(CURSOR);
            w.str(c.deviceId());
            w.str(c.roomId());
            w.i64(c.streamPos());
        } else if (record instanceof LogRecord.Gap g) {
            w.b(GAP);
            w.str(g.roomId());
            w.b((byte) (g.open() ? 1 : 0));
            w.list(g.eventIds());
        } else if (record instanceof LogRecord.Heads h) {
            w.b(HEADS);
            w.str(h.roomId());
            w.list(h.extremities());
        } else {
            throw new IllegalArgumentException("Unknown record type: " + record);
        }
        return w.toBytes();
    }

    /** Decode a payload (header already stripped and verified). */
    static LogRecord decode(byte[] payload) {
        ByteBuffer b = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        byte kind = b.get();
        switch (kind) {
            case ADMISSION: {
                RoomEvent event = RoomEvent.fromBytes(readBytes(b));
                long pos = b.getLong();
                String rejection = readString(b);
                String base = readString(b);
                Map<StateKey, String> delta = readMap(b);
                List<String> extremities = readList(b);
                Map<StateKey, String> current = readMap(b);
                return new LogRecord.Admission(event, pos, rejection, base, delta, extremities, current);
            }
            case CURSOR:
                return new LogRecord.Cursor(readString(b), readString(b), b.getLong());
            case GAP: {
                String room = readString(b);
                boolean open = b.get() != 0;
                return new LogRecord.Gap(room, readList(b), open);
            }
            case HEADS:
                return new LogRecord.Heads(readString(b), readList(b));
            default:
                throw new IllegalStateException("Unknown record kind " + kind);
        }
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }

    // ----------------- helpers -----------------

    /** Growable little-endian buffer. */
    private static final class Writer {
        private ByteBuffer buf = ByteBuffer.allocate(512).order(ByteOrder.LITTLE_ENDIAN);

        private void ensure(int n) {
            if (buf.remaining() >= n) return;
            ByteBuffer bigger = ByteBuffer.allocate(Math.max(buf.capacity() * 2, buf.position() + n))
                    .order(ByteOrder.LITTLE_ENDIAN);
            buf.flip();
            bigger.put(buf);
            buf = bigger;
        }

        void b(byte v) { ensure(1); buf.put(v); }

        void i32(int v) { ensure(4); buf.putInt(v); }

        void i64(long v) { ensure(8); buf.putLong(v); }

        void bytes(byte[] data) {
            if (data == null) { i32(-1); return; }
            ensure(4 + data.length);
            buf.putInt(data.length).put(data);
        }

        void str(String s) {
            bytes(s == null ? null : s.getBytes(StandardCharsets.UTF_8));
        }

        void list(List<String> ids) {
            if (ids == null) { i32(-1); return; }
            i32(ids.size());
            ids.forEach(this::str);
        }

        void map(Map<StateKey, String> m) {
            if (m == null) { i32(0); return; }
            i32(m.size());
            for (Map.Entry<StateKey, String> e : m.entrySet()) {
                str(e.getKey().type());
                str(e.getKey().stateKey());
                str(e.getValue());
            }
        }

        byte[] toBytes() {
            byte[] out = new byte[buf.position()];
            buf.flip();
            buf.get(out);
            return out;
        }
    }

    private static byte[] readBytes(ByteBuffer b) {
        int len = b.getInt();
        if (len == -1) return null;
        byte[] out = new byte[len];
        b.get(out);
        return out;
    }

    private static String readString(ByteBuffer b) {
        byte[] s = readBytes(b);
        return s == null ? null : new String(s, StandardCharsets.UTF_8);
    }

    private static List<String> readList(ByteBuffer b) {
        int n = b.getInt();
        if (n == -1) return null;
        List<String> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) out.add(readString(b));
        return out;
    }

    private static Map<StateKey, String> readMap(ByteBuffer b) {
        int n = b.getInt();
        Map<StateKey, String> out = new LinkedHashMap<>(Math.max(16, n * 2));
        for (int i = 0; i < n; i++) {
            String type = readString(b);
            String key = readString(b);
            out.put(new StateKey(type, key), readString(b));
        }
        return out;
    }
}
