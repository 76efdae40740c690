// file: storage/src/test/java/io/hslite/storage/FileWalTornTailTest.java
package io.hslite.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static java.nio.file.StandardOpenOption.APPEND;
import static org.junit.jupiter.api.Assertions.*;

class FileWalTornTailTest {

    @TempDir Path walDir;

    private static byte[] cursor(long pos) {
        return RecordCodec.encode(new LogRecord.Cursor("DEV", "!r:a.test", pos));
    }

    private static List<Long> replay(Wal wal) {
        List<Long> out = new ArrayList<>();
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] p; (p = r.next()) != null; ) {
                out.add(((LogRecord.Cursor) RecordCodec.decode(p)).streamPos());
            }
        }
        return out;
    }

    @Test
    void replay_ignores_truncated_tail_and_applies_all_prior_records() {
        var wal = new FileWal(walDir, 1L << 60);
        wal.append(cursor(1));
        wal.append(cursor(2));
        wal.close();

        // third record only partially written: crash mid-append
        byte[] r3 = cursor(3);
        Path seg = walDir.resolve("00000001.log");
        try (OutputStream out = Files.newOutputStream(seg, APPEND)) {
            out.write(r3, 0, r3.length - 5);
        } catch (Exception e) {
            fail(e);
        }

        var reopened = new FileWal(walDir, 1L << 60);
        assertEquals(List.of(1L, 2L), replay(reopened));
    }

    @Test
    void writes_after_a_torn_tail_land_in_a_new_segment_and_are_replayed() throws Exception {
        var wal = new FileWal(walDir, 1L << 60);
        wal.append(cursor(1));
        wal.close();
        try (OutputStream out = Files.newOutputStream(walDir.resolve("00000001.log"), APPEND)) {
            out.write(new byte[]{0x58, 0x4D, 1, 9});
        }

        var reopened = new FileWal(walDir, 1L << 60);
        reopened.append(cursor(2));
        assertTrue(Files.exists(walDir.resolve("00000002.log")));
        assertEquals(List.of(1L, 2L), replay(reopened));
    }

    @Test
    void corrupted_payload_is_detected_by_crc() throws Exception {
        var wal = new FileWal(walDir, 1L << 60);
        wal.append(cursor(1));
        wal.append(cursor(2));
        wal.close();

        Path seg = walDir.resolve("00000001.log");
        byte[] bytes = Files.readAllBytes(seg);
        bytes[bytes.length - 1] ^= 0x7F;   // flip bits in the last payload byte
        Files.write(seg, bytes);

        assertEquals(List.of(1L), replay(new FileWal(walDir, 1L << 60)));
    }

    @Test
    void rotation_and_segment_deletion_keep_replay_in_order() {
        var wal = new FileWal(walDir, 1);   // rotate after every record
        for (long i = 1; i <= 4; i++) {
            wal.append(cursor(i));
            wal.rotateIfNeeded();
        }
        assertEquals(List.of(1L, 2L, 3L, 4L), replay(wal));

        wal.deleteSegmentsBefore("00000003.log");
        assertEquals(List.of(3L, 4L), replay(wal));
    }
}
