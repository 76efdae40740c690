// file: storage/src/main/java/io/hslite/storage/FileSnapshotter.java
package io.hslite.storage;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * One file per snapshot, named after the WAL segment it hands over to:
 * "snapshot-00000007.bin" covers everything before segment "00000007.log".
 * <p>
 * Format:
 *   int32 magic, int32 walSegment length + UTF-8, int32 count,
 *   then count times: int32 len + record payload (see {@link RecordCodec}), int32 crc32.
 * <p>
 * Atomicity: written to "*.tmp", then moved into place with ATOMIC_MOVE. Older
 * snapshots are deleted once the new one is in place.
 */
public final class FileSnapshotter implements Snapshotter {
    private static final int MAGIC = 0x4D58534E;

    private final Path dir;

    public FileSnapshotter(Path dir) {
        this.dir = dir;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create snapshot directory " + dir, e);
        }
    }

    @Override
    public String writeSnapshot(String walSegment, List<LogRecord> records) {
        String name = "snapshot-" + walSegment.replace(".log", "") + ".bin";
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        try (var out = new DataOutputStream(Files.newOutputStream(tmp,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING))) {
            out.writeInt(MAGIC);
            writeString(out, walSegment);
            out.writeInt(records.size());
            for (LogRecord r : records) {
                byte[] payload = RecordCodec.encodePayload(r);
                out.writeInt(payload.length);
                out.write(payload);
                out.writeInt(RecordCodec.crc32(payload));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Snapshot write failed: " + tmp, e);
        }

        try {
            Files.move(tmp, dst, ATOMIC_MOVE);
            for (Path old : snapshots()) {
                if (old.getFileName().toString().compareTo(name) < 0) {
                    Files.deleteIfExists(old);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Snapshot install failed: " + dst, e);
        }
        return name;
    }

    @Override
    public LoadedSnapshot loadLatest() {
        List<Path> all = snapshots();
        if (all.isEmpty()) return null;
        Path snap = all.get(all.size() - 1);

        try (var in = new DataInputStream(Files.newInputStream(snap))) {
            if (in.readInt() != MAGIC) {
                throw new IllegalStateException("Not a snapshot file: " + snap);
            }
            String walSegment = readString(in);
            int count = in.readInt();
            List<LogRecord> records = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                byte[] payload = in.readNBytes(in.readInt());
                if (RecordCodec.crc32(payload) != in.readInt()) {
                    throw new IllegalStateException("Corrupt snapshot " + snap + " at record " + i);
                }
                records.add(RecordCodec.decode(payload));
            }
            return new LoadedSnapshot(snap.getFileName().toString(), walSegment, records);
        } catch (IOException e) {
            throw new UncheckedIOException("Snapshot read failed: " + snap, e);
        }
    }

    private List<Path> snapshots() {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> {
                        String n = p.getFileName().toString();
                        return n.startsWith("snapshot-") && n.endsWith(".bin");
                    })
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list snapshots in " + dir, e);
        }
    }

    private static void writeString(DataOutputStream out, String s) throws IOException {
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        out.writeInt(b.length);
        out.write(b);
    }

    private static String readString(DataInputStream in) throws IOException {
        int len = in.readInt();
        return new String(in.readNBytes(len), StandardCharsets.UTF_8);
    }
}
