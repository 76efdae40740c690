// file: storage/src/main/java/io/hslite/storage/FileWal.java
package io.hslite.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;

/**
 * File-backed WAL: segment files "00000001.log", "00000002.log", ... in one directory.
 * <p>
 *  - On construction a fresh segment is started after the newest non-empty one,
 *    so a torn write left by a crash is always the tail of a closed segment.
 *  - append() writes and calls force(true).
 *  - rotateIfNeeded() starts the next segment once the current one reaches rotateBytes.
 *  - The reader walks all segments in order; each record is an 11-byte header
 *    (magic, version, length, CRC32) followed by the payload. A bad record ends
 *    its segment; reading continues with the next one.
 */
public class FileWal implements Wal {
    private static final Logger log = Logger.getLogger(FileWal.class.getName());

    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment = 0;

    public FileWal(Path dir, long rotateBytes) {
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create WAL directory " + dir, e);
        }
        openNewestOrCreate();
    }

    @Override
    public synchronized void append(byte[] serializedRecord) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(serializedRecord);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true);
            writtenInSegment += serializedRecord.length;
        } catch (IOException e) {
            throw new UncheckedIOException("WAL append failed on " + current, e);
        }
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (writtenInSegment >= rotateBytes) {
            rotate();
        }
    }

    @Override
    public synchronized String rotate() {
        try {
            ch.close();
            int index = Integer.parseInt(current.getFileName().toString().replace(".log", ""));
            current = dir.resolve(segmentName(index + 1));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
            return current.getFileName().toString();
        } catch (IOException e) {
            throw new UncheckedIOException("WAL rotation failed in " + dir, e);
        }
    }

    @Override
    public synchronized void deleteSegmentsBefore(String segment) {
        for (Path p : segments(dir)) {
            if (p.getFileName().toString().compareTo(segment) < 0) {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    throw new UncheckedIOException("Cannot delete WAL segment " + p, e);
                }
            }
        }
    }

    @Override
    public WalReader openReader() {
        return new Reader(segments(dir));
    }

    @Override
    public synchronized void close() {
        try {
            if (ch != null) ch.close();
        } catch (IOException e) {
            throw new UncheckedIOException("WAL close failed", e);
        }
    }

    private void openNewestOrCreate() {
        List<Path> all = segments(dir);
        current = all.isEmpty() ? dir.resolve(segmentName(1)) : all.get(all.size() - 1);
        try {
            if (Files.exists(current) && Files.size(current) > 0) {
                int index = Integer.parseInt(current.getFileName().toString().replace(".log", ""));
                current = dir.resolve(segmentName(index + 1));
            }
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = ch.size();
            ch.position(writtenInSegment);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open WAL segment " + current, e);
        }
    }

    static String segmentName(int index) {
        return String.format("%08d.log", index);
    }

    private static List<Path> segments(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".log"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list WAL directory " + dir, e);
        }
    }

    /** Sequential reader across segments used during recovery. */
    private static final class Reader implements WalReader {
        private final List<Path> segments;
        private int segmentIndex = -1;
        private FileChannel ch;
        private long pos;

        Reader(List<Path> segments) {
            this.segments = segments;
        }

        @Override
        public byte[] next() {
            while (true) {
                if (ch == null && !openNextSegment()) {
                    return null;
                }
                try {
                    ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
                    int read = ch.read(hdr, pos);
                    if (read <= 0) {
                        closeSegment();  // clean end of this segment
                        continue;
                    }
                    if (read < RecordCodec.HEADER_BYTES) {
                        skipRest("truncated header");
                        continue;
                    }
                    hdr.flip();
                    short magic = hdr.getShort();
                    byte ver = hdr.get();
                    int len = hdr.getInt();
                    int crc = hdr.getInt();
                    if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) {
                        skipRest("bad header");
                        continue;
                    }
                    ByteBuffer payload = ByteBuffer.allocate(len);
                    int r2 = ch.read(payload, pos + RecordCodec.HEADER_BYTES);
                    if (r2 < len) {
                        skipRest("truncated payload");
                        continue;
                    }
                    byte[] bytes = payload.array();
                    if (RecordCodec.crc32(bytes) != crc) {
                        skipRest("crc mismatch");
                        continue;
                    }
                    pos += RecordCodec.HEADER_BYTES + (long) len;
                    return bytes;
                } catch (IOException e) {
                    throw new UncheckedIOException("WAL read failed in " + segments.get(segmentIndex), e);
                }
            }
        }

        private boolean openNextSegment() {
            segmentIndex++;
            if (segmentIndex >= segments.size()) {
                return false;
            }
            try {
                ch = FileChannel.open(segments.get(segmentIndex), READ);
                pos = 0;
                return true;
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot open WAL segment " + segments.get(segmentIndex), e);
            }
        }

        private void skipRest(String why) {
            log.warning("WAL replay skips rest of " + segments.get(segmentIndex).getFileName()
                    + " from offset " + pos + ": " + why);
            closeSegment();
        }

        private void closeSegment() {
            if (ch == null) return;
            try {
                ch.close();
            } catch (IOException e) {
                throw new UncheckedIOException("WAL close failed", e);
            }
            ch = null;
        }

        @Override
        public void close() {
            closeSegment();
        }
    }
}
