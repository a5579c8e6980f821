// file: storage/src/main/java/io/boardsync/storage/FileWal.java
package io.boardsync.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;

/**
 * File-backed WAL writing framed records into numbered segment files
 * ("00000001.log", "00000002.log", ...).
 * <p>
 *  - On construction it opens the newest segment for append, or creates the first one.
 *  - append() writes and calls force(true).
 *  - rotateIfNeeded() starts the next segment once {@code rotateBytes} were written.
 *  - The reader walks every segment in order and stops for good at the first
 *    truncated header, truncated payload or CRC mismatch.
 */
public class FileWal implements Wal {
    private static final String SUFFIX = ".log";

    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment = 0;

    public FileWal(Path dir, long rotateBytes) {
        if (rotateBytes <= 0) throw new IllegalArgumentException("rotateBytes must be > 0");
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new UncheckedIOException(e); }
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
            throw new UncheckedIOException("WAL append failed", e);
        }
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        try {
            ch.close();
            int index = Integer.parseInt(current.getFileName().toString().replace(SUFFIX, ""));
            current = dir.resolve(segmentName(index + 1));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    @Override
    public WalReader openReader() { return new Reader(segments(dir)); }

    @Override
    public synchronized void close() throws IOException { if (ch != null) ch.close(); }

    /** Segment files currently on disk, oldest first. */
    static List<Path> segments(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(SUFFIX))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    static String segmentName(int index) {
        return String.format("%08d%s", index, SUFFIX);
    }

    private void openNewestOrCreate() {
        try {
            List<Path> existing = segments(dir);
            current = existing.isEmpty() ? dir.resolve(segmentName(1)) : existing.get(existing.size() - 1);
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = ch.size();
            ch.position(writtenInSegment);
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    private static final class Reader implements WalReader {
        private final List<Path> segments;
        private int segmentIndex = -1;
        private FileChannel ch;
        private long pos;
        private boolean done;

        Reader(List<Path> segments) {
            this.segments = segments;
        }

        @Override
        public byte[] next() {
            if (done) return null;
            try {
                while (true) {
                    if (ch == null && !openNextSegment()) {
                        done = true;
                        return null;
                    }
                    if (pos >= ch.size()) {
                        ch.close();
                        ch = null;
                        continue;
                    }
                    byte[] payload = readRecord();
                    if (payload == null) {
                        // torn or corrupt record: nothing after it is trusted
                        done = true;
                        return null;
                    }
                    return payload;
                }
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        private boolean openNextSegment() throws IOException {
            segmentIndex++;
            if (segmentIndex >= segments.size()) return false;
            ch = FileChannel.open(segments.get(segmentIndex), READ);
            pos = 0;
            return true;
        }

        private byte[] readRecord() throws IOException {
            ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
            int read = ch.read(hdr, pos);
            if (read < RecordCodec.HEADER_BYTES) return null;
            hdr.flip();
            short magic = hdr.getShort();
            byte ver = hdr.get();
            int len = hdr.getInt();
            int crc = hdr.getInt();
            if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) return null;
            ByteBuffer payload = ByteBuffer.allocate(len);
            int r2 = ch.read(payload, pos + RecordCodec.HEADER_BYTES);
            if (r2 < len) return null;
            byte[] bytes = payload.array();
            if (RecordCodec.crc32(bytes) != crc) return null;
            pos += RecordCodec.HEADER_BYTES + (long) len;
            return bytes;
        }

        @Override
        public void close() throws IOException {
            if (ch != null) ch.close();
        }
    }
}
