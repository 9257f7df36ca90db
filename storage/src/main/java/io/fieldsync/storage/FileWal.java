package io.fieldsync.storage;

import java.io.IOException;
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
 * File-backed WAL that appends header+payload records to segment files.
 * <p>
 * Properties:
 *  - On construction, it:
 *      - creates the directory if needed,
 *      - finds the newest segment (e.g. "00000001.log", "00000002.log", ...),
 *      - cuts off a torn tail left by a crash mid-append,
 *      - opens it for append.
 * <p>
 *  - append():
 *      - writes the bytes,
 *      - calls force(true) to fsync data and metadata,
 *      - tracks bytes written this segment,
 *      - on failure cuts the segment back to where the record started.
 * <p>
 *  - rotateIfNeeded():
 *      - when written bytes >= rotateBytes, closes current segment and opens
 *        a new one with incremented index, resetting the counter.
 * <p>
 *  - Reader:
 *      - walks all segments in index order,
 *      - reads fixed-size header (11 bytes),
 *      - validates magic/version/length,
 *      - reads payload, validates CRC,
 *      - stops at the first truncated header/payload or bad CRC.
 */
public class FileWal implements Wal {
    private static final Logger log = Logger.getLogger(FileWal.class.getName());

    private final Path dir;
    private final long rotateBytes;
    private final SegmentOpener opener;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment = 0;
    private IOException broken;

    /** Opens a segment file for reading and appending. */
    interface SegmentOpener {
        FileChannel open(Path segment) throws IOException;
    }

    public FileWal(Path dir, long rotateBytes) {
        this(dir, rotateBytes, segment -> FileChannel.open(segment, CREATE, WRITE, READ));
    }

    FileWal(Path dir, long rotateBytes, SegmentOpener opener) {
        if (rotateBytes <= 0) throw new IllegalArgumentException("rotateBytes must be > 0");
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        this.opener = opener;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageException("cannot create WAL directory " + dir, e);
        }
        openNewestOrCreate();
    }

    @Override
    public synchronized void append(byte[] serializedRecord) {
        if (broken != null) {
            throw new StorageException("WAL " + current.getFileName() + " refuses appends after a failed rollback", broken);
        }
        long start = -1;
        try {
            start = ch.position();
            ByteBuffer buf = ByteBuffer.wrap(serializedRecord);
            while (buf.hasRemaining()) ch.write(buf);
            ch.force(true); // fsync: metadata too, so new file appears durable after rotation
            writtenInSegment += serializedRecord.length;
        } catch (IOException e) {
            if (start >= 0) rollBack(start, e);
            throw new StorageException("WAL append failed", e);
        }
    }

    /**
     * Cut a failed append back to where it started, so the next record lands
     * right after the last good one. If even that fails the WAL stops taking appends:
     * a record written past the garbage would be dropped as torn tail on reopen.
     */
    private void rollBack(long start, IOException cause) {
        try {
            ch.truncate(start);
            ch.position(start);
        } catch (IOException e) {
            cause.addSuppressed(e);
            broken = cause;
            log.severe(String.format("WAL %s: cannot cut failed append back to offset %d, no further appends",
                    current.getFileName(), start));
        }
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        openNext();
    }

    @Override
    public synchronized void compact() {
        openNext();
        try {
            for (Path seg : segments(dir)) {
                if (!seg.equals(current)) Files.deleteIfExists(seg);
            }
        } catch (IOException e) {
            throw new StorageException("WAL compaction failed in " + dir, e);
        }
    }

    @Override
    public WalReader openReader() { return new Reader(segments(dir)); }

    @Override
    public synchronized void close() {
        try {
            if (ch != null) ch.close();
        } catch (IOException e) {
            throw new StorageException("WAL close failed", e);
        }
    }

    /** Current segment file, for tests and diagnostics. */
    Path currentSegment() { return current; }

    // The new segment is opened before the old one is closed, so a failed
    // rotation leaves the WAL appending to the segment it had.
    private void openNext() {
        Path next = dir.resolve(segmentName(segmentIndex(current) + 1));
        FileChannel old = ch;
        try {
            ch = opener.open(next);
        } catch (IOException e) {
            throw new StorageException("WAL rotation failed: cannot open " + next, e);
        }
        current = next;
        writtenInSegment = 0;
        try {
            old.close();
        } catch (IOException e) {
            throw new StorageException("WAL rotation failed: cannot close previous segment", e);
        }
    }

    /**
     * On startup:
     *  - If there are existing segments, open the newest one, drop any torn tail
     *    and position at the end of the last valid record.
     *  - If none, create "00000001.log".
     */
    private void openNewestOrCreate() {
        List<Path> existing = segments(dir);
        current = existing.isEmpty() ? dir.resolve(segmentName(1)) : existing.get(existing.size() - 1);
        try {
            ch = opener.open(current);
            long valid = 0;
            for (byte[] payload; (payload = readRecord(ch, valid)) != null; ) {
                valid += RecordCodec.HEADER_BYTES + payload.length;
            }
            if (valid < ch.size()) {
                log.warning(String.format("WAL %s: dropping %d bytes of torn tail",
                        current.getFileName(), ch.size() - valid));
                ch.truncate(valid);
                ch.force(true);
            }
            writtenInSegment = valid;
            ch.position(valid);
        } catch (IOException e) {
            throw new StorageException("cannot open WAL segment " + current, e);
        }
    }

    private static List<Path> segments(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> p.getFileName().toString().endsWith(".log"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new StorageException("cannot list WAL directory " + dir, e);
        }
    }

    private static String segmentName(int index) {
        return String.format("%08d.log", index);
    }

    private static int segmentIndex(Path segment) {
        return Integer.parseInt(segment.getFileName().toString().replace(".log", ""));
    }

    /**
     * Read one framed record starting at {@code pos}.
     *
     * @return payload bytes, or null at EOF or on a truncated/corrupt record
     */
    private static byte[] readRecord(FileChannel ch, long pos) throws IOException {
        ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        while (hdr.hasRemaining()) {
            int n = ch.read(hdr, pos + hdr.position());
            if (n <= 0) break;
        }
        if (hdr.position() < RecordCodec.HEADER_BYTES) return null; // EOF or truncated header
        hdr.flip();
        short magic = hdr.getShort();
        byte ver = hdr.get();
        int len = hdr.getInt();
        int crc = hdr.getInt();
        if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) return null;
        if (pos + RecordCodec.HEADER_BYTES + len > ch.size()) return null; // truncated payload
        ByteBuffer payload = ByteBuffer.allocate(len);
        while (payload.hasRemaining()) {
            int n = ch.read(payload, pos + RecordCodec.HEADER_BYTES + payload.position());
            if (n <= 0) return null;
        }
        byte[] bytes = payload.array();
        if (RecordCodec.crc32(bytes) != crc) return null; // bad tail
        return bytes;
    }

    /**
     * Sequential reader for WAL segments used during recovery.
     */
    private static final class Reader implements WalReader {
        private final List<Path> segments;
        private int segment = -1;
        private FileChannel ch;
        private long pos;
        private boolean stopped;

        Reader(List<Path> segments) {
            this.segments = segments;
        }

        @Override
        public byte[] next() {
            if (stopped) return null;
            try {
                while (true) {
                    if (ch == null) {
                        if (++segment >= segments.size()) return null;
                        ch = FileChannel.open(segments.get(segment), READ);
                        pos = 0;
                    }
                    byte[] bytes = readRecord(ch, pos);
                    if (bytes != null) {
                        pos += RecordCodec.HEADER_BYTES + bytes.length;
                        return bytes;
                    }
                    boolean cleanEnd = pos == ch.size();
                    ch.close();
                    ch = null;
                    if (!cleanEnd) {
                        // Anything after a damaged record is unreachable.
                        stopped = true;
                        return null;
                    }
                }
            } catch (IOException e) {
                throw new StorageException("WAL read failed", e);
            }
        }

        @Override
        public void close() {
            try {
                if (ch != null) ch.close();
            } catch (IOException e) {
                throw new StorageException("WAL reader close failed", e);
            }
        }
    }
}
