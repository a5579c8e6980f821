// file: storage/src/main/java/io/boardsync/storage/Wal.java
package io.boardsync.storage;

/**
 * Write-ahead log of object writes.
 * <p>
 * Contract:
 *  - append() is atomic per record: a partially written record is treated as
 *    absent during recovery (the reader stops at the first corrupt or truncated one).
 *  - append() fsyncs before returning.
 */
public interface Wal extends AutoCloseable {

    /** Append one framed record (see {@link RecordCodec#encode}) and fsync it. */
    void append(byte[] serializedRecord);

    /** Start a new segment once the current one passes the size threshold. */
    void rotateIfNeeded();

    /**
     * Sequential reader over all segments, oldest first. Stops at the end of the
     * newest segment or at the first corrupt or truncated record.
     */
    WalReader openReader();

    interface WalReader extends AutoCloseable {

        /** @return next valid payload (header stripped), or null at the end */
        byte[] next();
    }
}
