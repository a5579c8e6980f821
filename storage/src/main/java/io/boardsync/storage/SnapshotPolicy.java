// file: storage/src/main/java/io/boardsync/storage/SnapshotPolicy.java
package io.boardsync.storage;

import io.boardsync.core.WhiteboardObject;

import java.util.Collection;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Takes a full snapshot after every N durable writes, which bounds how much WAL
 * a restart has to replay.
 */
public final class SnapshotPolicy {
    private final int everyOps;
    private final AtomicInteger sinceLast = new AtomicInteger();

    public SnapshotPolicy(int everyOps) {
        if (everyOps <= 0) throw new IllegalArgumentException("everyOps must be > 0");
        this.everyOps = everyOps;
    }

    /** Call after each durable write. The supplier is only invoked when a snapshot is due. */
    public boolean maybeSnapshot(Supplier<Collection<WhiteboardObject>> current, Snapshotter snaps) {
        if (sinceLast.incrementAndGet() >= everyOps) {
            snaps.writeSnapshot(current.get());
            sinceLast.set(0);
            return true;
        }
        return false;
    }
}
