// file: storage/src/main/java/io/boardsync/storage/Snapshotter.java
package io.boardsync.storage;

import io.boardsync.core.WhiteboardObject;

import java.util.Collection;
import java.util.List;

/**
 * Full copies of the repository contents, to bound WAL replay on restart:
 * load the latest snapshot, then replay the WAL on top of it.
 */
public interface Snapshotter {

    /** @return snapshot identifier (file name) */
    String writeSnapshot(Collection<WhiteboardObject> objects);

    /** Latest snapshot, or null when none was written yet. */
    LoadedSnapshot loadLatest();

    record LoadedSnapshot(String id, List<WhiteboardObject> objects) {}
}
