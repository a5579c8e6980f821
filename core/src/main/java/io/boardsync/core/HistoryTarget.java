// file: core/src/main/java/io/boardsync/core/HistoryTarget.java
package io.boardsync.core;

/**
 * Where undo and redo write. Implementations must not record history themselves.
 */
public interface HistoryTarget {

    /** Add the object, replacing any copy with the same id. */
    void put(WhiteboardObject object);

    void remove(String id);

    /** Apply the patch if the object exists; otherwise do nothing. */
    void patch(String id, ObjectPatch patch);
}
