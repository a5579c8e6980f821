// file: core/src/main/java/io/boardsync/core/ObjectUpdate.java
package io.boardsync.core;

import java.util.Objects;

/** One element of a batch update: which object, and what changes. */
public record ObjectUpdate(String id, ObjectPatch patch) {
    public ObjectUpdate {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(patch, "patch");
    }
}
