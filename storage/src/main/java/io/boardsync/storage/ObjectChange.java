// file: storage/src/main/java/io/boardsync/storage/ObjectChange.java
package io.boardsync.storage;

import io.boardsync.core.WhiteboardObject;

import java.util.Objects;

/**
 * One committed change, as published to change-feed subscribers.
 *
 * @param object post-state for INSERT and UPDATE, the deleted state for DELETE
 */
public record ObjectChange(Kind kind, WhiteboardObject object) {

    public enum Kind { INSERT, UPDATE, DELETE }

    public ObjectChange {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(object, "object");
    }

    public String boardId() {
        return object.boardId();
    }

    public String objectId() {
        return object.id();
    }
}
