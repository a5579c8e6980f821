// file: sync/src/main/java/io/boardsync/sync/message/ChangeNotification.java
package io.boardsync.sync.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.boardsync.core.WhiteboardObject;
import io.boardsync.storage.ObjectChange;

import java.util.Objects;

/**
 * A committed change of the durable repository, pushed to every client of the board.
 *
 * @param object post-state for INSERT and UPDATE; null for DELETE
 * @param id     id of the changed object, always set
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChangeNotification(ObjectChange.Kind kind, WhiteboardObject object, String id)
        implements SyncMessage {

    public ChangeNotification {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(id, "id");
        if (kind != ObjectChange.Kind.DELETE && object == null) {
            throw new IllegalArgumentException(kind + " notification needs the object");
        }
    }

    public static ChangeNotification of(ObjectChange change) {
        return new ChangeNotification(
                change.kind(),
                change.kind() == ObjectChange.Kind.DELETE ? null : change.object(),
                change.objectId());
    }
}
