// file: sync/src/main/java/io/boardsync/sync/message/BroadcastMessage.java
package io.boardsync.sync.message;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.boardsync.core.CursorPosition;
import io.boardsync.core.ObjectPatch;
import io.boardsync.core.ObjectUpdate;
import io.boardsync.core.Viewport;
import io.boardsync.core.WhiteboardObject;

import java.util.List;
import java.util.Objects;

/**
 * Ephemeral fan-out between clients of one board. Never stored; a client that
 * misses one catches up through the change feed or a resync.
 */
public sealed interface BroadcastMessage extends SyncMessage {

    /** User id of the client that sent the message; receivers drop their own. */
    String senderId();

    record Created(String senderId, WhiteboardObject object) implements BroadcastMessage {
        public Created {
            Objects.requireNonNull(senderId, "senderId");
            Objects.requireNonNull(object, "object");
        }
    }

    /** Several new objects at once, e.g. a paste or the undo of a multi-delete. */
    record CreatedBatch(String senderId, List<WhiteboardObject> objects) implements BroadcastMessage {
        public CreatedBatch {
            Objects.requireNonNull(senderId, "senderId");
            objects = List.copyOf(objects);
        }
    }

    /** Stamped delta for one object. */
    record Updated(String senderId, String id, ObjectPatch patch) implements BroadcastMessage {
        public Updated {
            Objects.requireNonNull(senderId, "senderId");
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(patch, "patch");
        }
    }

    record Deleted(String senderId, List<String> ids) implements BroadcastMessage {
        public Deleted {
            Objects.requireNonNull(senderId, "senderId");
            ids = List.copyOf(ids);
        }
    }

    /** Stamped deltas for several objects, sent as one message. */
    record MovedBatch(String senderId, List<ObjectUpdate> updates) implements BroadcastMessage {
        public MovedBatch {
            Objects.requireNonNull(senderId, "senderId");
            updates = List.copyOf(updates);
        }
    }

    record CursorMoved(String senderId, CursorPosition cursor) implements BroadcastMessage {
        public CursorMoved {
            Objects.requireNonNull(senderId, "senderId");
            Objects.requireNonNull(cursor, "cursor");
        }
    }

    record ViewportChanged(String senderId, Viewport viewport) implements BroadcastMessage {
        public ViewportChanged {
            Objects.requireNonNull(senderId, "senderId");
            Objects.requireNonNull(viewport, "viewport");
        }
    }

    /** A presenter asking everyone else on the board to follow their viewport, or releasing them. */
    record Spotlight(String senderId, Action action, String userId, String userName) implements BroadcastMessage {
        public enum Action {
            @JsonProperty("start") START,
            @JsonProperty("stop") STOP
        }

        public Spotlight {
            Objects.requireNonNull(senderId, "senderId");
            Objects.requireNonNull(action, "action");
            Objects.requireNonNull(userId, "userId");
        }
    }
}
