// file: sync/src/main/java/io/boardsync/sync/message/SyncMessage.java
package io.boardsync.sync.message;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Anything carried over a board's live connection. On the wire every message is a
 * JSON object tagged with an {@code event} property, e.g.
 * <pre>
 *   { "event": "object_update", "senderId": "u-1", "id": "...", "patch": { "x": 10, ... } }
 * </pre>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "event")
@JsonSubTypes({
        @JsonSubTypes.Type(value = BroadcastMessage.Created.class, name = "object_create"),
        @JsonSubTypes.Type(value = BroadcastMessage.CreatedBatch.class, name = "object_create_batch"),
        @JsonSubTypes.Type(value = BroadcastMessage.Updated.class, name = "object_update"),
        @JsonSubTypes.Type(value = BroadcastMessage.Deleted.class, name = "object_delete"),
        @JsonSubTypes.Type(value = BroadcastMessage.MovedBatch.class, name = "object_move_batch"),
        @JsonSubTypes.Type(value = BroadcastMessage.CursorMoved.class, name = "cursor_update"),
        @JsonSubTypes.Type(value = BroadcastMessage.ViewportChanged.class, name = "viewport"),
        @JsonSubTypes.Type(value = BroadcastMessage.Spotlight.class, name = "spotlight"),
        @JsonSubTypes.Type(value = ChangeNotification.class, name = "db_change"),
        @JsonSubTypes.Type(value = PresenceMessage.Track.class, name = "presence_track"),
        @JsonSubTypes.Type(value = PresenceMessage.Sync.class, name = "presence_sync"),
        @JsonSubTypes.Type(value = PresenceMessage.Leave.class, name = "presence_leave"),
        @JsonSubTypes.Type(value = PresenceMessage.Heartbeat.class, name = "heartbeat")
})
public sealed interface SyncMessage permits BroadcastMessage, ChangeNotification, PresenceMessage {
}
