// file: sync/src/main/java/io/boardsync/sync/message/PresenceMessage.java
package io.boardsync.sync.message;

import io.boardsync.core.PresenceUser;

import java.util.List;
import java.util.Objects;

/** Who is on the board. Clients send track/heartbeat/leave; the relay answers with sync. */
public sealed interface PresenceMessage extends SyncMessage {

    record Track(PresenceUser user) implements PresenceMessage {
        public Track {
            Objects.requireNonNull(user, "user");
        }
    }

    /** Full member set of the board, one entry per user. */
    record Sync(List<PresenceUser> users) implements PresenceMessage {
        public Sync {
            users = List.copyOf(users);
        }
    }

    record Leave(String userId) implements PresenceMessage {
        public Leave {
            Objects.requireNonNull(userId, "userId");
        }
    }

    /** Periodic re-track; carries the full record so a relay that lost it can restore it. */
    record Heartbeat(PresenceUser user) implements PresenceMessage {
        public Heartbeat {
            Objects.requireNonNull(user, "user");
        }
    }
}
