// file: core/src/main/java/io/boardsync/core/PresenceUser.java
package io.boardsync.core;

import java.util.Objects;

/**
 * One online member of a board as seen by the presence channel.
 *
 * @param onlineAt epoch millis when this user joined the board
 */
public record PresenceUser(String userId, String userName, String color, long onlineAt) {
    public PresenceUser {
        Objects.requireNonNull(userId, "userId");
        if (userId.isBlank()) throw new IllegalArgumentException("userId must not be blank");
    }

    /** Build a record whose color is derived from the user id. */
    public static PresenceUser of(String userId, String userName, long onlineAt) {
        return new PresenceUser(userId, userName, PresenceColors.colorFor(userId), onlineAt);
    }
}
