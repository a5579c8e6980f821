// file: sync/src/main/java/io/boardsync/sync/BoardSession.java
package io.boardsync.sync;

import java.util.Objects;

/** Who is editing which board. */
public record BoardSession(String boardId, String userId, String userName) {
    public BoardSession {
        Objects.requireNonNull(boardId, "boardId");
        Objects.requireNonNull(userId, "userId");
        if (boardId.isBlank()) throw new IllegalArgumentException("boardId must not be blank");
        if (userId.isBlank()) throw new IllegalArgumentException("userId must not be blank");
        if (userName == null || userName.isBlank()) userName = userId;
    }
}
