// file: sync/src/main/java/io/boardsync/sync/RemoteCursors.java
package io.boardsync.sync;

import io.boardsync.core.CursorPosition;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/** Last known cursor of every other user on the board. Nothing here is persisted. */
public final class RemoteCursors {
    private final Map<String, CursorPosition> byUser = new ConcurrentHashMap<>();

    public void update(CursorPosition cursor) {
        byUser.put(cursor.userId(), cursor);
    }

    public Optional<CursorPosition> get(String userId) {
        return Optional.ofNullable(byUser.get(userId));
    }

    /** Drop cursors of users that are no longer present. */
    public void retainOnly(Collection<String> presentUserIds) {
        Set<String> keep = Set.copyOf(presentUserIds);
        byUser.keySet().removeIf(id -> !keep.contains(id));
    }

    public Map<String, CursorPosition> snapshot() {
        return Map.copyOf(byUser);
    }

    public void clear() {
        byUser.clear();
    }
}
