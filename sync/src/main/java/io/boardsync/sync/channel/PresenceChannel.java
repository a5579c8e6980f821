// file: sync/src/main/java/io/boardsync/sync/channel/PresenceChannel.java
package io.boardsync.sync.channel;

import io.boardsync.core.PresenceUser;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/** Ephemeral membership of a board. Nothing sent here is persisted. */
public interface PresenceChannel {

    CompletableFuture<Void> track(PresenceUser user);

    CompletableFuture<Void> heartbeat(PresenceUser user);

    CompletableFuture<Void> leave(String userId);

    /** Receives the full member set every time it changes. */
    void onSync(Consumer<List<PresenceUser>> listener);

    void offSync(Consumer<List<PresenceUser>> listener);
}
