// file: sync/src/main/java/io/boardsync/sync/BoardClient.java
package io.boardsync.sync;

import io.boardsync.core.HistoryManager;
import io.boardsync.core.ObjectStore;
import io.boardsync.core.PresenceUser;
import io.boardsync.storage.ObjectRepository;
import io.boardsync.sync.channel.BroadcastChannel;
import io.boardsync.sync.channel.PresenceChannel;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Everything one user needs on one board: the object store, the orchestrator and
 * the presence tracker, wired together. Remote cursors, viewports and follow state
 * are pruned whenever a user drops out of presence.
 */
public final class BoardClient implements AutoCloseable {
    private final ObjectStore store;
    private final SyncOrchestrator sync;
    private final PresenceTracker presence;

    public BoardClient(BoardSession session, ObjectRepository repository, BroadcastChannel broadcast,
                       PresenceChannel presenceChannel, SyncConfig config, Clock clock) {
        this.store = new ObjectStore(new HistoryManager(config.historyLimit()));
        this.sync = new SyncOrchestrator(session, store, repository, broadcast, config, clock);
        this.presence = new PresenceTracker(session, presenceChannel, config.heartbeat(), clock);
        presence.addListener(users -> {
            List<String> present = users.stream().map(PresenceUser::userId).toList();
            sync.cursors().retainOnly(present);
            sync.followMode().retainOnly(present);
        });
    }

    /** Load the board and announce the user. Completes when the initial load is done. */
    public CompletableFuture<Void> open() {
        CompletableFuture<Void> loaded = sync.open();
        presence.join();
        return loaded;
    }

    public ObjectStore store() {
        return store;
    }

    public SyncOrchestrator sync() {
        return sync;
    }

    public PresenceTracker presence() {
        return presence;
    }

    @Override
    public void close() {
        presence.leave();
        sync.close();
    }
}
