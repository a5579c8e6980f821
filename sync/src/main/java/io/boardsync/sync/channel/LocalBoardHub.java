// file: sync/src/main/java/io/boardsync/sync/channel/LocalBoardHub.java
package io.boardsync.sync.channel;

import io.boardsync.core.PresenceUser;
import io.boardsync.storage.ObjectChange;
import io.boardsync.sync.message.BroadcastMessage;
import io.boardsync.sync.message.ChangeNotification;
import io.boardsync.sync.message.PresenceMessage;
import io.boardsync.sync.message.SyncMessage;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process relay: every endpoint of a board talks to the same {@link BoardRoom}.
 * Used to run several clients against one repository inside a single JVM.
 * <p>
 * Deliveries run on {@code executor}; the default runs them on the sending thread,
 * which makes message order fully deterministic.
 */
public final class LocalBoardHub {
    private static final Logger log = Logger.getLogger(LocalBoardHub.class.getName());

    private final Map<String, BoardRoom> rooms = new ConcurrentHashMap<>();
    private final Executor executor;
    private final Clock clock;

    public LocalBoardHub() {
        this(Runnable::run, Clock.systemUTC());
    }

    public LocalBoardHub(Executor executor, Clock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Endpoint connect(String boardId, String peerId) {
        BoardRoom room = rooms.computeIfAbsent(boardId, BoardRoom::new);
        Endpoint e = new Endpoint(room, peerId);
        room.join(e);
        return e;
    }

    /** Forward a committed repository change to the clients of its board. */
    public void publishChange(ObjectChange change) {
        BoardRoom room = rooms.get(change.boardId());
        if (room != null) room.publishChange(ChangeNotification.of(change));
    }

    public BoardRoom room(String boardId) {
        return rooms.get(boardId);
    }

    /** One client's connection: both the broadcast and the presence side. */
    public final class Endpoint implements BroadcastChannel, PresenceChannel, BoardRoom.Peer, AutoCloseable {
        private final BoardRoom room;
        private final String id;
        private final List<BroadcastChannel.Listener> listeners = new CopyOnWriteArrayList<>();
        private final List<Consumer<List<PresenceUser>>> presenceListeners = new CopyOnWriteArrayList<>();
        private volatile boolean closed;

        private Endpoint(BoardRoom room, String id) {
            this.room = room;
            this.id = Objects.requireNonNull(id, "id");
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public CompletableFuture<Void> broadcast(BroadcastMessage message) {
            return send(message);
        }

        @Override
        public void subscribe(BroadcastChannel.Listener listener) {
            listeners.add(Objects.requireNonNull(listener, "listener"));
        }

        @Override
        public void unsubscribe(BroadcastChannel.Listener listener) {
            listeners.remove(listener);
        }

        @Override
        public CompletableFuture<Void> track(PresenceUser user) {
            return send(new PresenceMessage.Track(user));
        }

        @Override
        public CompletableFuture<Void> heartbeat(PresenceUser user) {
            return send(new PresenceMessage.Heartbeat(user));
        }

        @Override
        public CompletableFuture<Void> leave(String userId) {
            return send(new PresenceMessage.Leave(userId));
        }

        @Override
        public void onSync(Consumer<List<PresenceUser>> listener) {
            presenceListeners.add(Objects.requireNonNull(listener, "listener"));
        }

        @Override
        public void offSync(Consumer<List<PresenceUser>> listener) {
            presenceListeners.remove(listener);
        }

        @Override
        public void deliver(SyncMessage message) {
            if (closed) return;
            executor.execute(() -> dispatch(message));
        }

        @Override
        public void close() {
            if (closed) return;
            closed = true;
            room.leave(this);
        }

        private CompletableFuture<Void> send(SyncMessage message) {
            if (closed) {
                return CompletableFuture.failedFuture(new IllegalStateException("endpoint " + id + " is closed"));
            }
            room.receive(this, message, clock.millis());
            return CompletableFuture.completedFuture(null);
        }

        private void dispatch(SyncMessage message) {
            try {
                if (message instanceof BroadcastMessage) {
                    for (BroadcastChannel.Listener l : listeners) l.onBroadcast((BroadcastMessage) message);
                } else if (message instanceof ChangeNotification) {
                    for (BroadcastChannel.Listener l : listeners) l.onChange((ChangeNotification) message);
                } else if (message instanceof PresenceMessage.Sync) {
                    List<PresenceUser> users = ((PresenceMessage.Sync) message).users();
                    for (Consumer<List<PresenceUser>> l : presenceListeners) l.accept(users);
                }
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "listener of endpoint " + id + " on board " + room.boardId() + " failed", e);
            }
        }
    }
}
