// file: sync/src/main/java/io/boardsync/sync/PresenceTracker.java
package io.boardsync.sync;

import io.boardsync.core.PresenceUser;
import io.boardsync.sync.channel.PresenceChannel;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Who else is on the board.
 * <p>
 * The local user is listed as soon as {@link #join()} is called, before the relay
 * answers. Every sync from the relay replaces the list, deduplicated by user id,
 * and the local user stays in it. A heartbeat re-tracks the local user on a fixed
 * interval so the relay does not expire it.
 */
public final class PresenceTracker implements AutoCloseable {
    private static final Logger log = Logger.getLogger(PresenceTracker.class.getName());

    public interface Listener {
        void onPresenceChanged(List<PresenceUser> users);
    }

    private final BoardSession session;
    private final PresenceChannel channel;
    private final Duration heartbeat;
    private final Clock clock;
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();
    private final Consumer<List<PresenceUser>> syncListener = this::onSync;

    private volatile List<PresenceUser> users = List.of();
    private volatile PresenceUser self;
    private ScheduledExecutorService scheduler;

    public PresenceTracker(BoardSession session, PresenceChannel channel, Duration heartbeat, Clock clock) {
        this.session = Objects.requireNonNull(session, "session");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.heartbeat = Objects.requireNonNull(heartbeat, "heartbeat");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void addListener(Listener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /** Show self, subscribe to syncs, announce self, and start the heartbeat. */
    public synchronized void join() {
        if (self != null) return;
        self = PresenceUser.of(session.userId(), session.userName(), clock.millis());
        setUsers(List.of(self));
        channel.onSync(syncListener);
        channel.track(self).whenComplete((r, e) -> {
            if (e != null) log.log(Level.WARNING, "presence track failed on board " + session.boardId(), e);
        });

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "presence-heartbeat-" + session.boardId());
            t.setDaemon(true);
            return t;
        });
        long period = heartbeat.toMillis();
        scheduler.scheduleAtFixedRate(this::tickSafe, period, period, TimeUnit.MILLISECONDS);
        log.info(() -> session.userId() + " joined board " + session.boardId());
    }

    /** Apply a full member set from the relay. Ignored unless joined. */
    public void onSync(List<PresenceUser> remote) {
        PresenceUser me = self;
        if (me == null) return;
        Map<String, PresenceUser> byUser = new LinkedHashMap<>();
        byUser.put(me.userId(), me);
        for (PresenceUser u : remote) {
            byUser.putIfAbsent(u.userId(), u);
        }
        setUsers(new ArrayList<>(byUser.values()));
    }

    /** Re-announce self; what the heartbeat does on every tick. */
    public void heartbeatNow() {
        PresenceUser me = self;
        if (me == null) return;
        channel.heartbeat(me).whenComplete((r, e) -> {
            if (e != null) log.log(Level.WARNING, "presence heartbeat failed on board " + session.boardId(), e);
        });
    }

    public List<PresenceUser> onlineUsers() {
        return users;
    }

    public synchronized void leave() {
        if (self == null) return;
        if (scheduler != null) scheduler.shutdownNow();
        scheduler = null;
        channel.offSync(syncListener);
        channel.leave(self.userId());
        self = null;
        setUsers(List.of());
        log.info(() -> session.userId() + " left board " + session.boardId());
    }

    @Override
    public void close() {
        leave();
    }

    private void setUsers(List<PresenceUser> next) {
        users = List.copyOf(next);
        for (Listener l : listeners) {
            l.onPresenceChanged(users);
        }
    }

    private void tickSafe() {
        try {
            heartbeatNow();
        } catch (Exception e) {
            log.log(Level.WARNING, "presence heartbeat tick failed on board " + session.boardId(), e);
        }
    }
}
