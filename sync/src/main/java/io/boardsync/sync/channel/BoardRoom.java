// file: sync/src/main/java/io/boardsync/sync/channel/BoardRoom.java
package io.boardsync.sync.channel;

import io.boardsync.core.PresenceUser;
import io.boardsync.sync.message.BroadcastMessage;
import io.boardsync.sync.message.ChangeNotification;
import io.boardsync.sync.message.PresenceMessage;
import io.boardsync.sync.message.SyncMessage;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Relay state of one board, independent of the transport.
 * <p>
 * Broadcasts go to every connected peer except the one that sent them. Presence is
 * kept per peer with the time it was last heard from; every membership change is
 * answered with a {@link PresenceMessage.Sync} to all peers, one entry per user id.
 * Delivery happens outside the room's lock.
 */
public final class BoardRoom {
    private static final Logger log = Logger.getLogger(BoardRoom.class.getName());

    /** One connected client as the relay sees it. */
    public interface Peer {
        String id();

        void deliver(SyncMessage message);
    }

    private record Member(PresenceUser user, long lastSeen) {}

    private final String boardId;
    private final Map<String, Peer> peers = new LinkedHashMap<>();
    private final Map<String, Member> members = new LinkedHashMap<>();

    public BoardRoom(String boardId) {
        this.boardId = Objects.requireNonNull(boardId, "boardId");
    }

    public String boardId() {
        return boardId;
    }

    public void join(Peer peer) {
        synchronized (this) {
            peers.put(peer.id(), peer);
        }
        log.fine(() -> "peer " + peer.id() + " joined board " + boardId);
    }

    /** Route one message received from {@code from}. */
    public void receive(Peer from, SyncMessage message, long now) {
        if (message instanceof BroadcastMessage) {
            fanOut(from, message);
        } else if (message instanceof PresenceMessage.Track) {
            upsert(from, ((PresenceMessage.Track) message).user(), now);
            pushPresence();
        } else if (message instanceof PresenceMessage.Heartbeat) {
            if (upsert(from, ((PresenceMessage.Heartbeat) message).user(), now)) pushPresence();
        } else if (message instanceof PresenceMessage.Leave) {
            if (dropMember(from.id())) pushPresence();
        } else {
            log.fine(() -> "ignoring " + message.getClass().getSimpleName() + " from peer " + from.id());
        }
    }

    /** Push a durable change to every peer, the writer included. */
    public void publishChange(ChangeNotification change) {
        deliverAll(snapshotPeers(null), change);
    }

    /** Forget a peer whose connection closed. */
    public void leave(Peer peer) {
        boolean wasMember;
        synchronized (this) {
            peers.remove(peer.id());
            wasMember = members.remove(peer.id()) != null;
        }
        log.fine(() -> "peer " + peer.id() + " left board " + boardId);
        if (wasMember) pushPresence();
    }

    /**
     * Drop members not heard from for {@code timeoutMillis}.
     *
     * @return number of members dropped
     */
    public int sweep(long now, long timeoutMillis) {
        int dropped = 0;
        synchronized (this) {
            Iterator<Member> it = members.values().iterator();
            while (it.hasNext()) {
                if (now - it.next().lastSeen() > timeoutMillis) {
                    it.remove();
                    dropped++;
                }
            }
        }
        if (dropped > 0) {
            int n = dropped;
            log.info(() -> "dropped " + n + " silent presence member(s) on board " + boardId);
            pushPresence();
        }
        return dropped;
    }

    /** Current members, one per user id, in join order. */
    public synchronized List<PresenceUser> presence() {
        Map<String, PresenceUser> byUser = new LinkedHashMap<>();
        for (Member m : members.values()) {
            byUser.putIfAbsent(m.user().userId(), m.user());
        }
        return new ArrayList<>(byUser.values());
    }

    public synchronized int peerCount() {
        return peers.size();
    }

    public synchronized boolean isEmpty() {
        return peers.isEmpty();
    }

    // ---------- internals ----------

    /** @return true if the peer had no presence record before */
    private synchronized boolean upsert(Peer from, PresenceUser user, long now) {
        return members.put(from.id(), new Member(user, now)) == null;
    }

    private synchronized boolean dropMember(String peerId) {
        return members.remove(peerId) != null;
    }

    private void pushPresence() {
        deliverAll(snapshotPeers(null), new PresenceMessage.Sync(presence()));
    }

    private void fanOut(Peer from, SyncMessage message) {
        deliverAll(snapshotPeers(from.id()), message);
    }

    private synchronized List<Peer> snapshotPeers(String exceptId) {
        List<Peer> out = new ArrayList<>(peers.size());
        for (Peer p : peers.values()) {
            if (!p.id().equals(exceptId)) out.add(p);
        }
        return out;
    }

    private void deliverAll(List<Peer> targets, SyncMessage message) {
        for (Peer p : targets) {
            try {
                p.deliver(message);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "delivery to peer " + p.id() + " on board " + boardId + " failed", e);
            }
        }
    }
}
