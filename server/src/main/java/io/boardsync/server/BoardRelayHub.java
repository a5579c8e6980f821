// file: server/src/main/java/io/boardsync/server/BoardRelayHub.java
package io.boardsync.server;

import io.boardsync.storage.ObjectChange;
import io.boardsync.sync.channel.BoardRoom;
import io.boardsync.sync.message.ChangeNotification;
import io.boardsync.sync.message.MessageCodec;
import io.boardsync.sync.message.SyncMessage;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketCallback;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import io.undertow.websockets.spi.WebSocketHttpExchange;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * WebSocket relay behind {@code /boards/{board}/live}.
 * <p>
 * Each board has one {@link BoardRoom}; each socket is one peer in it. Text frames
 * are decoded and routed by the room; durable changes committed by the repository
 * are pushed to every socket of the board. A background sweeper drops presence
 * members whose heartbeats stopped.
 */
public final class BoardRelayHub implements AutoCloseable {
    private static final Logger log = Logger.getLogger(BoardRelayHub.class.getName());

    private final Map<String, BoardRoom> rooms = new ConcurrentHashMap<>();
    private final MessageCodec codec = new MessageCodec();
    private final Duration presenceTimeout;
    private final Clock clock;
    private final ScheduledExecutorService sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "presence-sweeper");
        t.setDaemon(true);
        return t;
    });

    public BoardRelayHub(Duration presenceTimeout, Clock clock) {
        this.presenceTimeout = Objects.requireNonNull(presenceTimeout, "presenceTimeout");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (presenceTimeout.isNegative() || presenceTimeout.isZero()) {
            throw new IllegalArgumentException("presenceTimeout must be > 0");
        }
    }

    public void start() {
        long period = Math.max(1_000L, presenceTimeout.toMillis() / 3);
        sweeper.scheduleAtFixedRate(this::tickSafe, period, period, TimeUnit.MILLISECONDS);
        log.info(() -> "relay started, presence timeout " + presenceTimeout.toSeconds() + "s");
    }

    /** Handshake callback for one board; the user comes from the {@code userId} query parameter. */
    public WebSocketConnectionCallback connectionCallback(String boardId) {
        Objects.requireNonNull(boardId, "boardId");
        return (exchange, channel) -> onConnect(boardId, exchange, channel);
    }

    /** Forward a committed repository change to the sockets of its board. */
    public void publishChange(ObjectChange change) {
        BoardRoom room = rooms.get(change.boardId());
        if (room != null) room.publishChange(ChangeNotification.of(change));
    }

    /** Drop silent presence members on every board. */
    public int sweepNow() {
        int dropped = 0;
        long now = clock.millis();
        for (BoardRoom room : rooms.values()) {
            dropped += room.sweep(now, presenceTimeout.toMillis());
        }
        return dropped;
    }

    public BoardRoom room(String boardId) {
        return rooms.get(boardId);
    }

    @Override
    public void close() {
        sweeper.shutdownNow();
    }

    // ---------- internals ----------

    private void onConnect(String boardId, WebSocketHttpExchange exchange, WebSocketChannel channel) {
        Map<String, String> query = parseQuery(exchange.getQueryString());
        String userId = query.get("userId");
        if (userId == null || userId.isBlank()) {
            log.warning(() -> "rejecting live connection to board " + boardId + " from "
                    + channel.getSourceAddress() + ": missing userId");
            closeQuietly(channel);
            return;
        }

        SocketPeer peer = new SocketPeer(UUID.randomUUID().toString(), channel);
        BoardRoom room = rooms.compute(boardId, (id, existing) -> {
            BoardRoom r = existing != null ? existing : new BoardRoom(id);
            r.join(peer);
            return r;
        });
        log.info(() -> "user " + userId + " connected to board " + boardId + " as peer " + peer.id());

        channel.getReceiveSetter().set(new AbstractReceiveListener() {
            @Override
            protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                handleFrame(room, peer, message.getData());
            }

            @Override
            protected void onCloseMessage(CloseMessage cm, WebSocketChannel ch) {
                disconnect(room, peer, userId);
                super.onCloseMessage(cm, ch);
            }

            @Override
            protected void onError(WebSocketChannel ch, Throwable error) {
                log.log(Level.FINE, "socket error for peer " + peer.id() + " on board " + boardId, error);
                disconnect(room, peer, userId);
                super.onError(ch, error);
            }
        });
        channel.getCloseSetter().set(c -> disconnect(room, peer, userId));
        channel.resumeReceives();
    }

    private void handleFrame(BoardRoom room, SocketPeer peer, String text) {
        SyncMessage message;
        try {
            message = codec.decode(text);
        } catch (IllegalArgumentException e) {
            log.log(Level.WARNING, "dropping undecodable frame from peer " + peer.id()
                    + " on board " + room.boardId(), e);
            return;
        }
        room.receive(peer, message, clock.millis());
    }

    private void disconnect(BoardRoom room, SocketPeer peer, String userId) {
        if (!peer.closed.compareAndSet(false, true)) return;
        room.leave(peer);
        rooms.computeIfPresent(room.boardId(), (id, r) -> r.isEmpty() ? null : r);
        log.info(() -> "user " + userId + " disconnected from board " + room.boardId());
    }

    private void tickSafe() {
        try {
            sweepNow();
        } catch (Exception e) {
            log.log(Level.WARNING, "presence sweep failed", e);
        }
    }

    private static Map<String, String> parseQuery(String query) {
        Map<String, String> out = new HashMap<>();
        if (query == null || query.isBlank()) return out;
        for (String param : query.split("&")) {
            int eq = param.indexOf('=');
            if (eq <= 0) continue;
            out.put(URLDecoder.decode(param.substring(0, eq), StandardCharsets.UTF_8),
                    URLDecoder.decode(param.substring(eq + 1), StandardCharsets.UTF_8));
        }
        return out;
    }

    private static void closeQuietly(WebSocketChannel channel) {
        try {
            channel.close();
        } catch (IOException e) {
            log.log(Level.FINE, "closing rejected socket failed", e);
        }
    }

    private final class SocketPeer implements BoardRoom.Peer {
        private final String id;
        private final WebSocketChannel channel;
        private final AtomicBoolean closed = new AtomicBoolean();

        SocketPeer(String id, WebSocketChannel channel) {
            this.id = id;
            this.channel = channel;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public void deliver(SyncMessage message) {
            if (closed.get()) return;
            WebSockets.sendText(codec.encode(message), channel, new WebSocketCallback<Void>() {
                @Override
                public void complete(WebSocketChannel ch, Void context) {
                    // sent
                }

                @Override
                public void onError(WebSocketChannel ch, Void context, Throwable error) {
                    log.log(Level.FINE, "send to peer " + id + " failed", error);
                }
            });
        }
    }
}
