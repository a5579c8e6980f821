// file: sync/src/main/java/io/boardsync/sync/transport/WebSocketBoardChannel.java
package io.boardsync.sync.transport;

import io.boardsync.core.PresenceUser;
import io.boardsync.sync.channel.BroadcastChannel;
import io.boardsync.sync.channel.PresenceChannel;
import io.boardsync.sync.message.BroadcastMessage;
import io.boardsync.sync.message.ChangeNotification;
import io.boardsync.sync.message.MessageCodec;
import io.boardsync.sync.message.PresenceMessage;
import io.boardsync.sync.message.SyncMessage;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Client side of the server's live endpoint {@code /boards/{board}/live}.
 * <p>
 * One socket carries broadcasts, the durable change feed and presence. Outgoing
 * frames are chained so only one send is in flight at a time. When the server
 * drops the connection it is re-opened after {@code reconnectDelay}, and
 * subscribers get {@link BroadcastChannel.Listener#onReconnect()}.
 * <p>
 * Messages sent while no socket is open are queued (at most {@value #MAX_QUEUED},
 * oldest dropped first) and go out in order as soon as a connection opens. Their
 * futures complete when they are actually written.
 */
public final class WebSocketBoardChannel implements BroadcastChannel, PresenceChannel, AutoCloseable {
    private static final Logger log = Logger.getLogger(WebSocketBoardChannel.class.getName());

    static final int MAX_QUEUED = 1000;

    private record Queued(String text, CompletableFuture<Void> done) {}

    private final HttpClient client;
    private final URI uri;
    private final Duration reconnectDelay;
    private final MessageCodec codec = new MessageCodec();
    private final List<BroadcastChannel.Listener> listeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<List<PresenceUser>>> presenceListeners = new CopyOnWriteArrayList<>();
    private final ScheduledExecutorService reconnector = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "ws-reconnect");
        t.setDaemon(true);
        return t;
    });

    private volatile WebSocket socket;
    private volatile boolean closed;
    private CompletableFuture<?> sendChain = CompletableFuture.completedFuture(null);
    private final Deque<Queued> queued = new ArrayDeque<>();

    private WebSocketBoardChannel(HttpClient client, URI uri, Duration reconnectDelay) {
        this.client = client;
        this.uri = uri;
        this.reconnectDelay = reconnectDelay;
    }

    /** Open the live connection of {@code boardId} on the server at {@code baseUri}. */
    public static CompletableFuture<WebSocketBoardChannel> connect(URI baseUri, String boardId, String userId,
                                                                   String userName) {
        WebSocketBoardChannel ch = new WebSocketBoardChannel(HttpClient.newHttpClient(),
                liveUri(baseUri, boardId, userId, userName), Duration.ofSeconds(2));
        return ch.dial().thenApply(ws -> ch);
    }

    /**
     * Return at once and connect in the background, retrying every {@code reconnectDelay}
     * until the server answers. Anything sent meanwhile is queued.
     */
    public static WebSocketBoardChannel start(URI baseUri, String boardId, String userId, String userName,
                                              Duration reconnectDelay) {
        Objects.requireNonNull(reconnectDelay, "reconnectDelay");
        WebSocketBoardChannel ch = new WebSocketBoardChannel(HttpClient.newHttpClient(),
                liveUri(baseUri, boardId, userId, userName), reconnectDelay);
        ch.dial().whenComplete((ws, e) -> {
            if (e != null) ch.scheduleReconnect();
        });
        return ch;
    }

    private static URI liveUri(URI baseUri, String boardId, String userId, String userName) {
        Objects.requireNonNull(baseUri, "baseUri");
        String scheme = "https".equals(baseUri.getScheme()) ? "wss" : "ws";
        return URI.create(scheme + "://" + baseUri.getAuthority() + "/boards/" + encode(boardId)
                + "/live?userId=" + encode(userId) + "&userName=" + encode(userName));
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

    public synchronized int queuedCount() {
        return queued.size();
    }

    public boolean isConnected() {
        return socket != null;
    }

    @Override
    public void close() {
        closed = true;
        reconnector.shutdownNow();
        WebSocket ws = socket;
        socket = null;
        failQueued(new IllegalStateException("channel to " + uri + " closed"));
        if (ws != null) {
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "bye").exceptionally(e -> {
                log.log(Level.FINE, "close handshake failed for " + uri, e);
                return null;
            });
        }
    }

    // ---------- internals ----------

    private CompletableFuture<WebSocket> dial() {
        return client.newWebSocketBuilder()
                .buildAsync(uri, new SocketListener())
                .whenComplete((ws, e) -> {
                    if (e != null) {
                        log.log(Level.WARNING, "connect to " + uri + " failed", e);
                    } else {
                        connected(ws);
                    }
                });
    }

    private synchronized CompletableFuture<Void> send(SyncMessage message) {
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("channel to " + uri + " closed"));
        }
        String text = codec.encode(message);
        WebSocket ws = socket;
        if (ws != null) return write(ws, text);

        if (queued.size() >= MAX_QUEUED) {
            Queued dropped = queued.pollFirst();
            log.warning(() -> "send queue for " + uri + " is full, dropping the oldest message");
            dropped.done().completeExceptionally(new IllegalStateException("send queue for " + uri + " overflowed"));
        }
        CompletableFuture<Void> done = new CompletableFuture<>();
        queued.addLast(new Queued(text, done));
        return done;
    }

    /** Caller holds the lock. */
    private CompletableFuture<Void> write(WebSocket ws, String text) {
        CompletableFuture<WebSocket> next = sendChain
                .exceptionally(e -> null)
                .thenCompose(prev -> ws.sendText(text, true));
        sendChain = next;
        return next.thenApply(x -> null);
    }

    /** Publish the open socket and drain what was queued while offline. */
    private synchronized void connected(WebSocket ws) {
        socket = ws;
        if (queued.isEmpty()) return;
        int n = queued.size();
        log.fine(() -> "flushing " + n + " queued message(s) to " + uri);
        Queued q;
        while ((q = queued.pollFirst()) != null) {
            CompletableFuture<Void> done = q.done();
            write(ws, q.text()).whenComplete((r, e) -> {
                if (e != null) {
                    done.completeExceptionally(e);
                } else {
                    done.complete(null);
                }
            });
        }
    }

    private synchronized void failQueued(Exception cause) {
        Queued q;
        while ((q = queued.pollFirst()) != null) {
            q.done().completeExceptionally(cause);
        }
    }

    private void dispatch(String text) {
        SyncMessage message;
        try {
            message = codec.decode(text);
        } catch (IllegalArgumentException e) {
            log.log(Level.WARNING, "dropping undecodable frame from " + uri, e);
            return;
        }
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
            log.log(Level.WARNING, "listener failed on " + message.getClass().getSimpleName(), e);
        }
    }

    private void scheduleReconnect() {
        if (closed) return;
        reconnector.schedule(() -> {
            if (closed) return;
            dial().whenComplete((ws, e) -> {
                if (e != null) {
                    scheduleReconnect();
                } else {
                    log.info(() -> "reconnected to " + uri);
                    listeners.forEach(BroadcastChannel.Listener::onReconnect);
                }
            });
        }, reconnectDelay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private final class SocketListener implements WebSocket.Listener {
        private final StringBuilder buf = new StringBuilder();

        @Override
        public void onOpen(WebSocket webSocket) {
            connected(webSocket);
            log.info(() -> "connected to " + uri);
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            buf.append(data);
            if (last) {
                String text = buf.toString();
                buf.setLength(0);
                dispatch(text);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            socket = null;
            log.info(() -> "disconnected from " + uri + ": " + statusCode + " " + reason);
            scheduleReconnect();
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            socket = null;
            log.log(Level.WARNING, "socket error on " + uri, error);
            scheduleReconnect();
        }
    }
}
