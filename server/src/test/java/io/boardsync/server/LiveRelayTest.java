// file: server/src/test/java/io/boardsync/server/LiveRelayTest.java
package io.boardsync.server;

import io.boardsync.core.ObjectPatch;
import io.boardsync.core.PresenceUser;
import io.boardsync.storage.DurableObjectRepository;
import io.boardsync.storage.ObjectChange;
import io.boardsync.storage.ObjectNotFoundException;
import io.boardsync.sync.channel.BroadcastChannel;
import io.boardsync.sync.message.BroadcastMessage;
import io.boardsync.sync.message.ChangeNotification;
import io.boardsync.sync.transport.HttpObjectRepository;
import io.boardsync.sync.transport.WebSocketBoardChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static io.boardsync.server.TestBoards.note;
import static org.junit.jupiter.api.Assertions.*;

/** Two live sockets and the REST API against one running server. */
class LiveRelayTest {

    private static final int PORT = 18081; // test-only port
    private static final URI BASE = URI.create("http://localhost:" + PORT);
    private static final String BOARD = "b-1";

    @TempDir Path dir;

    private DurableObjectRepository repo;
    private BoardRelayHub relay;
    private WebServer server;
    private final List<WebSocketBoardChannel> sockets = new ArrayList<>();

    /** Everything one socket receives, in arrival order. */
    private static final class Inbox implements BroadcastChannel.Listener {
        final BlockingQueue<BroadcastMessage> broadcasts = new LinkedBlockingQueue<>();
        final BlockingQueue<ChangeNotification> changes = new LinkedBlockingQueue<>();
        final BlockingQueue<List<PresenceUser>> presence = new LinkedBlockingQueue<>();

        @Override
        public void onBroadcast(BroadcastMessage message) {
            broadcasts.add(message);
        }

        @Override
        public void onChange(ChangeNotification change) {
            changes.add(change);
        }

        /** Wait for a presence sync listing exactly these users. */
        void awaitPresence(Set<String> userIds) throws InterruptedException {
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (System.nanoTime() < deadline) {
                List<PresenceUser> users = presence.poll(100, TimeUnit.MILLISECONDS);
                if (users != null && users.stream().map(PresenceUser::userId).collect(Collectors.toSet()).equals(userIds)) {
                    return;
                }
            }
            fail("no presence sync with " + userIds);
        }
    }

    @BeforeEach
    void startServer() {
        repo = TestBoards.repository(dir);
        relay = new BoardRelayHub(Duration.ofSeconds(45), Clock.systemUTC());
        repo.subscribe(relay::publishChange);
        server = new WebServer(PORT, new BoardService(repo), relay);
        relay.start();
        server.start();
    }

    @AfterEach
    void stopServer() {
        sockets.forEach(WebSocketBoardChannel::close);
        server.stop();
        relay.close();
    }

    private Inbox join(String userId) throws Exception {
        WebSocketBoardChannel ch = WebSocketBoardChannel.connect(BASE, BOARD, userId, userId.toUpperCase())
                .get(5, TimeUnit.SECONDS);
        sockets.add(ch);
        Inbox inbox = new Inbox();
        ch.subscribe(inbox);
        ch.onSync(inbox.presence::add);
        ch.track(PresenceUser.of(userId, userId.toUpperCase(), System.currentTimeMillis())).get(5, TimeUnit.SECONDS);
        return inbox;
    }

    @Test
    void broadcasts_skip_the_sender_and_changes_reach_everyone() throws Exception {
        Inbox alice = join("alice");
        alice.awaitPresence(Set.of("alice"));
        Inbox bob = join("bob");
        alice.awaitPresence(Set.of("alice", "bob"));
        bob.awaitPresence(Set.of("alice", "bob"));

        sockets.get(1).broadcast(new BroadcastMessage.Updated("bob", "a", ObjectPatch.position(3, 4)))
                .get(5, TimeUnit.SECONDS);
        BroadcastMessage got = alice.broadcasts.poll(5, TimeUnit.SECONDS);
        assertInstanceOf(BroadcastMessage.Updated.class, got);
        assertEquals("bob", got.senderId());

        var http = new HttpObjectRepository(BASE, BOARD);
        http.insert(note("a", BOARD, 1_000)).get(5, TimeUnit.SECONDS);

        ChangeNotification toAlice = alice.changes.poll(5, TimeUnit.SECONDS);
        ChangeNotification toBob = bob.changes.poll(5, TimeUnit.SECONDS);
        assertNotNull(toAlice);
        assertNotNull(toBob);
        assertEquals(ObjectChange.Kind.INSERT, toBob.kind());
        assertEquals("a", toBob.object().id());
        assertTrue(bob.broadcasts.isEmpty(), "sender must not get its own broadcast");
    }

    @Test
    void leaving_member_disappears_from_presence() throws Exception {
        Inbox alice = join("alice");
        alice.awaitPresence(Set.of("alice"));
        join("bob");
        alice.awaitPresence(Set.of("alice", "bob"));

        sockets.get(1).leave("bob").get(5, TimeUnit.SECONDS);

        alice.awaitPresence(Set.of("alice"));
    }

    @Test
    void http_repository_reports_versions_and_missing_objects() throws Exception {
        var http = new HttpObjectRepository(BASE, BOARD);
        http.insert(note("a", BOARD, 1_000)).get(5, TimeUnit.SECONDS);

        assertEquals(2, http.update("a", ObjectPatch.position(7, 7)).get(5, TimeUnit.SECONDS));
        assertEquals(1, http.list(BOARD).get(5, TimeUnit.SECONDS).size());

        var e = assertThrows(ExecutionException.class,
                () -> http.update("ghost", ObjectPatch.position(1, 1)).get(5, TimeUnit.SECONDS));
        assertInstanceOf(ObjectNotFoundException.class, e.getCause());
    }

    @Test
    void http_batch_insert_stores_every_object() throws Exception {
        var http = new HttpObjectRepository(BASE, BOARD);
        http.insertMany(List.of(note("a", BOARD, 1_000), note("b", BOARD, 1_000))).get(5, TimeUnit.SECONDS);

        Set<String> ids = http.list(BOARD).get(5, TimeUnit.SECONDS).stream()
                .map(o -> o.id()).collect(Collectors.toSet());
        assertEquals(Set.of("a", "b"), ids);
    }

    @Test
    void messages_sent_before_the_server_answers_go_out_once_it_does() throws Exception {
        server.stop();
        var carol = WebSocketBoardChannel.start(BASE, BOARD, "carol", "CAROL", Duration.ofMillis(100));
        sockets.add(carol);

        var tracked = carol.track(PresenceUser.of("carol", "CAROL", System.currentTimeMillis()));
        assertFalse(tracked.isDone());
        assertEquals(1, carol.queuedCount());

        server = new WebServer(PORT, new BoardService(repo), relay);
        server.start();
        tracked.get(5, TimeUnit.SECONDS);
        assertEquals(0, carol.queuedCount());

        Inbox dave = join("dave");
        dave.awaitPresence(Set.of("carol", "dave"));
    }
}
