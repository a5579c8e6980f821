// file: sync/src/test/java/io/boardsync/sync/PresenceTrackerTest.java
package io.boardsync.sync;

import io.boardsync.core.PresenceUser;
import io.boardsync.sync.channel.PresenceChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class PresenceTrackerTest {

    private static final class FakePresenceChannel implements PresenceChannel {
        final List<String> sent = new ArrayList<>();
        Consumer<List<PresenceUser>> listener;

        @Override
        public synchronized CompletableFuture<Void> track(PresenceUser user) {
            sent.add("track " + user.userId());
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public synchronized CompletableFuture<Void> heartbeat(PresenceUser user) {
            sent.add("heartbeat " + user.userId());
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public synchronized CompletableFuture<Void> leave(String userId) {
            sent.add("leave " + userId);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void onSync(Consumer<List<PresenceUser>> listener) {
            this.listener = listener;
        }

        @Override
        public void offSync(Consumer<List<PresenceUser>> listener) {
            if (this.listener == listener) this.listener = null;
        }
    }

    private final MutableClock clock = new MutableClock(5_000);
    private final FakePresenceChannel channel = new FakePresenceChannel();
    private final PresenceTracker tracker = new PresenceTracker(
            new BoardSession("b-1", "alice", "Alice"), channel, Duration.ofHours(1), clock);

    @AfterEach
    void tearDown() {
        tracker.close();
    }

    private static List<String> ids(List<PresenceUser> users) {
        return users.stream().map(PresenceUser::userId).toList();
    }

    @Test
    void self_is_listed_before_the_relay_answers() {
        tracker.join();

        assertEquals(List.of("alice"), ids(tracker.onlineUsers()));
        var self = tracker.onlineUsers().get(0);
        assertEquals("Alice", self.userName());
        assertEquals(5_000L, self.onlineAt());
        assertEquals(List.of("track alice"), channel.sent);
    }

    @Test
    void sync_replaces_the_list_deduplicated_and_keeps_self() {
        tracker.join();

        channel.listener.accept(List.of(
                PresenceUser.of("bob", "Bob", 1),
                PresenceUser.of("bob", "Bob", 2),
                PresenceUser.of("carol", "Carol", 3)));

        assertEquals(List.of("alice", "bob", "carol"), ids(tracker.onlineUsers()));
        assertEquals(1L, tracker.onlineUsers().get(1).onlineAt());
    }

    @Test
    void colors_are_derived_from_the_user_id() {
        tracker.join();
        channel.listener.accept(List.of(PresenceUser.of("ab", "Ab", 1)));

        assertEquals("#EC4899", tracker.onlineUsers().get(1).color());
    }

    @Test
    void listeners_see_every_change() {
        List<List<String>> seen = new ArrayList<>();
        tracker.addListener(users -> seen.add(ids(users)));

        tracker.join();
        channel.listener.accept(List.of(PresenceUser.of("bob", "Bob", 1)));
        tracker.leave();

        assertEquals(List.of(List.of("alice"), List.of("alice", "bob"), List.of()), seen);
    }

    @Test
    void heartbeat_and_leave_are_sent_for_self() {
        tracker.heartbeatNow();
        assertTrue(channel.sent.isEmpty());

        tracker.join();
        tracker.heartbeatNow();
        tracker.leave();

        assertEquals(List.of("track alice", "heartbeat alice", "leave alice"), channel.sent);
        assertTrue(tracker.onlineUsers().isEmpty());
    }

    @Test
    void leaving_stops_listening_to_the_relay() {
        tracker.join();
        Consumer<List<PresenceUser>> subscribed = channel.listener;
        tracker.leave();

        assertNull(channel.listener);
        // a sync already in flight when we left
        subscribed.accept(List.of(PresenceUser.of("bob", "Bob", 1)));
        assertTrue(tracker.onlineUsers().isEmpty());
    }
}
