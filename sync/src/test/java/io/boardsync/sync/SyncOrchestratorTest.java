// file: sync/src/test/java/io/boardsync/sync/SyncOrchestratorTest.java
package io.boardsync.sync;

import io.boardsync.core.Connectors;
import io.boardsync.core.CursorPosition;
import io.boardsync.core.ObjectPatch;
import io.boardsync.core.ObjectStore;
import io.boardsync.core.ObjectType;
import io.boardsync.core.ObjectUpdate;
import io.boardsync.core.Viewport;
import io.boardsync.core.WhiteboardObject;
import io.boardsync.storage.ObjectChange;
import io.boardsync.sync.message.BroadcastMessage;
import io.boardsync.sync.message.ChangeNotification;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static io.boardsync.sync.TestBoards.BOARD;
import static io.boardsync.sync.TestBoards.sticky;
import static org.junit.jupiter.api.Assertions.*;

class SyncOrchestratorTest {

    private final MutableClock clock = new MutableClock(10_000);
    private final RecordingRepository repo = new RecordingRepository();
    private final RecordingChannel channel = new RecordingChannel();
    private final ObjectStore store = new ObjectStore();
    private final AtomicInteger nextId = new AtomicInteger();
    private SyncOrchestrator sync;

    @BeforeEach
    void setUp() {
        repo.objects.put("a", sticky("a", 0, 0));
        repo.objects.put("b", sticky("b", 100, 100));
        sync = new SyncOrchestrator(new BoardSession(BOARD, "me", "Me"), store, repo, channel,
                SyncConfig.defaults(), clock, () -> "n" + nextId.incrementAndGet());
        store.setBoardContext(BOARD);
        sync.load().join();
        repo.calls.clear();
    }

    private WhiteboardObject held(String id) {
        return store.get(id).orElseThrow();
    }

    // ---------- local path ----------

    @Test
    void create_is_broadcast_at_once_and_inserted() {
        var created = sync.createObject(ObjectType.RECTANGLE, 5, 5, 150, 100, Map.of("fill", "#3B82F6"));

        assertEquals("n1", created.id());
        assertEquals(1, created.version());
        assertEquals(10_000L, created.createdAt());
        assertEquals("me", created.updatedBy());
        assertEquals(List.of(new BroadcastMessage.Created("me", created)), channel.sent);
        assertEquals(List.of("insert n1"), repo.calls);
        assertEquals(1, store.undoDepth());
    }

    @Test
    void moves_in_one_window_leave_as_one_delta_with_the_last_position() {
        sync.updateObject("a", ObjectPatch.position(1, 1));
        sync.updateObject("a", ObjectPatch.position(2, 2));
        sync.updateObject("a", ObjectPatch.position(3, 3));
        assertTrue(channel.sent.isEmpty());
        assertEquals(3.0, held("a").x());

        clock.advance(16);
        sync.flushDue();

        var updates = channel.sentOf(BroadcastMessage.Updated.class);
        assertEquals(1, updates.size());
        assertEquals(3.0, updates.get(0).patch().x());
        assertEquals(4, updates.get(0).patch().version());
        assertEquals(List.of("update a"), repo.calls);
    }

    @Test
    void moves_of_two_objects_in_one_window_are_one_batch_message() {
        sync.updateObject("a", ObjectPatch.position(1, 1));
        sync.updateObject("b", ObjectPatch.position(2, 2));
        clock.advance(16);
        sync.flushDue();

        var batches = channel.sentOf(BroadcastMessage.MovedBatch.class);
        assertEquals(1, batches.size());
        assertEquals(List.of("a", "b"), batches.get(0).updates().stream().map(ObjectUpdate::id).toList());
        assertEquals(List.of("updateMany 2"), repo.calls);
    }

    @Test
    void text_edits_wait_for_the_longer_window() {
        sync.updateObject("a", ObjectPatch.builder().property("text", "h").build());
        sync.updateObject("a", ObjectPatch.builder().property("text", "hi").build());

        clock.advance(16);
        sync.flushDue();
        assertTrue(channel.sent.isEmpty());

        clock.advance(34);
        sync.flushDue();
        var updates = channel.sentOf(BroadcastMessage.Updated.class);
        assertEquals(1, updates.size());
        assertEquals("hi", updates.get(0).patch().properties().get("text"));
    }

    @Test
    void other_edits_go_out_at_once_carrying_a_pending_move() {
        sync.updateObject("a", ObjectPatch.position(5, 5));
        sync.updateObject("a", ObjectPatch.builder().property("noteColor", "#000000").build());

        var updates = channel.sentOf(BroadcastMessage.Updated.class);
        assertEquals(1, updates.size());
        ObjectPatch p = updates.get(0).patch();
        assertEquals(5.0, p.x());
        assertEquals("#000000", p.properties().get("noteColor"));
        assertEquals(3, p.version());

        clock.advance(16);
        sync.flushDue();
        assertEquals(1, channel.sent.size());
    }

    @Test
    void local_stamp_is_next_version_and_never_older_than_held() {
        store.addObject(sticky("a", 0, 0).withStamp(7, 50_000L, "bob"));

        sync.updateObject("a", ObjectPatch.builder().property("noteColor", "#000000").build());

        assertEquals(8, held("a").version());
        assertEquals(50_000L, held("a").updatedAt());
        assertEquals("me", held("a").updatedBy());
    }

    @Test
    void update_that_changes_nothing_sends_nothing() {
        assertFalse(sync.updateObject("a", ObjectPatch.position(0, 0)));
        assertFalse(sync.updateObject("ghost", ObjectPatch.position(1, 1)));
        assertEquals(1, held("a").version());
        assertEquals(0, store.undoDepth());
    }

    @Test
    void drag_is_one_undo_step_and_one_update_many() {
        sync.beginDrag();
        for (int i = 1; i <= 10; i++) {
            sync.drag(List.of(
                    new ObjectUpdate("a", ObjectPatch.position(i, 0)),
                    new ObjectUpdate("b", ObjectPatch.position(100 + i, 100))));
            clock.advance(4);
            sync.flushDue();
        }
        sync.endDrag();

        assertEquals(1, store.undoDepth());
        assertTrue(channel.sent.stream().allMatch(m -> m instanceof BroadcastMessage.MovedBatch));
        var last = channel.sentOf(BroadcastMessage.MovedBatch.class);
        assertEquals(10.0, last.get(last.size() - 1).updates().get(0).patch().x());

        assertEquals(List.of("updateMany 2"), repo.calls);
        var finals = repo.updateManyCalls.get(0);
        assertEquals(10.0, finals.get(0).patch().x());
        assertEquals(11, finals.get(0).patch().version());

        sync.undo();
        assertEquals(0.0, held("a").x());
        assertEquals(100.0, held("b").x());
    }

    @Test
    void deleting_the_selection_is_one_message_and_one_repository_call() {
        store.selectObject("a", false);
        store.selectObject("b", true);

        assertEquals(List.of("a", "b"), sync.deleteSelected());

        assertEquals(List.of(new BroadcastMessage.Deleted("me", List.of("a", "b"))), channel.sent);
        assertEquals(List.of("deleteMany 2"), repo.calls);
        assertEquals(1, store.undoDepth());
    }

    @Test
    void undoing_a_batch_delete_recreates_both_with_fresh_stamps() {
        store.setSelectedIds(List.of("a", "b"));
        sync.deleteSelected();
        channel.clear();
        repo.calls.clear();

        assertTrue(sync.undo());

        assertEquals(2, held("a").version());
        assertEquals(2, held("b").version());
        assertEquals(List.of(new BroadcastMessage.CreatedBatch("me", List.of(held("a"), held("b")))), channel.sent);
        assertEquals(List.of("insertMany 2"), repo.calls);
    }

    @Test
    void undo_in_the_middle_of_a_drag_closes_the_drag_first() {
        var created = sync.createObject(ObjectType.RECTANGLE, 0, 0, 50, 50, Map.of());
        sync.beginDrag();
        sync.drag(List.of(new ObjectUpdate(created.id(), ObjectPatch.position(1, 0))));

        assertTrue(sync.undo());
        assertEquals(0.0, held(created.id()).x());

        for (int i = 1; i <= 10; i++) {
            sync.drag(List.of(new ObjectUpdate(created.id(), ObjectPatch.position(10 * i, 0))));
        }
        sync.endDrag();

        assertEquals(100.0, held(created.id()).x());
        assertEquals(2, store.undoDepth(), "create plus one drag");
        sync.undo();
        assertEquals(0.0, held(created.id()).x());
    }

    @Test
    void undo_and_redo_restamp_above_the_held_version() {
        sync.updateObject("a", ObjectPatch.builder().property("noteColor", "#000000").build());
        assertEquals(2, held("a").version());
        channel.clear();

        assertTrue(sync.undo());
        assertEquals("#FEF08A", held("a").property("noteColor"));
        assertEquals(3, held("a").version());
        assertEquals("me", held("a").updatedBy());
        var undoMsg = channel.sentOf(BroadcastMessage.MovedBatch.class);
        assertEquals(1, undoMsg.size());
        ObjectPatch delta = undoMsg.get(0).updates().get(0).patch();
        assertEquals("#FEF08A", delta.properties().get("noteColor"));
        assertEquals(3, delta.version());

        assertTrue(sync.redo());
        assertEquals("#000000", held("a").property("noteColor"));
        assertEquals(4, held("a").version());
    }

    @Test
    void undoing_a_create_deletes_everywhere() {
        var created = sync.createObject(ObjectType.CIRCLE, 0, 0, 50, 50, Map.of());
        channel.clear();
        repo.calls.clear();

        sync.undo();

        assertTrue(store.get(created.id()).isEmpty());
        assertEquals(List.of(new BroadcastMessage.Deleted("me", List.of(created.id()))), channel.sent);
        assertEquals(List.of("delete " + created.id()), repo.calls);
    }

    @Test
    void undo_with_empty_history_does_nothing() {
        assertFalse(sync.undo());
        assertFalse(sync.redo());
        assertTrue(channel.sent.isEmpty());
    }

    @Test
    void paste_offsets_copies_and_selects_them() {
        store.selectObject("a", false);
        assertEquals(1, sync.copySelected());

        var pasted = sync.paste();

        assertEquals(1, pasted.size());
        var copy = pasted.get(0);
        assertEquals("n1", copy.id());
        assertEquals(30.0, copy.x());
        assertEquals(30.0, copy.y());
        assertEquals(Set.of("n1"), store.selectedIds());
        assertEquals(1, store.undoDepth());
        assertEquals(List.of("insert n1"), repo.calls);
    }

    @Test
    void pasting_several_objects_is_one_message_and_one_insert() {
        store.setSelectedIds(List.of("a", "b"));
        sync.copySelected();

        var pasted = sync.paste();

        assertEquals(2, pasted.size());
        assertEquals(List.of(new BroadcastMessage.CreatedBatch("me", pasted)), channel.sent);
        assertEquals(List.of("insertMany 2"), repo.calls);
        assertEquals(1, store.undoDepth());
    }

    @Test
    void throttled_move_is_restamped_when_a_remote_write_won_meanwhile() {
        sync.updateObject("a", ObjectPatch.position(50, 50));
        clock.advance(5);
        sync.onBroadcast(new BroadcastMessage.Updated("bob", "a",
                ObjectPatch.builder().property("noteColor", "#EF4444").build().withStamp(2, 10_005L, "bob")));
        assertEquals("bob", held("a").updatedBy());
        assertEquals(50.0, held("a").x());

        clock.advance(11);
        sync.flushDue();

        ObjectPatch sent = channel.sentOf(BroadcastMessage.Updated.class).get(0).patch();
        assertEquals(50.0, sent.x());
        assertEquals(3, sent.version());
        assertEquals(10_016L, sent.updatedAt());
        assertEquals("me", sent.updatedBy());
        assertEquals(3, held("a").version());
        assertEquals("me", held("a").updatedBy());
        assertEquals("#EF4444", held("a").property("noteColor"));
    }

    @Test
    void throttled_patch_for_an_object_deleted_meanwhile_is_dropped() {
        sync.updateObject("a", ObjectPatch.position(5, 5));
        store.deleteObject("a");

        clock.advance(16);
        sync.flushDue();

        assertTrue(channel.sent.isEmpty());
        assertTrue(repo.calls.isEmpty());
    }

    // ---------- connectors ----------

    private static WhiteboardObject arrowFromA() {
        return WhiteboardObject.builder()
                .id("ar").boardId(BOARD).type(ObjectType.ARROW)
                .x(200).y(100).width(100).height(0)
                .property(Connectors.POINTS, List.of(0.0, 0.0, 100.0, 0.0))
                .property(Connectors.START_ID, "a")
                .property(Connectors.START_SIDE, "right-50")
                .updatedBy("alice").updatedAt(1_000L).createdAt(1_000L).version(1)
                .build();
    }

    @Test
    void moving_a_shape_brings_its_arrow_in_the_same_undo_step() {
        store.addObject(arrowFromA());

        assertTrue(sync.updateObject("a", ObjectPatch.position(10, 0)));

        assertEquals(210.0, held("ar").x());
        assertEquals(90.0, held("ar").width());
        assertEquals(2, held("ar").version());
        assertEquals("me", held("ar").updatedBy());
        assertEquals(1, store.undoDepth());

        clock.advance(16);
        sync.flushDue();
        var batch = channel.sentOf(BroadcastMessage.MovedBatch.class);
        assertEquals(1, batch.size());
        assertEquals(List.of("a", "ar"), batch.get(0).updates().stream().map(ObjectUpdate::id).toList());
        assertEquals(List.of("updateMany 2"), repo.calls);

        sync.undo();
        assertEquals(200.0, held("ar").x());
        assertEquals(0.0, held("a").x());
    }

    @Test
    void dragging_a_shape_persists_its_arrow_with_the_drag() {
        store.addObject(arrowFromA());

        sync.beginDrag();
        sync.drag(List.of(new ObjectUpdate("a", ObjectPatch.position(0, 20))));
        sync.endDrag();

        assertEquals(120.0, held("ar").y());
        assertEquals(List.of("a", "ar"), repo.updateManyCalls.get(0).stream().map(ObjectUpdate::id).toList());
        assertEquals(1, store.undoDepth());
    }

    @Test
    void remote_move_lays_out_attached_arrows_locally() {
        store.addObject(arrowFromA());

        sync.onBroadcast(new BroadcastMessage.Updated("bob", "a",
                ObjectPatch.position(10, 0).withStamp(2, 20_000L, "bob")));

        assertEquals(210.0, held("ar").x());
        assertEquals(1, held("ar").version(), "local layout carries no stamp");
        assertTrue(channel.sent.isEmpty());
        assertEquals(0, store.undoDepth());
    }

    @Test
    void cursor_moves_are_throttled_to_the_last_position() {
        sync.moveCursor(1, 1);
        sync.moveCursor(2, 2);
        clock.advance(16);
        sync.flushDue();

        var cursors = channel.sentOf(BroadcastMessage.CursorMoved.class);
        assertEquals(1, cursors.size());
        assertEquals(2.0, cursors.get(0).cursor().x());
        assertEquals("me", cursors.get(0).cursor().userId());
    }

    @Test
    void repository_failure_is_not_rolled_back() {
        repo.failWrites = true;

        var created = sync.createObject(ObjectType.TEXT, 0, 0, 100, 20, Map.of("text", "x"));
        store.selectObject("a", false);
        sync.deleteSelected();

        assertTrue(store.get(created.id()).isPresent());
        assertTrue(store.get("a").isEmpty());
        assertEquals(2, channel.sent.size());
    }

    // ---------- remote path ----------

    @Test
    void own_echo_is_ignored() {
        sync.onBroadcast(new BroadcastMessage.Updated("me", "a",
                ObjectPatch.position(9, 9).withStamp(5, 99_000L, "me")));

        assertEquals(0.0, held("a").x());
    }

    @Test
    void remote_update_applies_without_history_or_rebroadcast() {
        sync.onBroadcast(new BroadcastMessage.Updated("bob", "a",
                ObjectPatch.position(9, 9).withStamp(2, 20_000L, "bob")));

        assertEquals(9.0, held("a").x());
        assertEquals(2, held("a").version());
        assertEquals(0, store.undoDepth());
        assertTrue(channel.sent.isEmpty());
        assertTrue(repo.calls.isEmpty());
    }

    @Test
    void stale_remote_update_is_dropped() {
        sync.onBroadcast(new BroadcastMessage.Updated("bob", "a",
                ObjectPatch.position(9, 9).withStamp(5, 500L, "bob")));

        assertEquals(0.0, held("a").x());
    }

    @Test
    void remote_batch_and_unknown_ids() {
        sync.onBroadcast(new BroadcastMessage.MovedBatch("bob", List.of(
                new ObjectUpdate("a", ObjectPatch.position(1, 1).withStamp(2, 20_000L, "bob")),
                new ObjectUpdate("ghost", ObjectPatch.position(1, 1).withStamp(2, 20_000L, "bob")),
                new ObjectUpdate("b", ObjectPatch.position(2, 2).withStamp(2, 20_000L, "bob")))));

        assertEquals(1.0, held("a").x());
        assertEquals(2.0, held("b").x());
        assertTrue(store.get("ghost").isEmpty());
    }

    @Test
    void remote_create_of_a_held_id_resolves_like_an_update() {
        var older = sticky("a", 50, 50).withStamp(1, 500L, "bob");
        sync.onBroadcast(new BroadcastMessage.Created("bob", older));
        assertEquals(0.0, held("a").x());

        var newer = sticky("a", 50, 50).withStamp(3, 30_000L, "bob");
        sync.onBroadcast(new BroadcastMessage.Created("bob", newer));
        assertEquals(newer, held("a"));
    }

    @Test
    void remote_delete_drops_pending_local_moves() {
        sync.updateObject("a", ObjectPatch.position(5, 5));
        sync.onBroadcast(new BroadcastMessage.Deleted("bob", List.of("a", "zzz")));

        clock.advance(16);
        sync.flushDue();

        assertTrue(store.get("a").isEmpty());
        assertTrue(channel.sent.isEmpty());
    }

    @Test
    void viewport_moves_are_throttled_and_suppressed_while_following() {
        assertTrue(sync.moveViewport(1.0, 0, 0));
        assertTrue(sync.moveViewport(1.5, -40, 25));
        clock.advance(16);
        sync.flushDue();

        var sent = channel.sentOf(BroadcastMessage.ViewportChanged.class);
        assertEquals(1, sent.size());
        assertEquals(1.5, sent.get(0).viewport().zoom());
        assertEquals(-40.0, sent.get(0).viewport().panOffsetX());

        sync.followMode().startFollowing("bob", "Bob");
        assertFalse(sync.moveViewport(2.0, 0, 0));
    }

    @Test
    void spotlight_from_another_user_is_followed_until_opted_out() {
        sync.onBroadcast(new BroadcastMessage.Spotlight("bob", BroadcastMessage.Spotlight.Action.START, "bob", "Bob"));
        sync.onBroadcast(new BroadcastMessage.ViewportChanged("bob", new Viewport("bob", 2.0, 10, 20, 11_000L)));

        var follow = sync.followMode();
        assertEquals("bob", follow.following().orElseThrow().userId());
        assertEquals(2.0, follow.followedViewport().orElseThrow().zoom());

        follow.breakFollow();
        assertTrue(follow.spotlightOptedOut());
        assertFalse(follow.isFollowing());

        sync.onBroadcast(new BroadcastMessage.Spotlight("bob", BroadcastMessage.Spotlight.Action.STOP, "bob", "Bob"));
        assertTrue(follow.spotlight().isEmpty());
        assertFalse(follow.spotlightOptedOut());
    }

    @Test
    void own_spotlight_is_announced_and_stopped() {
        sync.startSpotlight();
        assertTrue(sync.followMode().isSpotlighting());
        sync.stopSpotlight();
        sync.stopSpotlight();

        assertEquals(List.of(
                new BroadcastMessage.Spotlight("me", BroadcastMessage.Spotlight.Action.START, "me", "Me"),
                new BroadcastMessage.Spotlight("me", BroadcastMessage.Spotlight.Action.STOP, "me", "Me")),
                channel.sent);
        assertFalse(sync.followMode().isSpotlighting());
    }

    @Test
    void closed_orchestrator_ignores_the_channel() {
        sync.open().join();
        assertEquals(List.of(sync), channel.listeners);

        sync.close();

        assertTrue(channel.listeners.isEmpty());
        sync.onBroadcast(new BroadcastMessage.Created("bob", sticky("c", 1, 1).withStamp(1, 20_000L, "bob")));
        sync.onChange(new ChangeNotification(ObjectChange.Kind.DELETE, null, "a"));
        assertTrue(store.get("c").isEmpty());
        assertTrue(store.get("a").isPresent());
    }

    @Test
    void remote_cursor_is_tracked() {
        var c = new CursorPosition("bob", "Bob", "#EF4444", 4, 5);
        sync.onBroadcast(new BroadcastMessage.CursorMoved("bob", c));

        assertEquals(c, sync.cursors().get("bob").orElseThrow());
    }

    @Test
    void change_feed_skips_own_writes_and_applies_others() {
        var mine = sticky("a", 77, 77).withStamp(9, 90_000L, "me");
        sync.onChange(new ChangeNotification(ObjectChange.Kind.UPDATE, mine, "a"));
        assertEquals(0.0, held("a").x());

        var theirs = sticky("a", 66, 66).withStamp(9, 90_000L, "bob");
        sync.onChange(new ChangeNotification(ObjectChange.Kind.UPDATE, theirs, "a"));
        assertEquals(66.0, held("a").x());

        sync.onChange(new ChangeNotification(ObjectChange.Kind.DELETE, null, "b"));
        assertTrue(store.get("b").isEmpty());
        assertEquals(0, store.undoDepth());
    }

    @Test
    void resync_merges_without_dropping_local_only_objects() {
        var local = sync.createObject(ObjectType.FRAME, 0, 0, 400, 300, Map.of("title", "Ideas"));
        repo.objects.remove(local.id());
        repo.objects.put("a", sticky("a", 12, 12).withStamp(4, 40_000L, "bob"));

        sync.resync().join();

        assertEquals(12.0, held("a").x());
        assertTrue(store.get(local.id()).isPresent());
        assertEquals(1, store.undoDepth());
    }
}
