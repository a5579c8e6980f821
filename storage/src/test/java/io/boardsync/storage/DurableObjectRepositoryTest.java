// file: storage/src/test/java/io/boardsync/storage/DurableObjectRepositoryTest.java
package io.boardsync.storage;

import io.boardsync.core.ObjectPatch;
import io.boardsync.core.ObjectUpdate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

import static io.boardsync.storage.TestObjects.rect;
import static org.junit.jupiter.api.Assertions.*;

class DurableObjectRepositoryTest {

    @TempDir Path walDir;
    @TempDir Path snapDir;

    private final MutableClock clock = new MutableClock(10_000);

    private DurableObjectRepository open(int snapshotEvery) {
        return new DurableObjectRepository(
                new FileWal(walDir, 1L << 40),
                new FileSnapshotter(snapDir),
                new TtlOpIdDeduper(Duration.ofMinutes(10), clock),
                new SnapshotPolicy(snapshotEvery),
                clock);
    }

    @Test
    void writes_survive_restart() {
        var repo = open(1_000);
        repo.insertNow(rect("a", "b1", 0, 1, 1_000), null);
        repo.insertNow(rect("b", "b1", 0, 1, 1_001), null);
        repo.insertNow(rect("c", "b2", 0, 1, 1_002), null);
        repo.updateNow("a", ObjectPatch.builder().x(42.0).property("fill", null).build(), null);
        repo.deleteNow("b", null);

        var reopened = open(1_000);
        var listed = reopened.listNow("b1");
        assertEquals(1, listed.size());
        var a = listed.get(0);
        assertEquals(42.0, a.x());
        assertEquals(2, a.version());
        assertFalse(a.properties().containsKey("fill"));
        assertEquals(1, reopened.listNow("b2").size());
    }

    @Test
    void snapshot_plus_wal_replay_recovers_latest_state() throws Exception {
        var repo = open(2);
        repo.insertNow(rect("a", "b1", 0, 1, 1_000), null);
        repo.updateNow("a", ObjectPatch.position(5, 5), null);   // snapshot here
        repo.updateNow("a", ObjectPatch.position(7, 7), null);
        repo.deleteNow("a", null);                               // and here
        repo.insertNow(rect("a", "b1", 1, 1, 20_000), null);

        try (var files = Files.list(snapDir)) {
            assertTrue(files.findAny().isPresent());
        }
        var reopened = open(1_000);
        var a = reopened.find("a").orElseThrow();
        assertEquals(1.0, a.x());
        assertEquals(20_000L, a.updatedAt());
    }

    @Test
    void unstamped_patch_gets_next_version_and_server_time() {
        var repo = open(1_000);
        repo.insertNow(rect("a", "b1", 0, 3, 1_000), null);

        int v = repo.updateNow("a", ObjectPatch.position(1, 1), null);

        assertEquals(4, v);
        assertEquals(clock.millis(), repo.find("a").orElseThrow().updatedAt());
    }

    @Test
    void stale_stamped_patch_is_rejected_and_reports_stored_version() {
        var repo = open(1_000);
        repo.insertNow(rect("a", "b1", 0, 5, 9_000), null);

        int v = repo.updateNow("a", ObjectPatch.position(1, 1).withStamp(6, 8_000L, "bob"), null);

        assertEquals(5, v);
        assertEquals(0.0, repo.find("a").orElseThrow().x());
    }

    @Test
    void losing_insert_keeps_stored_copy() {
        var repo = open(1_000);
        repo.insertNow(rect("a", "b1", 3, 2, 5_000), null);

        var stored = repo.insertNow(rect("a", "b1", 99, 1, 5_000), null);

        assertEquals(3.0, stored.x());
        assertEquals(2, stored.version());
    }

    @Test
    void retried_op_id_is_applied_once() {
        var repo = open(1_000);
        repo.insertNow(rect("a", "b1", 0, 1, 1_000), null);

        assertEquals(2, repo.updateNow("a", ObjectPatch.position(1, 1), "op-1"));
        assertEquals(2, repo.updateNow("a", ObjectPatch.position(1, 1), "op-1"));
        assertEquals(3, repo.updateNow("a", ObjectPatch.position(2, 2), "op-2"));
    }

    @Test
    void update_of_unknown_id_fails_the_future() {
        var repo = open(1_000);
        var f = repo.update("nope", ObjectPatch.position(1, 1));

        var ex = assertThrows(CompletionException.class, f::join);
        assertInstanceOf(ObjectNotFoundException.class, ex.getCause());
    }

    @Test
    void batch_update_and_delete_skip_unknown_ids() {
        var repo = open(1_000);
        repo.insertNow(rect("a", "b1", 0, 1, 1_000), null);
        repo.insertNow(rect("b", "b1", 0, 1, 1_000), null);

        Map<String, Integer> versions = repo.updateMany(List.of(
                new ObjectUpdate("a", ObjectPatch.position(1, 1)),
                new ObjectUpdate("ghost", ObjectPatch.position(1, 1)),
                new ObjectUpdate("b", ObjectPatch.position(2, 2)))).join();
        assertEquals(Map.of("a", 2, "b", 2), versions);

        repo.deleteMany(List.of("a", "ghost")).join();
        assertEquals(List.of("b"), repo.listNow("b1").stream().map(o -> o.id()).toList());
    }

    @Test
    void batch_insert_stores_winners_once_per_op_id() {
        var repo = open(1_000);
        repo.insertNow(rect("a", "b1", 7, 4, 5_000), null);

        int stored = repo.insertManyNow(List.of(
                rect("a", "b1", 0, 1, 1_000),
                rect("b", "b1", 0, 1, 1_000),
                rect("c", "b1", 0, 1, 1_000)), "paste-1");
        assertEquals(2, stored);
        assertEquals(0, repo.insertManyNow(List.of(rect("d", "b1", 0, 1, 1_000)), "paste-1"));

        var reopened = open(1_000);
        assertEquals(List.of("a", "b", "c"),
                reopened.listNow("b1").stream().map(o -> o.id()).sorted().toList());
        assertEquals(7.0, reopened.find("a").orElseThrow().x());
    }

    @Test
    void committed_changes_are_published_in_order() {
        var repo = open(1_000);
        List<String> seen = new ArrayList<>();
        repo.subscribe(c -> seen.add(c.kind() + " " + c.objectId()));

        repo.insertNow(rect("a", "b1", 0, 1, 1_000), null);
        repo.updateNow("a", ObjectPatch.position(1, 1), null);
        repo.updateNow("a", ObjectPatch.position(1, 1).withStamp(1, 1L, "old"), null);
        repo.deleteNow("a", null);
        repo.deleteNow("a", null);

        assertEquals(List.of("INSERT a", "UPDATE a", "DELETE a"), seen);
    }

    @Test
    void list_is_ordered_by_creation_time() {
        var repo = open(1_000);
        repo.insertNow(rect("late", "b1", 0, 1, 3_000), null);
        repo.insertNow(rect("early", "b1", 0, 1, 1_000), null);
        repo.insertNow(rect("mid", "b1", 0, 1, 2_000), null);

        assertEquals(List.of("early", "mid", "late"),
                repo.list("b1").join().stream().map(o -> o.id()).toList());
    }
}
