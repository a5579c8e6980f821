// file: core/src/test/java/io/boardsync/core/ConflictResolverTest.java
package io.boardsync.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static io.boardsync.core.ConflictResolver.Resolution.*;
import static org.junit.jupiter.api.Assertions.*;

class ConflictResolverTest {

    private final ConflictResolver lww = new ConflictResolver.LastWriterWins();

    @Test
    void later_timestamp_wins_regardless_of_version() {
        assertEquals(REMOTE_WINS, lww.resolve(new VersionStamp(9, 1000), new VersionStamp(1, 1001)));
        assertEquals(LOCAL_WINS, lww.resolve(new VersionStamp(1, 1001), new VersionStamp(9, 1000)));
    }

    @Test
    void equal_timestamps_fall_back_to_version() {
        assertEquals(REMOTE_WINS, lww.resolve(new VersionStamp(3, 500), new VersionStamp(4, 500)));
        assertEquals(LOCAL_WINS, lww.resolve(new VersionStamp(4, 500), new VersionStamp(3, 500)));
    }

    @Test
    void identical_stamp_is_a_duplicate_and_not_applied() {
        var stamp = new VersionStamp(2, 700);
        assertEquals(DUPLICATE, lww.resolve(stamp, new VersionStamp(2, 700)));
        assertFalse(lww.shouldApplyRemote(stamp, new VersionStamp(2, 700)));
    }

    @Test
    void stale_copy_with_later_timestamp_beats_fresh_create() {
        // A creates X at T0; B edits a stale copy at T1 > T0.
        var aCreate = new VersionStamp(1, 10_000);
        var bEdit = new VersionStamp(1, 10_050);
        assertTrue(lww.shouldApplyRemote(aCreate, bEdit));
        assertFalse(lww.shouldApplyRemote(bEdit, aCreate));
    }

    @Test
    void version_four_wins_over_three_in_either_arrival_order() {
        var v3 = new VersionStamp(3, 2_000);
        var v4 = new VersionStamp(4, 2_000);
        assertEquals(v4, fold(List.of(v3, v4)));
        assertEquals(v4, fold(List.of(v4, v3)));
    }

    @Test
    void every_delivery_order_converges_to_the_same_stamp() {
        List<VersionStamp> writes = new ArrayList<>(List.of(
                new VersionStamp(1, 100), new VersionStamp(2, 150), new VersionStamp(3, 150),
                new VersionStamp(2, 90), new VersionStamp(5, 120), new VersionStamp(3, 150)));
        VersionStamp expected = fold(writes);
        Random rnd = new Random(42);
        for (int i = 0; i < 50; i++) {
            Collections.shuffle(writes, rnd);
            assertEquals(expected, fold(writes));
        }
        assertEquals(new VersionStamp(3, 150), expected);
    }

    private VersionStamp fold(List<VersionStamp> deliveries) {
        VersionStamp held = null;
        for (VersionStamp incoming : deliveries) {
            if (lww.shouldApplyRemote(held, incoming)) held = incoming;
        }
        return held;
    }
}
