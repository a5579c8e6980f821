// file: storage/src/test/java/io/boardsync/storage/TtlOpIdDeduperTest.java
package io.boardsync.storage;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class TtlOpIdDeduperTest {

    @Test
    void same_opid_within_ttl_is_not_first_time() {
        var d = new TtlOpIdDeduper(Duration.ofSeconds(5), new MutableClock(0));

        assertTrue(d.firstTime("op-123"), "first call should be firstTime");
        assertFalse(d.firstTime("op-123"), "second call within TTL should NOT be firstTime");
    }

    @Test
    void opid_becomes_first_time_again_after_ttl_expires() {
        var clock = new MutableClock(1_000);
        var d = new TtlOpIdDeduper(Duration.ofMillis(50), clock);

        assertTrue(d.firstTime("op-xyz"));
        clock.advance(50);
        assertFalse(d.firstTime("op-xyz"), "expiry is inclusive");
        clock.advance(1);
        assertTrue(d.firstTime("op-xyz"));
    }

    @Test
    void expired_entries_are_cleaned_up_on_later_calls() {
        var clock = new MutableClock(0);
        var d = new TtlOpIdDeduper(Duration.ofMillis(10), clock);
        for (int i = 0; i < 20; i++) {
            d.firstTime("op-" + i);
        }
        clock.advance(100);
        d.firstTime("fresh");
        assertEquals(1, d.size());
    }

    @Test
    void set_ttl_rejects_non_positive_values() {
        var d = new TtlOpIdDeduper(Duration.ofMillis(10));

        assertThrows(IllegalArgumentException.class, () -> d.setTtl(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> d.setTtl(Duration.ofMillis(-1)));
    }
}
