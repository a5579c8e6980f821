// file: storage/src/main/java/io/boardsync/storage/TtlOpIdDeduper.java
package io.boardsync.storage;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * TTL-bounded opId deduper.
 * <p>
 *  - firstTime(opId) returns false while the opId is inside its TTL window.
 *  - Backed by a ConcurrentHashMap of opId to expiry millis, cleaned lazily:
 *    each call scans a bounded slice of entries, so there is no background thread.
 */
public final class TtlOpIdDeduper implements OpIdDeduper {

    private static final int SCAN_LIMIT = 64;

    private final Map<String, Long> seen = new ConcurrentHashMap<>();
    private final Clock clock;
    private volatile long ttlMillis;

    public TtlOpIdDeduper(Duration ttl) {
        this(ttl, Clock.systemUTC());
    }

    public TtlOpIdDeduper(Duration ttl, Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        setTtl(ttl);
    }

    @Override
    public boolean firstTime(String opId) {
        Objects.requireNonNull(opId, "opId");
        long now = clock.millis();

        Long expireAt = seen.get(opId);
        if (expireAt != null && expireAt >= now) {
            return false;
        }
        seen.put(opId, now + ttlMillis);
        cleanup(now);
        return true;
    }

    @Override
    public void setTtl(Duration ttl) {
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive, got: " + ttl);
        }
        this.ttlMillis = ttl.toMillis();
    }

    int size() {
        return seen.size();
    }

    private void cleanup(long now) {
        int scanned = 0;
        for (var it = seen.entrySet().iterator(); it.hasNext() && scanned < SCAN_LIMIT; scanned++) {
            var e = it.next();
            if (e.getValue() < now) {
                it.remove();
            }
        }
    }
}
