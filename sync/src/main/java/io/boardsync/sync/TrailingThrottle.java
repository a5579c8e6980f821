// file: sync/src/main/java/io/boardsync/sync/TrailingThrottle.java
package io.boardsync.sync;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BinaryOperator;
import java.util.function.Consumer;

/**
 * Trailing-edge throttle keyed by {@code K}.
 * <p>
 * The first submit after a quiet period opens a window of {@code interval}. Values
 * submitted for the same key inside the window are folded with {@code merge}; when
 * the window ends the folded values of all keys go to the sink in one call. So at
 * most one emission per window, and it always carries the latest value per key.
 * <p>
 * The throttle does not own a thread: {@link #flushDue()} has to be called often
 * enough (the orchestrator ticks it from its scheduler, tests call it directly).
 * The sink runs outside the throttle's lock.
 */
public final class TrailingThrottle<K, V> {

    private final long intervalMillis;
    private final Clock clock;
    private final BinaryOperator<V> merge;
    private final Consumer<Map<K, V>> sink;

    private Map<K, V> pending = new LinkedHashMap<>();
    private long windowEnd = -1;

    public TrailingThrottle(Duration interval, Clock clock, BinaryOperator<V> merge, Consumer<Map<K, V>> sink) {
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative()) throw new IllegalArgumentException("interval must be >= 0");
        this.intervalMillis = interval.toMillis();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.merge = Objects.requireNonNull(merge, "merge");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /** Keeps only the newest value. */
    public static <V> BinaryOperator<V> latest() {
        return (older, newer) -> newer;
    }

    public synchronized void submit(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        pending.merge(key, value, merge);
        if (windowEnd < 0) {
            windowEnd = clock.millis() + intervalMillis;
        }
    }

    /** Remove and return whatever is pending for {@code key}, or null. */
    public synchronized V take(K key) {
        V v = pending.remove(key);
        if (pending.isEmpty()) windowEnd = -1;
        return v;
    }

    /**
     * Emit if the current window has ended.
     *
     * @return true if something was sent to the sink
     */
    public boolean flushDue() {
        Map<K, V> batch;
        synchronized (this) {
            if (windowEnd < 0 || clock.millis() < windowEnd) return false;
            batch = drain();
        }
        if (batch.isEmpty()) return false;
        sink.accept(batch);
        return true;
    }

    /** Emit whatever is pending now, ignoring the window. */
    public boolean flushNow() {
        Map<K, V> batch;
        synchronized (this) {
            batch = drain();
        }
        if (batch.isEmpty()) return false;
        sink.accept(batch);
        return true;
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    public long intervalMillis() {
        return intervalMillis;
    }

    private Map<K, V> drain() {
        Map<K, V> batch = pending;
        pending = new LinkedHashMap<>();
        windowEnd = -1;
        return batch;
    }
}
