// file: sync/src/main/java/io/boardsync/sync/SyncConfig.java
package io.boardsync.sync;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Client-side tuning of one board session.
 *
 * @param cursorThrottle   trailing window for cursor broadcasts
 * @param objectThrottle   trailing window for move/resize broadcasts and drag frames
 * @param textThrottle     trailing window for free-text edits
 * @param historyLimit     undo stack capacity
 * @param heartbeat        presence re-track interval
 * @param pasteOffset      canvas offset applied to pasted copies
 */
public record SyncConfig(
        Duration cursorThrottle,
        Duration objectThrottle,
        Duration textThrottle,
        int historyLimit,
        Duration heartbeat,
        double pasteOffset
) {
    public SyncConfig {
        requirePositive(cursorThrottle, "cursorThrottle");
        requirePositive(objectThrottle, "objectThrottle");
        requirePositive(textThrottle, "textThrottle");
        requirePositive(heartbeat, "heartbeat");
        if (historyLimit <= 0) throw new IllegalArgumentException("historyLimit must be > 0");
    }

    public static SyncConfig defaults() {
        return new SyncConfig(
                Duration.ofMillis(16),
                Duration.ofMillis(16),
                Duration.ofMillis(50),
                50,
                Duration.ofSeconds(15),
                30);
    }

    /** Load a config file; keys that are missing keep their default value. */
    public static SyncConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            Json cfg = mapper.readValue(path.toFile(), Json.class);
            return new SyncConfig(
                    Duration.ofMillis(cfg.cursorThrottleMs),
                    Duration.ofMillis(cfg.objectThrottleMs),
                    Duration.ofMillis(cfg.textThrottleMs),
                    cfg.historyLimit,
                    Duration.ofSeconds(cfg.heartbeatSeconds),
                    cfg.pasteOffset);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load SyncConfig from " + path, e);
        }
    }

    private static void requirePositive(Duration d, String name) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
    }

    /** File shape of {@link SyncConfig}. */
    public static class Json {
        public long cursorThrottleMs = 16;
        public long objectThrottleMs = 16;
        public long textThrottleMs = 50;
        public int historyLimit = 50;
        public long heartbeatSeconds = 15;
        public double pasteOffset = 30;
    }
}
