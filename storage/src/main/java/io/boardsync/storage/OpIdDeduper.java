// file: storage/src/main/java/io/boardsync/storage/OpIdDeduper.java
package io.boardsync.storage;

import java.time.Duration;

/**
 * Remembers recently seen operation ids so a retried request (same
 * {@code Idempotency-Key}) is applied once.
 */
public interface OpIdDeduper {
    /** Returns true if this opId was not seen before and is now recorded. */
    boolean firstTime(String opId);

    void setTtl(Duration ttl);
}
