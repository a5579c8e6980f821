// file: core/src/main/java/io/boardsync/core/ConflictResolver.java
package io.boardsync.core;

/**
 * Decides whether an incoming copy of an object should replace the copy held locally.
 * <p>
 * Every replica (clients and the durable store alike) must use the same rule,
 * otherwise peers that see writes in different orders stop converging.
 */
public interface ConflictResolver {

    enum Resolution {
        /** Incoming copy is newer: replace the local one. */
        REMOTE_WINS,
        /** Local copy is newer: drop the incoming one. */
        LOCAL_WINS,
        /** Same stamp: this write was already applied. */
        DUPLICATE
    }

    Resolution resolve(VersionStamp local, VersionStamp remote);

    default boolean shouldApplyRemote(VersionStamp local, VersionStamp remote) {
        return resolve(local, remote) == Resolution.REMOTE_WINS;
    }

    /**
     * Last-writer-wins on {@code updatedAt}, with {@code version} breaking ties
     * between writes stamped in the same millisecond.
     * <p>
     * The ordering is total over {@code (updatedAt, version)}, so applying a set of
     * writes in any order leaves every replica on the same maximum.
     */
    final class LastWriterWins implements ConflictResolver {
        @Override
        public Resolution resolve(VersionStamp local, VersionStamp remote) {
            if (local == null) return Resolution.REMOTE_WINS;
            if (remote == null) return Resolution.LOCAL_WINS;
            if (remote.updatedAt() > local.updatedAt()) return Resolution.REMOTE_WINS;
            if (remote.updatedAt() < local.updatedAt()) return Resolution.LOCAL_WINS;
            if (remote.version() > local.version()) return Resolution.REMOTE_WINS;
            if (remote.version() < local.version()) return Resolution.LOCAL_WINS;
            return Resolution.DUPLICATE;
        }
    }
}
