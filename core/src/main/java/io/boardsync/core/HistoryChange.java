// file: core/src/main/java/io/boardsync/core/HistoryChange.java
package io.boardsync.core;

import java.util.Objects;

/**
 * One recorded local mutation, with enough state to apply it in either direction.
 */
public sealed interface HistoryChange permits HistoryChange.Created, HistoryChange.Deleted, HistoryChange.Updated {

    String objectId();

    /** Object was added; undo removes it, redo adds it back as it was. */
    record Created(WhiteboardObject object) implements HistoryChange {
        public Created {
            Objects.requireNonNull(object, "object");
        }

        @Override
        public String objectId() {
            return object.id();
        }
    }

    /** Object was removed; undo restores this exact prior state. */
    record Deleted(WhiteboardObject prior) implements HistoryChange {
        public Deleted {
            Objects.requireNonNull(prior, "prior");
        }

        @Override
        public String objectId() {
            return prior.id();
        }
    }

    /**
     * Object fields were overwritten. {@code inverse} holds the values captured
     * before {@code forward} was applied.
     */
    record Updated(String id, ObjectPatch forward, ObjectPatch inverse) implements HistoryChange {
        public Updated {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(forward, "forward");
            Objects.requireNonNull(inverse, "inverse");
        }

        @Override
        public String objectId() {
            return id;
        }

        /** Fold a later update of the same object into this one. */
        Updated coalesce(Updated later) {
            return new Updated(id, forward.merge(later.forward), later.inverse.merge(inverse));
        }
    }
}
