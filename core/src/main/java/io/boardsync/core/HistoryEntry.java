// file: core/src/main/java/io/boardsync/core/HistoryEntry.java
package io.boardsync.core;

import java.util.List;
import java.util.Objects;

/** A labelled group of changes that undo and redo treat as one step. */
public record HistoryEntry(String label, List<HistoryChange> changes) {
    public HistoryEntry {
        Objects.requireNonNull(label, "label");
        changes = List.copyOf(changes);
    }
}
