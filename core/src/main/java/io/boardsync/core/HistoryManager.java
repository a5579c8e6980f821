// file: core/src/main/java/io/boardsync/core/HistoryManager.java
package io.boardsync.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Undo/redo stacks for local mutations.
 * <p>
 * Rules:
 *  - Every recorded change clears the redo stack.
 *  - Outside a batch each change becomes its own entry. Between
 *    {@link #beginBatch(String)} and {@link #commitBatch()} all changes land in one
 *    entry; nested begins are counted and only the outermost commit pushes.
 *  - Within a batch, repeated updates of one object are folded into one change,
 *    so a long drag stores a single delta per object.
 *  - The undo stack holds at most {@code limit} entries; the oldest is dropped.
 * <p>
 * Not thread-safe; {@link ObjectStore} calls it under its own lock.
 */
public final class HistoryManager {

    public static final int DEFAULT_LIMIT = 50;

    private final int limit;
    private final Deque<HistoryEntry> undo = new ArrayDeque<>();
    private final Deque<HistoryEntry> redo = new ArrayDeque<>();

    private List<HistoryChange> batch;
    private String batchLabel;
    private int batchDepth;

    public HistoryManager() {
        this(DEFAULT_LIMIT);
    }

    public HistoryManager(int limit) {
        if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
        this.limit = limit;
    }

    public void record(String label, HistoryChange change) {
        redo.clear();
        if (batch != null) {
            addToBatch(change);
            return;
        }
        push(new HistoryEntry(label, List.of(change)));
    }

    public void beginBatch(String label) {
        if (batchDepth++ == 0) {
            batch = new ArrayList<>();
            batchLabel = label;
        }
    }

    public void commitBatch() {
        if (batchDepth == 0) return;
        if (--batchDepth > 0) return;
        List<HistoryChange> changes = batch;
        String label = batchLabel;
        batch = null;
        batchLabel = null;
        if (!changes.isEmpty()) {
            push(new HistoryEntry(label, changes));
        }
    }

    public boolean inBatch() {
        return batchDepth > 0;
    }

    /**
     * Revert the newest entry: inverses are applied newest change first.
     * An open batch is committed before anything is popped.
     */
    public Optional<HistoryEntry> undo(HistoryTarget target) {
        closeOpenBatch();
        HistoryEntry entry = undo.pollFirst();
        if (entry == null) return Optional.empty();
        List<HistoryChange> changes = entry.changes();
        for (int i = changes.size() - 1; i >= 0; i--) {
            revert(changes.get(i), target);
        }
        redo.addFirst(entry);
        return Optional.of(entry);
    }

    public Optional<HistoryEntry> redo(HistoryTarget target) {
        closeOpenBatch();
        HistoryEntry entry = redo.pollFirst();
        if (entry == null) return Optional.empty();
        for (HistoryChange change : entry.changes()) {
            reapply(change, target);
        }
        pushKeepingRedo(entry);
        return Optional.of(entry);
    }

    public void clear() {
        undo.clear();
        redo.clear();
        batch = null;
        batchLabel = null;
        batchDepth = 0;
    }

    public int undoSize() {
        return undo.size();
    }

    public int redoSize() {
        return redo.size();
    }

    public boolean canUndo() {
        return !undo.isEmpty();
    }

    public boolean canRedo() {
        return !redo.isEmpty();
    }

    // ---------- internals ----------

    private void closeOpenBatch() {
        if (batchDepth > 0) {
            batchDepth = 1;
            commitBatch();
        }
    }

    private void addToBatch(HistoryChange change) {
        if (change instanceof HistoryChange.Updated) {
            HistoryChange.Updated update = (HistoryChange.Updated) change;
            for (int i = batch.size() - 1; i >= 0; i--) {
                HistoryChange earlier = batch.get(i);
                if (!earlier.objectId().equals(update.id())) continue;
                if (earlier instanceof HistoryChange.Updated) {
                    batch.set(i, ((HistoryChange.Updated) earlier).coalesce(update));
                    return;
                }
                break;
            }
        }
        batch.add(change);
    }

    private void push(HistoryEntry entry) {
        redo.clear();
        pushKeepingRedo(entry);
    }

    private void pushKeepingRedo(HistoryEntry entry) {
        undo.addFirst(entry);
        while (undo.size() > limit) {
            undo.pollLast();
        }
    }

    private static void revert(HistoryChange change, HistoryTarget target) {
        if (change instanceof HistoryChange.Created) {
            target.remove(change.objectId());
        } else if (change instanceof HistoryChange.Deleted) {
            target.put(((HistoryChange.Deleted) change).prior());
        } else if (change instanceof HistoryChange.Updated) {
            HistoryChange.Updated u = (HistoryChange.Updated) change;
            target.patch(u.id(), u.inverse());
        }
    }

    private static void reapply(HistoryChange change, HistoryTarget target) {
        if (change instanceof HistoryChange.Created) {
            target.put(((HistoryChange.Created) change).object());
        } else if (change instanceof HistoryChange.Deleted) {
            target.remove(change.objectId());
        } else if (change instanceof HistoryChange.Updated) {
            HistoryChange.Updated u = (HistoryChange.Updated) change;
            target.patch(u.id(), u.forward());
        }
    }
}
