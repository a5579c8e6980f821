// file: core/src/main/java/io/boardsync/core/ObjectStore.java
package io.boardsync.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * In-memory view of one board as this client currently believes it to be.
 * <p>
 * Two tiers of mutation:
 *  - Tier 1 ({@code addObject}, {@code updateObject}, {@code deleteObject}, ...):
 *    remote or otherwise unrecorded changes. History is never touched.
 *  - Tier 2 ({@code ...Sync}): local user edits. Same effect on the objects, plus
 *    an entry in the {@link HistoryManager}.
 * <p>
 * The object map is copy-on-write: each effective mutation publishes a new
 * unmodifiable map, and a mutation that changes nothing keeps the current instance,
 * so callers can detect changes by reference. Multi-object operations publish once.
 * <p>
 * All methods are synchronized on the store; {@link #atomically(Supplier)} extends
 * that to compound read-then-write sequences.
 */
public final class ObjectStore {

    /** Notified after every published change of the object map. */
    public interface Listener {
        void onObjectsChanged(Map<String, WhiteboardObject> objects);
    }

    private final HistoryManager history;
    private final Clipboard clipboard = new Clipboard();
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();

    private Map<String, WhiteboardObject> objects = Collections.unmodifiableMap(new LinkedHashMap<>());
    private Set<String> selected = new LinkedHashSet<>();
    private String boardId;

    public ObjectStore() {
        this(new HistoryManager());
    }

    public ObjectStore(HistoryManager history) {
        this.history = Objects.requireNonNull(history, "history");
    }

    public void addListener(Listener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    // ---------- reads ----------

    /** Current object map, in insertion order. Same instance until something changes. */
    public synchronized Map<String, WhiteboardObject> objects() {
        return objects;
    }

    public synchronized Optional<WhiteboardObject> get(String id) {
        return Optional.ofNullable(objects.get(id));
    }

    public synchronized int size() {
        return objects.size();
    }

    public synchronized String boardId() {
        return boardId;
    }

    // ---------- board lifecycle ----------

    /**
     * Bind the store to a board. Switching to a different board drops history,
     * selection and clipboard; re-binding the same board keeps them.
     */
    public synchronized void setBoardContext(String newBoardId) {
        Objects.requireNonNull(newBoardId, "boardId");
        if (newBoardId.equals(boardId)) return;
        boardId = newBoardId;
        history.clear();
        selected = new LinkedHashSet<>();
        clipboard.clear();
    }

    /** Replace everything, as on initial load. Clears selection and history. */
    public synchronized void setObjects(Collection<WhiteboardObject> list) {
        Map<String, WhiteboardObject> next = new LinkedHashMap<>(list.size() * 2);
        for (WhiteboardObject o : list) {
            next.put(o.id(), o);
        }
        selected = new LinkedHashSet<>();
        history.clear();
        publish(next);
    }

    // ---------- Tier 1 ----------

    public synchronized boolean addObject(WhiteboardObject object) {
        Objects.requireNonNull(object, "object");
        if (object.equals(objects.get(object.id()))) return false;
        Editor e = new Editor();
        e.put(object);
        return e.publish();
    }

    public synchronized boolean updateObject(String id, ObjectPatch patch) {
        Editor e = new Editor();
        e.patch(id, patch);
        return e.publish();
    }

    public synchronized boolean deleteObject(String id) {
        Editor e = new Editor();
        e.remove(id);
        return e.publish();
    }

    public synchronized boolean deleteObjects(Collection<String> ids) {
        Editor e = new Editor();
        for (String id : ids) {
            e.remove(id);
        }
        return e.publish();
    }

    /**
     * Apply many patches with a single copy of the map. Unknown ids are skipped.
     * An empty list, or one that changes nothing, leaves the map instance untouched.
     *
     * @return the object map after the batch
     */
    public synchronized Map<String, WhiteboardObject> batchUpdateObjects(List<ObjectUpdate> updates) {
        if (updates.isEmpty()) return objects;
        Editor e = new Editor();
        for (ObjectUpdate u : updates) {
            e.patch(u.id(), u.patch());
        }
        e.publish();
        return objects;
    }

    /**
     * Resolve an incoming full copy against the held one and keep the winner.
     * An object not held yet is simply added.
     */
    public synchronized ConflictResolver.Resolution applyRemote(WhiteboardObject remote, ConflictResolver resolver) {
        WhiteboardObject local = objects.get(remote.id());
        if (local == null) {
            addObject(remote);
            return ConflictResolver.Resolution.REMOTE_WINS;
        }
        ConflictResolver.Resolution r = resolver.resolve(local.stamp(), remote.stamp());
        if (r == ConflictResolver.Resolution.REMOTE_WINS) {
            addObject(remote);
        }
        return r;
    }

    /**
     * Resolve an incoming delta against the held object and apply it if it wins.
     * A delta without a complete stamp never wins.
     *
     * @return empty when the object is not held, otherwise the verdict
     */
    public synchronized Optional<ConflictResolver.Resolution> applyRemotePatch(
            String id, ObjectPatch patch, ConflictResolver resolver) {
        WhiteboardObject local = objects.get(id);
        if (local == null) return Optional.empty();
        VersionStamp incoming = patch.stamp();
        ConflictResolver.Resolution r = incoming == null
                ? ConflictResolver.Resolution.LOCAL_WINS
                : resolver.resolve(local.stamp(), incoming);
        if (r == ConflictResolver.Resolution.REMOTE_WINS) {
            updateObject(id, patch);
        }
        return Optional.of(r);
    }

    // ---------- Tier 2 ----------

    public synchronized void addObjectSync(WhiteboardObject object) {
        Objects.requireNonNull(object, "object");
        if (objects.containsKey(object.id())) {
            throw new IllegalArgumentException("object already exists: " + object.id());
        }
        addObject(object);
        history.record("create", new HistoryChange.Created(object));
    }

    /** Several new objects as one history entry labelled {@code label}. */
    public synchronized void addObjectsSync(String label, List<WhiteboardObject> created) {
        history.beginBatch(label);
        try {
            for (WhiteboardObject o : created) {
                addObjectSync(o);
            }
        } finally {
            history.commitBatch();
        }
    }

    public synchronized boolean updateObjectSync(String id, ObjectPatch patch) {
        WhiteboardObject before = objects.get(id);
        if (before == null) return false;
        if (!updateObject(id, patch)) return false;
        history.record("update", new HistoryChange.Updated(id, patch, patch.capture(before)));
        return true;
    }

    /** Tier 2 counterpart of {@link #batchUpdateObjects(List)}: one copy, one history entry. */
    public synchronized Map<String, WhiteboardObject> batchUpdateObjectsSync(String label, List<ObjectUpdate> updates) {
        if (updates.isEmpty()) return objects;
        List<HistoryChange> changes = new ArrayList<>(updates.size());
        Editor e = new Editor();
        for (ObjectUpdate u : updates) {
            WhiteboardObject before = e.current(u.id());
            if (before == null) continue;
            if (e.patchChanged(u.id(), u.patch())) {
                changes.add(new HistoryChange.Updated(u.id(), u.patch(), u.patch().capture(before)));
            }
        }
        if (e.publish()) {
            recordAll(label, changes);
        }
        return objects;
    }

    public synchronized boolean deleteObjectSync(String id) {
        WhiteboardObject prior = objects.get(id);
        if (prior == null) return false;
        deleteObject(id);
        history.record("delete", new HistoryChange.Deleted(prior));
        return true;
    }

    /**
     * Delete every selected object as one history entry.
     *
     * @return the ids actually deleted, in selection order
     */
    public synchronized List<String> deleteSelectedSync() {
        List<HistoryChange> changes = new ArrayList<>();
        List<String> deleted = new ArrayList<>();
        Editor e = new Editor();
        for (String id : new ArrayList<>(selected)) {
            WhiteboardObject prior = e.current(id);
            if (prior == null) continue;
            e.remove(id);
            changes.add(new HistoryChange.Deleted(prior));
            deleted.add(id);
        }
        if (e.publish()) {
            recordAll("delete", changes);
        }
        return deleted;
    }

    // ---------- history ----------

    public synchronized void beginHistoryBatch(String label) {
        history.beginBatch(label);
    }

    public synchronized void commitHistoryBatch() {
        history.commitBatch();
    }

    public synchronized Optional<HistoryEntry> undo() {
        Editor e = new Editor();
        Optional<HistoryEntry> entry = history.undo(e);
        e.publish();
        return entry;
    }

    public synchronized Optional<HistoryEntry> redo() {
        Editor e = new Editor();
        Optional<HistoryEntry> entry = history.redo(e);
        e.publish();
        return entry;
    }

    public synchronized void clearHistory() {
        history.clear();
    }

    public synchronized boolean canUndo() {
        return history.canUndo();
    }

    public synchronized boolean canRedo() {
        return history.canRedo();
    }

    public synchronized int undoDepth() {
        return history.undoSize();
    }

    public synchronized int redoDepth() {
        return history.redoSize();
    }

    // ---------- selection ----------

    public synchronized void selectObject(String id, boolean multi) {
        if (!objects.containsKey(id)) return;
        if (!multi) {
            selected = new LinkedHashSet<>();
            selected.add(id);
        } else if (!selected.remove(id)) {
            selected.add(id);
        }
    }

    public synchronized void setSelectedIds(Collection<String> ids) {
        Set<String> next = new LinkedHashSet<>();
        for (String id : ids) {
            if (objects.containsKey(id)) next.add(id);
        }
        selected = next;
    }

    public synchronized void deselectAll() {
        selected = new LinkedHashSet<>();
    }

    public synchronized Set<String> selectedIds() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(selected));
    }

    // ---------- clipboard ----------

    /** @return number of objects copied */
    public synchronized int copySelected() {
        List<WhiteboardObject> copied = new ArrayList<>();
        for (String id : selected) {
            WhiteboardObject o = objects.get(id);
            if (o != null) copied.add(o);
        }
        if (!copied.isEmpty()) clipboard.copy(copied);
        return copied.size();
    }

    public synchronized Clipboard clipboard() {
        return clipboard;
    }

    /** Run a compound read-modify-write without interleaving with other mutations. */
    public synchronized <T> T atomically(Supplier<T> action) {
        return action.get();
    }

    // ---------- internals ----------

    private void recordAll(String label, List<HistoryChange> changes) {
        if (changes.isEmpty()) return;
        history.beginBatch(label);
        try {
            for (HistoryChange c : changes) {
                history.record(label, c);
            }
        } finally {
            history.commitBatch();
        }
    }

    private void publish(Map<String, WhiteboardObject> next) {
        objects = Collections.unmodifiableMap(next);
        Map<String, WhiteboardObject> snapshot = objects;
        for (Listener l : listeners) {
            l.onObjectsChanged(snapshot);
        }
    }

    /**
     * Lazily copied working map. The first effective change copies the published map;
     * {@link #publish()} swaps it in once, or does nothing when nothing changed.
     */
    private final class Editor implements HistoryTarget {
        private Map<String, WhiteboardObject> working;

        WhiteboardObject current(String id) {
            return working != null ? working.get(id) : objects.get(id);
        }

        @Override
        public void put(WhiteboardObject object) {
            if (object.equals(current(object.id()))) return;
            writable().put(object.id(), object);
        }

        @Override
        public void remove(String id) {
            if (current(id) == null) return;
            writable().remove(id);
            selected.remove(id);
        }

        @Override
        public void patch(String id, ObjectPatch patch) {
            patchChanged(id, patch);
        }

        boolean patchChanged(String id, ObjectPatch patch) {
            WhiteboardObject before = current(id);
            if (before == null) return false;
            WhiteboardObject after = before.apply(patch);
            if (after == before) return false;
            writable().put(id, after);
            return true;
        }

        boolean publish() {
            if (working == null) return false;
            ObjectStore.this.publish(working);
            return true;
        }

        private Map<String, WhiteboardObject> writable() {
            if (working == null) working = new LinkedHashMap<>(objects);
            return working;
        }
    }
}
