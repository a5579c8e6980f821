// file: storage/src/main/java/io/boardsync/storage/DurableObjectRepository.java
package io.boardsync.storage;

import io.boardsync.core.ConflictResolver;
import io.boardsync.core.ObjectPatch;
import io.boardsync.core.ObjectUpdate;
import io.boardsync.core.VersionStamp;
import io.boardsync.core.WhiteboardObject;

import java.time.Clock;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Server-side repository: in-memory objects made durable by a WAL plus snapshots.
 * <p>
 * On write:
 *  1) If an op id is given and was already seen, return the current result.
 *  2) Resolve the write against the stored copy with the same last-writer-wins
 *     rule clients use; a losing write is dropped and reports the stored version.
 *  3) Append the post-write state to the WAL (fsync), then apply it to memory.
 *  4) Rotate the WAL and maybe snapshot.
 *  5) Publish an {@link ObjectChange} to subscribers.
 * <p>
 * On startup: load the latest snapshot, then replay the whole WAL through the
 * resolver. Records hold post-state, so records already covered by the snapshot
 * resolve as duplicates or losers and change nothing.
 * <p>
 * Writes are serialized on this instance; reads go to a concurrent map.
 * The async interface methods complete before returning.
 */
public class DurableObjectRepository implements ObjectRepository {
    private static final Logger log = Logger.getLogger(DurableObjectRepository.class.getName());

    private final Map<String, WhiteboardObject> mem = new ConcurrentHashMap<>();
    private final Wal wal;
    private final Snapshotter snaps;
    private final OpIdDeduper dedupe;
    private final SnapshotPolicy snapPolicy;
    private final Clock clock;
    private final ConflictResolver resolver = new ConflictResolver.LastWriterWins();
    private final List<Consumer<ObjectChange>> subscribers = new CopyOnWriteArrayList<>();

    public DurableObjectRepository(Wal wal, Snapshotter snaps, OpIdDeduper dedupe) {
        this(wal, snaps, dedupe, new SnapshotPolicy(10_000), Clock.systemUTC());
    }

    public DurableObjectRepository(Wal wal, Snapshotter snaps, OpIdDeduper dedupe,
                                   SnapshotPolicy snapPolicy, Clock clock) {
        this.wal = Objects.requireNonNull(wal, "wal");
        this.snaps = Objects.requireNonNull(snaps, "snaps");
        this.dedupe = Objects.requireNonNull(dedupe, "dedupe");
        this.snapPolicy = Objects.requireNonNull(snapPolicy, "snapPolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
        recover();
    }

    /** Receive every committed change, on the writing thread. */
    public void subscribe(Consumer<ObjectChange> subscriber) {
        subscribers.add(Objects.requireNonNull(subscriber, "subscriber"));
    }

    // ---------- synchronous API (used by the server) ----------

    public List<WhiteboardObject> listNow(String boardId) {
        return mem.values().stream()
                .filter(o -> o.boardId().equals(boardId))
                .sorted(Comparator.comparingLong(WhiteboardObject::createdAt).thenComparing(WhiteboardObject::id))
                .toList();
    }

    public Optional<WhiteboardObject> find(String id) {
        return Optional.ofNullable(mem.get(id));
    }

    /**
     * Insert, or overwrite an existing copy if this one wins.
     *
     * @return the stored object after the call
     */
    public synchronized WhiteboardObject insertNow(WhiteboardObject object, String opId) {
        Objects.requireNonNull(object, "object");
        WhiteboardObject existing = mem.get(object.id());
        if (isRetry(opId)) return existing != null ? existing : object;
        if (existing != null && !resolver.shouldApplyRemote(existing.stamp(), object.stamp())) {
            return existing;
        }
        commit(RecordCodec.Op.UPSERT, object, opId);
        publish(existing == null ? ObjectChange.Kind.INSERT : ObjectChange.Kind.UPDATE, object);
        return object;
    }

    /**
     * Insert each object like {@link #insertNow}. A retried op id changes nothing.
     *
     * @return number of objects that were stored or overwrote an older copy
     */
    public synchronized int insertManyNow(List<WhiteboardObject> objects, String opId) {
        if (isRetry(opId)) return 0;
        int stored = 0;
        for (WhiteboardObject o : objects) {
            if (insertNow(o, null) == o) stored++;
        }
        return stored;
    }

    /**
     * Apply a patch. A patch carrying a full stamp is resolved against the stored
     * copy and dropped if it loses; an unstamped patch is stamped here with
     * {@code stored version + 1} and the current time.
     *
     * @return the stored version after the call
     * @throws ObjectNotFoundException if no object has this id
     */
    public synchronized int updateNow(String id, ObjectPatch patch, String opId) {
        Objects.requireNonNull(patch, "patch");
        WhiteboardObject existing = mem.get(id);
        if (existing == null) throw new ObjectNotFoundException(id);
        if (isRetry(opId)) return existing.version();

        ObjectPatch effective = patch;
        VersionStamp incoming = patch.stamp();
        if (incoming == null) {
            String by = patch.updatedBy() != null ? patch.updatedBy() : existing.updatedBy();
            long at = Math.max(clock.millis(), existing.updatedAt());
            effective = patch.withStamp(existing.version() + 1, at, by);
        } else if (!resolver.shouldApplyRemote(existing.stamp(), incoming)) {
            log.fine(() -> "dropping stale update of " + id + " at " + incoming + ", stored " + existing.stamp());
            return existing.version();
        }

        WhiteboardObject updated = existing.apply(effective);
        if (updated == existing) return existing.version();
        commit(RecordCodec.Op.UPSERT, updated, opId);
        publish(ObjectChange.Kind.UPDATE, updated);
        return updated.version();
    }

    /** Each update is resolved on its own; unknown ids are skipped. */
    public synchronized Map<String, Integer> updateManyNow(List<ObjectUpdate> updates, String opId) {
        if (isRetry(opId)) {
            Map<String, Integer> current = new LinkedHashMap<>();
            for (ObjectUpdate u : updates) {
                WhiteboardObject o = mem.get(u.id());
                if (o != null) current.put(u.id(), o.version());
            }
            return current;
        }
        Map<String, Integer> versions = new LinkedHashMap<>();
        for (ObjectUpdate u : updates) {
            if (!mem.containsKey(u.id())) continue;
            versions.put(u.id(), updateNow(u.id(), u.patch(), null));
        }
        return versions;
    }

    /** Idempotent: deleting an unknown id does nothing. */
    public synchronized boolean deleteNow(String id, String opId) {
        WhiteboardObject existing = mem.get(id);
        if (existing == null) return false;
        if (isRetry(opId)) return false;
        commit(RecordCodec.Op.DELETE, existing, opId);
        publish(ObjectChange.Kind.DELETE, existing);
        return true;
    }

    public synchronized int deleteManyNow(Collection<String> ids, String opId) {
        if (isRetry(opId)) return 0;
        int deleted = 0;
        for (String id : ids) {
            if (deleteNow(id, null)) deleted++;
        }
        return deleted;
    }

    // ---------- ObjectRepository ----------

    @Override
    public CompletableFuture<List<WhiteboardObject>> list(String boardId) {
        return CompletableFuture.completedFuture(listNow(boardId));
    }

    @Override
    public CompletableFuture<Void> insert(WhiteboardObject object) {
        return run(() -> { insertNow(object, null); return null; });
    }

    @Override
    public CompletableFuture<Void> insertMany(List<WhiteboardObject> objects) {
        return run(() -> { insertManyNow(objects, null); return null; });
    }

    @Override
    public CompletableFuture<Integer> update(String id, ObjectPatch patch) {
        return run(() -> updateNow(id, patch, null));
    }

    @Override
    public CompletableFuture<Map<String, Integer>> updateMany(List<ObjectUpdate> updates) {
        return run(() -> updateManyNow(updates, null));
    }

    @Override
    public CompletableFuture<Void> delete(String id) {
        return run(() -> { deleteNow(id, null); return null; });
    }

    @Override
    public CompletableFuture<Void> deleteMany(Collection<String> ids) {
        return run(() -> { deleteManyNow(ids, null); return null; });
    }

    // ---------- internals ----------

    private interface Action<T> {
        T get();
    }

    private static <T> CompletableFuture<T> run(Action<T> action) {
        try {
            return CompletableFuture.completedFuture(action.get());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private boolean isRetry(String opId) {
        return opId != null && !dedupe.firstTime(opId);
    }

    private void commit(RecordCodec.Op op, WhiteboardObject object, String opId) {
        String id = opId != null ? opId : UUID.randomUUID().toString();
        wal.append(RecordCodec.encode(id, op, object));
        if (op == RecordCodec.Op.DELETE) {
            mem.remove(object.id());
        } else {
            mem.put(object.id(), object);
        }
        wal.rotateIfNeeded();
        snapPolicy.maybeSnapshot(() -> List.copyOf(mem.values()), snaps);
    }

    private void replay(RecordCodec.Op op, WhiteboardObject object) {
        if (op == RecordCodec.Op.DELETE) {
            mem.remove(object.id());
            return;
        }
        WhiteboardObject existing = mem.get(object.id());
        if (existing == null || resolver.shouldApplyRemote(existing.stamp(), object.stamp())) {
            mem.put(object.id(), object);
        }
    }

    private void publish(ObjectChange.Kind kind, WhiteboardObject object) {
        ObjectChange change = new ObjectChange(kind, object);
        for (Consumer<ObjectChange> s : subscribers) {
            try {
                s.accept(change);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "change subscriber failed for " + object.id(), e);
            }
        }
    }

    private void recover() {
        Snapshotter.LoadedSnapshot loaded = snaps.loadLatest();
        if (loaded != null && loaded.objects() != null) {
            for (WhiteboardObject o : loaded.objects()) {
                mem.put(o.id(), o);
            }
        }

        int replayed = 0;
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                RecordCodec.LogRecord rec = RecordCodec.decode(payload);
                dedupe.firstTime(rec.opId());
                replay(rec.op(), rec.object());
                replayed++;
            }
        } catch (Exception e) {
            throw new IllegalStateException("recovery failed", e);
        }
        log.info(String.format("recovered %d objects (snapshot=%s, wal records=%d)",
                mem.size(), loaded == null ? "none" : loaded.id(), replayed));
    }
}
