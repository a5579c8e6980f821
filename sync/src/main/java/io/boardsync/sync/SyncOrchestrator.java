// file: sync/src/main/java/io/boardsync/sync/SyncOrchestrator.java
package io.boardsync.sync;

import io.boardsync.core.ConflictResolver;
import io.boardsync.core.Connectors;
import io.boardsync.core.CursorPosition;
import io.boardsync.core.HistoryChange;
import io.boardsync.core.HistoryEntry;
import io.boardsync.core.ObjectPatch;
import io.boardsync.core.ObjectStore;
import io.boardsync.core.ObjectType;
import io.boardsync.core.ObjectUpdate;
import io.boardsync.core.PresenceColors;
import io.boardsync.core.Viewport;
import io.boardsync.core.WhiteboardObject;
import io.boardsync.storage.ObjectChange;
import io.boardsync.storage.ObjectRepository;
import io.boardsync.sync.channel.BroadcastChannel;
import io.boardsync.sync.message.BroadcastMessage;
import io.boardsync.sync.message.ChangeNotification;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Glue between one client's {@link ObjectStore}, the broadcast channel and the
 * durable repository.
 * <p>
 * Local path: stamp the edit with {@code (held version + 1, now, self)}, apply it
 * through the store's Tier 2 (so it lands in history), broadcast the delta and
 * persist it without waiting. Geometry-only edits and cursor moves go through a
 * 16ms trailing throttle, free-text edits through a 50ms one; everything else is
 * sent at once.
 * <p>
 * Remote path: drop our own echoes, resolve against the held copy with
 * last-writer-wins and apply winners through Tier 1, so remote edits never reach
 * history and are never re-broadcast.
 * <p>
 * Throttled patches are re-checked against the held copy when they leave. If a
 * remote write won in the meantime, what is held for the same fields goes out under
 * a fresh stamp, so the late send cannot lose against the write it already absorbed.
 * <p>
 * Moving a shape re-lays out the connectors attached to it, in the same undo step.
 * Remote moves re-lay them out locally, without a stamp.
 * <p>
 * Network failures are logged and never rolled back; the change feed or a resync
 * brings the replicas back together.
 */
public final class SyncOrchestrator implements BroadcastChannel.Listener, AutoCloseable {
    private static final Logger log = Logger.getLogger(SyncOrchestrator.class.getName());

    private final BoardSession session;
    private final ObjectStore store;
    private final ObjectRepository repository;
    private final BroadcastChannel channel;
    private final SyncConfig config;
    private final Clock clock;
    private final Supplier<String> ids;
    private final ConflictResolver resolver = new ConflictResolver.LastWriterWins();
    private final RemoteCursors cursors = new RemoteCursors();
    private final FollowMode follow;

    private final TrailingThrottle<String, ObjectPatch> moves;
    private final TrailingThrottle<String, ObjectPatch> texts;
    private final TrailingThrottle<String, ObjectPatch> dragFrames;
    private final TrailingThrottle<String, CursorPosition> cursorMoves;
    private final TrailingThrottle<String, Viewport> viewportMoves;

    private final Object dragLock = new Object();
    private Map<String, ObjectPatch> dragFinal;

    private ScheduledExecutorService driver;
    private volatile boolean closed;

    public SyncOrchestrator(BoardSession session, ObjectStore store, ObjectRepository repository,
                            BroadcastChannel channel) {
        this(session, store, repository, channel, SyncConfig.defaults(), Clock.systemUTC());
    }

    public SyncOrchestrator(BoardSession session, ObjectStore store, ObjectRepository repository,
                            BroadcastChannel channel, SyncConfig config, Clock clock) {
        this(session, store, repository, channel, config, clock, () -> UUID.randomUUID().toString());
    }

    SyncOrchestrator(BoardSession session, ObjectStore store, ObjectRepository repository,
                     BroadcastChannel channel, SyncConfig config, Clock clock, Supplier<String> ids) {
        this.session = Objects.requireNonNull(session, "session");
        this.store = Objects.requireNonNull(store, "store");
        this.repository = Objects.requireNonNull(repository, "repository");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ids = Objects.requireNonNull(ids, "ids");
        this.follow = new FollowMode(session.userId());

        this.moves = new TrailingThrottle<>(config.objectThrottle(), clock, ObjectPatch::merge,
                batch -> emitDeltas("move", batch));
        this.texts = new TrailingThrottle<>(config.textThrottle(), clock, ObjectPatch::merge,
                batch -> emitDeltas("text", batch));
        this.dragFrames = new TrailingThrottle<>(config.objectThrottle(), clock, ObjectPatch::merge,
                this::emitDragFrame);
        this.cursorMoves = new TrailingThrottle<String, CursorPosition>(config.cursorThrottle(), clock,
                TrailingThrottle.latest(), this::emitCursors);
        this.viewportMoves = new TrailingThrottle<String, Viewport>(config.cursorThrottle(), clock,
                TrailingThrottle.latest(), this::emitViewports);
    }

    // ---------- lifecycle ----------

    /** Bind the store to the board, subscribe to the channel, start the throttle driver and load. */
    public CompletableFuture<Void> open() {
        store.setBoardContext(session.boardId());
        channel.subscribe(this);
        startDriver();
        log.info(() -> "opened board " + session.boardId() + " as " + session.userId());
        return load();
    }

    /** Replace the store contents with the repository's. Clears history. */
    public CompletableFuture<Void> load() {
        return repository.list(session.boardId())
                .thenAccept(store::setObjects)
                .whenComplete((r, e) -> {
                    if (e != null) logFailure("list", "*", e);
                });
    }

    /**
     * Merge the repository's contents into the store with last-writer-wins, keeping
     * history and local-only objects. Used after a reconnect.
     */
    public CompletableFuture<Void> resync() {
        return repository.list(session.boardId())
                .thenAccept(list -> {
                    for (WhiteboardObject o : list) store.applyRemote(o, resolver);
                })
                .whenComplete((r, e) -> {
                    if (e != null) logFailure("list", "*", e);
                });
    }

    /** Emit everything still pending in the throttles; called by the driver. */
    public void flushDue() {
        cursorMoves.flushDue();
        viewportMoves.flushDue();
        dragFrames.flushDue();
        moves.flushDue();
        texts.flushDue();
    }

    public void flushAll() {
        cursorMoves.flushNow();
        viewportMoves.flushNow();
        dragFrames.flushNow();
        moves.flushNow();
        texts.flushNow();
    }

    /** Flush what is pending and stop listening; later broadcasts and change records are ignored. */
    @Override
    public void close() {
        endDrag();
        flushAll();
        closed = true;
        channel.unsubscribe(this);
        synchronized (this) {
            if (driver != null) driver.shutdownNow();
            driver = null;
        }
        log.info(() -> "closed board " + session.boardId());
    }

    // ---------- local path ----------

    public WhiteboardObject createObject(ObjectType type, double x, double y, double width, double height,
                                         Map<String, Object> properties) {
        return create(WhiteboardObject.builder()
                .type(type).x(x).y(y).width(width).height(height)
                .properties(properties));
    }

    /** Create from a draft; id, board, stamp and creation time are assigned here. */
    public WhiteboardObject createObject(WhiteboardObject draft) {
        Objects.requireNonNull(draft, "draft");
        return create(draft.toBuilder());
    }

    private WhiteboardObject create(WhiteboardObject.Builder draft) {
        long now = clock.millis();
        WhiteboardObject created = draft
                .id(ids.get())
                .boardId(session.boardId())
                .version(1)
                .createdAt(now)
                .updatedAt(now)
                .updatedBy(session.userId())
                .build();
        store.addObjectSync(created);
        announceCreated(List.of(created));
        return created;
    }

    /**
     * Local edit of one object. Connectors attached to a moved shape follow it in
     * the same undo step.
     *
     * @return false if the object is not held or the edit changed nothing
     */
    public boolean updateObject(String id, ObjectPatch patch) {
        Objects.requireNonNull(patch, "patch");
        List<ObjectUpdate> applied = store.atomically(() -> {
            Optional<WhiteboardObject> held = store.get(id);
            if (held.isEmpty()) return null;
            ObjectPatch s = stamp(held.get(), patch);
            if (held.get().apply(s.withoutStamp()) == held.get()) return null;
            List<ObjectUpdate> all = withConnectors(List.of(new ObjectUpdate(id, s)));
            if (all.size() == 1) {
                return store.updateObjectSync(id, s) ? all : null;
            }
            store.batchUpdateObjectsSync("update", all);
            return all;
        });
        if (applied == null) return false;
        route(id, applied.get(0).patch());
        for (ObjectUpdate link : applied.subList(1, applied.size())) {
            moves.submit(link.id(), carryPending(link.id(), texts, link.patch()));
        }
        return true;
    }

    /** Start a multi-object drag; every frame until {@link #endDrag()} is one "move" undo step. */
    public void beginDrag() {
        synchronized (dragLock) {
            if (dragFinal != null) return;
            dragFinal = new LinkedHashMap<>();
        }
        store.beginHistoryBatch("move");
    }

    /** One frame of a drag: absolute positions (or any geometry) per object. */
    public void drag(List<ObjectUpdate> frame) {
        if (frame.isEmpty()) return;
        beginDrag();
        List<ObjectUpdate> stamped = store.atomically(() -> {
            List<ObjectUpdate> out = new ArrayList<>(frame.size());
            for (ObjectUpdate u : frame) {
                store.get(u.id()).ifPresent(held -> out.add(new ObjectUpdate(u.id(), stamp(held, u.patch()))));
            }
            List<ObjectUpdate> all = withConnectors(out);
            store.batchUpdateObjectsSync("move", all);
            return all;
        });
        synchronized (dragLock) {
            for (ObjectUpdate u : stamped) {
                dragFrames.submit(u.id(), u.patch());
                if (dragFinal != null) dragFinal.merge(u.id(), u.patch(), ObjectPatch::merge);
            }
        }
    }

    /** Flush the last frame, close the undo step, and persist final values in one call. */
    public void endDrag() {
        Map<String, ObjectPatch> finals;
        synchronized (dragLock) {
            if (dragFinal == null) return;
            finals = dragFinal;
            dragFinal = null;
        }
        dragFrames.flushNow();
        store.commitHistoryBatch();
        finals = restamp(finals);
        if (finals.isEmpty()) return;
        List<ObjectUpdate> updates = toUpdates(finals);
        persist("updateMany", joinIds(finals.keySet()), repository.updateMany(updates));
    }

    public boolean deleteObject(String id) {
        if (!store.deleteObjectSync(id)) return false;
        announceDeleted(List.of(id));
        return true;
    }

    /** Delete the selection as one undo step, one message and one repository call. */
    public List<String> deleteSelected() {
        List<String> deleted = store.deleteSelectedSync();
        if (!deleted.isEmpty()) announceDeleted(deleted);
        return deleted;
    }

    public int copySelected() {
        return store.copySelected();
    }

    /**
     * Insert fresh copies of the clipboard, shifted by the paste offset. Connector
     * links between copied objects follow the copies. One undo step; the copies
     * become the selection.
     */
    public List<WhiteboardObject> paste() {
        List<WhiteboardObject> copies = store.clipboard()
                .materialize(session.boardId(), ids, config.pasteOffset(), clock.millis(), session.userId());
        if (copies.isEmpty()) return copies;
        store.addObjectsSync("paste", copies);
        announceCreated(copies);
        store.setSelectedIds(copies.stream().map(WhiteboardObject::id).toList());
        return copies;
    }

    public void moveCursor(double x, double y) {
        cursorMoves.submit(session.userId(), new CursorPosition(
                session.userId(), session.userName(), PresenceColors.colorFor(session.userId()), x, y));
    }

    /** Share our viewport with the board. Suppressed while following someone else's. */
    public boolean moveViewport(double zoom, double panOffsetX, double panOffsetY) {
        if (follow.isFollowing()) return false;
        viewportMoves.submit(session.userId(),
                new Viewport(session.userId(), zoom, panOffsetX, panOffsetY, clock.millis()));
        return true;
    }

    /** Ask everyone else on the board to follow our viewport. */
    public void startSpotlight() {
        follow.stopFollowing();
        follow.spotlightStarted(session.userId(), session.userName());
        broadcast(new BroadcastMessage.Spotlight(session.userId(), BroadcastMessage.Spotlight.Action.START,
                session.userId(), session.userName()), "spotlight", session.userId());
    }

    public void stopSpotlight() {
        if (!follow.isSpotlighting()) return;
        follow.spotlightStopped(session.userId());
        broadcast(new BroadcastMessage.Spotlight(session.userId(), BroadcastMessage.Spotlight.Action.STOP,
                session.userId(), session.userName()), "spotlight", session.userId());
    }

    public boolean undo() {
        return propagate("undo", store::undo);
    }

    public boolean redo() {
        return propagate("redo", store::redo);
    }

    public RemoteCursors cursors() {
        return cursors;
    }

    public FollowMode followMode() {
        return follow;
    }

    public ObjectStore store() {
        return store;
    }

    // ---------- remote path ----------

    @Override
    public void onBroadcast(BroadcastMessage message) {
        if (closed) return;
        if (session.userId().equals(message.senderId())) {
            log.fine(() -> "dropping own echo " + message.getClass().getSimpleName());
            return;
        }
        if (message instanceof BroadcastMessage.Created) {
            WhiteboardObject o = ((BroadcastMessage.Created) message).object();
            if (!session.boardId().equals(o.boardId())) return;
            logVerdict(o.id(), store.applyRemote(o, resolver));
        } else if (message instanceof BroadcastMessage.CreatedBatch) {
            for (WhiteboardObject o : ((BroadcastMessage.CreatedBatch) message).objects()) {
                if (session.boardId().equals(o.boardId())) logVerdict(o.id(), store.applyRemote(o, resolver));
            }
        } else if (message instanceof BroadcastMessage.Updated) {
            BroadcastMessage.Updated u = (BroadcastMessage.Updated) message;
            if (applyRemotePatch(u.id(), u.patch())) relayout(List.of(u.id()));
        } else if (message instanceof BroadcastMessage.MovedBatch) {
            List<String> moved = new ArrayList<>();
            for (ObjectUpdate u : ((BroadcastMessage.MovedBatch) message).updates()) {
                if (applyRemotePatch(u.id(), u.patch())) moved.add(u.id());
            }
            relayout(moved);
        } else if (message instanceof BroadcastMessage.Deleted) {
            List<String> deleted = ((BroadcastMessage.Deleted) message).ids();
            deleted.forEach(this::dropPending);
            store.deleteObjects(deleted);
        } else if (message instanceof BroadcastMessage.CursorMoved) {
            cursors.update(((BroadcastMessage.CursorMoved) message).cursor());
        } else if (message instanceof BroadcastMessage.ViewportChanged) {
            follow.updateViewport(((BroadcastMessage.ViewportChanged) message).viewport());
        } else if (message instanceof BroadcastMessage.Spotlight) {
            BroadcastMessage.Spotlight s = (BroadcastMessage.Spotlight) message;
            if (s.action() == BroadcastMessage.Spotlight.Action.START) {
                follow.spotlightStarted(s.userId(), s.userName());
            } else {
                follow.spotlightStopped(s.userId());
            }
        }
    }

    @Override
    public void onChange(ChangeNotification change) {
        if (closed) return;
        if (change.kind() == ObjectChange.Kind.DELETE) {
            dropPending(change.id());
            store.deleteObject(change.id());
            return;
        }
        WhiteboardObject o = change.object();
        if (session.userId().equals(o.updatedBy())) {
            log.fine(() -> "dropping own change feed record for " + o.id());
            return;
        }
        if (!session.boardId().equals(o.boardId())) return;
        logVerdict(o.id(), store.applyRemote(o, resolver));
    }

    @Override
    public void onReconnect() {
        if (closed) return;
        log.info(() -> "reconnected to board " + session.boardId() + ", resyncing");
        resync();
    }

    // ---------- internals ----------

    /**
     * Local stamps are {@code held version + 1} and never older than the held
     * timestamp, so a local write always wins against the copy it was based on.
     */
    private ObjectPatch stamp(WhiteboardObject held, ObjectPatch patch) {
        long at = Math.max(clock.millis(), held.updatedAt());
        return patch.withoutStamp().withStamp(held.version() + 1, at, session.userId());
    }

    /**
     * Check patches leaving a throttle against the held copy. A patch whose stamp is
     * still the held one goes out as is. Otherwise a remote write won after it was
     * stamped: send the held values of the same fields under a fresh stamp, and take
     * that stamp locally. Patches for objects no longer held are dropped.
     */
    private Map<String, ObjectPatch> restamp(Map<String, ObjectPatch> batch) {
        return store.atomically(() -> {
            Map<String, ObjectPatch> out = new LinkedHashMap<>();
            for (Map.Entry<String, ObjectPatch> e : batch.entrySet()) {
                Optional<WhiteboardObject> held = store.get(e.getKey());
                if (held.isEmpty()) continue;
                ObjectPatch p = e.getValue();
                if (held.get().stamp().equals(p.stamp()) && session.userId().equals(held.get().updatedBy())) {
                    out.put(e.getKey(), p);
                    continue;
                }
                ObjectPatch fresh = stamp(held.get(), p.capture(held.get()));
                store.updateObject(e.getKey(), fresh);
                log.fine(() -> "restamped " + e.getKey() + " to v" + fresh.version() + " after a remote write");
                out.put(e.getKey(), fresh);
            }
            return out;
        });
    }

    /**
     * Append stamped layout patches for connectors attached to shapes whose geometry
     * {@code stamped} changes. Must run inside {@code store.atomically}.
     */
    private List<ObjectUpdate> withConnectors(List<ObjectUpdate> stamped) {
        Map<String, WhiteboardObject> view = new LinkedHashMap<>(store.objects());
        boolean moved = false;
        List<String> touched = new ArrayList<>(stamped.size());
        for (ObjectUpdate u : stamped) {
            touched.add(u.id());
            WhiteboardObject held = view.get(u.id());
            if (held == null || !u.patch().touchesGeometry()) continue;
            view.put(u.id(), held.apply(u.patch()));
            moved = true;
        }
        if (!moved) return stamped;
        List<ObjectUpdate> links = Connectors.follow(view, touched);
        if (links.isEmpty()) return stamped;
        List<ObjectUpdate> out = new ArrayList<>(stamped);
        for (ObjectUpdate l : links) {
            out.add(new ObjectUpdate(l.id(), stamp(view.get(l.id()), l.patch())));
        }
        return out;
    }

    /** Local-only re-layout of connectors attached to shapes a remote write moved. */
    private void relayout(List<String> movedIds) {
        if (movedIds.isEmpty()) return;
        store.atomically(() -> store.batchUpdateObjects(Connectors.follow(store.objects(), movedIds)));
    }

    /** Throttled edits of one object must leave in stamp order, so a patch carries along whatever is pending elsewhere. */
    private void route(String id, ObjectPatch stamped) {
        if (stamped.isGeometryOnly()) {
            moves.submit(id, carryPending(id, texts, stamped));
        } else if (stamped.touchesText()) {
            texts.submit(id, carryPending(id, moves, stamped));
        } else {
            ObjectPatch p = carryPending(id, texts, carryPending(id, moves, stamped));
            emitDeltas("update", Map.of(id, p));
        }
    }

    private static ObjectPatch carryPending(String id, TrailingThrottle<String, ObjectPatch> other, ObjectPatch later) {
        ObjectPatch earlier = other.take(id);
        return earlier == null ? later : earlier.merge(later);
    }

    private void dropPending(String id) {
        moves.take(id);
        texts.take(id);
        dragFrames.take(id);
    }

    /** One delta goes out as object_update, several as one object_move_batch; persisted the same way. */
    private void emitDeltas(String op, Map<String, ObjectPatch> pending) {
        Map<String, ObjectPatch> batch = restamp(pending);
        if (batch.isEmpty()) return;
        if (batch.size() == 1) {
            Map.Entry<String, ObjectPatch> only = batch.entrySet().iterator().next();
            broadcast(new BroadcastMessage.Updated(session.userId(), only.getKey(), only.getValue()), op, only.getKey());
            persist("update", only.getKey(), repository.update(only.getKey(), only.getValue()));
            return;
        }
        List<ObjectUpdate> updates = toUpdates(batch);
        String objectIds = joinIds(batch.keySet());
        broadcast(new BroadcastMessage.MovedBatch(session.userId(), updates), op, objectIds);
        persist("updateMany", objectIds, repository.updateMany(updates));
    }

    /** Drag frames are broadcast only; {@link #endDrag()} persists the final values. */
    private void emitDragFrame(Map<String, ObjectPatch> pending) {
        Map<String, ObjectPatch> batch = restamp(pending);
        if (batch.isEmpty()) return;
        broadcast(new BroadcastMessage.MovedBatch(session.userId(), toUpdates(batch)), "drag", joinIds(batch.keySet()));
    }

    private void emitCursors(Map<String, CursorPosition> batch) {
        for (CursorPosition c : batch.values()) {
            broadcast(new BroadcastMessage.CursorMoved(session.userId(), c), "cursor", c.userId());
        }
    }

    private void emitViewports(Map<String, Viewport> batch) {
        for (Viewport v : batch.values()) {
            broadcast(new BroadcastMessage.ViewportChanged(session.userId(), v), "viewport", v.userId());
        }
    }

    /** One object goes out as object_create, several as one object_create_batch; persisted the same way. */
    private void announceCreated(List<WhiteboardObject> created) {
        if (created.isEmpty()) return;
        if (created.size() == 1) {
            WhiteboardObject o = created.get(0);
            broadcast(new BroadcastMessage.Created(session.userId(), o), "create", o.id());
            persist("insert", o.id(), repository.insert(o));
            return;
        }
        String objectIds = joinIds(created.stream().map(WhiteboardObject::id).toList());
        broadcast(new BroadcastMessage.CreatedBatch(session.userId(), created), "create", objectIds);
        persist("insertMany", objectIds, repository.insertMany(created));
    }

    private void announceDeleted(List<String> deleted) {
        deleted.forEach(this::dropPending);
        String objectIds = joinIds(deleted);
        broadcast(new BroadcastMessage.Deleted(session.userId(), deleted), "delete", objectIds);
        if (deleted.size() == 1) {
            persist("delete", objectIds, repository.delete(deleted.get(0)));
        } else {
            persist("deleteMany", objectIds, repository.deleteMany(deleted));
        }
    }

    private record Propagation(List<WhiteboardObject> created, List<String> removed, List<ObjectUpdate> updated) {}

    /**
     * Run undo or redo, then re-stamp every surviving object it touched with
     * {@code max(held before, restored) + 1} so peers accept the restored state,
     * and send it out like any other local edit.
     */
    private boolean propagate(String op, Supplier<Optional<HistoryEntry>> action) {
        endDrag();
        flushAll();
        Propagation p = store.atomically(() -> {
            Map<String, WhiteboardObject> before = store.objects();
            Optional<HistoryEntry> entry = action.get();
            if (entry.isEmpty()) return null;
            Map<String, WhiteboardObject> after = store.objects();
            long now = clock.millis();

            Set<String> touched = new LinkedHashSet<>();
            for (HistoryChange c : entry.get().changes()) touched.add(c.objectId());

            List<WhiteboardObject> created = new ArrayList<>();
            List<String> removed = new ArrayList<>();
            List<ObjectUpdate> updated = new ArrayList<>();
            for (String id : touched) {
                WhiteboardObject prev = before.get(id);
                WhiteboardObject restored = after.get(id);
                if (restored == null) {
                    if (prev != null) removed.add(id);
                    continue;
                }
                int version = Math.max(prev != null ? prev.version() : 0, restored.version()) + 1;
                long at = Math.max(now, Math.max(restored.updatedAt(), prev != null ? prev.updatedAt() : 0L));
                WhiteboardObject restamped = restored.withStamp(version, at, session.userId());
                store.addObject(restamped);
                if (prev == null) {
                    created.add(restamped);
                } else {
                    updated.add(new ObjectUpdate(id, ObjectPatch.diff(prev, restamped)));
                }
            }
            return new Propagation(created, removed, updated);
        });
        if (p == null) return false;
        log.fine(() -> op + " on board " + session.boardId() + ": " + p.created().size() + " created, "
                + p.removed().size() + " removed, " + p.updated().size() + " updated");

        announceCreated(p.created());
        if (!p.removed().isEmpty()) announceDeleted(p.removed());
        if (!p.updated().isEmpty()) {
            String objectIds = joinIds(p.updated().stream().map(ObjectUpdate::id).toList());
            broadcast(new BroadcastMessage.MovedBatch(session.userId(), p.updated()), op, objectIds);
            if (p.updated().size() == 1) {
                ObjectUpdate u = p.updated().get(0);
                persist("update", u.id(), repository.update(u.id(), u.patch()));
            } else {
                persist("updateMany", objectIds, repository.updateMany(p.updated()));
            }
        }
        return true;
    }

    /** @return true when the delta won and moved the object */
    private boolean applyRemotePatch(String id, ObjectPatch patch) {
        Optional<ConflictResolver.Resolution> verdict = store.applyRemotePatch(id, patch, resolver);
        if (verdict.isEmpty()) {
            log.fine(() -> "ignoring delta for unknown object " + id);
            return false;
        }
        logVerdict(id, verdict.get());
        return verdict.get() == ConflictResolver.Resolution.REMOTE_WINS && patch.touchesGeometry();
    }

    private void logVerdict(String id, ConflictResolver.Resolution r) {
        if (r == ConflictResolver.Resolution.DUPLICATE) {
            log.fine(() -> "duplicate delivery for " + id);
        } else if (r == ConflictResolver.Resolution.LOCAL_WINS) {
            log.fine(() -> "stale remote write for " + id + " dropped");
        }
    }

    private void broadcast(BroadcastMessage message, String op, String objectIds) {
        CompletableFuture<Void> f;
        try {
            f = channel.broadcast(message);
        } catch (RuntimeException e) {
            f = CompletableFuture.failedFuture(e);
        }
        f.whenComplete((r, e) -> {
            if (e != null) logFailure("broadcast " + op, objectIds, e);
        });
    }

    private <T> void persist(String op, String objectIds, CompletableFuture<T> call) {
        call.whenComplete((r, e) -> {
            if (e != null) logFailure(op, objectIds, e);
        });
    }

    private void logFailure(String op, String objectIds, Throwable e) {
        log.log(Level.WARNING, String.format("%s failed for object %s on board %s",
                op, objectIds, session.boardId()), e);
    }

    private static List<ObjectUpdate> toUpdates(Map<String, ObjectPatch> batch) {
        List<ObjectUpdate> out = new ArrayList<>(batch.size());
        for (Map.Entry<String, ObjectPatch> e : batch.entrySet()) {
            out.add(new ObjectUpdate(e.getKey(), e.getValue()));
        }
        return out;
    }

    private static String joinIds(Collection<String> objectIds) {
        return String.join(",", objectIds);
    }

    private synchronized void startDriver() {
        if (driver != null) return;
        driver = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sync-throttle-" + session.boardId());
            t.setDaemon(true);
            return t;
        });
        long shortest = Math.min(config.cursorThrottle().toMillis(),
                Math.min(config.objectThrottle().toMillis(), config.textThrottle().toMillis()));
        long period = Math.max(1, shortest / 4);
        driver.scheduleAtFixedRate(this::tickSafe, period, period, TimeUnit.MILLISECONDS);
    }

    private void tickSafe() {
        try {
            flushDue();
        } catch (Exception e) {
            log.log(Level.WARNING, "throttle tick failed on board " + session.boardId(), e);
        }
    }
}
