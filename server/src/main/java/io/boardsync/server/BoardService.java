// file: server/src/main/java/io/boardsync/server/BoardService.java
package io.boardsync.server;

import io.boardsync.core.ObjectPatch;
import io.boardsync.core.ObjectUpdate;
import io.boardsync.core.WhiteboardObject;
import io.boardsync.storage.DurableObjectRepository;
import io.boardsync.storage.ObjectNotFoundException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Application service for board objects.
 *
 * Responsibilities:
 *  - Hide the durable repository from the HTTP layer.
 *  - Scope every call to the board named in the path: objects of other boards
 *    are treated as unknown.
 *  - Pass a non-blank Idempotency-Key through as the WAL op id.
 */
public class BoardService {

    private final DurableObjectRepository repo;

    public BoardService(DurableObjectRepository repo) {
        this.repo = Objects.requireNonNull(repo, "repo");
    }

    public List<WhiteboardObject> list(String boardId) {
        return repo.listNow(requireId("boardId", boardId));
    }

    /**
     * Upsert; the stored copy only changes if this one wins.
     *
     * @return the object stored after the call
     */
    public WhiteboardObject insert(String boardId, WhiteboardObject object, String opId) {
        requireId("boardId", boardId);
        Objects.requireNonNull(object, "object");
        if (!boardId.equals(object.boardId())) {
            throw new IllegalArgumentException("object " + object.id() + " belongs to board " + object.boardId());
        }
        return repo.insertNow(object, opIdOrNull(opId));
    }

    /**
     * Upsert several objects under one op id. Rejected as a whole if any object
     * belongs to another board.
     *
     * @return number of objects stored
     */
    public int insertMany(String boardId, List<WhiteboardObject> objects, String opId) {
        requireId("boardId", boardId);
        if (objects == null) throw new IllegalArgumentException("objects must be present");
        for (WhiteboardObject o : objects) {
            Objects.requireNonNull(o, "object");
            if (!boardId.equals(o.boardId())) {
                throw new IllegalArgumentException("object " + o.id() + " belongs to board " + o.boardId());
            }
        }
        return repo.insertManyNow(objects, opIdOrNull(opId));
    }

    /** @throws ObjectNotFoundException if the board holds no object with this id */
    public int update(String boardId, String id, ObjectPatch patch, String opId) {
        requireOnBoard(boardId, id);
        Objects.requireNonNull(patch, "patch");
        return repo.updateNow(id, patch, opIdOrNull(opId));
    }

    /** Unknown ids are skipped and missing from the result. */
    public Map<String, Integer> updateMany(String boardId, List<ObjectUpdate> updates, String opId) {
        requireId("boardId", boardId);
        if (updates == null) throw new IllegalArgumentException("updates must be present");
        List<ObjectUpdate> onBoard = new ArrayList<>(updates.size());
        for (ObjectUpdate u : updates) {
            if (isOnBoard(boardId, u.id())) onBoard.add(u);
        }
        return repo.updateManyNow(onBoard, opIdOrNull(opId));
    }

    /** @return true if the object existed */
    public boolean delete(String boardId, String id, String opId) {
        requireId("boardId", boardId);
        requireId("id", id);
        return isOnBoard(boardId, id) && repo.deleteNow(id, opIdOrNull(opId));
    }

    public int deleteMany(String boardId, Collection<String> ids, String opId) {
        requireId("boardId", boardId);
        if (ids == null) throw new IllegalArgumentException("ids must be present");
        List<String> onBoard = ids.stream().filter(id -> isOnBoard(boardId, id)).toList();
        return repo.deleteManyNow(onBoard, opIdOrNull(opId));
    }

    // ---------- helpers ----------

    private void requireOnBoard(String boardId, String id) {
        requireId("boardId", boardId);
        requireId("id", id);
        if (!isOnBoard(boardId, id)) throw new ObjectNotFoundException(id);
    }

    private boolean isOnBoard(String boardId, String id) {
        return id != null && repo.find(id).map(o -> o.boardId().equals(boardId)).orElse(false);
    }

    private static String requireId(String what, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " must not be empty");
        }
        return value;
    }

    private static String opIdOrNull(String opId) {
        return opId == null || opId.isBlank() ? null : opId;
    }
}
