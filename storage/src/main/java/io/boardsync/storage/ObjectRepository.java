// file: storage/src/main/java/io/boardsync/storage/ObjectRepository.java
package io.boardsync.storage;

import io.boardsync.core.ObjectPatch;
import io.boardsync.core.ObjectUpdate;
import io.boardsync.core.WhiteboardObject;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Durable home of board objects.
 * <p>
 * Every call is asynchronous and may fail on its own; failures surface as
 * exceptionally completed futures. Callers on the sync path never block on them.
 */
public interface ObjectRepository {

    /** All objects of a board, oldest first. */
    CompletableFuture<List<WhiteboardObject>> list(String boardId);

    CompletableFuture<Void> insert(WhiteboardObject object);

    /** One round trip for many new objects, e.g. a paste. */
    CompletableFuture<Void> insertMany(List<WhiteboardObject> objects);

    /**
     * Apply a partial update.
     *
     * @return the version the stored object ends up with
     */
    CompletableFuture<Integer> update(String id, ObjectPatch patch);

    /** One round trip for many updates, e.g. the end of a multi-object drag. */
    CompletableFuture<Map<String, Integer>> updateMany(List<ObjectUpdate> updates);

    CompletableFuture<Void> delete(String id);

    CompletableFuture<Void> deleteMany(Collection<String> ids);
}
