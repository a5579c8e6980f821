// file: server/src/test/java/io/boardsync/server/TestBoards.java
package io.boardsync.server;

import io.boardsync.core.ObjectType;
import io.boardsync.core.WhiteboardObject;
import io.boardsync.storage.DurableObjectRepository;
import io.boardsync.storage.FileSnapshotter;
import io.boardsync.storage.FileWal;
import io.boardsync.storage.TtlOpIdDeduper;

import java.nio.file.Path;
import java.time.Duration;

final class TestBoards {
    private TestBoards() {
    }

    static DurableObjectRepository repository(Path dir) {
        return new DurableObjectRepository(
                new FileWal(dir.resolve("wal"), 1L << 20),
                new FileSnapshotter(dir.resolve("snap")),
                new TtlOpIdDeduper(Duration.ofMinutes(10)));
    }

    static WhiteboardObject note(String id, String board, long at) {
        return WhiteboardObject.builder()
                .id(id).boardId(board).type(ObjectType.STICKY_NOTE)
                .x(10).y(20).width(200).height(200)
                .property("text", "hello")
                .updatedBy("alice").updatedAt(at).createdAt(at).version(1)
                .build();
    }
}
