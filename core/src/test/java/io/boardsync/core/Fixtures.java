// file: core/src/test/java/io/boardsync/core/Fixtures.java
package io.boardsync.core;

import java.util.Map;

/** Small builders shared by the core tests. */
final class Fixtures {

    static final String BOARD = "board-1";

    private Fixtures() {
    }

    static WhiteboardObject sticky(String id, double x, double y) {
        return WhiteboardObject.builder()
                .id(id)
                .boardId(BOARD)
                .type(ObjectType.STICKY_NOTE)
                .x(x).y(y).width(200).height(200)
                .properties(Map.of("text", "hello", "noteColor", "#FEF08A"))
                .updatedBy("alice")
                .updatedAt(1_000L)
                .createdAt(1_000L)
                .version(1)
                .build();
    }

    static WhiteboardObject stamped(WhiteboardObject o, int version, long updatedAt) {
        return o.withStamp(version, updatedAt, o.updatedBy());
    }
}
