// file: core/src/main/java/io/boardsync/core/Clipboard.java
package io.boardsync.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Copied objects waiting to be pasted. Local to one client, never synchronized.
 */
public final class Clipboard {

    public static final double DEFAULT_OFFSET = 30;

    private static final String START_ID = Connectors.START_ID;
    private static final String END_ID = Connectors.END_ID;
    private static final String START_SIDE = Connectors.START_SIDE;
    private static final String END_SIDE = Connectors.END_SIDE;

    private List<WhiteboardObject> items = List.of();

    public void copy(Collection<WhiteboardObject> objects) {
        items = List.copyOf(objects);
    }

    public void clear() {
        items = List.of();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public List<WhiteboardObject> items() {
        return items;
    }

    /**
     * Fresh copies ready to insert: new ids from {@code ids}, shifted by {@code offset},
     * version 1 stamped now by {@code userId}. Connector endpoints pointing at another
     * copied object are re-pointed at its copy; endpoints pointing outside the copied
     * set are dropped together with their anchor side.
     */
    public List<WhiteboardObject> materialize(String boardId, Supplier<String> ids, double offset,
                                              long now, String userId) {
        Map<String, String> idMap = new HashMap<>();
        for (WhiteboardObject o : items) {
            idMap.put(o.id(), ids.get());
        }
        List<WhiteboardObject> out = new ArrayList<>(items.size());
        for (WhiteboardObject o : items) {
            WhiteboardObject.Builder b = o.toBuilder()
                    .id(idMap.get(o.id()))
                    .boardId(boardId)
                    .x(o.x() + offset)
                    .y(o.y() + offset)
                    .version(1)
                    .createdAt(now)
                    .updatedAt(now)
                    .updatedBy(userId);
            if (o.type().isConnector()) {
                relink(b, o, START_ID, START_SIDE, idMap);
                relink(b, o, END_ID, END_SIDE, idMap);
            }
            out.add(b.build());
        }
        return out;
    }

    private static void relink(WhiteboardObject.Builder b, WhiteboardObject source, String idKey,
                               String sideKey, Map<String, String> idMap) {
        Object linked = source.property(idKey);
        if (linked == null) return;
        String copy = idMap.get(linked.toString());
        if (copy != null) {
            b.property(idKey, copy);
        } else {
            b.property(idKey, null);
            b.property(sideKey, null);
        }
    }
}
