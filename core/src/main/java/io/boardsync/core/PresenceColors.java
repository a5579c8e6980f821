// file: core/src/main/java/io/boardsync/core/PresenceColors.java
package io.boardsync.core;

import java.util.List;

/**
 * Deterministic user colors, so every client paints a given user the same way
 * without coordinating.
 */
public final class PresenceColors {

    public static final List<String> PALETTE = List.of(
            "#EF4444", "#F59E0B", "#10B981", "#3B82F6", "#8B5CF6",
            "#EC4899", "#F97316", "#14B8A6", "#6366F1", "#D946EF"
    );

    private PresenceColors() {
        // utility
    }

    /** Sum of the UTF-16 code units of the id, modulo the palette size. */
    public static String colorFor(String userId) {
        int sum = 0;
        for (int i = 0; i < userId.length(); i++) {
            sum += userId.charAt(i);
        }
        return PALETTE.get(Math.abs(sum) % PALETTE.size());
    }
}
