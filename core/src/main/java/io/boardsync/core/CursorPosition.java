// file: core/src/main/java/io/boardsync/core/CursorPosition.java
package io.boardsync.core;

import java.util.Objects;

/**
 * Absolute pointer position of one user in canvas coordinates.
 * Positions are absolute, so a dropped update only leaves the cursor briefly stale.
 */
public record CursorPosition(String userId, String userName, String color, double x, double y) {
    public CursorPosition {
        Objects.requireNonNull(userId, "userId");
    }
}
