// file: core/src/main/java/io/boardsync/core/Viewport.java
package io.boardsync.core;

import java.util.Objects;

/**
 * What one user is looking at: zoom factor and pan offset of their canvas.
 * Followers copy it as is.
 */
public record Viewport(String userId, double zoom, double panOffsetX, double panOffsetY, long timestamp) {
    public Viewport {
        Objects.requireNonNull(userId, "userId");
        if (!(zoom > 0)) throw new IllegalArgumentException("zoom must be > 0");
    }
}
