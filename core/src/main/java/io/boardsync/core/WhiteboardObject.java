// file: core/src/main/java/io/boardsync/core/WhiteboardObject.java
package io.boardsync.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of one object on a board.
 * <p>
 * Geometry fields are plain overwrite-on-update scalars. {@code properties} is a
 * one-level bag: an update replaces individual keys and leaves the others alone
 * (see {@link #apply(ObjectPatch)}). The {@code (version, updatedAt)} pair is what
 * replicas compare when copies disagree.
 * <p>
 * Property values are treated as immutable; null values are never stored.
 */
public record WhiteboardObject(
        String id,
        String boardId,
        ObjectType type,
        double x,
        double y,
        double width,
        double height,
        double rotation,
        Map<String, Object> properties,
        String updatedBy,
        long updatedAt,
        long createdAt,
        int version
) {
    public WhiteboardObject {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(boardId, "boardId");
        Objects.requireNonNull(type, "type");
        if (id.isBlank()) throw new IllegalArgumentException("id must not be blank");
        if (version < 0) throw new IllegalArgumentException("version must be >= 0");
        properties = copyWithoutNulls(properties);
    }

    public VersionStamp stamp() {
        return new VersionStamp(version, updatedAt);
    }

    public Object property(String key) {
        return properties.get(key);
    }

    /**
     * Return a copy with the patch applied: non-null scalars overwrite, each property
     * entry overwrites its key (a null value removes the key), stamp fields overwrite
     * when present. Returns {@code this} when the patch changes nothing.
     */
    public WhiteboardObject apply(ObjectPatch patch) {
        Objects.requireNonNull(patch, "patch");
        Map<String, Object> props = properties;
        if (!patch.properties().isEmpty()) {
            Map<String, Object> merged = new LinkedHashMap<>(properties);
            for (Map.Entry<String, Object> e : patch.properties().entrySet()) {
                if (e.getValue() == null) {
                    merged.remove(e.getKey());
                } else {
                    merged.put(e.getKey(), e.getValue());
                }
            }
            props = merged;
        }
        WhiteboardObject next = new WhiteboardObject(
                id,
                boardId,
                type,
                patch.x() != null ? patch.x() : x,
                patch.y() != null ? patch.y() : y,
                patch.width() != null ? patch.width() : width,
                patch.height() != null ? patch.height() : height,
                patch.rotation() != null ? patch.rotation() : rotation,
                props,
                patch.updatedBy() != null ? patch.updatedBy() : updatedBy,
                patch.updatedAt() != null ? patch.updatedAt() : updatedAt,
                createdAt,
                patch.version() != null ? patch.version() : version
        );
        return next.equals(this) ? this : next;
    }

    public WhiteboardObject withStamp(int newVersion, long newUpdatedAt, String newUpdatedBy) {
        return toBuilder().version(newVersion).updatedAt(newUpdatedAt).updatedBy(newUpdatedBy).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id).boardId(boardId).type(type)
                .x(x).y(y).width(width).height(height).rotation(rotation)
                .properties(properties)
                .updatedBy(updatedBy).updatedAt(updatedAt).createdAt(createdAt)
                .version(version);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static Map<String, Object> copyWithoutNulls(Map<String, Object> in) {
        if (in == null || in.isEmpty()) return Map.of();
        Map<String, Object> out = new LinkedHashMap<>(in.size() * 2);
        for (Map.Entry<String, Object> e : in.entrySet()) {
            if (e.getValue() != null) out.put(e.getKey(), e.getValue());
        }
        return Collections.unmodifiableMap(out);
    }

    public static final class Builder {
        private String id;
        private String boardId;
        private ObjectType type;
        private double x;
        private double y;
        private double width;
        private double height;
        private double rotation;
        private Map<String, Object> properties = new LinkedHashMap<>();
        private String updatedBy;
        private long updatedAt;
        private long createdAt;
        private int version = 1;

        private Builder() {
        }

        public Builder id(String id) { this.id = id; return this; }
        public Builder boardId(String boardId) { this.boardId = boardId; return this; }
        public Builder type(ObjectType type) { this.type = type; return this; }
        public Builder x(double x) { this.x = x; return this; }
        public Builder y(double y) { this.y = y; return this; }
        public Builder width(double width) { this.width = width; return this; }
        public Builder height(double height) { this.height = height; return this; }
        public Builder rotation(double rotation) { this.rotation = rotation; return this; }
        public Builder updatedBy(String updatedBy) { this.updatedBy = updatedBy; return this; }
        public Builder updatedAt(long updatedAt) { this.updatedAt = updatedAt; return this; }
        public Builder createdAt(long createdAt) { this.createdAt = createdAt; return this; }
        public Builder version(int version) { this.version = version; return this; }

        public Builder properties(Map<String, Object> properties) {
            this.properties = new LinkedHashMap<>(properties == null ? Map.of() : properties);
            return this;
        }

        public Builder property(String key, Object value) {
            this.properties.put(key, value);
            return this;
        }

        public WhiteboardObject build() {
            return new WhiteboardObject(id, boardId, type, x, y, width, height, rotation,
                    properties, updatedBy, updatedAt, createdAt, version);
        }
    }
}
