// file: core/src/main/java/io/boardsync/core/ObjectPatch.java
package io.boardsync.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Partial update of a {@link WhiteboardObject}.
 * <p>
 * A null scalar means "leave as is". In {@link #properties()} a key mapped to
 * null means "remove this key"; keys not mentioned are left alone. The stamp
 * fields (version, updatedAt, updatedBy) travel with the patch so a receiver
 * can resolve it against its own copy.
 */
public final class ObjectPatch {

    private static final Set<String> TEXT_KEYS = Set.of("text", "title");
    private static final ObjectPatch EMPTY = new Builder().build();

    private final Double x;
    private final Double y;
    private final Double width;
    private final Double height;
    private final Double rotation;
    private final Map<String, Object> properties;
    private final Integer version;
    private final Long updatedAt;
    private final String updatedBy;

    private ObjectPatch(Builder b) {
        this.x = b.x;
        this.y = b.y;
        this.width = b.width;
        this.height = b.height;
        this.rotation = b.rotation;
        this.properties = b.properties.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(b.properties));
        this.version = b.version;
        this.updatedAt = b.updatedAt;
        this.updatedBy = b.updatedBy;
    }

    public static ObjectPatch empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Geometry-only patch, the shape of every drag frame. */
    public static ObjectPatch position(double x, double y) {
        return builder().x(x).y(y).build();
    }

    public Double x() { return x; }
    public Double y() { return y; }
    public Double width() { return width; }
    public Double height() { return height; }
    public Double rotation() { return rotation; }
    public Map<String, Object> properties() { return properties; }
    public Integer version() { return version; }
    public Long updatedAt() { return updatedAt; }
    public String updatedBy() { return updatedBy; }

    /** Stamp carried by this patch, or null when it carries no complete stamp. */
    public VersionStamp stamp() {
        if (version == null || updatedAt == null) return null;
        return new VersionStamp(version, updatedAt);
    }

    /** True when no field other than the stamp is touched. */
    public boolean isEmpty() {
        return !touchesGeometry() && properties.isEmpty();
    }

    public boolean touchesGeometry() {
        return x != null || y != null || width != null || height != null || rotation != null;
    }

    public boolean isGeometryOnly() {
        return touchesGeometry() && properties.isEmpty();
    }

    /** Free-text edits (note text, frame title) get their own, looser throttle. */
    public boolean touchesText() {
        for (String key : properties.keySet()) {
            if (TEXT_KEYS.contains(key)) return true;
        }
        return false;
    }

    public ObjectPatch withStamp(int newVersion, long newUpdatedAt, String newUpdatedBy) {
        return toBuilder().version(newVersion).updatedAt(newUpdatedAt).updatedBy(newUpdatedBy).build();
    }

    public ObjectPatch withoutStamp() {
        return toBuilder().version(null).updatedAt(null).updatedBy(null).build();
    }

    /**
     * Combine with a later patch for the same object. Fields set in {@code later}
     * win; fields only set here are kept.
     */
    public ObjectPatch merge(ObjectPatch later) {
        Objects.requireNonNull(later, "later");
        Builder b = toBuilder();
        if (later.x != null) b.x(later.x);
        if (later.y != null) b.y(later.y);
        if (later.width != null) b.width(later.width);
        if (later.height != null) b.height(later.height);
        if (later.rotation != null) b.rotation(later.rotation);
        for (Map.Entry<String, Object> e : later.properties.entrySet()) {
            b.property(e.getKey(), e.getValue());
        }
        if (later.version != null) b.version(later.version);
        if (later.updatedAt != null) b.updatedAt(later.updatedAt);
        if (later.updatedBy != null) b.updatedBy(later.updatedBy);
        return b.build();
    }

    /**
     * Patch touching the same fields as this one, holding the values {@code source}
     * has for them, plus the full stamp of {@code source}. Applied to any later state
     * of the object it restores exactly what this patch overwrote.
     */
    public ObjectPatch capture(WhiteboardObject source) {
        Objects.requireNonNull(source, "source");
        Builder b = builder();
        if (x != null) b.x(source.x());
        if (y != null) b.y(source.y());
        if (width != null) b.width(source.width());
        if (height != null) b.height(source.height());
        if (rotation != null) b.rotation(source.rotation());
        for (String key : properties.keySet()) {
            b.property(key, source.property(key));
        }
        return b.version(source.version())
                .updatedAt(source.updatedAt())
                .updatedBy(source.updatedBy())
                .build();
    }

    /**
     * Smallest patch turning {@code from} into {@code to}: changed geometry, changed
     * or added properties, and removed properties as null entries. Stamp of {@code to}.
     */
    public static ObjectPatch diff(WhiteboardObject from, WhiteboardObject to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Builder b = builder();
        if (from.x() != to.x()) b.x(to.x());
        if (from.y() != to.y()) b.y(to.y());
        if (from.width() != to.width()) b.width(to.width());
        if (from.height() != to.height()) b.height(to.height());
        if (from.rotation() != to.rotation()) b.rotation(to.rotation());
        for (Map.Entry<String, Object> e : to.properties().entrySet()) {
            if (!Objects.equals(e.getValue(), from.property(e.getKey()))) b.property(e.getKey(), e.getValue());
        }
        for (String key : from.properties().keySet()) {
            if (!to.properties().containsKey(key)) b.property(key, null);
        }
        return b.version(to.version()).updatedAt(to.updatedAt()).updatedBy(to.updatedBy()).build();
    }

    public Builder toBuilder() {
        Builder b = new Builder()
                .x(x).y(y).width(width).height(height).rotation(rotation)
                .version(version).updatedAt(updatedAt).updatedBy(updatedBy);
        b.properties.putAll(properties);
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ObjectPatch)) return false;
        ObjectPatch p = (ObjectPatch) o;
        return Objects.equals(x, p.x) && Objects.equals(y, p.y)
                && Objects.equals(width, p.width) && Objects.equals(height, p.height)
                && Objects.equals(rotation, p.rotation)
                && properties.equals(p.properties)
                && Objects.equals(version, p.version)
                && Objects.equals(updatedAt, p.updatedAt)
                && Objects.equals(updatedBy, p.updatedBy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, width, height, rotation, properties, version, updatedAt, updatedBy);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ObjectPatch{");
        if (x != null) sb.append("x=").append(x).append(' ');
        if (y != null) sb.append("y=").append(y).append(' ');
        if (width != null) sb.append("width=").append(width).append(' ');
        if (height != null) sb.append("height=").append(height).append(' ');
        if (rotation != null) sb.append("rotation=").append(rotation).append(' ');
        if (!properties.isEmpty()) sb.append("properties=").append(properties).append(' ');
        if (version != null) sb.append("v=").append(version).append(' ');
        if (updatedAt != null) sb.append("at=").append(updatedAt);
        return sb.append('}').toString();
    }

    public static final class Builder {
        private Double x;
        private Double y;
        private Double width;
        private Double height;
        private Double rotation;
        private final Map<String, Object> properties = new LinkedHashMap<>();
        private Integer version;
        private Long updatedAt;
        private String updatedBy;

        private Builder() {
        }

        public Builder x(Double x) { this.x = x; return this; }
        public Builder y(Double y) { this.y = y; return this; }
        public Builder width(Double width) { this.width = width; return this; }
        public Builder height(Double height) { this.height = height; return this; }
        public Builder rotation(Double rotation) { this.rotation = rotation; return this; }
        public Builder version(Integer version) { this.version = version; return this; }
        public Builder updatedAt(Long updatedAt) { this.updatedAt = updatedAt; return this; }
        public Builder updatedBy(String updatedBy) { this.updatedBy = updatedBy; return this; }

        /** A null value removes the key when the patch is applied. */
        public Builder property(String key, Object value) {
            properties.put(Objects.requireNonNull(key, "key"), value);
            return this;
        }

        public Builder properties(Map<String, Object> values) {
            if (values != null) {
                for (Map.Entry<String, Object> e : values.entrySet()) {
                    property(e.getKey(), e.getValue());
                }
            }
            return this;
        }

        public ObjectPatch build() {
            return new ObjectPatch(this);
        }
    }
}
