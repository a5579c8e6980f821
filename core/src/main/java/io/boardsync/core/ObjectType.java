// file: core/src/main/java/io/boardsync/core/ObjectType.java
package io.boardsync.core;

/**
 * Closed set of canvas object kinds, with the names used on the wire and in storage.
 */
public enum ObjectType {
    STICKY_NOTE("sticky_note"),
    RECTANGLE("rectangle"),
    CIRCLE("circle"),
    FRAME("frame"),
    ARROW("arrow"),
    LINE("line"),
    TEXT("text"),
    CONNECTOR("connector");

    private final String wireName;

    ObjectType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Links to other objects live in properties for these kinds. */
    public boolean isConnector() {
        return this == ARROW || this == LINE || this == CONNECTOR;
    }

    public static ObjectType fromWireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("object type must not be empty");
        }
        for (ObjectType t : values()) {
            if (t.wireName.equals(name)) return t;
        }
        throw new IllegalArgumentException("unknown object type: " + name);
    }
}
