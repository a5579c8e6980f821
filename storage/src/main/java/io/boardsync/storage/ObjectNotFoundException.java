// file: storage/src/main/java/io/boardsync/storage/ObjectNotFoundException.java
package io.boardsync.storage;

/** Thrown when an update targets an object the repository does not hold. */
public class ObjectNotFoundException extends RuntimeException {
    private final String objectId;

    public ObjectNotFoundException(String objectId) {
        super("object not found: " + objectId);
        this.objectId = objectId;
    }

    public String objectId() {
        return objectId;
    }
}
