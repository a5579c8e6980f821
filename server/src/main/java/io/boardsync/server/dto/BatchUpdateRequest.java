// file: server/src/main/java/io/boardsync/server/dto/BatchUpdateRequest.java
package io.boardsync.server.dto;

import io.boardsync.core.ObjectUpdate;

import java.util.List;

/**
 * JSON body for PATCH /boards/{board}/objects.
 * Example:
 *   { "updates": [ { "id": "a", "patch": { "x": 10, "y": 20 } } ] }
 */
public class BatchUpdateRequest {
    public List<ObjectUpdate> updates;
}
