// file: server/src/main/java/io/boardsync/server/dto/InsertManyRequest.java
package io.boardsync.server.dto;

import io.boardsync.core.WhiteboardObject;

import java.util.List;

/** JSON body for POST /boards/{board}/objects/insert: {@code { "objects": [ {...}, {...} ] }}. */
public class InsertManyRequest {
    public List<WhiteboardObject> objects;
}
