// file: server/src/main/java/io/boardsync/server/dto/DeleteManyRequest.java
package io.boardsync.server.dto;

import java.util.List;

/** JSON body for POST /boards/{board}/objects/delete: {@code { "ids": ["a", "b"] }}. */
public class DeleteManyRequest {
    public List<String> ids;
}
