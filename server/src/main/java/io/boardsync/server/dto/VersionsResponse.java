// file: server/src/main/java/io/boardsync/server/dto/VersionsResponse.java
package io.boardsync.server.dto;

import java.util.Map;

/** Stored versions after a batch update, by object id. Unknown ids are absent. */
public class VersionsResponse {
    public Map<String, Integer> versions;

    public VersionsResponse(Map<String, Integer> versions) {
        this.versions = versions;
    }
}
