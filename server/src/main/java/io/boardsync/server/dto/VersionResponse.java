// file: server/src/main/java/io/boardsync/server/dto/VersionResponse.java
package io.boardsync.server.dto;

/** Stored version after a single update: {@code { "version": 4 }}. */
public class VersionResponse {
    public int version;

    public VersionResponse(int version) {
        this.version = version;
    }
}
