// file: core/src/main/java/io/boardsync/core/VersionStamp.java
package io.boardsync.core;

/**
 * The pair a replica compares when two copies of one object disagree.
 *
 * @param version   per-object write counter, bumped by exactly one per accepted write
 * @param updatedAt epoch millis of the write at its origin
 */
public record VersionStamp(int version, long updatedAt) {
}
