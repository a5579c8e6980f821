// file: sync/src/main/java/io/boardsync/sync/transport/RemoteCallException.java
package io.boardsync.sync.transport;

/** Non-success HTTP answer from the board server. */
public class RemoteCallException extends RuntimeException {
    private final int status;

    public RemoteCallException(String operation, int status, String body) {
        super(operation + " failed (" + status + "): " + body);
        this.status = status;
    }

    public int status() {
        return status;
    }
}
