// file: sync/src/main/java/io/boardsync/sync/channel/BroadcastChannel.java
package io.boardsync.sync.channel;

import io.boardsync.sync.message.BroadcastMessage;
import io.boardsync.sync.message.ChangeNotification;

import java.util.concurrent.CompletableFuture;

/**
 * Per-board pub/sub between clients. Delivery is best-effort and the sender never
 * receives its own messages from a well-behaved relay; receivers still filter by
 * sender id. The same connection also carries the durable change feed.
 */
public interface BroadcastChannel {

    interface Listener {
        void onBroadcast(BroadcastMessage message);

        void onChange(ChangeNotification change);

        /** The connection was re-established; anything sent meanwhile may be lost. */
        default void onReconnect() {
        }
    }

    CompletableFuture<Void> broadcast(BroadcastMessage message);

    void subscribe(Listener listener);

    /** Stop delivering to {@code listener}. Unknown listeners are ignored. */
    void unsubscribe(Listener listener);
}
