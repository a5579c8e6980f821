// file: server/src/main/java/io/boardsync/server/Main.java
package io.boardsync.server;

import io.boardsync.storage.DurableObjectRepository;
import io.boardsync.storage.FileSnapshotter;
import io.boardsync.storage.FileWal;
import io.boardsync.storage.SnapshotPolicy;
import io.boardsync.storage.TtlOpIdDeduper;

import java.time.Clock;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for the board server.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Wire storage (WAL, snapshots, deduper) into the durable repository.
 *  - Feed committed changes to the WebSocket relay.
 *  - Start the HTTP server and close everything on shutdown.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        var cfg = ServerConfig.fromArgs(args);
        Clock clock = Clock.systemUTC();

        // ------ Storage Layer -------
        var wal = new FileWal(cfg.walDir(), 64L * 1024 * 1024); // rotate ~64MB
        var snaps = new FileSnapshotter(cfg.snapDir());
        var dedupe = new TtlOpIdDeduper(Duration.ofSeconds(cfg.dedupeTtlSeconds()), clock);
        var repo = new DurableObjectRepository(wal, snaps, dedupe, new SnapshotPolicy(cfg.snapshotEvery()), clock);

        // ------ Live relay -------
        var relay = new BoardRelayHub(Duration.ofSeconds(cfg.presenceTimeoutSeconds()), clock);
        repo.subscribe(relay::publishChange);

        // ------ HTTP layer ------
        var web = new WebServer(cfg.port(), new BoardService(repo), relay);

        relay.start();
        web.start();
        System.out.printf("boardsync server listening on http://localhost:%d (data in %s)%n",
                cfg.port(), cfg.dataDir());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                web.stop();
                relay.close();
                wal.close();
            } catch (Exception e) {
                log.log(Level.WARNING, "shutdown failed", e);
            }
        }));
    }
}
