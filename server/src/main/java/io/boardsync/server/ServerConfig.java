// file: server/src/main/java/io/boardsync/server/ServerConfig.java
package io.boardsync.server;

import java.nio.file.Path;

/**
 * Board server configuration parsed from CLI args.
 *
 * Supports:
 *  - port:                   HTTP and WebSocket port
 *  - dataDir:                root of the WAL ({@code wal/}) and snapshot ({@code snap/}) directories
 *  - dedupeTtlSeconds:       how long an Idempotency-Key is remembered
 *  - snapshotEvery:          snapshot after this many committed writes
 *  - presenceTimeoutSeconds: drop presence members not heard from for this long
 */
public record ServerConfig(
        int port,
        String dataDir,
        long dedupeTtlSeconds,
        int snapshotEvery,
        long presenceTimeoutSeconds
) {

    public Path walDir() {
        return Path.of(dataDir, "wal");
    }

    public Path snapDir() {
        return Path.of(dataDir, "snap");
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --port,     -p   <port>
     *   --data-dir, -d   <path>
     *   --dedupe-ttl-seconds <seconds>
     *   --snapshot-every <ops>
     *   --presence-timeout-seconds <seconds>
     *   --help,     -h
     *
     * All flags are optional; defaults suit local dev.
     */
    public static ServerConfig fromArgs(String[] args) {
        int port = 8080;
        String dataDir = "./data";
        long dedupeTtlSeconds = 600;
        int snapshotEvery = 10_000;
        long presenceTimeoutSeconds = 45;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--port", "-p" -> {
                    ensureValue(args, i);
                    port = parseInt(args[i], args[++i]);
                }

                case "--data-dir", "-d" -> {
                    ensureValue(args, i);
                    dataDir = args[++i];
                }

                case "--dedupe-ttl-seconds" -> {
                    ensureValue(args, i);
                    dedupeTtlSeconds = parseInt(args[i], args[++i]);
                }

                case "--snapshot-every" -> {
                    ensureValue(args, i);
                    snapshotEvery = parseInt(args[i], args[++i]);
                }

                case "--presence-timeout-seconds" -> {
                    ensureValue(args, i);
                    presenceTimeoutSeconds = parseInt(args[i], args[++i]);
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new ServerConfig(port, dataDir, dedupeTtlSeconds, snapshotEvery, presenceTimeoutSeconds);
    }

    private static int parseInt(String option, String value) {
        try {
            int n = Integer.parseInt(value);
            if (n <= 0) throw new NumberFormatException(value);
            return n;
        } catch (NumberFormatException e) {
            System.err.println("Invalid value for " + option + ": " + value);
            System.exit(1);
            return -1;
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: boardsync-server [options]

            Options:
              --port,           -p   HTTP/WebSocket port (default: 8080)
              --data-dir,       -d   Data directory (default: ./data)
              --dedupe-ttl-seconds    How long idempotency keys are remembered (default: 600)
              --snapshot-every        Snapshot after this many writes (default: 10000)
              --presence-timeout-seconds
                                     Drop silent presence members after (default: 45)
              --help,           -h   Show this help message
            """);
        System.exit(0);
    }
}
