// file: client/src/main/java/io/boardsync/client/Cli.java
package io.boardsync.client;

import io.boardsync.core.ObjectPatch;
import io.boardsync.core.ObjectType;
import io.boardsync.core.WhiteboardObject;
import io.boardsync.storage.ObjectNotFoundException;
import io.boardsync.storage.ObjectRepository;
import io.boardsync.sync.transport.HttpObjectRepository;

import java.io.PrintStream;
import java.net.URI;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

/**
 * Simple CLI for editing a board on a running server over its REST API.
 * Writes made here reach connected clients through the server's change feed.
 *
 * Usage:
 *   boardsync-cli [--base-url http://host:port] list <board>
 *   boardsync-cli [--base-url http://host:port] create <board> <type> <x> <y> [text]
 *   boardsync-cli [--base-url http://host:port] move <board> <id> <x> <y>
 *   boardsync-cli [--base-url http://host:port] del <board> <id>...
 *
 * Examples:
 *   boardsync-cli create b-1 sticky_note 100 100 "hello"
 *   boardsync-cli move b-1 6f1c... 300 120
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8080";
    static final String CLI_USER = "cli";

    private final Function<String, ObjectRepository> repoForBoard;
    private final PrintStream out;
    private final Clock clock;

    Cli(Function<String, ObjectRepository> repoForBoard, PrintStream out, Clock clock) {
        this.repoForBoard = Objects.requireNonNull(repoForBoard, "repoForBoard");
        this.out = Objects.requireNonNull(out, "out");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static void main(String[] args) {
        try {
            if (args.length == 0) {
                usageAndExit("missing command");
            }

            Map.Entry<String, String[]> parsed = parseBaseUrl(args);
            URI baseUri = URI.create(parsed.getKey());
            String[] rest = parsed.getValue();

            if (rest.length == 0) {
                usageAndExit("missing command");
            }

            new Cli(board -> new HttpObjectRepository(baseUri, board), System.out, Clock.systemUTC()).run(rest);
        } catch (UsageException e) {
            usageAndExit(e.getMessage());
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    /** Run one command; {@code args[0]} is the command name. */
    void run(String[] args) {
        String cmd = args[0];
        switch (cmd) {
            case "list" -> {
                if (args.length != 2) throw new UsageException("list requires <board>");
                list(args[1]);
            }
            case "create" -> {
                if (args.length != 5 && args.length != 6) {
                    throw new UsageException("create requires <board> <type> <x> <y> [text]");
                }
                create(args[1], args[2], number("x", args[3]), number("y", args[4]), args.length == 6 ? args[5] : null);
            }
            case "move" -> {
                if (args.length != 5) throw new UsageException("move requires <board> <id> <x> <y>");
                move(args[1], args[2], number("x", args[3]), number("y", args[4]));
            }
            case "del" -> {
                if (args.length < 3) throw new UsageException("del requires <board> <id>...");
                del(args[1], Arrays.asList(args).subList(2, args.length));
            }
            default -> throw new UsageException("unknown command: " + cmd);
        }
    }

    private void list(String board) {
        List<WhiteboardObject> objects = await("list", repoForBoard.apply(board).list(board));
        if (objects.isEmpty()) {
            out.println("(empty)");
            return;
        }
        for (WhiteboardObject o : objects) {
            Object text = o.property("text");
            out.printf("%s %s (%.0f, %.0f) v%d%s%n", o.id(), o.type().wireName(), o.x(), o.y(), o.version(),
                    text == null ? "" : " \"" + text + "\"");
        }
    }

    private void create(String board, String typeName, double x, double y, String text) {
        ObjectType type;
        try {
            type = ObjectType.fromWireName(typeName);
        } catch (IllegalArgumentException e) {
            throw new CliException("unknown object type: " + typeName);
        }
        long now = clock.millis();
        boolean square = type == ObjectType.STICKY_NOTE || type == ObjectType.CIRCLE;
        WhiteboardObject.Builder b = WhiteboardObject.builder()
                .id(UUID.randomUUID().toString())
                .boardId(board)
                .type(type)
                .x(x).y(y)
                .width(square ? 200 : 150).height(square ? 200 : 100)
                .updatedBy(CLI_USER).updatedAt(now).createdAt(now).version(1);
        if (text != null) b.property("text", text);
        WhiteboardObject object = b.build();

        await("create", repoForBoard.apply(board).insert(object));
        out.println(object.id());
    }

    /** Unstamped, so the server stamps it and it wins over the stored copy. */
    private void move(String board, String id, double x, double y) {
        ObjectPatch patch = ObjectPatch.builder().x(x).y(y).updatedBy(CLI_USER).build();
        int version = await("move", repoForBoard.apply(board).update(id, patch));
        out.println("v" + version);
    }

    private void del(String board, List<String> ids) {
        ObjectRepository repo = repoForBoard.apply(board);
        await("del", ids.size() == 1 ? repo.delete(ids.get(0)) : repo.deleteMany(ids));
        out.println("OK");
    }

    private static <T> T await(String command, CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ObjectNotFoundException) {
                throw new CliException("no object " + ((ObjectNotFoundException) cause).objectId());
            }
            throw new CliException(command + " failed: " + cause.getMessage());
        }
    }

    private static double number(String what, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new CliException(what + " must be a number: " + value);
        }
    }

    private static Map.Entry<String, String[]> parseBaseUrl(String[] args) {
        if (args.length >= 1 && "--base-url".equals(args[0])) {
            if (args.length < 2) {
                usageAndExit("--base-url requires a value");
            }
            String baseUrl = args[1];
            String[] rest = new String[args.length - 2];
            System.arraycopy(args, 2, rest, 0, rest.length);
            return Map.entry(baseUrl, rest);
        }
        return Map.entry(DEFAULT_BASE_URL, args);
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  boardsync-cli [--base-url http://host:port] list <board>
                  boardsync-cli [--base-url http://host:port] create <board> <type> <x> <y> [text]
                  boardsync-cli [--base-url http://host:port] move <board> <id> <x> <y>
                  boardsync-cli [--base-url http://host:port] del <board> <id>...

                Types: sticky_note, rectangle, circle, frame, arrow, line, text, connector
                """);
        System.exit(1);
    }

    static class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }

    static final class UsageException extends CliException {
        UsageException(String msg) {
            super(msg);
        }
    }
}
