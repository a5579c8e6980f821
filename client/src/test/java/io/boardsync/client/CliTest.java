// file: client/src/test/java/io/boardsync/client/CliTest.java
package io.boardsync.client;

import io.boardsync.core.ObjectType;
import io.boardsync.storage.DurableObjectRepository;
import io.boardsync.storage.FileSnapshotter;
import io.boardsync.storage.FileWal;
import io.boardsync.storage.TtlOpIdDeduper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/** Commands run against a local repository instead of the REST API. */
class CliTest {

    @TempDir Path dir;

    private DurableObjectRepository repo;
    private ByteArrayOutputStream buf;
    private Cli cli;

    @BeforeEach
    void setUp() {
        repo = new DurableObjectRepository(
                new FileWal(dir.resolve("wal"), 1L << 20),
                new FileSnapshotter(dir.resolve("snap")),
                new TtlOpIdDeduper(Duration.ofMinutes(10)));
        buf = new ByteArrayOutputStream();
        Clock clock = Clock.fixed(Instant.ofEpochMilli(5_000), ZoneOffset.UTC);
        cli = new Cli(board -> repo, new PrintStream(buf, true, StandardCharsets.UTF_8), clock);
    }

    private String output() {
        return buf.toString(StandardCharsets.UTF_8);
    }

    private String createNote(String text) {
        cli.run(new String[]{"create", "b-1", "sticky_note", "100", "120", text});
        String[] lines = output().trim().split("\n");
        buf.reset();
        return lines[lines.length - 1].trim();
    }

    @Test
    void create_stores_a_fresh_object_and_prints_its_id() {
        String id = createNote("hello");

        var stored = repo.find(id).orElseThrow();
        assertEquals(ObjectType.STICKY_NOTE, stored.type());
        assertEquals(1, stored.version());
        assertEquals("hello", stored.property("text"));
        assertEquals(Cli.CLI_USER, stored.updatedBy());
        assertEquals(5_000L, stored.createdAt());
    }

    @Test
    void list_prints_one_line_per_object() {
        cli.run(new String[]{"list", "b-1"});
        assertEquals("(empty)", output().trim());
        buf.reset();

        String id = createNote("plan");
        cli.run(new String[]{"list", "b-1"});

        assertTrue(output().contains(id + " sticky_note (100, 120) v1 \"plan\""), output());
    }

    @Test
    void move_is_stamped_by_the_repository() {
        String id = createNote("x");

        cli.run(new String[]{"move", "b-1", id, "300", "40"});

        assertEquals("v2", output().trim());
        assertEquals(300.0, repo.find(id).orElseThrow().x());
    }

    @Test
    void del_accepts_several_ids() {
        String a = createNote("a");
        String b = createNote("b");

        cli.run(new String[]{"del", "b-1", a, b});

        assertEquals("OK", output().trim());
        assertTrue(repo.listNow("b-1").isEmpty());
    }

    @Test
    void moving_an_unknown_object_is_a_cli_error() {
        var e = assertThrows(Cli.CliException.class, () -> cli.run(new String[]{"move", "b-1", "ghost", "1", "1"}));
        assertEquals("no object ghost", e.getMessage());
    }

    @Test
    void bad_input_is_reported() {
        assertThrows(Cli.UsageException.class, () -> cli.run(new String[]{"list"}));
        assertThrows(Cli.UsageException.class, () -> cli.run(new String[]{"frobnicate"}));
        var e = assertThrows(Cli.CliException.class,
                () -> cli.run(new String[]{"create", "b-1", "hexagon", "1", "1"}));
        assertEquals("unknown object type: hexagon", e.getMessage());
        assertThrows(Cli.CliException.class, () -> cli.run(new String[]{"move", "b-1", "a", "left", "1"}));
    }
}
