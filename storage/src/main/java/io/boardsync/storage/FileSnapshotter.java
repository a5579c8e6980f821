// file: storage/src/main/java/io/boardsync/storage/FileSnapshotter.java
package io.boardsync.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.boardsync.core.WhiteboardObject;
import io.boardsync.storage.json.ObjectJson;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Collection;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * JSON snapshot files, one array of objects per file.
 * <p>
 * Atomicity: the snapshot is written to "snapshot-&lt;ts&gt;.json.tmp" and then moved
 * to "snapshot-&lt;ts&gt;.json" with ATOMIC_MOVE, so a crash never leaves a half file
 * under the final name. Only the newest {@code retain} snapshots are kept.
 */
public final class FileSnapshotter implements Snapshotter {
    private static final Logger log = Logger.getLogger(FileSnapshotter.class.getName());
    private static final String PREFIX = "snapshot-";
    private static final String SUFFIX = ".json";
    private static final TypeReference<List<WhiteboardObject>> LIST_TYPE = new TypeReference<>() {};

    private final Path dir;
    private final int retain;
    private final ObjectMapper json = ObjectJson.newMapper();

    public FileSnapshotter(Path dir) {
        this(dir, 2);
    }

    public FileSnapshotter(Path dir, int retain) {
        if (retain <= 0) throw new IllegalArgumentException("retain must be > 0");
        this.dir = dir;
        this.retain = retain;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    @Override
    public String writeSnapshot(Collection<WhiteboardObject> objects) {
        long ts = System.currentTimeMillis();
        while (Files.exists(dir.resolve(nameFor(ts)))) ts++;
        String name = nameFor(ts);
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        try (OutputStream out = Files.newOutputStream(tmp,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
            json.writerFor(LIST_TYPE).writeValue(out, List.copyOf(objects));
        } catch (IOException e) { throw new UncheckedIOException(e); }

        try { Files.move(tmp, dst, ATOMIC_MOVE); }
        catch (IOException e) { throw new UncheckedIOException(e); }

        pruneOld();
        log.fine(() -> "wrote snapshot " + name + " with " + objects.size() + " objects");
        return name;
    }

    @Override
    public LoadedSnapshot loadLatest() {
        List<Path> snaps = snapshots();
        if (snaps.isEmpty()) return null;
        Path latest = snaps.get(snaps.size() - 1);
        try {
            List<WhiteboardObject> objects = json.readValue(latest.toFile(), LIST_TYPE);
            return new LoadedSnapshot(latest.getFileName().toString(), objects);
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    private static String nameFor(long ts) {
        return String.format("%s%013d%s", PREFIX, ts, SUFFIX);
    }

    private List<Path> snapshots() {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> {
                        String n = p.getFileName().toString();
                        return n.startsWith(PREFIX) && n.endsWith(SUFFIX);
                    })
                    .sorted()
                    .toList();
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    private void pruneOld() {
        List<Path> snaps = snapshots();
        for (int i = 0; i < snaps.size() - retain; i++) {
            try {
                Files.deleteIfExists(snaps.get(i));
            } catch (IOException e) {
                log.warning("could not delete old snapshot " + snaps.get(i) + ": " + e.getMessage());
            }
        }
    }
}
