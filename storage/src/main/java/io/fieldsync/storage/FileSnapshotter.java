package io.fieldsync.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import io.fieldsync.core.EntityKey;
import io.fieldsync.core.EntityRecord;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * JSON snapshot implementation backed by a single file per snapshot.
 * <p>
 * Format: a JSON array of entity documents (same shape as the WAL's ENTITY_PUT
 * records), one per key.
 * <p>
 * Atomicity:
 *   - We write to "snapshot-<gen>.json.tmp" first and fsync it,
 *   - then move to "snapshot-<gen>.json" using ATOMIC_MOVE,
 *   - then delete older generations.
 */
public final class FileSnapshotter implements Snapshotter {
    private static final String PREFIX = "snapshot-";
    private static final String SUFFIX = ".json";
    private static final TypeReference<List<Map<String, Object>>> DOCUMENTS = new TypeReference<>() {};

    private final Path dir;

    public FileSnapshotter(Path dir) {
        this.dir = dir;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageException("cannot create snapshot directory " + dir, e);
        }
    }

    @Override
    public String writeSnapshot(Map<EntityKey, EntityRecord> current) {
        List<Path> older = snapshots();
        long gen = older.isEmpty() ? 1 : generation(older.get(older.size() - 1)) + 1;
        String name = String.format("%s%012d%s", PREFIX, gen, SUFFIX);
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        var docs = new ArrayList<Map<String, Object>>(current.size());
        for (EntityRecord r : current.values()) docs.add(RecordCodec.entityToDocument(r));

        try {
            try (OutputStream out = Files.newOutputStream(tmp,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE,
                    StandardOpenOption.SYNC)) {
                RecordCodec.JSON.writeValue(out, docs);
            }
            Files.move(tmp, dst, ATOMIC_MOVE);
            for (Path p : older) Files.deleteIfExists(p);
        } catch (IOException e) {
            throw new StorageException("snapshot write failed: " + dst, e);
        }
        return dst.getFileName().toString();
    }

    @Override
    public LoadedSnapshot loadLatest() {
        List<Path> all = snapshots();
        if (all.isEmpty()) return null;
        Path snap = all.get(all.size() - 1);

        try {
            List<Map<String, Object>> docs = RecordCodec.JSON.readValue(snap.toFile(), DOCUMENTS);
            Map<EntityKey, EntityRecord> map = new HashMap<>(docs.size() * 2);
            for (Map<String, Object> doc : docs) {
                EntityRecord r = RecordCodec.entityFromDocument(doc);
                map.put(r.key(), r);
            }
            return new LoadedSnapshot(snap.getFileName().toString(), map);
        } catch (IOException | RuntimeException e) {
            throw new StorageException("snapshot load failed: " + snap, e);
        }
    }

    private List<Path> snapshots() {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> {
                        String n = p.getFileName().toString();
                        return n.startsWith(PREFIX) && n.endsWith(SUFFIX);
                    })
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new StorageException("cannot list snapshot directory " + dir, e);
        }
    }

    private static long generation(Path snapshot) {
        String n = snapshot.getFileName().toString();
        return Long.parseLong(n.substring(PREFIX.length(), n.length() - SUFFIX.length()));
    }
}
