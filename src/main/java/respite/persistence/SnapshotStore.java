package respite.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.TreeMap;

/**
 * Whole-state snapshot file: a JSON document holding every record.
 * <pre>
 * {"format":"respite-snapshot","version":1,"entries":{"key":"value",...}}
 * </pre>
 * Writes go to a sibling temp file first and are then moved over the target, so a crash
 * mid-write never leaves a truncated snapshot behind.
 */
public class SnapshotStore {
    public static final String FORMAT = "respite-snapshot";
    public static final int VERSION = 1;

    private static final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private final Path file;

    public SnapshotStore(Path file) {
        this.file = file;
    }

    public Path getFile() {
        return file;
    }

    public boolean exists() {
        return Files.isRegularFile(file);
    }

    public void save(Map<String, String> entries) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);

        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try (OutputStream out = Files.newOutputStream(tmp)) {
            mapper.writeValue(out, new Snapshot(entries));
        }
        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Reads the snapshot. Returns null when no snapshot file exists.
     *
     * @throws IOException if the file cannot be read or is not a snapshot this version understands
     */
    public Map<String, String> load() throws IOException {
        if (!exists()) return null;

        Snapshot snapshot;
        try (InputStream in = Files.newInputStream(file)) {
            snapshot = mapper.readValue(in, Snapshot.class);
        } catch (JsonProcessingException e) {
            throw new IOException("Corrupt snapshot " + file + ": " + e.getOriginalMessage(), e);
        }

        if (snapshot == null || !FORMAT.equals(snapshot.format)) {
            throw new IOException("Not a snapshot file: " + file);
        }
        if (snapshot.version != VERSION) {
            throw new IOException("Unknown snapshot version: " + snapshot.version);
        }
        if (snapshot.entries == null) return new TreeMap<>();
        for (Map.Entry<String, String> e : snapshot.entries.entrySet()) {
            if (e.getValue() == null) throw new IOException("Null value for key '" + e.getKey() + "' in " + file);
        }
        return snapshot.entries;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Snapshot {
        public String format;
        public int version;
        public Map<String, String> entries;

        Snapshot() {
        }

        Snapshot(Map<String, String> entries) {
            this.format = FORMAT;
            this.version = VERSION;
            this.entries = entries;
        }
    }
}
