package respite.db;

import respite.Config;
import respite.persistence.SnapshotStore;
import respite.utils.Log;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * The shared key/value store. Tracks the bytes attributed to its records
 * (UTF-8 length of key plus value) and refuses writes that would push that total over
 * {@code maxMemory}. All access goes through one {@link ReentrantLock}.
 */
public class RespiteDatabase {

    private final Map<String, String> store = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    private final long maxMemory;
    private final SnapshotStore snapshots; // null = persistence disabled
    private long usedMemory = 0;
    private volatile long lastSaveTime = 0;

    public RespiteDatabase(long maxMemory, SnapshotStore snapshots) {
        this.maxMemory = maxMemory;
        this.snapshots = snapshots;
    }

    public RespiteDatabase(Config config) {
        this(config.maxMemory, config.persistenceEnabled ? new SnapshotStore(Paths.get(config.snapshotFile)) : null);
    }

    public static long entrySize(String key, String value) {
        return utf8Length(key) + utf8Length(value);
    }

    /**
     * Runs {@code action} while holding the store lock, making a multi-step operation atomic
     * with respect to every other caller.
     */
    public <T> T atomically(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Inserts or replaces a record.
     *
     * @return false if the write would exceed the memory ceiling; the store is then unchanged
     */
    public boolean insert(String key, String value) {
        long size = entrySize(key, value);
        lock.lock();
        try {
            String previous = store.remove(key);
            long base = usedMemory;
            if (previous != null) base -= entrySize(key, previous);

            if (maxMemory > 0 && base + size > maxMemory) {
                if (previous != null) store.put(key, previous);
                return false;
            }
            store.put(key, value);
            usedMemory = base + size;
            return true;
        } finally {
            lock.unlock();
        }
    }

    public String get(String key) {
        lock.lock();
        try {
            return store.get(key);
        } finally {
            lock.unlock();
        }
    }

    public long memoryUsage() {
        lock.lock();
        try {
            return usedMemory;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return store.size();
        } finally {
            lock.unlock();
        }
    }

    public long getMaxMemory() {
        return maxMemory;
    }

    public boolean isPersistenceEnabled() {
        return snapshots != null;
    }

    /** Epoch seconds of the last successful save or load, 0 if none. */
    public long getLastSaveTime() {
        return lastSaveTime;
    }

    /** Copy of every record, taken atomically. */
    public Map<String, String> snapshot() {
        lock.lock();
        try {
            return new TreeMap<>(store);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Writes every record to the snapshot file. Does nothing when persistence is disabled.
     */
    public void save() throws IOException {
        if (snapshots == null) return;
        lock.lock();
        try {
            snapshots.save(store);
            lastSaveTime = System.currentTimeMillis() / 1000;
        } finally {
            lock.unlock();
        }
        Log.info("Snapshot saved to " + snapshots.getFile() + ".");
    }

    /**
     * Replaces the records with the snapshot file's. Does nothing when persistence is disabled
     * or no snapshot exists. The usage total is recomputed from the loaded records.
     */
    public void load() throws IOException {
        if (snapshots == null) return;
        Map<String, String> loaded = snapshots.load();
        if (loaded == null) {
            Log.info("No snapshot at " + snapshots.getFile() + ", starting empty.");
            return;
        }

        long total = 0;
        lock.lock();
        try {
            store.clear();
            for (Map.Entry<String, String> e : loaded.entrySet()) {
                store.put(e.getKey(), e.getValue());
                total += entrySize(e.getKey(), e.getValue());
            }
            usedMemory = total;
            lastSaveTime = System.currentTimeMillis() / 1000;
        } finally {
            lock.unlock();
        }

        Log.info("Loaded " + loaded.size() + " keys (" + total + " bytes) from " + snapshots.getFile() + ".");
        if (maxMemory > 0 && total > maxMemory) {
            Log.warn("Snapshot uses " + total + " bytes, above maxmemory " + maxMemory + ". Writes will be refused.");
        }
    }

    /** Sum of entry sizes recomputed from the records, for checking the running total. */
    long recomputeUsage() {
        lock.lock();
        try {
            long total = 0;
            for (Map.Entry<String, String> e : store.entrySet()) {
                total += entrySize(e.getKey(), e.getValue());
            }
            return total;
        } finally {
            lock.unlock();
        }
    }

    static long utf8Length(String s) {
        return s.getBytes(StandardCharsets.UTF_8).length;
    }
}
