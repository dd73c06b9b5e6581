package respite.db;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class RespiteDatabaseConcurrencyTest {

    @Test
    public void testConcurrentInsertsRespectCeiling() throws Exception {
        long ceiling = 1000;
        RespiteDatabase db = new RespiteDatabase(ceiling, null);

        int threadCount = 8;
        ExecutorService es = Executors.newFixedThreadPool(threadCount);
        CountDownLatch latch = new CountDownLatch(1);
        AtomicInteger accepted = new AtomicInteger();

        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threadCount; t++) {
            final int id = t;
            futures.add(es.submit(() -> {
                latch.await(); // Sync start
                for (int i = 0; i < 200; i++) {
                    // 10 bytes per entry
                    if (db.insert(String.format("t%d-%04d", id, i), "abc")) {
                        accepted.incrementAndGet();
                    }
                }
                return null;
            }));
        }

        latch.countDown(); // Go!
        for (Future<?> f : futures) f.get(10, TimeUnit.SECONDS);
        es.shutdown();

        assertEquals(100, accepted.get());
        assertTrue(db.memoryUsage() <= ceiling);
        assertEquals(db.recomputeUsage(), db.memoryUsage());
        assertEquals(db.size() * 10L, db.memoryUsage());
    }

    @Test
    public void testConcurrentOverwritesOfOneKey() throws Exception {
        RespiteDatabase db = new RespiteDatabase(0, null);
        ExecutorService es = Executors.newFixedThreadPool(4);
        CountDownLatch latch = new CountDownLatch(1);

        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            final String value = "x".repeat(t + 1);
            futures.add(es.submit(() -> {
                latch.await();
                for (int i = 0; i < 500; i++) db.insert("shared", value);
                return null;
            }));
        }
        latch.countDown();
        for (Future<?> f : futures) f.get(10, TimeUnit.SECONDS);
        es.shutdown();

        assertEquals(1, db.size());
        assertEquals(RespiteDatabase.entrySize("shared", db.get("shared")), db.memoryUsage());
    }
}
