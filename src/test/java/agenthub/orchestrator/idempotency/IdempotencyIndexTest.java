package agenthub.orchestrator.idempotency;

import agenthub.orchestrator.model.Task;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class IdempotencyIndexTest {

    @Test
    void secondReservationReturnsExistingTask() {
        IdempotencyIndex index = new IdempotencyIndex(Duration.ofHours(1));

        IdempotencyIndex.Reservation first = index.reserve("echo", "key-1", () -> "task-1");
        IdempotencyIndex.Reservation second = index.reserve("echo", "key-1", () -> "task-2");

        assertTrue(first.isNew());
        assertFalse(second.isNew());
        assertEquals("task-1", second.taskId());
        assertEquals(1, index.size());
    }

    @Test
    void keysAreScopedByAgentType() {
        IdempotencyIndex index = new IdempotencyIndex(Duration.ofHours(1));

        index.reserve("echo", "same-key", () -> "task-echo");
        IdempotencyIndex.Reservation other = index.reserve("summarize", "same-key", () -> "task-sum");

        assertTrue(other.isNew());
        assertEquals("task-sum", other.taskId());
    }

    @Test
    void failedCreatorStoresNothing() {
        IdempotencyIndex index = new IdempotencyIndex(Duration.ofHours(1));

        assertThrows(IllegalStateException.class, () -> index.reserve("echo", "k", () -> {
            throw new IllegalStateException("store down");
        }));

        assertTrue(index.lookup("echo", "k").isEmpty());
        assertTrue(index.reserve("echo", "k", () -> "task-ok").isNew());
    }

    @Test
    void expiredEntriesAreReplacedAndPurged() throws Exception {
        IdempotencyIndex index = new IdempotencyIndex(Duration.ofMillis(20));
        index.reserve("echo", "k", () -> "old");

        Thread.sleep(40);

        assertTrue(index.lookup("echo", "k").isEmpty());
        IdempotencyIndex.Reservation again = index.reserve("echo", "k", () -> "new");
        assertTrue(again.isNew());
        assertEquals("new", again.taskId());

        index.reserve("echo", "other", () -> "other-task");
        Thread.sleep(40);
        assertEquals(2, index.purgeExpired());
        assertEquals(0, index.size());
    }

    @Test
    void invalidateRemovesTheTasksKey() {
        IdempotencyIndex index = new IdempotencyIndex(Duration.ofHours(1));
        index.reserve("echo", "k", () -> "task-1");

        assertTrue(index.invalidate("task-1"));
        assertFalse(index.invalidate("task-1"));
        assertTrue(index.lookup("echo", "k").isEmpty());
    }

    @Test
    void concurrentReservationsCreateOneTask() throws Exception {
        IdempotencyIndex index = new IdempotencyIndex(Duration.ofHours(1));
        AtomicInteger created = new AtomicInteger();
        Set<String> ids = ConcurrentHashMap.newKeySet();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);

        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                ids.add(index.reserve("echo", "race", () -> "task-" + created.incrementAndGet()).taskId());
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(5, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertEquals(1, created.get());
        assertEquals(Set.of("task-1"), ids);
    }

    @Test
    void restoreSkipsExpiredAndUnkeyedTasks() {
        IdempotencyIndex index = new IdempotencyIndex(Duration.ofHours(24));
        Task fresh = Task.builder().id("fresh").agentType("echo").idempotencyKey("k1")
                .createdAt(Instant.now().minus(Duration.ofHours(1))).build();
        Task stale = Task.builder().id("stale").agentType("echo").idempotencyKey("k2")
                .createdAt(Instant.now().minus(Duration.ofHours(30))).build();
        Task unkeyed = Task.builder().id("unkeyed").agentType("echo").createdAt(Instant.now()).build();

        assertEquals(1, index.restore(List.of(fresh, stale, unkeyed)));
        assertEquals("fresh", index.lookup("echo", "k1").orElseThrow());
        assertTrue(index.lookup("echo", "k2").isEmpty());
    }

    @Test
    void rejectsNonPositiveTtl() {
        assertThrows(IllegalArgumentException.class, () -> new IdempotencyIndex(Duration.ZERO));
    }
}
