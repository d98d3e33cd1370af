package agenthub.orchestrator.scheduler;

import agenthub.orchestrator.error.QueueFullException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ReadyQueueTest {

    @Test
    void highestPriorityFirstThenFifo() throws Exception {
        ReadyQueue queue = new ReadyQueue(10);
        queue.offer("low", 1);
        queue.offer("high-a", 9);
        queue.offer("mid", 5);
        queue.offer("high-b", 9);

        List<String> order = new ArrayList<>();
        while (queue.size() > 0) {
            order.add(queue.take());
        }

        assertEquals(List.of("high-a", "high-b", "mid", "low"), order);
    }

    @Test
    void duplicateOfferIsIgnored() {
        ReadyQueue queue = new ReadyQueue(10);
        assertTrue(queue.offer("t1", 0));
        assertFalse(queue.offer("t1", 5));
        assertEquals(1, queue.size());
    }

    @Test
    void fullQueueRejects() {
        ReadyQueue queue = new ReadyQueue(2);
        queue.offer("a", 0);
        queue.offer("b", 0);

        assertEquals(0, queue.remainingCapacity());
        QueueFullException e = assertThrows(QueueFullException.class, () -> queue.offer("c", 0));
        assertEquals("QUEUE_FULL", e.code());
    }

    @Test
    void removeTakesTaskOutOfLine() throws Exception {
        ReadyQueue queue = new ReadyQueue(10);
        queue.offer("a", 5);
        queue.offer("b", 1);

        assertTrue(queue.remove("a"));
        assertFalse(queue.remove("a"));
        assertFalse(queue.contains("a"));
        assertEquals("b", queue.poll(1, TimeUnit.SECONDS));
    }

    @Test
    void pollTimesOutWhenEmpty() throws Exception {
        ReadyQueue queue = new ReadyQueue(1);
        assertNull(queue.poll(20, TimeUnit.MILLISECONDS));
    }

    @Test
    void takeWakesUpOnOffer() throws Exception {
        ReadyQueue queue = new ReadyQueue(1);
        CompletableFuture<String> taken = CompletableFuture.supplyAsync(() -> {
            try {
                return queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        });

        Thread.sleep(50);
        assertFalse(taken.isDone());
        queue.offer("late", 0);

        assertEquals("late", taken.get(2, TimeUnit.SECONDS));
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new ReadyQueue(0));
    }
}
