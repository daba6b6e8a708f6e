package com.enterprise.orchestration.queue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.atomic.AtomicBoolean;

class TaskQueueTest {

    private TaskQueue queue;

    @BeforeEach
    void setUp() {
        queue = new TaskQueue();
    }

    @Test
    void testLowestPriorityNumberFirst() {
        queue.enqueue("low", 5);
        queue.enqueue("high", 1);
        queue.enqueue("mid", 3);

        assertEquals("high", queue.poll().orElseThrow().getTaskId());
        assertEquals("mid", queue.poll().orElseThrow().getTaskId());
        assertEquals("low", queue.poll().orElseThrow().getTaskId());
        assertTrue(queue.poll().isEmpty());
    }

    @Test
    void testFifoWithinPriority() {
        queue.enqueue("a", 2);
        queue.enqueue("b", 2);
        queue.enqueue("c", 2);

        assertEquals("a", queue.poll().orElseThrow().getTaskId());
        assertEquals("b", queue.poll().orElseThrow().getTaskId());
        assertEquals("c", queue.poll().orElseThrow().getTaskId());
    }

    @Test
    void testRequeueKeepsOriginalPosition() {
        queue.enqueue("first", 2);
        queue.enqueue("second", 2);

        TaskQueue.QueueEntry entry = queue.poll().orElseThrow();
        queue.requeue(entry);

        assertEquals("first", queue.poll().orElseThrow().getTaskId());
        assertEquals(2, entry.getPriority());
    }

    @Test
    void testParkAndUnpark() {
        queue.enqueue("dependent", 1);
        TaskQueue.QueueEntry entry = queue.poll().orElseThrow();

        assertTrue(queue.parkIfNotReady(entry, () -> false));
        assertTrue(queue.isParked("dependent"));
        assertEquals(0, queue.size());
        assertEquals(1, queue.parkedCount());

        assertTrue(queue.unpark("dependent"));
        assertFalse(queue.isParked("dependent"));
        assertEquals("dependent", queue.poll().orElseThrow().getTaskId());
        assertFalse(queue.unpark("dependent"));
    }

    @Test
    void testReadyEntryIsNotParked() {
        queue.enqueue("ready", 1);
        TaskQueue.QueueEntry entry = queue.poll().orElseThrow();

        assertFalse(queue.parkIfNotReady(entry, () -> true));
        assertEquals(0, queue.parkedCount());
    }

    @Test
    void testReadinessIsCheckedUnderQueueLock() throws Exception {
        queue.enqueue("t", 1);
        TaskQueue.QueueEntry entry = queue.poll().orElseThrow();
        AtomicBoolean ready = new AtomicBoolean(false);

        // The unpark blocks until the park has finished, so the entry is never lost
        Thread resolver = new Thread(() -> {
            ready.set(true);
            queue.unpark("t");
        });
        boolean parked = queue.parkIfNotReady(entry, () -> {
            if (!ready.get()) {
                resolver.start();
                try {
                    Thread.sleep(50);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return ready.get();
        });
        resolver.join(2000);

        if (parked) {
            assertFalse(queue.isParked("t"));
            assertEquals(1, queue.size());
        } else {
            assertEquals(0, queue.parkedCount());
        }
    }
}
