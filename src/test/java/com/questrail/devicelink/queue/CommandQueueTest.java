package com.questrail.devicelink.queue;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CommandQueueTest {

    @Test
    void itemsLeaveInAcceptanceOrder() throws Exception {
        CommandQueue<String> queue = new CommandQueue<>(3, OverflowPolicy.REJECT_NEW, Duration.ZERO);
        queue.enqueue("a");
        queue.enqueue("b");
        queue.enqueue("c");

        assertEquals(Optional.of("a"), queue.poll());
        assertEquals(Optional.of("b"), queue.dequeue(Duration.ofMillis(10)));
        assertEquals(Optional.of("c"), queue.poll());
        assertEquals(Optional.empty(), queue.poll());
    }

    @Test
    void rejectNewRefusesWhenFull() throws Exception {
        CommandQueue<String> queue = new CommandQueue<>(2, OverflowPolicy.REJECT_NEW, Duration.ZERO);
        assertTrue(queue.enqueue("a").isAccepted());
        assertTrue(queue.enqueue("b").isAccepted());

        EnqueueResult<String> result = queue.enqueue("c");

        assertEquals(EnqueueResult.Status.REJECTED_FULL, result.status());
        assertEquals(Optional.empty(), result.evictedItem());
        assertEquals(2, queue.size());
        assertEquals(Optional.of("a"), queue.poll());
    }

    @Test
    void dropOldestEvictsHeadAndReturnsIt() throws Exception {
        CommandQueue<String> queue = new CommandQueue<>(2, OverflowPolicy.DROP_OLDEST, Duration.ZERO);
        queue.enqueue("a");
        queue.enqueue("b");

        EnqueueResult<String> result = queue.enqueue("c");

        assertTrue(result.isAccepted());
        assertEquals(Optional.of("a"), result.evictedItem());
        assertEquals(2, queue.size());
        assertEquals(Optional.of("b"), queue.poll());
        assertEquals(Optional.of("c"), queue.poll());
    }

    @Test
    void blockWithTimeoutGivesUpAfterTimeout() throws Exception {
        CommandQueue<String> queue = new CommandQueue<>(1, OverflowPolicy.BLOCK_WITH_TIMEOUT, Duration.ofMillis(50));
        queue.enqueue("a");

        long start = System.nanoTime();
        EnqueueResult<String> result = queue.enqueue("b");
        long waitedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(EnqueueResult.Status.TIMED_OUT, result.status());
        assertTrue(waitedMillis >= 40, "waited " + waitedMillis + "ms");
        assertEquals(1, queue.size());
    }

    @Test
    void blockWithTimeoutAdmitsOnceSpaceFrees() throws Exception {
        CommandQueue<String> queue = new CommandQueue<>(1, OverflowPolicy.BLOCK_WITH_TIMEOUT, Duration.ofSeconds(5));
        queue.enqueue("a");

        CountDownLatch started = new CountDownLatch(1);
        CompletableFuture<EnqueueResult<String>> blocked = CompletableFuture.supplyAsync(() -> {
            started.countDown();
            try {
                return queue.enqueue("b");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        });
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertEquals(Optional.of("a"), queue.dequeue(Duration.ofSeconds(1)));

        assertTrue(blocked.get(5, TimeUnit.SECONDS).isAccepted());
        assertEquals(Optional.of("b"), queue.poll());
    }

    @Test
    void removeTakesOutAQueuedItemAndFreesSpace() throws Exception {
        CommandQueue<String> queue = new CommandQueue<>(2, OverflowPolicy.REJECT_NEW, Duration.ZERO);
        queue.enqueue("a");
        queue.enqueue("b");

        assertTrue(queue.remove("a"));
        assertFalse(queue.remove("a"));
        assertTrue(queue.enqueue("c").isAccepted());
        assertEquals(Optional.of("b"), queue.poll());
        assertEquals(Optional.of("c"), queue.poll());
    }

    @Test
    void dequeueTimesOutWhenEmpty() throws Exception {
        CommandQueue<String> queue = new CommandQueue<>(1, OverflowPolicy.REJECT_NEW, Duration.ZERO);

        assertEquals(Optional.empty(), queue.dequeue(Duration.ofMillis(20)));
    }

    @Test
    void rejectsInvalidConstruction() {
        assertThrows(IllegalArgumentException.class,
                () -> new CommandQueue<String>(0, OverflowPolicy.REJECT_NEW, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> new CommandQueue<String>(1, OverflowPolicy.BLOCK_WITH_TIMEOUT, Duration.ZERO));
    }

    @Test
    void concurrentProducersLoseNothingAndKeepTheirOwnOrder() throws Exception {
        int producers = 4;
        int perProducer = 500;
        CommandQueue<String> queue = new CommandQueue<>(8, OverflowPolicy.BLOCK_WITH_TIMEOUT, Duration.ofSeconds(5));
        ExecutorService pool = Executors.newFixedThreadPool(producers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Integer>> accepted = new ArrayList<>();
            for (int p = 0; p < producers; p++) {
                int producer = p;
                accepted.add(pool.submit(() -> {
                    start.await();
                    int count = 0;
                    for (int i = 0; i < perProducer; i++) {
                        if (queue.enqueue(producer + ":" + i).isAccepted()) {
                            count++;
                        }
                    }
                    return count;
                }));
            }
            start.countDown();

            Map<Integer, Integer> lastSeen = new HashMap<>();
            Set<String> taken = new HashSet<>();
            while (taken.size() < producers * perProducer) {
                String item = queue.dequeue(Duration.ofSeconds(5)).orElseThrow();
                assertTrue(taken.add(item), "duplicate " + item);
                String[] parts = item.split(":");
                int producer = Integer.parseInt(parts[0]);
                int sequence = Integer.parseInt(parts[1]);
                assertTrue(sequence > lastSeen.getOrDefault(producer, -1), "out of order " + item);
                lastSeen.put(producer, sequence);
                assertTrue(queue.size() <= queue.capacity());
            }

            for (Future<Integer> future : accepted) {
                assertEquals(perProducer, future.get(10, TimeUnit.SECONDS));
            }
            assertEquals(0, queue.size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void concurrentDropOldestAccountsForEveryItem() throws Exception {
        int producers = 4;
        int perProducer = 1000;
        CommandQueue<Integer> queue = new CommandQueue<>(4, OverflowPolicy.DROP_OLDEST, Duration.ZERO);
        AtomicInteger evicted = new AtomicInteger();
        AtomicInteger consumed = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(producers + 1);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch producersDone = new CountDownLatch(producers);
        try {
            for (int p = 0; p < producers; p++) {
                int base = p * perProducer;
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perProducer; i++) {
                        queue.enqueue(base + i).evictedItem().ifPresent(item -> evicted.incrementAndGet());
                    }
                    producersDone.countDown();
                    return null;
                });
            }
            Future<?> consumer = pool.submit(() -> {
                start.await();
                while (producersDone.getCount() > 0 || queue.size() > 0) {
                    if (queue.dequeue(Duration.ofMillis(5)).isPresent()) {
                        consumed.incrementAndGet();
                    }
                }
                return null;
            });
            start.countDown();

            assertTrue(producersDone.await(10, TimeUnit.SECONDS));
            consumer.get(10, TimeUnit.SECONDS);

            assertEquals(producers * perProducer, consumed.get() + evicted.get());
            assertEquals(0, queue.size());
        } finally {
            pool.shutdownNow();
        }
    }
}
