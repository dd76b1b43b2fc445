package com.tripsync.server.storage;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 写队列：同一路径严格按提交顺序执行，不同路径互不阻塞，失败不影响后续任务。
 */
class TripWriteQueueTest {

    @TempDir
    Path dir;

    private ExecutorService executor;
    private TripWriteQueue queue;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        queue = new TripWriteQueue(executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void submit_shouldRunTasksForSamePathInSubmissionOrder() {
        Path file = dir.resolve("trip-a.json");
        List<Integer> executed = Collections.synchronizedList(new ArrayList<>());
        List<CompletableFuture<Void>> futures = new ArrayList<>();

        for (int i = 0; i < 50; i++) {
            int n = i;
            futures.add(queue.submit(file, () -> {
                if (n % 7 == 0) {
                    sleep(5);
                }
                executed.add(n);
            }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        assertEquals(IntStream.range(0, 50).boxed().collect(Collectors.toList()), executed);
        assertEquals(0, queue.pendingPaths());
    }

    @Test
    void submit_shouldNotBlockOtherPaths() throws Exception {
        CountDownLatch otherPathRan = new CountDownLatch(1);
        CompletableFuture<Void> waiting = queue.submit(dir.resolve("trip-a.json"), () -> {
            try {
                if (!otherPathRan.await(5, TimeUnit.SECONDS)) {
                    throw new IOException("other path never ran");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException(e);
            }
        });
        queue.submit(dir.resolve("trip-b.json"), otherPathRan::countDown).get(5, TimeUnit.SECONDS);

        waiting.get(5, TimeUnit.SECONDS);
    }

    @Test
    void submit_shouldContinueChain_whenEarlierTaskFails() {
        Path file = dir.resolve("trip-a.json");
        List<String> executed = Collections.synchronizedList(new ArrayList<>());

        CompletableFuture<Void> failed = queue.submit(file, () -> {
            throw new IOException("disk full");
        });
        CompletableFuture<Void> next = queue.submit(file, () -> executed.add("second"));

        CompletionException e = assertThrows(CompletionException.class, failed::join);
        assertInstanceOf(IOException.class, e.getCause());
        next.join();
        assertEquals(List.of("second"), executed);
        assertTrue(next.isDone());
        assertEquals(0, queue.pendingPaths());
    }

    @Test
    void submit_shouldCarryCallerMdcToWriterThread_andRestoreItAfterwards() {
        ExecutorService single = Executors.newSingleThreadExecutor();
        try {
            TripWriteQueue singleQueue = new TripWriteQueue(single);
            Path file = dir.resolve("trip-a.json");
            List<String> seen = Collections.synchronizedList(new ArrayList<>());

            try (TripMdcScope ignored = TripMdcScope.open("trip-a")) {
                singleQueue.submit(file, () -> seen.add(MDC.get("tripId"))).join();
            }
            singleQueue.submit(file, () -> seen.add(String.valueOf(MDC.get("tripId")))).join();

            assertEquals(List.of("trip-a", "null"), seen);
            assertNull(MDC.get("tripId"));
        } finally {
            single.shutdownNow();
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
