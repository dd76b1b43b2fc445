package com.tripsync.server.storage;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * 按文件路径串行化的写队列。
 * <p>
 * 同一路径的写操作排在上一个之后执行（不管上一个成功还是失败），不同路径之间完全并行。
 * 某条链上的任务全部完成后，对应条目从表里移除。
 * 提交方线程的 MDC（tripId）随任务带到写线程，任务结束后还原。
 * </p>
 */
@Slf4j
public class TripWriteQueue {

    private final ConcurrentHashMap<Path, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();
    private final Executor executor;

    public TripWriteQueue(Executor executor) {
        this.executor = executor;
    }

    @FunctionalInterface
    public interface WriteTask {
        void run() throws IOException;
    }

    /**
     * 提交一个写任务。失败时返回的 future 以 CompletionException 结束，cause 为原始异常。
     * 返回的 future 完成时，已排空的路径条目已经移除。
     */
    public CompletableFuture<Void> submit(Path path, WriteTask task) {
        Path key = path.toAbsolutePath().normalize();
        Map<String, String> callerMdc = MDC.getCopyOfContextMap();
        @SuppressWarnings("unchecked")
        CompletableFuture<Void>[] holder = new CompletableFuture[1];
        tails.compute(key, (k, previous) -> {
            CompletableFuture<Void> start = previous == null
                    ? CompletableFuture.completedFuture(null)
                    : previous.<Void>handle((r, e) -> null);
            CompletableFuture<Void> next = start.thenRunAsync(() -> execute(key, task, callerMdc), executor);
            holder[0] = next;
            return next;
        });
        CompletableFuture<Void> next = holder[0];
        return next.whenComplete((r, e) -> tails.remove(key, next));
    }

    /**
     * 当前仍有未完成写入的文件数。
     */
    public int pendingPaths() {
        return tails.size();
    }

    private static void execute(Path path, WriteTask task, Map<String, String> callerMdc) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (callerMdc == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(callerMdc);
        }
        try {
            task.run();
        } catch (IOException e) {
            log.error("写文件失败, path={}", path, e);
            throw new CompletionException(e);
        } finally {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}
