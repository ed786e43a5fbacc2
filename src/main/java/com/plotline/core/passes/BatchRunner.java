package com.plotline.core.passes;

import com.plotline.core.llm.AiKeyException;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Runs one batch of units of work concurrently on a shared executor and waits for all of
 * them to settle.
 * <p>
 * Results come back in submission order, one {@link Settled} per task, whether the task
 * succeeded or failed. A failed task never fails the batch, except an {@link AiKeyException},
 * which is re-thrown once the whole batch has been collected.
 */
public class BatchRunner {

    private final Executor executor;

    public BatchRunner(Executor executor) {
        this.executor = executor;
    }

    /**
     * Outcome of one task: either a value or the error it failed with.
     */
    public record Settled<T>(T value, Throwable error) {

        public static <T> Settled<T> ok(T value) {
            return new Settled<>(value, null);
        }

        public static <T> Settled<T> failed(Throwable error) {
            return new Settled<>(null, error);
        }

        public boolean isSuccess() {
            return error == null;
        }
    }

    public <T> List<Settled<T>> settleAll(List<Supplier<T>> tasks) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        var futures = new ArrayList<CompletableFuture<T>>(tasks.size());
        for (Supplier<T> task : tasks) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                if (mdc != null) {
                    MDC.setContextMap(mdc);
                }
                try {
                    return task.get();
                } finally {
                    if (mdc != null) {
                        MDC.clear();
                    }
                }
            }, executor));
        }

        var results = new ArrayList<Settled<T>>(futures.size());
        AiKeyException fatal = null;
        for (var future : futures) {
            try {
                results.add(Settled.ok(future.join()));
            } catch (CompletionException | CancellationException e) {
                Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                if (cause instanceof AiKeyException keyError && fatal == null) {
                    fatal = keyError;
                }
                results.add(Settled.failed(cause));
            }
        }
        if (fatal != null) {
            throw fatal;
        }
        return results;
    }
}
