package com.iudex.cograg.util;

import com.iudex.cograg.context.RequestBudget;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Runs one task per input on an executor with at most {@code maxParallel} in flight, bounded by
 * the request deadline. Outcomes come back in input order; completion order does not matter.
 *
 * <p>Permits are taken on the calling thread before submission, so a wide fan-out queues on the
 * caller instead of flooding the pool. When the deadline passes, unsubmitted inputs are skipped
 * and in-flight futures are cancelled.</p>
 */
public final class BoundedFanOut {

    private BoundedFanOut() {
    }

    public static <T, R> List<Outcome<R>> run(List<T> inputs, Function<T, R> task, int maxParallel,
                                              ExecutorService executor, RequestBudget budget) {
        Semaphore permits = new Semaphore(Math.max(1, maxParallel));
        List<CompletableFuture<R>> futures = new ArrayList<>(inputs.size());
        boolean expired = false;
        for (T input : inputs) {
            if (expired || budget.isExpired()) {
                expired = true;
                futures.add(null);
                continue;
            }
            try {
                if (!permits.tryAcquire(budget.remainingMillis(), TimeUnit.MILLISECONDS)) {
                    expired = true;
                    futures.add(null);
                    continue;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                expired = true;
                futures.add(null);
                continue;
            }
            try {
                futures.add(CompletableFuture.supplyAsync(() -> task.apply(input), executor)
                        .whenComplete((value, error) -> permits.release()));
            } catch (RejectedExecutionException e) {
                permits.release();
                futures.add(CompletableFuture.failedFuture(e));
            }
        }
        List<Outcome<R>> outcomes = new ArrayList<>(futures.size());
        for (CompletableFuture<R> future : futures) {
            if (future == null) {
                outcomes.add(Outcome.deadlineCut());
                continue;
            }
            long remaining = budget.remainingMillis();
            if (remaining <= 0L && !future.isDone()) {
                future.cancel(true);
                outcomes.add(Outcome.deadlineCut());
                continue;
            }
            try {
                outcomes.add(Outcome.success(future.get(Math.max(1L, remaining), TimeUnit.MILLISECONDS)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                outcomes.add(Outcome.deadlineCut());
            } catch (TimeoutException e) {
                future.cancel(true);
                outcomes.add(Outcome.deadlineCut());
            } catch (ExecutionException e) {
                outcomes.add(Outcome.failure(e.getCause() != null ? e.getCause() : e));
            }
        }
        return outcomes;
    }

    /**
     * Result of one branch: a value, an error, or a deadline cut.
     */
    public record Outcome<R>(R value, Throwable error, boolean timedOut) {

        static <R> Outcome<R> success(R value) {
            return new Outcome<>(value, null, false);
        }

        static <R> Outcome<R> failure(Throwable error) {
            return new Outcome<>(null, error, false);
        }

        static <R> Outcome<R> deadlineCut() {
            return new Outcome<>(null, null, true);
        }

        public boolean isSuccess() {
            return !this.timedOut && this.error == null;
        }
    }
}
