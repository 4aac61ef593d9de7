package com.marketplace.shared.effects;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs tasks submitted under the same key one after another, in submission order, on a shared pool.
 * Tasks under different keys run in parallel. A lane is removed once it drains.
 *
 * When the pool refuses a task it runs on the thread that hands it over instead, so a saturated
 * pool slows submitters down rather than losing effects.
 */
@Slf4j
public class KeyedSerialExecutor {

    private final Executor delegate;
    private final ConcurrentHashMap<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    public KeyedSerialExecutor(Executor delegate) {
        this.delegate = delegate;
    }

    public void execute(String key, Runnable task) {
        // lane tails only ever complete normally
        CompletableFuture<Void> done = new CompletableFuture<>();
        CompletableFuture<Void> previous = tails.put(key, done);
        CompletableFuture<Void> start = previous != null ? previous : CompletableFuture.completedFuture(null);
        start.whenComplete((ignored, ex) -> submit(key, task, done));
        done.whenComplete((ignored, ex) -> tails.remove(key, done));
    }

    /** Lanes with queued or running work. */
    public int pendingLanes() {
        return tails.size();
    }

    private void submit(String key, Runnable task, CompletableFuture<Void> done) {
        Runnable step = () -> {
            try {
                runGuarded(key, task);
            } finally {
                done.complete(null);
            }
        };
        try {
            delegate.execute(step);
        } catch (RejectedExecutionException e) {
            log.warn("Effect pool saturated, running task on submitting thread: key={}, error={}",
                    key, e.getMessage());
            step.run();
        }
    }

    private static void runGuarded(String key, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            // a failed task must not poison the lane for later submissions
            log.error("Serial task failed: key={}", key, e);
        }
    }
}
