package com.largomodo.monitorlayout.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * The compositor thread: one dedicated worker draining an unbounded FIFO queue.
 * <p>
 * Everything that touches heads or outputs runs here. Other threads only hand
 * work over through {@link #execute} and never wait for it, except tests and
 * the command line, which use {@link #submit} to read results back.
 */
public class DisplayLoop implements Executor, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DisplayLoop.class);

    private final ThreadPoolExecutor executor;
    private volatile Thread loopThread;

    public DisplayLoop(String threadName) {
        this.executor = new ThreadPoolExecutor(
                1,                          // Single worker: tasks never run concurrently
                1,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), // Unbounded: submitters never block
                runnable -> {
                    Thread thread = new Thread(runnable, threadName);
                    thread.setDaemon(true);
                    loopThread = thread;
                    return thread;
                });
    }

    /**
     * Queues a task behind everything submitted before it and returns at once.
     *
     * @throws java.util.concurrent.RejectedExecutionException if the loop has been closed
     */
    @Override
    public void execute(Runnable task) {
        executor.execute(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                // Keep the worker alive for the tasks queued behind this one
                log.error("Display loop task failed", e);
            }
        });
    }

    public <T> Future<T> submit(Callable<T> task) {
        return executor.submit(task);
    }

    public boolean isLoopThread() {
        return Thread.currentThread() == loopThread;
    }

    /**
     * @throws IllegalStateException if called from any thread other than the loop's
     */
    public void assertLoopThread() {
        if (!isLoopThread()) {
            throw new IllegalStateException("Must run on the display loop, called from "
                    + Thread.currentThread().getName());
        }
    }

    /**
     * Runs the tasks already queued, then stops the worker.
     */
    @Override
    public void close() {
        // Standard two-phase shutdown: graceful then forceful
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Display loop did not drain in time, interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
