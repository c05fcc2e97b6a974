package com.eainde.policyaudit.thread;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executor that carries the caller's MDC (run id and friends) into worker threads.
 *
 * <p>Tasks never queue: {@code coreThreads} workers are kept alive and the pool grows
 * whenever all of them are busy. A worker stuck in a call that ignores interrupts therefore
 * cannot delay later tasks; callers bound their own concurrency.</p>
 *
 * <p>{@link #submit(Callable)} returns the pool's own {@link Future}, so
 * {@code cancel(true)} interrupts a task that overran its deadline.</p>
 */
public class MdcAwareExecutor implements Executor, AutoCloseable {

    private final ExecutorService delegate;

    private static final long IDLE_KEEP_ALIVE_SECONDS = 60L;

    public MdcAwareExecutor(int coreThreads, String namePrefix) {
        if (coreThreads < 1) {
            throw new IllegalArgumentException("coreThreads must be >= 1");
        }
        this.delegate = new ThreadPoolExecutor(coreThreads, Integer.MAX_VALUE,
                IDLE_KEEP_ALIVE_SECONDS, TimeUnit.SECONDS, new SynchronousQueue<>(), daemonThreads(namePrefix));
    }

    @Override
    public void execute(Runnable command) {
        delegate.execute(wrap(command));
    }

    public <T> Future<T> submit(Callable<T> task) {
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();
        return delegate.submit(() -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                return task.call();
            } finally {
                MDC.clear();
            }
        });
    }

    @Override
    public void close() {
        delegate.shutdownNow();
        try {
            delegate.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isShutdown() {
        return delegate.isShutdown();
    }

    private static Runnable wrap(Runnable command) {
        // captured on the calling thread
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();
        return () -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                command.run();
            } finally {
                MDC.clear();
            }
        };
    }

    private static ThreadFactory daemonThreads(String namePrefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, namePrefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
