package com.eainde.productresearch.thread;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executor that carries the submitting thread's MDC (e.g. {@code productKey}) into the worker thread.
 */
public class MdcAwareExecutor implements Executor {

    private final ExecutorService delegate;

    public MdcAwareExecutor(ExecutorService delegate) {
        this.delegate = delegate;
    }

    public static MdcAwareExecutor fixed(String namePrefix, int threads) {
        return new MdcAwareExecutor(Executors.newFixedThreadPool(threads, daemonThreads(namePrefix)));
    }

    public static MdcAwareExecutor cached(String namePrefix) {
        return new MdcAwareExecutor(Executors.newCachedThreadPool(daemonThreads(namePrefix)));
    }

    @Override
    public void execute(Runnable command) {
        // Capture MDC context from the calling (parent) thread
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();

        delegate.execute(() -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            } else {
                MDC.clear();
            }
            try {
                command.run();
            } finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        });
    }

    public void shutdown() {
        delegate.shutdownNow();
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
