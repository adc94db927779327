package com.eainde.productresearch.thread;

import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs a blocking call on an executor and waits at most the given duration for it.
 * A timeout fails only this call and interrupts the worker running it.
 */
public final class TimedCalls {

    private TimedCalls() {
    }

    public static <T> T call(Supplier<T> task, Duration timeout, Executor executor) throws TimeoutException {
        FutureTask<T> future = new FutureTask<>(task::get);
        executor.execute(future);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TimeoutException("Call timed out after " + describe(timeout));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CompletionException("Interrupted while waiting for call", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new CompletionException(cause);
        }
    }

    /** {@code 200ms} below one second, {@code 45s} otherwise. */
    public static String describe(Duration timeout) {
        return timeout.compareTo(Duration.ofSeconds(1)) < 0
                ? timeout.toMillis() + "ms"
                : timeout.toSeconds() + "s";
    }
}
