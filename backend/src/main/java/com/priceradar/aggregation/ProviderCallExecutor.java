package com.priceradar.aggregation;

import com.priceradar.common.ProviderException;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one provider call on a worker thread and waits at most the given timeout.
 * <p>
 * On timeout the future is cancelled with interruption, which aborts WebClient-based adapters. An adapter that
 * ignores interruption keeps its worker thread busy until it returns on its own; only the waiting stops.
 */
public class ProviderCallExecutor {

    private final ExecutorService executor;

    public ProviderCallExecutor(ExecutorService executor) {
        this.executor = executor;
    }

    public <T> T call(String providerName, Callable<T> task, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        return await(providerName, submit(providerName, task), deadline, timeout);
    }

    /**
     * Starts the call without waiting. Fails fast with {@link ProviderException} when no worker is free.
     */
    public <T> Future<T> submit(String providerName, Callable<T> task) {
        try {
            return executor.submit(task);
        } catch (RejectedExecutionException e) {
            throw new ProviderException(providerName, ProviderException.Kind.CALL_FAILED,
                    "No worker available for " + providerName, e);
        }
    }

    /**
     * Waits for a submitted call until {@code deadlineNanos} (a {@link System#nanoTime()} value) and cancels it
     * with interruption when the deadline passes first.
     *
     * @param timeout the configured timeout, reported in the timeout error
     */
    public <T> T await(String providerName, Future<T> future, long deadlineNanos, Duration timeout) {
        try {
            long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw ProviderException.timeout(providerName, timeout.toMillis());
        } catch (ExecutionException e) {
            throw translate(providerName, e.getCause());
        } catch (CancellationException e) {
            throw new ProviderException(providerName, ProviderException.Kind.INTERRUPTED,
                    "Call to " + providerName + " was cancelled", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProviderException(providerName, ProviderException.Kind.INTERRUPTED,
                    "Interrupted while waiting for " + providerName, e);
        }
    }

    private static ProviderException translate(String providerName, Throwable cause) {
        if (cause instanceof ProviderException pe) {
            return pe;
        }
        String message = cause == null || cause.getMessage() == null
                ? String.valueOf(cause)
                : cause.getMessage();
        return new ProviderException(providerName, ProviderException.Kind.CALL_FAILED, message, cause);
    }
}
