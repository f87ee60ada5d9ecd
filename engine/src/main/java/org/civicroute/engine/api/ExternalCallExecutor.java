package org.civicroute.engine.api;

import org.civicroute.engine.exception.RoutingException;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.logging.Logger;

/**
 * Runs calls to external collaborators on a bounded pool with a hard timeout.
 * Timeouts and failures are converted into the caller's exception type;
 * RoutingExceptions raised by the call itself pass through unchanged.
 */
public final class ExternalCallExecutor implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(ExternalCallExecutor.class.getName());

    private final ExecutorService executor;
    private final Duration timeout;

    public ExternalCallExecutor(int threads, Duration timeout) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1");
        }
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "external-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Start a call without waiting for it. Pair with {@link #await}.
     */
    public <T> Future<T> submit(Callable<T> call) {
        return executor.submit(call);
    }

    /**
     * Run a call and wait for it within the configured timeout.
     */
    public <T> T call(String description, Callable<T> call,
                      BiFunction<String, Throwable, ? extends RuntimeException> failure) {
        return await(description, submit(call), failure);
    }

    /**
     * Wait for a submitted call within the configured timeout.
     */
    public <T> T await(String description, Future<T> future,
                       BiFunction<String, Throwable, ? extends RuntimeException> failure) {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warning(() -> String.format("%s timed out after %dms", description, timeout.toMillis()));
            throw failure.apply(description + " timed out after " + timeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RoutingException) {
                throw (RoutingException) cause;
            }
            throw failure.apply(description + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw failure.apply(description + " interrupted", e);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
