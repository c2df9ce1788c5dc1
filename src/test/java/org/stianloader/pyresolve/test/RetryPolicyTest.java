package org.stianloader.pyresolve.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import org.junit.jupiter.api.Test;
import org.stianloader.pyresolve.repo.IndexUnavailableException;
import org.stianloader.pyresolve.repo.ProjectNotFoundException;
import org.stianloader.pyresolve.repo.RetryPolicy;

public class RetryPolicyTest {

    private static final RetryPolicy FAST = new RetryPolicy(3, 1L, 2.0D, 5L, RetryPolicy.DEFAULT_RETRYABLE);

    private static <T> Supplier<CompletableFuture<T>> failing(AtomicInteger attempts, int failures, Throwable failure, T value) {
        return () -> {
            CompletableFuture<T> future = new CompletableFuture<>();
            if (attempts.incrementAndGet() <= failures) {
                future.completeExceptionally(failure);
            } else {
                future.complete(value);
            }
            return future;
        };
    }

    @Test
    public void testDelays() {
        RetryPolicy policy = new RetryPolicy(6, 500L, 2.0D, 3_000L, RetryPolicy.DEFAULT_RETRYABLE);
        assertEquals(0L, policy.getDelayMillis(1));
        assertEquals(500L, policy.getDelayMillis(2));
        assertEquals(1_000L, policy.getDelayMillis(3));
        assertEquals(2_000L, policy.getDelayMillis(4));
        assertEquals(3_000L, policy.getDelayMillis(5));
        assertEquals(3_000L, policy.getDelayMillis(6));
        assertEquals(1, RetryPolicy.NONE.getMaxAttempts());
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, 1L, 2.0D, 5L, RetryPolicy.DEFAULT_RETRYABLE));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(2, 1L, 0.5D, 5L, RetryPolicy.DEFAULT_RETRYABLE));
    }

    @Test
    public void testRetryable() {
        assertTrue(RetryPolicy.DEFAULT.isRetryable(new IOException("HTTP 503")));
        assertTrue(RetryPolicy.DEFAULT.isRetryable(new SocketTimeoutException()));
        assertTrue(RetryPolicy.DEFAULT.isRetryable(new ExecutionException(new IOException("reset"))));
        assertFalse(RetryPolicy.DEFAULT.isRetryable(new FileNotFoundException("HTTP 404")));
        assertFalse(RetryPolicy.DEFAULT.isRetryable(new ProjectNotFoundException("pkg-a", "pypi")));
    }

    @Test
    public void testRecoversFromTransientFailures() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        String value = FAST.execute(failing(attempts, 2, new IOException("HTTP 502"), "page"), "pypi", "pkg-a", Runnable::run)
                .get(10, TimeUnit.SECONDS);
        assertEquals("page", value);
        assertEquals(3, attempts.get());
    }

    @Test
    public void testExhaustion() {
        AtomicInteger attempts = new AtomicInteger();
        CompletableFuture<String> future = FAST.execute(failing(attempts, Integer.MAX_VALUE, new IOException("connection refused"), "page"), "pypi", "pkg-a", Runnable::run);
        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(10, TimeUnit.SECONDS));
        IndexUnavailableException unavailable = assertInstanceOf(IndexUnavailableException.class, e.getCause());
        assertEquals("pypi", unavailable.getIndexId());
        assertEquals(3, unavailable.getAttempts());
        assertInstanceOf(IOException.class, unavailable.getCause());
        assertEquals(3, attempts.get());
    }

    @Test
    public void testPermanentFailuresAreNotRetried() {
        AtomicInteger attempts = new AtomicInteger();
        CompletableFuture<String> future = FAST.execute(failing(attempts, Integer.MAX_VALUE, new FileNotFoundException("HTTP 404"), "page"), "pypi", "pkg-a", Runnable::run);
        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(10, TimeUnit.SECONDS));
        assertInstanceOf(FileNotFoundException.class, e.getCause());
        assertEquals(1, attempts.get());
    }

    @Test
    public void testCancellationStopsRetries() throws InterruptedException {
        AtomicInteger attempts = new AtomicInteger();
        RetryPolicy slow = new RetryPolicy(5, 200L, 1.0D, 200L, RetryPolicy.DEFAULT_RETRYABLE);
        CompletableFuture<String> future = slow.execute(failing(attempts, Integer.MAX_VALUE, new IOException("HTTP 503"), "page"), "pypi", "pkg-a", Runnable::run);
        assertTrue(future.cancel(true));
        Thread.sleep(600L);
        assertEquals(1, attempts.get());
    }
}
