package org.stianloader.pyresolve.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.stianloader.pyresolve.internal.AsyncMemoizer;

public class AsyncMemoizerTest {

    @Test
    public void testLoadsOnce() throws Exception {
        AsyncMemoizer<String, Integer> memoizer = new AsyncMemoizer<>();
        AtomicInteger loads = new AtomicInteger();
        CompletableFuture<Integer> first = memoizer.get("pkg-a", (key) -> CompletableFuture.completedFuture(loads.incrementAndGet()));
        CompletableFuture<Integer> second = memoizer.get("pkg-a", (key) -> CompletableFuture.completedFuture(loads.incrementAndGet()));
        assertSame(first, second);
        assertEquals(1, first.get());
        assertEquals(1, loads.get());
        assertSame(first, memoizer.getIfPresent("pkg-a"));
        assertNull(memoizer.getIfPresent("pkg-b"));
    }

    @Test
    public void testRecursiveLoader() throws Exception {
        AsyncMemoizer<Integer, Integer> memoizer = new AsyncMemoizer<>();
        CompletableFuture<Integer> outer = memoizer.get(1, (key) -> memoizer.get(2, (inner) -> CompletableFuture.completedFuture(20)).thenApply((v) -> v + key));
        assertEquals(21, outer.get());
        assertEquals(2, memoizer.size());
    }

    @Test
    public void testFailedEntriesAreEvicted() {
        AsyncMemoizer<String, String> memoizer = new AsyncMemoizer<>();
        CompletableFuture<String> failed = new CompletableFuture<>();
        failed.completeExceptionally(new IOException("HTTP 503"));
        memoizer.get("pkg-a", (key) -> failed);
        memoizer.get("pkg-b", (key) -> CompletableFuture.completedFuture("ok"));
        memoizer.get("pkg-c", (key) -> {
            throw new IllegalStateException("loader failure");
        });
        assertEquals(2, memoizer.evictFailed());
        assertEquals(1, memoizer.size());
        assertNull(memoizer.getIfPresent("pkg-a"));
    }

    @Test
    public void testCancelPending() {
        AsyncMemoizer<String, String> memoizer = new AsyncMemoizer<>();
        CompletableFuture<String> pending = new CompletableFuture<>();
        CompletableFuture<String> handedOut = memoizer.get("pkg-a", (key) -> pending);
        memoizer.get("pkg-b", (key) -> CompletableFuture.completedFuture("ok"));
        assertEquals(1, memoizer.cancelPending());
        assertTrue(handedOut.isCancelled());
        assertTrue(pending.isCancelled());
        assertNull(memoizer.getIfPresent("pkg-a"));
        assertEquals(1, memoizer.size());
        memoizer.clear();
        assertEquals(0, memoizer.size());
    }
}
