package com.pricewatch.pipeline.fetch;

/**
 * Spaces successive adapter calls of one run. The first call goes out immediately; every later call waits
 * until at least {@code intervalMs} have passed since the previous one started.
 */
public class RunPacer {
    private final long intervalMs;
    private long lastCallNanos = -1L;

    public RunPacer(long intervalMs) {
        this.intervalMs = Math.max(0L, intervalMs);
    }

    public static long intervalFor(int rateLimitPerMin, long floorMs) {
        long perCall = rateLimitPerMin <= 0 ? 60_000L : 60_000L / rateLimitPerMin;
        return Math.max(floorMs, perCall);
    }

    public long intervalMs() {
        return intervalMs;
    }

    /**
     * Milliseconds the next call would have to wait right now.
     */
    public long pendingDelayMs() {
        if (lastCallNanos < 0) {
            return 0L;
        }
        long elapsedMs = (System.nanoTime() - lastCallNanos) / 1_000_000L;
        return Math.max(0L, intervalMs - elapsedMs);
    }

    public void awaitNextCall() throws InterruptedException {
        long waitMs = pendingDelayMs();
        while (waitMs > 0) {
            Thread.sleep(waitMs);
            waitMs = pendingDelayMs();
        }
        lastCallNanos = System.nanoTime();
    }
}
