package com.treesync.util;

import com.treesync.api.DrainListener;
import com.treesync.api.Observer;

/**
 * A listener that tracks how drains load the designated thread.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Latency:</b> Min, Max, Average time per drain (in nanoseconds).</li>
 * <li><b>Throughput:</b> Total number of drains and delivered callbacks.</li>
 * <li><b>Failures:</b> Number of callbacks that threw.</li>
 * </ul>
 *
 * <p>
 * All callbacks arrive on the designated thread; readers on other threads may
 * see slightly stale figures.
 */
public final class DrainStatsListener implements DrainListener {
    private long drainStartNanos, lastLatencyNanos;
    private volatile long totalDrains, totalCallbacks, totalErrors;
    private long totalLatencyNanos;
    private long minLatencyNanos = Long.MAX_VALUE, maxLatencyNanos = Long.MIN_VALUE;
    private int lastCallbacks;

    @Override
    public void onDrainStart(long cycle) {
        drainStartNanos = System.nanoTime();
    }

    @Override
    public void onCallbackError(long cycle, Observer<?> observer, Object source, Throwable error) {
        totalErrors++;
    }

    @Override
    public void onDrainEnd(long cycle, int invoked) {
        lastLatencyNanos = System.nanoTime() - drainStartNanos;
        lastCallbacks = invoked;
        totalDrains++;
        totalCallbacks += invoked;
        totalLatencyNanos += lastLatencyNanos;
        if (lastLatencyNanos < minLatencyNanos)
            minLatencyNanos = lastLatencyNanos;
        if (lastLatencyNanos > maxLatencyNanos)
            maxLatencyNanos = lastLatencyNanos;
    }

    public long lastLatencyNanos() {
        return lastLatencyNanos;
    }

    public int lastCallbacks() {
        return lastCallbacks;
    }

    public long totalDrains() {
        return totalDrains;
    }

    public long totalCallbacks() {
        return totalCallbacks;
    }

    public long totalErrors() {
        return totalErrors;
    }

    public long minLatencyNanos() {
        return totalDrains == 0 ? 0 : minLatencyNanos;
    }

    public long maxLatencyNanos() {
        return totalDrains == 0 ? 0 : maxLatencyNanos;
    }

    public double avgLatencyNanos() {
        return totalDrains == 0 ? 0 : (double) totalLatencyNanos / totalDrains;
    }

    @Override
    public String toString() {
        return String.format("DrainStats{drains=%d, callbacks=%d, errors=%d, avg=%.1fus, min=%.1fus, max=%.1fus}",
                totalDrains, totalCallbacks, totalErrors,
                avgLatencyNanos() / 1000.0, minLatencyNanos() / 1000.0, maxLatencyNanos() / 1000.0);
    }
}
