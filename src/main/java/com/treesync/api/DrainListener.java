package com.treesync.api;

/**
 * Observability interface for monitoring notification drains.
 *
 * Implementations can be registered with the NotificationScheduler to receive
 * callbacks during each drain cycle. This is the primary mechanism for:
 *
 * - Diagnostics: Reporting observer callbacks that threw.
 * - Profiling: Measuring how long a drain keeps the designated thread busy.
 * - Metrics: Counting delivered notifications per cycle.
 *
 * Performance Warning:
 * These callbacks run on the designated (UI) thread, inside the drain loop. Any
 * blocking I/O here directly delays every pending notification and every user
 * event queued behind the drain.
 */
public interface DrainListener {

    /**
     * Called immediately before a drain begins.
     *
     * @param cycle The incrementing drain counter.
     */
    void onDrainStart(long cycle);

    /**
     * Called when an observer callback threw. The drain continues with the next
     * pending callback.
     *
     * @param cycle    Current drain cycle.
     * @param observer The observer that failed.
     * @param source   The source it was notified for.
     * @param error    The exception that occurred.
     */
    void onCallbackError(long cycle, Observer<?> observer, Object source, Throwable error);

    /**
     * Called when the pending set has been fully drained.
     *
     * @param cycle   Current drain cycle.
     * @param invoked The number of callbacks invoked, including failed ones.
     */
    void onDrainEnd(long cycle, int invoked);
}
