package com.treesync.engine;

import com.treesync.api.DrainListener;
import com.treesync.api.Observer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executor;

/**
 * The queue that turns "something changed" into deferred observer calls on the
 * designated thread.
 *
 * One scheduler is constructed per application and injected into every
 * {@link Observable}. The scheduler owns no thread of its own: it posts drain
 * requests to a host {@link Executor} that represents the designated thread
 * (an {@link EventLoop}, {@code SwingUtilities::invokeLater},
 * {@code Platform::runLater}, ...).
 *
 * Algorithm Details:
 *
 * 1. Enqueue: {@link #enqueueAll} adds observers to a pending map keyed by
 * observer. Key semantics give coalescing: an observer enqueued N times before
 * the drain runs, by one or by several sources, is invoked once. It receives
 * the first source that enqueued it.
 *
 * 2. Schedule: If no drain is requested and none is running, exactly one
 * drain is posted to the host executor.
 *
 * 3. Drain: On the designated thread, pairs are removed and invoked one at a
 * time until the set is empty. Pairs enqueued by callbacks during the drain are
 * picked up by the same drain.
 *
 * Fault Isolation:
 * A callback that throws does not stop the drain. The failure is reported to
 * the {@link DrainListener} and the next pending callback runs. A listener that
 * throws is logged and otherwise ignored.
 *
 * Thread Safety:
 * {@link #enqueueAll} and {@link #discard} may be called from any thread.
 * {@link #drain()} runs only via the host executor.
 */
public final class NotificationScheduler {
    private static final Logger log = LogManager.getLogger(NotificationScheduler.class);

    private final Executor host;
    private final Object lock = new Object();

    // Guarded by lock. Observer -> sources that enqueued it, in arrival order.
    private final Map<Observer<?>, Set<Object>> pending = new LinkedHashMap<>();
    private boolean scheduled;
    private boolean draining;

    private volatile DrainListener listener;
    private volatile long cycle;

    /**
     * Creates a scheduler that drains on the given host executor.
     *
     * @param host Executor bound to the designated thread.
     */
    public NotificationScheduler(Executor host) {
        this.host = Objects.requireNonNull(host, "host");
    }

    public void setListener(DrainListener listener) {
        this.listener = listener;
    }

    /**
     * Adds every observer to the pending map and makes sure a drain is
     * scheduled. An observer already pending stays pending once.
     *
     * @param observers The observers to notify. An empty collection is a no-op.
     * @param source    The source passed to each observer.
     * @param <S>       Source type.
     * @throws java.util.concurrent.RejectedExecutionException if the host
     *                                                         refused the drain
     *                                                         request.
     */
    public <S> void enqueueAll(Collection<? extends Observer<? super S>> observers, S source) {
        if (observers.isEmpty())
            return;

        boolean requestDrain;
        synchronized (lock) {
            for (Observer<? super S> o : observers)
                pending.computeIfAbsent(o, k -> new LinkedHashSet<>()).add(source);
            requestDrain = !scheduled && !draining && !pending.isEmpty();
            if (requestDrain)
                scheduled = true;
        }

        if (requestDrain) {
            try {
                host.execute(this::drain);
            } catch (RuntimeException e) {
                // Leave the entries pending so the next enqueue can retry.
                synchronized (lock) {
                    scheduled = false;
                }
                throw e;
            }
        }
    }

    /**
     * Withdraws the request {@code source} made for {@code observer}. Used when
     * an observer is unregistered so that a late notification cannot reach it.
     * The observer stays pending if another source also enqueued it.
     *
     * @return true if a pending request was removed.
     */
    public boolean discard(Observer<?> observer, Object source) {
        synchronized (lock) {
            Set<Object> sources = pending.get(observer);
            if (sources == null || !sources.remove(source))
                return false;
            if (sources.isEmpty())
                pending.remove(observer);
            return true;
        }
    }

    /**
     * Invokes every pending callback, including callbacks enqueued while the
     * drain is running. Runs on the designated thread.
     */
    void drain() {
        final long c;
        synchronized (lock) {
            if (draining)
                return;
            scheduled = false;
            draining = true;
            c = ++cycle;
        }

        final DrainListener l = this.listener;
        int invoked = 0;
        try {
            fireDrainStart(l, c);
            while (true) {
                PendingNotification next;
                synchronized (lock) {
                    Iterator<Map.Entry<Observer<?>, Set<Object>>> it = pending.entrySet().iterator();
                    if (!it.hasNext()) {
                        draining = false;
                        break;
                    }
                    Map.Entry<Observer<?>, Set<Object>> e = it.next();
                    it.remove();
                    next = new PendingNotification(e.getKey(), e.getValue().iterator().next());
                }

                invoked++;
                try {
                    next.invoke();
                } catch (RuntimeException | Error e) {
                    if (e instanceof VirtualMachineError)
                        throw (VirtualMachineError) e;
                    fireCallbackError(l, c, next, e);
                }
            }
        } finally {
            synchronized (lock) {
                if (draining) {
                    // Abnormal exit: hand the remaining work to a fresh drain.
                    draining = false;
                    if (!pending.isEmpty() && !scheduled) {
                        scheduled = true;
                        host.execute(this::drain);
                    }
                }
            }
            fireDrainEnd(l, c, invoked);
        }
    }

    private static void fireDrainStart(DrainListener l, long c) {
        if (l == null)
            return;
        try {
            l.onDrainStart(c);
        } catch (RuntimeException e) {
            log.error("DrainListener failed at start of drain {}", c, e);
        }
    }

    private static void fireCallbackError(DrainListener l, long c, PendingNotification failed, Throwable error) {
        if (l == null) {
            log.error("Observer {} failed for source {}", failed.observer(), failed.source(), error);
            return;
        }
        try {
            l.onCallbackError(c, failed.observer(), failed.source(), error);
        } catch (RuntimeException e) {
            log.error("DrainListener failed to report error of observer {} in drain {}", failed.observer(), c, e);
            log.error("Unreported observer failure", error);
        }
    }

    private static void fireDrainEnd(DrainListener l, long c, int invoked) {
        if (l == null)
            return;
        try {
            l.onDrainEnd(c, invoked);
        } catch (RuntimeException e) {
            log.error("DrainListener failed at end of drain {}", c, e);
        }
    }

    /**
     * @return The number of notifications waiting for the next drain.
     */
    public int pendingCount() {
        synchronized (lock) {
            return pending.size();
        }
    }

    /**
     * @return true if a drain has been requested and has not started yet.
     */
    public boolean isScheduled() {
        synchronized (lock) {
            return scheduled;
        }
    }

    /**
     * @return The number of drains started so far.
     */
    public long cycle() {
        return cycle;
    }

    /**
     * One delivery taken out of the pending map.
     */
    private record PendingNotification(Observer<?> observer, Object source) {

        @SuppressWarnings("unchecked")
        void invoke() {
            ((Observer<Object>) observer).onChanged(source);
        }
    }
}
