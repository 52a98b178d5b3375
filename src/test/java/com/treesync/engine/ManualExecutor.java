package com.treesync.engine;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Deterministic stand-in for the designated thread: tasks queue up until the
 * test calls {@link #runAll()} on its own thread.
 */
public final class ManualExecutor implements Executor {
    private final Deque<Runnable> tasks = new ArrayDeque<>();
    private boolean rejecting;

    @Override
    public synchronized void execute(Runnable task) {
        if (rejecting)
            throw new RejectedExecutionException("rejecting");
        tasks.add(task);
    }

    /**
     * Runs queued tasks, including tasks queued while running, until the queue
     * is empty.
     *
     * @return The number of tasks run.
     */
    public int runAll() {
        int n = 0;
        Runnable task;
        while ((task = poll()) != null) {
            task.run();
            n++;
        }
        return n;
    }

    public synchronized int queued() {
        return tasks.size();
    }

    public synchronized void setRejecting(boolean rejecting) {
        this.rejecting = rejecting;
    }

    private synchronized Runnable poll() {
        return tasks.poll();
    }
}
