package com.treesync.engine;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A single designated thread fed by an LMAX Disruptor ring buffer.
 *
 * Headless applications and tests have no toolkit event thread, so this class
 * provides one: every task handed to {@link #execute(Runnable)} runs on the same
 * consumer thread, in publication order. It is the natural host executor for a
 * {@link NotificationScheduler} when no UI toolkit is present.
 *
 * Producers:
 * Any thread may publish (multi-producer ring buffer). Tasks are carried in
 * pre-allocated {@link TaskEvent} slots that are cleared after each run.
 *
 * Fault Isolation:
 * A task that throws is logged and the loop keeps running. Loss of the
 * designated thread would silently stop every future notification.
 *
 * Shutdown:
 * Publishing holds the read side of {@code publishLock}; {@link #close()} takes
 * the write side to flip {@code closed}. Every task accepted before that flip is
 * therefore in the ring when the disruptor drains it, and every later task is
 * rejected.
 */
public final class EventLoop implements Executor, AutoCloseable {
    private static final Logger log = LogManager.getLogger(EventLoop.class);

    public static final int DEFAULT_RING_BUFFER_SIZE = 1024;
    private static final long SHUTDOWN_TIMEOUT_MILLIS = 5_000;

    private final String name;
    private final Disruptor<TaskEvent> disruptor;
    private final RingBuffer<TaskEvent> ringBuffer;
    private final ReadWriteLock publishLock = new ReentrantReadWriteLock();
    private volatile Thread eventThread;
    private volatile boolean closed;

    /**
     * Creates and starts a loop with a blocking wait strategy.
     */
    public EventLoop(String name) {
        this(name, DEFAULT_RING_BUFFER_SIZE, new BlockingWaitStrategy());
    }

    /**
     * Creates and starts a loop.
     *
     * @param name           Name of the consumer thread.
     * @param ringBufferSize Ring size; must be a power of two.
     * @param waitStrategy   How the consumer waits for new tasks.
     */
    public EventLoop(String name, int ringBufferSize, WaitStrategy waitStrategy) {
        this.name = Objects.requireNonNull(name, "name");
        if (Integer.bitCount(ringBufferSize) != 1)
            throw new IllegalArgumentException("ringBufferSize must be a power of 2: " + ringBufferSize);

        this.disruptor = new Disruptor<>(
                TaskEvent::new,
                ringBufferSize,
                r -> {
                    Thread t = new Thread(r, name);
                    t.setDaemon(true);
                    eventThread = t;
                    return t;
                },
                ProducerType.MULTI,
                Objects.requireNonNull(waitStrategy, "waitStrategy"));

        disruptor.handleEventsWith(new TaskHandler());
        disruptor.setDefaultExceptionHandler(new TaskExceptionHandler());
        this.ringBuffer = disruptor.start();
        log.debug("Event loop '{}' started (ringBufferSize={})", name, ringBufferSize);
    }

    /**
     * Publishes a task for execution on the loop thread.
     *
     * @throws RejectedExecutionException if the loop has been closed.
     */
    @Override
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "task");
        publishLock.readLock().lock();
        try {
            if (closed)
                throw new RejectedExecutionException("Event loop '" + name + "' is closed");
            ringBuffer.publishEvent((event, sequence, t) -> event.task = t, task);
        } finally {
            publishLock.readLock().unlock();
        }
    }

    /**
     * Runs {@code task} on the loop thread and waits for its result. Called on
     * the loop thread itself, the task runs inline.
     *
     * @throws IllegalStateException if the task threw or the wait was
     *                               interrupted.
     */
    public <T> T call(Callable<T> task) {
        if (isEventThread()) {
            try {
                return task.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new IllegalStateException("Task failed on " + name, e);
            }
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        execute(() -> {
            try {
                result.complete(task.call());
            } catch (Throwable e) {
                result.completeExceptionally(e);
            }
        });
        try {
            return result.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + name, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re)
                throw re;
            throw new IllegalStateException("Task failed on " + name, e.getCause());
        }
    }

    /**
     * Runs {@code task} on the loop thread and waits for it to finish.
     */
    public void run(Runnable task) {
        call(() -> {
            task.run();
            return null;
        });
    }

    /**
     * Blocks until every task published before this call has run.
     */
    public void flush() {
        run(() -> {
        });
    }

    /**
     * @return true if the calling thread is the loop thread.
     */
    public boolean isEventThread() {
        return Thread.currentThread() == eventThread;
    }

    public boolean isClosed() {
        return closed;
    }

    public String name() {
        return name;
    }

    /**
     * Stops accepting tasks, runs the ones already published and stops the
     * thread. Must not be called from the loop thread.
     */
    @Override
    public void close() {
        if (closed)
            return;
        if (isEventThread())
            throw new IllegalStateException("Event loop '" + name + "' cannot be closed from its own thread");
        publishLock.writeLock().lock();
        try {
            if (closed)
                return;
            closed = true;
        } finally {
            publishLock.writeLock().unlock();
        }
        try {
            disruptor.shutdown(SHUTDOWN_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Event loop '{}' did not drain within {} ms, halting", name, SHUTDOWN_TIMEOUT_MILLIS);
            disruptor.halt();
        }
        log.debug("Event loop '{}' stopped", name);
    }

    /**
     * Mutable ring buffer slot carrying one task.
     */
    static final class TaskEvent {
        Runnable task;

        void clear() {
            task = null;
        }
    }

    private static final class TaskHandler implements EventHandler<TaskEvent> {
        @Override
        public void onEvent(TaskEvent event, long sequence, boolean endOfBatch) {
            Runnable task = event.task;
            event.clear();
            if (task != null)
                task.run();
        }
    }

    private final class TaskExceptionHandler implements ExceptionHandler<TaskEvent> {
        @Override
        public void handleEventException(Throwable ex, long sequence, TaskEvent event) {
            // The slot was cleared before the task ran; keep the loop alive.
            log.error("Task failed on event loop '{}' (sequence={})", name, sequence, ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Event loop '{}' failed to start", name, ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Event loop '{}' failed to shut down cleanly", name, ex);
        }
    }
}
