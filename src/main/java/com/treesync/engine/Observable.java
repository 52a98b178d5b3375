package com.treesync.engine;

import com.treesync.api.Observer;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * When an Observable is notified it schedules all its observers for a deferred
 * call on the designated thread.
 *
 * The Observable is bound to a fixed source object at construction and passes
 * it to its observers.
 *
 * Delivery Contract:
 * - {@link #notifyObservers()} never runs a callback synchronously.
 * - Each observer runs at most once per drain, however many times and by however
 * many observables it was enqueued. An observer shared by several observables
 * receives the source of the first one that fired; register one observer per
 * source when the source matters.
 * - {@link #removeObserver} also cancels a pending, undelivered call.
 *
 * @param <S> The source type.
 */
public final class Observable<S> {
    private final NotificationScheduler scheduler;
    private final S source;
    private final Set<Observer<? super S>> observers = ConcurrentHashMap.newKeySet();

    /**
     * @param scheduler The scheduler that delivers notifications.
     * @param source    The object passed to observers.
     */
    public Observable(NotificationScheduler scheduler, S source) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.source = Objects.requireNonNull(source, "source");
    }

    /**
     * Registers an observer. Registering the same observer twice has no effect.
     */
    public void addObserver(Observer<? super S> observer) {
        observers.add(Objects.requireNonNull(observer, "observer"));
    }

    /**
     * Unregisters an observer and drops its pending notification for this
     * source, if any. No error if it was not registered.
     */
    public void removeObserver(Observer<? super S> observer) {
        if (observer == null)
            return;
        observers.remove(observer);
        scheduler.discard(observer, source);
    }

    /**
     * Schedules every registered observer for one deferred call.
     */
    public void notifyObservers() {
        if (observers.isEmpty())
            return;
        scheduler.enqueueAll(List.copyOf(observers), source);
    }

    public boolean hasObserver(Observer<? super S> observer) {
        return observers.contains(observer);
    }

    public int observerCount() {
        return observers.size();
    }

    public S source() {
        return source;
    }

    public NotificationScheduler scheduler() {
        return scheduler;
    }
}
