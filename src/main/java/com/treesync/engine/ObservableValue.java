package com.treesync.engine;

import com.treesync.api.Observer;

import java.util.Objects;

/**
 * An observable variable: notifies its observers when the value returned by
 * {@link #get()} changes.
 *
 * Change Detection:
 * {@link #set(Object)} compares the new value with the current one using
 * {@link Objects#equals}. Setting an equal value is a no-op and fires nothing.
 *
 * Threading:
 * {@code get} and {@code set} may be called from any thread. After {@code set}
 * returns, {@code get} on the calling thread sees the new value immediately;
 * observers learn about it later, on the designated thread. Observers receive
 * this cell as their source and should read the current value with
 * {@link #get()}, which may already be newer than the value that triggered
 * the notification.
 *
 * @param <T> The value type.
 */
public final class ObservableValue<T> {
    private final Observable<ObservableValue<T>> observable;
    private volatile T value;

    public ObservableValue(NotificationScheduler scheduler, T initialValue) {
        this.observable = new Observable<>(scheduler, this);
        this.value = initialValue;
    }

    /** Returns the last value set. */
    public T get() {
        return value;
    }

    /**
     * Stores a new value and notifies observers if it differs from the current
     * one.
     *
     * @param newValue The new value, may be null.
     * @return true if the value changed.
     */
    public boolean set(T newValue) {
        synchronized (this) {
            if (Objects.equals(newValue, value))
                return false;
            value = newValue;
        }
        observable.notifyObservers();
        return true;
    }

    public void addObserver(Observer<? super ObservableValue<T>> observer) {
        observable.addObserver(observer);
    }

    public void removeObserver(Observer<? super ObservableValue<T>> observer) {
        observable.removeObserver(observer);
    }

    public Observable<ObservableValue<T>> observable() {
        return observable;
    }

    @Override
    public String toString() {
        return "ObservableValue[" + value + "]";
    }
}
