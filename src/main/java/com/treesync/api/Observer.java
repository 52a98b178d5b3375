package com.treesync.api;

/**
 * A callback registered on an {@link com.treesync.engine.Observable}.
 *
 * Observers are never invoked synchronously by the code that fires a change.
 * The NotificationScheduler collects them and invokes each one at most once
 * per drain, on the designated thread.
 *
 * Identity Contract:
 * Registration, removal and coalescing all use {@code equals}/{@code hashCode}
 * of the observer instance. A method reference or lambda evaluated twice yields
 * two different observers, so callers must keep the instance they registered
 * in order to remove it later.
 *
 * @param <S> The type of the source that fired the change (e.g. the node whose
 *            children changed, or the value cell whose value changed).
 */
@FunctionalInterface
public interface Observer<S> {

    /**
     * Called on the designated thread after the source changed.
     *
     * @param source The entity that fired the notification.
     */
    void onChanged(S source);
}
