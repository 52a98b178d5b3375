package com.treesync.util;

import com.treesync.api.DrainListener;
import com.treesync.api.Observer;

import java.util.Arrays;

/**
 * Aggregates multiple {@link DrainListener} instances.
 * Registration copies the array so iteration during a drain needs no lock.
 */
public class CompositeDrainListener implements DrainListener {
    private volatile DrainListener[] listeners = new DrainListener[0];

    public synchronized void addForComposite(DrainListener listener) {
        DrainListener[] old = listeners;
        DrainListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onDrainStart(long cycle) {
        for (DrainListener l : listeners)
            l.onDrainStart(cycle);
    }

    @Override
    public void onCallbackError(long cycle, Observer<?> observer, Object source, Throwable error) {
        for (DrainListener l : listeners)
            l.onCallbackError(cycle, observer, source, error);
    }

    @Override
    public void onDrainEnd(long cycle, int invoked) {
        for (DrainListener l : listeners)
            l.onDrainEnd(cycle, invoked);
    }
}
