package com.treesync.api;

/**
 * Receives view-originated expansion events. Both callbacks are delivered on the
 * designated thread.
 *
 * @param <I> The item handle type.
 */
public interface TreeExpansionListener<I> {

    /**
     * The user asked to expand {@code item}.
     */
    void onUserExpand(I item);

    /**
     * The user asked to collapse {@code item}.
     */
    void onUserCollapse(I item);
}
