package com.treesync.binding;

/**
 * Expansion state of a materialized visual item. Destroyed items have no state:
 * they are simply absent from the {@link BindingMap}.
 */
public enum ItemState {
    /** Children not materialized. Initial state of every item. */
    COLLAPSED,
    /** Children materialized, mapped and observed. */
    EXPANDED
}
