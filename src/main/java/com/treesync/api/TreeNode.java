package com.treesync.api;

import com.treesync.engine.Observable;
import com.treesync.engine.ObservableValue;

/**
 * A node in the tree-shaped domain model.
 *
 * This is the contract a domain implements to be displayed by a
 * {@link com.treesync.binding.TreeBinding}. The binding never walks the model
 * eagerly: it asks for children only when the user expands a node, and it asks
 * again on every expansion.
 *
 * Key Responsibilities:
 *
 * 1. Label: An observable text cell. Setting it from any thread eventually
 * updates the displayed text.
 *
 * 2. Shape: {@link #isLeaf()} tells whether the node can ever have children.
 * The value is constant for the lifetime of the instance.
 *
 * 3. Children: {@link #children()} is queried on demand. Whenever the result
 * may have changed, the node fires {@link #childrenChanged()}.
 *
 * Tree Constraint:
 * A node instance may appear under at most one parent within a binding. The
 * binding skips (with a warning) a node that is already materialized elsewhere.
 */
public interface TreeNode {

    /**
     * @return The observable label cell shown as the item text.
     */
    ObservableValue<String> label();

    /**
     * If true, {@link #children()} never returns any nodes.
     *
     * @return true for leaf nodes; constant per instance.
     */
    boolean isLeaf();

    /**
     * Returns the current children. May be expensive; the binding calls it only
     * while expanding or rebuilding an expanded node.
     *
     * @return The children in display order.
     */
    Iterable<? extends TreeNode> children();

    /**
     * Fires when the return value of {@link #children()} may have changed. The
     * observable's source is this node.
     *
     * @return The children-changed observable.
     */
    Observable<TreeNode> childrenChanged();
}
