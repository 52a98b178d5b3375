package com.treesync.util;

import com.treesync.api.TreeNode;
import com.treesync.binding.ItemState;
import com.treesync.binding.TreeBinding;

/**
 * Diagnostic utility for inspecting what a binding has materialized.
 *
 * <p>
 * The output walks the binding's own bookkeeping, not the view, so comparing
 * it with the widget's display helps pin down desynchronization bugs.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions and logging. Call on the
 * designated thread. Do <b>not</b> use on a hot path (allocates strings, walks
 * the whole materialized tree).
 */
public final class TreeExplain {
    private final TreeBinding<?> binding;

    public TreeExplain(TreeBinding<?> binding) {
        this.binding = binding;
    }

    /**
     * Dumps the materialized tree, one node per line:
     * {@code [EXPANDED] label (leaf)}.
     */
    public String explainTree() {
        StringBuilder sb = new StringBuilder(256);
        sb.append("Materialized nodes: ").append(binding.size()).append('\n');
        appendTree(binding, sb);
        return sb.toString();
    }

    private static <I> void appendTree(TreeBinding<I> binding, StringBuilder sb) {
        I root = binding.rootItem();
        if (root != null && !binding.isClosed())
            appendItem(binding, root, 0, sb);
    }

    private static <I> void appendItem(TreeBinding<I> binding, I item, int depth, StringBuilder sb) {
        TreeNode node = binding.nodeFor(item);
        ItemState state = binding.stateOf(item);
        if (node == null)
            return;
        sb.append("  ".repeat(depth))
                .append('[').append(state).append("] ")
                .append(node.label().get());
        if (node.isLeaf())
            sb.append(" (leaf)");
        sb.append('\n');
        for (I child : binding.childItems(item))
            appendItem(binding, child, depth + 1, sb);
    }

    /**
     * Dumps one node's binding state.
     */
    public String explainNode(TreeNode node) {
        return explainNode(binding, node);
    }

    private static <I> String explainNode(TreeBinding<I> binding, TreeNode node) {
        StringBuilder sb = new StringBuilder(128);
        sb.append("Node: ").append(node.label().get()).append('\n')
                .append("  Type: ").append(node.getClass().getSimpleName()).append('\n')
                .append("  Leaf: ").append(node.isLeaf()).append('\n');
        I item = binding.itemFor(node);
        if (item == null) {
            sb.append("  Materialized: false\n");
        } else {
            sb.append("  Materialized: true\n")
                    .append("  State: ").append(binding.stateOf(item)).append('\n')
                    .append("  Children shown: ").append(binding.childItems(item).size()).append('\n');
        }
        sb.append("  Label observers: ").append(node.label().observable().observerCount()).append('\n')
                .append("  Children observers: ").append(node.childrenChanged().observerCount()).append('\n');
        return sb.toString();
    }
}
