package com.treesync.binding;

import com.treesync.api.Observer;
import com.treesync.api.TreeNode;
import com.treesync.engine.ObservableValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * The node ↔ item relation of one binding, kept as a single unit.
 *
 * Both directions are updated only through {@link #put} and {@link #remove},
 * so every node key has exactly one item and every item key exactly one node.
 * Keys are compared by identity: a domain class overriding {@code equals} must
 * not merge two distinct nodes into one visual item.
 *
 * Each {@link Entry} also records the expansion state, the parent item, the
 * materialized child items and the node's two observers, which is what
 * collapse walks to release a subtree.
 *
 * Not thread-safe; {@link TreeBinding} guards it with its lock.
 *
 * @param <I> The item handle type.
 */
final class BindingMap<I> {
    private final Map<TreeNode, Entry<I>> byNode = new IdentityHashMap<>();
    private final Map<I, Entry<I>> byItem = new IdentityHashMap<>();

    /**
     * Maps {@code node} to {@code item} in both directions.
     *
     * @throws IllegalStateException if either side is already mapped.
     */
    Entry<I> put(TreeNode node, I item, I parentItem, Observer<ObservableValue<String>> labelObserver,
            Observer<TreeNode> childrenObserver) {
        if (byNode.containsKey(node))
            throw new IllegalStateException("Node already materialized: " + node);
        if (byItem.containsKey(item))
            throw new IllegalStateException("Item already mapped: " + item);

        Entry<I> entry = new Entry<>(node, item, parentItem, labelObserver, childrenObserver);
        byNode.put(node, entry);
        byItem.put(item, entry);
        if (parentItem != null) {
            Entry<I> parent = byItem.get(parentItem);
            if (parent != null)
                parent.children.add(item);
        }
        return entry;
    }

    /**
     * Removes the entry of {@code item} from both directions and from its
     * parent's child list. Children of the entry are left alone; callers
     * release subtrees bottom-up.
     *
     * @return The removed entry, or null if the item was not mapped.
     */
    Entry<I> remove(I item) {
        Entry<I> entry = byItem.remove(item);
        if (entry == null)
            return null;
        byNode.remove(entry.node);
        if (entry.parentItem != null) {
            Entry<I> parent = byItem.get(entry.parentItem);
            if (parent != null)
                parent.children.remove(item);
        }
        return entry;
    }

    Entry<I> byItem(I item) {
        return byItem.get(item);
    }

    Entry<I> byNode(TreeNode node) {
        return byNode.get(node);
    }

    boolean containsNode(TreeNode node) {
        return byNode.containsKey(node);
    }

    int size() {
        return byNode.size();
    }

    boolean isConsistent() {
        if (byNode.size() != byItem.size())
            return false;
        for (Entry<I> e : byNode.values()) {
            if (byItem.get(e.item) != e)
                return false;
        }
        return true;
    }

    /**
     * One materialized node.
     */
    static final class Entry<I> {
        final TreeNode node;
        final I item;
        final I parentItem;
        final Observer<ObservableValue<String>> labelObserver;
        final Observer<TreeNode> childrenObserver;
        final List<I> children = new ArrayList<>();
        ItemState state = ItemState.COLLAPSED;

        Entry(TreeNode node, I item, I parentItem, Observer<ObservableValue<String>> labelObserver,
                Observer<TreeNode> childrenObserver) {
            this.node = node;
            this.item = item;
            this.parentItem = parentItem;
            this.labelObserver = labelObserver;
            this.childrenObserver = childrenObserver;
        }

        List<I> childrenSnapshot() {
            return children.isEmpty() ? Collections.emptyList() : new ArrayList<>(children);
        }
    }
}
