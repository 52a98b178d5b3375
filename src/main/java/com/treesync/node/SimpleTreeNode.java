package com.treesync.node;

import com.treesync.api.TreeNode;
import com.treesync.engine.NotificationScheduler;
import com.treesync.engine.Observable;
import com.treesync.engine.ObservableValue;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A general-purpose mutable {@link TreeNode}.
 *
 * Used for:
 * - Headless trees built from a JSON definition (see TreeLoader)
 * - Tests and demos
 * - Small in-memory models that need no custom children query
 *
 * Shape Contract:
 * Leaf status is fixed at construction. A leaf rejects children; a branch may
 * have zero children at times and still shows an expander.
 *
 * Thread Safety:
 * Label and child list may be modified from any thread. Each structural change
 * fires {@link #childrenChanged()} once; bursts of changes before the next
 * drain coalesce into one rebuild.
 */
public final class SimpleTreeNode implements TreeNode {
    private final ObservableValue<String> label;
    private final Observable<TreeNode> childrenChanged;
    private final boolean leaf;
    private final List<SimpleTreeNode> children = new CopyOnWriteArrayList<>();

    private SimpleTreeNode(NotificationScheduler scheduler, String label, boolean leaf) {
        this.label = new ObservableValue<>(scheduler, label);
        this.childrenChanged = new Observable<>(scheduler, this);
        this.leaf = leaf;
    }

    /** Creates a node that can never have children. */
    public static SimpleTreeNode leaf(NotificationScheduler scheduler, String label) {
        return new SimpleTreeNode(scheduler, label, true);
    }

    /** Creates a node that may have children. */
    public static SimpleTreeNode branch(NotificationScheduler scheduler, String label, SimpleTreeNode... children) {
        SimpleTreeNode node = new SimpleTreeNode(scheduler, label, false);
        node.children.addAll(List.of(children));
        return node;
    }

    @Override
    public ObservableValue<String> label() {
        return label;
    }

    @Override
    public boolean isLeaf() {
        return leaf;
    }

    @Override
    public List<SimpleTreeNode> children() {
        return List.copyOf(children);
    }

    @Override
    public Observable<TreeNode> childrenChanged() {
        return childrenChanged;
    }

    /** Convenience for {@code label().set(text)}. */
    public void setLabel(String text) {
        label.set(text);
    }

    public void addChild(SimpleTreeNode child) {
        checkBranch();
        children.add(child);
        childrenChanged.notifyObservers();
    }

    public void addChild(int index, SimpleTreeNode child) {
        checkBranch();
        children.add(index, child);
        childrenChanged.notifyObservers();
    }

    /**
     * @return true if the child was present and removed.
     */
    public boolean removeChild(SimpleTreeNode child) {
        boolean removed = children.remove(child);
        if (removed)
            childrenChanged.notifyObservers();
        return removed;
    }

    /**
     * Replaces all children at once, firing a single notification.
     */
    public void setChildren(Collection<SimpleTreeNode> newChildren) {
        checkBranch();
        children.clear();
        children.addAll(newChildren);
        childrenChanged.notifyObservers();
    }

    private void checkBranch() {
        if (leaf)
            throw new IllegalStateException("Leaf node '" + label.get() + "' cannot have children");
    }

    @Override
    public String toString() {
        return "SimpleTreeNode[" + label.get() + (leaf ? ", leaf" : "") + "]";
    }
}
