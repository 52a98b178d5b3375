package com.treesync.binding;

import com.treesync.api.TreeNode;
import com.treesync.engine.NotificationScheduler;
import com.treesync.engine.Observable;
import com.treesync.engine.ObservableValue;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A node that counts children queries and can be told to fail them.
 */
final class TestNode implements TreeNode {
    private final ObservableValue<String> label;
    private final Observable<TreeNode> childrenChanged;
    private final boolean leaf;
    private final List<TreeNode> children = new CopyOnWriteArrayList<>();
    private int childrenQueries;
    private RuntimeException failure;
    private int failAfter = -1;

    private TestNode(NotificationScheduler scheduler, String label, boolean leaf) {
        this.label = new ObservableValue<>(scheduler, label);
        this.childrenChanged = new Observable<>(scheduler, this);
        this.leaf = leaf;
    }

    static TestNode leaf(NotificationScheduler scheduler, String label) {
        return new TestNode(scheduler, label, true);
    }

    static TestNode branch(NotificationScheduler scheduler, String label, TreeNode... children) {
        TestNode node = new TestNode(scheduler, label, false);
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
    public Iterable<TreeNode> children() {
        childrenQueries++;
        if (failure != null && failAfter < 0)
            throw failure;
        if (failure == null)
            return new ArrayList<>(children);

        // Fails while being iterated, after failAfter elements.
        List<TreeNode> snapshot = new ArrayList<>(children);
        RuntimeException error = failure;
        int limit = failAfter;
        return () -> new Iterator<>() {
            int i;

            @Override
            public boolean hasNext() {
                return i < snapshot.size();
            }

            @Override
            public TreeNode next() {
                if (i == limit)
                    throw error;
                return snapshot.get(i++);
            }
        };
    }

    @Override
    public Observable<TreeNode> childrenChanged() {
        return childrenChanged;
    }

    void setChildren(TreeNode... newChildren) {
        children.clear();
        children.addAll(List.of(newChildren));
        childrenChanged.notifyObservers();
    }

    void failWith(RuntimeException failure) {
        this.failure = failure;
        this.failAfter = -1;
    }

    void failDuringIteration(RuntimeException failure, int afterElements) {
        this.failure = failure;
        this.failAfter = afterElements;
    }

    void heal() {
        this.failure = null;
        this.failAfter = -1;
    }

    int childrenQueries() {
        return childrenQueries;
    }

    @Override
    public String toString() {
        return "TestNode[" + label.get() + "]";
    }
}
