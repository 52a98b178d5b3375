package com.treesync.binding;

import com.treesync.api.Observer;
import com.treesync.api.TreeExpansionListener;
import com.treesync.api.TreeNode;
import com.treesync.api.TreeView;
import com.treesync.engine.ObservableValue;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps a {@link TreeView} in sync with a lazily expanded tree of
 * {@link TreeNode}s.
 *
 * The binding owns the node ↔ item relation and reacts to four kinds of
 * events:
 *
 * 1. Expand (view-originated): queries {@link TreeNode#children()} afresh and
 * materializes one item per child: it creates the item, maps it both ways,
 * shows the expander for non-leaf children and starts observing the child's
 * label and children.
 *
 * 2. Collapse (view-originated): releases the whole materialized subtree below
 * the item (observers removed, map entries removed) and destroys the child
 * items. Deeper expansion state is not remembered.
 *
 * 3. Label changed (notification): copies the current label to the item text.
 *
 * 4. Children changed (notification): if the item is expanded, rebuilds its
 * children completely (collapse, then expand). A collapsed item is left alone;
 * its children are queried on the next expand.
 *
 * Laziness:
 * children() is never called eagerly and never cached. The work done for a
 * large or expensive subtree is bounded by what the user chose to see.
 *
 * Threading:
 * Every method must be called on the designated thread, which is also where
 * the NotificationScheduler delivers label/children notifications. A single
 * lock guards every read-modify-write of the map and the view. A view that
 * echoes an expand/collapse event synchronously while the binding is mutating
 * it (same thread, lock already held) has the echo ignored.
 *
 * Failure Handling:
 * If a node's children cannot be queried, the partial result is rolled back and
 * the item stays collapsed. Notifications for nodes that are no longer
 * materialized are ignored.
 *
 * @param <I> The view's item handle type.
 */
public final class TreeBinding<I> implements TreeExpansionListener<I>, AutoCloseable {
    private static final Logger log = LogManager.getLogger(TreeBinding.class);

    private final TreeNode root;
    private final TreeView<I> view;
    private final BindingMap<I> map = new BindingMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    private I rootItem;
    private boolean closed;

    private TreeBinding(TreeNode root, TreeView<I> view) {
        this.root = Objects.requireNonNull(root, "root");
        this.view = Objects.requireNonNull(view, "view");
    }

    /**
     * Creates a binding showing {@code root} in {@code view}. The root item
     * starts collapsed unless the view reports it as already expanded.
     */
    public static <I> TreeBinding<I> attach(TreeNode root, TreeView<I> view) {
        return attach(root, view, false);
    }

    /**
     * Creates a binding showing {@code root} in {@code view}.
     *
     * @param expandRoot If true the root's children are materialized
     *                   immediately.
     */
    public static <I> TreeBinding<I> attach(TreeNode root, TreeView<I> view, boolean expandRoot) {
        TreeBinding<I> binding = new TreeBinding<>(root, view);
        binding.attachRoot(expandRoot);
        return binding;
    }

    private void attachRoot(boolean expandRoot) {
        lock.lock();
        try {
            BindingMap.Entry<I> entry = materialize(root, null);
            rootItem = entry.item;
            view.setExpansionListener(this);
            log.debug("Attached root '{}'", entry.node.label().get());
            if (expandRoot || view.isExpanded(rootItem)) {
                if (populate(entry))
                    view.setExpanded(rootItem, true);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void onUserExpand(I item) {
        expand(item);
    }

    @Override
    public void onUserCollapse(I item) {
        collapse(item);
    }

    /**
     * Materializes the children of {@code item}. No-op for leaves, for items
     * that are already expanded and for items this binding does not know.
     *
     * @return true if the item is expanded afterwards.
     * @throws IllegalStateException if the binding is closed.
     */
    public boolean expand(I item) {
        if (!enter("expand", item))
            return false;
        try {
            checkOpen();
            BindingMap.Entry<I> entry = map.byItem(item);
            if (entry == null) {
                log.debug("Expand ignored for unmapped item {}", item);
                return false;
            }
            if (entry.state == ItemState.EXPANDED)
                return true;
            if (entry.node.isLeaf())
                return false;
            if (!populate(entry))
                return false;
            view.setExpanded(item, true);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Releases the materialized subtree below {@code item} and destroys its
     * child items. No-op for collapsed or unknown items.
     *
     * @throws IllegalStateException if the binding is closed.
     */
    public void collapse(I item) {
        if (!enter("collapse", item))
            return;
        try {
            checkOpen();
            BindingMap.Entry<I> entry = map.byItem(item);
            if (entry == null) {
                log.debug("Collapse ignored for unmapped item {}", item);
                return;
            }
            if (entry.state == ItemState.EXPANDED) {
                depopulate(entry);
                view.setExpanded(item, false);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Handler for label notifications: shows the node's current label.
     * Ignored if the node is no longer materialized.
     */
    public void onLabelChanged(TreeNode node) {
        if (!enter("label change", node))
            return;
        try {
            BindingMap.Entry<I> entry = map.byNode(node);
            if (entry == null) {
                log.debug("Label change ignored for unmaterialized node");
                return;
            }
            view.setItemText(entry.item, textOf(node));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Handler for children notifications: rebuilds the children of an expanded
     * item. Collapsed and unmaterialized nodes are left alone and their
     * children are not queried.
     */
    public void onChildrenChanged(TreeNode node) {
        if (!enter("children change", node))
            return;
        try {
            BindingMap.Entry<I> entry = map.byNode(node);
            if (entry == null || entry.state != ItemState.EXPANDED)
                return;
            depopulate(entry);
            populate(entry);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Releases every observer registration, empties the map, removes the root
     * item and detaches from the view. Idempotent.
     */
    @Override
    public void close() {
        if (!enter("close", root))
            return;
        try {
            if (closed)
                return;
            closed = true;
            BindingMap.Entry<I> entry = map.byItem(rootItem);
            if (entry != null) {
                releaseChildren(entry);
                release(entry);
                view.destroyItem(rootItem);
            }
            view.setExpansionListener(null);
            log.debug("Binding closed");
        } finally {
            lock.unlock();
        }
    }

    // ── Queries ──

    public TreeNode root() {
        return root;
    }

    public I rootItem() {
        return rootItem;
    }

    /**
     * @return The item of a materialized node, or null.
     */
    public I itemFor(TreeNode node) {
        lock.lock();
        try {
            BindingMap.Entry<I> entry = map.byNode(node);
            return entry == null ? null : entry.item;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return The node bound to an item, or null.
     */
    public TreeNode nodeFor(I item) {
        lock.lock();
        try {
            BindingMap.Entry<I> entry = map.byItem(item);
            return entry == null ? null : entry.node;
        } finally {
            lock.unlock();
        }
    }

    public boolean isMaterialized(TreeNode node) {
        lock.lock();
        try {
            return map.containsNode(node);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return The state of a mapped item, or null if the item is not mapped.
     */
    public ItemState stateOf(I item) {
        lock.lock();
        try {
            BindingMap.Entry<I> entry = map.byItem(item);
            return entry == null ? null : entry.state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return The materialized child items of {@code item}, in display order.
     */
    public List<I> childItems(I item) {
        lock.lock();
        try {
            BindingMap.Entry<I> entry = map.byItem(item);
            return entry == null ? List.of() : entry.childrenSnapshot();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return The number of materialized nodes, root included.
     */
    public int size() {
        lock.lock();
        try {
            return map.size();
        } finally {
            lock.unlock();
        }
    }

    boolean isConsistent() {
        lock.lock();
        try {
            return map.isConsistent();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    // ── Internals (lock held) ──

    private boolean enter(String operation, Object target) {
        if (lock.isHeldByCurrentThread()) {
            log.debug("Ignoring re-entrant {} for {}", operation, target);
            return false;
        }
        lock.lock();
        return true;
    }

    private void checkOpen() {
        if (closed)
            throw new IllegalStateException("Binding is closed");
    }

    private BindingMap.Entry<I> materialize(TreeNode node, I parentItem) {
        String text = textOf(node);
        boolean leaf = node.isLeaf();
        I item = parentItem == null ? view.createRootItem(text) : view.appendChildItem(parentItem, text);

        // One closure per node and concern: the scheduler coalesces by observer.
        Observer<ObservableValue<String>> labelObserver = label -> onLabelChanged(node);
        Observer<TreeNode> childrenObserver = changed -> onChildrenChanged(node);
        BindingMap.Entry<I> entry = map.put(node, item, parentItem, labelObserver, childrenObserver);
        view.setHasChildrenIndicator(item, !leaf);
        node.label().addObserver(labelObserver);
        node.childrenChanged().addObserver(childrenObserver);
        return entry;
    }

    private boolean populate(BindingMap.Entry<I> entry) {
        try {
            int count = 0;
            for (TreeNode child : entry.node.children()) {
                if (child == null || map.containsNode(child)) {
                    log.warn("Skipping child of '{}': {}", textOf(entry.node),
                            child == null ? "null node" : "node is already shown elsewhere in the tree");
                    continue;
                }
                materialize(child, entry.item);
                count++;
            }
            entry.state = ItemState.EXPANDED;
            log.trace("Expanded '{}' with {} children", textOf(entry.node), count);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to expand '{}', leaving it collapsed", textOf(entry.node), e);
            depopulate(entry);
            view.setExpanded(entry.item, false);
            return false;
        }
    }

    private void depopulate(BindingMap.Entry<I> entry) {
        releaseChildren(entry);
        view.destroyChildren(entry.item);
        entry.state = ItemState.COLLAPSED;
    }

    private void releaseChildren(BindingMap.Entry<I> entry) {
        for (I childItem : entry.childrenSnapshot()) {
            BindingMap.Entry<I> child = map.byItem(childItem);
            if (child == null)
                continue;
            releaseChildren(child);
            release(child);
        }
    }

    private void release(BindingMap.Entry<I> entry) {
        entry.node.label().removeObserver(entry.labelObserver);
        entry.node.childrenChanged().removeObserver(entry.childrenObserver);
        map.remove(entry.item);
    }

    private static String textOf(TreeNode node) {
        return Objects.toString(node.label().get(), "");
    }
}
