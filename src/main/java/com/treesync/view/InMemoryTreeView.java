package com.treesync.view;

import com.treesync.api.TreeExpansionListener;
import com.treesync.api.TreeView;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A headless {@link TreeView} that keeps the visual tree as plain objects.
 *
 * It plays the widget's role where no toolkit is available: tests, the demo,
 * server-side rendering of an outline. {@link #userExpand(Item)} and
 * {@link #userCollapse(Item)} stand in for clicks on an expander and forward
 * the event to the registered {@link TreeExpansionListener}, like a widget
 * would.
 *
 * Confined to the designated thread, like a real widget.
 */
public final class InMemoryTreeView implements TreeView<InMemoryTreeView.Item> {

    private Item root;
    private TreeExpansionListener<Item> listener;
    private int created;
    private int destroyed;

    @Override
    public Item createRootItem(String text) {
        if (root != null)
            throw new IllegalStateException("Root item already exists");
        root = new Item(null, text);
        created++;
        return root;
    }

    @Override
    public Item appendChildItem(Item parent, String text) {
        checkLive(parent);
        Item child = new Item(parent, text);
        parent.children.add(child);
        created++;
        return child;
    }

    @Override
    public void destroyItem(Item item) {
        checkLive(item);
        destroyChildren(item);
        if (item.parent != null) {
            item.parent.children.remove(item);
        } else {
            root = null;
        }
        item.destroyed = true;
        destroyed++;
    }

    @Override
    public void destroyChildren(Item item) {
        checkLive(item);
        for (Item child : new ArrayList<>(item.children))
            destroyItem(child);
    }

    @Override
    public void setItemText(Item item, String text) {
        checkLive(item);
        item.text = text;
    }

    @Override
    public void setHasChildrenIndicator(Item item, boolean hasChildren) {
        checkLive(item);
        item.hasChildren = hasChildren;
    }

    @Override
    public boolean isExpanded(Item item) {
        return item.expanded;
    }

    @Override
    public void setExpanded(Item item, boolean expanded) {
        checkLive(item);
        item.expanded = expanded;
    }

    @Override
    public void setExpansionListener(TreeExpansionListener<Item> listener) {
        this.listener = listener;
    }

    /**
     * Simulates the user opening an item. Items without an expander cannot be
     * opened.
     */
    public void userExpand(Item item) {
        checkLive(item);
        if (!item.hasChildren || item.expanded)
            return;
        item.expanded = true;
        if (listener != null)
            listener.onUserExpand(item);
    }

    /**
     * Simulates the user closing an item.
     */
    public void userCollapse(Item item) {
        checkLive(item);
        if (!item.expanded)
            return;
        item.expanded = false;
        if (listener != null)
            listener.onUserCollapse(item);
    }

    public Item root() {
        return root;
    }

    public TreeExpansionListener<Item> listener() {
        return listener;
    }

    /** @return number of items created over the view's lifetime. */
    public int createdCount() {
        return created;
    }

    /** @return number of items destroyed over the view's lifetime. */
    public int destroyedCount() {
        return destroyed;
    }

    /**
     * Renders the live items as an indented outline, one item per line.
     * Collapsed items with an expander are prefixed with "+", expanded ones with
     * "-", items without expander with a space.
     */
    public String render() {
        StringBuilder sb = new StringBuilder(256);
        if (root != null)
            render(sb, root, 0);
        return sb.toString();
    }

    private static void render(StringBuilder sb, Item item, int depth) {
        sb.append("  ".repeat(depth))
                .append(item.hasChildren ? (item.expanded ? '-' : '+') : ' ')
                .append(' ')
                .append(item.text)
                .append('\n');
        for (Item child : item.children)
            render(sb, child, depth + 1);
    }

    private static void checkLive(Item item) {
        Objects.requireNonNull(item, "item");
        if (item.destroyed)
            throw new IllegalStateException("Item has been destroyed: " + item.text);
    }

    /**
     * A visual item. Handles are compared by identity.
     */
    public static final class Item {
        private final Item parent;
        private final List<Item> children = new ArrayList<>();
        private String text;
        private boolean hasChildren;
        private boolean expanded;
        private boolean destroyed;

        private Item(Item parent, String text) {
            this.parent = parent;
            this.text = text;
        }

        public String text() {
            return text;
        }

        public boolean hasChildren() {
            return hasChildren;
        }

        public boolean isExpanded() {
            return expanded;
        }

        public boolean isDestroyed() {
            return destroyed;
        }

        public Item parent() {
            return parent;
        }

        public List<Item> children() {
            return Collections.unmodifiableList(children);
        }

        /**
         * @return the child at {@code index}.
         */
        public Item child(int index) {
            return children.get(index);
        }

        @Override
        public String toString() {
            return "Item[" + text + "]";
        }
    }
}
