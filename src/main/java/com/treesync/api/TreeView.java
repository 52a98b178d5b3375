package com.treesync.api;

/**
 * The minimal capability set a visual tree widget must provide to be driven by
 * a {@link com.treesync.binding.TreeBinding}.
 *
 * Implementations wrap a concrete widget (a Swing JTree model, a JavaFX
 * TreeView, a terminal renderer) or, for headless use and tests, a plain
 * in-memory structure. Every method is called on the designated thread only.
 *
 * Item handles are opaque to the binding. They are used as map keys by
 * identity, so an implementation must hand out a distinct handle object per
 * item and keep returning the same object for the same item.
 *
 * @param <I> The item handle type.
 */
public interface TreeView<I> {

    /**
     * Creates the single root item.
     *
     * @param text Initial item text.
     * @return The new root handle.
     */
    I createRootItem(String text);

    /**
     * Appends a new item as the last child of {@code parent}.
     *
     * @param parent The parent handle.
     * @param text   Initial item text.
     * @return The new child handle.
     */
    I appendChildItem(I parent, String text);

    /**
     * Removes {@code item} and all its descendants.
     */
    void destroyItem(I item);

    /**
     * Removes every descendant of {@code item}, keeping the item itself.
     */
    void destroyChildren(I item);

    void setItemText(I item, String text);

    /**
     * Shows or hides the expander of an item. A node that is not a leaf shows
     * the expander even before its children are known.
     */
    void setHasChildrenIndicator(I item, boolean hasChildren);

    /**
     * @return true if the widget currently displays the item as expanded.
     */
    boolean isExpanded(I item);

    /**
     * Opens or closes an item programmatically without firing expansion events.
     * The binding uses it to close an item whose children could not be
     * queried, and to open a root expanded on attach. Widgets that cannot do
     * this may keep the default no-op.
     */
    default void setExpanded(I item, boolean expanded) {
    }

    /**
     * Registers the receiver of user expand/collapse events. Passing null
     * detaches the current listener.
     *
     * @param listener The listener, or null.
     */
    void setExpansionListener(TreeExpansionListener<I> listener);
}
