package com.treesync.binding;

import com.treesync.api.TreeExpansionListener;
import com.treesync.api.TreeView;
import com.treesync.view.InMemoryTreeView;
import com.treesync.view.InMemoryTreeView.Item;

/**
 * Wraps an {@link InMemoryTreeView}, counting text updates and optionally
 * echoing expansion events synchronously from inside view mutations, the way
 * some widgets do.
 */
final class RecordingView implements TreeView<Item> {
    final InMemoryTreeView delegate = new InMemoryTreeView();
    private TreeExpansionListener<Item> listener;
    boolean echo;
    int textUpdates;
    int echoes;

    @Override
    public Item createRootItem(String text) {
        return delegate.createRootItem(text);
    }

    @Override
    public Item appendChildItem(Item parent, String text) {
        Item child = delegate.appendChildItem(parent, text);
        if (echo && listener != null) {
            echoes++;
            listener.onUserExpand(parent);
        }
        return child;
    }

    @Override
    public void destroyItem(Item item) {
        delegate.destroyItem(item);
    }

    @Override
    public void destroyChildren(Item item) {
        if (echo && listener != null) {
            echoes++;
            listener.onUserCollapse(item);
        }
        delegate.destroyChildren(item);
    }

    @Override
    public void setItemText(Item item, String text) {
        textUpdates++;
        delegate.setItemText(item, text);
    }

    @Override
    public void setHasChildrenIndicator(Item item, boolean hasChildren) {
        delegate.setHasChildrenIndicator(item, hasChildren);
    }

    @Override
    public boolean isExpanded(Item item) {
        return delegate.isExpanded(item);
    }

    @Override
    public void setExpanded(Item item, boolean expanded) {
        delegate.setExpanded(item, expanded);
    }

    @Override
    public void setExpansionListener(TreeExpansionListener<Item> listener) {
        this.listener = listener;
        delegate.setExpansionListener(listener);
    }
}
