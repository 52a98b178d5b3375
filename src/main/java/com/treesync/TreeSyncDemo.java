package com.treesync;

import com.treesync.binding.TreeBinding;
import com.treesync.io.ViewSnapshot;
import com.treesync.node.SimpleTreeNode;
import com.treesync.util.DrainStatsListener;
import com.treesync.util.TreeExplain;
import com.treesync.view.InMemoryTreeView;

import lombok.extern.log4j.Log4j2;

import java.util.List;

/**
 * Headless end-to-end demo.
 * <p>
 * Loads a small file-system-like tree from JSON, binds it to an
 * {@link InMemoryTreeView} on the event loop, then mutates the model from the
 * main thread the way a background producer would: bursts of label changes
 * (coalesced into one update per item) and child list changes (full rebuild of
 * expanded items only).
 */
@Log4j2
public class TreeSyncDemo {

    public static void main(String[] args) {
        try (TreeSync sync = TreeSync.create()) {
            DrainStatsListener stats = sync.enableDrainStats();
            SimpleTreeNode root = sync.loadTree("demo_tree.json");
            InMemoryTreeView view = new InMemoryTreeView();
            TreeBinding<InMemoryTreeView.Item> binding = sync.bind(root, view);

            // 1. User opens the root and the first folder.
            sync.eventLoop().run(() -> {
                view.userExpand(view.root());
                view.userExpand(view.root().child(0));
            });
            log.info("After expand:\n{}", sync.eventLoop().call(view::render));

            // 2. Producer burst: 100 label changes on one node, one visible update.
            SimpleTreeNode src = root.children().get(0);
            for (int i = 0; i <= 100; i++)
                src.setLabel("src (" + i + " files scanned)");
            sync.flush();
            log.info("After label burst:\n{}", sync.eventLoop().call(view::render));

            // 3. Structure change under an expanded and under a collapsed node.
            src.addChild(SimpleTreeNode.leaf(sync.scheduler(), "NewFile.java"));
            SimpleTreeNode docs = root.children().get(1);
            docs.setChildren(List.of(SimpleTreeNode.leaf(sync.scheduler(), "CHANGELOG.md")));
            sync.flush();
            log.info("After structure change:\n{}", sync.eventLoop().call(view::render));

            // 4. Diagnostics.
            log.info("Binding state:\n{}", sync.eventLoop().call(() -> new TreeExplain(binding).explainTree()));
            log.info("View snapshot:\n{}", sync.eventLoop().call(() -> ViewSnapshot.toJson(view)));
            log.info("{}", stats);

            sync.eventLoop().run(binding::close);
        }
    }
}
