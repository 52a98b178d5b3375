package com.treesync;

import com.treesync.binding.ItemState;
import com.treesync.binding.TreeBinding;
import com.treesync.config.TreeSyncConfig;
import com.treesync.engine.ManualExecutor;
import com.treesync.node.SimpleTreeNode;
import com.treesync.util.DrainStatsListener;
import com.treesync.view.InMemoryTreeView;
import com.treesync.view.InMemoryTreeView.Item;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class TreeSyncTest {

    private TreeSync sync;

    @Before
    public void setUp() {
        TreeSyncConfig config = new TreeSyncConfig();
        config.setThreadName("treesync-test");
        sync = TreeSync.create(config);
    }

    @After
    public void tearDown() {
        sync.close();
    }

    @Test
    public void testLabelChangesFromProducerThreads() throws Exception {
        SimpleTreeNode root = sync.loadTree("demo_tree.json");
        InMemoryTreeView view = new InMemoryTreeView();
        TreeBinding<Item> binding = sync.bind(root, view);
        DrainStatsListener stats = sync.enableDrainStats();
        sync.eventLoop().run(() -> view.userExpand(view.root()));

        SimpleTreeNode src = root.children().get(0);
        int producers = 4;
        CountDownLatch done = new CountDownLatch(producers);
        for (int p = 0; p < producers; p++) {
            new Thread(() -> {
                for (int i = 0; i < 200; i++)
                    src.setLabel("src " + Thread.currentThread().getName() + " " + i);
                done.countDown();
            }).start();
        }
        assertTrue(done.await(10, TimeUnit.SECONDS));
        src.setLabel("src final");
        sync.flush();

        String text = sync.eventLoop().call(() -> binding.itemFor(src).text());
        assertEquals("src final", text);
        assertTrue(stats.totalCallbacks() <= 801);
        assertEquals(0, stats.totalErrors());
    }

    @Test
    public void testStructureChangeOnlyRebuildsExpandedNodes() {
        SimpleTreeNode root = sync.loadTree("demo_tree.json");
        InMemoryTreeView view = new InMemoryTreeView();
        TreeBinding<Item> binding = sync.bind(root, view);
        sync.eventLoop().run(() -> {
            view.userExpand(view.root());
            view.userExpand(view.root().child(0));
        });

        SimpleTreeNode src = root.children().get(0);
        SimpleTreeNode docs = root.children().get(1);
        src.addChild(SimpleTreeNode.leaf(sync.scheduler(), "NewFile.java"));
        docs.setChildren(List.of(SimpleTreeNode.leaf(sync.scheduler(), "CHANGELOG.md")));
        sync.flush();

        String rendered = sync.eventLoop().call(view::render);
        assertEquals("- project\n"
                + "  - src\n"
                + "      Main.java\n"
                + "      Util.java\n"
                + "    + model\n"
                + "      NewFile.java\n"
                + "  + docs\n"
                + "  + empty\n"
                + "    pom.xml\n", rendered);
        assertEquals(ItemState.COLLAPSED,
                sync.eventLoop().call(() -> binding.stateOf(binding.itemFor(docs))));

        sync.eventLoop().run(binding::close);
        assertNull(sync.eventLoop().call(view::root));
    }

    @Test
    public void testFailingObserverIsReportedAndDrainContinues() {
        DrainStatsListener stats = sync.enableDrainStats();
        List<String> seen = new CopyOnWriteArrayList<>();
        var value = sync.newValue("a");
        value.addObserver(v -> {
            throw new IllegalStateException("expected in test");
        });
        value.addObserver(v -> seen.add(v.get()));

        value.set("b");
        sync.flush();

        assertEquals(List.of("b"), seen);
        assertEquals(1, stats.totalErrors());
    }

    @Test
    public void testWithExecutor() {
        ManualExecutor ui = new ManualExecutor();
        TreeSyncConfig config = new TreeSyncConfig();
        config.setExpandRootOnAttach(true);
        TreeSync hosted = TreeSync.withExecutor(ui, config);

        SimpleTreeNode b = SimpleTreeNode.leaf(hosted.scheduler(), "B");
        SimpleTreeNode root = SimpleTreeNode.branch(hosted.scheduler(), "A", b);
        InMemoryTreeView view = new InMemoryTreeView();
        TreeBinding<Item> binding = hosted.bind(root, view);

        assertNull(hosted.eventLoop());
        assertTrue(view.root().isExpanded());

        b.setLabel("B2");
        ui.runAll();
        assertEquals("B2", binding.itemFor(b).text());

        try {
            hosted.flush();
            fail("Expected exception");
        } catch (IllegalStateException expected) {
            // no own loop
        }
        hosted.close();
    }
}
