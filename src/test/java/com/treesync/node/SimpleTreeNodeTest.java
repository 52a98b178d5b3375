package com.treesync.node;

import com.treesync.api.TreeNode;
import com.treesync.engine.ManualExecutor;
import com.treesync.engine.NotificationScheduler;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class SimpleTreeNodeTest {

    private ManualExecutor ui;
    private NotificationScheduler scheduler;

    @Before
    public void setUp() {
        ui = new ManualExecutor();
        scheduler = new NotificationScheduler(ui);
    }

    @Test
    public void testLeafAndBranch() {
        SimpleTreeNode leaf = SimpleTreeNode.leaf(scheduler, "file");
        SimpleTreeNode empty = SimpleTreeNode.branch(scheduler, "dir");
        SimpleTreeNode root = SimpleTreeNode.branch(scheduler, "root", leaf, empty);

        assertTrue(leaf.isLeaf());
        assertFalse(empty.isLeaf());
        assertTrue(empty.children().isEmpty());
        assertEquals(List.of(leaf, empty), root.children());
        assertEquals("root", root.label().get());
    }

    @Test(expected = IllegalStateException.class)
    public void testLeafRejectsChildren() {
        SimpleTreeNode leaf = SimpleTreeNode.leaf(scheduler, "file");
        leaf.addChild(SimpleTreeNode.leaf(scheduler, "x"));
    }

    @Test
    public void testChildrenReturnsSnapshot() {
        SimpleTreeNode a = SimpleTreeNode.leaf(scheduler, "a");
        SimpleTreeNode root = SimpleTreeNode.branch(scheduler, "root", a);
        List<SimpleTreeNode> before = root.children();

        root.addChild(SimpleTreeNode.leaf(scheduler, "b"));

        assertEquals(1, before.size());
        assertEquals(2, root.children().size());
    }

    @Test
    public void testStructuralChangesCoalesceIntoOneNotification() {
        SimpleTreeNode root = SimpleTreeNode.branch(scheduler, "root");
        List<TreeNode> fired = new ArrayList<>();
        root.childrenChanged().addObserver(fired::add);

        SimpleTreeNode a = SimpleTreeNode.leaf(scheduler, "a");
        root.addChild(a);
        root.addChild(0, SimpleTreeNode.leaf(scheduler, "b"));
        root.removeChild(a);

        assertTrue("Delivery is deferred", fired.isEmpty());
        ui.runAll();

        assertEquals(List.of(root), fired);
        assertEquals("b", root.children().get(0).label().get());
    }

    @Test
    public void testRemovingAbsentChildFiresNothing() {
        SimpleTreeNode root = SimpleTreeNode.branch(scheduler, "root");
        List<TreeNode> fired = new ArrayList<>();
        root.childrenChanged().addObserver(fired::add);

        assertFalse(root.removeChild(SimpleTreeNode.leaf(scheduler, "stranger")));
        assertEquals(0, ui.queued());
        assertTrue(fired.isEmpty());
    }

    @Test
    public void testSetChildrenReplacesAll() {
        SimpleTreeNode root = SimpleTreeNode.branch(scheduler, "root",
                SimpleTreeNode.leaf(scheduler, "old"));
        SimpleTreeNode x = SimpleTreeNode.leaf(scheduler, "x");
        SimpleTreeNode y = SimpleTreeNode.leaf(scheduler, "y");

        root.setChildren(List.of(x, y));

        assertEquals(List.of(x, y), root.children());
    }

    @Test
    public void testSetLabel() {
        SimpleTreeNode node = SimpleTreeNode.leaf(scheduler, "before");
        List<String> seen = new ArrayList<>();
        node.label().addObserver(cell -> seen.add(cell.get()));

        node.setLabel("after");
        node.setLabel("after");
        ui.runAll();

        assertEquals(List.of("after"), seen);
    }
}
