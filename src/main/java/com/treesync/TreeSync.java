package com.treesync;

import com.treesync.api.DrainListener;
import com.treesync.api.TreeNode;
import com.treesync.api.TreeView;
import com.treesync.binding.TreeBinding;
import com.treesync.config.TreeSyncConfig;
import com.treesync.engine.EventLoop;
import com.treesync.engine.NotificationScheduler;
import com.treesync.engine.ObservableValue;
import com.treesync.io.TreeLoader;
import com.treesync.node.SimpleTreeNode;
import com.treesync.util.CompositeDrainListener;
import com.treesync.util.DrainStatsListener;
import com.treesync.util.LoggingDrainListener;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * A high-level wrapper that wires the synchronization engine for headless or
 * toolkit use.
 * <p>
 * This class handles:
 * <ul>
 * <li>Reading a {@link TreeSyncConfig}</li>
 * <li>Starting an {@link EventLoop} as designated thread, unless the caller
 * supplies the toolkit's own executor</li>
 * <li>Creating the {@link NotificationScheduler} shared by every observable</li>
 * <li>Installing the logging diagnostic sink for failing observers</li>
 * <li>Attaching {@link TreeBinding}s on the designated thread</li>
 * </ul>
 *
 * <pre>
 * try (TreeSync sync = TreeSync.create()) {
 *     SimpleTreeNode root = sync.loadTree("tree.json");
 *     InMemoryTreeView view = new InMemoryTreeView();
 *     TreeBinding&lt;InMemoryTreeView.Item&gt; binding = sync.bind(root, view);
 *     ...
 * }
 * </pre>
 */
public final class TreeSync implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(TreeSync.class);

    private final TreeSyncConfig config;
    private final Executor host;
    private final EventLoop eventLoop;
    private final NotificationScheduler scheduler;
    private final CompositeDrainListener compositeListener = new CompositeDrainListener();

    private TreeSync(TreeSyncConfig config, Executor host, EventLoop eventLoop) {
        this.config = config.validate();
        this.host = host;
        this.eventLoop = eventLoop;
        this.scheduler = new NotificationScheduler(host);
        this.scheduler.setListener(compositeListener);
        compositeListener.addForComposite(new LoggingDrainListener(config.getErrorLogIntervalMillis()));
    }

    /**
     * Creates an instance from the classpath configuration, with its own event
     * loop.
     */
    public static TreeSync create() {
        return create(TreeSyncConfig.load());
    }

    /**
     * Creates an instance with its own event loop.
     */
    public static TreeSync create(TreeSyncConfig config) {
        config.validate();
        EventLoop loop = new EventLoop(config.getThreadName(), config.getRingBufferSize(),
                config.getWaitStrategy().create());
        log.info("TreeSync started on event loop '{}' (waitStrategy={})", config.getThreadName(),
                config.getWaitStrategy());
        return new TreeSync(config, loop, loop);
    }

    /**
     * Creates an instance from a configuration file, with its own event loop.
     */
    public static TreeSync create(Path configPath) {
        try {
            return create(TreeSyncConfig.fromFile(configPath));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load configuration from " + configPath, e);
        }
    }

    /**
     * Creates an instance driven by a toolkit's event thread, e.g.
     * {@code SwingUtilities::invokeLater}. No event loop is started; the caller
     * must then call {@link #bind} on that thread.
     */
    public static TreeSync withExecutor(Executor uiExecutor, TreeSyncConfig config) {
        return new TreeSync(config, Objects.requireNonNull(uiExecutor, "uiExecutor"), null);
    }

    /**
     * Adds a drain listener next to the logging sink.
     */
    public void addDrainListener(DrainListener listener) {
        compositeListener.addForComposite(listener);
    }

    /**
     * Enables drain statistics.
     */
    public DrainStatsListener enableDrainStats() {
        DrainStatsListener stats = new DrainStatsListener();
        compositeListener.addForComposite(stats);
        return stats;
    }

    /**
     * Binds {@code root} to {@code view}. With an own event loop the binding is
     * attached on the loop thread and this call waits for it; with a toolkit
     * executor it must be called on the toolkit thread.
     */
    public <I> TreeBinding<I> bind(TreeNode root, TreeView<I> view) {
        boolean expandRoot = config.isExpandRootOnAttach();
        if (eventLoop != null)
            return eventLoop.call(() -> TreeBinding.attach(root, view, expandRoot));
        return TreeBinding.attach(root, view, expandRoot);
    }

    /**
     * Runs a task on the designated thread.
     */
    public void runOnUiThread(Runnable task) {
        host.execute(task);
    }

    /**
     * Waits until every notification and task posted so far has been handled.
     * Only available with an own event loop.
     */
    public void flush() {
        if (eventLoop == null)
            throw new IllegalStateException("flush() requires an own event loop");
        // Two rounds: a drain posted by the first round's tasks runs in the second.
        eventLoop.flush();
        eventLoop.flush();
    }

    /** Creates a label cell bound to this instance's scheduler. */
    public <T> ObservableValue<T> newValue(T initial) {
        return new ObservableValue<>(scheduler, initial);
    }

    /** Loads a JSON tree from the classpath. */
    public SimpleTreeNode loadTree(String resource) {
        try {
            return new TreeLoader(scheduler).loadResource(resource);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load tree from " + resource, e);
        }
    }

    /** Loads a JSON tree from a file. */
    public SimpleTreeNode loadTree(Path path) {
        try {
            return new TreeLoader(scheduler).loadFile(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load tree from " + path, e);
        }
    }

    public NotificationScheduler scheduler() {
        return scheduler;
    }

    public TreeSyncConfig config() {
        return config;
    }

    /** @return the own event loop, or null when driven by a toolkit executor. */
    public EventLoop eventLoop() {
        return eventLoop;
    }

    @Override
    public void close() {
        if (eventLoop != null)
            eventLoop.close();
    }
}
