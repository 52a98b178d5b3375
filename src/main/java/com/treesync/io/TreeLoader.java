package com.treesync.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.treesync.engine.NotificationScheduler;
import com.treesync.node.SimpleTreeNode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds {@link SimpleTreeNode} hierarchies from JSON tree definitions.
 *
 * All nodes of a loaded tree share the given scheduler.
 */
public final class TreeLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final NotificationScheduler scheduler;

    public TreeLoader(NotificationScheduler scheduler) {
        this.scheduler = scheduler;
    }

    /** Parses a JSON file into a node tree. */
    public SimpleTreeNode loadFile(Path path) throws IOException {
        return load(Files.readString(path));
    }

    /** Parses a classpath resource into a node tree. */
    public SimpleTreeNode loadResource(String resource) throws IOException {
        try (InputStream in = TreeLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IOException("Resource not found: " + resource);
            return build(MAPPER.readValue(in, TreeDefinition.class));
        }
    }

    /** Parses a JSON string into a node tree. */
    public SimpleTreeNode load(String json) throws IOException {
        return build(MAPPER.readValue(json, TreeDefinition.class));
    }

    /**
     * Builds a node tree from a parsed definition.
     *
     * @throws IllegalArgumentException if the definition has no tree, a node
     *                                  has no label, or a leaf declares
     *                                  children.
     */
    public SimpleTreeNode build(TreeDefinition def) {
        if (def == null || def.getTree() == null)
            throw new IllegalArgumentException("Missing 'tree' key");
        return build(def.getTree(), "tree");
    }

    private SimpleTreeNode build(TreeDefinition.NodeDef nd, String path) {
        if (nd.getLabel() == null)
            throw new IllegalArgumentException("Missing 'label' at " + path);

        if (nd.resolveLeaf()) {
            if (nd.getChildren() != null && !nd.getChildren().isEmpty())
                throw new IllegalArgumentException("Leaf '" + nd.getLabel() + "' declares children at " + path);
            return SimpleTreeNode.leaf(scheduler, nd.getLabel());
        }

        List<SimpleTreeNode> children = new ArrayList<>();
        if (nd.getChildren() != null) {
            for (int i = 0; i < nd.getChildren().size(); i++)
                children.add(build(nd.getChildren().get(i), path + ".children[" + i + "]"));
        }
        return SimpleTreeNode.branch(scheduler, nd.getLabel(), children.toArray(new SimpleTreeNode[0]));
    }
}
