package com.treesync.io;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.treesync.view.InMemoryTreeView;

import java.util.ArrayList;
import java.util.List;

/**
 * Captures the visible state of an {@link InMemoryTreeView} as JSON.
 *
 * <p>
 * Useful for:
 * <ul>
 * <li><b>Diagnostics:</b> Logging what the user currently sees.</li>
 * <li><b>Golden tests:</b> Comparing a view against an expected document.</li>
 * </ul>
 */
public final class ViewSnapshot {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private ViewSnapshot() {
        // Utility class
    }

    /** Serialized form of one item. */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record ItemState(String text, boolean hasChildren, boolean expanded, List<ItemState> children) {
    }

    /**
     * @return The state tree of the view, or null if it has no root.
     */
    public static ItemState capture(InMemoryTreeView view) {
        return view.root() == null ? null : capture(view.root());
    }

    private static ItemState capture(InMemoryTreeView.Item item) {
        List<ItemState> children = new ArrayList<>(item.children().size());
        for (InMemoryTreeView.Item child : item.children())
            children.add(capture(child));
        return new ItemState(item.text(), item.hasChildren(), item.isExpanded(), children);
    }

    /**
     * Serializes the view to indented JSON.
     */
    public static String toJson(InMemoryTreeView view) {
        try {
            return MAPPER.writeValueAsString(capture(view));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize view", e);
        }
    }
}
