package com.treesync.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a JSON tree.
 *
 * <pre>
 * { "tree": { "label": "A", "children": [ { "label": "B", "leaf": true } ] } }
 * </pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TreeDefinition {
    private NodeDef tree;

    /** Definition of a single node and its subtree. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class NodeDef {
        private String label;
        /** Explicit leaf flag; when absent, a node without "children" is a leaf. */
        private Boolean leaf;
        private List<NodeDef> children;

        public boolean resolveLeaf() {
            return leaf != null ? leaf : children == null;
        }
    }
}
