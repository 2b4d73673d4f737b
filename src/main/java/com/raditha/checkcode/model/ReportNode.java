package com.raditha.checkcode.model;

import java.util.List;

/**
 * A node of the analysis report tree.
 * The set of node kinds is closed; only {@link LeafNode} carries metrics and source.
 */
public sealed interface ReportNode permits DirectoryNode, FileNode, ClassNode, LeafNode {

    String name();

    /**
     * Absolute path of the directory or of the file the node was found in.
     */
    String path();

    NodeType nodeType();

    /**
     * Children in encounter order.
     */
    List<? extends ReportNode> children();
}
