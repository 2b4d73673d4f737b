package com.raditha.checkcode.model;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * An analysed source file.
 *
 * @param name     File name
 * @param path     Absolute file path
 * @param children Top-level classes and functions in declaration order
 */
public record FileNode(String name, String path, List<ReportNode> children) implements ReportNode {

    public FileNode {
        for (ReportNode child : children) {
            boolean allowed = child instanceof ClassNode
                    || (child instanceof LeafNode leaf && leaf.kind() == NodeType.FUNCTION);
            if (!allowed) {
                throw new IllegalArgumentException(
                        "file " + path + " cannot contain a " + child.nodeType().label());
            }
        }
        children = List.copyOf(children);
    }

    @Override
    public NodeType nodeType() {
        return NodeType.FILE;
    }

    /**
     * Copy of this file with every leaf replaced by {@code mapper}'s result.
     */
    public FileNode mapLeaves(UnaryOperator<LeafNode> mapper) {
        List<ReportNode> mapped = children.stream()
                .map(child -> child instanceof ClassNode cls
                        ? (ReportNode) cls.mapLeaves(mapper)
                        : mapper.apply((LeafNode) child))
                .toList();
        return new FileNode(name, path, mapped);
    }
}
