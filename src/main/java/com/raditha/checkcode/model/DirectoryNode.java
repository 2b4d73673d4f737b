package com.raditha.checkcode.model;

import java.util.List;

/**
 * A directory holding files and sub-directories.
 *
 * @param name     Last path component ("/" for the filesystem root)
 * @param path     Absolute directory path
 * @param children Files and sub-directories in encounter order
 */
public record DirectoryNode(String name, String path, List<ReportNode> children) implements ReportNode {

    public DirectoryNode {
        for (ReportNode child : children) {
            if (!(child instanceof DirectoryNode) && !(child instanceof FileNode)) {
                throw new IllegalArgumentException(
                        "directory " + path + " cannot contain a " + child.nodeType().label());
            }
        }
        children = List.copyOf(children);
    }

    @Override
    public NodeType nodeType() {
        return NodeType.DIRECTORY;
    }
}
