package com.raditha.checkcode.tree;

import com.raditha.checkcode.model.DirectoryNode;

/**
 * Collapses leading directories that contain nothing but one sub-directory.
 * <p>
 * Starting at the given node, keep walking down while the current directory
 * has exactly one child and that child is a directory. The first directory
 * that forks into several children or directly contains a file becomes the
 * new root. Pruning a pruned tree returns it unchanged.
 */
public class TreePruner {

    public DirectoryNode prune(DirectoryNode root) {
        DirectoryNode current = root;
        while (current.children().size() == 1 && current.children().get(0) instanceof DirectoryNode only) {
            current = only;
        }
        return current;
    }
}
