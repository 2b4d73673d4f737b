package com.raditha.checkcode.tree;

import com.raditha.checkcode.model.LeafNode;
import com.raditha.checkcode.model.ReportNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Iterative traversals over report trees.
 */
public final class TreeWalker {

    private TreeWalker() {
    }

    /**
     * All leaves under the given roots, in pre-order.
     * Uses an explicit stack so deep trees cannot overflow the call stack.
     */
    public static List<LeafNode> leaves(List<? extends ReportNode> roots) {
        List<LeafNode> leaves = new ArrayList<>();
        Deque<ReportNode> stack = new ArrayDeque<>();
        for (int i = roots.size() - 1; i >= 0; i--) {
            stack.push(roots.get(i));
        }
        while (!stack.isEmpty()) {
            ReportNode node = stack.pop();
            if (node instanceof LeafNode leaf) {
                leaves.add(leaf);
                continue;
            }
            List<? extends ReportNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return leaves;
    }

    /**
     * Number of nodes in the tree rooted at {@code root}, root included.
     */
    public static int count(ReportNode root) {
        int count = 0;
        Deque<ReportNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            ReportNode node = stack.pop();
            count++;
            for (ReportNode child : node.children()) {
                stack.push(child);
            }
        }
        return count;
    }
}
