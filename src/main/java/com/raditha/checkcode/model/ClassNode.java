package com.raditha.checkcode.model;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * A top-level type declaration. Classes carry no metrics of their own.
 *
 * @param name      Simple type name
 * @param qualname  Qualified name (the simple name for a top-level type)
 * @param path      Absolute path of the declaring file
 * @param range     Line span of the declaration
 * @param docstring Javadoc description, empty if none
 * @param children  Directly declared methods and constructors
 */
public record ClassNode(
        String name,
        String qualname,
        String path,
        Range range,
        String docstring,
        List<LeafNode> children) implements ReportNode {

    public ClassNode {
        for (LeafNode child : children) {
            if (child.kind() != NodeType.METHOD) {
                throw new IllegalArgumentException(
                        "class " + qualname + " can only contain methods, got " + child.kind().label());
            }
        }
        children = List.copyOf(children);
        docstring = docstring == null ? "" : docstring;
    }

    @Override
    public NodeType nodeType() {
        return NodeType.CLASS;
    }

    public ClassNode mapLeaves(UnaryOperator<LeafNode> mapper) {
        return new ClassNode(name, qualname, path, range, docstring,
                children.stream().map(mapper).toList());
    }
}
