package com.raditha.checkcode.model;

import java.util.List;
import java.util.Objects;

/**
 * A function or method: the only node kind with metrics, source text and a fingerprint.
 *
 * @param kind        {@link NodeType#FUNCTION} or {@link NodeType#METHOD}
 * @param name        Simple name
 * @param qualname    Dot-joined name from the enclosing class, if any
 * @param path        Absolute path of the declaring file
 * @param range       Line span of the declaration
 * @param docstring   Javadoc description, empty if none
 * @param metrics     Structural metrics
 * @param source      Exact source lines of the declaration
 * @param fingerprint Internal similarity sketch, never serialized
 */
public record LeafNode(
        NodeType kind,
        String name,
        String qualname,
        String path,
        Range range,
        String docstring,
        Metrics metrics,
        String source,
        Fingerprint fingerprint) implements ReportNode {

    public LeafNode {
        if (!kind.isLeaf()) {
            throw new IllegalArgumentException("leaf kind must be function or method, got " + kind.label());
        }
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(range, "range");
        Objects.requireNonNull(metrics, "metrics");
        qualname = qualname == null ? "" : qualname;
        docstring = docstring == null ? "" : docstring;
        source = source == null ? "" : source;
        fingerprint = fingerprint == null ? Fingerprint.EMPTY : fingerprint;
    }

    @Override
    public NodeType nodeType() {
        return kind;
    }

    @Override
    public List<ReportNode> children() {
        return List.of();
    }

    /**
     * Name other units use to refer to this one.
     */
    public String displayName() {
        return qualname.isEmpty() ? name : qualname;
    }

    public LeafNode withDuplication(Duplication duplication) {
        return new LeafNode(kind, name, qualname, path, range, docstring,
                metrics.withDuplication(duplication), source, fingerprint);
    }
}
