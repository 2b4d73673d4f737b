package com.raditha.checkcode.report;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.raditha.checkcode.model.ClassNode;
import com.raditha.checkcode.model.DirectoryNode;
import com.raditha.checkcode.model.FileNode;
import com.raditha.checkcode.model.LeafNode;
import com.raditha.checkcode.model.Metrics;
import com.raditha.checkcode.model.NodeType;
import com.raditha.checkcode.model.ReportNode;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes a report tree as JSON.
 * Nodes are mapped to DTOs first so every node has the same field set and
 * internal state such as fingerprints never reaches the output.
 */
public class ReportWriter {

    private static final ObjectMapper mapper = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Serialized form of one node. Fields that do not apply to a kind are null.
     */
    @JsonPropertyOrder({ "name", "nodetype", "path", "qualname", "lineno", "end_lineno",
            "docstring", "source", "metrics", "children" })
    public record NodeDTO(
            String name,
            NodeType nodetype,
            String path,
            @Nullable String qualname,
            @Nullable Integer lineno,
            @Nullable Integer endLineno,
            @Nullable String docstring,
            @Nullable String source,
            @Nullable Metrics metrics,
            List<NodeDTO> children) {
    }

    /**
     * Map a tree to DTOs.
     */
    public NodeDTO toDTO(ReportNode node) {
        List<NodeDTO> children = node.children().stream().map(this::toDTO).toList();
        if (node instanceof LeafNode leaf) {
            return new NodeDTO(leaf.name(), leaf.kind(), leaf.path(), leaf.qualname(),
                    leaf.range().startLine(), leaf.range().endLine(), leaf.docstring(),
                    leaf.source(), leaf.metrics(), children);
        }
        if (node instanceof ClassNode cls) {
            return new NodeDTO(cls.name(), NodeType.CLASS, cls.path(), cls.qualname(),
                    cls.range().startLine(), cls.range().endLine(), cls.docstring(),
                    null, null, children);
        }
        if (node instanceof FileNode file) {
            return new NodeDTO(file.name(), NodeType.FILE, file.path(), null, null, null, null, null, null, children);
        }
        DirectoryNode dir = (DirectoryNode) node;
        return new NodeDTO(dir.name(), NodeType.DIRECTORY, dir.path(), null, null, null, null, null, null, children);
    }

    public String toJson(ReportNode root) throws IOException {
        return mapper.writeValueAsString(toDTO(root));
    }

    /**
     * Write the tree to {@code output} as UTF-8 JSON, creating parent directories.
     */
    public void write(ReportNode root, Path output) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, toJson(root) + System.lineSeparator());
    }
}
