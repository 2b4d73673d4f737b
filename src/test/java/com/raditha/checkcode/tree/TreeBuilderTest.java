package com.raditha.checkcode.tree;

import com.raditha.checkcode.model.DirectoryNode;
import com.raditha.checkcode.model.FileNode;
import com.raditha.checkcode.model.NodeType;
import com.raditha.checkcode.model.ReportNode;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TreeBuilderTest {

    private final TreeBuilder builder = new TreeBuilder("/work");

    private static FileNode file(String path) {
        return new FileNode(Path.of(path).getFileName().toString(), path, List.of());
    }

    private static DirectoryNode dir(ReportNode node) {
        return assertInstanceOf(DirectoryNode.class, node);
    }

    @Test
    void testSyntheticRootAndFilesystemRoot() {
        DirectoryNode root = builder.build(List.of(file("/a/M.java")));

        assertEquals(TreeBuilder.ROOT_NAME, root.name());
        assertEquals("/work", root.path());

        DirectoryNode fsRoot = dir(root.children().get(0));
        assertEquals("/", fsRoot.name());
        assertEquals("/", fsRoot.path());

        DirectoryNode a = dir(fsRoot.children().get(0));
        assertEquals("a", a.name());
        assertEquals("/a", a.path());
        assertEquals(NodeType.FILE, a.children().get(0).nodeType());
    }

    @Test
    void testSharedDirectoriesAreCreatedOnce() {
        DirectoryNode root = builder.build(List.of(
                file("/p/x/One.java"),
                file("/p/y/Two.java"),
                file("/p/x/Three.java")));

        DirectoryNode p = dir(dir(root.children().get(0)).children().get(0));
        assertEquals(2, p.children().size());

        DirectoryNode x = dir(p.children().get(0));
        DirectoryNode y = dir(p.children().get(1));
        assertEquals("x", x.name());
        assertEquals("y", y.name());
        assertEquals(List.of("One.java", "Three.java"), x.children().stream().map(ReportNode::name).toList());
        assertEquals(List.of("Two.java"), y.children().stream().map(ReportNode::name).toList());
    }

    @Test
    void testFilesAndDirectoriesKeepEncounterOrder() {
        DirectoryNode root = builder.build(List.of(
                file("/p/Z.java"),
                file("/p/sub/A.java"),
                file("/p/B.java")));

        DirectoryNode p = dir(dir(root.children().get(0)).children().get(0));
        assertEquals(List.of("Z.java", "sub", "B.java"), p.children().stream().map(ReportNode::name).toList());
    }

    @Test
    void testEmptyInputGivesBareRoot() {
        DirectoryNode root = builder.build(List.of());

        assertEquals(TreeBuilder.ROOT_NAME, root.name());
        assertTrue(root.children().isEmpty());
    }

    @Test
    void testBuildsAreIndependent() {
        builder.build(List.of(file("/p/One.java")));
        DirectoryNode second = builder.build(List.of(file("/p/Two.java")));

        DirectoryNode p = dir(dir(second.children().get(0)).children().get(0));
        assertEquals(List.of("Two.java"), p.children().stream().map(ReportNode::name).toList());
    }

    @Test
    void testPrefixes() {
        assertEquals(
                List.of(Path.of("/"), Path.of("/a"), Path.of("/a/b")),
                TreeBuilder.prefixes(Path.of("/a/b")));
    }
}
