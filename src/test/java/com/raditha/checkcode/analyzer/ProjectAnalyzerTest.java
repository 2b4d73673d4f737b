package com.raditha.checkcode.analyzer;

import com.raditha.checkcode.config.AnalysisConfig;
import com.raditha.checkcode.extraction.SourceParseException;
import com.raditha.checkcode.model.ClassNode;
import com.raditha.checkcode.model.DirectoryNode;
import com.raditha.checkcode.model.Duplication;
import com.raditha.checkcode.model.FileNode;
import com.raditha.checkcode.model.LeafNode;
import com.raditha.checkcode.model.NodeType;
import com.raditha.checkcode.tree.TreeWalker;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * End-to-end tests: source files in, pruned report tree out.
 */
class ProjectAnalyzerTest {

    @TempDir
    Path tempDir;

    private static final String SUM_TEMPLATE = """
            public class %s {
                public int compute(int[] values) {
                    int total = %d;
                    for (int i = 0; i < values.length; i++) {
                        if (values[i] > 0) {
                            total += values[i];
                        }
                    }
                    return total;
                }
            }
            """;

    private Path write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @Test
    void testSingleFileChainIsPrunedToPackage() throws Exception {
        Path file = write("a/b/pkg/M.java", """
                class M {
                    void f(int x) {
                        if (x > 0) {
                            System.out.println(x);
                        }
                    }
                }
                """);

        DirectoryNode root = new ProjectAnalyzer().analyze(List.of(file));

        assertEquals("pkg", root.name());
        assertEquals(file.getParent().toString(), root.path());
        FileNode m = assertInstanceOf(FileNode.class, root.children().get(0));
        assertEquals("M.java", m.name());
        ClassNode cls = assertInstanceOf(ClassNode.class, m.children().get(0));
        LeafNode f = cls.children().get(0);
        assertEquals("f", f.name());
        assertEquals(NodeType.METHOD, f.kind());
        assertEquals(2, f.metrics().cyclomaticComplexity());
        assertNull(f.metrics().duplication());
    }

    @Test
    void testNearDuplicatesAcrossFilesReferenceEachOther() throws Exception {
        Path alpha = write("src/Alpha.java", SUM_TEMPLATE.formatted("Alpha", 0));
        Path beta = write("src/Beta.java", SUM_TEMPLATE.formatted("Beta", 1));

        DirectoryNode root = new ProjectAnalyzer().analyze(List.of(alpha, beta));

        assertEquals("src", root.name());
        List<LeafNode> leaves = TreeWalker.leaves(root.children());
        assertEquals(2, leaves.size());

        Duplication alphaDup = leaves.get(0).metrics().duplication();
        Duplication betaDup = leaves.get(1).metrics().duplication();
        assertNotNull(alphaDup);
        assertNotNull(betaDup);
        assertEquals("Beta.compute", alphaDup.other());
        assertEquals("Alpha.compute", betaDup.other());
        assertEquals(9, alphaDup.linesOther());
        assertTrue(alphaDup.score() >= 0.99 && alphaDup.score() < 1.0, "score " + alphaDup.score());
        assertEquals(alphaDup.score(), betaDup.score());
    }

    @Test
    void testDuplicationCanBeDisabled() throws Exception {
        Path alpha = write("src/Alpha.java", SUM_TEMPLATE.formatted("Alpha", 0));
        Path beta = write("src/Beta.java", SUM_TEMPLATE.formatted("Beta", 1));
        AnalysisConfig config = AnalysisConfig.defaults().withDuplication(false);

        DirectoryNode root = new ProjectAnalyzer(config, ProgressListener.NONE).analyze(List.of(alpha, beta));

        assertTrue(TreeWalker.leaves(root.children()).stream().noneMatch(leaf -> leaf.metrics().hasDuplication()));
    }

    @Test
    void testUnrelatedMethodsGetNoDuplication() throws Exception {
        Path alpha = write("src/Alpha.java", SUM_TEMPLATE.formatted("Alpha", 0));
        Path other = write("src/Other.java", """
                public class Other {
                    public String describe(String name, String title) {
                        StringBuilder builder = new StringBuilder();
                        builder.append(title).append(' ').append(name);
                        while (builder.length() < 40) {
                            builder.append('.');
                        }
                        return builder.toString().trim();
                    }
                }
                """);

        DirectoryNode root = new ProjectAnalyzer().analyze(List.of(alpha, other));

        assertTrue(TreeWalker.leaves(root.children()).stream().noneMatch(leaf -> leaf.metrics().hasDuplication()));
    }

    @Test
    void testProgressIsReportedPerFileThenPerUnit() throws Exception {
        Path alpha = write("src/Alpha.java", SUM_TEMPLATE.formatted("Alpha", 0));
        Path beta = write("src/Beta.java", SUM_TEMPLATE.formatted("Beta", 1));
        ProgressListener listener = mock(ProgressListener.class);

        new ProjectAnalyzer(AnalysisConfig.defaults(), listener).analyze(List.of(alpha, beta));

        verify(listener).onProgress(1, 2, ProjectAnalyzer.PROGRESS_LABEL);
        verify(listener).onProgress(2, 2, ProjectAnalyzer.PROGRESS_LABEL);
        verify(listener).onProgress(2, 2, DuplicationAnalyzer.PROGRESS_LABEL);
    }

    @Test
    void testParseErrorAbortsRun() throws IOException {
        Path good = write("src/Alpha.java", SUM_TEMPLATE.formatted("Alpha", 0));
        Path bad = write("src/Bad.java", "class Bad { void m( }");
        ProjectAnalyzer analyzer = new ProjectAnalyzer();

        SourceParseException ex = assertThrows(SourceParseException.class,
                () -> analyzer.analyze(List.of(good, bad)));
        assertEquals(bad, ex.getFile());
    }

    @Test
    void testParallelRunMatchesSequentialRun() throws Exception {
        Path alpha = write("src/Alpha.java", SUM_TEMPLATE.formatted("Alpha", 0));
        Path beta = write("src/Beta.java", SUM_TEMPLATE.formatted("Beta", 1));
        Path gamma = write("src/Gamma.java", SUM_TEMPLATE.formatted("Gamma", 2));
        List<Path> files = List.of(alpha, beta, gamma);

        DirectoryNode sequential = new ProjectAnalyzer().analyze(files);
        DirectoryNode parallel = new ProjectAnalyzer(AnalysisConfig.defaults().withParallelism(3),
                ProgressListener.NONE).analyze(files);

        assertEquals(sequential, parallel);
    }
}
