package com.raditha.checkcode.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.checkcode.model.ClassNode;
import com.raditha.checkcode.model.DirectoryNode;
import com.raditha.checkcode.model.Duplication;
import com.raditha.checkcode.model.FileNode;
import com.raditha.checkcode.model.Fingerprint;
import com.raditha.checkcode.model.LeafNode;
import com.raditha.checkcode.model.Metrics;
import com.raditha.checkcode.model.NodeType;
import com.raditha.checkcode.model.Range;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReportWriterTest {

    private final ReportWriter writer = new ReportWriter();
    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    private static DirectoryNode sampleTree() {
        LeafNode run = new LeafNode(NodeType.METHOD, "run", "Job.run", "/p/Job.java", new Range(3, 7),
                "Runs the job.", new Metrics(5, 3, 6, 1, 2, 1).withDuplication(Duplication.of(0.9876, "Task.run", 6)),
                "void run(int n) {\n}\n", Fingerprint.of(11, 22, 33));
        LeafNode stop = new LeafNode(NodeType.METHOD, "stop", "Job.stop", "/p/Job.java", new Range(8, 9),
                "", new Metrics(2, 1, 0, 0, 1, 0), "void stop() {\n}\n", Fingerprint.EMPTY);
        ClassNode job = new ClassNode("Job", "Job", "/p/Job.java", new Range(1, 10), "A job.", List.of(run, stop));
        FileNode file = new FileNode("Job.java", "/p/Job.java", List.of(job));
        return new DirectoryNode("p", "/p", List.of(file));
    }

    @Test
    void testFieldNamesAndValues() throws IOException {
        JsonNode root = mapper.readTree(writer.toJson(sampleTree()));

        assertEquals("p", root.get("name").asText());
        assertEquals("directory", root.get("nodetype").asText());
        assertTrue(root.get("metrics").isNull());
        assertTrue(root.get("lineno").isNull());

        JsonNode file = root.get("children").get(0);
        assertEquals("file", file.get("nodetype").asText());
        assertEquals("/p/Job.java", file.get("path").asText());

        JsonNode cls = file.get("children").get(0);
        assertEquals("class", cls.get("nodetype").asText());
        assertEquals(1, cls.get("lineno").asInt());
        assertEquals(10, cls.get("end_lineno").asInt());
        assertEquals("A job.", cls.get("docstring").asText());
        assertTrue(cls.get("metrics").isNull());
        assertTrue(cls.get("source").isNull());

        JsonNode run = cls.get("children").get(0);
        assertEquals("method", run.get("nodetype").asText());
        assertEquals("Job.run", run.get("qualname").asText());
        assertEquals("void run(int n) {\n}\n", run.get("source").asText());
        assertTrue(run.get("children").isArray());
        assertEquals(0, run.get("children").size());

        JsonNode metrics = run.get("metrics");
        assertEquals(5, metrics.get("lines").asInt());
        assertEquals(3, metrics.get("statements").asInt());
        assertEquals(6, metrics.get("expressions").asInt());
        assertEquals(1, metrics.get("expression_statements").asInt());
        assertEquals(2, metrics.get("cyclomatic_complexity").asInt());
        assertEquals(1, metrics.get("parameters").asInt());
        assertEquals(0.988, metrics.get("duplication").get("score").asDouble());
        assertEquals("Task.run", metrics.get("duplication").get("other").asText());
        assertEquals(6, metrics.get("duplication").get("lines_other").asInt());

        JsonNode stop = cls.get("children").get(1);
        assertTrue(stop.get("metrics").get("duplication").isNull());
    }

    @Test
    void testFingerprintIsNeverWritten() throws IOException {
        String json = writer.toJson(sampleTree());

        assertFalse(json.contains("fingerprint"));
        assertFalse(json.contains("has_duplication"));
    }

    @Test
    void testFieldOrder() throws IOException {
        JsonNode root = mapper.readTree(writer.toJson(sampleTree()));
        List<String> names = new ArrayList<>();
        root.fieldNames().forEachRemaining(names::add);

        assertEquals(List.of("name", "nodetype", "path", "qualname", "lineno", "end_lineno",
                "docstring", "source", "metrics", "children"), names);
    }

    @Test
    void testWriteCreatesParentDirectories() throws IOException {
        Path output = tempDir.resolve("out/nested/result.json");

        writer.write(sampleTree(), output);

        assertTrue(Files.exists(output));
        assertEquals("p", mapper.readTree(output.toFile()).get("name").asText());
    }
}
