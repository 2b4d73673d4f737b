package com.raditha.checkcode.extraction;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.javadoc.Javadoc;
import com.raditha.checkcode.fingerprint.Fingerprinter;
import com.raditha.checkcode.fingerprint.SourceTokenizer;
import com.raditha.checkcode.fingerprint.SourceTokenizer.LineIndex;
import com.raditha.checkcode.metrics.MetricExtractor;
import com.raditha.checkcode.model.ClassNode;
import com.raditha.checkcode.model.FileNode;
import com.raditha.checkcode.model.Fingerprint;
import com.raditha.checkcode.model.LeafNode;
import com.raditha.checkcode.model.Metrics;
import com.raditha.checkcode.model.NodeType;
import com.raditha.checkcode.model.Range;
import com.raditha.checkcode.model.ReportNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses Java source files and turns them into file nodes.
 * <p>
 * Every top-level type becomes a class node; methods and constructors
 * declared directly in it become method leaves with metrics, source text and
 * a fingerprint. Member types, initializers and fields produce no nodes, and
 * anything declared inside a method body only contributes to that method's
 * counts.
 */
public class UnitExtractor {

    private final JavaParser parser;
    private final MetricExtractor metricExtractor;
    private final SourceTokenizer tokenizer;
    private final Fingerprinter fingerprinter;

    /**
     * Create extractor with default fingerprint settings.
     */
    public UnitExtractor() {
        this(new Fingerprinter());
    }

    public UnitExtractor(Fingerprinter fingerprinter) {
        ParserConfiguration configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setStoreTokens(true);
        this.parser = new JavaParser(configuration);
        this.metricExtractor = new MetricExtractor();
        this.tokenizer = new SourceTokenizer();
        this.fingerprinter = fingerprinter;
    }

    /**
     * Read and analyse one source file.
     * Bytes that are not valid UTF-8 are replaced rather than rejected.
     *
     * @param file Absolute path of the file
     * @return File node with its classes and methods
     * @throws IOException           if the file cannot be read
     * @throws SourceParseException  if the file is not valid Java
     */
    public FileNode analyzeFile(Path file) throws IOException {
        String text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        return analyzeSource(text, file);
    }

    /**
     * Analyse source text as if it had been read from {@code file}.
     *
     * @throws SourceParseException if the text is not valid Java
     */
    public FileNode analyzeSource(String text, Path file) {
        ParseResult<CompilationUnit> result = parser.parse(text);
        Optional<CompilationUnit> parsed = result.getResult();
        if (!result.isSuccessful() || parsed.isEmpty()) {
            throw new SourceParseException(file, result.getProblems());
        }
        CompilationUnit cu = parsed.get();
        List<String> lines = splitLines(text);
        LineIndex tokens = tokenizer.index(cu);
        String path = file.toString();

        List<ReportNode> children = new ArrayList<>();
        for (TypeDeclaration<?> type : cu.getTypes()) {
            children.add(analyzeType(type, tokens, lines, path));
        }

        Path fileName = file.getFileName();
        return new FileNode(fileName != null ? fileName.toString() : path, path, children);
    }

    private ClassNode analyzeType(TypeDeclaration<?> type, LineIndex tokens, List<String> lines, String path) {
        String typeName = type.getNameAsString();

        List<LeafNode> methods = new ArrayList<>();
        for (BodyDeclaration<?> member : type.getMembers()) {
            if (member instanceof CallableDeclaration<?> callable) {
                methods.add(analyzeCallable(callable, typeName, tokens, lines, path));
            }
        }

        return new ClassNode(
                typeName,
                typeName,
                path,
                rangeOf(type),
                docstring(type.getJavadoc()),
                methods);
    }

    private LeafNode analyzeCallable(CallableDeclaration<?> callable, String typeName,
            LineIndex tokens, List<String> lines, String path) {
        Range range = rangeOf(callable);
        Metrics metrics = metricExtractor.extract(callable);
        Fingerprint fingerprint = fingerprinter.fingerprint(tokenizer.tokenize(tokens, range));

        return new LeafNode(
                NodeType.METHOD,
                callable.getNameAsString(),
                typeName + "." + callable.getNameAsString(),
                path,
                range,
                docstring(callable.getJavadoc()),
                metrics,
                sourceOf(lines, range),
                fingerprint);
    }

    private static Range rangeOf(Node node) {
        return node.getRange()
                .map(Range::from)
                .orElseThrow(() -> new IllegalStateException("Parsed node without a source range: " + node));
    }

    private static String docstring(Optional<Javadoc> javadoc) {
        return javadoc.map(doc -> doc.getDescription().toText().trim()).orElse("");
    }

    /**
     * Exact source lines of a range, terminators included.
     */
    static String sourceOf(List<String> lines, Range range) {
        int from = Math.min(range.startLine() - 1, lines.size());
        int to = Math.min(range.endLine(), lines.size());
        return String.join("", lines.subList(from, to));
    }

    /**
     * Split text into lines keeping "\n", "\r\n" or "\r" at the end of each.
     */
    static List<String> splitLines(String text) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r') {
                int end = (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') ? i + 2 : i + 1;
                lines.add(text.substring(start, end));
                start = end;
                i = end;
            } else {
                i++;
            }
        }
        if (start < text.length()) {
            lines.add(text.substring(start));
        }
        return lines;
    }
}
