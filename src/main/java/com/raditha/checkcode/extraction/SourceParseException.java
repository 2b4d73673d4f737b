package com.raditha.checkcode.extraction;

import com.github.javaparser.Problem;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A source file could not be parsed into a syntax tree.
 * Analysis runs fail fast on the first such file.
 */
public class SourceParseException extends RuntimeException {

    private final transient Path file;
    private final List<String> problems;

    public SourceParseException(Path file, List<Problem> problems) {
        super(buildMessage(file, problems));
        this.file = file;
        this.problems = problems.stream().map(Problem::getVerboseMessage).toList();
    }

    public Path getFile() {
        return file;
    }

    /**
     * Parser diagnostics, one entry per problem.
     */
    public List<String> getProblems() {
        return problems;
    }

    private static String buildMessage(Path file, List<Problem> problems) {
        if (problems.isEmpty()) {
            return "Failed to parse " + file;
        }
        return "Failed to parse " + file + ": " + problems.stream()
                .map(Problem::getVerboseMessage)
                .collect(Collectors.joining("; "));
    }
}
