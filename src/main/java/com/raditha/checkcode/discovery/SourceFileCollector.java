package com.raditha.checkcode.discovery;

import com.raditha.checkcode.config.AnalysisConfig;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Expands command line paths into the list of source files to analyse.
 * <p>
 * Each argument is resolved to its real location first, so a link given on
 * the command line is honoured. Directories are then walked recursively
 * without following links, and links met during the walk are skipped. Every
 * file is keyed on its real path and appears once, in the order it was first
 * reached. A path that is missing, or is neither a directory nor a source
 * file, is reported and left out.
 */
public class SourceFileCollector {

    private static final Logger logger = LoggerFactory.getLogger(SourceFileCollector.class);

    private final AnalysisConfig config;

    public SourceFileCollector(AnalysisConfig config) {
        this.config = config;
    }

    /**
     * Collect source files under the given paths.
     *
     * @param paths Files or directories as typed by the user
     * @return Deduplicated real file paths
     * @throws IOException if a directory cannot be walked
     */
    public List<Path> collect(List<String> paths) throws IOException {
        Set<Path> files = new LinkedHashSet<>();

        for (String raw : paths) {
            Path path = resolve(raw);
            if (path == null) {
                continue;
            }
            if (Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
                collectDirectory(path, files);
            } else if (isSourceFile(path)) {
                addIfIncluded(path, files);
            } else {
                logger.warn("{} is neither a directory nor a {} file", path, config.sourceSuffix());
            }
        }

        return new ArrayList<>(files);
    }

    private @Nullable Path resolve(String raw) {
        Path path = Path.of(raw).toAbsolutePath().normalize();
        try {
            return path.toRealPath();
        } catch (NoSuchFileException e) {
            logger.warn("{} does not exist", path);
        } catch (IOException e) {
            logger.warn("Cannot resolve {}: {}", path, e.getMessage());
        }
        return null;
    }

    private void collectDirectory(Path directory, Set<Path> files) throws IOException {
        List<Path> found;
        try (Stream<Path> walk = Files.walk(directory)) {
            found = walk.filter(this::isSourceFile).sorted().toList();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        for (Path file : found) {
            addIfIncluded(file, files);
        }
    }

    private void addIfIncluded(Path file, Set<Path> files) {
        if (config.shouldExclude(file)) {
            logger.debug("Excluded by pattern: {}", file);
            return;
        }
        files.add(file);
    }

    private boolean isSourceFile(Path path) {
        return Files.isRegularFile(path, LinkOption.NOFOLLOW_LINKS)
                && path.getFileName() != null
                && path.getFileName().toString().endsWith(config.sourceSuffix());
    }
}
