package com.raditha.checkcode.analyzer;

import com.raditha.checkcode.config.AnalysisConfig;
import com.raditha.checkcode.extraction.UnitExtractor;
import com.raditha.checkcode.filter.JaccardPreFilter;
import com.raditha.checkcode.fingerprint.Fingerprinter;
import com.raditha.checkcode.model.DirectoryNode;
import com.raditha.checkcode.model.Duplication;
import com.raditha.checkcode.model.FileNode;
import com.raditha.checkcode.model.LeafNode;
import com.raditha.checkcode.tree.TreeBuilder;
import com.raditha.checkcode.tree.TreePruner;
import com.raditha.checkcode.tree.TreeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Main orchestrator for one analysis run.
 * Coordinates extraction, duplicate matching, tree assembly and pruning.
 */
public class ProjectAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(ProjectAnalyzer.class);

    public static final String PROGRESS_LABEL = "analyse";

    private final AnalysisConfig config;
    private final UnitExtractor extractor;
    private final DuplicationAnalyzer duplicationAnalyzer;
    private final TreeBuilder treeBuilder;
    private final TreePruner treePruner;
    private final ProgressListener progress;

    /**
     * Create analyzer with default configuration and no progress output.
     */
    public ProjectAnalyzer() {
        this(AnalysisConfig.defaults(), ProgressListener.NONE);
    }

    public ProjectAnalyzer(AnalysisConfig config, ProgressListener progress) {
        this(config, progress, new TreeBuilder());
    }

    /**
     * @param config      Analysis configuration
     * @param progress    Receives per-file and per-row progress
     * @param treeBuilder Builder for the directory tree
     */
    public ProjectAnalyzer(AnalysisConfig config, ProgressListener progress, TreeBuilder treeBuilder) {
        this.config = config;
        this.progress = progress;
        this.extractor = new UnitExtractor(
                new Fingerprinter(config.shingleWidth(), config.fingerprintSize(), config.minTokens()));
        this.duplicationAnalyzer = new DuplicationAnalyzer(
                new JaccardPreFilter(config.jaccardMin()), config.parallelism(), progress);
        this.treeBuilder = treeBuilder;
        this.treePruner = new TreePruner();
    }

    /**
     * Analyse the given files and return the pruned report tree.
     *
     * @param files Absolute, deduplicated source file paths
     * @return Root of the pruned tree
     * @throws IOException          if a file cannot be read
     * @throws InterruptedException if interrupted during parallel matching
     * @throws com.raditha.checkcode.extraction.SourceParseException on the first file that does not parse
     */
    public DirectoryNode analyze(List<Path> files) throws IOException, InterruptedException {
        List<FileNode> fileNodes = analyzeFiles(files);

        if (config.duplication()) {
            fileNodes = attachDuplications(fileNodes);
        }

        DirectoryNode root = treePruner.prune(treeBuilder.build(fileNodes));
        logger.info("Report tree rooted at {} with {} nodes", root.path(), TreeWalker.count(root));
        return root;
    }

    /**
     * Parse and measure every file, in order.
     */
    public List<FileNode> analyzeFiles(List<Path> files) throws IOException {
        logger.info("Analysing {} files", files.size());
        List<FileNode> fileNodes = new ArrayList<>(files.size());
        for (int i = 0; i < files.size(); i++) {
            Path file = files.get(i);
            logger.debug("Analysing {}", file);
            fileNodes.add(extractor.analyzeFile(file));
            progress.onProgress(i + 1, files.size(), PROGRESS_LABEL);
        }
        return fileNodes;
    }

    /**
     * Run duplicate matching over all leaves and return new file nodes whose
     * leaves carry their best match.
     */
    public List<FileNode> attachDuplications(List<FileNode> fileNodes) throws InterruptedException {
        List<LeafNode> leaves = TreeWalker.leaves(fileNodes);
        List<Optional<Duplication>> matches = duplicationAnalyzer.findBestMatches(leaves);

        Map<LeafNode, Duplication> byLeaf = new IdentityHashMap<>();
        for (int i = 0; i < leaves.size(); i++) {
            LeafNode leaf = leaves.get(i);
            matches.get(i).ifPresent(duplication -> byLeaf.put(leaf, duplication));
        }
        logger.info("{} of {} units have a near-duplicate", byLeaf.size(), leaves.size());

        return fileNodes.stream()
                .map(file -> file.mapLeaves(leaf -> {
                    Duplication duplication = byLeaf.get(leaf);
                    return duplication == null ? leaf : leaf.withDuplication(duplication);
                }))
                .toList();
    }
}
