package com.raditha.checkcode.analyzer;

import com.raditha.checkcode.filter.JaccardPreFilter;
import com.raditha.checkcode.model.Duplication;
import com.raditha.checkcode.model.Fingerprint;
import com.raditha.checkcode.model.LeafNode;
import com.raditha.checkcode.similarity.MatchingBlocksSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Finds, for every leaf unit, its single most similar other unit.
 * <p>
 * All unordered pairs {@code (i, j)}, {@code i < j}, are enumerated. Pairs
 * where either fingerprint is empty or whose fingerprint Jaccard similarity is
 * below the threshold are skipped; the rest get a character-level
 * matching-blocks ratio over their source text. Each unit keeps the best ratio
 * it has seen, replaced only by a strictly greater one, so ties resolve to the
 * first partner in enumeration order.
 * <p>
 * With parallelism above one, rows of the pair matrix are scored on a thread
 * pool and reduced in row order, which gives exactly the sequential result.
 */
public class DuplicationAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(DuplicationAnalyzer.class);

    public static final String PROGRESS_LABEL = "duplication";

    private final JaccardPreFilter preFilter;
    private final MatchingBlocksSimilarity similarity;
    private final int parallelism;
    private final ProgressListener progress;

    /**
     * Create analyzer with the default Jaccard threshold, single-threaded.
     */
    public DuplicationAnalyzer() {
        this(new JaccardPreFilter(), 1, ProgressListener.NONE);
    }

    /**
     * @param preFilter   Fingerprint pre-filter
     * @param parallelism Worker threads for pair scoring (1 = calling thread)
     * @param progress    Notified after each row of pairs
     */
    public DuplicationAnalyzer(JaccardPreFilter preFilter, int parallelism, ProgressListener progress) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1");
        }
        this.preFilter = preFilter;
        this.similarity = new MatchingBlocksSimilarity();
        this.parallelism = parallelism;
        this.progress = progress;
    }

    /**
     * Compute the best match of every unit.
     *
     * @param leaves All leaf units of the corpus, in a fixed order
     * @return One entry per input unit, empty where no pair passed the filter
     * @throws InterruptedException if interrupted while waiting for worker threads
     */
    public List<Optional<Duplication>> findBestMatches(List<LeafNode> leaves) throws InterruptedException {
        int n = leaves.size();
        BestMatches best = new BestMatches(n);
        Stats stats = new Stats();

        if (parallelism > 1 && n > 1) {
            scoreInParallel(leaves, best, stats);
        } else {
            for (int i = 0; i < n; i++) {
                best.merge(scoreRow(leaves, i), stats);
                progress.onProgress(i + 1, n, PROGRESS_LABEL);
            }
        }

        logger.info("Pre-filtering: {}/{} comparisons filtered, {} compared in full",
                stats.filteredOut, stats.comparisons, stats.comparisons - stats.filteredOut);

        List<Optional<Duplication>> result = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            int partnerIndex = best.partner[i];
            if (partnerIndex < 0) {
                result.add(Optional.empty());
                continue;
            }
            LeafNode partner = leaves.get(partnerIndex);
            result.add(Optional.of(Duplication.of(best.ratio[i], partner.displayName(), partner.metrics().lines())));
        }
        return result;
    }

    private void scoreInParallel(List<LeafNode> leaves, BestMatches best, Stats stats) throws InterruptedException {
        int n = leaves.size();
        ExecutorService pool = Executors.newFixedThreadPool(parallelism);
        try {
            List<Future<Row>> rows = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                final int row = i;
                Callable<Row> task = () -> scoreRow(leaves, row);
                rows.add(pool.submit(task));
            }
            for (int i = 0; i < n; i++) {
                best.merge(await(rows.get(i)), stats);
                progress.onProgress(i + 1, n, PROGRESS_LABEL);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private static Row await(Future<Row> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Pair scoring failed", cause);
        }
    }

    /**
     * Score unit {@code i} against every later unit. Reads shared state only.
     */
    Row scoreRow(List<LeafNode> leaves, int i) {
        LeafNode left = leaves.get(i);
        Fingerprint fp1 = left.fingerprint();
        List<Candidate> candidates = new ArrayList<>();
        int comparisons = 0;
        int filteredOut = 0;

        for (int j = i + 1; j < leaves.size(); j++) {
            comparisons++;
            LeafNode right = leaves.get(j);
            if (!preFilter.shouldCompare(fp1, right.fingerprint())) {
                filteredOut++;
                continue;
            }
            candidates.add(new Candidate(j, similarity.calculate(left.source(), right.source())));
        }
        return new Row(i, candidates, comparisons, filteredOut);
    }

    /**
     * A scored pair partner.
     */
    record Candidate(int partner, double ratio) {
    }

    /**
     * All scored partners {@code j > index} of one unit.
     */
    record Row(int index, List<Candidate> candidates, int comparisons, int filteredOut) {
    }

    /**
     * Per-unit best ratio and partner; partner -1 means none yet.
     */
    private static final class BestMatches {
        final double[] ratio;
        final int[] partner;

        BestMatches(int n) {
            this.ratio = new double[n];
            this.partner = new int[n];
            Arrays.fill(partner, -1);
        }

        void merge(Row row, Stats stats) {
            stats.comparisons += row.comparisons();
            stats.filteredOut += row.filteredOut();
            for (Candidate candidate : row.candidates()) {
                offer(row.index(), candidate.partner(), candidate.ratio());
                offer(candidate.partner(), row.index(), candidate.ratio());
            }
        }

        private void offer(int unit, int other, double value) {
            if (value > ratio[unit]) {
                ratio[unit] = value;
                partner[unit] = other;
            }
        }
    }

    private static final class Stats {
        long comparisons;
        long filteredOut;
    }
}
