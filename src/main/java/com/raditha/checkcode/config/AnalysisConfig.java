package com.raditha.checkcode.config;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;

/**
 * Configuration for one analysis run.
 *
 * @param shingleWidth    Tokens per shingle
 * @param fingerprintSize Smallest shingle hashes kept per unit
 * @param minTokens       Units with fewer normalized tokens are not fingerprinted
 * @param jaccardMin      Minimum fingerprint Jaccard similarity before the exact comparison
 * @param duplication     Whether near-duplicate detection runs at all
 * @param parallelism     Worker threads for pair matching (1 = run on the calling thread)
 * @param sourceSuffix    File name suffix of analysable sources
 * @param excludePatterns Glob patterns of files to skip during discovery
 */
public record AnalysisConfig(
        int shingleWidth,
        int fingerprintSize,
        int minTokens,
        double jaccardMin,
        boolean duplication,
        int parallelism,
        String sourceSuffix,
        List<String> excludePatterns) {

    public static final int DEFAULT_SHINGLE_WIDTH = 5;
    public static final int DEFAULT_FINGERPRINT_SIZE = 50;
    public static final int DEFAULT_MIN_TOKENS = 25;
    public static final double DEFAULT_JACCARD_MIN = 0.3;
    public static final String DEFAULT_SOURCE_SUFFIX = ".java";

    /**
     * Validate configuration.
     */
    public AnalysisConfig {
        if (shingleWidth < 1) {
            throw new IllegalArgumentException("shingleWidth must be >= 1");
        }
        if (fingerprintSize < 1) {
            throw new IllegalArgumentException("fingerprintSize must be >= 1");
        }
        if (minTokens < shingleWidth) {
            throw new IllegalArgumentException("minTokens must be >= shingleWidth");
        }
        if (jaccardMin < 0.0 || jaccardMin > 1.0) {
            throw new IllegalArgumentException("jaccardMin must be between 0.0 and 1.0");
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1");
        }
        if (sourceSuffix == null || sourceSuffix.isEmpty()) {
            throw new IllegalArgumentException("sourceSuffix cannot be empty");
        }
        excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
    }

    /**
     * Defaults: 5-token shingles, 50 hashes, 25 tokens minimum, Jaccard 0.3,
     * duplication on, single-threaded.
     */
    public static AnalysisConfig defaults() {
        return new AnalysisConfig(
                DEFAULT_SHINGLE_WIDTH,
                DEFAULT_FINGERPRINT_SIZE,
                DEFAULT_MIN_TOKENS,
                DEFAULT_JACCARD_MIN,
                true,
                1,
                DEFAULT_SOURCE_SUFFIX,
                List.of());
    }

    public AnalysisConfig withDuplication(boolean enabled) {
        return new AnalysisConfig(shingleWidth, fingerprintSize, minTokens, jaccardMin,
                enabled, parallelism, sourceSuffix, excludePatterns);
    }

    public AnalysisConfig withParallelism(int threads) {
        return new AnalysisConfig(shingleWidth, fingerprintSize, minTokens, jaccardMin,
                duplication, threads, sourceSuffix, excludePatterns);
    }

    /**
     * Check if a file path matches any exclusion pattern.
     */
    public boolean shouldExclude(Path file) {
        for (String pattern : excludePatterns) {
            PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
            if (matcher.matches(file)) {
                return true;
            }
        }
        return false;
    }
}
