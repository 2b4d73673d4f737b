package com.raditha.checkcode.filter;

import com.raditha.checkcode.model.Fingerprint;

/**
 * Pre-filters unit pairs by the Jaccard similarity of their fingerprints.
 * Rejects the large majority of unrelated pairs before the character-level
 * comparison runs.
 */
public class JaccardPreFilter {

    public static final double DEFAULT_MIN_JACCARD = 0.3;

    private final double minJaccardThreshold;

    /**
     * Create filter with default 0.3 Jaccard threshold.
     */
    public JaccardPreFilter() {
        this(DEFAULT_MIN_JACCARD);
    }

    /**
     * Create filter with custom Jaccard threshold.
     *
     * @param minJaccardThreshold Minimum Jaccard similarity (0.0 to 1.0)
     */
    public JaccardPreFilter(double minJaccardThreshold) {
        if (minJaccardThreshold < 0.0 || minJaccardThreshold > 1.0) {
            throw new IllegalArgumentException("Jaccard threshold must be between 0.0 and 1.0");
        }
        this.minJaccardThreshold = minJaccardThreshold;
    }

    /**
     * Check if two units should be compared.
     * Units with an empty fingerprint are never compared.
     *
     * @return true if the pair passes the filter
     */
    public boolean shouldCompare(Fingerprint fp1, Fingerprint fp2) {
        if (fp1.isEmpty() || fp2.isEmpty()) {
            return false;
        }
        return fp1.jaccard(fp2) >= minJaccardThreshold;
    }

    /**
     * Get the configured minimum Jaccard threshold.
     */
    public double getMinJaccardThreshold() {
        return minJaccardThreshold;
    }
}
