package com.raditha.checkcode.analyzer;

/**
 * Receives progress notifications. Purely observational: implementations must
 * not throw and cannot influence the analysis.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (current, total, label) -> {
    };

    /**
     * @param current Units of work completed so far (1-based)
     * @param total   Total units of work
     * @param label   Phase name, e.g. "analyse" or "duplication"
     */
    void onProgress(int current, int total, String label);
}
