package com.raditha.checkcode.model;

import java.util.Arrays;

/**
 * Winnowed shingle-hash sketch of a unit's token stream.
 * Hashes are kept sorted and distinct so set operations are linear merges.
 * Never part of the serialized report.
 */
public final class Fingerprint {

    public static final Fingerprint EMPTY = new Fingerprint(new long[0]);

    private final long[] hashes;

    private Fingerprint(long[] sortedDistinct) {
        this.hashes = sortedDistinct;
    }

    /**
     * Create a fingerprint from arbitrary hash values.
     * Duplicates are collapsed, order is irrelevant.
     */
    public static Fingerprint of(long... values) {
        if (values.length == 0) {
            return EMPTY;
        }
        long[] sorted = Arrays.stream(values).sorted().distinct().toArray();
        return new Fingerprint(sorted);
    }

    public int size() {
        return hashes.length;
    }

    public boolean isEmpty() {
        return hashes.length == 0;
    }

    public boolean contains(long hash) {
        return Arrays.binarySearch(hashes, hash) >= 0;
    }

    /**
     * Sorted copy of the hash values.
     */
    public long[] toArray() {
        return hashes.clone();
    }

    /**
     * Size of the intersection with another fingerprint.
     */
    public int intersectionSize(Fingerprint other) {
        int i = 0;
        int j = 0;
        int common = 0;
        while (i < hashes.length && j < other.hashes.length) {
            int cmp = Long.compare(hashes[i], other.hashes[j]);
            if (cmp == 0) {
                common++;
                i++;
                j++;
            } else if (cmp < 0) {
                i++;
            } else {
                j++;
            }
        }
        return common;
    }

    /**
     * Jaccard similarity |A∩B| / |A∪B|; 0.0 when both are empty.
     */
    public double jaccard(Fingerprint other) {
        int intersection = intersectionSize(other);
        int union = hashes.length + other.hashes.length - intersection;
        return union == 0 ? 0.0 : (double) intersection / union;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Fingerprint other && Arrays.equals(hashes, other.hashes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(hashes);
    }

    @Override
    public String toString() {
        return "Fingerprint[" + hashes.length + " hashes]";
    }
}
