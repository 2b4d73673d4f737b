package com.raditha.checkcode.model;

/**
 * The single best near-duplicate found for a leaf unit.
 *
 * @param score      Similarity ratio rounded to 3 decimals (0.0-1.0)
 * @param other      Qualified name of the matching unit, or its plain name if unqualified
 * @param linesOther Line count of the matching unit
 */
public record Duplication(double score, String other, int linesOther) {

    public Duplication {
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be between 0.0 and 1.0, got: " + score);
        }
        if (other == null || other.isEmpty()) {
            throw new IllegalArgumentException("other cannot be empty");
        }
        if (linesOther < 0) {
            throw new IllegalArgumentException("linesOther must be >= 0");
        }
    }

    /**
     * Build a record for a raw ratio, rounding half-up to three decimals.
     */
    public static Duplication of(double ratio, String other, int linesOther) {
        return new Duplication(Math.round(ratio * 1000.0) / 1000.0, other, linesOther);
    }
}
