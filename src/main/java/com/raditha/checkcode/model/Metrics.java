package com.raditha.checkcode.model;

import org.jspecify.annotations.Nullable;

/**
 * Structural metrics of one leaf unit.
 * Values never change after extraction; {@link #withDuplication(Duplication)}
 * returns a copy instead of mutating.
 *
 * @param lines                 end line - start line + 1
 * @param statements            Count of statement-category nodes
 * @param expressions           Count of expression nodes
 * @param expressionStatements  Count of bare expression statements
 * @param cyclomaticComplexity  1 + decision points
 * @param parameters            Declared parameters, varargs collector excluded
 * @param duplication           Best near-duplicate, or null
 */
public record Metrics(
        int lines,
        int statements,
        int expressions,
        int expressionStatements,
        int cyclomaticComplexity,
        int parameters,
        @Nullable Duplication duplication) {

    public Metrics {
        if (lines < 1) {
            throw new IllegalArgumentException("lines must be >= 1, got: " + lines);
        }
        if (statements < 0 || expressions < 0 || expressionStatements < 0 || parameters < 0) {
            throw new IllegalArgumentException("counts cannot be negative");
        }
        if (cyclomaticComplexity < 1) {
            throw new IllegalArgumentException(
                    "cyclomaticComplexity must be >= 1, got: " + cyclomaticComplexity);
        }
    }

    public Metrics(int lines, int statements, int expressions, int expressionStatements,
            int cyclomaticComplexity, int parameters) {
        this(lines, statements, expressions, expressionStatements, cyclomaticComplexity, parameters, null);
    }

    public Metrics withDuplication(@Nullable Duplication newDuplication) {
        return new Metrics(lines, statements, expressions, expressionStatements,
                cyclomaticComplexity, parameters, newDuplication);
    }

    public boolean hasDuplication() {
        return duplication != null;
    }
}
