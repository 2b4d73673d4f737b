package com.raditha.checkcode.fingerprint;

import com.github.javaparser.JavaToken;
import com.github.javaparser.ast.CompilationUnit;
import com.raditha.checkcode.model.Range;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns JavaParser's lexical tokens into the normalized token stream used for
 * shingling.
 * Layout tokens and comments are dropped. Literal values are canonicalized so
 * that code differing only in constants produces the same stream:
 * every numeric literal becomes {@value #NUMBER_PLACEHOLDER} and every
 * string, text block or character literal becomes {@value #STRING_PLACEHOLDER}.
 */
public class SourceTokenizer {

    public static final String NUMBER_PLACEHOLDER = "0";
    public static final String STRING_PLACEHOLDER = "STR";

    /**
     * Normalized tokens of the compilation unit that begin inside {@code span}.
     * Scans the whole file; when several units of one file are tokenized, build
     * a {@link LineIndex} once with {@link #index(CompilationUnit)} instead.
     *
     * @param cu   Parsed file, parsed with token storage enabled
     * @param span Line span of the unit
     * @return Normalized tokens in source order (empty if the parser kept no tokens)
     */
    public List<String> tokenize(CompilationUnit cu, Range span) {
        return tokenize(index(cu), span);
    }

    /**
     * Normalized tokens from {@code index} that begin inside {@code span}.
     * Costs a binary search plus the length of the span.
     */
    public List<String> tokenize(LineIndex index, Range span) {
        int from = index.firstAtOrAfter(span.startLine());
        int to = index.firstAtOrAfter(span.endLine() + 1);
        return new ArrayList<>(index.tokens.subList(from, Math.max(from, to)));
    }

    /**
     * Normalize every token of a file once, keeping the line each one begins on.
     *
     * @param cu Parsed file, parsed with token storage enabled
     * @return Index over the file's tokens (empty if the parser kept no tokens)
     */
    public LineIndex index(CompilationUnit cu) {
        List<String> tokens = new ArrayList<>();
        List<Integer> lines = new ArrayList<>();
        cu.getTokenRange().ifPresent(range -> {
            for (JavaToken token : range) {
                int line = token.getRange().map(r -> r.begin.line).orElse(-1);
                String normalized = normalize(token);
                if (line < 0 || normalized == null) {
                    continue;
                }
                tokens.add(normalized);
                lines.add(line);
            }
        });
        return new LineIndex(tokens, lines.stream().mapToInt(Integer::intValue).toArray());
    }

    /**
     * Normalized tokens of one file in source order, each tagged with the line
     * it begins on. Lines never decrease along the list.
     */
    public static final class LineIndex {
        private final List<String> tokens;
        private final int[] lines;

        private LineIndex(List<String> tokens, int[] lines) {
            this.tokens = tokens;
            this.lines = lines;
        }

        /**
         * Position of the first token beginning on {@code line} or later.
         */
        int firstAtOrAfter(int line) {
            int low = 0;
            int high = lines.length;
            while (low < high) {
                int mid = (low + high) >>> 1;
                if (lines[mid] < line) {
                    low = mid + 1;
                } else {
                    high = mid;
                }
            }
            return low;
        }
    }

    /**
     * Normalize one token.
     * Returns null for tokens that carry no content.
     */
    String normalize(JavaToken token) {
        if (token.getKind() == JavaToken.Kind.EOF.getKind()
                || token.getCategory().isWhitespaceOrComment()) {
            return null;
        }
        if (isStringLike(token.getKind())) {
            return STRING_PLACEHOLDER;
        }
        if (token.getCategory().isLiteral() && !isKeywordLiteral(token.getKind())) {
            return NUMBER_PLACEHOLDER;
        }
        return token.getText();
    }

    private static boolean isStringLike(int kind) {
        return kind == JavaToken.Kind.STRING_LITERAL.getKind()
                || kind == JavaToken.Kind.TEXT_BLOCK_LITERAL.getKind()
                || kind == JavaToken.Kind.CHARACTER_LITERAL.getKind();
    }

    private static boolean isKeywordLiteral(int kind) {
        return kind == JavaToken.Kind.TRUE.getKind()
                || kind == JavaToken.Kind.FALSE.getKind()
                || kind == JavaToken.Kind.NULL.getKind();
    }
}
