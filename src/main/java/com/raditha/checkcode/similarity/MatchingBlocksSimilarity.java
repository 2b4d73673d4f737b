package com.raditha.checkcode.similarity;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ratcliff/Obershelp similarity over characters: the longest common block is
 * found, then the parts to its left and right are matched recursively.
 * The ratio is {@code 2 * matched / (len(a) + len(b))}.
 * <p>
 * For texts of 200 characters or more, characters occurring in more than
 * 1% of the second text are "popular" and cannot seed a block (they can still
 * extend one). This keeps whitespace-heavy source text from dominating the
 * search time.
 */
public class MatchingBlocksSimilarity {

    private static final int AUTOJUNK_MIN_LENGTH = 200;

    private final boolean autoJunk;

    /**
     * Create calculator with the popular-character heuristic enabled.
     */
    public MatchingBlocksSimilarity() {
        this(true);
    }

    /**
     * @param autoJunk Whether popular characters are excluded from block seeds
     */
    public MatchingBlocksSimilarity(boolean autoJunk) {
        this.autoJunk = autoJunk;
    }

    /**
     * Calculate the similarity ratio of two texts.
     *
     * @return 1.0 for identical texts (including two empty ones), 0.0 when nothing matches
     */
    public double calculate(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        int matched = 0;
        for (Block block : matchingBlocks(a, b)) {
            matched += block.size();
        }
        return 2.0 * matched / total;
    }

    /**
     * Non-overlapping matching blocks in increasing order of position.
     */
    public List<Block> matchingBlocks(String a, String b) {
        Map<Character, int[]> b2j = indexPositions(b);

        List<Block> blocks = new ArrayList<>();
        Deque<int[]> queue = new ArrayDeque<>();
        queue.push(new int[] { 0, a.length(), 0, b.length() });

        int[] j2len = new int[b.length() + 1];
        int[] newJ2len = new int[b.length() + 1];

        while (!queue.isEmpty()) {
            int[] bounds = queue.pop();
            int alo = bounds[0];
            int ahi = bounds[1];
            int blo = bounds[2];
            int bhi = bounds[3];

            Block longest = findLongestMatch(a, b, b2j, alo, ahi, blo, bhi, j2len, newJ2len);
            if (longest.size() > 0) {
                blocks.add(longest);
                if (alo < longest.a() && blo < longest.b()) {
                    queue.push(new int[] { alo, longest.a(), blo, longest.b() });
                }
                if (longest.a() + longest.size() < ahi && longest.b() + longest.size() < bhi) {
                    queue.push(new int[] { longest.a() + longest.size(), ahi, longest.b() + longest.size(), bhi });
                }
            }
        }

        blocks.sort((x, y) -> x.a() != y.a() ? Integer.compare(x.a(), y.a()) : Integer.compare(x.b(), y.b()));
        return mergeAdjacent(blocks);
    }

    /**
     * Longest block {@code a[i, i+k) == b[j, j+k)} within the bounds.
     * Ties go to the block starting earliest in {@code a}, then earliest in {@code b}.
     */
    private Block findLongestMatch(String a, String b, Map<Character, int[]> b2j,
            int alo, int ahi, int blo, int bhi, int[] j2len, int[] newJ2len) {
        int besti = alo;
        int bestj = blo;
        int bestsize = 0;

        // lengths are stored at j + 1 so that position j - 1 never underflows
        int[] prevTouched = new int[0];
        int prevCount = 0;
        for (int i = alo; i < ahi; i++) {
            int[] positions = b2j.get(a.charAt(i));
            int[] touched = positions == null ? new int[0] : new int[positions.length];
            int count = 0;
            if (positions != null) {
                for (int j : positions) {
                    if (j < blo) {
                        continue;
                    }
                    if (j >= bhi) {
                        break;
                    }
                    int k = j2len[j] + 1;
                    newJ2len[j + 1] = k;
                    touched[count++] = j + 1;
                    if (k > bestsize) {
                        besti = i - k + 1;
                        bestj = j - k + 1;
                        bestsize = k;
                    }
                }
            }
            for (int p = 0; p < prevCount; p++) {
                j2len[prevTouched[p]] = 0;
            }
            for (int p = 0; p < count; p++) {
                j2len[touched[p]] = newJ2len[touched[p]];
                newJ2len[touched[p]] = 0;
            }
            prevTouched = touched;
            prevCount = count;
        }
        for (int p = 0; p < prevCount; p++) {
            j2len[prevTouched[p]] = 0;
        }

        // popular characters never seed a block but may still extend one
        while (besti > alo && bestj > blo && a.charAt(besti - 1) == b.charAt(bestj - 1)) {
            besti--;
            bestj--;
            bestsize++;
        }
        while (besti + bestsize < ahi && bestj + bestsize < bhi
                && a.charAt(besti + bestsize) == b.charAt(bestj + bestsize)) {
            bestsize++;
        }
        return new Block(besti, bestj, bestsize);
    }

    /**
     * Positions of each character in {@code b}, ascending, minus popular characters.
     */
    private Map<Character, int[]> indexPositions(String b) {
        Map<Character, List<Integer>> positions = new HashMap<>();
        for (int j = 0; j < b.length(); j++) {
            positions.computeIfAbsent(b.charAt(j), c -> new ArrayList<>()).add(j);
        }

        int n = b.length();
        if (autoJunk && n >= AUTOJUNK_MIN_LENGTH) {
            int popularLimit = n / 100 + 1;
            positions.values().removeIf(list -> list.size() > popularLimit);
        }

        Map<Character, int[]> b2j = new HashMap<>();
        positions.forEach((c, list) -> b2j.put(c, list.stream().mapToInt(Integer::intValue).toArray()));
        return b2j;
    }

    private static List<Block> mergeAdjacent(List<Block> sorted) {
        List<Block> merged = new ArrayList<>();
        Block current = null;
        for (Block block : sorted) {
            if (current != null
                    && current.a() + current.size() == block.a()
                    && current.b() + current.size() == block.b()) {
                current = new Block(current.a(), current.b(), current.size() + block.size());
            } else {
                if (current != null) {
                    merged.add(current);
                }
                current = block;
            }
        }
        if (current != null) {
            merged.add(current);
        }
        return merged;
    }

    /**
     * A matching block: {@code a[a, a+size) == b[b, b+size)}.
     */
    public record Block(int a, int b, int size) {
    }
}
