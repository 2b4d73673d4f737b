package com.raditha.checkcode.fingerprint;

import com.raditha.checkcode.model.Fingerprint;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * Computes winnowed fingerprints from normalized token streams.
 * <p>
 * A window of {@code shingleWidth} consecutive tokens slides over the stream
 * with step 1; each window is joined with single spaces and hashed. The
 * {@code fingerprintSize} smallest hashes, counted with repeats, form the
 * fingerprint once duplicates collapse, so a unit that repeats a shingle can
 * end up with fewer than {@code fingerprintSize} entries. Streams shorter than
 * {@code minTokens} are too small to judge and yield {@link Fingerprint#EMPTY}.
 */
public class Fingerprinter {

    public static final int DEFAULT_SHINGLE_WIDTH = 5;
    public static final int DEFAULT_FINGERPRINT_SIZE = 50;
    public static final int DEFAULT_MIN_TOKENS = 25;

    private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private final int shingleWidth;
    private final int fingerprintSize;
    private final int minTokens;

    public Fingerprinter() {
        this(DEFAULT_SHINGLE_WIDTH, DEFAULT_FINGERPRINT_SIZE, DEFAULT_MIN_TOKENS);
    }

    /**
     * @param shingleWidth    Size of token n-grams
     * @param fingerprintSize Number of smallest hashes kept
     * @param minTokens       Minimum stream length for a non-empty fingerprint
     */
    public Fingerprinter(int shingleWidth, int fingerprintSize, int minTokens) {
        if (shingleWidth < 1) {
            throw new IllegalArgumentException("Shingle width must be at least 1");
        }
        if (fingerprintSize < 1) {
            throw new IllegalArgumentException("Fingerprint size must be at least 1");
        }
        if (minTokens < shingleWidth) {
            throw new IllegalArgumentException(
                    String.format("Minimum tokens (%d) must be >= shingle width (%d)", minTokens, shingleWidth));
        }
        this.shingleWidth = shingleWidth;
        this.fingerprintSize = fingerprintSize;
        this.minTokens = minTokens;
    }

    /**
     * Fingerprint a normalized token stream.
     */
    public Fingerprint fingerprint(List<String> tokens) {
        if (tokens.size() < minTokens) {
            return Fingerprint.EMPTY;
        }

        long[] hashes = new long[tokens.size() - shingleWidth + 1];
        for (int i = 0; i < hashes.length; i++) {
            hashes[i] = hash(String.join(" ", tokens.subList(i, i + shingleWidth)));
        }

        // cut before collapsing repeats
        long[] smallest = Arrays.stream(hashes)
                .sorted()
                .limit(fingerprintSize)
                .toArray();
        return Fingerprint.of(smallest);
    }

    /**
     * Stable 64-bit hash of a shingle: FNV-1a over the UTF-8 bytes followed by
     * the MurmurHash3 finalizer to spread the low bits.
     */
    static long hash(String shingle) {
        long h = FNV_OFFSET_BASIS;
        for (byte b : shingle.getBytes(StandardCharsets.UTF_8)) {
            h ^= (b & 0xff);
            h *= FNV_PRIME;
        }
        h ^= (h >>> 33);
        h *= 0xff51afd7ed558ccdL;
        h ^= (h >>> 33);
        h *= 0xc4ceb9fe1a85ec53L;
        h ^= (h >>> 33);
        return h;
    }
}
