package imelattice;

import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Immutable set of "starter" code points of a reading dictionary.
 * <p>
 * A starter is the first Unicode code point of a dictionary reading. Before building
 * substrings at a key position, {@link DictionaryLookup} asks this mask whether any
 * reading can start there at all, and which lengths are possible.
 * </p>
 *
 * <p>
 * Internally two {@link BitSet}s hold presence:
 * <ul>
 *   <li>{@code bmpMask} – starters in the Basic Multilingual Plane (U+0000 to U+FFFF)</li>
 *   <li>{@code astralMask} – starters in the Supplementary Planes, stored as an offset
 *       from {@code BMP_LIMIT}</li>
 * </ul>
 * and per-starter 64-bit length masks record the reading lengths (UTF-16 code units)
 * seen for each starter. Readings of 64 units or more are not represented in the
 * length masks and are always tried.
 * </p>
 *
 * <p>Thread-safe once built.</p>
 */
public final class StarterMask {
    private static final int BMP_LIMIT = 0x10000;
    private static final int UNICODE_MAX = 0x10FFFF;

    /**
     * Length bit reserved for readings too long to fit the mask.
     */
    static final long LONG_READING_BIT = 1L;

    private final BitSet bmpMask;
    private final BitSet astralMask; // cp - BMP_LIMIT
    private final long[] bmpLenMask;
    private final Map<Integer, Long> astralLenMask;

    private StarterMask(BitSet bmp, BitSet astral, long[] bmpLen, Map<Integer, Long> astralLen) {
        this.bmpMask = bmp;
        this.astralMask = astral;
        this.bmpLenMask = bmpLen;
        this.astralLenMask = Collections.unmodifiableMap(astralLen);
    }

    /**
     * Scans readings and builds the starter and length masks.
     *
     * @param readings dictionary readings; {@code null} and empty entries are ignored
     * @return an immutable mask
     */
    public static StarterMask build(Iterable<String> readings) {
        final BitSet bmp = new BitSet(BMP_LIMIT);
        final BitSet astral = new BitSet((UNICODE_MAX - BMP_LIMIT) + 1);
        final long[] bmpLen = new long[BMP_LIMIT];
        final Map<Integer, Long> astralLen = new HashMap<>();

        for (String k : readings) {
            if (k == null || k.isEmpty()) continue;
            final int cp = k.codePointAt(0);

            if (cp < BMP_LIMIT) bmp.set(cp);
            else astral.set(cp - BMP_LIMIT);

            // bit 0 can never be a real length, so it flags "some reading is 64+ long"
            final int len = k.length();
            final long bit = len < 64 ? 1L << len : LONG_READING_BIT;
            if (cp < BMP_LIMIT) {
                bmpLen[cp] |= bit;
            } else {
                astralLen.merge(cp, bit, (a, b) -> a | b);
            }
        }

        return new StarterMask(bmp, astral, bmpLen, astralLen);
    }

    /**
     * Checks whether any reading starts with the given code point.
     *
     * @param codePoint the Unicode code point to test
     * @return {@code true} if at least one reading starts with it
     */
    public boolean hasStarter(int codePoint) {
        if (codePoint < 0) return false;
        if (codePoint < BMP_LIMIT) return bmpMask.get(codePoint);
        if (codePoint <= UNICODE_MAX) return astralMask.get(codePoint - BMP_LIMIT);
        return false;
    }

    /**
     * Returns the reading-length bitmask for a starter.
     * <p>
     * Bit {@code n} (1 ≤ n ≤ 63) is set if a reading of {@code n} UTF-16 code units starts
     * with {@code cp}. Bit 0 is set if a reading of 64 or more units does.
     * </p>
     *
     * @param cp the starter code point
     * @return the length mask, {@code 0} if nothing starts with {@code cp}
     */
    public long lenMask(int cp) {
        if (cp < 0) return 0L;
        if (cp < BMP_LIMIT) return bmpLenMask[cp];
        return astralLenMask.getOrDefault(cp, 0L);
    }

    /**
     * Whether a reading of {@code len} units may start with {@code cp}.
     *
     * @param cp  starter code point
     * @param len candidate reading length in UTF-16 code units
     * @return {@code false} only when no reading of that length can start with {@code cp}
     */
    public boolean mayMatch(int cp, int len) {
        final long mask = lenMask(cp);
        if (len >= 64) return (mask & LONG_READING_BIT) != 0;
        return len > 0 && (mask & (1L << len)) != 0;
    }
}
