package imelattice;

import imelattice.ReadingDictionary.Entry;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Simple producer that fills a {@link Lattice} from a {@link ReadingDictionary}.
 *
 * <p>For every position of the key, each dictionary reading that is a prefix of the
 * remaining key yields one node per candidate. Lengths are tried longest-first, so the
 * longest readings end up deepest in the begin chain. A {@link StarterMask} check skips
 * positions and lengths no reading can match before any substring is built.</p>
 *
 * <p>Positions that no dictionary reading covers with a single code point get an
 * unknown-word node whose surface equals its reading, so a decoder always finds a path
 * from the begin sentinel to the end sentinel.</p>
 *
 * <p>Stateless apart from its configuration; one instance can serve many lattices on
 * many threads, as long as each lattice is used by one thread.</p>
 */
public class DictionaryLookup {
    private static final Logger LOGGER = Logger.getLogger(DictionaryLookup.class.getName());

    static {
        LOGGER.setLevel(Level.OFF);
    }

    /**
     * Enables or disables verbose logging of lookup statistics.
     *
     * @param enabled {@code true} to log at {@link Level#INFO}, {@code false} to disable
     */
    public static void setVerboseLogging(boolean enabled) {
        LOGGER.setLevel(enabled ? Level.INFO : Level.OFF);
    }

    /**
     * Default word cost of unknown-word nodes.
     */
    public static final int DEFAULT_UNKNOWN_COST = 10000;

    private final ReadingDictionary dictionary;
    private final int unknownCost;

    /**
     * Creates a lookup with {@link #DEFAULT_UNKNOWN_COST}.
     *
     * @param dictionary the dictionary to scan
     */
    public DictionaryLookup(ReadingDictionary dictionary) {
        this(dictionary, DEFAULT_UNKNOWN_COST);
    }

    /**
     * Creates a lookup.
     *
     * @param dictionary  the dictionary to scan
     * @param unknownCost word cost assigned to unknown-word nodes
     */
    public DictionaryLookup(ReadingDictionary dictionary, int unknownCost) {
        this.dictionary = Objects.requireNonNull(dictionary, "dictionary");
        this.unknownCost = unknownCost;
    }

    /**
     * Sets {@code key} on the lattice and inserts every candidate found for it.
     *
     * @param lattice the lattice to (re)fill; its previous contents are released
     * @param key     the reading
     * @return the number of ordinary nodes inserted
     */
    public int fill(Lattice lattice, String key) {
        lattice.setKey(key);
        final StarterMask mask = dictionary.starterMask();
        final int n = key.length();
        int inserted = 0;
        int unknown = 0;

        int i = 0;
        while (i < n) {
            final int cp = key.codePointAt(i);
            final int cpLen = Character.charCount(cp);
            boolean coveredByOneChar = false;

            if (mask.hasStarter(cp)) {
                final int tryMax = Math.min(dictionary.maxLength, n - i);
                for (int len = tryMax; len >= Math.max(1, dictionary.minLength); len--) {
                    if (!mask.mayMatch(cp, len)) continue;
                    if (splitsSurrogatePair(key, i + len)) continue;
                    List<Entry> hits = dictionary.lookup(key.substring(i, i + len));
                    for (Entry e : hits) {
                        insert(lattice, i, key.substring(i, i + len), e.value, e.lid, e.rid, e.wcost);
                        inserted++;
                    }
                    if (len == cpLen && !hits.isEmpty()) coveredByOneChar = true;
                }
            }

            if (!coveredByOneChar) {
                String reading = key.substring(i, i + cpLen);
                insert(lattice, i, reading, reading, 0, 0, unknownCost);
                inserted++;
                unknown++;
            }
            i += cpLen;
        }

        final int total = inserted;
        final int unknownTotal = unknown;
        LOGGER.info(() -> "Filled lattice for key of length " + n + ": " + total
                + " nodes (" + unknownTotal + " unknown)");
        return inserted;
    }

    /**
     * Whether position {@code pos} falls between the high and low half of a surrogate pair.
     */
    static boolean splitsSurrogatePair(String key, int pos) {
        return pos > 0 && pos < key.length()
                && Character.isHighSurrogate(key.charAt(pos - 1))
                && Character.isLowSurrogate(key.charAt(pos));
    }

    private static void insert(Lattice lattice, int pos, String key, String value, int lid, int rid, int wcost) {
        Node node = lattice.newNode();
        node.key = key;
        node.value = value;
        node.lid = lid;
        node.rid = rid;
        node.wcost = wcost;
        lattice.insert(pos, node);
    }
}
