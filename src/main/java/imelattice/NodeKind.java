package imelattice;

/**
 * Kind of a {@link Node} inside a {@link Lattice}.
 * <p>
 * The set is closed: every node is either an ordinary candidate produced by
 * dictionary lookup, or one of the two sentinels the lattice installs when a
 * key is set.
 * </p>
 */
public enum NodeKind {
    /**
     * Candidate edge over a span of the key.
     */
    ORDINARY,
    /**
     * Begin-of-sequence sentinel, zero span at position 0.
     */
    BEGIN_OF_SEQUENCE,
    /**
     * End-of-sequence sentinel, zero span at the end of the key.
     */
    END_OF_SEQUENCE;

    /**
     * Returns {@code true} for the two sentinel kinds.
     *
     * @return whether this kind marks a lattice boundary
     */
    public boolean isSentinel() {
        return this != ORDINARY;
    }
}
