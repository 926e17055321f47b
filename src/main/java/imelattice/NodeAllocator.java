package imelattice;

import java.util.ArrayList;
import java.util.List;

/**
 * Chunked arena for {@link Node} records.
 *
 * <p>Nodes are issued in order from fixed-size chunks. Storage only grows, so a
 * node object handed out once keeps its identity until the next {@link #reset()}.
 * A reset does not free anything: it rewinds the issue cursor and starts a new
 * generation, after which the same objects are re-zeroed and issued again.</p>
 *
 * <p>Not thread-safe. Each {@link Lattice} owns exactly one allocator.</p>
 */
public final class NodeAllocator {
    /**
     * Default number of nodes per chunk.
     */
    public static final int DEFAULT_CHUNK_SIZE = 1024;

    private final int chunkSize;
    private final List<Node[]> chunks = new ArrayList<>();

    /**
     * Number of nodes issued in the current generation.
     */
    private int size;

    /**
     * Number of node objects constructed so far (across all generations).
     */
    private int constructed;

    private int generation;

    /**
     * Creates an allocator with {@link #DEFAULT_CHUNK_SIZE}.
     */
    public NodeAllocator() {
        this(DEFAULT_CHUNK_SIZE);
    }

    /**
     * Creates an allocator growing by {@code chunkSize} nodes at a time.
     *
     * @param chunkSize number of nodes per chunk, must be positive
     * @throws IllegalArgumentException if {@code chunkSize <= 0}
     */
    public NodeAllocator(int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
        }
        this.chunkSize = chunkSize;
    }

    /**
     * Issues a zero-initialized node.
     *
     * @return a node with empty key and value, zero ids and costs, kind
     * {@link NodeKind#ORDINARY} and no links
     */
    public Node newNode() {
        final int chunk = size / chunkSize;
        final int slot = size % chunkSize;
        if (chunk == chunks.size()) {
            chunks.add(new Node[chunkSize]);
        }

        Node node = chunks.get(chunk)[slot];
        if (node == null) {
            node = new Node(this);
            chunks.get(chunk)[slot] = node;
            constructed++;
        }
        node.init(generation);
        size++;
        return node;
    }

    /**
     * Releases every node issued since the previous reset.
     * <p>
     * Runs in constant time; backing storage is kept for reuse. Nodes issued before
     * the reset report {@link Node#isValid()} {@code false} afterwards.
     * </p>
     */
    public void reset() {
        size = 0;
        generation++;
    }

    /**
     * Returns the number of nodes issued in the current generation.
     *
     * @return issued node count
     */
    public int size() {
        return size;
    }

    /**
     * Returns the number of node objects backed by storage.
     *
     * @return constructed node count, never less than {@link #size()}
     */
    public int capacity() {
        return constructed;
    }

    /**
     * Returns the chunk size this allocator grows by.
     *
     * @return nodes per chunk
     */
    public int chunkSize() {
        return chunkSize;
    }

    /**
     * Returns the current allocation epoch.
     *
     * @return generation counter, incremented by every {@link #reset()}
     */
    public int generation() {
        return generation;
    }
}
