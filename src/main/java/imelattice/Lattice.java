package imelattice;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Position-indexed candidate graph for one conversion request.
 *
 * <p>For a key (the reading) of length {@code L} the lattice keeps two arrays of
 * chain heads over positions {@code 0..L}:</p>
 * <ul>
 *   <li><b>begin index</b> – nodes whose span starts at a position, linked through
 *       {@link Node#getBnext()};</li>
 *   <li><b>end index</b> – nodes whose span ends at a position, linked through
 *       {@link Node#getEnext()}.</li>
 * </ul>
 *
 * <p>Setting a key installs two zero-span sentinels: the begin-of-sequence node at the
 * head of the begin index at 0 and the end-of-sequence node at the head of the end index
 * at {@code L}. Both are the fixed anchors of every path a decoder builds.</p>
 *
 * <p>Usage:</p>
 * <pre>{@code
 * Lattice lattice = new Lattice();
 * lattice.setKey("きょうは");
 * Node node = lattice.newNode();
 * node.key = "きょう";
 * node.value = "今日";
 * lattice.insert(0, node);
 * for (Node n : lattice.endNodeChain(3)) { ... }
 * }</pre>
 *
 * <p>Chains yield the most recently inserted node first. Positions are UTF-16 code
 * units. A lattice is not thread-safe; use one instance per request.</p>
 */
public class Lattice {
    /**
     * Logger for lattice lifecycle diagnostics, disabled by default.
     */
    private static final Logger LOGGER = Logger.getLogger(Lattice.class.getName());

    static {
        LOGGER.setLevel(Level.OFF);
    }

    /**
     * Enables or disables verbose logging for lattice lifecycle events.
     *
     * @param enabled {@code true} to log at {@link Level#FINE}, {@code false} to silence the logger
     */
    public static void setVerboseLogging(boolean enabled) {
        LOGGER.setLevel(enabled ? Level.FINE : Level.OFF);
    }

    private static final Node[] EMPTY_INDEX = new Node[0];

    private final NodeAllocator allocator;

    private String key = "";
    private Node[] beginNodes = EMPTY_INDEX;
    private Node[] endNodes = EMPTY_INDEX;
    private Node bosNode;
    private Node eosNode;
    private boolean hasLattice;

    /**
     * Creates an empty lattice backed by an allocator with the default chunk size.
     */
    public Lattice() {
        this(new NodeAllocator());
    }

    /**
     * Creates an empty lattice whose arena grows by {@code chunkSize} nodes at a time.
     *
     * @param chunkSize nodes per arena chunk
     * @throws IllegalArgumentException if {@code chunkSize <= 0}
     */
    public Lattice(int chunkSize) {
        this(new NodeAllocator(chunkSize));
    }

    private Lattice(NodeAllocator allocator) {
        this.allocator = allocator;
        resetIndices(0);
    }

    /**
     * Starts a new request for {@code key}.
     * <p>
     * Every node issued before this call is released. The indices are resized to
     * {@code key.length() + 1} empty chains and the two sentinels are installed.
     * </p>
     *
     * @param key the reading to convert
     * @throws NullPointerException if {@code key} is {@code null}
     */
    public void setKey(String key) {
        Objects.requireNonNull(key, "key");
        this.key = key;
        final int length = key.length();
        resetIndices(length);

        bosNode = allocator.newNode();
        bosNode.kind = NodeKind.BEGIN_OF_SEQUENCE;
        bosNode.begin = 0;
        bosNode.end = 0;
        beginNodes[0] = bosNode;

        eosNode = allocator.newNode();
        eosNode.kind = NodeKind.END_OF_SEQUENCE;
        eosNode.begin = length;
        eosNode.end = length;
        endNodes[length] = eosNode;

        hasLattice = true;
        LOGGER.fine(() -> "Lattice key set, length " + length);
    }

    /**
     * Drops the key, every node and both sentinels.
     */
    public void clear() {
        final int released = allocator.size();
        key = "";
        resetIndices(0);
        bosNode = null;
        eosNode = null;
        hasLattice = false;
        LOGGER.fine(() -> "Lattice cleared, released " + released + " nodes");
    }

    private void resetIndices(int length) {
        allocator.reset();
        if (beginNodes.length != length + 1) {
            beginNodes = new Node[length + 1];
            endNodes = new Node[length + 1];
        } else {
            Arrays.fill(beginNodes, null);
            Arrays.fill(endNodes, null);
        }
    }

    /**
     * Returns the current key.
     *
     * @return the key, or {@code ""} if none is set
     */
    public String key() {
        return key;
    }

    /**
     * Returns the key length {@code L}, the last valid position.
     *
     * @return length in UTF-16 code units, 0 when no key is set
     */
    public int length() {
        return key.length();
    }

    /**
     * Whether a key has been set and not cleared since.
     *
     * @return {@code true} in the keyed state
     */
    public boolean hasLattice() {
        return hasLattice;
    }

    /**
     * Returns the begin-of-sequence sentinel.
     *
     * @return the sentinel, or {@code null} when no key is set
     */
    public Node bosNode() {
        return bosNode;
    }

    /**
     * Returns the end-of-sequence sentinel.
     *
     * @return the sentinel, or {@code null} when no key is set
     */
    public Node eosNode() {
        return eosNode;
    }

    /**
     * Issues a fresh node from this lattice's arena.
     * <p>
     * Allowed with or without a key. The node is not part of any index until it is
     * passed to {@link #insert(int, Node)}.
     * </p>
     *
     * @return a zero-initialized node
     */
    public Node newNode() {
        return allocator.newNode();
    }

    /**
     * Returns the number of nodes issued for the current key, sentinels included.
     *
     * @return issued node count
     */
    public int nodeCount() {
        return allocator.size();
    }

    /**
     * Links {@code node} into the lattice at position {@code pos}.
     * <p>
     * The node becomes the head of the begin chain at {@code pos} and of the end chain at
     * {@code pos + node.getSpan()}. Nothing is allocated and no ordering by cost is applied.
     * </p>
     *
     * @param pos  start position of the node's span
     * @param node a node issued by {@link #newNode()} for the current key and not yet inserted
     * @throws NullPointerException      if {@code node} or its key is {@code null}
     * @throws IllegalStateException     if the node belongs to another lattice, was issued before
     *                                   the last {@link #setKey(String)}/{@link #clear()}, or was
     *                                   already inserted
     * @throws IndexOutOfBoundsException if {@code pos} or {@code pos + span} lies outside {@code [0, L]}
     */
    public void insert(int pos, Node node) {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(node.key, "node.key");
        if (node.owner != allocator) {
            throw new IllegalStateException("Node was not issued by this lattice: " + node);
        }
        if (!node.isValid()) {
            throw new IllegalStateException("Node was issued before the lattice was reset: " + node);
        }
        if (node.isInserted()) {
            throw new IllegalStateException("Node is already inserted at " + node.begin + ": " + node);
        }
        checkPosition(pos);
        final int end = pos + node.getSpan();
        if (end > length()) {
            throw new IndexOutOfBoundsException(
                    "Node span [" + pos + ", " + end + ") exceeds key length " + length());
        }

        node.begin = pos;
        node.end = end;
        node.bnext = beginNodes[pos];
        beginNodes[pos] = node;
        node.enext = endNodes[end];
        endNodes[end] = node;
    }

    /**
     * Returns the head of the chain of nodes starting at {@code pos}.
     *
     * @param pos a position in {@code [0, L]}
     * @return the most recently inserted node starting at {@code pos}, or {@code null}
     * @throws IndexOutOfBoundsException if {@code pos} is outside {@code [0, L]}
     */
    public Node beginNodes(int pos) {
        checkPosition(pos);
        return beginNodes[pos];
    }

    /**
     * Returns the head of the chain of nodes ending at {@code pos}.
     *
     * @param pos a position in {@code [0, L]}
     * @return the most recently inserted node ending at {@code pos}, or {@code null}
     * @throws IndexOutOfBoundsException if {@code pos} is outside {@code [0, L]}
     */
    public Node endNodes(int pos) {
        checkPosition(pos);
        return endNodes[pos];
    }

    /**
     * Iterable view over the begin chain at {@code pos}.
     *
     * @param pos a position in {@code [0, L]}
     * @return the nodes starting at {@code pos}, most recent first
     * @throws IndexOutOfBoundsException if {@code pos} is outside {@code [0, L]}
     */
    public Iterable<Node> beginNodeChain(int pos) {
        final Node head = beginNodes(pos);
        return () -> new ChainIterator(head, true);
    }

    /**
     * Iterable view over the end chain at {@code pos}.
     *
     * @param pos a position in {@code [0, L]}
     * @return the nodes ending at {@code pos}, most recent first
     * @throws IndexOutOfBoundsException if {@code pos} is outside {@code [0, L]}
     */
    public Iterable<Node> endNodeChain(int pos) {
        final Node head = endNodes(pos);
        return () -> new ChainIterator(head, false);
    }

    private void checkPosition(int pos) {
        if (pos < 0 || pos > length()) {
            throw new IndexOutOfBoundsException("Position " + pos + " outside [0, " + length() + "]");
        }
    }

    @Override
    public String toString() {
        return "Lattice{key='" + key + "', hasLattice=" + hasLattice + ", nodes=" + allocator.size() + '}';
    }

    /**
     * Walks one intrusive chain, following either {@code bnext} or {@code enext}.
     */
    private static final class ChainIterator implements Iterator<Node> {
        private Node current;
        private final boolean beginChain;

        ChainIterator(Node head, boolean beginChain) {
            this.current = head;
            this.beginChain = beginChain;
        }

        @Override
        public boolean hasNext() {
            return current != null;
        }

        @Override
        public Node next() {
            if (current == null) {
                throw new NoSuchElementException();
            }
            Node n = current;
            current = beginChain ? n.bnext : n.enext;
            return n;
        }
    }
}
