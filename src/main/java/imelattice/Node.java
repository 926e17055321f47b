package imelattice;

/**
 * A candidate edge in a {@link Lattice}: one mapping from a span of the key
 * (the reading) to a converted surface form.
 *
 * <p>Nodes are never constructed directly. They are issued by a {@link NodeAllocator}
 * (normally through {@link Lattice#newNode()}) and stay owned by it: the allocator
 * recycles the same objects after every reset, so a node must not be kept across
 * {@link Lattice#setKey(String)} or {@link Lattice#clear()}.</p>
 *
 * <p>Producer fields ({@link #key}, {@link #value}, {@link #lid}, {@link #rid},
 * {@link #wcost}) and decoder fields ({@link #cost}, {@link #prev}, {@link #next})
 * are public and freely writable. The position and the two index links are
 * maintained by the lattice and are read-only from outside this package.</p>
 *
 * <p>Positions are measured in UTF-16 code units, so the span of a node is
 * {@code key.length()}.</p>
 */
public final class Node {
    /**
     * Span of the lattice key this node covers (e.g. "きょう").
     */
    public String key;

    /**
     * Converted surface form (e.g. "今日").
     */
    public String value;

    /**
     * Left connection-class id, interpreted only by the external cost model.
     */
    public int lid;

    /**
     * Right connection-class id, interpreted only by the external cost model.
     */
    public int rid;

    /**
     * Standalone word cost assigned by the producer.
     */
    public int wcost;

    /**
     * Accumulated path cost written by the decoder.
     */
    public int cost;

    /**
     * Previous node on the best path, written by the decoder.
     */
    public Node prev;

    /**
     * Next node on the best path, written by the decoder.
     */
    public Node next;

    // lattice-maintained state
    NodeKind kind;
    int begin;
    int end;
    Node bnext;
    Node enext;

    // arena bookkeeping
    final NodeAllocator owner;
    int generation;

    Node(NodeAllocator owner) {
        this.owner = owner;
        init(0);
    }

    /**
     * Restores every field to its freshly allocated state and stamps the node
     * with the allocator generation it is issued in.
     */
    void init(int generation) {
        this.key = "";
        this.value = "";
        this.lid = 0;
        this.rid = 0;
        this.wcost = 0;
        this.cost = 0;
        this.prev = null;
        this.next = null;
        this.kind = NodeKind.ORDINARY;
        this.begin = -1;
        this.end = -1;
        this.bnext = null;
        this.enext = null;
        this.generation = generation;
    }

    /**
     * Returns the kind of this node.
     *
     * @return {@link NodeKind#ORDINARY} or one of the sentinel kinds
     */
    public NodeKind getKind() {
        return kind;
    }

    /**
     * Returns the start position of this node, or {@code -1} if it has not been inserted.
     *
     * @return begin position in UTF-16 code units
     */
    public int getBegin() {
        return begin;
    }

    /**
     * Returns the number of key positions covered by this node.
     * <p>
     * Before insertion this is {@code key.length()}. Once inserted, the span recorded by
     * the lattice is returned, so later changes to {@link #key} do not move the node.
     * </p>
     *
     * @return span in UTF-16 code units
     */
    public int getSpan() {
        if (begin >= 0) return end - begin;
        return key == null ? 0 : key.length();
    }

    /**
     * Returns the end position recorded at insertion, or {@code -1} if not inserted.
     *
     * @return end position in UTF-16 code units
     */
    public int getEnd() {
        return end;
    }

    /**
     * Next node in the chain of nodes starting at the same position.
     *
     * @return the next node, or {@code null} at the end of the chain
     */
    public Node getBnext() {
        return bnext;
    }

    /**
     * Next node in the chain of nodes ending at the same position.
     *
     * @return the next node, or {@code null} at the end of the chain
     */
    public Node getEnext() {
        return enext;
    }

    /**
     * Whether this node has been linked into a lattice index.
     *
     * @return {@code true} once {@link Lattice#insert(int, Node)} accepted it
     */
    public boolean isInserted() {
        return begin >= 0;
    }

    /**
     * Whether this node still belongs to the current allocation epoch of its arena.
     * <p>
     * Returns {@code false} once the owning lattice was cleared or given a new key.
     * The arena recycles node objects, so after the same object has been issued again
     * this check reports the new node's state, not the old one.
     * </p>
     *
     * @return {@code true} if the node reference is still usable
     */
    public boolean isValid() {
        return generation == owner.generation();
    }

    @Override
    public String toString() {
        return "Node{" + kind +
                ", begin=" + begin +
                ", key='" + key + '\'' +
                ", value='" + value + '\'' +
                ", lid=" + lid +
                ", rid=" + rid +
                ", wcost=" + wcost +
                ", cost=" + cost +
                '}';
    }
}
