package imelattice;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only, serializable copy of a {@link Lattice}.
 *
 * <p>Nodes are listed by begin position, in chain order within a position; the
 * end-of-sequence sentinel, which only sits in the end index, comes last. The snapshot
 * holds no references into the arena, so it stays usable after the lattice is cleared.</p>
 */
public class LatticeSnapshot {
    /**
     * One node of the snapshot.
     */
    public static class NodeView {
        public int begin;
        public int end;
        public String key;
        public String value;
        public int lid;
        public int rid;
        public int wcost;
        public int cost;
        public NodeKind kind;

        /**
         * Constructs an empty view for deserialization.
         */
        public NodeView() {
        }

        NodeView(Node node) {
            this.begin = node.getBegin();
            this.end = node.getEnd();
            this.key = node.key;
            this.value = node.value;
            this.lid = node.lid;
            this.rid = node.rid;
            this.wcost = node.wcost;
            this.cost = node.cost;
            this.kind = node.getKind();
        }
    }

    /**
     * The lattice key.
     */
    public String key;

    /**
     * Key length in UTF-16 code units.
     */
    public int length;

    /**
     * All nodes reachable from the begin index, plus the end sentinel.
     */
    public List<NodeView> nodes;

    /**
     * Constructs an empty snapshot for deserialization.
     */
    public LatticeSnapshot() {
        this.key = "";
        this.nodes = new ArrayList<>();
    }

    /**
     * Copies the current contents of {@code lattice}.
     *
     * @param lattice the lattice to copy
     * @return a detached snapshot
     */
    public static LatticeSnapshot of(Lattice lattice) {
        LatticeSnapshot s = new LatticeSnapshot();
        s.key = lattice.key();
        s.length = lattice.length();
        for (int pos = 0; pos <= s.length; pos++) {
            for (Node n : lattice.beginNodeChain(pos)) {
                s.nodes.add(new NodeView(n));
            }
        }
        if (lattice.eosNode() != null) {
            s.nodes.add(new NodeView(lattice.eosNode()));
        }
        return s;
    }

    /**
     * Serializes this snapshot as compact JSON.
     *
     * @return the JSON text
     * @throws RuntimeException if serialization fails
     */
    public String toJson() {
        try {
            return new ObjectMapper().writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize lattice snapshot", e);
        }
    }

    /**
     * Serializes this snapshot as indented JSON.
     *
     * @return the JSON text
     * @throws RuntimeException if serialization fails
     */
    public String toPrettyJson() {
        try {
            return new ObjectMapper().writerWithDefaultPrettyPrinter().writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize lattice snapshot", e);
        }
    }

    /**
     * Parses a snapshot from JSON.
     *
     * @param json the JSON text
     * @return the parsed snapshot
     * @throws JsonProcessingException if the text is not a valid snapshot
     */
    public static LatticeSnapshot fromJson(String json) throws JsonProcessingException {
        return new ObjectMapper().readValue(json, LatticeSnapshot.class);
    }
}
