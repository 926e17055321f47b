package imelattice;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Minimal Viterbi decoder used by tests to drive a lattice the way a real consumer does:
 * path cost is the sum of word costs plus a flat penalty when the right id of the left
 * node differs from the left id of the right node.
 */
final class BestPathDecoder {
    static final int CONNECTION_PENALTY = 500;

    private BestPathDecoder() {
    }

    static int connectionCost(Node left, Node right) {
        if (left.getKind().isSentinel() || right.getKind().isSentinel()) return 0;
        return left.rid == right.lid ? 0 : CONNECTION_PENALTY;
    }

    /**
     * Runs the search, links the best path through {@code prev}/{@code next} and returns
     * its surface forms in order.
     */
    static List<String> decode(Lattice lattice) {
        final Node bos = lattice.bosNode();
        final Node eos = lattice.eosNode();
        final int length = lattice.length();
        bos.cost = 0;

        for (int pos = 0; pos < length; pos++) {
            Iterable<Node> lefts = pos == 0 ? Collections.singletonList(bos) : lattice.endNodeChain(pos);
            for (Node right : lattice.beginNodeChain(pos)) {
                if (right.getKind() != NodeKind.ORDINARY) continue;
                link(lefts, right, bos);
            }
        }
        link(length == 0 ? Collections.singletonList(bos) : lattice.endNodeChain(length), eos, bos);
        if (eos.prev == null) {
            return null;
        }

        Node n = eos;
        while (n.prev != null) {
            n.prev.next = n;
            n = n.prev;
        }

        List<String> values = new ArrayList<>();
        for (Node cur = bos.next; cur != eos; cur = cur.next) {
            values.add(cur.value);
        }
        return values;
    }

    private static void link(Iterable<Node> lefts, Node right, Node bos) {
        Node best = null;
        long bestCost = Long.MAX_VALUE;
        for (Node left : lefts) {
            if (left == right) continue;
            if (left != bos && left.prev == null) continue; // unreachable
            long c = (long) left.cost + connectionCost(left, right);
            if (c < bestCost) {
                bestCost = c;
                best = left;
            }
        }
        if (best != null) {
            right.prev = best;
            right.cost = (int) bestCost + right.wcost;
        }
    }
}
