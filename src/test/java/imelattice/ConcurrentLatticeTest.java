package imelattice;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class ConcurrentLatticeTest {

    @Test
    public void testIndependentLatticesShareOnlyTheDictionary() throws Exception {
        final ReadingDictionary dictionary = ReadingDictionary.fromResource("/dicts/readings.txt");
        final DictionaryLookup lookup = new DictionaryLookup(dictionary);
        final List<String> keys = Arrays.asList("きょうはいいてんき", "いいてんき", "てんき", "きょうは");

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<Integer>> results = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                final String key = keys.get(t % keys.size());
                results.add(pool.submit(() -> {
                    Lattice lattice = new Lattice(8);
                    int last = -1;
                    for (int round = 0; round < 200; round++) {
                        int inserted = lookup.fill(lattice, key);
                        if (last >= 0 && inserted != last) {
                            throw new AssertionError("unstable node count for " + key);
                        }
                        last = inserted;
                        for (int pos = 0; pos <= lattice.length(); pos++) {
                            for (Node n : lattice.beginNodeChain(pos)) {
                                if (n.getBegin() != pos || !n.isValid()) {
                                    throw new AssertionError("bad node " + n);
                                }
                            }
                        }
                        lattice.clear();
                    }
                    return last;
                }));
            }
            for (int t = 0; t < results.size(); t++) {
                Lattice reference = new Lattice();
                int expected = lookup.fill(reference, keys.get(t % keys.size()));
                assertEquals(expected, (int) results.get(t).get(30, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
