package imelattice;

import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.*;

public class StarterMaskTest {

    @Test
    public void testStartersAndLengths() {
        StarterMask mask = StarterMask.build(Arrays.asList("きょう", "きょうは", "き", "は", "", null));
        assertTrue(mask.hasStarter('き'));
        assertTrue(mask.hasStarter('は'));
        assertFalse(mask.hasStarter('ょ'));
        assertFalse(mask.hasStarter(-1));

        assertTrue(mask.mayMatch('き', 1));
        assertFalse(mask.mayMatch('き', 2));
        assertTrue(mask.mayMatch('き', 3));
        assertTrue(mask.mayMatch('き', 4));
        assertFalse(mask.mayMatch('き', 0));
        assertEquals((1L << 1) | (1L << 3) | (1L << 4), mask.lenMask('き'));
        assertEquals(0L, mask.lenMask('ん'));
    }

    @Test
    public void testSupplementaryStarter() {
        String yoshi = new String(Character.toChars(0x20BB7));
        StarterMask mask = StarterMask.build(Arrays.asList(yoshi + "の"));
        assertTrue(mask.hasStarter(0x20BB7));
        assertTrue(mask.mayMatch(0x20BB7, 3));
        assertFalse(mask.mayMatch(0x20BB7, 2));
    }

    @Test
    public void testLongReadings() {
        char[] chars = new char[70];
        Arrays.fill(chars, 'あ');
        StarterMask mask = StarterMask.build(Arrays.asList(new String(chars)));
        assertTrue(mask.mayMatch('あ', 70));
        assertTrue(mask.mayMatch('あ', 64));
        assertFalse(mask.mayMatch('あ', 63));
    }
}
