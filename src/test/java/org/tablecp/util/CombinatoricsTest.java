/*
 * TableCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tablecp.util;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

public class CombinatoricsTest {

    private static List<List<Integer>> collect(Consumer<Consumer<int[]>> enumeration) {
        List<List<Integer>> res = new ArrayList<>();
        enumeration.accept(a -> {
            List<Integer> l = new ArrayList<>();
            for (int v : a) l.add(v);
            res.add(l);
        });
        return res;
    }

    @Test
    public void testMultisets() {
        List<List<Integer>> multisets = collect(c -> Combinatorics.forEachMultiset(new int[]{1, 2, 3}, 2, c));
        assertEquals(List.of(List.of(1, 1), List.of(1, 2), List.of(1, 3), List.of(2, 2), List.of(2, 3), List.of(3, 3)), multisets);

        // C(4 + 3 - 1, 3)
        assertEquals(20, collect(c -> Combinatorics.forEachMultiset(new int[]{1, 2, 3, 4}, 3, c)).size());
        assertEquals(List.of(List.of()), collect(c -> Combinatorics.forEachMultiset(new int[]{1, 2}, 0, c)));
        assertTrue(collect(c -> Combinatorics.forEachMultiset(new int[0], 2, c)).isEmpty());
    }

    @Test
    public void testDistinctPermutations() {
        List<List<Integer>> perms = collect(c -> Combinatorics.forEachDistinctPermutation(new int[]{2, 1, 2}, c));
        assertEquals(List.of(List.of(1, 2, 2), List.of(2, 1, 2), List.of(2, 2, 1)), perms);

        assertEquals(24, collect(c -> Combinatorics.forEachDistinctPermutation(Combinatorics.range(1, 4), c)).size());
        assertEquals(1, collect(c -> Combinatorics.forEachDistinctPermutation(new int[]{3, 3, 3}, c)).size());
    }

    @Test
    public void testArithmetic() {
        assertArrayEquals(new int[]{2, 3, 4}, Combinatorics.range(2, 4));
        assertEquals(0, Combinatorics.range(3, 2).length);
        assertEquals(9, Combinatorics.sum(2, 3, 4));
        assertEquals(24, Combinatorics.product(2, 3, 4));
    }
}
