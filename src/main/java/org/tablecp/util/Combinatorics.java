/*
 * TableCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tablecp.util;

import java.util.Arrays;
import java.util.function.Consumer;

/**
 * Enumeration of multisets and permutations of int values.
 * The arrays given to the consumers are reused between calls:
 * copy them to keep them.
 */
public final class Combinatorics {

    private Combinatorics() {
    }

    /**
     * Enumerates the multisets of size k over the given values,
     * each one once, as non-decreasing arrays.
     *
     * @param values   the values, sorted increasingly and without duplicates
     * @param k        the size of the multisets
     * @param consumer called with each multiset
     */
    public static void forEachMultiset(int[] values, int k, Consumer<int[]> consumer) {
        if (k == 0 || values.length == 0) {
            if (k == 0) consumer.accept(new int[0]);
            return;
        }
        multisets(values, new int[k], 0, 0, consumer);
    }

    private static void multisets(int[] values, int[] current, int depth, int from, Consumer<int[]> consumer) {
        if (depth == current.length) {
            consumer.accept(current);
            return;
        }
        for (int i = from; i < values.length; i++) {
            current[depth] = values[i];
            multisets(values, current, depth + 1, i, consumer);
        }
    }

    /**
     * Enumerates the distinct permutations of the values in lexicographic order.
     * Repeated values yield each distinct arrangement once.
     *
     * @param values   the values, in any order
     * @param consumer called with each permutation
     */
    public static void forEachDistinctPermutation(int[] values, Consumer<int[]> consumer) {
        int[] p = values.clone();
        Arrays.sort(p);
        do {
            consumer.accept(p);
        } while (nextPermutation(p));
    }

    /**
     * Rearranges a into the next permutation in lexicographic order
     *
     * @return false if a was the last permutation
     */
    static boolean nextPermutation(int[] a) {
        int i = a.length - 2;
        while (i >= 0 && a[i] >= a[i + 1]) i--;
        if (i < 0) return false;
        int j = a.length - 1;
        while (a[j] <= a[i]) j--;
        swap(a, i, j);
        for (int l = i + 1, r = a.length - 1; l < r; l++, r--) {
            swap(a, l, r);
        }
        return true;
    }

    private static void swap(int[] a, int i, int j) {
        int t = a[i];
        a[i] = a[j];
        a[j] = t;
    }

    /**
     * @return {from, from+1, ..., to}
     */
    public static int[] range(int from, int to) {
        int[] res = new int[Math.max(0, to - from + 1)];
        for (int i = 0; i < res.length; i++) {
            res[i] = from + i;
        }
        return res;
    }

    public static int sum(int... a) {
        int s = 0;
        for (int v : a) s += v;
        return s;
    }

    public static long product(int... a) {
        long p = 1;
        for (int v : a) p *= v;
        return p;
    }
}
