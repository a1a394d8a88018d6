package com.hcltech.causal.common;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Subset enumeration in a stable order: by size, then lexicographically by position in the input list.
 * Callers sort the input when they need an order that does not depend on how it was built.
 */
public interface Combinations {

    /** All subsets of exactly {@code size} elements. */
    static <T> List<List<T>> ofSize(List<T> items, int size) {
        List<List<T>> result = new ArrayList<>();
        if (size < 0 || size > items.size()) return result;
        int[] idx = firstIndices(size);
        do {
            result.add(pick(items, idx));
        } while (advance(idx, items.size()));
        return result;
    }

    /** All subsets with 0..maxSize elements, smaller subsets first. */
    static <T> List<List<T>> upToSize(List<T> items, int maxSize) {
        List<List<T>> result = new ArrayList<>();
        int limit = Math.min(maxSize, items.size());
        for (int k = 0; k <= limit; k++) result.addAll(ofSize(items, k));
        return result;
    }

    /** First subset with {@code minSize..maxSize} elements accepted by {@code test}; stops as soon as one is found. */
    static <T> Optional<List<T>> firstMatching(List<T> items, int minSize, int maxSize, Predicate<List<T>> test) {
        int limit = Math.min(maxSize, items.size());
        for (int k = Math.max(0, minSize); k <= limit; k++) {
            int[] idx = firstIndices(k);
            do {
                List<T> candidate = pick(items, idx);
                if (test.test(candidate)) return Optional.of(candidate);
            } while (advance(idx, items.size()));
        }
        return Optional.empty();
    }

    private static int[] firstIndices(int size) {
        int[] idx = new int[size];
        for (int i = 0; i < size; i++) idx[i] = i;
        return idx;
    }

    private static <T> List<T> pick(List<T> items, int[] idx) {
        List<T> picked = new ArrayList<>(idx.length);
        for (int i : idx) picked.add(items.get(i));
        return List.copyOf(picked);
    }

    /** Moves idx to the next combination in lexicographic order; false once exhausted. */
    private static boolean advance(int[] idx, int n) {
        int k = idx.length;
        int i = k - 1;
        while (i >= 0 && idx[i] == n - k + i) i--;
        if (i < 0) return false;
        idx[i]++;
        for (int j = i + 1; j < k; j++) idx[j] = idx[j - 1] + 1;
        return true;
    }
}
