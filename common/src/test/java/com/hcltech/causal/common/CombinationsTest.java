package com.hcltech.causal.common;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CombinationsTest {

    @Test
    void ofSize_isLexicographicByPosition() {
        assertEquals(List.of(List.of("a", "b"), List.of("a", "c"), List.of("b", "c")),
                Combinations.ofSize(List.of("a", "b", "c"), 2));
    }

    @Test
    void ofSize_zero_isSingleEmptySubset() {
        assertEquals(List.of(List.of()), Combinations.ofSize(List.of("a"), 0));
    }

    @Test
    void ofSize_largerThanInput_isEmpty() {
        assertEquals(List.of(), Combinations.ofSize(List.of("a"), 2));
        assertEquals(List.of(), Combinations.ofSize(List.of("a"), -1));
    }

    @Test
    void upToSize_smallestFirst() {
        List<List<String>> all = Combinations.upToSize(List.of("a", "b", "c"), 2);
        assertEquals(7, all.size());
        assertEquals(List.of(), all.get(0));
        assertEquals(List.of("a"), all.get(1));
        assertEquals(List.of("b", "c"), all.get(6));
    }

    @Test
    void upToSize_capsAtInputSize() {
        assertEquals(4, Combinations.upToSize(List.of("a", "b"), 10).size());
    }

    @Test
    void firstMatching_stopsAtFirstAccepted() {
        List<List<String>> tried = new ArrayList<>();
        Optional<List<String>> found = Combinations.firstMatching(List.of("a", "b", "c"), 1, 3, s -> {
            tried.add(s);
            return s.contains("b");
        });
        assertEquals(Optional.of(List.of("b")), found);
        assertEquals(List.of(List.of("a"), List.of("b")), tried);
    }

    @Test
    void firstMatching_respectsMinAndMax() {
        assertEquals(Optional.of(List.of("a", "b")),
                Combinations.firstMatching(List.of("a", "b", "c"), 2, 2, s -> true));
        assertEquals(Optional.empty(),
                Combinations.firstMatching(List.of("a", "b", "c"), 0, 1, s -> s.size() > 1));
    }
}
