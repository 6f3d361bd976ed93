package com.swarmgraph.core.state;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MergePolicyTest {

    @Test
    @DisplayName("REPLACE keeps the latest value")
    void replaceKeepsLatest() {
        assertEquals(3, MergePolicy.REPLACE.apply(1, 3));
    }

    @Test
    @DisplayName("FIXED accepts the first value and a repeat of it")
    void fixedAcceptsSameValue() {
        assertEquals(2, MergePolicy.FIXED.apply(null, 2));
        assertEquals(2, MergePolicy.FIXED.apply(2, 2));
    }

    @Test
    @DisplayName("FIXED rejects a different value")
    void fixedRejectsChange() {
        assertThrows(IllegalStateException.class, () -> MergePolicy.FIXED.apply(2, 5));
    }

    @Test
    @DisplayName("APPEND concatenates without mutating either input")
    void appendConcatenates() {
        List<String> current = List.of("a");
        List<String> update = List.of("b", "c");

        Object merged = MergePolicy.APPEND.apply(current, update);

        assertEquals(List.of("a", "b", "c"), merged);
        assertEquals(List.of("a"), current);
        assertThrows(UnsupportedOperationException.class, () -> ((List<Object>) merged).add("d"));
    }

    @Test
    @DisplayName("APPEND treats a missing current value as empty")
    void appendToNull() {
        assertEquals(List.of("x"), MergePolicy.APPEND.apply(null, List.of("x")));
    }

    @Test
    @DisplayName("APPEND rejects non-list updates")
    void appendRejectsNonList() {
        assertThrows(IllegalArgumentException.class, () -> MergePolicy.APPEND.apply(List.of(), "x"));
    }

    @Test
    @DisplayName("MAP_UNION merges with right-hand side winning on duplicates")
    void mapUnionRightWins() {
        Object merged = MergePolicy.MAP_UNION.apply(Map.of("a", 1, "b", 2), Map.of("b", 3, "c", 4));
        assertEquals(Map.of("a", 1, "b", 3, "c", 4), merged);
    }

    @Test
    @DisplayName("MAP_UNION rejects non-map updates")
    void mapUnionRejectsNonMap() {
        assertThrows(IllegalArgumentException.class, () -> MergePolicy.MAP_UNION.apply(Map.of(), List.of()));
    }
}
