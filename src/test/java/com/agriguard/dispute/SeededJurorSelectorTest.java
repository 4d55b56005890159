package com.agriguard.dispute;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class SeededJurorSelectorTest {

    private final SeededJurorSelector selector = new SeededJurorSelector();

    private static List<String> registry(int size) {
        return IntStream.rangeClosed(1, size)
            .mapToObj(i -> "juror-" + i)
            .collect(Collectors.toList());
    }

    @Test
    void sameSeedAndRegistry_giveSamePanel() {
        List<String> jurors = registry(25);

        assertEquals(selector.select(jurors, 1051L, 10), selector.select(jurors, 1051L, 10));
    }

    @Test
    void panelIsDistinctSubsetOfRegistry() {
        List<String> jurors = registry(25);

        List<String> panel = selector.select(jurors, 77L, 10);

        assertEquals(10, panel.size());
        assertEquals(10, new HashSet<>(panel).size());
        assertTrue(jurors.containsAll(panel));
    }

    @Test
    void panelNeverExceedsRegistry() {
        assertEquals(3, selector.select(registry(3), 5L, 10).size());
        assertTrue(selector.select(List.of(), 5L, 10).isEmpty());
    }

    @Test
    void selectionDoesNotMutateRegistry() {
        List<String> jurors = registry(12);
        List<String> copy = List.copyOf(jurors);

        selector.select(jurors, 9L, 10);

        assertEquals(copy, jurors);
    }
}
