package com.gridcalc.app.models;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphTest {

    private static final String SHEET = "sheet-1";

    private DependencyGraph graph;

    @BeforeEach
    void setUp() {
        graph = new DependencyGraph();
    }

    private static CellKey key(String a1) {
        return new CellKey(SHEET, CellAddress.parseA1(a1));
    }

    private static List<SheetRange> refs(String... a1) {
        SheetRange[] result = new SheetRange[a1.length];
        for (int i = 0; i < a1.length; i++) {
            result[i] = new SheetRange(SHEET, CellRange.parseA1(a1[i]));
        }
        return Arrays.asList(result);
    }

    @Test
    void testDirectDependentsThroughCellsAndRanges() {
        graph.setPrecedents(key("B1"), refs("A1"));
        graph.setPrecedents(key("C1"), refs("A1:A10"));
        assertEquals(new HashSet<>(Arrays.asList(key("B1"), key("C1"))), graph.directDependents(key("A1")));
        assertEquals(Collections.singleton(key("C1")), graph.directDependents(key("A5")));
        assertTrue(graph.directDependents(key("A11")).isEmpty());
    }

    @Test
    void testTransitiveDependents() {
        graph.setPrecedents(key("B1"), refs("A1"));
        graph.setPrecedents(key("C1"), refs("B1"));
        graph.setPrecedents(key("D1"), refs("C1", "Z9"));
        assertEquals(new HashSet<>(Arrays.asList(key("B1"), key("C1"), key("D1"))),
                graph.transitiveDependents(Collections.singleton(key("A1"))));
    }

    @Test
    void testClearPrecedentsRemovesReverseEdges() {
        graph.setPrecedents(key("B1"), refs("A1", "A2:A3"));
        graph.clearPrecedents(key("B1"));
        assertTrue(graph.directDependents(key("A1")).isEmpty());
        assertTrue(graph.directDependents(key("A2")).isEmpty());
        assertEquals(0, graph.edgeCount());
    }

    @Test
    void testCycleDetection() {
        graph.setPrecedents(key("B1"), refs("A1"));
        graph.setPrecedents(key("C1"), refs("B1"));
        assertTrue(graph.wouldCreateCycle(key("A1"), refs("C1")));
        assertTrue(graph.wouldCreateCycle(key("A1"), refs("A1")));
        assertTrue(graph.wouldCreateCycle(key("A1"), refs("C1:C5")));
        assertFalse(graph.wouldCreateCycle(key("A1"), refs("D1")));
        assertFalse(graph.wouldCreateCycle(key("D1"), refs("C1")));
    }

    @Test
    void testSuspensionIsClearedWithPrecedents() {
        graph.suspend(key("A1"), refs("A1"));
        assertTrue(graph.isSuspended(key("A1")));
        graph.clearPrecedents(key("A1"));
        assertFalse(graph.isSuspended(key("A1")));
    }
}
