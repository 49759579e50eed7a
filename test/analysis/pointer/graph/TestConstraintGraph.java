package analysis.pointer.graph;

import java.util.List;

import junit.framework.TestCase;
import analysis.pointer.engine.InternalInconsistencyException;

/**
 * Test edge insertion, weight deduplication and node merging
 */
public class TestConstraintGraph extends TestCase {

    public static void testWeightsAreMergedIntoOneEdge() {
        ConstraintGraph g = new ConstraintGraph(10);
        assertTrue(g.addEdge(4, 5, 0));
        assertFalse(g.addEdge(4, 5, 0));
        assertTrue(g.addEdge(4, 5, 32));
        assertEquals(1, g.numEdges());
        assertEquals(2, g.getWeights(4, 5).size());
        assertTrue(g.getWeights(4, 5).contains(32));
        assertSame(g.getEdge(4, 5), g.getPredecessors(5).get(0));
        assertEquals(1, g.outDegree(4));
        assertEquals(1, g.inDegree(5));
        assertEquals(0, g.inDegree(4));
    }

    public static void testZeroWeightSelfEdgeIgnored() {
        ConstraintGraph g = new ConstraintGraph(10);
        assertFalse(g.addEdge(6, 6, 0));
        assertFalse(g.hasEdge(6, 6));
        assertTrue(g.addEdge(6, 6, 64));
        assertTrue(g.hasEdge(6, 6));
        assertTrue(g.getEdge(6, 6).getWeights().contains(64));
    }

    public static void testEdgeAddedFlag() {
        ConstraintGraph g = new ConstraintGraph(10);
        assertFalse(g.isEdgeAdded());
        g.addEdge(4, 5, 32);
        assertTrue(g.isEdgeAdded());
        g.clearEdgeAdded();
        g.addEdge(4, 5, 64);
        // a shifted copy on an existing edge does not create a new cycle
        assertFalse(g.isEdgeAdded());
        g.addEdge(4, 5, 0);
        assertTrue(g.isEdgeAdded());
    }

    public static void testSuccessorsSortedByTarget() {
        ConstraintGraph g = new ConstraintGraph(10);
        g.addEdge(4, 9, 0);
        g.addEdge(4, 5, 0);
        g.addEdge(4, 7, 0);
        List<ConstraintEdge> succs = g.getSuccessors(4);
        assertEquals(3, succs.size());
        assertEquals(5, succs.get(0).getTo());
        assertEquals(7, succs.get(1).getTo());
        assertEquals(9, succs.get(2).getTo());
    }

    public static void testMergeNodes() {
        ConstraintGraph g = new ConstraintGraph(10);
        // 4 -> 5 -> 6 -> 4 with a shifted edge 5 -> 7 and 4 -> 7
        g.addEdge(4, 5, 0);
        g.addEdge(5, 6, 0);
        g.addEdge(6, 4, 0);
        g.addEdge(5, 7, 32);
        g.addEdge(4, 7, 0);

        g.mergeNodes(4, 5);
        g.removeZeroWeightSelfEdge(4);

        assertEquals(0, g.outDegree(5));
        assertEquals(0, g.inDegree(5));
        assertFalse(g.hasEdge(4, 4));
        assertTrue(g.hasEdge(4, 6));
        assertTrue(g.hasEdge(6, 4));
        assertEquals(2, g.getWeights(4, 7).size());
        assertTrue(g.getWeights(4, 7).contains(0));
        assertTrue(g.getWeights(4, 7).contains(32));
        assertEquals(3, g.numEdges());
    }

    public static void testMergeKeepsShiftedSelfEdge() {
        ConstraintGraph g = new ConstraintGraph(10);
        g.addEdge(4, 5, 0);
        g.addEdge(5, 4, 0);
        g.addEdge(5, 4, 64);

        g.mergeNodes(4, 5);
        g.removeZeroWeightSelfEdge(4);

        assertTrue(g.hasEdge(4, 4));
        assertTrue(g.getEdge(4, 4).getWeights().contains(64));
        assertFalse(g.getEdge(4, 4).hasZeroWeight());
        assertEquals(1, g.numEdges());
    }

    public static void testMissingEdgeWeights() {
        ConstraintGraph g = new ConstraintGraph(10);
        assertNull(g.getEdge(1, 2));
        try {
            g.getWeights(1, 2);
        }
        catch (InternalInconsistencyException e) {
            return;
        }
        fail("Should have thrown exception");
    }
}
