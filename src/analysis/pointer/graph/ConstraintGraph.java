package analysis.pointer.graph;

import java.util.Collections;
import java.util.List;

import util.intmap.IntMap;
import util.intmap.SparseIntMap;
import analysis.pointer.engine.InternalInconsistencyException;

import com.ibm.wala.util.intset.IntSet;

/**
 * Constraint graph over the variable ids of one run. Successor and predecessor lists are kept sorted by the id of the
 * neighbour, each edge carries the set of offsets (weights) with which the solution of its source is propagated.
 */
public class ConstraintGraph {

    /**
     * succs[n] maps m to the edge n -> m
     */
    private final SparseIntMap<ConstraintEdge>[] succs;
    /**
     * preds[n] maps m to the edge m -> n
     */
    private final SparseIntMap<ConstraintEdge>[] preds;
    /**
     * Set whenever an edge, or a zero weight on an existing edge, is added. Used by the solver to decide whether cycle
     * detection should be rerun.
     */
    private boolean edgeAdded = false;

    /**
     * Number of edges currently in the graph
     */
    private int numEdges = 0;

    @SuppressWarnings("unchecked")
    public ConstraintGraph(int numNodes) {
        this.succs = new SparseIntMap[numNodes];
        this.preds = new SparseIntMap[numNodes];
    }

    public int numNodes() {
        return this.succs.length;
    }

    public int numEdges() {
        return this.numEdges;
    }

    private void checkNode(int n) {
        if (n < 0 || n >= this.succs.length) {
            throw new IllegalArgumentException("Node " + n + " is not in the graph");
        }
    }

    /**
     * Get the edge from -> to, creating it (with no weights) if necessary
     */
    private ConstraintEdge getOrCreateEdge(int from, int to) {
        checkNode(from);
        checkNode(to);
        SparseIntMap<ConstraintEdge> out = this.succs[from];
        if (out == null) {
            out = new SparseIntMap<>();
            this.succs[from] = out;
        }
        ConstraintEdge e = out.get(to);
        if (e != null) {
            return e;
        }
        e = new ConstraintEdge(from, to);
        out.put(to, e);
        SparseIntMap<ConstraintEdge> in = this.preds[to];
        if (in == null) {
            in = new SparseIntMap<>();
            this.preds[to] = in;
        }
        in.put(from, e);
        this.numEdges++;
        this.edgeAdded = true;
        return e;
    }

    /**
     * Add the offset weight to the edge from -> to. A zero weight self edge carries no information and is not added.
     *
     * @return true if the edge is new or did not already have this weight
     */
    public boolean addEdge(int from, int to, int weight) {
        if (from == to && weight == 0) {
            return false;
        }
        ConstraintEdge e = getOrCreateEdge(from, to);
        boolean added = e.addWeight(weight);
        if (added && weight == 0) {
            this.edgeAdded = true;
        }
        return added;
    }

    public boolean hasEdge(int from, int to) {
        return getEdge(from, to) != null;
    }

    /**
     * @return the edge from -> to, or null if there is none
     */
    public ConstraintEdge getEdge(int from, int to) {
        checkNode(from);
        IntMap<ConstraintEdge> out = this.succs[from];
        if (out == null) {
            return null;
        }
        return out.get(to);
    }

    /**
     * @return the weights of the edge from -> to, which must exist
     */
    public IntSet getWeights(int from, int to) {
        ConstraintEdge e = getEdge(from, to);
        if (e == null) {
            throw new InternalInconsistencyException("Missing edge " + from + " -> " + to);
        }
        return e.getWeights();
    }

    /**
     * @return snapshot of the edges leaving n, sorted by target
     */
    public List<ConstraintEdge> getSuccessors(int n) {
        checkNode(n);
        SparseIntMap<ConstraintEdge> out = this.succs[n];
        if (out == null) {
            return Collections.emptyList();
        }
        return out.valuesSnapshot();
    }

    /**
     * @return snapshot of the edges entering n, sorted by source
     */
    public List<ConstraintEdge> getPredecessors(int n) {
        checkNode(n);
        SparseIntMap<ConstraintEdge> in = this.preds[n];
        if (in == null) {
            return Collections.emptyList();
        }
        return in.valuesSnapshot();
    }

    public int outDegree(int n) {
        checkNode(n);
        return this.succs[n] == null ? 0 : this.succs[n].size();
    }

    public int inDegree(int n) {
        checkNode(n);
        return this.preds[n] == null ? 0 : this.preds[n].size();
    }

    /**
     * Move all the edges of from onto to, unioning the weights of edges that end up between the same pair of nodes.
     * Afterwards from has no edges.
     */
    public void mergeNodes(int to, int from) {
        assert to != from;
        for (ConstraintEdge e : getPredecessors(from)) {
            int src = e.getFrom() == from ? to : e.getFrom();
            ConstraintEdge merged = getOrCreateEdge(src, to);
            merged.addWeights(e.getWeights());
        }
        for (ConstraintEdge e : getSuccessors(from)) {
            int dest = e.getTo() == from ? to : e.getTo();
            ConstraintEdge merged = getOrCreateEdge(to, dest);
            merged.addWeights(e.getWeights());
        }
        clearEdges(from);
    }

    /**
     * Remove every edge into or out of node
     */
    public void clearEdges(int node) {
        checkNode(node);
        SparseIntMap<ConstraintEdge> out = this.succs[node];
        if (out != null) {
            for (int m : out.keysSnapshot()) {
                if (m != node) {
                    this.preds[m].remove(node);
                }
                this.numEdges--;
            }
        }
        SparseIntMap<ConstraintEdge> in = this.preds[node];
        if (in != null) {
            for (int m : in.keysSnapshot()) {
                if (m != node) {
                    this.succs[m].remove(node);
                    this.numEdges--;
                }
            }
        }
        this.succs[node] = null;
        this.preds[node] = null;
    }

    /**
     * Remove the zero weight from the self edge n -> n, and the edge itself if no weight remains
     */
    public void removeZeroWeightSelfEdge(int n) {
        ConstraintEdge e = getEdge(n, n);
        if (e == null) {
            return;
        }
        e.removeWeight(0);
        if (e.getWeights().isEmpty()) {
            removeEdge(n, n);
        }
    }

    private void removeEdge(int from, int to) {
        ConstraintEdge e = this.succs[from].remove(to);
        if (e == null) {
            throw new InternalInconsistencyException("Missing edge " + from + " -> " + to);
        }
        ConstraintEdge other = this.preds[to].remove(from);
        assert other == e;
        this.numEdges--;
    }

    public boolean isEdgeAdded() {
        return this.edgeAdded;
    }

    public void clearEdgeAdded() {
        this.edgeAdded = false;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int n = 0; n < this.succs.length; n++) {
            for (ConstraintEdge e : getSuccessors(n)) {
                sb.append(e).append("\n");
            }
        }
        return sb.toString();
    }
}
