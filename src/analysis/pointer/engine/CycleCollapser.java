package analysis.pointer.engine;

import java.util.ArrayDeque;
import java.util.List;

import analysis.pointer.graph.ConstraintEdge;
import analysis.pointer.graph.ConstraintGraph;
import analysis.pointer.graph.VariableTable;

import com.ibm.wala.util.collections.IntStack;
import com.ibm.wala.util.intset.BitVectorIntSet;

/**
 * Finds strongly connected components of the zero weight edges of the constraint graph and unifies each of them into a
 * single node. Edges with a non-zero weight shift the solution they propagate, so nodes connected through them do not
 * have equal solutions and are never unified.
 * <p>
 * This is Tarjan's algorithm as modified by Nuutila to keep only non-root nodes on the stack ("On finding the strongly
 * connected components in a directed graph", Nuutila and Soisalon-Soininen, IPL 49(1)). The depth first search uses
 * an explicit stack.
 */
public class CycleCollapser {

    private final VariableTable vars;
    private final ConstraintGraph graph;
    private final NodeUnifier unifier;
    private final SolverStatistics stats;

    /**
     * Nodes visited by the search
     */
    private BitVectorIntSet visited;
    /**
     * Nodes whose component has been found
     */
    private BitVectorIntSet inComponent;
    /**
     * Order in which nodes were first visited
     */
    private int[] visitIndex;
    /**
     * Candidate root of the component of each visited node
     */
    private int[] root;
    private int currentIndex;
    /**
     * Visited nodes that are not the root of their component
     */
    private IntStack sccStack;
    /**
     * Nodes to unify into their root, the members of one component are consecutive
     */
    private IntStack unificationQueue;

    public CycleCollapser(VariableTable vars, ConstraintGraph graph, NodeUnifier unifier, SolverStatistics stats) {
        this.vars = vars;
        this.graph = graph;
        this.unifier = unifier;
        this.stats = stats;
    }

    /**
     * Find and collapse the cycles of zero weight edges.
     *
     * @param changed if non-null, the solver's changed set, which is kept consistent with the unifications
     * @return number of nodes unified
     */
    public int collapseCycles(ChangedSet changed) {
        int size = this.vars.size();
        this.visited = new BitVectorIntSet();
        this.inComponent = new BitVectorIntSet();
        this.visitIndex = new int[size];
        this.root = new int[size];
        this.currentIndex = 0;
        this.sccStack = new IntStack();
        this.unificationQueue = new IntStack();

        for (int i = 0; i < size; i++) {
            if (!this.visited.contains(i) && this.vars.isRepresentative(i)) {
                visit(i);
            }
        }
        int unified = this.unificationQueue.size();
        processUnificationQueue(changed);

        this.visited = null;
        this.inComponent = null;
        this.visitIndex = null;
        this.root = null;
        this.sccStack = null;
        this.unificationQueue = null;
        return unified;
    }

    /**
     * Depth first search frame: a node and the position in its successor list
     */
    private static final class Frame {
        final int node;
        final List<ConstraintEdge> succs;
        int pos = 0;
        /**
         * successor being visited, -1 if none
         */
        int child = -1;

        Frame(int node, List<ConstraintEdge> succs) {
            this.node = node;
            this.succs = succs;
        }
    }

    private Frame enter(int n) {
        if (!this.vars.isRepresentative(n)) {
            throw new InternalInconsistencyException("Cycle detection reached collapsed node " + n);
        }
        this.visited.add(n);
        this.visitIndex[n] = this.currentIndex++;
        this.root[n] = n;
        return new Frame(n, this.graph.getSuccessors(n));
    }

    /**
     * The search from n along the edge to w is done, update the root of n.
     */
    private void edgeDone(int n, int w) {
        if (!this.inComponent.contains(w)) {
            int t = this.root[w];
            if (this.visitIndex[t] < this.visitIndex[this.root[n]]) {
                this.root[n] = t;
            }
        }
    }

    /**
     * All successors of n are done, see whether n is the root of a component
     */
    private void finish(int n) {
        if (this.root[n] == n) {
            int t = this.visitIndex[n];
            this.inComponent.add(n);
            while (!this.sccStack.isEmpty() && t < this.visitIndex[this.sccStack.peek()]) {
                int w = this.sccStack.pop();
                this.root[w] = n;
                this.inComponent.add(w);
                this.unificationQueue.push(w);
            }
        }
        else {
            this.sccStack.push(n);
        }
    }

    private void visit(int start) {
        ArrayDeque<Frame> frames = new ArrayDeque<>();
        frames.push(enter(start));
        while (!frames.isEmpty()) {
            Frame f = frames.peek();
            if (f.child >= 0) {
                edgeDone(f.node, f.child);
                f.child = -1;
            }
            boolean descended = false;
            while (f.pos < f.succs.size()) {
                ConstraintEdge e = f.succs.get(f.pos++);
                if (!e.hasZeroWeight()) {
                    // only zero weight edges can be collapsed
                    continue;
                }
                int w = e.getTo();
                if (!this.visited.contains(w)) {
                    f.child = w;
                    frames.push(enter(w));
                    descended = true;
                    break;
                }
                edgeDone(f.node, w);
            }
            if (!descended) {
                frames.pop();
                finish(f.node);
            }
        }
    }

    /**
     * Unify each queued node into the root of its component.
     */
    private void processUnificationQueue(ChangedSet changed) {
        // in the order the nodes were queued
        int[] queue = new int[this.unificationQueue.size()];
        for (int i = queue.length - 1; i >= 0; i--) {
            queue[i] = this.unificationQueue.pop();
        }
        for (int tounify : queue) {
            int n = this.root[tounify];
            if (changed != null) {
                this.stats.incrementUnifiedVarsDynamic();
                changed.transfer(tounify, n);
            }
            else {
                this.stats.incrementUnifiedVarsStatic();
            }
            boolean grew = this.unifier.unify(n, tounify);
            if (grew && changed != null) {
                changed.add(n);
            }
        }
    }
}
