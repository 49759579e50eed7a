package analysis.pointer.engine;

import analysis.pointer.graph.ConstraintEdge;
import analysis.pointer.graph.ConstraintGraph;
import analysis.pointer.graph.ConstraintVariable;
import analysis.pointer.graph.VariableTable;

/**
 * Offline variable substitution ("Off-line variable substitution for scaling points-to analysis", Rountev and
 * Chandra, PLDI 2000). A node whose only inputs are zero weight copy edges from a single representative w, and whose
 * initial solution is contained in that of w, always has the solution of w and can be unified with it.
 * <p>
 * Nodes whose address is taken, or that are the target of a load, may receive values that are not visible in the graph
 * before solving, and are never substituted.
 */
public class OfflineVariableSubstitution {

    private final VariableTable vars;
    private final ConstraintGraph graph;
    private final NodeUnifier unifier;
    private final SolverStatistics stats;

    public OfflineVariableSubstitution(VariableTable vars, ConstraintGraph graph, NodeUnifier unifier,
                                       SolverStatistics stats) {
        this.vars = vars;
        this.graph = graph;
        this.unifier = unifier;
        this.stats = stats;
    }

    /**
     * Visit the nodes in topological order and substitute the ones that are equivalent to their predecessor
     *
     * @return number of nodes substituted
     */
    public int run() {
        int collapsed = 0;
        for (int i : TopologicalOrder.compute(this.vars, this.graph)) {
            if (!this.vars.isRepresentative(i)) {
                continue;
            }
            ConstraintVariable vi = this.vars.get(i);
            if (vi.isAddressTaken() || vi.isIndirectTarget()) {
                continue;
            }
            int root = findEquivalentPredecessor(vi);
            if (root >= 0 && root != i) {
                if (StructAliasAnalysis.outputLevel >= 2) {
                    System.err.println("Collapsing " + vi.getName() + " into " + this.vars.get(root).getName());
                }
                this.unifier.unify(root, i);
                this.stats.incrementCollapsedVars();
                collapsed++;
            }
        }
        return collapsed;
    }

    /**
     * @return the representative all predecessors of vi resolve to, or -1 if vi cannot be substituted
     */
    private int findEquivalentPredecessor(ConstraintVariable vi) {
        int root = -1;
        for (ConstraintEdge e : this.graph.getPredecessors(vi.getId())) {
            if (!e.isZeroWeightOnly()) {
                // shifted sets are not equal to the unshifted ones
                return -1;
            }
            int w = this.vars.getRepresentative(e.getFrom());
            if (root == -1) {
                root = w;
            }
            else if (w != root) {
                return -1;
            }
            if (!vi.getSolution().isSubset(this.vars.get(w).getSolution())) {
                return -1;
            }
        }
        return root;
    }
}
