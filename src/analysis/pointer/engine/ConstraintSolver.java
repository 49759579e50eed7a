package analysis.pointer.engine;

import java.util.Collection;

import analysis.pointer.constraints.Constraint;
import analysis.pointer.constraints.ConstraintExpression;
import analysis.pointer.graph.ConstraintEdge;
import analysis.pointer.graph.ConstraintGraph;
import analysis.pointer.graph.ConstraintVariable;
import analysis.pointer.graph.FieldLayout;
import analysis.pointer.graph.SolutionSets;
import analysis.pointer.graph.VariableTable;

import com.ibm.wala.util.intset.BitVectorIntSet;
import com.ibm.wala.util.intset.IntIterator;
import com.ibm.wala.util.intset.IntSet;
import com.ibm.wala.util.intset.MutableIntSet;

/**
 * Worklist solver for the constraint graph. Each round visits the representatives in topological order; a node whose
 * solution changed re-evaluates the complex constraints attached to it and pushes its solution along its outgoing
 * edges. Complex constraints add edges to the graph, if any were added the next round first collapses the new cycles.
 */
public class ConstraintSolver {

    private final VariableTable vars;
    private final ConstraintGraph graph;
    private final CycleCollapser collapser;
    private final SolverStatistics stats;
    /**
     * Nodes that have to be processed
     */
    private final ChangedSet changed = new ChangedSet();

    public ConstraintSolver(VariableTable vars, ConstraintGraph graph, CycleCollapser collapser,
                            SolverStatistics stats) {
        this.vars = vars;
        this.graph = graph;
        this.collapser = collapser;
        this.stats = stats;
    }

    /**
     * Run rounds until no solution changes
     *
     * @return number of rounds
     */
    public int solve() {
        markAllChanged();
        int rounds = 0;
        while (!this.changed.isEmpty()) {
            solveRound();
            rounds++;
        }
        return rounds;
    }

    /**
     * Schedule every representative to be processed in the next round
     */
    public void markAllChanged() {
        for (int i = 0; i < this.vars.size(); i++) {
            if (this.vars.isRepresentative(i)) {
                this.changed.add(i);
            }
        }
    }

    /**
     * Execute a single round of the solver
     *
     * @return true if there is more work to do
     */
    public boolean solveRound() {
        this.stats.incrementIterations();
        if (StructAliasAnalysis.outputLevel >= 5) {
            System.err.println("Round " + this.stats.getIterations() + ": " + this.changed.count()
                    + " changed nodes");
        }

        if (this.graph.isEdgeAdded()) {
            // the edges added by the static phase were already collapsed
            if (this.stats.getIterations() > 1) {
                this.collapser.collapseCycles(this.changed);
            }
            this.graph.clearEdgeAdded();
        }

        for (int i : TopologicalOrder.compute(this.vars, this.graph)) {
            if (!this.vars.isRepresentative(i)) {
                throw new InternalInconsistencyException("Solving collapsed node " + this.vars.get(i).getName());
            }
            if (!this.changed.remove(i)) {
                continue;
            }
            ConstraintVariable vi = this.vars.get(i);
            // the complex constraints may add to the solution of i, which is picked up by the next round
            IntSet delta = new BitVectorIntSet(vi.getSolution());
            for (Constraint c : vi.getComplex()) {
                processComplex(c, delta);
            }

            for (ConstraintEdge e : this.graph.getSuccessors(i)) {
                int to = e.getTo();
                MutableIntSet toSolution = this.vars.get(to).getSolution();
                boolean grew = false;
                IntIterator weights = e.getWeights().intIterator();
                while (weights.hasNext()) {
                    grew |= SolutionSets.unionWithIncrement(this.vars, toSolution, vi.getSolution(), weights.next());
                }
                if (grew) {
                    this.changed.add(to);
                }
            }
        }
        return !this.changed.isEmpty();
    }

    /**
     * Evaluate a constraint with a dereference for each member of delta
     */
    private void processComplex(Constraint c, IntSet delta) {
        if (c.getLhs().isDeref()) {
            if (c.getRhs().isAddressOf()) {
                processStoreAddress(c, delta);
            }
            else {
                processStore(c, delta);
            }
        }
        else {
            processLoad(c, delta);
        }
    }

    /**
     * *x + off = &amp;y: y is in the solution of the field at off of everything x points to
     */
    private void processStoreAddress(Constraint c, IntSet delta) {
        int y = c.getRhs().getVar();
        IntIterator iter = delta.intIterator();
        while (iter.hasNext()) {
            int p = iter.next();
            int f = fieldFor(p, c.getLhs().getOffset(), c);
            if (f == FieldLayout.NO_FIELD) {
                continue;
            }
            int t = this.vars.getRepresentative(f);
            if (this.vars.get(t).getSolution().add(y)) {
                this.changed.add(t);
            }
        }
    }

    /**
     * x = *y + off: copy edge from the field at off of everything y points to into x
     */
    private void processLoad(Constraint c, IntSet delta) {
        int lhs = this.vars.getRepresentative(c.getLhs().getVar());
        MutableIntSet solution = this.vars.get(lhs).getSolution();
        boolean grew = false;
        IntIterator iter = delta.intIterator();
        while (iter.hasNext()) {
            int p = iter.next();
            int f = fieldFor(p, c.getRhs().getOffset(), c);
            if (f == FieldLayout.NO_FIELD) {
                continue;
            }
            int t = this.vars.getRepresentative(f);
            if (this.graph.addEdge(t, lhs, 0)) {
                grew |= solution.addAll(this.vars.get(t).getSolution());
            }
        }
        if (grew) {
            this.changed.add(lhs);
        }
    }

    /**
     * *x + off = y + k: copy edge with weight k from y into the field at off of everything x points to
     */
    private void processStore(Constraint c, IntSet delta) {
        int rhs = this.vars.getRepresentative(c.getRhs().getVar());
        int weight = c.getRhs().getOffset();
        IntIterator iter = delta.intIterator();
        while (iter.hasNext()) {
            int p = iter.next();
            int f = fieldFor(p, c.getLhs().getOffset(), c);
            if (f == FieldLayout.NO_FIELD) {
                continue;
            }
            int t = this.vars.getRepresentative(f);
            if (this.graph.addEdge(rhs, t, weight)) {
                MutableIntSet target = this.vars.get(t).getSolution();
                if (SolutionSets.unionWithIncrement(this.vars, target, this.vars.get(rhs).getSolution(), weight)) {
                    this.changed.add(t);
                }
            }
        }
    }

    /**
     * Field of the object p at offset off from p. Objects that are not split into fields are accessed as a whole.
     *
     * @return the field, or {@link FieldLayout#NO_FIELD} if p has no field at that offset
     */
    private int fieldFor(int p, int off, Constraint c) {
        ConstraintVariable pv = this.vars.get(p);
        if (p == VariableTable.ANYTHING_ID || pv.isArtificial() || pv.isUnknownSize()) {
            return p;
        }
        int f = this.vars.firstFieldAtOffset(p, (long) pv.getOffset() + off);
        if (f == FieldLayout.NO_FIELD && StructAliasAnalysis.outputLevel >= 3) {
            System.err.println("Offset " + off + " out of bounds of " + pv.getName() + " in " + c);
        }
        return f;
    }

    /**
     * @return the nodes still to be processed
     */
    public ChangedSet getChangedSet() {
        return this.changed;
    }

    /**
     * Check that the solution satisfies the given constraints and that collapsed nodes carry no solution.
     *
     * @param constraints normalized constraints the graph was built from
     * @throws InternalInconsistencyException if a constraint is violated
     */
    public void verify(Collection<Constraint> constraints) {
        for (ConstraintVariable v : this.vars) {
            if (!this.vars.isRepresentative(v.getId()) && !v.getSolution().isEmpty()) {
                throw new InternalInconsistencyException("Collapsed node " + v.getName() + " has a solution");
            }
        }
        for (Constraint c : constraints) {
            verify(c);
        }
    }

    private void verify(Constraint c) {
        ConstraintExpression lhs = c.getLhs();
        ConstraintExpression rhs = c.getRhs();
        if (lhs.isDeref()) {
            if (!rhs.isAddressOf() && rhs.getVar() <= VariableTable.ANYTHING_ID) {
                return;
            }
            IntIterator iter = solutionOf(lhs.getVar()).intIterator();
            while (iter.hasNext()) {
                int f = fieldFor(iter.next(), lhs.getOffset(), c);
                if (f == FieldLayout.NO_FIELD) {
                    continue;
                }
                if (rhs.isAddressOf()) {
                    check(solutionOf(f).contains(rhs.getVar()), c);
                }
                else {
                    check(SolutionSets.shift(this.vars, solutionOf(rhs.getVar()), rhs.getOffset())
                                      .isSubset(solutionOf(f)), c);
                }
            }
        }
        else if (rhs.isDeref()) {
            if (lhs.getVar() <= VariableTable.ANYTHING_ID) {
                return;
            }
            IntIterator iter = solutionOf(rhs.getVar()).intIterator();
            while (iter.hasNext()) {
                int f = fieldFor(iter.next(), rhs.getOffset(), c);
                if (f != FieldLayout.NO_FIELD) {
                    check(solutionOf(f).isSubset(solutionOf(lhs.getVar())), c);
                }
            }
        }
        else if (rhs.isAddressOf()) {
            check(solutionOf(lhs.getVar()).contains(rhs.getVar()), c);
        }
        else if (rhs.getVar() > VariableTable.ANYTHING_ID && lhs.getVar() > VariableTable.ANYTHING_ID) {
            check(SolutionSets.shift(this.vars, solutionOf(rhs.getVar()), rhs.getOffset())
                              .isSubset(solutionOf(lhs.getVar())), c);
        }
    }

    private IntSet solutionOf(int var) {
        return this.vars.get(this.vars.getRepresentative(var)).getSolution();
    }

    private static void check(boolean holds, Constraint c) {
        if (!holds) {
            throw new InternalInconsistencyException("Solution violates " + c);
        }
    }
}
