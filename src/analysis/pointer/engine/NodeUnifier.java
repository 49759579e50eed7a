package analysis.pointer.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import analysis.pointer.constraints.Constraint;
import analysis.pointer.graph.ConstraintGraph;
import analysis.pointer.graph.ConstraintVariable;
import analysis.pointer.graph.VariableTable;

/**
 * Unifies two graph nodes that are known to have the same solution. The absorbed node gives its members, complex
 * constraints, solution, edges and flags to the representative, and is left empty.
 */
public class NodeUnifier {

    private final VariableTable vars;
    private final ConstraintGraph graph;

    public NodeUnifier(VariableTable vars, ConstraintGraph graph) {
        this.vars = vars;
        this.graph = graph;
    }

    /**
     * Unify from into to. Both must be representatives.
     *
     * @return true if the solution of to changed
     */
    public boolean unify(int to, int from) {
        if (to == from) {
            throw new InternalInconsistencyException("Unifying " + to + " with itself");
        }
        if (!this.vars.isRepresentative(to) || !this.vars.isRepresentative(from)) {
            throw new InternalInconsistencyException("Unifying non-representative nodes " + from + " into " + to);
        }
        ConstraintVariable toVar = this.vars.get(to);
        ConstraintVariable fromVar = this.vars.get(from);
        if (StructAliasAnalysis.outputLevel >= 2) {
            System.err.println("Unifying " + fromVar.getName() + " to " + toVar.getName());
        }

        this.vars.absorb(to, from);

        // the complex constraints of from dereference from, they now dereference to
        List<Constraint> moved = new ArrayList<>(fromVar.getComplex().size());
        for (Constraint c : fromVar.getComplex()) {
            if (c.getRhs().isDeref()) {
                assert c.getRhs().getVar() == from;
                moved.add(new Constraint(c.getLhs(), c.getRhs().withVar(to)));
            }
            else {
                assert c.getLhs().getVar() == from;
                moved.add(new Constraint(c.getLhs().withVar(to), c.getRhs()));
            }
        }
        Collections.sort(moved);
        toVar.unionComplex(moved);
        fromVar.clearComplex();

        boolean changed = toVar.getSolution().addAll(fromVar.getSolution());

        this.graph.mergeNodes(to, from);
        this.graph.removeZeroWeightSelfEdge(to);

        fromVar.getSolution().clear();
        toVar.setAddressTaken(toVar.isAddressTaken() || fromVar.isAddressTaken());
        toVar.setIndirectTarget(toVar.isIndirectTarget() || fromVar.isIndirectTarget());
        return changed;
    }
}
