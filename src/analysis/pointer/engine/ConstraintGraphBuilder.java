package analysis.pointer.engine;

import java.util.Collection;

import analysis.pointer.constraints.Constraint;
import analysis.pointer.constraints.ConstraintExpression;
import analysis.pointer.graph.ConstraintGraph;
import analysis.pointer.graph.VariableTable;

/**
 * Builds the constraint graph from the normalized constraints: copy constraints become weighted edges, address-of
 * constraints initialize the solutions, and constraints with a dereference are attached to the dereferenced variable.
 */
public class ConstraintGraphBuilder {

    private final VariableTable vars;

    public ConstraintGraphBuilder(VariableTable vars) {
        this.vars = vars;
    }

    /**
     * Create the graph for the given constraints
     *
     * @param constraints normalized constraints
     * @return graph with one node per variable
     */
    public ConstraintGraph build(Collection<Constraint> constraints) {
        ConstraintGraph g = new ConstraintGraph(this.vars.size());
        for (Constraint c : constraints) {
            ConstraintExpression lhs = c.getLhs();
            ConstraintExpression rhs = c.getRhs();
            if (lhs.isDeref()) {
                // *x = y or *x = &y
                if (rhs.isAddressOf() || rhs.getVar() > VariableTable.ANYTHING_ID) {
                    this.vars.get(lhs.getVar()).addComplex(c);
                }
            }
            else if (rhs.isDeref()) {
                // x = *y, nothing to do if x is a special variable
                if (lhs.getVar() > VariableTable.ANYTHING_ID) {
                    this.vars.get(rhs.getVar()).addComplex(c);
                }
            }
            else if (rhs.isAddressOf()) {
                // x = &y
                this.vars.get(lhs.getVar()).getSolution().add(rhs.getVar());
            }
            else if (rhs.getVar() > VariableTable.ANYTHING_ID && lhs.getVar() > VariableTable.ANYTHING_ID) {
                // x = y + k, zero weight self edges are dropped by the graph
                g.addEdge(rhs.getVar(), lhs.getVar(), rhs.getOffset());
            }
        }
        return g;
    }
}
