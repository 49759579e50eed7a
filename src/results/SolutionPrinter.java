package results;

import java.util.Collection;

import analysis.pointer.constraints.Constraint;
import analysis.pointer.constraints.ConstraintExpression;
import analysis.pointer.graph.ConstraintVariable;
import analysis.pointer.graph.VariableTable;

import com.ibm.wala.util.intset.IntIterator;

/**
 * Text rendering of the variables, constraints and points-to sets of an analysis
 */
public class SolutionPrinter {

    private final VariableTable vars;

    public SolutionPrinter(VariableTable vars) {
        this.vars = vars;
    }

    /**
     * Print the solution of every variable, in id order
     *
     * @return one line <code>name = { n1 n2 }</code> per variable
     */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        for (ConstraintVariable v : this.vars) {
            dumpSolution(v.getId(), sb);
        }
        return sb.toString();
    }

    /**
     * Append <code>name = { n1 n2 }</code> for the given variable, using the solution of its representative
     */
    public void dumpSolution(int var, StringBuilder sb) {
        ConstraintVariable v = this.vars.get(var);
        ConstraintVariable rep = this.vars.get(this.vars.getRepresentative(var));
        sb.append(v.getName()).append(" = { ");
        IntIterator iter = rep.getSolution().intIterator();
        while (iter.hasNext()) {
            sb.append(this.vars.get(iter.next()).getName()).append(" ");
        }
        sb.append("}\n");
    }

    /**
     * Print constraints using variable names, one per line
     */
    public String dumpConstraints(Collection<Constraint> constraints) {
        StringBuilder sb = new StringBuilder();
        for (Constraint c : constraints) {
            sb.append(render(c.getLhs())).append(" = ").append(render(c.getRhs())).append("\n");
        }
        return sb.toString();
    }

    private String render(ConstraintExpression e) {
        return e.render(this.vars.get(e.getVar()).getName());
    }
}
