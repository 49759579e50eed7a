package results;

import java.util.HashMap;
import java.util.Map;

import analysis.pointer.engine.SolverStatistics;
import analysis.pointer.graph.ConstraintVariable;
import analysis.pointer.graph.VariableTable;

import com.ibm.wala.util.intset.BitVectorIntSet;
import com.ibm.wala.util.intset.IntSet;

/**
 * Points-to sets computed by an analysis run. Queries are resolved through the representative of the variable.
 */
public class PointsToSolution {

    private final VariableTable vars;
    private final SolverStatistics stats;
    /**
     * Variable id for each name, computed on demand
     */
    private Map<String, Integer> nameToId;

    public PointsToSolution(VariableTable vars, SolverStatistics stats) {
        this.vars = vars;
        this.stats = stats;
    }

    /**
     * What may the variable point to? The answer is unknown for variables that do not stand for a single location
     * with a known layout (temporaries, heap objects, unions and other objects of unknown size), and for variables
     * that may point to anything.
     *
     * @param var variable id
     * @return points-to set or {@link PointsToResult#UNKNOWN}
     */
    public PointsToResult queryPointsTo(int var) {
        ConstraintVariable v = this.vars.get(var);
        if (v.isArtificial() || v.isUnknownSize()) {
            return PointsToResult.UNKNOWN;
        }
        IntSet solution = this.vars.get(this.vars.getRepresentative(var)).getSolution();
        if (solution.contains(VariableTable.ANYTHING_ID)) {
            return PointsToResult.UNKNOWN;
        }
        return PointsToResult.of(solution);
    }

    /**
     * @return copy of the solution of the representative of var
     */
    public IntSet getSolution(int var) {
        return new BitVectorIntSet(this.vars.get(this.vars.getRepresentative(var)).getSolution());
    }

    public int getRepresentative(int var) {
        return this.vars.getRepresentative(var);
    }

    public String getName(int var) {
        return this.vars.get(var).getName();
    }

    /**
     * Find a variable by name, e.g. <code>s.f</code> for the field f of the object s
     *
     * @return the id of the variable, or -1 if there is none
     */
    public int findVariable(String name) {
        if (this.nameToId == null) {
            this.nameToId = new HashMap<>();
            for (ConstraintVariable v : this.vars) {
                // temporaries share a prefix, but not a name
                if (!this.nameToId.containsKey(v.getName())) {
                    this.nameToId.put(v.getName(), v.getId());
                }
            }
        }
        Integer id = this.nameToId.get(name);
        return id == null ? -1 : id;
    }

    public int numVariables() {
        return this.vars.size();
    }

    public SolverStatistics getStatistics() {
        return this.stats;
    }

    public VariableTable getVariableTable() {
        return this.vars;
    }
}
